package com.companya.crm.service.flags;

import com.companya.crm.model.domain.Customer;
import com.companya.crm.model.domain.FamilyRelationship;
import com.companya.crm.model.dto.ContactInfo;
import com.companya.crm.repository.CustomerRepository;
import com.companya.crm.repository.FamilyRelationshipRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ContactDirectory Tests")
class ContactDirectoryTest {

    private static final LocalDateTime SEEN = LocalDateTime.of(2026, 1, 1, 0, 0);

    private static Customer customer(String id, String email, String phone) {
        return new Customer(id, email, phone, null, SEEN, "capitan");
    }

    @Test
    void customerWithOwnContactKeepsIt() {
        ContactDirectory directory = ContactDirectory.of(
                List.of(customer("kid", null, "+15550000001"), customer("parent", "parent@example.com", null)),
                List.of(new FamilyRelationship("kid", "parent")));

        ContactInfo contact = directory.contactFor("kid");

        assertThat(contact.phone()).isEqualTo("+15550000001");
        assertThat(contact.email()).isNull();
        assertThat(contact.usingParentContact()).isFalse();
    }

    @Test
    void childWithoutContactBorrowsFirstReachableParent() {
        ContactDirectory directory = ContactDirectory.of(
                List.of(customer("kid", null, null),
                        customer("silent-parent", null, null),
                        customer("parent", "parent@example.com", "+15550000002")),
                List.of(new FamilyRelationship("kid", "silent-parent"),
                        new FamilyRelationship("kid", "parent")));

        ContactInfo contact = directory.contactFor("kid");

        assertThat(contact).isEqualTo(new ContactInfo("parent@example.com", "+15550000002", true));
        assertThat(directory.childrenOf("parent")).containsExactly("kid");
    }

    @Test
    void onlyDirectParentsAreConsulted() {
        ContactDirectory directory = ContactDirectory.of(
                List.of(customer("kid", null, null), customer("parent", null, null),
                        customer("grandparent", "gp@example.com", null)),
                List.of(new FamilyRelationship("kid", "parent"),
                        new FamilyRelationship("parent", "grandparent")));

        assertThat(directory.contactFor("kid").hasAny()).isFalse();
        assertThat(directory.contactFor("parent").usingParentContact()).isTrue();
    }

    @Test
    void unknownCustomerHasNoContact() {
        assertThat(ContactDirectory.empty().contactFor("nobody")).isEqualTo(ContactInfo.NONE);
        assertThat(ContactDirectory.empty().childrenOf("nobody")).isEmpty();
    }

    @Test
    void loaderDegradesWhenFamilyGraphIsUnavailable() {
        CustomerRepository customerRepository = mock(CustomerRepository.class);
        FamilyRelationshipRepository familyRepository = mock(FamilyRelationshipRepository.class);
        when(customerRepository.findAll()).thenReturn(List.of(customer("kid", null, null)));
        when(familyRepository.findAllByOrderByIdAsc()).thenThrow(new DataAccessResourceFailureException("table missing"));

        ContactDirectory directory = new ContactDirectoryLoader(customerRepository, familyRepository).load();

        assertThat(directory.customerCount()).isEqualTo(1);
        assertThat(directory.relationshipCount()).isZero();
        assertThat(directory.contactFor("kid")).isEqualTo(ContactInfo.NONE);
    }
}
