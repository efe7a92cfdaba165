package com.companya.crm.service.flags;

import com.companya.crm.model.domain.Customer;
import com.companya.crm.model.domain.FamilyRelationship;
import com.companya.crm.repository.CustomerRepository;
import com.companya.crm.repository.FamilyRelationshipRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the {@link ContactDirectory} for a flagging run. Either input failing to load
 * degrades the directory instead of failing the run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContactDirectoryLoader {

    private final CustomerRepository customerRepository;
    private final FamilyRelationshipRepository familyRelationshipRepository;

    public ContactDirectory load() {
        List<Customer> customers;
        try {
            customers = customerRepository.findAll();
        } catch (DataAccessException e) {
            log.warn("⚠️ Could not load customer registry, flags will carry no contact details: {}", e.getMessage());
            customers = List.of();
        }

        List<FamilyRelationship> relationships;
        try {
            relationships = familyRelationshipRepository.findAllByOrderByIdAsc();
        } catch (DataAccessException e) {
            log.warn("⚠️ Could not load family relationships, parent contact fallback disabled: {}", e.getMessage());
            relationships = List.of();
        }

        ContactDirectory directory = ContactDirectory.of(customers, relationships);
        log.info("📇 Contact directory ready: {} customers, {} family relationships",
                directory.customerCount(), directory.relationshipCount());
        return directory;
    }
}
