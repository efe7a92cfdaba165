package com.companya.crm.service.flags;

import com.companya.crm.model.domain.Customer;
import com.companya.crm.model.domain.FamilyRelationship;
import com.companya.crm.model.dto.ContactInfo;

import java.util.*;

/**
 * Read-only view of customer contact details and the family graph for one flagging run.
 *
 * A customer with neither email nor phone is reached through the first parent, in edge
 * order, that has any contact details. Only direct parents are consulted.
 */
public class ContactDirectory {

    private final Map<String, ContactInfo> ownContacts;
    private final Map<String, List<String>> parentsByChild;
    private final Map<String, Set<String>> childrenByParent;

    private ContactDirectory(Map<String, ContactInfo> ownContacts,
                             Map<String, List<String>> parentsByChild,
                             Map<String, Set<String>> childrenByParent) {
        this.ownContacts = ownContacts;
        this.parentsByChild = parentsByChild;
        this.childrenByParent = childrenByParent;
    }

    public static ContactDirectory empty() {
        return new ContactDirectory(Map.of(), Map.of(), Map.of());
    }

    public static ContactDirectory of(Collection<Customer> customers, List<FamilyRelationship> relationships) {
        Map<String, ContactInfo> contacts = new HashMap<>();
        for (Customer customer : customers) {
            contacts.put(customer.getCustomerId(),
                    new ContactInfo(customer.getPrimaryEmail(), customer.getPrimaryPhone(), false));
        }

        Map<String, List<String>> parentsByChild = new HashMap<>();
        Map<String, Set<String>> childrenByParent = new HashMap<>();
        for (FamilyRelationship edge : relationships) {
            if (edge.getChildCustomerId() == null || edge.getParentCustomerId() == null) {
                continue;
            }
            parentsByChild.computeIfAbsent(edge.getChildCustomerId(), k -> new ArrayList<>())
                    .add(edge.getParentCustomerId());
            childrenByParent.computeIfAbsent(edge.getParentCustomerId(), k -> new LinkedHashSet<>())
                    .add(edge.getChildCustomerId());
        }
        return new ContactDirectory(contacts, parentsByChild, childrenByParent);
    }

    public ContactInfo contactFor(String customerId) {
        ContactInfo own = ownContacts.getOrDefault(customerId, ContactInfo.NONE);
        if (own.hasAny()) {
            return own;
        }
        for (String parentId : parentsByChild.getOrDefault(customerId, List.of())) {
            ContactInfo parent = ownContacts.get(parentId);
            if (parent != null && parent.hasAny()) {
                return new ContactInfo(parent.email(), parent.phone(), true);
            }
        }
        return own;
    }

    public Set<String> childrenOf(String parentId) {
        return Collections.unmodifiableSet(childrenByParent.getOrDefault(parentId, Set.of()));
    }

    public int customerCount() {
        return ownContacts.size();
    }

    public int relationshipCount() {
        return parentsByChild.values().stream().mapToInt(List::size).sum();
    }
}
