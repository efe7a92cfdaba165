package com.companya.crm.model.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * Directed family edge: the child may borrow the parent's contact details.
 */
@Getter
@Setter
@Entity
@Table(name = "FAMILY_RELATIONSHIP")
public class FamilyRelationship {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "child_customer_id", length = 64, nullable = false)
    private String childCustomerId;

    @Column(name = "parent_customer_id", length = 64, nullable = false)
    private String parentCustomerId;

    public FamilyRelationship() {
    }

    public FamilyRelationship(String childCustomerId, String parentCustomerId) {
        this.childCustomerId = childCustomerId;
        this.parentCustomerId = parentCustomerId;
    }
}
