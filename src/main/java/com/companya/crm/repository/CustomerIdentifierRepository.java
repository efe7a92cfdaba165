package com.companya.crm.repository;

import com.companya.crm.model.domain.CustomerIdentifier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CustomerIdentifierRepository extends JpaRepository<CustomerIdentifier, Long> {

    /**
     * Identifier log in write order. Replaying it in this order rebuilds the
     * first-writer-wins email and phone indices.
     */
    List<CustomerIdentifier> findAllByOrderByObservedAtAscIdAsc();

    List<CustomerIdentifier> findByCustomerIdOrderByObservedAtAsc(String customerId);
}
