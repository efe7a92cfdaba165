package com.companya.crm.repository;

import com.companya.crm.model.domain.Customer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CustomerRepository extends JpaRepository<Customer, String> {

    Optional<Customer> findByPrimaryEmail(String primaryEmail);

    /**
     * Full registry in creation order, as exported to downstream collaborators.
     */
    List<Customer> findAllByOrderByFirstSeenAsc();
}
