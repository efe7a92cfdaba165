package com.companya.crm.repository;

import com.companya.crm.model.domain.CustomerFlag;
import com.companya.crm.model.domain.CustomerFlagId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CustomerFlagRepository extends JpaRepository<CustomerFlag, CustomerFlagId> {

    List<CustomerFlag> findByIdCustomerId(String customerId);
}
