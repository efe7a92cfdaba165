package com.companya.crm.repository;

import com.companya.crm.model.domain.ExperimentEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ExperimentEntryRepository extends JpaRepository<ExperimentEntry, Long> {

    boolean existsByCustomerIdAndExperimentId(String customerId, String experimentId);

    List<ExperimentEntry> findByExperimentId(String experimentId);
}
