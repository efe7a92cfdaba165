package com.companya.crm.repository;

import com.companya.crm.model.domain.FamilyRelationship;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FamilyRelationshipRepository extends JpaRepository<FamilyRelationship, Long> {

    List<FamilyRelationship> findAllByOrderByIdAsc();
}
