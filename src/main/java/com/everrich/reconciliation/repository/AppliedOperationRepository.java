package com.everrich.reconciliation.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.everrich.reconciliation.entities.AppliedOperation;

@Repository
public interface AppliedOperationRepository extends JpaRepository<AppliedOperation, Long> {

    boolean existsByOperationId(String operationId);
}
