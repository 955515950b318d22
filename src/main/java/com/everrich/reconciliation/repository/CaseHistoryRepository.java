package com.everrich.reconciliation.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.everrich.reconciliation.entities.CaseHistoryEntry;

@Repository
public interface CaseHistoryRepository extends JpaRepository<CaseHistoryEntry, Long> {

    List<CaseHistoryEntry> findByCaseIdOrderByIdAsc(Long caseId);
}
