package com.everrich.reconciliation.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.everrich.reconciliation.entities.ReconciliationSplit;

@Repository
public interface ReconciliationSplitRepository extends JpaRepository<ReconciliationSplit, Long> {

    List<ReconciliationSplit> findBySplitGroupIdOrderByIdAsc(String splitGroupId);

    List<ReconciliationSplit> findByExpenseIdAndSplitGroupIdNotOrderByIdDesc(Long expenseId, String splitGroupId);

    List<ReconciliationSplit> findByMovementIdAndSplitGroupIdNotOrderByIdDesc(Long movementId, String splitGroupId);
}
