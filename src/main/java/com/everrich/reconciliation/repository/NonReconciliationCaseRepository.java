package com.everrich.reconciliation.repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.everrich.reconciliation.entities.CaseStatus;
import com.everrich.reconciliation.entities.NonReconciliationCase;
import com.everrich.reconciliation.entities.ReasonCode;

@Repository
public interface NonReconciliationCaseRepository extends JpaRepository<NonReconciliationCase, Long> {

    boolean existsByExpenseIdAndReasonCode(Long expenseId, ReasonCode reasonCode);

    boolean existsByMovementIdAndReasonCode(Long movementId, ReasonCode reasonCode);

    List<NonReconciliationCase> findByExpenseIdAndStatusIn(Long expenseId, Collection<CaseStatus> statuses);

    List<NonReconciliationCase> findByMovementIdAndStatusIn(Long movementId, Collection<CaseStatus> statuses);

    List<NonReconciliationCase> findByCompanyIdAndStatusIn(String companyId, Collection<CaseStatus> statuses);

    List<NonReconciliationCase> findByCompanyId(String companyId);

    List<NonReconciliationCase> findByCompanyIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(
            String companyId, LocalDateTime from, LocalDateTime to);

    /**
     * Ids of cases the sweep should look at. The sweep re-reads each one in its own transaction.
     */
    @Query("SELECT c.id FROM NonReconciliationCase c " +
           "WHERE c.status IN :statuses AND c.nextEscalationDate IS NOT NULL AND c.nextEscalationDate <= :now " +
           "ORDER BY c.nextEscalationDate ASC")
    List<Long> findDueForEscalation(@Param("statuses") Collection<CaseStatus> statuses, @Param("now") LocalDateTime now);

    @Query("SELECT DISTINCT c.companyId FROM NonReconciliationCase c")
    List<String> findDistinctCompanyIds();
}
