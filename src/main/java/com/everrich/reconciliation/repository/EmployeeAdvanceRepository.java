package com.everrich.reconciliation.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import com.everrich.reconciliation.entities.AdvanceStatus;
import com.everrich.reconciliation.entities.EmployeeAdvance;

@Repository
public interface EmployeeAdvanceRepository extends JpaRepository<EmployeeAdvance, Long> {

    Optional<EmployeeAdvance> findByExpenseId(Long expenseId);

    List<EmployeeAdvance> findByEmployeeIdOrderByAdvanceDateDesc(String employeeId);

    List<EmployeeAdvance> findByStatusInOrderByAdvanceDateAsc(Collection<AdvanceStatus> statuses);

    List<EmployeeAdvance> findByCompanyId(String companyId);

    List<EmployeeAdvance> findAllByOrderByAdvanceDateDesc();

    @Query("SELECT DISTINCT a.companyId FROM EmployeeAdvance a")
    List<String> findDistinctCompanyIds();
}
