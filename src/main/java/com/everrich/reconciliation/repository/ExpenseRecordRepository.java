package com.everrich.reconciliation.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.everrich.reconciliation.entities.ExpenseBankStatus;
import com.everrich.reconciliation.entities.ExpenseRecord;

@Repository
public interface ExpenseRecordRepository extends JpaRepository<ExpenseRecord, Long> {

    List<ExpenseRecord> findByCompanyIdAndBankStatus(String companyId, ExpenseBankStatus bankStatus);
}
