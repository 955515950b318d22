package com.everrich.reconciliation.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.everrich.reconciliation.entities.BankMovement;

@Repository
public interface BankMovementRepository extends JpaRepository<BankMovement, Long> {

    List<BankMovement> findByCompanyIdOrderByTransactionDateDesc(String companyId);
}
