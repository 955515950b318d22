package com.everrich.reconciliation.repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.everrich.reconciliation.entities.AnalyticsSnapshot;
import com.everrich.reconciliation.entities.PeriodType;

@Repository
public interface AnalyticsSnapshotRepository extends JpaRepository<AnalyticsSnapshot, Long> {

    Optional<AnalyticsSnapshot> findByCompanyIdAndPeriodStartAndPeriodEndAndPeriodType(
            String companyId, LocalDateTime periodStart, LocalDateTime periodEnd, PeriodType periodType);

    List<AnalyticsSnapshot> findByCompanyIdAndPeriodTypeOrderByPeriodStartDesc(String companyId, PeriodType periodType);
}
