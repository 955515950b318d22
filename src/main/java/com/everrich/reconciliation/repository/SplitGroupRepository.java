package com.everrich.reconciliation.repository;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.everrich.reconciliation.entities.SplitGroup;
import com.everrich.reconciliation.entities.SplitGroupStatus;
import com.everrich.reconciliation.entities.SplitType;

@Repository
public interface SplitGroupRepository extends JpaRepository<SplitGroup, String> {

    /**
     * Filtered listing; null parameters are ignored.
     */
    @Query("SELECT g FROM SplitGroup g WHERE " +
           "(:splitType IS NULL OR g.splitType = :splitType) AND " +
           "(:complete IS NULL OR g.complete = :complete) AND " +
           "g.status <> :excluded " +
           "ORDER BY g.createdAt DESC")
    List<SplitGroup> findFiltered(@Param("splitType") SplitType splitType, @Param("complete") Boolean complete,
                                  @Param("excluded") SplitGroupStatus excluded);

    List<SplitGroup> findByCompanyIdAndStatusNotOrderByCreatedAtDesc(String companyId, SplitGroupStatus status);

    List<SplitGroup> findByCompanyIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(
            String companyId, LocalDateTime from, LocalDateTime to);

    @Query("SELECT DISTINCT g.companyId FROM SplitGroup g")
    List<String> findDistinctCompanyIds();
}
