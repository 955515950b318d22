package com.everrich.reconciliation.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.everrich.reconciliation.entities.NotificationRequest;
import com.everrich.reconciliation.entities.NotificationStatus;

@Repository
public interface NotificationRequestRepository extends JpaRepository<NotificationRequest, Long> {

    List<NotificationRequest> findByCaseIdOrderByIdAsc(Long caseId);

    @Query("SELECT n.id FROM NotificationRequest n " +
           "WHERE n.status = :status AND n.retryCount < :maxAttempts ORDER BY n.id ASC")
    List<Long> findRetryableIds(@Param("status") NotificationStatus status, @Param("maxAttempts") int maxAttempts);
}
