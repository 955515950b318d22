package com.everrich.reconciliation.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.everrich.reconciliation.entities.EscalationRule;

@Repository
public interface EscalationRuleRepository extends JpaRepository<EscalationRule, Long> {

    List<EscalationRule> findByCompanyIdAndActiveTrueOrderByEvaluationOrderAscIdAsc(String companyId);

    List<EscalationRule> findByCompanyIdOrderByEvaluationOrderAscIdAsc(String companyId);

    Optional<EscalationRule> findByCompanyIdAndRuleCode(String companyId, String ruleCode);
}
