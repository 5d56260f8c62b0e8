package com.company.correlation.correlation.evaluator;

import com.company.correlation.correlation.rule.RegisteredRule;
import com.company.correlation.domain.Alert;
import com.company.correlation.domain.AlertGroup;
import com.company.correlation.domain.CorrelationOutcome;
import com.company.correlation.domain.enums.CorrelationStrategy;

/**
 * Scores how strongly an incoming alert belongs to an existing group under one strategy.
 * <p>
 * Implementations are stateless and deterministic. Missing optional alert fields produce a
 * non-match rather than an exception.
 */
public interface CorrelationEvaluator {

    CorrelationStrategy strategy();

    CorrelationOutcome evaluate(Alert alert, AlertGroup group, RegisteredRule rule);
}
