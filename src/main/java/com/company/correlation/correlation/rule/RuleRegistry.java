package com.company.correlation.correlation.rule;

import com.company.correlation.correlation.evaluator.CorrelationEvaluator;
import com.company.correlation.domain.Alert;
import com.company.correlation.domain.CorrelationRule;
import com.company.correlation.domain.MaintenanceWindow;
import com.company.correlation.domain.enums.CorrelationStrategy;
import com.company.correlation.exception.RuleConfigurationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Ordered set of correlation rules. Readers get an immutable snapshot; writers replace it.
 */
@Component
@Slf4j
public class RuleRegistry {

    private static final Comparator<RegisteredRule> EVALUATION_ORDER =
            Comparator.comparingInt(RegisteredRule::getPriority)
                    .thenComparingLong(RegisteredRule::getSequence);

    private final Map<CorrelationStrategy, CorrelationEvaluator> evaluators;
    private final Validator validator;
    private final AtomicLong sequence = new AtomicLong();

    private volatile List<RegisteredRule> rules = List.of();

    public RuleRegistry(List<CorrelationEvaluator> evaluators, Validator validator) {
        this.evaluators = new EnumMap<>(CorrelationStrategy.class);
        for (CorrelationEvaluator evaluator : evaluators) {
            this.evaluators.put(evaluator.strategy(), evaluator);
        }
        this.validator = validator;
    }

    /**
     * Validate and register a rule. Nothing is registered if validation fails.
     */
    public synchronized RegisteredRule register(CorrelationRule candidate) {
        if (candidate == null) {
            throw new RuleConfigurationException("<null>", "rule is required");
        }
        CorrelationRule rule = candidate.copy();
        validate(rule);

        if (find(rule.getName()).isPresent()) {
            throw new RuleConfigurationException(rule.getName(), "a rule with this name already exists");
        }

        CorrelationEvaluator evaluator = evaluators.get(rule.getStrategy());
        if (evaluator == null) {
            throw new RuleConfigurationException(rule.getName(),
                    "no evaluator available for strategy " + rule.getStrategy());
        }

        RegisteredRule registered = new RegisteredRule(rule, evaluator, compile(rule), sequence.incrementAndGet());

        List<RegisteredRule> updated = new ArrayList<>(rules);
        updated.add(registered);
        publish(updated);

        log.info("Registered correlation rule: {} ({}, priority {})",
                rule.getName(), rule.getStrategy(), rule.getPriority());
        return registered;
    }

    public synchronized boolean remove(String name) {
        List<RegisteredRule> updated = new ArrayList<>(rules);
        boolean removed = updated.removeIf(rule -> rule.getName().equals(name));
        if (removed) {
            publish(updated);
            log.info("Removed correlation rule: {}", name);
        }
        return removed;
    }

    public boolean setEnabled(String name, boolean enabled) {
        boolean changed = replace(name, rule -> rule.withEnabled(enabled));
        if (changed) {
            log.info("Correlation rule {} {}", name, enabled ? "enabled" : "disabled");
        }
        return changed;
    }

    public boolean addMaintenanceWindow(String name, Instant start, Instant end) {
        if (start == null || end == null || start.isAfter(end)) {
            throw new RuleConfigurationException(name,
                    "maintenance window start must not be after its end: " + start + " - " + end);
        }
        boolean changed = replace(name, rule -> rule.withMaintenanceWindow(new MaintenanceWindow(start, end)));
        if (changed) {
            log.info("Added maintenance window {} - {} to rule {}", start, end, name);
        }
        return changed;
    }

    public Optional<RegisteredRule> find(String name) {
        if (name == null) return Optional.empty();
        return rules.stream().filter(rule -> rule.getName().equals(name)).findFirst();
    }

    /**
     * Consistent snapshot in evaluation order
     */
    public List<RegisteredRule> snapshot() {
        return rules;
    }

    public List<RegisteredRule> applicableTo(Alert alert) {
        return rules.stream()
                .filter(rule -> rule.appliesTo(alert))
                .collect(Collectors.toList());
    }

    public List<CorrelationRule> getRules() {
        return rules.stream()
                .map(registered -> registered.getRule().copy())
                .collect(Collectors.toList());
    }

    public int size() {
        return rules.size();
    }

    public int enabledCount() {
        return (int) rules.stream().filter(RegisteredRule::isEnabled).count();
    }

    private synchronized boolean replace(String name, UnaryOperator<RegisteredRule> change) {
        List<RegisteredRule> updated = new ArrayList<>(rules);
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).getName().equals(name)) {
                updated.set(i, change.apply(updated.get(i)));
                publish(updated);
                return true;
            }
        }
        return false;
    }

    private void publish(List<RegisteredRule> updated) {
        updated.sort(EVALUATION_ORDER);
        rules = Collections.unmodifiableList(updated);
    }

    private void validate(CorrelationRule rule) {
        Set<ConstraintViolation<CorrelationRule>> violations = validator.validate(rule);
        if (!violations.isEmpty()) {
            String reason = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new RuleConfigurationException(rule.getName(), reason);
        }
    }

    private Pattern compile(CorrelationRule rule) {
        if (rule.getPatternRegex() == null || rule.getPatternRegex().isBlank()) {
            return null;
        }
        try {
            return Pattern.compile(rule.getPatternRegex(), Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new RuleConfigurationException(rule.getName(),
                    "pattern does not compile: " + rule.getPatternRegex(), e);
        }
    }
}
