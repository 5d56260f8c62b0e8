package com.company.correlation.correlation.evaluator;

import com.company.correlation.correlation.rule.RegisteredRule;
import com.company.correlation.domain.Alert;
import com.company.correlation.domain.AlertGroup;
import com.company.correlation.domain.CorrelationOutcome;
import com.company.correlation.domain.enums.CorrelationStrategy;
import com.company.correlation.util.ScoringUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Alert and at least one member both contain the rule's regular expression
 */
@Component
public class PatternMatchEvaluator implements CorrelationEvaluator {

    @Override
    public CorrelationStrategy strategy() {
        return CorrelationStrategy.PATTERN_MATCH;
    }

    @Override
    public CorrelationOutcome evaluate(Alert alert, AlertGroup group, RegisteredRule rule) {
        Pattern pattern = rule.getPattern();
        if (pattern == null) {
            return CorrelationOutcome.noMatch(strategy(), Map.of("reason", "no pattern compiled"));
        }

        Matcher alertMatcher = pattern.matcher(alert.getText());
        if (!alertMatcher.find()) {
            return CorrelationOutcome.noMatch(strategy(), Map.of("pattern", pattern.pattern()));
        }
        String matchedText = alertMatcher.group();

        String memberId = null;
        for (Alert member : group.getMembers()) {
            if (pattern.matcher(member.getText()).find()) {
                memberId = member.getId();
                break;
            }
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("pattern", pattern.pattern());
        evidence.put("matchedText", matchedText);

        if (memberId == null) {
            return CorrelationOutcome.noMatch(strategy(), evidence);
        }
        evidence.put("matchedMember", memberId);

        return CorrelationOutcome.matched(strategy(),
                ScoringUtils.cap(rule.getPatternConfidence() * rule.getWeight()), evidence);
    }
}
