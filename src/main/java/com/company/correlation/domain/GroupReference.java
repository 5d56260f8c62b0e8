package com.company.correlation.domain;

import com.company.correlation.domain.enums.CorrelationStrategy;
import com.company.correlation.domain.enums.GroupAction;
import com.company.correlation.domain.enums.GroupStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Returned by {@code process}: which group now owns the alert and how it got there.
 */
@Value
@Builder
public class GroupReference {
    String groupId;
    GroupAction action;
    GroupStatus status;
    int memberCount;
    double confidenceScore;
    CorrelationStrategy strategy;

    public static GroupReference of(AlertGroup group, GroupAction action, CorrelationStrategy strategy) {
        return GroupReference.builder()
                .groupId(group.getId())
                .action(action)
                .status(group.getStatus())
                .memberCount(group.memberCount())
                .confidenceScore(group.getConfidenceScore())
                .strategy(strategy)
                .build();
    }
}
