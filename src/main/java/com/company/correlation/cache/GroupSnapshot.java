package com.company.correlation.cache;

import com.company.correlation.domain.AlertGroup;
import com.company.correlation.domain.enums.GroupStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Cached form of a group. Fields may be added freely; readers ignore what they do not know.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GroupSnapshot {
    private String id;
    private String rootAlertId;
    private List<String> memberIds;
    private List<String> contributingRules;
    private double confidenceScore;
    private Instant createdAt;
    private Instant lastUpdated;
    private GroupStatus status;

    public static GroupSnapshot from(AlertGroup group) {
        return GroupSnapshot.builder()
                .id(group.getId())
                .rootAlertId(group.getRootAlertId())
                .memberIds(new ArrayList<>(group.getMemberIds()))
                .contributingRules(new ArrayList<>(group.getContributingRules()))
                .confidenceScore(group.getConfidenceScore())
                .createdAt(group.getCreatedAt())
                .lastUpdated(group.getLastUpdated())
                .status(group.getStatus())
                .build();
    }
}
