package com.company.correlation.event;

import com.company.correlation.domain.AlertGroup;
import com.company.correlation.domain.enums.GroupEventType;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AlertGroupEvent {
    private final GroupEventType type;
    private final AlertGroup group;
}
