package com.company.correlation.event;

import com.company.correlation.domain.AlertGroup;
import com.company.correlation.domain.enums.GroupEventType;

/**
 * Receives group lifecycle notifications. The group passed in is a detached snapshot.
 */
@FunctionalInterface
public interface GroupEventListener {

    void onGroupEvent(GroupEventType type, AlertGroup group);
}
