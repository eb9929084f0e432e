package com.starscape.mediareaper.features.pendingdeletions.domain;

import java.util.EnumSet;
import java.util.Set;

public enum PendingDeletionStatus {
    PENDING,
    APPROVED,
    CANCELLED,
    COMPLETED,
    FAILED;
    
    /** States in which a rule may not propose the same media again. */
    public static final Set<PendingDeletionStatus> ACTIVE = EnumSet.of(PENDING, APPROVED);
    
    public boolean isActive() {
        return ACTIVE.contains(this);
    }
}
