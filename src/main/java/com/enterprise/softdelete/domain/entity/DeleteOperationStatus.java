package com.enterprise.softdelete.domain.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Delete operation state machine.
 *
 * PENDING -> IN_PROGRESS -> { COMPLETED | PARTIAL | FAILED }, and
 * { PARTIAL | FAILED } -> PENDING through an explicit retry.
 */
public enum DeleteOperationStatus {
    PENDING,      // Created, waiting for a processor to claim it
    IN_PROGRESS,  // Claimed, traversal and deletion running
    COMPLETED,    // Every reached entity deleted
    PARTIAL,      // Some entities failed, the rest stay deleted
    FAILED;       // Every entity failed, or the processor itself failed

    public static final Set<DeleteOperationStatus> LIVE = EnumSet.of(PENDING, IN_PROGRESS);

    public static final Set<DeleteOperationStatus> TERMINAL = EnumSet.of(COMPLETED, PARTIAL, FAILED);

    public boolean isLive() {
        return LIVE.contains(this);
    }

    public boolean isRetryable() {
        return this == PARTIAL || this == FAILED;
    }

    /**
     * Wire form used by the HTTP API, e.g. IN_PROGRESS -> "in_progress"
     */
    public String toApiString() {
        return name().toLowerCase();
    }
}
