package com.enterprise.softdelete.service;

import com.enterprise.softdelete.domain.entity.DeleteOperation;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Running counts of one cascade, written to the ledger as a snapshot.
 * Owned by a single worker thread.
 */
public class CascadeProgress {

    @Getter
    private int total;

    @Getter
    private int deleted;

    private final Set<UUID> failedIds;

    private CascadeProgress(int total, int deleted, Set<UUID> failedIds) {
        this.total = total;
        this.deleted = deleted;
        this.failedIds = new LinkedHashSet<>(failedIds);
    }

    public static CascadeProgress start(int total) {
        return new CascadeProgress(total, 0, Set.of());
    }

    /**
     * Continue from the counts last checkpointed on the operation
     */
    public static CascadeProgress resume(DeleteOperation operation) {
        return new CascadeProgress(
            operation.getTotalEntities(),
            operation.getDeletedCount(),
            operation.getFailedEntityIds()
        );
    }

    public void recordDeleted() {
        deleted++;
        raiseTotalIfExceeded();
    }

    public void recordDeleted(long count) {
        deleted += Math.toIntExact(count);
        raiseTotalIfExceeded();
    }

    /**
     * @return false if the entity was already recorded as failed
     */
    public boolean recordFailed(UUID entityId) {
        boolean added = failedIds.add(entityId);
        raiseTotalIfExceeded();
        return added;
    }

    public boolean hasFailed(UUID entityId) {
        return failedIds.contains(entityId);
    }

    public int getFailed() {
        return failedIds.size();
    }

    public int getProcessed() {
        return deleted + failedIds.size();
    }

    public Set<UUID> getFailedIds() {
        return Collections.unmodifiableSet(failedIds);
    }

    // Entities created under the subtree mid-cascade are reached but were not counted up front
    private void raiseTotalIfExceeded() {
        if (getProcessed() > total) {
            total = getProcessed();
        }
    }
}
