package com.enterprise.softdelete.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Delete Operation - one row of the operation ledger
 *
 * 5W1H Analysis:
 * WHO: Delete initiator (create), cascade processor (progress), status reader (read)
 * WHAT: Durable record of one delete request: status, counts and failures
 * WHEN: Created on request, checkpointed after every batch, pruned after retention
 * WHERE: delete_operations table, addressed by (container_id, id)
 * WHY: Makes background progress observable and resumable after a crash
 * HOW: Explicit snapshot writes guarded by a claim token and optimistic locking
 */
@Entity
@Table(name = "delete_operations", indexes = {
    @Index(name = "idx_delop_container_created", columnList = "container_id, created_at"),
    @Index(name = "idx_delop_status", columnList = "status"),
    @Index(name = "idx_delop_actor_status", columnList = "container_id, created_by, status"),
    @Index(name = "idx_delop_expires", columnList = "expires_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeleteOperation {

    public static final Duration DEFAULT_RETENTION = Duration.ofHours(24);

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "container_id", nullable = false, updatable = false)
    private UUID containerId;

    @Column(name = "root_entity_id", nullable = false, updatable = false)
    private UUID rootEntityId;

    /**
     * Root entity name - denormalized for display
     */
    @Column(nullable = false, length = 200)
    private String rootEntityName;

    /**
     * Status - see DeleteOperationStatus for the state machine
     */
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private DeleteOperationStatus status = DeleteOperationStatus.PENDING;

    @Column(nullable = false, updatable = false)
    private boolean cascade;

    /**
     * Total entities - root plus descendants still live when processing started.
     * Zero until the operation is claimed.
     */
    @Column(nullable = false)
    @Builder.Default
    private int totalEntities = 0;

    @Column(nullable = false)
    @Builder.Default
    private int deletedCount = 0;

    @Column(nullable = false)
    @Builder.Default
    private int failedCount = 0;

    /**
     * Failed entity IDs - kept as a JSON array, insertion ordered, no duplicates
     */
    @Convert(converter = EntityIdSetConverter.class)
    @Column(name = "failed_entity_ids", length = 262144)
    @Builder.Default
    private Set<UUID> failedEntityIds = new LinkedHashSet<>();

    /**
     * Error detail - only set when the processor itself failed
     */
    @Column(length = 4000)
    private String errorDetail;

    @Column(name = "created_by", nullable = false, updatable = false, length = 100)
    private String createdBy;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column
    private LocalDateTime startedAt;

    @Column
    private LocalDateTime completedAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Claim token - identifies the worker that currently owns the operation
     */
    @Column
    private UUID claimToken;

    /**
     * Processor instance that took the current claim
     */
    @Column(name = "claimed_by", length = 100)
    private String claimedBy;

    /**
     * Last checkpoint - progress heartbeat, counts are accurate as of this instant
     */
    @Column
    private LocalDateTime lastCheckpointAt;

    @Convert(converter = DurationSecondsConverter.class)
    @Column(name = "expires_after_seconds", nullable = false)
    @Builder.Default
    private Duration expiresAfter = DEFAULT_RETENTION;

    /**
     * Expires at - last modification plus retention, like a document TTL
     */
    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Version
    private Long version;

    @PrePersist
    @PreUpdate
    void refreshExpiry() {
        this.updatedAt = LocalDateTime.now();
        this.expiresAt = updatedAt.plus(expiresAfter);
    }

    public Set<UUID> getFailedEntityIds() {
        return Collections.unmodifiableSet(failedEntityIds);
    }

    /**
     * Apply a progress snapshot taken by the processor
     */
    public void applyProgress(int total, int deleted, Set<UUID> failedIds) {
        if (total < 0 || deleted < 0) {
            throw new IllegalArgumentException("Progress counts must be non-negative");
        }
        if (deleted + failedIds.size() > total) {
            throw new IllegalArgumentException(
                "Processed count " + (deleted + failedIds.size()) + " exceeds total " + total);
        }
        this.totalEntities = total;
        this.deletedCount = deleted;
        this.failedEntityIds = new LinkedHashSet<>(failedIds);
        this.failedCount = this.failedEntityIds.size();
        this.lastCheckpointAt = LocalDateTime.now();
    }

    /**
     * Liveness only, counts are untouched.
     * Safe between batches, when every mark so far is already checkpointed.
     */
    public void recordHeartbeat() {
        this.lastCheckpointAt = LocalDateTime.now();
    }

    /**
     * Mark the traversal finished and derive the terminal status from the counts
     */
    public void complete() {
        if (failedCount == 0) {
            this.status = DeleteOperationStatus.COMPLETED;
        } else if (failedCount >= totalEntities) {
            this.status = DeleteOperationStatus.FAILED;
        } else {
            this.status = DeleteOperationStatus.PARTIAL;
        }
        this.completedAt = LocalDateTime.now();
        this.claimToken = null;
    }

    /**
     * Mark the operation failed because the processor could not continue
     */
    public void fail(String detail) {
        this.status = DeleteOperationStatus.FAILED;
        this.errorDetail = (detail == null || detail.isBlank()) ? "Delete processing failed" : detail;
        this.completedAt = LocalDateTime.now();
        this.claimToken = null;
    }

    /**
     * Put a PARTIAL or FAILED operation back into PENDING.
     * Identity, creator, root and cascade flag are kept.
     */
    public void resetForRetry() {
        if (!status.isRetryable()) {
            throw new IllegalStateException("Operation " + id + " cannot be retried from status " + status);
        }
        this.status = DeleteOperationStatus.PENDING;
        this.totalEntities = 0;
        this.deletedCount = 0;
        this.failedCount = 0;
        this.failedEntityIds = new LinkedHashSet<>();
        this.errorDetail = null;
        this.startedAt = null;
        this.completedAt = null;
        this.claimToken = null;
        this.claimedBy = null;
        this.lastCheckpointAt = null;
    }

    public boolean isOwnedBy(UUID token) {
        return token != null && token.equals(claimToken);
    }

    public boolean isExpired(LocalDateTime now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }
}
