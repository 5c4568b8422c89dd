package com.enterprise.softdelete.repository;

import com.enterprise.softdelete.domain.entity.DeleteOperation;
import com.enterprise.softdelete.domain.entity.DeleteOperationStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Delete Operations
 *
 * 5W1H Analysis:
 * WHO: Initiator, rate limiter, cascade processor, status reader, cleanup job
 * WHAT: Data access layer for the operation ledger
 * WHEN: On every request, every poll cycle and every checkpoint
 * WHERE: delete_operations table
 * WHY: The ledger is the single source of truth for progress and admission
 * HOW: Derived counts, versioned conditional claims, bulk pruning
 */
@Repository
public interface DeleteOperationRepository extends JpaRepository<DeleteOperation, UUID> {

    Optional<DeleteOperation> findByIdAndContainerId(UUID id, UUID containerId);

    /**
     * Live operations of one actor in one container
     *
     * WHO: Rate limiter
     * WHAT: Number of PENDING or IN_PROGRESS operations
     * WHY: Admission is derived from the ledger, no counter to drift
     * HOW: Count over the (container_id, created_by, status) index
     */
    @Query("""
        SELECT COUNT(o) FROM DeleteOperation o
        WHERE o.containerId = :containerId
        AND o.createdBy = :actorId
        AND o.status IN :statuses
        """)
    long countByActorAndStatusIn(
        @Param("containerId") UUID containerId,
        @Param("actorId") String actorId,
        @Param("statuses") Collection<DeleteOperationStatus> statuses
    );

    boolean existsByContainerIdAndRootEntityIdAndStatusIn(
        UUID containerId,
        UUID rootEntityId,
        Collection<DeleteOperationStatus> statuses
    );

    /**
     * Oldest operations in a status, for the poll loop and startup resume
     */
    List<DeleteOperation> findByStatusOrderByCreatedAtAsc(DeleteOperationStatus status, Pageable pageable);

    /**
     * In-progress operations whose owner stopped checkpointing
     *
     * WHO: Stall recovery
     * WHAT: Operations with lastCheckpointAt older than the threshold
     * WHY: A crashed worker would otherwise leave the operation live forever
     * HOW: Compares the progress heartbeat, not updatedAt
     */
    @Query("""
        SELECT o FROM DeleteOperation o
        WHERE o.status = :status
        AND o.lastCheckpointAt < :threshold
        ORDER BY o.lastCheckpointAt ASC
        """)
    List<DeleteOperation> findStalled(
        @Param("status") DeleteOperationStatus status,
        @Param("threshold") LocalDateTime threshold,
        Pageable pageable
    );

    /**
     * In-progress operations a starting processor may take over
     *
     * WHO: Startup resume
     * WHAT: Operations this instance owned before it stopped, plus any past the stall threshold
     * WHY: Another instance that is still checkpointing keeps its operations
     */
    @Query("""
        SELECT o FROM DeleteOperation o
        WHERE o.status = :status
        AND (o.claimedBy = :owner OR o.lastCheckpointAt < :threshold)
        ORDER BY o.createdAt ASC
        """)
    List<DeleteOperation> findResumable(
        @Param("status") DeleteOperationStatus status,
        @Param("owner") String owner,
        @Param("threshold") LocalDateTime threshold,
        Pageable pageable
    );

    /**
     * Claim a pending operation
     *
     * WHO: Cascade processor
     * WHAT: PENDING -> IN_PROGRESS with a fresh claim token
     * WHY: Several instances may poll the same ledger
     * HOW: Conditional on status and version, exactly one racer updates 1 row
     */
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE DeleteOperation o
        SET o.status = :inProgress,
            o.startedAt = :now,
            o.lastCheckpointAt = :now,
            o.claimToken = :claimToken,
            o.claimedBy = :owner,
            o.updatedAt = :now,
            o.expiresAt = :expiresAt,
            o.version = o.version + 1
        WHERE o.id = :id
        AND o.status = :pending
        AND o.version = :version
        """)
    int claimPending(
        @Param("id") UUID id,
        @Param("version") Long version,
        @Param("claimToken") UUID claimToken,
        @Param("owner") String owner,
        @Param("now") LocalDateTime now,
        @Param("expiresAt") LocalDateTime expiresAt,
        @Param("pending") DeleteOperationStatus pending,
        @Param("inProgress") DeleteOperationStatus inProgress
    );

    /**
     * Take over an in-progress operation from a crashed or stalled owner.
     * Keeps startedAt and lastCheckpointAt, the resumer needs the latter.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE DeleteOperation o
        SET o.claimToken = :claimToken,
            o.claimedBy = :owner,
            o.updatedAt = :now,
            o.expiresAt = :expiresAt,
            o.version = o.version + 1
        WHERE o.id = :id
        AND o.status = :inProgress
        AND o.version = :version
        """)
    int reclaimInProgress(
        @Param("id") UUID id,
        @Param("version") Long version,
        @Param("claimToken") UUID claimToken,
        @Param("owner") String owner,
        @Param("now") LocalDateTime now,
        @Param("expiresAt") LocalDateTime expiresAt,
        @Param("inProgress") DeleteOperationStatus inProgress
    );

    /**
     * Recent unexpired operations of a container, newest first
     */
    @Query("""
        SELECT o FROM DeleteOperation o
        WHERE o.containerId = :containerId
        AND o.expiresAt > :now
        ORDER BY o.createdAt DESC
        """)
    List<DeleteOperation> findRecent(
        @Param("containerId") UUID containerId,
        @Param("now") LocalDateTime now,
        Pageable pageable
    );

    /**
     * Delete expired terminal operations (cleanup)
     *
     * WHO: Scheduled Cleanup Job
     * WHAT: Removes ledger rows past their retention
     * WHY: Readers already hide them, this keeps the table small
     * HOW: Live operations are never matched
     */
    @Modifying
    @Query("""
        DELETE FROM DeleteOperation o
        WHERE o.status IN :statuses
        AND o.expiresAt < :now
        """)
    int deleteExpired(
        @Param("statuses") Collection<DeleteOperationStatus> statuses,
        @Param("now") LocalDateTime now
    );

    /**
     * Count operations by status for monitoring
     */
    @Query("SELECT o.status, COUNT(o) FROM DeleteOperation o GROUP BY o.status")
    List<Object[]> countOperationsByStatus();
}
