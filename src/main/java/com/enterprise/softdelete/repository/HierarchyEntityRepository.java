package com.enterprise.softdelete.repository;

import com.enterprise.softdelete.domain.entity.HierarchyEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Hierarchy Entities
 *
 * 5W1H Analysis:
 * WHO: Delete initiator (existence and child checks), cascade processor (walk and mark)
 * WHAT: Container-scoped reads and the conditional soft-delete update
 * WHEN: On every delete request and on every batch of a cascade
 * WHERE: hierarchy_entities table
 * WHY: Lookups must never cross containers, marking must be idempotent
 * HOW: JPQL scoped by container_id, bulk update guarded by is_deleted = false
 */
@Repository
public interface HierarchyEntityRepository extends JpaRepository<HierarchyEntity, UUID> {

    Optional<HierarchyEntity> findByIdAndContainerId(UUID id, UUID containerId);

    boolean existsByContainerIdAndParentIdAndDeletedFalse(UUID containerId, UUID parentId);

    /**
     * Children of a set of parents, deleted or not
     *
     * WHO: Subtree walker
     * WHAT: One page of the next frontier level
     * WHY: Survivors under a deleted node must still be reached
     * HOW: Ordered by id so pages are stable while rows are being marked
     */
    @Query("""
        SELECT e FROM HierarchyEntity e
        WHERE e.containerId = :containerId
        AND e.parentId IN :parentIds
        ORDER BY e.id ASC
        """)
    List<HierarchyEntity> findChildren(
        @Param("containerId") UUID containerId,
        @Param("parentIds") Collection<UUID> parentIds,
        Pageable pageable
    );

    /**
     * Soft-delete one entity if it is still live
     *
     * WHO: Cascade processor
     * WHAT: Sets every deletion field in one statement
     * WHY: Concurrent operations on overlapping subtrees must not both count the same entity
     * HOW: Conditional update, 1 row means this call performed the deletion
     */
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE HierarchyEntity e
        SET e.deleted = true,
            e.deletedAt = :deletedAt,
            e.deletedBy = :deletedBy,
            e.expiresAfter = :expiresAfter,
            e.deleteOperationId = :operationId,
            e.updatedAt = :deletedAt,
            e.version = e.version + 1
        WHERE e.containerId = :containerId
        AND e.id = :id
        AND e.deleted = false
        """)
    int markDeleted(
        @Param("containerId") UUID containerId,
        @Param("id") UUID id,
        @Param("deletedBy") String deletedBy,
        @Param("operationId") UUID operationId,
        @Param("deletedAt") LocalDateTime deletedAt,
        @Param("expiresAfter") Duration expiresAfter
    );

    /**
     * Entities a given operation marked after an instant.
     * Used on resume to account for work done after the last checkpoint.
     */
    @Query("""
        SELECT COUNT(e) FROM HierarchyEntity e
        WHERE e.containerId = :containerId
        AND e.deleteOperationId = :operationId
        AND e.deleted = true
        AND e.deletedAt > :since
        """)
    long countDeletedByOperationSince(
        @Param("containerId") UUID containerId,
        @Param("operationId") UUID operationId,
        @Param("since") LocalDateTime since
    );
}
