package com.enterprise.softdelete.service.hierarchy;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Hierarchy Store - the entity tree the cascade works on
 *
 * 5W1H Analysis:
 * WHO: Delete initiator and cascade processor
 * WHAT: Container-scoped reads plus one idempotent soft-delete write
 * WHEN: During admission checks and during traversal
 * WHERE: Backed by hierarchy_entities in the default implementation
 * WHY: Keeps the cascade independent of how entities are stored
 * HOW: Every call names the container, nothing crosses partitions
 */
public interface HierarchyStore {

    boolean containerExists(UUID containerId);

    /**
     * Lock the container for the rest of the caller's transaction.
     * Admissions into the same container run one after another while it is held.
     *
     * @return false if the container does not exist
     */
    boolean lockContainer(UUID containerId);

    Optional<HierarchyNode> findNode(UUID containerId, UUID entityId);

    /**
     * True if at least one direct child is not deleted
     */
    boolean hasLiveChildren(UUID containerId, UUID entityId);

    /**
     * Direct children of the given parents, deleted ones included, in a stable order
     */
    List<HierarchyNode> findChildren(UUID containerId, Collection<UUID> parentIds, int page, int pageSize);

    /**
     * Soft-delete one entity.
     *
     * @return true if this call deleted it, false if it was already deleted
     */
    boolean markDeleted(
        UUID containerId,
        UUID entityId,
        String actorId,
        UUID operationId,
        LocalDateTime deletedAt,
        Duration expiresAfter
    );

    /**
     * Number of entities the operation deleted strictly after {@code since}
     */
    long countDeletedByOperationSince(UUID containerId, UUID operationId, LocalDateTime since);
}
