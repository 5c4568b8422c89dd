package com.enterprise.softdelete.service;

import com.enterprise.softdelete.config.CascadeDeleteProperties;
import com.enterprise.softdelete.domain.entity.DeleteOperation;
import com.enterprise.softdelete.domain.entity.DeleteOperationStatus;
import com.enterprise.softdelete.repository.DeleteOperationRepository;
import com.enterprise.softdelete.service.hierarchy.ContainerAccessPolicy;
import com.enterprise.softdelete.service.hierarchy.HierarchyNode;
import com.enterprise.softdelete.service.hierarchy.HierarchyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Delete Operation Service - command side of the delete API
 *
 * 5W1H Analysis:
 * WHO: API callers deleting an entity or retrying a finished operation
 * WHAT: Validates a request and records it as a PENDING operation
 * WHEN: Synchronously, inside the HTTP request
 * WHERE: Reads the hierarchy, writes delete_operations
 * WHY: The cascade can be arbitrarily large, so the request only records intent
 * HOW: Ordered checks, then one insert. No traversal happens here.
 *
 * Check order:
 * 1. Container exists
 * 2. Actor may delete in the container
 * 3. Entity exists (deleted or not)
 * 4. No live operation on the same root
 * 5. Actor is under the live-operation ceiling
 * 6. Without cascade, the entity has no live children
 *
 * Checks 4 and 5 run under a row lock on the container, so two concurrent
 * admissions cannot both see the same live count.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeleteOperationService {

    private final HierarchyStore hierarchyStore;
    private final ContainerAccessPolicy accessPolicy;
    private final DeleteOperationRepository operationRepository;
    private final DeleteRateLimiter rateLimiter;
    private final CascadeDeleteProperties properties;

    @Transactional
    public DeleteOperation initiateDelete(UUID containerId, UUID entityId, String actorId, boolean cascade) {
        log.info("Delete requested: containerId={}, entityId={}, actorId={}, cascade={}",
            containerId, entityId, actorId, cascade);

        if (!hierarchyStore.containerExists(containerId)) {
            throw new ContainerNotFoundException("Container not found: " + containerId);
        }

        checkAccess(containerId, actorId);

        HierarchyNode entity = hierarchyStore.findNode(containerId, entityId)
            .orElseThrow(() -> new EntityNotFoundException(
                "Entity not found: " + entityId + " in container " + containerId));

        lockContainer(containerId);
        checkNoLiveOperation(containerId, entityId);

        rateLimiter.checkAdmission(containerId, actorId);

        if (!cascade && hierarchyStore.hasLiveChildren(containerId, entityId)) {
            throw new EntityHasChildrenException(
                "Entity " + entityId + " has children; delete them first or use cascade=true");
        }

        DeleteOperation operation = DeleteOperation.builder()
            .containerId(containerId)
            .rootEntityId(entityId)
            .rootEntityName(entity.getName())
            .cascade(cascade)
            .createdBy(actorId)
            .expiresAfter(properties.getOperationRetention())
            .build();

        DeleteOperation saved = operationRepository.save(operation);

        log.info("Delete operation admitted: operationId={}, entityId={}, alreadyDeleted={}",
            saved.getId(), entityId, entity.isDeleted());
        return saved;
    }

    /**
     * Put a PARTIAL or FAILED operation back in the queue.
     * Entities it already deleted are skipped on the next run.
     */
    @Transactional
    public DeleteOperation retryOperation(UUID containerId, UUID operationId, String actorId) {
        log.info("Retry requested: containerId={}, operationId={}, actorId={}", containerId, operationId, actorId);

        if (!hierarchyStore.containerExists(containerId)) {
            throw new ContainerNotFoundException("Container not found: " + containerId);
        }

        checkAccess(containerId, actorId);

        DeleteOperation operation = operationRepository.findByIdAndContainerId(operationId, containerId)
            .filter(op -> !op.isExpired(LocalDateTime.now()))
            .orElseThrow(() -> new OperationNotFoundException("Delete operation not found: " + operationId));

        if (!operation.getStatus().isRetryable()) {
            throw new InvalidOperationStateException(
                "Operation " + operationId + " is " + operation.getStatus().toApiString()
                    + "; only partial or failed operations can be retried");
        }

        lockContainer(containerId);
        checkNoLiveOperation(containerId, operation.getRootEntityId());

        DeleteOperationStatus previous = operation.getStatus();
        operation.resetForRetry();
        DeleteOperation saved = operationRepository.save(operation);

        log.info("Delete operation queued for retry: operationId={}, previousStatus={}", operationId, previous);
        return saved;
    }

    private void checkAccess(UUID containerId, String actorId) {
        if (!accessPolicy.canDelete(containerId, actorId)) {
            log.warn("Delete denied: containerId={}, actorId={}", containerId, actorId);
            throw new ContainerAccessDeniedException(
                "Actor " + actorId + " may not delete in container " + containerId);
        }
    }

    private void lockContainer(UUID containerId) {
        if (!hierarchyStore.lockContainer(containerId)) {
            throw new ContainerNotFoundException("Container not found: " + containerId);
        }
    }

    private void checkNoLiveOperation(UUID containerId, UUID rootEntityId) {
        if (operationRepository.existsByContainerIdAndRootEntityIdAndStatusIn(
                containerId, rootEntityId, DeleteOperationStatus.LIVE)) {
            throw new DeleteAlreadyInProgressException(
                "A delete operation for entity " + rootEntityId + " is already pending or in progress");
        }
    }

    // Custom exceptions
    public static class ContainerNotFoundException extends RuntimeException {
        public ContainerNotFoundException(String message) {
            super(message);
        }
    }

    public static class EntityNotFoundException extends RuntimeException {
        public EntityNotFoundException(String message) {
            super(message);
        }
    }

    public static class EntityHasChildrenException extends RuntimeException {
        public EntityHasChildrenException(String message) {
            super(message);
        }
    }

    public static class DeleteAlreadyInProgressException extends RuntimeException {
        public DeleteAlreadyInProgressException(String message) {
            super(message);
        }
    }

    public static class ContainerAccessDeniedException extends RuntimeException {
        public ContainerAccessDeniedException(String message) {
            super(message);
        }
    }

    public static class OperationNotFoundException extends RuntimeException {
        public OperationNotFoundException(String message) {
            super(message);
        }
    }

    public static class InvalidOperationStateException extends RuntimeException {
        public InvalidOperationStateException(String message) {
            super(message);
        }
    }
}
