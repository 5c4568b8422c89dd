package com.enterprise.softdelete.service;

import com.enterprise.softdelete.config.CascadeDeleteProperties;
import com.enterprise.softdelete.domain.entity.DeleteOperation;
import com.enterprise.softdelete.domain.entity.DeleteOperationStatus;
import com.enterprise.softdelete.repository.DeleteOperationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Delete Operation Ledger
 *
 * 5W1H Analysis:
 * WHO: Cascade processor and its workers
 * WHAT: Every write the processor makes to an operation row
 * WHEN: Claim, each checkpoint, heartbeats between batches, completion, fatal failure
 * WHERE: delete_operations table
 * WHY: Progress must survive a crash and a stale worker must never overwrite a new owner
 * HOW: Conditional claims, token-checked snapshot writes, optimistic locking, Spring Retry
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeleteOperationLedger {

    private final DeleteOperationRepository operationRepository;
    private final CascadeDeleteProperties properties;

    /**
     * Claim a PENDING operation.
     *
     * @return the claim token, or empty if another worker won the race
     */
    @Transactional
    public Optional<UUID> claim(DeleteOperation operation) {
        UUID token = UUID.randomUUID();
        LocalDateTime now = LocalDateTime.now();

        int updated = operationRepository.claimPending(
            operation.getId(),
            operation.getVersion(),
            token,
            ownerId(),
            now,
            now.plus(operation.getExpiresAfter()),
            DeleteOperationStatus.PENDING,
            DeleteOperationStatus.IN_PROGRESS
        );

        if (updated == 0) {
            log.debug("Claim lost to another worker: operationId={}", operation.getId());
            return Optional.empty();
        }

        log.info("Claimed delete operation: operationId={}, rootEntityId={}, owner={}",
            operation.getId(), operation.getRootEntityId(), ownerId());
        return Optional.of(token);
    }

    /**
     * Take over an IN_PROGRESS operation whose owner crashed or stalled
     */
    @Transactional
    public Optional<UUID> reclaim(DeleteOperation operation) {
        UUID token = UUID.randomUUID();
        LocalDateTime now = LocalDateTime.now();

        int updated = operationRepository.reclaimInProgress(
            operation.getId(),
            operation.getVersion(),
            token,
            ownerId(),
            now,
            now.plus(operation.getExpiresAfter()),
            DeleteOperationStatus.IN_PROGRESS
        );

        if (updated == 0) {
            log.debug("Reclaim lost, operation changed since it was read: operationId={}", operation.getId());
            return Optional.empty();
        }

        log.info("Reclaimed delete operation: operationId={}, previousOwner={}, lastCheckpointAt={}",
            operation.getId(), operation.getClaimedBy(), operation.getLastCheckpointAt());
        return Optional.of(token);
    }

    /**
     * Persist a progress snapshot
     *
     * WHO: Cascade worker, after every batch
     * WHAT: total, deleted and failed IDs as of now
     * WHY: A resumed worker starts from here
     * HOW: Refused with ClaimLostException once another worker owns the operation
     */
    @Transactional
    @Retryable(
        retryFor = TransientDataAccessException.class,
        maxAttempts = 3,
        backoff = @Backoff(delay = 100, multiplier = 2)
    )
    public DeleteOperation checkpoint(UUID operationId, UUID claimToken, CascadeProgress progress) {
        DeleteOperation operation = loadOwned(operationId, claimToken);
        operation.applyProgress(progress.getTotal(), progress.getDeleted(), progress.getFailedIds());

        DeleteOperation saved = operationRepository.saveAndFlush(operation);

        log.debug("Checkpoint: operationId={}, total={}, deleted={}, failed={}",
            operationId, progress.getTotal(), progress.getDeleted(), progress.getFailed());
        return saved;
    }

    /**
     * Refresh lastCheckpointAt without touching the counts, so stall recovery
     * leaves a slow but healthy walk alone
     */
    @Transactional
    @Retryable(
        retryFor = TransientDataAccessException.class,
        maxAttempts = 3,
        backoff = @Backoff(delay = 100, multiplier = 2)
    )
    public void heartbeat(UUID operationId, UUID claimToken) {
        DeleteOperation operation = loadOwned(operationId, claimToken);
        operation.recordHeartbeat();
        operationRepository.saveAndFlush(operation);

        log.trace("Heartbeat: operationId={}", operationId);
    }

    /**
     * Persist the final snapshot and the terminal status it implies
     */
    @Transactional
    @Retryable(
        retryFor = TransientDataAccessException.class,
        maxAttempts = 3,
        backoff = @Backoff(delay = 100, multiplier = 2)
    )
    public DeleteOperation complete(UUID operationId, UUID claimToken, CascadeProgress progress) {
        DeleteOperation operation = loadOwned(operationId, claimToken);
        operation.applyProgress(progress.getTotal(), progress.getDeleted(), progress.getFailedIds());
        operation.complete();

        DeleteOperation saved = operationRepository.saveAndFlush(operation);

        log.info("Delete operation finished: operationId={}, status={}, total={}, deleted={}, failed={}",
            operationId, saved.getStatus(), saved.getTotalEntities(),
            saved.getDeletedCount(), saved.getFailedCount());
        return saved;
    }

    /**
     * Mark the operation FAILED after a fatal processor error
     */
    @Transactional
    @Retryable(
        retryFor = TransientDataAccessException.class,
        maxAttempts = 3,
        backoff = @Backoff(delay = 100, multiplier = 2)
    )
    public DeleteOperation fail(UUID operationId, UUID claimToken, String errorDetail) {
        DeleteOperation operation = loadOwned(operationId, claimToken);
        operation.fail(errorDetail);

        DeleteOperation saved = operationRepository.saveAndFlush(operation);

        log.warn("Delete operation failed: operationId={}, errorDetail={}", operationId, errorDetail);
        return saved;
    }

    private String ownerId() {
        return properties.getProcessor().getInstanceId();
    }

    private DeleteOperation loadOwned(UUID operationId, UUID claimToken) {
        DeleteOperation operation = operationRepository.findById(operationId)
            .orElseThrow(() -> new ClaimLostException(operationId, "operation no longer exists"));

        if (operation.getStatus() != DeleteOperationStatus.IN_PROGRESS) {
            throw new ClaimLostException(operationId, "status is " + operation.getStatus());
        }
        if (!operation.isOwnedBy(claimToken)) {
            throw new ClaimLostException(operationId, "claimed by another worker");
        }
        return operation;
    }

    /**
     * The caller no longer owns the operation and must stop without writing
     */
    public static class ClaimLostException extends RuntimeException {
        public ClaimLostException(UUID operationId, String reason) {
            super("Claim lost on operation " + operationId + ": " + reason);
        }
    }
}
