package com.enterprise.softdelete.service;

import com.enterprise.softdelete.config.CascadeDeleteProperties;
import com.enterprise.softdelete.domain.entity.DeleteOperation;
import com.enterprise.softdelete.service.DeleteOperationLedger.ClaimLostException;
import com.enterprise.softdelete.service.hierarchy.HierarchyNode;
import com.enterprise.softdelete.service.hierarchy.HierarchyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Cascade Delete Executor
 *
 * 5W1H Analysis:
 * WHO: Worker thread holding the claim on one operation
 * WHAT: Counts, walks and soft-deletes the subtree of the operation root
 * WHEN: Right after a claim, or after a reclaim of an interrupted operation
 * WHERE: HierarchyStore for entities, DeleteOperationLedger for progress
 * WHY: The request path only records intent, the work happens here
 * HOW: Breadth-first levels, batches of batch-size marks, checkpoint per batch,
 *      heartbeats while the walk reads pages without producing a batch
 *
 * Error Handling:
 * 1. An entity that fails to delete is recorded and the cascade goes on
 * 2. Any other error marks the operation FAILED and is never rethrown
 * 3. A lost claim stops the worker without touching the ledger
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CascadeDeleteExecutor {

    private final HierarchyStore hierarchyStore;
    private final SubtreeWalker subtreeWalker;
    private final DeleteOperationLedger ledger;
    private final DeleteOperationMonitoringService monitoringService;
    private final CascadeDeleteProperties properties;

    /**
     * Run a freshly claimed operation from the start
     */
    public void execute(DeleteOperation operation, UUID claimToken) {
        run(operation, claimToken, false);
    }

    /**
     * Continue a reclaimed operation from its last checkpoint
     */
    public void resume(DeleteOperation operation, UUID claimToken) {
        run(operation, claimToken, true);
    }

    private void run(DeleteOperation operation, UUID claimToken, boolean resumed) {
        UUID operationId = operation.getId();
        UUID containerId = operation.getContainerId();
        ClaimHandle claim = new ClaimHandle(operationId, claimToken);

        try {
            Optional<HierarchyNode> root = hierarchyStore.findNode(containerId, operation.getRootEntityId());
            if (root.isEmpty()) {
                log.warn("Root entity no longer exists, nothing to delete: operationId={}, rootEntityId={}",
                    operationId, operation.getRootEntityId());
                finish(operationId, claimToken, CascadeProgress.start(0));
                return;
            }

            CascadeProgress progress = resumed
                ? resumeProgress(operation, root.get(), claim)
                : CascadeProgress.start(subtreeWalker.countRemaining(
                    containerId, root.get(), operation.isCascade(), claim::heartbeat));

            claim.checkpoint(progress);

            log.info("Cascade started: operationId={}, rootEntityId={}, cascade={}, total={}, resumed={}",
                operationId, operation.getRootEntityId(), operation.isCascade(), progress.getTotal(), resumed);

            deleteSubtree(operation, claim, root.get(), progress);

            finish(operationId, claimToken, progress);

        } catch (ClaimLostException e) {
            log.warn("Stopping cascade, claim lost: operationId={}, reason={}", operationId, e.getMessage());

        } catch (Exception e) {
            log.error("Cascade failed: operationId={}", operationId, e);
            recordFatal(operationId, claimToken, e);
        }
    }

    /**
     * Counts from the last checkpoint plus what this operation deleted after it.
     * An operation interrupted before its first checkpoint is counted like a fresh one.
     *
     * The recovered counts are checkpointed before any walk, since a heartbeat moves
     * lastCheckpointAt past the previous owner's uncounted marks.
     */
    private CascadeProgress resumeProgress(DeleteOperation operation, HierarchyNode root, ClaimHandle claim) {
        LocalDateTime since = operation.getLastCheckpointAt() != null
            ? operation.getLastCheckpointAt()
            : operation.getStartedAt();

        long deletedSince = since == null ? 0 : hierarchyStore.countDeletedByOperationSince(
            operation.getContainerId(), operation.getId(), since);

        boolean neverCheckpointed = operation.getTotalEntities() == 0
            && operation.getDeletedCount() == 0
            && operation.getFailedCount() == 0;

        CascadeProgress recovered = neverCheckpointed
            ? CascadeProgress.start(Math.toIntExact(deletedSince))
            : CascadeProgress.resume(operation);
        recovered.recordDeleted(deletedSince);
        claim.checkpoint(recovered);

        CascadeProgress progress = recovered;
        if (neverCheckpointed) {
            int remaining = subtreeWalker.countRemaining(
                operation.getContainerId(), root, operation.isCascade(), claim::heartbeat);
            progress = CascadeProgress.start(remaining + Math.toIntExact(deletedSince));
            progress.recordDeleted(deletedSince);
        }

        log.info("Resuming cascade: operationId={}, deleted={}, failed={}, deletedSinceCheckpoint={}",
            operation.getId(), progress.getDeleted(), progress.getFailed(), deletedSince);
        return progress;
    }

    private void deleteSubtree(DeleteOperation operation, ClaimHandle claim, HierarchyNode root, CascadeProgress progress) {
        int batchSize = Math.max(1, properties.getBatchSize());
        List<HierarchyNode> batch = new ArrayList<>(batchSize);

        subtreeWalker.walk(operation.getContainerId(), root, operation.isCascade(), level -> {
            for (HierarchyNode node : level) {
                // Failed entities are not retried within the same run
                if (node.isDeleted() || progress.hasFailed(node.getId())) {
                    continue;
                }
                batch.add(node);
                if (batch.size() >= batchSize) {
                    deleteBatch(operation, claim, batch, progress);
                    batch.clear();
                }
            }
        }, claim::heartbeat);

        if (!batch.isEmpty()) {
            deleteBatch(operation, claim, batch, progress);
        }
    }

    private void deleteBatch(DeleteOperation operation, ClaimHandle claim, List<HierarchyNode> batch, CascadeProgress progress) {
        LocalDateTime deletedAt = LocalDateTime.now();

        for (HierarchyNode node : batch) {
            try {
                boolean deleted = hierarchyStore.markDeleted(
                    operation.getContainerId(),
                    node.getId(),
                    operation.getCreatedBy(),
                    operation.getId(),
                    deletedAt,
                    properties.getEntityRetention()
                );

                if (deleted) {
                    progress.recordDeleted();
                    monitoringService.recordEntityDeleted();
                } else {
                    log.debug("Entity deleted concurrently, skipping: operationId={}, entityId={}",
                        operation.getId(), node.getId());
                }
            } catch (Exception e) {
                log.warn("Failed to delete entity: operationId={}, entityId={}, error={}",
                    operation.getId(), node.getId(), e.getMessage());
                if (progress.recordFailed(node.getId())) {
                    monitoringService.recordEntityFailed();
                }
            }
        }

        claim.checkpoint(progress);
    }

    private void finish(UUID operationId, UUID claimToken, CascadeProgress progress) {
        DeleteOperation completed = ledger.complete(operationId, claimToken, progress);
        monitoringService.recordOperationFinished(completed.getStatus());
    }

    private void recordFatal(UUID operationId, UUID claimToken, Exception cause) {
        String detail = cause.getClass().getSimpleName()
            + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
        try {
            DeleteOperation failed = ledger.fail(operationId, claimToken, detail);
            monitoringService.recordOperationFinished(failed.getStatus());
        } catch (ClaimLostException e) {
            log.warn("Could not record failure, claim lost: operationId={}", operationId);
        } catch (Exception e) {
            // Operation stays IN_PROGRESS and is picked up by stall recovery
            log.error("Could not record failure: operationId={}", operationId, e);
        }
    }

    /**
     * Ledger writes of one worker for one claim.
     * The walker beats between page reads, never inside deleteBatch, so every
     * mark made before a heartbeat is already covered by a checkpoint.
     * Beats are throttled to processor.heartbeat-interval.
     */
    private final class ClaimHandle {
        private final UUID operationId;
        private final UUID claimToken;
        private long lastWriteNanos = System.nanoTime();

        ClaimHandle(UUID operationId, UUID claimToken) {
            this.operationId = operationId;
            this.claimToken = claimToken;
        }

        void heartbeat() {
            long interval = properties.getProcessor().getHeartbeatInterval().toNanos();
            if (System.nanoTime() - lastWriteNanos >= interval) {
                ledger.heartbeat(operationId, claimToken);
                lastWriteNanos = System.nanoTime();
            }
        }

        void checkpoint(CascadeProgress progress) {
            ledger.checkpoint(operationId, claimToken, progress);
            lastWriteNanos = System.nanoTime();
        }
    }
}
