package com.enterprise.softdelete.service;

import com.enterprise.softdelete.config.CascadeDeleteProperties;
import com.enterprise.softdelete.domain.entity.DeleteOperation;
import com.enterprise.softdelete.domain.entity.DeleteOperationStatus;
import com.enterprise.softdelete.repository.DeleteOperationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Cascade Delete Processor
 *
 * 5W1H Analysis:
 * WHO: Background polling service (scheduled task)
 * WHAT: Claims PENDING operations and runs their cascades on the worker pool
 * WHEN: Fixed delay poll, stall check, and once at startup for interrupted work
 * WHERE: Polls delete_operations, deletes through the hierarchy store
 * WHY: Delete requests return at once, cascades run and resume independently
 * HOW: Versioned conditional claims, one worker task per claimed operation
 *
 * Key Guarantees:
 * 1. An operation is run by exactly one worker at a time
 * 2. Interrupted operations are resumed, never restarted from zero
 * 3. A healthy operation of another instance is never taken over
 * 4. Poll cycles do not overlap
 */
@Service
@Slf4j
public class CascadeDeleteProcessor {

    private final DeleteOperationRepository operationRepository;
    private final DeleteOperationLedger ledger;
    private final CascadeDeleteExecutor cascadeExecutor;
    private final TaskExecutor taskExecutor;
    private final CascadeDeleteProperties properties;

    public CascadeDeleteProcessor(
        DeleteOperationRepository operationRepository,
        DeleteOperationLedger ledger,
        CascadeDeleteExecutor cascadeExecutor,
        @Qualifier("cascadeDeleteTaskExecutor") TaskExecutor taskExecutor,
        CascadeDeleteProperties properties
    ) {
        this.operationRepository = operationRepository;
        this.ledger = ledger;
        this.cascadeExecutor = cascadeExecutor;
        this.taskExecutor = taskExecutor;
        this.properties = properties;
    }

    /**
     * Main polling loop.
     * Fixed delay, so the next poll starts only after this batch has finished.
     */
    @Scheduled(fixedDelayString = "${cascade-delete.processor.polling-interval-ms:500}")
    public void pollPendingOperations() {
        try {
            processPendingOperations();
        } catch (Exception e) {
            log.error("Error in delete processor poll cycle", e);
        }
    }

    /**
     * Claim up to claim-batch-size PENDING operations, oldest first, and run them
     *
     * @return number of operations this call claimed
     */
    public int processPendingOperations() {
        List<DeleteOperation> pending = operationRepository.findByStatusOrderByCreatedAtAsc(
            DeleteOperationStatus.PENDING,
            PageRequest.of(0, properties.getProcessor().getClaimBatchSize())
        );

        if (pending.isEmpty()) {
            log.trace("No pending delete operations");
            return 0;
        }

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (DeleteOperation operation : pending) {
            ledger.claim(operation).ifPresent(token ->
                futures.add(submit(() -> cascadeExecutor.execute(operation, token))));
        }

        log.info("Delete processor poll: pending={}, claimed={}", pending.size(), futures.size());
        awaitAll(futures);
        return futures.size();
    }

    /**
     * Reclaim and resume the IN_PROGRESS operations this instance owned before a restart,
     * and any whose owner stopped checkpointing. Operations another live instance is
     * still checkpointing are left to it.
     *
     * @return number of operations resumed
     */
    public int resumeInterruptedOperations() {
        List<DeleteOperation> interrupted = operationRepository.findResumable(
            DeleteOperationStatus.IN_PROGRESS,
            properties.getProcessor().getInstanceId(),
            stallThreshold(),
            Pageable.unpaged()
        );

        if (interrupted.isEmpty()) {
            return 0;
        }

        log.info("Resuming interrupted delete operations: count={}, instanceId={}",
            interrupted.size(), properties.getProcessor().getInstanceId());
        return resumeAll(interrupted);
    }

    /**
     * Reclaim operations whose owner stopped checkpointing
     */
    @Scheduled(fixedDelayString = "${cascade-delete.processor.stall-check-interval-ms:60000}")
    public void recoverStalledOperations() {
        try {
            LocalDateTime threshold = stallThreshold();

            List<DeleteOperation> stalled = operationRepository.findStalled(
                DeleteOperationStatus.IN_PROGRESS,
                threshold,
                PageRequest.of(0, properties.getProcessor().getClaimBatchSize())
            );

            if (!stalled.isEmpty()) {
                log.warn("Recovering stalled delete operations: count={}, threshold={}", stalled.size(), threshold);
                resumeAll(stalled);
            }
        } catch (Exception e) {
            log.error("Error recovering stalled delete operations", e);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getProcessor().isResumeOnStartup()) {
            log.debug("Resume on startup disabled");
            return;
        }
        try {
            resumeInterruptedOperations();
        } catch (Exception e) {
            log.error("Error resuming interrupted delete operations on startup", e);
        }
    }

    private LocalDateTime stallThreshold() {
        return LocalDateTime.now().minus(properties.getProcessor().getStallThreshold());
    }

    private int resumeAll(List<DeleteOperation> operations) {
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (DeleteOperation operation : operations) {
            ledger.reclaim(operation).ifPresent(token ->
                futures.add(submit(() -> cascadeExecutor.resume(operation, token))));
        }
        awaitAll(futures);
        return futures.size();
    }

    private CompletableFuture<Void> submit(Runnable task) {
        return CompletableFuture.runAsync(task, taskExecutor);
    }

    private void awaitAll(List<CompletableFuture<Void>> futures) {
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
            .exceptionally(throwable -> {
                log.error("Error running delete operations", throwable);
                return null;
            })
            .join();
    }
}
