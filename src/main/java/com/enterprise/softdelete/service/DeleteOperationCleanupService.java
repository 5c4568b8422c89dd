package com.enterprise.softdelete.service;

import com.enterprise.softdelete.config.CascadeDeleteProperties;
import com.enterprise.softdelete.domain.entity.DeleteOperationStatus;
import com.enterprise.softdelete.repository.DeleteOperationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Delete Operation Cleanup Service
 *
 * 5W1H Analysis:
 * WHO: Scheduled background job
 * WHAT: Removes expired terminal operations from the ledger
 * WHEN: Runs on cascade-delete.cleanup.cron (default: hourly)
 * WHERE: Deletes from delete_operations table
 * WHY: Readers already hide expired rows, the rows themselves only cost space
 * HOW: One bulk delete on status and expires_at
 *
 * PENDING and IN_PROGRESS operations are never deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeleteOperationCleanupService {

    private final DeleteOperationRepository operationRepository;
    private final CascadeDeleteProperties properties;

    @Scheduled(cron = "${cascade-delete.cleanup.cron:0 0 * * * ?}")
    @Transactional
    public void cleanupExpiredOperations() {
        if (!properties.getCleanup().isEnabled()) {
            log.debug("Cleanup is disabled, skipping");
            return;
        }

        try {
            int deleted = operationRepository.deleteExpired(DeleteOperationStatus.TERMINAL, LocalDateTime.now());
            log.info("Ledger cleanup completed: deleted {} expired operations", deleted);
        } catch (Exception e) {
            log.error("Error during ledger cleanup", e);
        }
    }

    /**
     * Manual cleanup trigger
     */
    @Transactional
    public int cleanupNow() {
        log.info("Manual ledger cleanup triggered");

        int deleted = operationRepository.deleteExpired(DeleteOperationStatus.TERMINAL, LocalDateTime.now());

        log.info("Manual ledger cleanup completed: deleted {}", deleted);
        return deleted;
    }
}
