package com.enterprise.softdelete.service;

import com.enterprise.softdelete.config.CascadeDeleteProperties;
import com.enterprise.softdelete.domain.entity.DeleteOperationStatus;
import com.enterprise.softdelete.repository.DeleteOperationRepository;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Delete Rate Limiter
 *
 * 5W1H Analysis:
 * WHO: Delete initiator, before an operation is persisted
 * WHAT: Caps live (PENDING + IN_PROGRESS) operations per actor and container
 * WHEN: Once per delete request
 * WHERE: Reads the delete_operations ledger
 * WHY: One actor must not flood the processor with cascades
 * HOW: Counts ledger rows on demand, no counter that could drift after a crash
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeleteRateLimiter {

    private final DeleteOperationRepository operationRepository;
    private final CascadeDeleteProperties properties;

    @Transactional(readOnly = true)
    public long countLive(UUID containerId, String actorId) {
        return operationRepository.countByActorAndStatusIn(
            containerId, actorId, DeleteOperationStatus.LIVE);
    }

    /**
     * Throws if the actor already has the maximum number of live operations
     */
    @Transactional(readOnly = true)
    public void checkAdmission(UUID containerId, String actorId) {
        long live = countLive(containerId, actorId);
        int ceiling = properties.getMaxLiveOperationsPerActor();

        if (live >= ceiling) {
            log.warn("Delete rejected by rate limiter: containerId={}, actorId={}, live={}, ceiling={}",
                containerId, actorId, live, ceiling);
            throw new RateLimitExceededException(live, ceiling, properties.getRetryAfterSeconds());
        }
    }

    @Getter
    public static class RateLimitExceededException extends RuntimeException {
        private final long activeCount;
        private final int ceiling;
        private final long retryAfterSeconds;

        public RateLimitExceededException(long activeCount, int ceiling, long retryAfterSeconds) {
            super("Too many delete operations in progress: " + activeCount + " of " + ceiling
                + " allowed. Retry after " + retryAfterSeconds + " seconds");
            this.activeCount = activeCount;
            this.ceiling = ceiling;
            this.retryAfterSeconds = retryAfterSeconds;
        }
    }
}
