package com.enterprise.softdelete.integration;

import com.enterprise.softdelete.domain.entity.DeleteOperation;
import com.enterprise.softdelete.service.DeleteOperationService;
import com.enterprise.softdelete.service.DeleteRateLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two requests released together must still respect the ceiling and the one-live-operation-per-root rule.
 */
class AdmissionConcurrencyIntegrationTest extends BaseIntegrationTest {

    @Autowired DeleteOperationService deleteOperationService;
    @Autowired DeleteRateLimiter rateLimiter;

    private final ExecutorService callers = Executors.newFixedThreadPool(2);

    @AfterEach
    void shutdownCallers() throws InterruptedException {
        callers.shutdownNow();
        callers.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void concurrentRequestsAtCeilingAdmitOnlyOne() throws Exception {
        // ARRANGE: one slot left under the ceiling of five
        for (int i = 0; i < 4; i++) {
            deleteOperationService.initiateDelete(containerId, entity(null, "busy-" + i), OWNER, true);
        }
        UUID first = entity(null, "first");
        UUID second = entity(null, "second");
        accessGate.holdUntil(2);

        // ACT
        List<String> outcomes = runTogether(first, second);

        // ASSERT
        assertEquals(1, outcomes.stream().filter("admitted"::equals).count(), outcomes.toString());
        assertEquals(1, outcomes.stream().filter("rate-limited"::equals).count(), outcomes.toString());
        assertEquals(5, rateLimiter.countLive(containerId, OWNER));
    }

    @Test
    void concurrentRequestsOnSameRootAdmitOnlyOne() throws Exception {
        UUID root = entity(null, "root");
        accessGate.holdUntil(2);

        List<String> outcomes = runTogether(root, root);

        assertEquals(1, outcomes.stream().filter("admitted"::equals).count(), outcomes.toString());
        assertEquals(1, outcomes.stream().filter("in-progress"::equals).count(), outcomes.toString());
        assertEquals(1, operationRepo.count());
    }

    private List<String> runTogether(UUID firstEntity, UUID secondEntity) throws Exception {
        List<Future<String>> futures = new ArrayList<>();
        futures.add(callers.submit(() -> attempt(firstEntity)));
        futures.add(callers.submit(() -> attempt(secondEntity)));

        List<String> outcomes = new ArrayList<>();
        for (Future<String> future : futures) {
            outcomes.add(future.get(30, TimeUnit.SECONDS));
        }
        return outcomes;
    }

    private String attempt(UUID entityId) {
        try {
            DeleteOperation op = deleteOperationService.initiateDelete(containerId, entityId, OWNER, true);
            assertNotNull(op.getId());
            return "admitted";
        } catch (DeleteRateLimiter.RateLimitExceededException e) {
            return "rate-limited";
        } catch (DeleteOperationService.DeleteAlreadyInProgressException e) {
            return "in-progress";
        }
    }
}
