package com.enterprise.softdelete.service;

import com.enterprise.softdelete.domain.entity.DeleteOperationStatus;
import com.enterprise.softdelete.repository.DeleteOperationRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delete Operation Monitoring Service
 *
 * 5W1H Analysis:
 * WHO: Operations, DevOps, SRE teams
 * WHAT: Exposes ledger and cascade metrics
 * WHEN: Gauges refreshed every 10 seconds, counters on every event
 * WHERE: Actuator metrics endpoint, Prometheus/Grafana dashboards
 * WHY: A growing PENDING backlog or FAILED count needs an alert
 * HOW: Micrometer gauges per status plus counters
 */
@Service
@Slf4j
public class DeleteOperationMonitoringService {

    private final DeleteOperationRepository operationRepository;

    private final Map<DeleteOperationStatus, AtomicLong> operationsByStatus =
        new EnumMap<>(DeleteOperationStatus.class);
    private final Map<DeleteOperationStatus, Counter> operationsFinished =
        new EnumMap<>(DeleteOperationStatus.class);

    private final Counter entitiesDeletedCounter;
    private final Counter entitiesFailedCounter;

    public DeleteOperationMonitoringService(
        DeleteOperationRepository operationRepository,
        MeterRegistry meterRegistry
    ) {
        this.operationRepository = operationRepository;

        for (DeleteOperationStatus status : DeleteOperationStatus.values()) {
            AtomicLong gauge = new AtomicLong(0);
            operationsByStatus.put(status, gauge);

            Gauge.builder("softdelete.operations", gauge, AtomicLong::get)
                .description("Delete operations in the ledger by status")
                .tag("status", status.toApiString())
                .register(meterRegistry);
        }

        for (DeleteOperationStatus status : DeleteOperationStatus.TERMINAL) {
            operationsFinished.put(status, Counter.builder("softdelete.operations.finished")
                .description("Delete operations that reached a terminal status")
                .tag("status", status.toApiString())
                .register(meterRegistry));
        }

        this.entitiesDeletedCounter = Counter.builder("softdelete.entities.deleted")
            .description("Entities soft-deleted by cascades")
            .register(meterRegistry);

        this.entitiesFailedCounter = Counter.builder("softdelete.entities.failed")
            .description("Entities a cascade failed to delete")
            .register(meterRegistry);
    }

    @Scheduled(fixedRate = 10000)
    public void updateMetrics() {
        try {
            operationsByStatus.values().forEach(gauge -> gauge.set(0));

            List<Object[]> statusCounts = operationRepository.countOperationsByStatus();
            for (Object[] row : statusCounts) {
                DeleteOperationStatus status = (DeleteOperationStatus) row[0];
                long count = ((Number) row[1]).longValue();
                operationsByStatus.get(status).set(count);
            }
        } catch (Exception e) {
            log.error("Error updating metrics", e);
        }
    }

    public void recordEntityDeleted() {
        entitiesDeletedCounter.increment();
    }

    public void recordEntityFailed() {
        entitiesFailedCounter.increment();
    }

    public void recordOperationFinished(DeleteOperationStatus status) {
        Counter counter = operationsFinished.get(status);
        if (counter != null) {
            counter.increment();
        }
    }
}
