package com.enterprise.softdelete.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.UUID;

/**
 * Cascade Delete Configuration Properties
 *
 * Binds cascade-delete.* from application.yml to type-safe configuration
 */
@Configuration
@ConfigurationProperties(prefix = "cascade-delete")
@Data
public class CascadeDeleteProperties {

    /**
     * Ceiling on PENDING + IN_PROGRESS operations per actor and container
     */
    private int maxLiveOperationsPerActor = 5;
    private long retryAfterSeconds = 30;

    private Duration operationRetention = Duration.ofHours(24);
    private Duration entityRetention = Duration.ofDays(90);

    private int batchSize = 10;
    private int childPageSize = 100;

    private int listLimitDefault = 20;
    private int listLimitMax = 100;

    private Processor processor = new Processor();
    private Cleanup cleanup = new Cleanup();

    @Data
    public static class Processor {
        /**
         * Must differ between processors running at the same time.
         * A restarted instance resumes the operations claimed under its id at once.
         */
        private String instanceId = UUID.randomUUID().toString();
        private long pollingIntervalMs = 500;
        private int claimBatchSize = 50;
        private int workerThreads = 4;
        private Duration stallThreshold = Duration.ofMinutes(5);
        /**
         * Liveness write while a walk produces no batch, well below stallThreshold
         */
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private long stallCheckIntervalMs = 60000;
        private boolean resumeOnStartup = true;
        private boolean schedulingEnabled = true;
    }

    @Data
    public static class Cleanup {
        private boolean enabled = true;
        private String cron = "0 0 * * * ?";
    }
}
