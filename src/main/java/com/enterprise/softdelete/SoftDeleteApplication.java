package com.enterprise.softdelete;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Main Spring Boot Application for the cascading soft-delete service
 *
 * 5W1H:
 * WHO: Clients removing entities from container-scoped hierarchies
 * WHAT: Accepts delete requests and cascades soft-deletion in the background
 * WHEN: Deletes of arbitrarily large subtrees that cannot finish inside a request
 * WHERE: Deployed as one or more instances sharing the same database
 * WHY: A request returns at once while progress stays observable and resumable
 * HOW: Operation ledger, polling processor, checkpointed breadth-first traversal
 */
@SpringBootApplication
@EnableRetry
public class SoftDeleteApplication {

    public static void main(String[] args) {
        SpringApplication.run(SoftDeleteApplication.class, args);
    }
}
