package com.enterprise.softdelete.controller;

import com.enterprise.softdelete.domain.entity.DeleteOperation;
import com.enterprise.softdelete.service.DeleteOperationService;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.UUID;

/**
 * Delete Operation Controller - command endpoints
 *
 * 5W1H Analysis:
 * WHO: Frontend applications and external systems deleting hierarchy entities
 * WHAT: Starts a (cascading) soft delete, retries a finished one
 * WHEN: On user delete actions
 * WHERE: API Gateway / Load Balancer routes to this controller
 * WHY: The delete runs in the background, the caller polls the returned operation
 * HOW: 202 Accepted with a Location header pointing at the operation
 *
 * NFR Applied:
 * - @RateLimiter: raw request throttling, separate from the per-actor operation ceiling
 * - @NotBlank: Bean Validation on the actor header
 * - Errors mapped centrally by ApiExceptionHandler
 */
@RestController
@RequestMapping("/api/v1/containers/{containerId}")
@RequiredArgsConstructor
@Slf4j
public class DeleteOperationController {

    static final String ACTOR_HEADER = "X-User-Id";

    private final DeleteOperationService deleteOperationService;

    /**
     * Delete an entity, and its descendants when cascade=true
     *
     * Endpoint: DELETE /api/v1/containers/{containerId}/entities/{entityId}?cascade=false
     */
    @DeleteMapping("/entities/{entityId}")
    @RateLimiter(name = "deleteApi")
    public ResponseEntity<DeleteOperationResponse> deleteEntity(
        @PathVariable UUID containerId,
        @PathVariable UUID entityId,
        @RequestParam(defaultValue = "false") boolean cascade,
        @RequestHeader(ACTOR_HEADER) @NotBlank(message = "X-User-Id must not be blank") String actorId
    ) {
        DeleteOperation operation = deleteOperationService.initiateDelete(containerId, entityId, actorId, cascade);

        return ResponseEntity
            .status(HttpStatus.ACCEPTED)
            .location(operationUri(containerId, operation.getId()))
            .body(DeleteOperationResponse.fromEntity(operation));
    }

    /**
     * Retry a partial or failed operation
     *
     * Endpoint: POST /api/v1/containers/{containerId}/delete-operations/{operationId}/retry
     */
    @PostMapping("/delete-operations/{operationId}/retry")
    public ResponseEntity<DeleteOperationResponse> retryOperation(
        @PathVariable UUID containerId,
        @PathVariable UUID operationId,
        @RequestHeader(ACTOR_HEADER) @NotBlank(message = "X-User-Id must not be blank") String actorId
    ) {
        DeleteOperation operation = deleteOperationService.retryOperation(containerId, operationId, actorId);

        return ResponseEntity
            .status(HttpStatus.ACCEPTED)
            .location(operationUri(containerId, operation.getId()))
            .body(DeleteOperationResponse.fromEntity(operation));
    }

    private URI operationUri(UUID containerId, UUID operationId) {
        return URI.create("/api/v1/containers/" + containerId + "/delete-operations/" + operationId);
    }
}
