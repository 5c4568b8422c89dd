package com.enterprise.softdelete.controller;

import com.enterprise.softdelete.cqrs.query.DeleteOperationQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Query Controller - read endpoints for delete operations.
 *
 * Depends only on DeleteOperationQueryService, never on the command side.
 */
@RestController
@RequestMapping("/api/v1/containers/{containerId}/delete-operations")
@RequiredArgsConstructor
@Slf4j
public class DeleteOperationQueryController {

    private final DeleteOperationQueryService queryService;

    @GetMapping("/{operationId}")
    public ResponseEntity<DeleteOperationResponse> getOperation(
        @PathVariable UUID containerId,
        @PathVariable UUID operationId
    ) {
        return ResponseEntity.ok(DeleteOperationResponse.fromEntity(
            queryService.getOperation(containerId, operationId)));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listRecent(
        @PathVariable UUID containerId,
        @RequestParam(required = false) Integer limit
    ) {
        List<DeleteOperationResponse> data = queryService.listRecent(containerId, limit).stream()
            .map(DeleteOperationResponse::fromEntity)
            .toList();
        return ResponseEntity.ok(Map.of("data", data, "count", data.size()));
    }
}
