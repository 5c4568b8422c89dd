package com.enterprise.softdelete.controller;

import com.enterprise.softdelete.domain.entity.DeleteOperation;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Wire form of a delete operation
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeleteOperationResponse {
    private UUID id;
    private UUID containerId;
    private UUID rootEntityId;
    private String rootEntityName;
    private String status;
    private boolean cascade;
    private int totalEntities;
    private int deletedCount;
    private int failedCount;
    private List<UUID> failedEntityIds;
    private String errorDetail;
    private String createdBy;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime expiresAt;

    public static DeleteOperationResponse fromEntity(DeleteOperation operation) {
        return DeleteOperationResponse.builder()
            .id(operation.getId())
            .containerId(operation.getContainerId())
            .rootEntityId(operation.getRootEntityId())
            .rootEntityName(operation.getRootEntityName())
            .status(operation.getStatus().toApiString())
            .cascade(operation.isCascade())
            .totalEntities(operation.getTotalEntities())
            .deletedCount(operation.getDeletedCount())
            .failedCount(operation.getFailedCount())
            .failedEntityIds(List.copyOf(operation.getFailedEntityIds()))
            .errorDetail(operation.getErrorDetail())
            .createdBy(operation.getCreatedBy())
            .createdAt(operation.getCreatedAt())
            .startedAt(operation.getStartedAt())
            .completedAt(operation.getCompletedAt())
            .expiresAt(operation.getExpiresAt())
            .build();
    }
}
