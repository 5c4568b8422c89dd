package com.enterprise.softdelete.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Hierarchy Entity - member of a parent/child tree inside a container
 *
 * 5W1H Analysis:
 * WHO: Cascade processor (deletion fields), external CRUD (everything else)
 * WHAT: One node of a hierarchy, addressed by (containerId, id)
 * WHEN: Soft-deleted when a delete operation reaches it
 * WHERE: hierarchy_entities table, partitioned logically by container_id
 * WHY: Deletion is a state change, the row stays until retention expires
 * HOW: Deletion fields are set by one conditional update and cleared together
 *
 * Invariant: deleted=false implies deletedAt, deletedBy and expiresAfter are null.
 */
@Entity
@Table(name = "hierarchy_entities", indexes = {
    @Index(name = "idx_entity_container_parent", columnList = "container_id, parent_id"),
    @Index(name = "idx_entity_container_deleted", columnList = "container_id, is_deleted"),
    @Index(name = "idx_entity_delete_operation", columnList = "delete_operation_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HierarchyEntity {

    @Id
    private UUID id;

    /**
     * Container ID - partition key, every lookup is scoped by it
     */
    @Column(name = "container_id", nullable = false)
    private UUID containerId;

    /**
     * Parent ID - null marks a root
     */
    @Column(name = "parent_id")
    private UUID parentId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "is_deleted", nullable = false)
    @Builder.Default
    private boolean deleted = false;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    @Column(name = "deleted_by", length = 100)
    private String deletedBy;

    /**
     * Time-to-live once deleted, before permanent purge
     */
    @Convert(converter = DurationSecondsConverter.class)
    @Column(name = "expires_after_seconds")
    private Duration expiresAfter;

    /**
     * Operation that marked this entity deleted.
     * Lets a resumed operation count deletions made after its last checkpoint.
     */
    @Column(name = "delete_operation_id")
    private UUID deleteOperationId;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    /**
     * Clear every deletion field. Restore itself is driven by entity CRUD.
     */
    public void restore() {
        this.deleted = false;
        this.deletedAt = null;
        this.deletedBy = null;
        this.expiresAfter = null;
        this.deleteOperationId = null;
        this.updatedAt = LocalDateTime.now();
    }
}
