package com.enterprise.softdelete.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Container of a hierarchy. Owns the partition every entity and operation lives in.
 */
@Entity
@Table(name = "hierarchy_containers")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HierarchyContainer {

    @Id
    private UUID id;

    @Column(nullable = false, length = 200)
    private String name;

    /**
     * Owner - the only actor the default access policy lets delete
     */
    @Column(nullable = false, length = 100)
    private String ownerId;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
