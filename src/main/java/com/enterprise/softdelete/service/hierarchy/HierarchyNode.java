package com.enterprise.softdelete.service.hierarchy;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Read view of one hierarchy entity, as seen by the cascade.
 */
@Value
@Builder
public class HierarchyNode {
    UUID id;
    UUID parentId;
    String name;
    boolean deleted;
}
