package com.enterprise.softdelete.service.hierarchy;

import java.util.UUID;

/**
 * Decides whether an actor may delete inside a container.
 */
public interface ContainerAccessPolicy {

    boolean canDelete(UUID containerId, String actorId);
}
