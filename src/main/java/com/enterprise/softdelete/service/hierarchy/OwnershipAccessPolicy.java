package com.enterprise.softdelete.service.hierarchy;

import com.enterprise.softdelete.repository.HierarchyContainerRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Default policy: only the container owner may delete.
 */
@Component
@RequiredArgsConstructor
public class OwnershipAccessPolicy implements ContainerAccessPolicy {

    private final HierarchyContainerRepository containerRepository;

    @Override
    @Transactional(readOnly = true)
    public boolean canDelete(UUID containerId, String actorId) {
        return containerRepository.findById(containerId)
            .map(container -> container.getOwnerId().equals(actorId))
            .orElse(false);
    }
}
