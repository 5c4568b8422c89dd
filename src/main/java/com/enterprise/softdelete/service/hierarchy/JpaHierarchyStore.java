package com.enterprise.softdelete.service.hierarchy;

import com.enterprise.softdelete.domain.entity.HierarchyEntity;
import com.enterprise.softdelete.repository.HierarchyContainerRepository;
import com.enterprise.softdelete.repository.HierarchyEntityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Hierarchy store over the JPA repositories.
 * Each mark is its own transaction, so a cascade commits entity by entity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaHierarchyStore implements HierarchyStore {

    private final HierarchyContainerRepository containerRepository;
    private final HierarchyEntityRepository entityRepository;

    @Override
    @Transactional(readOnly = true)
    public boolean containerExists(UUID containerId) {
        return containerRepository.existsById(containerId);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean lockContainer(UUID containerId) {
        return containerRepository.findByIdForUpdate(containerId).isPresent();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<HierarchyNode> findNode(UUID containerId, UUID entityId) {
        return entityRepository.findByIdAndContainerId(entityId, containerId)
            .map(this::toNode);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasLiveChildren(UUID containerId, UUID entityId) {
        return entityRepository.existsByContainerIdAndParentIdAndDeletedFalse(containerId, entityId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<HierarchyNode> findChildren(UUID containerId, Collection<UUID> parentIds, int page, int pageSize) {
        if (parentIds.isEmpty()) {
            return List.of();
        }
        return entityRepository.findChildren(containerId, parentIds, PageRequest.of(page, pageSize))
            .stream()
            .map(this::toNode)
            .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public boolean markDeleted(
        UUID containerId,
        UUID entityId,
        String actorId,
        UUID operationId,
        LocalDateTime deletedAt,
        Duration expiresAfter
    ) {
        int updated = entityRepository.markDeleted(
            containerId, entityId, actorId, operationId, deletedAt, expiresAfter);

        if (updated == 0) {
            log.debug("Entity already deleted or missing: containerId={}, entityId={}", containerId, entityId);
        }
        return updated == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public long countDeletedByOperationSince(UUID containerId, UUID operationId, LocalDateTime since) {
        return entityRepository.countDeletedByOperationSince(containerId, operationId, since);
    }

    private HierarchyNode toNode(HierarchyEntity entity) {
        return HierarchyNode.builder()
            .id(entity.getId())
            .parentId(entity.getParentId())
            .name(entity.getName())
            .deleted(entity.isDeleted())
            .build();
    }
}
