package com.enterprise.softdelete.integration;

import com.enterprise.softdelete.domain.entity.DeleteOperation;
import com.enterprise.softdelete.domain.entity.DeleteOperationStatus;
import com.enterprise.softdelete.domain.entity.HierarchyEntity;
import com.enterprise.softdelete.service.CascadeDeleteProcessor;
import com.enterprise.softdelete.service.DeleteOperationService;
import com.enterprise.softdelete.service.DeleteRateLimiter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end cascade scenarios: request, poll, ledger, entity state.
 */
class CascadeDeleteIntegrationTest extends BaseIntegrationTest {

    @Autowired DeleteOperationService deleteOperationService;
    @Autowired CascadeDeleteProcessor processor;

    @Test
    void rootWithThreeChildrenCompletes() {
        // ARRANGE
        UUID root = entity(null, "root");
        List<UUID> children = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            children.add(entity(root, "child-" + i));
        }

        // ACT
        DeleteOperation op = deleteOperationService.initiateDelete(containerId, root, OWNER, true);
        assertEquals(DeleteOperationStatus.PENDING, op.getStatus());
        assertEquals(1, processor.processPendingOperations());

        // ASSERT
        DeleteOperation done = reloadOperation(op.getId());
        assertEquals(DeleteOperationStatus.COMPLETED, done.getStatus());
        assertEquals(4, done.getTotalEntities());
        assertEquals(4, done.getDeletedCount());
        assertEquals(0, done.getFailedCount());
        assertNotNull(done.getStartedAt());
        assertNotNull(done.getCompletedAt());
        assertNull(done.getClaimToken());

        HierarchyEntity deletedChild = reload(children.get(0));
        assertTrue(deletedChild.isDeleted());
        assertEquals(OWNER, deletedChild.getDeletedBy());
        assertNotNull(deletedChild.getDeletedAt());
        assertEquals(Duration.ofDays(90), deletedChild.getExpiresAfter());
        assertEquals(op.getId(), deletedChild.getDeleteOperationId());
    }

    @Test
    void tenEntitiesIncludingRootWithTwoFailures() {
        // ARRANGE: ten entities, root included
        UUID root = entity(null, "root");
        List<UUID> children = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            children.add(entity(root, "child-" + i));
        }
        faultStore.failOn(children.get(3));
        faultStore.failOn(children.get(6));

        // ACT
        DeleteOperation op = deleteOperationService.initiateDelete(containerId, root, OWNER, true);
        processor.processPendingOperations();

        // ASSERT
        DeleteOperation done = reloadOperation(op.getId());
        assertEquals(DeleteOperationStatus.PARTIAL, done.getStatus());
        assertEquals(10, done.getTotalEntities());
        assertEquals(8, done.getDeletedCount());
        assertEquals(2, done.getFailedCount());
        assertEquals(2, done.getFailedEntityIds().size());
        assertTrue(done.getFailedEntityIds().contains(children.get(3)));
        assertTrue(done.getFailedEntityIds().contains(children.get(6)));
        assertFalse(reload(children.get(3)).isDeleted());
    }

    @Test
    void rootWithTenChildrenAndTwoFailures() {
        // ARRANGE: root plus ten children, eleven entities in total
        UUID root = entity(null, "root");
        List<UUID> children = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            children.add(entity(root, "child-" + i));
        }
        faultStore.failOn(children.get(0));
        faultStore.failOn(children.get(9));

        // ACT
        DeleteOperation op = deleteOperationService.initiateDelete(containerId, root, OWNER, true);
        processor.processPendingOperations();

        // ASSERT
        DeleteOperation done = reloadOperation(op.getId());
        assertEquals(DeleteOperationStatus.PARTIAL, done.getStatus());
        assertEquals(11, done.getTotalEntities());
        assertEquals(9, done.getDeletedCount());
        assertEquals(2, done.getFailedCount());
        assertTrue(reload(root).isDeleted());
        assertFalse(reload(children.get(0)).isDeleted());
        assertFalse(reload(children.get(9)).isDeleted());
    }

    @Test
    void singleEntityWithoutCascade() {
        UUID leaf = entity(null, "leaf");

        DeleteOperation op = deleteOperationService.initiateDelete(containerId, leaf, OWNER, false);
        processor.processPendingOperations();

        DeleteOperation done = reloadOperation(op.getId());
        assertEquals(DeleteOperationStatus.COMPLETED, done.getStatus());
        assertEquals(1, done.getTotalEntities());
        assertEquals(1, done.getDeletedCount());
    }

    @Test
    void childrenWithoutCascadeRejected() {
        UUID root = entity(null, "root");
        entity(root, "child");

        assertThrows(DeleteOperationService.EntityHasChildrenException.class,
            () -> deleteOperationService.initiateDelete(containerId, root, OWNER, false));

        assertEquals(0, operationRepo.count());
    }

    @Test
    void sixthLiveRequestIsRateLimited() {
        for (int i = 0; i < 5; i++) {
            deleteOperationService.initiateDelete(containerId, entity(null, "root-" + i), OWNER, true);
        }
        UUID sixth = entity(null, "root-6");

        DeleteRateLimiter.RateLimitExceededException e = assertThrows(
            DeleteRateLimiter.RateLimitExceededException.class,
            () -> deleteOperationService.initiateDelete(containerId, sixth, OWNER, true));

        assertEquals(5, e.getActiveCount());
        assertEquals(5, operationRepo.count());

        // Once the live operations finish the actor is admitted again
        processor.processPendingOperations();
        assertNotNull(deleteOperationService.initiateDelete(containerId, sixth, OWNER, true));
    }

    @Test
    void secondDeleteOfSameSubtreeCountsNothing() {
        UUID root = entity(null, "root");
        entity(root, "child");

        DeleteOperation first = deleteOperationService.initiateDelete(containerId, root, OWNER, true);
        processor.processPendingOperations();
        DeleteOperation second = deleteOperationService.initiateDelete(containerId, root, OWNER, true);
        processor.processPendingOperations();

        assertEquals(2, reloadOperation(first.getId()).getDeletedCount());
        DeleteOperation again = reloadOperation(second.getId());
        assertEquals(DeleteOperationStatus.COMPLETED, again.getStatus());
        assertEquals(0, again.getTotalEntities());
        assertEquals(0, again.getDeletedCount());
    }

    @Test
    void liveOperationOnSameRootConflicts() {
        UUID root = entity(null, "root");
        deleteOperationService.initiateDelete(containerId, root, OWNER, true);

        assertThrows(DeleteOperationService.DeleteAlreadyInProgressException.class,
            () -> deleteOperationService.initiateDelete(containerId, root, OWNER, true));
    }

    @Test
    void deepHierarchyFullyDeleted() {
        UUID root = entity(null, "root");
        UUID parent = root;
        for (int depth = 0; depth < 30; depth++) {
            parent = entity(parent, "level-" + depth);
            entity(parent, "leaf-" + depth);
        }

        DeleteOperation op = deleteOperationService.initiateDelete(containerId, root, OWNER, true);
        processor.processPendingOperations();

        DeleteOperation done = reloadOperation(op.getId());
        assertEquals(DeleteOperationStatus.COMPLETED, done.getStatus());
        assertEquals(61, done.getTotalEntities());
        assertEquals(61, done.getDeletedCount());
        assertTrue(entityRepo.findAll().stream().allMatch(HierarchyEntity::isDeleted));
    }

    @Test
    void survivorsBelowDeletedNodeAreReached() {
        UUID root = entity(null, "root");
        UUID middle = entity(root, "middle");
        UUID survivor = entity(middle, "survivor");

        DeleteOperation inner = deleteOperationService.initiateDelete(containerId, middle, OWNER, true);
        faultStore.failOn(survivor);
        processor.processPendingOperations();
        assertEquals(DeleteOperationStatus.PARTIAL, reloadOperation(inner.getId()).getStatus());

        faultStore.reset();
        DeleteOperation outer = deleteOperationService.initiateDelete(containerId, root, OWNER, true);
        processor.processPendingOperations();

        DeleteOperation done = reloadOperation(outer.getId());
        assertEquals(DeleteOperationStatus.COMPLETED, done.getStatus());
        assertEquals(2, done.getDeletedCount());
        assertTrue(reload(survivor).isDeleted());
    }

    @Test
    void otherContainersAreUntouched() {
        UUID root = entity(null, "root");
        UUID foreignContainer = UUID.randomUUID();
        UUID foreign = UUID.randomUUID();
        entityRepo.save(HierarchyEntity.builder()
            .id(foreign).containerId(foreignContainer).parentId(root).name("foreign").build());

        DeleteOperation op = deleteOperationService.initiateDelete(containerId, root, OWNER, true);
        processor.processPendingOperations();

        assertEquals(1, reloadOperation(op.getId()).getDeletedCount());
        assertFalse(reload(foreign).isDeleted());
    }

    @Test
    void nonOwnerIsForbidden() {
        UUID root = entity(null, "root");

        assertThrows(DeleteOperationService.ContainerAccessDeniedException.class,
            () -> deleteOperationService.initiateDelete(containerId, root, "someone-else", true));
    }
}
