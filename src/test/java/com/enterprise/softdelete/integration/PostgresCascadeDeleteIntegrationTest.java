package com.enterprise.softdelete.integration;

import com.enterprise.softdelete.domain.entity.DeleteOperation;
import com.enterprise.softdelete.domain.entity.DeleteOperationStatus;
import com.enterprise.softdelete.domain.entity.HierarchyContainer;
import com.enterprise.softdelete.domain.entity.HierarchyEntity;
import com.enterprise.softdelete.repository.DeleteOperationRepository;
import com.enterprise.softdelete.repository.HierarchyContainerRepository;
import com.enterprise.softdelete.repository.HierarchyEntityRepository;
import com.enterprise.softdelete.service.CascadeDeleteProcessor;
import com.enterprise.softdelete.service.DeleteOperationLedger;
import com.enterprise.softdelete.service.DeleteOperationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

// =============================================================================
// Same flow against a real PostgreSQL. Skipped when Docker is not available.
// =============================================================================

@SpringBootTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@Import(BaseIntegrationTest.FaultInjectionConfig.class)
class PostgresCascadeDeleteIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES =
            new PostgreSQLContainer<>("postgres:15-alpine")
                    .withDatabaseName("softdelete_test")
                    .withUsername("test_user")
                    .withPassword("test_pass");

    @DynamicPropertySource
    static void postgresProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url",      POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired HierarchyContainerRepository containerRepo;
    @Autowired HierarchyEntityRepository entityRepo;
    @Autowired DeleteOperationRepository operationRepo;
    @Autowired DeleteOperationService deleteOperationService;
    @Autowired DeleteOperationLedger ledger;
    @Autowired CascadeDeleteProcessor processor;
    @Autowired FaultInjectingHierarchyStore faultStore;

    private UUID containerId;

    @BeforeEach
    void setUp() {
        faultStore.reset();
        operationRepo.deleteAllInBatch();
        entityRepo.deleteAllInBatch();
        containerRepo.deleteAllInBatch();

        containerId = UUID.randomUUID();
        containerRepo.save(HierarchyContainer.builder().id(containerId).name("world").ownerId("owner-1").build());
    }

    @Test
    void partialCascadePersistsFailedIds() {
        UUID root = add(null, "root");
        List<UUID> children = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            children.add(add(root, "child-" + i));
        }
        faultStore.failOn(children.get(5));

        DeleteOperation op = deleteOperationService.initiateDelete(containerId, root, "owner-1", true);
        processor.processPendingOperations();

        DeleteOperation done = operationRepo.findById(op.getId()).orElseThrow();
        assertEquals(DeleteOperationStatus.PARTIAL, done.getStatus());
        assertEquals(26, done.getTotalEntities());
        assertEquals(25, done.getDeletedCount());
        assertEquals(List.of(children.get(5)), List.copyOf(done.getFailedEntityIds()));
    }

    @Test
    void claimIsExclusive() {
        UUID root = add(null, "root");
        DeleteOperation op = deleteOperationService.initiateDelete(containerId, root, "owner-1", true);
        DeleteOperation loaded = operationRepo.findById(op.getId()).orElseThrow();

        assertTrue(ledger.claim(loaded).isPresent());
        assertTrue(ledger.claim(loaded).isEmpty());
    }

    private UUID add(UUID parentId, String name) {
        UUID id = UUID.randomUUID();
        entityRepo.save(HierarchyEntity.builder()
            .id(id).containerId(containerId).parentId(parentId).name(name).build());
        return id;
    }
}
