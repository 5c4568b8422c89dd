package com.enterprise.softdelete.service;

import com.enterprise.softdelete.config.CascadeDeleteProperties;
import com.enterprise.softdelete.domain.entity.DeleteOperationStatus;
import com.enterprise.softdelete.repository.DeleteOperationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeleteRateLimiterTest {

    @Mock
    private DeleteOperationRepository operationRepository;

    private DeleteRateLimiter rateLimiter;

    private final UUID containerId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        CascadeDeleteProperties properties = new CascadeDeleteProperties();
        properties.setMaxLiveOperationsPerActor(5);
        properties.setRetryAfterSeconds(30);
        rateLimiter = new DeleteRateLimiter(operationRepository, properties);
    }

    @Test
    void testCheckAdmission_BelowCeiling_Admitted() {
        // Given
        when(operationRepository.countByActorAndStatusIn(containerId, "user-1", DeleteOperationStatus.LIVE))
            .thenReturn(4L);

        // When & Then
        assertDoesNotThrow(() -> rateLimiter.checkAdmission(containerId, "user-1"));
    }

    @Test
    void testCheckAdmission_AtCeiling_Rejected() {
        // Given
        when(operationRepository.countByActorAndStatusIn(containerId, "user-1", DeleteOperationStatus.LIVE))
            .thenReturn(5L);

        // When
        DeleteRateLimiter.RateLimitExceededException e = assertThrows(
            DeleteRateLimiter.RateLimitExceededException.class,
            () -> rateLimiter.checkAdmission(containerId, "user-1"));

        // Then
        assertEquals(5, e.getActiveCount());
        assertEquals(5, e.getCeiling());
        assertEquals(30, e.getRetryAfterSeconds());
    }

    @Test
    void testCountLive_OnlyLiveStatuses() {
        when(operationRepository.countByActorAndStatusIn(containerId, "user-2", DeleteOperationStatus.LIVE))
            .thenReturn(2L);

        assertEquals(2L, rateLimiter.countLive(containerId, "user-2"));
        verify(operationRepository).countByActorAndStatusIn(
            eq(containerId), eq("user-2"),
            argThat(statuses -> statuses.contains(DeleteOperationStatus.PENDING)
                && statuses.contains(DeleteOperationStatus.IN_PROGRESS)
                && statuses.size() == 2));
    }
}
