package com.accountability.leaderboard.service;

import com.accountability.leaderboard.exception.RankRecalculationException;
import com.accountability.leaderboard.ranking.RankingEngine;
import com.accountability.leaderboard.repository.LeaderboardCacheRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RankRecalculationProcessorTest {

    @Mock
    private RankingEngine rankingEngine;

    @Mock
    private LeaderboardCacheRepository cacheRepository;

    private RankRecalculationProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new RankRecalculationProcessor(rankingEngine, cacheRepository, "leaderboard");
    }

    @Test
    void testRepairStaleRanks_InvalidatesCacheAfterRepair() {
        // Arrange
        when(rankingEngine.recalculateIfStale()).thenReturn(true);

        // Act
        processor.repairStaleRanks();

        // Assert
        verify(cacheRepository).invalidateAll("leaderboard");
    }

    @Test
    void testRepairStaleRanks_NothingToRepair() {
        // Arrange
        when(rankingEngine.recalculateIfStale()).thenReturn(false);

        // Act
        processor.repairStaleRanks();

        // Assert
        verify(cacheRepository, never()).invalidateAll(anyString());
    }

    @Test
    void testRepairStaleRanks_FailureDoesNotPropagate() {
        // Arrange
        when(rankingEngine.recalculateIfStale()).thenThrow(
            new RankRecalculationException("store down", new RuntimeException("connection refused")));

        // Act & Assert
        assertDoesNotThrow(() -> processor.repairStaleRanks());
        verify(cacheRepository, never()).invalidateAll(anyString());
    }

    @Test
    void testCheckCacheConnection_OnlyPingsCache() {
        // Arrange
        when(cacheRepository.isAvailable()).thenReturn(false);

        // Act
        processor.checkCacheConnection();

        // Assert
        verify(cacheRepository).isAvailable();
        verifyNoMoreInteractions(cacheRepository);
        verifyNoInteractions(rankingEngine);
    }
}
