package com.accountability.leaderboard.repository.impl;

import com.accountability.leaderboard.model.ParticipantStats;
import com.accountability.leaderboard.model.StatDelta;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class ParticipantStatsRepositoryAdapterTest {

    @Autowired
    private JpaParticipantStatsRepository jpaRepository;

    @Autowired
    private TestEntityManager entityManager;

    private ParticipantStatsRepositoryAdapter repository;

    @BeforeEach
    void setUp() {
        repository = new ParticipantStatsRepositoryAdapter(jpaRepository);
    }

    @Test
    void testFindAllRanked_FollowsLeaderboardOrder() {
        // Arrange
        store("user-a", 50, 5, 0, 0);
        store("user-c", 80, 2, 0, 0);
        store("user-b", 80, 3, 0, 0);
        store("user-e", 80, 2, 1, 0);
        store("user-d", 80, 2, 1, 0);
        entityManager.clear();

        // Act
        List<String> order = repository.findAllRanked().stream()
            .map(ParticipantStats::getUserId)
            .collect(Collectors.toList());

        // Assert
        assertEquals(List.of("user-b", "user-d", "user-e", "user-c", "user-a"), order);
    }

    @Test
    void testCreateIfAbsent_OneRowPerUser() {
        // Act
        boolean created = repository.createIfAbsent("user-1");
        boolean createdAgain = repository.createIfAbsent("user-1");
        entityManager.clear();

        // Assert
        assertTrue(created);
        assertFalse(createdAgain);
        assertEquals(1, jpaRepository.count());
        ParticipantStats stored = repository.findByUserId("user-1").orElseThrow();
        assertEquals(0, stored.getTotalPoints());
        assertNull(stored.getRank());
        assertNotNull(stored.getCreatedAt());
        assertNotNull(stored.getUpdatedAt());
    }

    @Test
    void testReplaceGoalCounters_LeavesStreakAndRankAlone() {
        // Arrange
        ParticipantStats seeded = stats("user-1", 999, 9, 9, 7);
        seeded.setRank(4);
        jpaRepository.saveAndFlush(seeded);

        // Act
        boolean updated = repository.replaceGoalCounters("user-1", 2, 1, 30);

        // Assert
        assertTrue(updated);
        ParticipantStats stored = repository.findByUserId("user-1").orElseThrow();
        assertEquals(2, stored.getCompletedGoals());
        assertEquals(1, stored.getCompletedMilestones());
        assertEquals(30, stored.getTotalPoints());
        assertEquals(7, stored.getStreakDays());
        assertEquals(4, stored.getRank());
        assertFalse(repository.replaceGoalCounters("missing", 1, 1, 1));
    }

    @Test
    void testIncrementCounters_NeverBelowZero() {
        // Arrange
        store("user-1", 10, 1, 0, 2);

        // Act
        boolean updated = repository.incrementCounters("user-1",
            StatDelta.builder().totalPoints(-25).completedGoals(-1).completedMilestones(-3).streakDays(3).build());

        // Assert
        assertTrue(updated);
        ParticipantStats stored = repository.findByUserId("user-1").orElseThrow();
        assertEquals(0, stored.getTotalPoints());
        assertEquals(0, stored.getCompletedGoals());
        assertEquals(0, stored.getCompletedMilestones());
        assertEquals(5, stored.getStreakDays());
        assertFalse(repository.incrementCounters("missing", StatDelta.builder().totalPoints(1).build()));
    }

    @Test
    void testIncrementCounters_AddsToStoredValueNotCallerSnapshot() {
        // Arrange
        store("user-1", 10, 0, 0, 0);
        ParticipantStats snapshot = repository.findByUserId("user-1").orElseThrow();
        StatDelta plusFive = StatDelta.builder().totalPoints(5).build();

        // Act
        repository.incrementCounters("user-1", plusFive);
        repository.incrementCounters("user-1", plusFive);

        // Assert
        assertEquals(10, snapshot.getTotalPoints());
        assertEquals(20, repository.findByUserId("user-1").orElseThrow().getTotalPoints());
    }

    @Test
    void testUpdateRanks_KeepsCountersWrittenSinceRowWasRead() {
        // Arrange
        store("user-1", 10, 0, 0, 0);
        store("user-2", 20, 0, 0, 0);
        ParticipantStats staleRead = repository.findByUserId("user-1").orElseThrow();
        repository.incrementCounters("user-1", StatDelta.builder().totalPoints(40).build());

        // Act
        repository.updateRanks(Map.of(staleRead.getUserId(), 1, "user-2", 2));
        entityManager.clear();

        // Assert
        ParticipantStats stored = repository.findByUserId("user-1").orElseThrow();
        assertEquals(50, stored.getTotalPoints());
        assertEquals(1, stored.getRank());
        assertEquals(2, repository.findByUserId("user-2").orElseThrow().getRank());
    }

    @Test
    void testFindByUserIds() {
        // Arrange
        store("user-1", 10, 0, 0, 0);
        store("user-2", 20, 0, 0, 0);
        store("user-3", 30, 0, 0, 0);

        // Act
        List<ParticipantStats> found = repository.findByUserIds(List.of("user-1", "user-3", "missing"));

        // Assert
        assertEquals(2, found.size());
        assertTrue(repository.findByUserIds(List.of()).isEmpty());
    }

    @Test
    void testDeleteAll() {
        // Arrange
        store("user-1", 10, 0, 0, 0);

        // Act
        repository.deleteAll();

        // Assert
        assertEquals(0, jpaRepository.count());
        assertTrue(repository.findAllRanked().isEmpty());
    }

    private void store(String userId, int points, int goals, int milestones, int streak) {
        jpaRepository.saveAndFlush(stats(userId, points, goals, milestones, streak));
    }

    private ParticipantStats stats(String userId, int points, int goals, int milestones, int streak) {
        return ParticipantStats.builder()
            .userId(userId)
            .totalPoints(points)
            .completedGoals(goals)
            .completedMilestones(milestones)
            .streakDays(streak)
            .build();
    }
}
