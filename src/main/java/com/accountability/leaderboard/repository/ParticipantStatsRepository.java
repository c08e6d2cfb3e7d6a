package com.accountability.leaderboard.repository;

import com.accountability.leaderboard.model.ParticipantStats;
import com.accountability.leaderboard.model.StatDelta;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every write is a targeted update of the columns it owns, so counter writes and rank writes
 * never overwrite each other.
 */
public interface ParticipantStatsRepository {

    /**
     * Inserts an all-zero row for the user unless one exists.
     *
     * @return true if this call created the row
     */
    boolean createIfAbsent(String userId);

    /**
     * Overwrites the goal-derived counters. Streak days are left untouched.
     *
     * @return false if the user has no row
     */
    boolean replaceGoalCounters(String userId, int completedGoals, int completedMilestones, int totalPoints);

    /**
     * Atomically adds the deltas, flooring every counter at zero.
     *
     * @return false if the user has no row
     */
    boolean incrementCounters(String userId, StatDelta delta);

    /**
     * Writes the given ranks, keyed by user id, without touching any counter.
     */
    void updateRanks(Map<String, Integer> ranks);

    Optional<ParticipantStats> findByUserId(String userId);
    List<ParticipantStats> findByUserIds(Collection<String> userIds);

    /**
     * Every record in leaderboard order, best first.
     */
    List<ParticipantStats> findAllRanked();

    void deleteAll();
}
