package com.accountability.leaderboard.repository.impl;

import com.accountability.leaderboard.model.ParticipantStats;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface JpaParticipantStatsRepository extends JpaRepository<ParticipantStats, String> {
    List<ParticipantStats> findByUserIdIn(Collection<String> userIds);

    @Modifying
    @Transactional
    @Query(value = "INSERT INTO participant_stats "
        + "(user_id, completed_goals, completed_milestones, total_points, streak_days, created_at, updated_at) "
        + "VALUES (:userId, 0, 0, 0, 0, :now, :now)", nativeQuery = true)
    int insertEmpty(@Param("userId") String userId, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE ParticipantStats s SET s.completedGoals = :goals, s.completedMilestones = :milestones, "
        + "s.totalPoints = :points, s.updatedAt = :now WHERE s.userId = :userId")
    int replaceGoalCounters(@Param("userId") String userId, @Param("goals") int goals,
                            @Param("milestones") int milestones, @Param("points") int points,
                            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE ParticipantStats s SET "
        + "s.completedGoals = CASE WHEN s.completedGoals + :goals < 0 THEN 0 ELSE s.completedGoals + :goals END, "
        + "s.completedMilestones = CASE WHEN s.completedMilestones + :milestones < 0 THEN 0 "
        + "ELSE s.completedMilestones + :milestones END, "
        + "s.totalPoints = CASE WHEN s.totalPoints + :points < 0 THEN 0 ELSE s.totalPoints + :points END, "
        + "s.streakDays = CASE WHEN s.streakDays + :streak < 0 THEN 0 ELSE s.streakDays + :streak END, "
        + "s.updatedAt = :now WHERE s.userId = :userId")
    int incrementCounters(@Param("userId") String userId, @Param("goals") int goals,
                          @Param("milestones") int milestones, @Param("points") int points,
                          @Param("streak") int streak, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE ParticipantStats s SET s.rank = :rank WHERE s.userId = :userId")
    int updateRank(@Param("userId") String userId, @Param("rank") Integer rank);
}
