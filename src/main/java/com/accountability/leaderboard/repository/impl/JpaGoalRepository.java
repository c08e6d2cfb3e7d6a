package com.accountability.leaderboard.repository.impl;

import com.accountability.leaderboard.model.Goal;
import com.accountability.leaderboard.model.GoalStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JpaGoalRepository extends JpaRepository<Goal, Long> {
    List<Goal> findByUserIdAndStatus(String userId, GoalStatus status);
}
