package com.accountability.leaderboard.repository;

import com.accountability.leaderboard.model.Goal;

import java.util.List;

public interface GoalRepository {
    List<Goal> findCompletedByUserId(String userId);
}
