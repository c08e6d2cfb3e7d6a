package com.accountability.leaderboard.repository.impl;

import com.accountability.leaderboard.model.Goal;
import com.accountability.leaderboard.model.GoalStatus;
import com.accountability.leaderboard.repository.GoalRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@Primary
public class GoalRepositoryAdapter implements GoalRepository {
    
    private final JpaGoalRepository jpaRepository;
    
    @Autowired
    public GoalRepositoryAdapter(JpaGoalRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public List<Goal> findCompletedByUserId(String userId) {
        return jpaRepository.findByUserIdAndStatus(userId, GoalStatus.COMPLETED);
    }
}
