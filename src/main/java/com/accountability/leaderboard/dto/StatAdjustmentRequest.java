package com.accountability.leaderboard.dto;

import com.accountability.leaderboard.model.StatDelta;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Signed counter adjustments; omitted fields default to 0.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatAdjustmentRequest {
    private int completedGoals;
    private int completedMilestones;
    private int totalPoints;
    private int streakDays;

    public StatDelta toDelta() {
        return StatDelta.builder()
            .completedGoals(completedGoals)
            .completedMilestones(completedMilestones)
            .totalPoints(totalPoints)
            .streakDays(streakDays)
            .build();
    }
}
