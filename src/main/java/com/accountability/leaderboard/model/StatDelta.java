package com.accountability.leaderboard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Signed increments applied to a participant's counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatDelta {
    private int completedGoals;
    private int completedMilestones;
    private int totalPoints;
    private int streakDays;

    public boolean isEmpty() {
        return completedGoals == 0 && completedMilestones == 0 && totalPoints == 0 && streakDays == 0;
    }
}
