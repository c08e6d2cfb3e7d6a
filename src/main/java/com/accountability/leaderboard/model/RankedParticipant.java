package com.accountability.leaderboard.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Leaderboard row as served to clients and stored in the page cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedParticipant {
    private String userId;
    private Integer rank;
    private Integer position;
    private int completedGoals;
    private int completedMilestones;
    private int totalPoints;
    private int streakDays;
    private String rankDescription;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant updatedAt;

    public static RankedParticipant from(ParticipantStats stats, Integer position) {
        return RankedParticipant.builder()
            .userId(stats.getUserId())
            .rank(stats.getRank())
            .position(position)
            .completedGoals(stats.getCompletedGoals())
            .completedMilestones(stats.getCompletedMilestones())
            .totalPoints(stats.getTotalPoints())
            .streakDays(stats.getStreakDays())
            .rankDescription(describeRank(stats.getRank()))
            .updatedAt(stats.getUpdatedAt())
            .build();
    }

    public static String describeRank(Integer rank) {
        if (rank == null) {
            return "Unranked";
        }
        switch (rank) {
            case 1:
                return "Champion";
            case 2:
                return "Runner-up";
            case 3:
                return "Third Place";
            default:
                return "Rank " + rank;
        }
    }
}
