package com.accountability.leaderboard.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "participant_stats", indexes = {
    @Index(name = "idx_participant_stats_ranking",
        columnList = "total_points DESC,completed_goals DESC,completed_milestones DESC,streak_days DESC,user_id ASC"),
    @Index(name = "idx_participant_stats_rank", columnList = "leaderboard_rank")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantStats {
    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Builder.Default
    @Column(name = "completed_goals", nullable = false)
    private int completedGoals = 0;

    @Builder.Default
    @Column(name = "completed_milestones", nullable = false)
    private int completedMilestones = 0;

    @Builder.Default
    @Column(name = "total_points", nullable = false)
    private int totalPoints = 0;

    @Builder.Default
    @Column(name = "streak_days", nullable = false)
    private int streakDays = 0;

    @Column(name = "leaderboard_rank")
    private Integer rank;

    @Column(name = "created_at", nullable = false, updatable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
        clampAll();
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
        clampAll();
    }

    private void clampAll() {
        completedGoals = clamp(completedGoals);
        completedMilestones = clamp(completedMilestones);
        totalPoints = clamp(totalPoints);
        streakDays = clamp(streakDays);
    }

    /**
     * Floors a counter at zero and saturates at {@link Integer#MAX_VALUE}.
     */
    public static int clamp(long value) {
        if (value < 0) {
            return 0;
        }
        return value > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) value;
    }
}
