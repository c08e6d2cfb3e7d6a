package com.accountability.leaderboard.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of a goal owned by the goal management module.
 * Only the fields the leaderboard aggregates over are mapped.
 */
@Entity
@Table(name = "goals", indexes = {
    @Index(name = "idx_goal_user_status", columnList = "user_id,status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Goal {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "title")
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private GoalStatus status;

    @Column(name = "points")
    private Integer points;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "goal_milestones", joinColumns = @JoinColumn(name = "goal_id"))
    private List<Milestone> milestones = new ArrayList<>();

    public int pointsOrZero() {
        return points != null ? points : 0;
    }

    public int completedMilestoneCount() {
        if (milestones == null) {
            return 0;
        }
        return (int) milestones.stream()
            .filter(m -> m != null && m.isCompleted())
            .count();
    }
}
