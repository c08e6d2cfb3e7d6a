package com.accountability.leaderboard.ranking;

import com.accountability.leaderboard.model.ParticipantStats;
import org.springframework.data.domain.Sort;

import java.util.Comparator;

/**
 * The leaderboard total order: points, then goals, then milestones, then streak, all descending,
 * with the user id ascending as the final tie-break.
 * The in-memory comparator and the store sort must stay identical.
 */
public final class RankingOrder {

    public static final Comparator<ParticipantStats> COMPARATOR = Comparator
        .comparingInt(ParticipantStats::getTotalPoints).reversed()
        .thenComparing(Comparator.comparingInt(ParticipantStats::getCompletedGoals).reversed())
        .thenComparing(Comparator.comparingInt(ParticipantStats::getCompletedMilestones).reversed())
        .thenComparing(Comparator.comparingInt(ParticipantStats::getStreakDays).reversed())
        .thenComparing(ParticipantStats::getUserId);

    public static final Sort STORE_SORT = Sort.by(
        Sort.Order.desc("totalPoints"),
        Sort.Order.desc("completedGoals"),
        Sort.Order.desc("completedMilestones"),
        Sort.Order.desc("streakDays"),
        Sort.Order.asc("userId"));

    private RankingOrder() {
    }
}
