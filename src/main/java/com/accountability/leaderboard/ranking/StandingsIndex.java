package com.accountability.leaderboard.ranking;

import com.accountability.leaderboard.model.ParticipantStats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * In-memory ordered view of every participant's score tuple.
 * Positions are found by binary search, so a single participant can be moved without
 * re-sorting everybody. Not thread-safe; {@link RankingEngine} serializes access.
 */
class StandingsIndex {

    private final List<Standing> ordered = new ArrayList<>();
    private final Map<String, Standing> byUser = new HashMap<>();
    private boolean loaded;

    void rebuild(List<ParticipantStats> stats) {
        ordered.clear();
        byUser.clear();
        for (ParticipantStats s : stats) {
            Standing standing = Standing.of(s);
            ordered.add(standing);
            byUser.put(standing.userId, standing);
        }
        ordered.sort(Standing.ORDER);
        loaded = true;
    }

    /**
     * Empties the index while keeping it authoritative, matching an empty store.
     */
    void clear() {
        ordered.clear();
        byUser.clear();
        loaded = true;
    }

    /**
     * Drops the index contents; the next use must rebuild it from the store.
     */
    void invalidate() {
        ordered.clear();
        byUser.clear();
        loaded = false;
    }

    boolean isLoaded() {
        return loaded;
    }

    int size() {
        return ordered.size();
    }

    /**
     * Inserts or moves one participant.
     */
    Shift upsert(ParticipantStats stats) {
        Standing previous = byUser.get(stats.getUserId());
        int oldPosition = 0;
        if (previous != null) {
            int index = Collections.binarySearch(ordered, previous, Standing.ORDER);
            oldPosition = index + 1;
            ordered.remove(index);
        }

        Standing current = Standing.of(stats);
        int insertAt = -(Collections.binarySearch(ordered, current, Standing.ORDER)) - 1;
        ordered.add(insertAt, current);
        byUser.put(current.userId, current);
        return new Shift(oldPosition, insertAt + 1);
    }

    OptionalInt positionOf(String userId) {
        Standing standing = byUser.get(userId);
        if (standing == null) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Collections.binarySearch(ordered, standing, Standing.ORDER) + 1);
    }

    /**
     * User ids holding positions {@code from..to}, both inclusive and 1-based.
     */
    List<String> userIdsBetween(int from, int to) {
        List<String> ids = new ArrayList<>();
        int last = Math.min(to, ordered.size());
        for (int position = Math.max(from, 1); position <= last; position++) {
            ids.add(ordered.get(position - 1).userId);
        }
        return ids;
    }

    /**
     * Positions before and after a single-participant move. An old position of 0 means the
     * participant was not in the index.
     */
    static final class Shift {
        final int oldPosition;
        final int newPosition;

        Shift(int oldPosition, int newPosition) {
            this.oldPosition = oldPosition;
            this.newPosition = newPosition;
        }

        boolean isInsert() {
            return oldPosition == 0;
        }

        int firstAffected() {
            return isInsert() ? newPosition : Math.min(oldPosition, newPosition);
        }

        /**
         * An insert pushes every participant below it down by one.
         */
        int lastAffected(int size) {
            return isInsert() ? size : Math.max(oldPosition, newPosition);
        }
    }

    private static final class Standing {
        static final Comparator<Standing> ORDER = Comparator
            .comparingInt((Standing s) -> s.totalPoints).reversed()
            .thenComparing(Comparator.comparingInt((Standing s) -> s.completedGoals).reversed())
            .thenComparing(Comparator.comparingInt((Standing s) -> s.completedMilestones).reversed())
            .thenComparing(Comparator.comparingInt((Standing s) -> s.streakDays).reversed())
            .thenComparing(s -> s.userId);

        final String userId;
        final int totalPoints;
        final int completedGoals;
        final int completedMilestones;
        final int streakDays;

        private Standing(String userId, int totalPoints, int completedGoals, int completedMilestones, int streakDays) {
            this.userId = userId;
            this.totalPoints = totalPoints;
            this.completedGoals = completedGoals;
            this.completedMilestones = completedMilestones;
            this.streakDays = streakDays;
        }

        static Standing of(ParticipantStats stats) {
            return new Standing(stats.getUserId(), stats.getTotalPoints(), stats.getCompletedGoals(),
                stats.getCompletedMilestones(), stats.getStreakDays());
        }
    }
}
