package com.accountability.leaderboard.exception;

/**
 * Thrown when ranks could not be fully persisted. Ranks written before the failure are kept
 * and the next successful recomputation overwrites them.
 */
public class RankRecalculationException extends LeaderboardException {
    public RankRecalculationException(String message, Throwable cause) {
        super(message, "RANK_RECALCULATION_FAILED", cause);
    }
}
