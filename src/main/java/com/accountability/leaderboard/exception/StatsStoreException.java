package com.accountability.leaderboard.exception;

/**
 * The authoritative stats store could not complete a read or write.
 */
public class StatsStoreException extends LeaderboardException {
    public StatsStoreException(String message) {
        super(message, "STATS_STORE_ERROR");
    }

    public StatsStoreException(String message, Throwable cause) {
        super(message, "STATS_STORE_ERROR", cause);
    }
}
