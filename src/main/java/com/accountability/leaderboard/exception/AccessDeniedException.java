package com.accountability.leaderboard.exception;

public class AccessDeniedException extends LeaderboardException {
    public AccessDeniedException(String message) {
        super(message, "ACCESS_DENIED");
    }
}
