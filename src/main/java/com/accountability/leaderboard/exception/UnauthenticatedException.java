package com.accountability.leaderboard.exception;

public class UnauthenticatedException extends LeaderboardException {
    public UnauthenticatedException(String message) {
        super(message, "UNAUTHENTICATED");
    }
}
