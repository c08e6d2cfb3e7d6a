package com.accountability.leaderboard.exception;

public class ParticipantNotFoundException extends LeaderboardException {
    public ParticipantNotFoundException(String userId) {
        super("User not found on the leaderboard: " + userId, "PARTICIPANT_NOT_FOUND");
    }
}
