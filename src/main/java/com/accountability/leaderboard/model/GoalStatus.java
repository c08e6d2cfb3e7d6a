package com.accountability.leaderboard.model;

public enum GoalStatus {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETED,
    ARCHIVED
}
