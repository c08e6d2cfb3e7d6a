package com.accountability.leaderboard.controller;

import com.accountability.leaderboard.exception.AccessDeniedException;
import com.accountability.leaderboard.exception.UnauthenticatedException;

import java.util.Arrays;

/**
 * Caller identity as forwarded by the API gateway, which has already authenticated the request.
 */
final class CallerHeaders {

    static final String USER_ID = "X-User-Id";
    static final String USER_ROLES = "X-User-Roles";
    static final String ADMIN_ROLE = "admin";

    private CallerHeaders() {
    }

    static String requireUserId(String userId) {
        if (userId == null || userId.trim().isEmpty()) {
            throw new UnauthenticatedException("Unauthorized access");
        }
        return userId.trim();
    }

    static void requireAdmin(String userId, String roles) {
        requireUserId(userId);
        boolean admin = roles != null && Arrays.stream(roles.split(","))
            .map(String::trim)
            .anyMatch(ADMIN_ROLE::equalsIgnoreCase);
        if (!admin) {
            throw new AccessDeniedException("Access denied");
        }
    }
}
