package com.accountability.leaderboard.controller;

import com.accountability.leaderboard.dto.OperationResponse;
import com.accountability.leaderboard.dto.StatAdjustmentRequest;
import com.accountability.leaderboard.dto.UpdatePointsRequest;
import com.accountability.leaderboard.model.RankedParticipant;
import com.accountability.leaderboard.service.LeaderboardService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

/**
 * Administrative leaderboard operations. Every endpoint requires the admin role.
 */
@RestController
@RequestMapping("/api/leaderboard")
public class LeaderboardAdminController {
    
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardAdminController.class);
    
    private final LeaderboardService leaderboardService;
    
    @Autowired
    public LeaderboardAdminController(LeaderboardService leaderboardService) {
        this.leaderboardService = leaderboardService;
    }
    
    /**
     * Delete every participant's stats.
     * DELETE /api/leaderboard/reset
     */
    @DeleteMapping("/reset")
    public ResponseEntity<OperationResponse> resetLeaderboard(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @RequestHeader(value = CallerHeaders.USER_ROLES, required = false) String roles) {
        
        CallerHeaders.requireAdmin(userId, roles);
        leaderboardService.resetAll();
        logger.info("Leaderboard reset by admin: {}", userId);
        
        return ResponseEntity.ok(OperationResponse.builder()
            .success(true)
            .message("Leaderboard reset successfully")
            .timestamp(Instant.now())
            .build());
    }
    
    /**
     * Recompute a user's stats from their completed goals.
     * POST /api/leaderboard/update-points
     */
    @PostMapping("/update-points")
    public ResponseEntity<OperationResponse> updatePoints(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @RequestHeader(value = CallerHeaders.USER_ROLES, required = false) String roles,
            @Valid @RequestBody UpdatePointsRequest request) {
        
        CallerHeaders.requireAdmin(userId, roles);
        logger.info("Admin {} requested leaderboard update for user {}", userId, request.getUserId());
        
        RankedParticipant entry = leaderboardService.updateForUser(request.getUserId());
        
        return ResponseEntity.ok(OperationResponse.builder()
            .success(true)
            .message("Leaderboard updated successfully.")
            .entry(entry)
            .timestamp(Instant.now())
            .build());
    }
    
    /**
     * Adjust a user's counters by signed amounts.
     * PATCH /api/leaderboard/users/{targetUserId}/stats
     */
    @PatchMapping("/users/{targetUserId}/stats")
    public ResponseEntity<OperationResponse> adjustStats(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @RequestHeader(value = CallerHeaders.USER_ROLES, required = false) String roles,
            @PathVariable String targetUserId,
            @RequestBody StatAdjustmentRequest request) {
        
        CallerHeaders.requireAdmin(userId, roles);
        logger.info("Admin {} adjusting leaderboard stats for user {}: {}", userId, targetUserId, request);
        
        RankedParticipant entry = leaderboardService.applyStatDelta(targetUserId, request.toDelta());
        
        return ResponseEntity.ok(OperationResponse.builder()
            .success(true)
            .message("Leaderboard stats adjusted.")
            .entry(entry)
            .timestamp(Instant.now())
            .build());
    }
    
    /**
     * Recompute every rank.
     * POST /api/leaderboard/recalculate
     */
    @PostMapping("/recalculate")
    public ResponseEntity<OperationResponse> recalculate(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId,
            @RequestHeader(value = CallerHeaders.USER_ROLES, required = false) String roles) {
        
        CallerHeaders.requireAdmin(userId, roles);
        int updated = leaderboardService.recalculateRanks();
        logger.info("Leaderboard ranks recalculated by admin {}: {} rows updated", userId, updated);
        
        return ResponseEntity.ok(OperationResponse.builder()
            .success(true)
            .message("Leaderboard ranks recalculated.")
            .updatedRanks(updated)
            .timestamp(Instant.now())
            .build());
    }
}
