package com.accountability.leaderboard.controller;

import com.accountability.leaderboard.dto.LeaderboardResponse;
import com.accountability.leaderboard.dto.PaginationInfo;
import com.accountability.leaderboard.dto.UserPositionResponse;
import com.accountability.leaderboard.model.LeaderboardPage;
import com.accountability.leaderboard.model.UserPosition;
import com.accountability.leaderboard.service.LeaderboardService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/leaderboard")
public class LeaderboardController {
    
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardController.class);
    
    private final LeaderboardService leaderboardService;
    
    @Autowired
    public LeaderboardController(LeaderboardService leaderboardService) {
        this.leaderboardService = leaderboardService;
    }
    
    /**
     * Get one page of the leaderboard.
     * GET /api/leaderboard?limit=10&page=1
     */
    @GetMapping
    public ResponseEntity<LeaderboardResponse> getLeaderboard(
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(defaultValue = "1") int page) {
        
        LeaderboardPage result = leaderboardService.fetchPage(limit, page);
        
        LeaderboardResponse response = LeaderboardResponse.builder()
            .leaderboard(result.getEntries())
            .pagination(PaginationInfo.builder()
                .totalEntries(result.getTotalEntries())
                .currentPage(result.getCurrentPage())
                .totalPages(result.getTotalPages())
                .build())
            .cached(result.isCached())
            .build();
        
        logger.info("Leaderboard page {} (limit {}) fetched {} - returned {} of {} entries",
            page, limit, result.isCached() ? "from cache" : "from store",
            result.getEntries().size(), result.getTotalEntries());
        
        return ResponseEntity.ok(response);
    }
    
    /**
     * Get the calling user's leaderboard position.
     * GET /api/leaderboard/user-position
     */
    @GetMapping("/user-position")
    public ResponseEntity<UserPositionResponse> getUserPosition(
            @RequestHeader(value = CallerHeaders.USER_ID, required = false) String userId) {
        
        String caller = CallerHeaders.requireUserId(userId);
        UserPosition position = leaderboardService.getUserPosition(caller);
        
        logger.info("Leaderboard position fetched for user {}: {}", caller, position.getPosition());
        
        return ResponseEntity.ok(UserPositionResponse.builder()
            .userPosition(position.getPosition())
            .userEntry(position.getEntry())
            .build());
    }
}
