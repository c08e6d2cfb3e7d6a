package com.accountability.leaderboard.service;

import com.accountability.leaderboard.exception.InvalidRequestException;
import com.accountability.leaderboard.exception.LeaderboardException;
import com.accountability.leaderboard.exception.ParticipantNotFoundException;
import com.accountability.leaderboard.exception.StatsStoreException;
import com.accountability.leaderboard.model.CachedLeaderboardPage;
import com.accountability.leaderboard.model.Goal;
import com.accountability.leaderboard.model.LeaderboardPage;
import com.accountability.leaderboard.model.ParticipantStats;
import com.accountability.leaderboard.model.RankedParticipant;
import com.accountability.leaderboard.model.StatDelta;
import com.accountability.leaderboard.model.UserPosition;
import com.accountability.leaderboard.ranking.PageSlice;
import com.accountability.leaderboard.ranking.RankingEngine;
import com.accountability.leaderboard.repository.GoalRepository;
import com.accountability.leaderboard.repository.LeaderboardCacheRepository;
import com.accountability.leaderboard.repository.ParticipantStatsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

@Service
public class LeaderboardService {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardService.class);

    private final ParticipantStatsRepository statsRepository;
    private final GoalRepository goalRepository;
    private final LeaderboardCacheRepository cacheRepository;
    private final RankingEngine rankingEngine;
    private final String cachePrefix;
    private final int cacheTtlSeconds;
    private final int maxPageSize;

    @Autowired
    public LeaderboardService(
            ParticipantStatsRepository statsRepository,
            GoalRepository goalRepository,
            LeaderboardCacheRepository cacheRepository,
            RankingEngine rankingEngine,
            @Value("${leaderboard.cache.prefix:leaderboard}") String cachePrefix,
            @Value("${leaderboard.cache.ttl-seconds:3600}") int cacheTtlSeconds,
            @Value("${leaderboard.pagination.max-limit:100}") int maxPageSize) {
        this.statsRepository = statsRepository;
        this.goalRepository = goalRepository;
        this.cacheRepository = cacheRepository;
        this.rankingEngine = rankingEngine;
        this.cachePrefix = cachePrefix;
        this.cacheTtlSeconds = cacheTtlSeconds;
        this.maxPageSize = maxPageSize;
    }

    /**
     * Get one page of the leaderboard.
     * Served from the page cache when possible; on a miss the page is built from the stats
     * store and cached together with its pagination totals.
     */
    public LeaderboardPage fetchPage(int pageSize, int pageIndex) {
        validatePageRequest(pageSize, pageIndex);
        Optional<String> key = cacheRepository.pageKey(cachePrefix, pageIndex, pageSize);

        if (key.isPresent()) {
            Optional<CachedLeaderboardPage> cached = cacheRepository.get(key.get());
            if (cached.isPresent()) {
                logger.debug("Leaderboard page served from cache: {}", key.get());
                return LeaderboardPage.of(cached.get(), true);
            }
        }

        CachedLeaderboardPage page = buildPage(pageSize, pageIndex);
        if (key.isPresent()) {
            cacheRepository.set(key.get(), page, cacheTtlSeconds);
            logger.debug("Leaderboard page built from store and cached: {} ({} of {} entries)",
                key.get(), page.getEntries().size(), page.getTotalEntries());
        } else {
            logger.debug("Cache generation unknown, page {} built from store without caching", pageIndex);
        }
        return LeaderboardPage.of(page, false);
    }

    private void validatePageRequest(int pageSize, int pageIndex) {
        if (pageSize <= 0) {
            throw new InvalidRequestException("Limit must be greater than 0");
        }
        if (pageSize > maxPageSize) {
            throw new InvalidRequestException("Limit cannot exceed " + maxPageSize);
        }
        if (pageIndex <= 0) {
            throw new InvalidRequestException("Page must be greater than 0");
        }
    }

    private CachedLeaderboardPage buildPage(int pageSize, int pageIndex) {
        List<ParticipantStats> ranked = readStore(statsRepository::findAllRanked, "load leaderboard");
        PageSlice<ParticipantStats> slice = rankingEngine.computePage(ranked, pageIndex, pageSize);

        List<RankedParticipant> entries = new ArrayList<>();
        long offset = slice.firstOffset();
        for (int i = 0; i < slice.getItems().size(); i++) {
            entries.add(RankedParticipant.from(slice.getItems().get(i), (int) (offset + i + 1)));
        }

        return CachedLeaderboardPage.builder()
            .entries(entries)
            .currentPage(slice.getCurrentPage())
            .pageSize(slice.getPageSize())
            .totalEntries(slice.getTotalEntries())
            .totalPages(slice.getTotalPages())
            .build();
    }

    /**
     * Get a user's 1-based position on the leaderboard.
     * Uses the materialized rank when ranks are current, otherwise scans the full ordering.
     */
    public UserPosition getUserPosition(String userId) {
        validateUserId(userId);
        ParticipantStats stats = readStore(() -> statsRepository.findByUserId(userId), "load participant")
            .orElseThrow(() -> new ParticipantNotFoundException(userId));

        if (!rankingEngine.isStale() && stats.getRank() != null) {
            return UserPosition.builder()
                .position(stats.getRank())
                .entry(RankedParticipant.from(stats, stats.getRank()))
                .build();
        }

        logger.debug("Ranks not current, scanning full leaderboard for user {}", userId);
        List<ParticipantStats> ranked = readStore(statsRepository::findAllRanked, "load leaderboard");
        for (int i = 0; i < ranked.size(); i++) {
            if (ranked.get(i).getUserId().equals(userId)) {
                return UserPosition.builder()
                    .position(i + 1)
                    .entry(RankedParticipant.from(ranked.get(i), i + 1))
                    .build();
            }
        }
        // Removed between the two reads
        throw new ParticipantNotFoundException(userId);
    }

    /**
     * Recompute a user's goal-derived counters from their completed goals and store them.
     * The counters are replaced, not incremented, so this is safe to call repeatedly.
     */
    public RankedParticipant updateForUser(String userId) {
        validateUserId(userId);
        List<Goal> completedGoals = readStore(() -> goalRepository.findCompletedByUserId(userId), "load completed goals");

        int goals = ParticipantStats.clamp(completedGoals.size());
        int milestones = ParticipantStats.clamp(completedGoals.stream().mapToLong(Goal::completedMilestoneCount).sum());
        int points = ParticipantStats.clamp(completedGoals.stream().mapToLong(Goal::pointsOrZero).sum());

        ParticipantStats saved = writeCounters(userId,
            () -> statsRepository.replaceGoalCounters(userId, goals, milestones, points));
        logger.info("Leaderboard stats replaced for user {}: goals={}, milestones={}, points={}",
            userId, saved.getCompletedGoals(), saved.getCompletedMilestones(), saved.getTotalPoints());

        return afterMutation(saved);
    }

    /**
     * Add signed deltas to a user's counters. Counters never drop below zero.
     * The increment runs in the store, so concurrent deltas for one user all land.
     */
    public RankedParticipant applyStatDelta(String userId, StatDelta delta) {
        validateUserId(userId);
        if (delta == null || delta.isEmpty()) {
            throw new InvalidRequestException("Stat delta must change at least one counter");
        }

        ParticipantStats saved = writeCounters(userId, () -> statsRepository.incrementCounters(userId, delta));
        logger.info("Leaderboard stats adjusted for user {} by {}", userId, delta);

        return afterMutation(saved);
    }

    /**
     * Recompute every rank and drop all cached pages.
     *
     * @return number of rank rows written
     */
    public int recalculateRanks() {
        int updated = rankingEngine.recalculateAll();
        cacheRepository.invalidateAll(cachePrefix);
        return updated;
    }

    /**
     * Delete every participant's stats and drop all cached pages.
     */
    public void resetAll() {
        try {
            statsRepository.deleteAll();
        } catch (DataAccessException e) {
            throw new StatsStoreException("Failed to reset leaderboard", e);
        }
        rankingEngine.reset();
        cacheRepository.invalidateAll(cachePrefix);
        logger.info("Leaderboard reset, all participant stats deleted");
    }

    private ParticipantStats writeCounters(String userId, BooleanSupplier update) {
        try {
            if (!update.getAsBoolean()) {
                if (statsRepository.createIfAbsent(userId)) {
                    logger.debug("Created stats row for user {}", userId);
                }
                if (!update.getAsBoolean()) {
                    throw new StatsStoreException("Stats row for user " + userId + " disappeared during update");
                }
            }
        } catch (DataAccessException e) {
            throw new StatsStoreException("Failed to save stats for user " + userId, e);
        }

        return readStore(() -> statsRepository.findByUserId(userId), "reload participant")
            .orElseThrow(() -> new StatsStoreException("Stats row for user " + userId + " disappeared during update"));
    }

    private RankedParticipant afterMutation(ParticipantStats saved) {
        String userId = saved.getUserId();
        refreshRanks(userId);
        cacheRepository.invalidateAll(cachePrefix);

        OptionalInt position = rankingEngine.positionOf(userId);
        ParticipantStats current = readStore(() -> statsRepository.findByUserId(userId), "reload participant")
            .orElse(saved);
        return RankedParticipant.from(current, position.isPresent() ? position.getAsInt() : current.getRank());
    }

    private void refreshRanks(String userId) {
        try {
            int written = rankingEngine.reposition(userId);
            logger.debug("Rank refresh after update of user {} wrote {} rows", userId, written);
        } catch (LeaderboardException e) {
            // Stats are stored; ranks stay flagged stale until the repair job succeeds
            logger.warn("Rank refresh failed after update of user {}: {}", userId, e.getMessage());
        }
    }

    private void validateUserId(String userId) {
        if (userId == null || userId.trim().isEmpty()) {
            throw new InvalidRequestException("User ID is required");
        }
    }

    private <T> T readStore(Supplier<T> read, String operation) {
        try {
            return read.get();
        } catch (DataAccessException e) {
            throw new StatsStoreException("Failed to " + operation, e);
        }
    }
}
