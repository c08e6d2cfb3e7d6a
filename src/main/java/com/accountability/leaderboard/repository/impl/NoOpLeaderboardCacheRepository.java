package com.accountability.leaderboard.repository.impl;

import com.accountability.leaderboard.model.CachedLeaderboardPage;
import com.accountability.leaderboard.repository.LeaderboardCacheRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Used when {@code leaderboard.cache.enabled=false}: every read misses and every write is dropped.
 */
@Repository
@ConditionalOnProperty(name = "leaderboard.cache.enabled", havingValue = "false")
public class NoOpLeaderboardCacheRepository implements LeaderboardCacheRepository {

    private static final Logger logger = LoggerFactory.getLogger(NoOpLeaderboardCacheRepository.class);

    public NoOpLeaderboardCacheRepository() {
        logger.info("Leaderboard cache disabled, pages are always read from the stats store");
    }

    @Override
    public Optional<CachedLeaderboardPage> get(String key) {
        return Optional.empty();
    }

    @Override
    public void set(String key, CachedLeaderboardPage page, int ttlSeconds) {
    }

    @Override
    public void invalidateAll(String prefix) {
    }

    @Override
    public Optional<String> pageKey(String prefix, int pageIndex, int pageSize) {
        return Optional.empty();
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
