package com.accountability.leaderboard.repository;

import com.accountability.leaderboard.model.CachedLeaderboardPage;

import java.util.Optional;

/**
 * Non-authoritative store for rendered leaderboard pages.
 * Implementations never throw: an unreachable cache behaves like an empty one.
 */
public interface LeaderboardCacheRepository {
    Optional<CachedLeaderboardPage> get(String key);
    void set(String key, CachedLeaderboardPage page, int ttlSeconds);
    void invalidateAll(String prefix);

    /**
     * Key for one page under the current invalidation generation, or empty when the generation
     * cannot be read. Callers must bypass the cache for an empty key.
     */
    Optional<String> pageKey(String prefix, int pageIndex, int pageSize);

    boolean isAvailable();
}
