package com.accountability.leaderboard.service;

import com.accountability.leaderboard.ranking.RankingEngine;
import com.accountability.leaderboard.repository.LeaderboardCacheRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RankRecalculationProcessor {
    
    private static final Logger logger = LoggerFactory.getLogger(RankRecalculationProcessor.class);
    
    private final RankingEngine rankingEngine;
    private final LeaderboardCacheRepository cacheRepository;
    private final String cachePrefix;
    
    @Autowired
    public RankRecalculationProcessor(
            RankingEngine rankingEngine,
            LeaderboardCacheRepository cacheRepository,
            @Value("${leaderboard.cache.prefix:leaderboard}") String cachePrefix) {
        this.rankingEngine = rankingEngine;
        this.cacheRepository = cacheRepository;
        this.cachePrefix = cachePrefix;
    }
    
    /**
     * Re-run a full rank pass whenever the last one failed or has not run yet.
     */
    @Scheduled(fixedDelayString = "${leaderboard.ranking.repair-interval-ms:30000}",
        initialDelayString = "${leaderboard.ranking.repair-initial-delay-ms:5000}")
    public void repairStaleRanks() {
        try {
            if (rankingEngine.recalculateIfStale()) {
                cacheRepository.invalidateAll(cachePrefix);
                logger.info("Stale leaderboard ranks repaired");
            }
        } catch (Exception e) {
            logger.error("Error repairing stale leaderboard ranks", e);
        }
    }
    
    /**
     * Pings the page cache so a lost or restored connection shows up in the logs.
     */
    @Scheduled(fixedDelayString = "${leaderboard.cache.health-check-interval-ms:60000}")
    public void checkCacheConnection() {
        if (!cacheRepository.isAvailable()) {
            logger.debug("Leaderboard cache unavailable, pages are served from the stats store");
        }
    }
}
