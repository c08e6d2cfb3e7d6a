package com.accountability.leaderboard.ranking;

import com.accountability.leaderboard.exception.InvalidRequestException;
import com.accountability.leaderboard.exception.RankRecalculationException;
import com.accountability.leaderboard.exception.StatsStoreException;
import com.accountability.leaderboard.model.ParticipantStats;
import com.accountability.leaderboard.repository.ParticipantStatsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Assigns dense 1-based ranks over all participant stats and keeps them current.
 *
 * <p>Ranks are materialized on the stats rows. A full pass ({@link #recalculateAll()}) re-sorts
 * everything; a single-participant change ({@link #reposition(String)}) moves that
 * participant inside the in-memory standings and rewrites only the rows whose position shifted.
 * Whenever a rank write fails the ranks are flagged stale, and the next trigger runs a full pass.
 */
@Component
public class RankingEngine {

    private static final Logger logger = LoggerFactory.getLogger(RankingEngine.class);

    private final ParticipantStatsRepository statsRepository;
    private final StandingsIndex standings = new StandingsIndex();
    // Serializes rank writes within this process
    private final ReentrantLock lock = new ReentrantLock();
    // Ranks persisted by an earlier process are not trusted until a full pass has run
    private final AtomicBoolean stale = new AtomicBoolean(true);

    @Autowired
    public RankingEngine(ParticipantStatsRepository statsRepository) {
        this.statsRepository = statsRepository;
    }

    /**
     * Re-sorts every participant and persists the ranks that changed.
     *
     * @return number of rows whose rank was written
     */
    public int recalculateAll() {
        lock.lock();
        try {
            List<ParticipantStats> ranked = loadRanked();
            Map<String, Integer> changed = new LinkedHashMap<>();
            for (int i = 0; i < ranked.size(); i++) {
                ParticipantStats stats = ranked.get(i);
                int rank = i + 1;
                if (!Objects.equals(stats.getRank(), rank)) {
                    changed.put(stats.getUserId(), rank);
                }
            }

            persistRanks(changed);
            standings.rebuild(ranked);
            stale.set(false);
            logger.info("Recalculated ranks for {} participants, {} rows updated", ranked.size(), changed.size());
            return changed.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves one participant to the position its stored counters earn and rewrites the ranks
     * of every participant between its old and new position. The counters are re-read under
     * the lock, so the latest write wins regardless of the order callers arrive in. Falls back
     * to a full pass when the in-memory standings cannot be trusted.
     *
     * @return number of rows whose rank was written
     */
    public int reposition(String userId) {
        lock.lock();
        try {
            if (stale.get() || !standings.isLoaded()) {
                logger.debug("Standings not current, running full rank recalculation for user {}", userId);
                return recalculateAll();
            }

            Optional<ParticipantStats> current = loadParticipant(userId);
            if (current.isEmpty()) {
                logger.debug("User {} no longer stored, running full rank recalculation", userId);
                return recalculateAll();
            }

            StandingsIndex.Shift shift = standings.upsert(current.get());
            List<String> affected = standings.userIdsBetween(shift.firstAffected(), shift.lastAffected(standings.size()));
            List<ParticipantStats> rows = loadRows(affected);

            Map<String, Integer> changed = new LinkedHashMap<>();
            for (ParticipantStats row : rows) {
                OptionalInt position = standings.positionOf(row.getUserId());
                if (position.isPresent() && !Objects.equals(row.getRank(), position.getAsInt())) {
                    changed.put(row.getUserId(), position.getAsInt());
                }
            }

            persistRanks(changed);
            logger.debug("Repositioned user {} from {} to {}, {} rank rows updated",
                userId, shift.oldPosition, shift.newPosition, changed.size());
            return changed.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs a full pass only if an earlier pass failed or never ran.
     *
     * @return true if a pass ran
     */
    public boolean recalculateIfStale() {
        if (!stale.get()) {
            return false;
        }
        recalculateAll();
        return true;
    }

    /**
     * Forgets every standing after the store was emptied.
     */
    public void reset() {
        lock.lock();
        try {
            standings.clear();
            stale.set(false);
        } finally {
            lock.unlock();
        }
    }

    public boolean isStale() {
        return stale.get();
    }

    /**
     * Current 1-based position of a participant, if the standings are trustworthy.
     */
    public OptionalInt positionOf(String userId) {
        lock.lock();
        try {
            if (stale.get() || !standings.isLoaded()) {
                return OptionalInt.empty();
            }
            return standings.positionOf(userId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cuts page {@code pageIndex} (1-based) of size {@code pageSize} out of an already ordered list.
     * A page past the end is empty, not an error.
     */
    public <T> PageSlice<T> computePage(List<T> sortedList, int pageIndex, int pageSize) {
        if (pageIndex < 1) {
            throw new InvalidRequestException("Page must be greater than 0");
        }
        if (pageSize < 1) {
            throw new InvalidRequestException("Limit must be greater than 0");
        }

        int totalEntries = sortedList.size();
        long from = (long) (pageIndex - 1) * pageSize;
        List<T> items;
        if (from >= totalEntries) {
            items = Collections.emptyList();
        } else {
            int to = (int) Math.min(from + pageSize, totalEntries);
            items = List.copyOf(sortedList.subList((int) from, to));
        }
        return new PageSlice<>(items, pageIndex, pageSize, totalEntries, PageSlice.totalPages(totalEntries, pageSize));
    }

    private List<ParticipantStats> loadRanked() {
        try {
            return statsRepository.findAllRanked();
        } catch (Exception e) {
            markStale();
            throw new StatsStoreException("Failed to load participant stats for ranking", e);
        }
    }

    private Optional<ParticipantStats> loadParticipant(String userId) {
        try {
            return statsRepository.findByUserId(userId);
        } catch (Exception e) {
            markStale();
            throw new RankRecalculationException("Failed to load participant " + userId + " for ranking", e);
        }
    }

    private List<ParticipantStats> loadRows(List<String> userIds) {
        try {
            return statsRepository.findByUserIds(userIds);
        } catch (Exception e) {
            markStale();
            throw new RankRecalculationException("Failed to load participants whose rank shifted", e);
        }
    }

    private void persistRanks(Map<String, Integer> changed) {
        if (changed.isEmpty()) {
            return;
        }
        try {
            statsRepository.updateRanks(changed);
        } catch (Exception e) {
            markStale();
            throw new RankRecalculationException("Failed to persist " + changed.size() + " rank updates", e);
        }
    }

    private void markStale() {
        stale.set(true);
        standings.invalidate();
        logger.warn("Ranks marked stale, a full recalculation will run on the next trigger");
    }
}
