package com.accountability.leaderboard.repository.impl;

import com.accountability.leaderboard.model.ParticipantStats;
import com.accountability.leaderboard.model.StatDelta;
import com.accountability.leaderboard.ranking.RankingOrder;
import com.accountability.leaderboard.repository.ParticipantStatsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@Primary
public class ParticipantStatsRepositoryAdapter implements ParticipantStatsRepository {

    private static final Logger logger = LoggerFactory.getLogger(ParticipantStatsRepositoryAdapter.class);

    private final JpaParticipantStatsRepository jpaRepository;

    @Autowired
    public ParticipantStatsRepositoryAdapter(JpaParticipantStatsRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public boolean createIfAbsent(String userId) {
        if (jpaRepository.existsById(userId)) {
            return false;
        }
        try {
            return jpaRepository.insertEmpty(userId, Instant.now()) == 1;
        } catch (DataIntegrityViolationException e) {
            // Another request inserted the row in between
            logger.debug("Stats row for user {} created concurrently", userId);
            return false;
        }
    }

    @Override
    public boolean replaceGoalCounters(String userId, int completedGoals, int completedMilestones, int totalPoints) {
        return jpaRepository.replaceGoalCounters(userId, completedGoals, completedMilestones, totalPoints,
            Instant.now()) == 1;
    }

    @Override
    public boolean incrementCounters(String userId, StatDelta delta) {
        return jpaRepository.incrementCounters(userId, delta.getCompletedGoals(), delta.getCompletedMilestones(),
            delta.getTotalPoints(), delta.getStreakDays(), Instant.now()) == 1;
    }

    @Override
    @Transactional
    public void updateRanks(Map<String, Integer> ranks) {
        for (Map.Entry<String, Integer> entry : ranks.entrySet()) {
            jpaRepository.updateRank(entry.getKey(), entry.getValue());
        }
    }

    @Override
    public Optional<ParticipantStats> findByUserId(String userId) {
        return jpaRepository.findById(userId);
    }

    @Override
    public List<ParticipantStats> findByUserIds(Collection<String> userIds) {
        if (userIds.isEmpty()) {
            return Collections.emptyList();
        }
        return jpaRepository.findByUserIdIn(userIds);
    }

    @Override
    public List<ParticipantStats> findAllRanked() {
        // The database collation may order user ids differently than String.compareTo
        List<ParticipantStats> ranked = new ArrayList<>(jpaRepository.findAll(RankingOrder.STORE_SORT));
        ranked.sort(RankingOrder.COMPARATOR);
        return ranked;
    }

    @Override
    public void deleteAll() {
        jpaRepository.deleteAllInBatch();
    }
}
