package com.accountability.leaderboard.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * One leaderboard page together with the pagination totals computed at the same time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedLeaderboardPage {
    private List<RankedParticipant> entries;
    private int currentPage;
    private int pageSize;
    private long totalEntries;
    private int totalPages;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant cachedAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant expiresAt;

    /**
     * A page past its expiry is a miss even if the backing store still holds it.
     */
    public boolean isExpiredAt(Instant now) {
        return expiresAt == null || !now.isBefore(expiresAt);
    }
}
