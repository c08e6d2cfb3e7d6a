package com.accountability.leaderboard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardPage {
    private List<RankedParticipant> entries;
    private int currentPage;
    private long totalEntries;
    private int totalPages;
    private boolean cached;

    public static LeaderboardPage of(CachedLeaderboardPage page, boolean cached) {
        return LeaderboardPage.builder()
            .entries(page.getEntries())
            .currentPage(page.getCurrentPage())
            .totalEntries(page.getTotalEntries())
            .totalPages(page.getTotalPages())
            .cached(cached)
            .build();
    }
}
