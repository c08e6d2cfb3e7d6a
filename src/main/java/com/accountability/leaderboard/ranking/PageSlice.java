package com.accountability.leaderboard.ranking;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * A 1-based page cut from an ordered list, with the totals of the whole list.
 */
@Data
@AllArgsConstructor
public class PageSlice<T> {
    private final List<T> items;
    private final int currentPage;
    private final int pageSize;
    private final long totalEntries;
    private final int totalPages;

    /**
     * Offset of the first item of this page within the full ordering.
     */
    public long firstOffset() {
        return (long) (currentPage - 1) * pageSize;
    }

    public static int totalPages(long totalEntries, int pageSize) {
        return (int) ((totalEntries + pageSize - 1) / pageSize);
    }
}
