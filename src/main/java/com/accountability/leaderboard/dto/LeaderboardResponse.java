package com.accountability.leaderboard.dto;

import com.accountability.leaderboard.model.RankedParticipant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardResponse {
    private List<RankedParticipant> leaderboard;
    private PaginationInfo pagination;
    private boolean cached;
}
