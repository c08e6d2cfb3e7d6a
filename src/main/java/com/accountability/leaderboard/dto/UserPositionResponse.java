package com.accountability.leaderboard.dto;

import com.accountability.leaderboard.model.RankedParticipant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserPositionResponse {
    private int userPosition;
    private RankedParticipant userEntry;
}
