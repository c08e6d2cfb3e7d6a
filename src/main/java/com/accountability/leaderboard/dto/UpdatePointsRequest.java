package com.accountability.leaderboard.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePointsRequest {
    @NotBlank(message = "User ID is required")
    private String userId;
}
