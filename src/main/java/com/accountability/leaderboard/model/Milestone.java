package com.accountability.leaderboard.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Milestone {
    @Column(name = "title")
    private String title;

    @Column(name = "completed", nullable = false)
    private boolean completed;
}
