package com.accountability.leaderboard.controller;

import com.accountability.leaderboard.exception.GlobalExceptionHandler;
import com.accountability.leaderboard.model.RankedParticipant;
import com.accountability.leaderboard.model.StatDelta;
import com.accountability.leaderboard.service.LeaderboardService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class LeaderboardAdminControllerTest {

    @Mock
    private LeaderboardService leaderboardService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new LeaderboardAdminController(leaderboardService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void testReset_Success() throws Exception {
        // Act & Assert
        mockMvc.perform(delete("/api/leaderboard/reset")
                .header("X-User-Id", "admin-1")
                .header("X-User-Roles", "member, Admin"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.message").value("Leaderboard reset successfully"));
        verify(leaderboardService).resetAll();
    }

    @Test
    void testReset_Unauthenticated() throws Exception {
        // Act & Assert
        mockMvc.perform(delete("/api/leaderboard/reset").header("X-User-Roles", "admin"))
            .andExpect(status().isUnauthorized());
        verifyNoInteractions(leaderboardService);
    }

    @Test
    void testReset_NotAdmin() throws Exception {
        // Act & Assert
        mockMvc.perform(delete("/api/leaderboard/reset")
                .header("X-User-Id", "user-1")
                .header("X-User-Roles", "member"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.errorCode").value("ACCESS_DENIED"));
        verifyNoInteractions(leaderboardService);
    }

    @Test
    void testUpdatePoints_Success() throws Exception {
        // Arrange
        RankedParticipant entry = RankedParticipant.builder()
            .userId("user-7").rank(2).position(2).completedGoals(2).completedMilestones(1).totalPoints(30)
            .rankDescription("Runner-up").build();
        when(leaderboardService.updateForUser("user-7")).thenReturn(entry);

        // Act & Assert
        mockMvc.perform(post("/api/leaderboard/update-points")
                .header("X-User-Id", "admin-1")
                .header("X-User-Roles", "admin")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":\"user-7\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.message").value("Leaderboard updated successfully."))
            .andExpect(jsonPath("$.entry.totalPoints").value(30))
            .andExpect(jsonPath("$.entry.completedGoals").value(2))
            .andExpect(jsonPath("$.updatedRanks").doesNotExist());
    }

    @Test
    void testUpdatePoints_MissingUserId() throws Exception {
        // Act & Assert
        mockMvc.perform(post("/api/leaderboard/update-points")
                .header("X-User-Id", "admin-1")
                .header("X-User-Roles", "admin")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("User ID is required"));
        verifyNoInteractions(leaderboardService);
    }

    @Test
    void testUpdatePoints_MalformedBody() throws Exception {
        // Act & Assert
        mockMvc.perform(post("/api/leaderboard/update-points")
                .header("X-User-Id", "admin-1")
                .header("X-User-Roles", "admin")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"));
    }

    @Test
    void testAdjustStats_PassesSignedDelta() throws Exception {
        // Arrange
        when(leaderboardService.applyStatDelta(eq("user-4"), any(StatDelta.class)))
            .thenReturn(RankedParticipant.builder().userId("user-4").streakDays(6).build());

        // Act & Assert
        mockMvc.perform(patch("/api/leaderboard/users/user-4/stats")
                .header("X-User-Id", "admin-1")
                .header("X-User-Roles", "admin")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"totalPoints\":-5,\"streakDays\":1}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.entry.streakDays").value(6));

        ArgumentCaptor<StatDelta> captor = ArgumentCaptor.forClass(StatDelta.class);
        verify(leaderboardService).applyStatDelta(eq("user-4"), captor.capture());
        assertEquals(-5, captor.getValue().getTotalPoints());
        assertEquals(1, captor.getValue().getStreakDays());
        assertEquals(0, captor.getValue().getCompletedGoals());
    }

    @Test
    void testRecalculate_ReportsUpdatedRanks() throws Exception {
        // Arrange
        when(leaderboardService.recalculateRanks()).thenReturn(17);

        // Act & Assert
        mockMvc.perform(post("/api/leaderboard/recalculate")
                .header("X-User-Id", "admin-1")
                .header("X-User-Roles", "admin"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.updatedRanks").value(17))
            .andExpect(jsonPath("$.entry").doesNotExist());
    }
}
