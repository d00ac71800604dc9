package uk.gegc.examinsight.features.performance.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.examinsight.features.performance.api.dto.*;
import uk.gegc.examinsight.features.performance.application.PerformanceQueryService;

import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PerformanceController.class)
@DisplayName("PerformanceController Tests")
class PerformanceControllerTest {

    private static final String USER_ID = "9d8c7b6a-5f4e-4d3c-8b2a-1f0e9d8c7b6a";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PerformanceQueryService performanceQueryService;

    @Test
    @WithMockUser(username = USER_ID)
    @DisplayName("GET /api/v1/performance/me returns the snapshot")
    void getMyPerformance_Ok() throws Exception {
        // Given
        TopicPerformance weak = new TopicPerformance("graphs", 1, 4, 25.0);
        PerformanceSnapshot snapshot = new PerformanceSnapshot(
                3, 66.7, 100.0, 900, 1, 2, 200, 1,
                List.of(weak),
                new DifficultyBreakdown(DifficultyStats.EMPTY, new DifficultyStats(3, 4, 75.0), DifficultyStats.EMPTY),
                List.of(),
                new TimingAnalysis(30.0, null, null),
                List.of(weak),
                List.of(),
                List.of(),
                List.of());
        when(performanceQueryService.getUserPerformance(UUID.fromString(USER_ID))).thenReturn(snapshot);

        // When & Then
        mockMvc.perform(get("/api/v1/performance/me"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalExams").value(3))
                .andExpect(jsonPath("$.longestStreak").value(2))
                .andExpect(jsonPath("$.difficultyAnalysis.medium.accuracy").value(75.0))
                .andExpect(jsonPath("$.improvementAreas[0].topic").value("graphs"))
                .andExpect(jsonPath("$.timeAnalysis.averageTimePerQuestion").value(30.0));
    }
}
