package uk.gegc.examinsight.features.attempt.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.examinsight.features.attempt.api.dto.*;
import uk.gegc.examinsight.features.attempt.application.AttemptService;
import uk.gegc.examinsight.features.attempt.domain.model.AttemptStatus;
import uk.gegc.examinsight.features.attempt.domain.model.TopicScore;
import uk.gegc.examinsight.features.exam.domain.model.QuestionDifficulty;
import uk.gegc.examinsight.features.performance.application.PerformanceQueryService;
import uk.gegc.examinsight.features.progress.api.dto.AchievementDto;
import uk.gegc.examinsight.features.progress.domain.model.AchievementType;
import uk.gegc.examinsight.shared.exception.AttemptAlreadyCompletedException;
import uk.gegc.examinsight.shared.exception.ForbiddenException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AttemptController.class)
@DisplayName("AttemptController Tests")
class AttemptControllerTest {

    private static final String USER_ID = "6f1c2a8e-3b4d-4e5f-8a9b-0c1d2e3f4a5b";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private AttemptService attemptService;

    @MockitoBean
    private PerformanceQueryService performanceQueryService;

    @Nested
    @DisplayName("POST /api/v1/exams/{examId}/attempts")
    class SubmitTests {

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("Graded attempt is returned with 201")
        void submit_Created() throws Exception {
            // Given
            UUID examId = UUID.randomUUID();
            SubmitAttemptRequest request = new SubmitAttemptRequest(Map.of("q1", "A"), 45);
            AttemptResultDto result = new AttemptResultDto(UUID.randomUUID(), examId, 5, 100.0, 1, 0, 1, 45,
                    Map.of("math", new TopicScore(1, 1)), AttemptStatus.COMPLETED, Instant.now(), 1, 1,
                    List.of(new AchievementDto(AchievementType.PERFECT_SCORE, "Perfect Score!",
                            "Scored 100% on an exam", examId, Instant.now(), true)),
                    List.of(new QuestionReviewDto("q1", "Question", Map.of("A", "x"), "A", true, "A",
                            "Because", "math", QuestionDifficulty.EASY)));
            when(attemptService.submitAttempt(eq(UUID.fromString(USER_ID)), eq(examId), any(SubmitAttemptRequest.class)))
                    .thenReturn(result);

            // When & Then
            mockMvc.perform(post("/api/v1/exams/{examId}/attempts", examId)
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.score").value(5))
                    .andExpect(jsonPath("$.percentage").value(100.0))
                    .andExpect(jsonPath("$.performanceByTopic.math.correct").value(1))
                    .andExpect(jsonPath("$.achievements[0].type").value("perfect_score"))
                    .andExpect(jsonPath("$.achievements[0].newlyUnlocked").value(true))
                    .andExpect(jsonPath("$.questions[0].isCorrect").value(true))
                    .andExpect(jsonPath("$.questions[0].difficulty").value("easy"));
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("Missing answers map is a 400")
        void submit_MissingAnswers_BadRequest() throws Exception {
            mockMvc.perform(post("/api/v1/exams/{examId}/attempts", UUID.randomUUID())
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"timeSpentSeconds\": 10}"))
                    .andExpect(status().isBadRequest());

            verifyNoInteractions(attemptService);
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("Negative time is a 400")
        void submit_NegativeTime_BadRequest() throws Exception {
            mockMvc.perform(post("/api/v1/exams/{examId}/attempts", UUID.randomUUID())
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"answers\": {}, \"timeSpentSeconds\": -5}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("Resubmission is a 409 problem")
        void submit_AlreadyCompleted_Conflict() throws Exception {
            // Given
            UUID examId = UUID.randomUUID();
            when(attemptService.submitAttempt(any(), eq(examId), any()))
                    .thenThrow(new AttemptAlreadyCompletedException(examId, UUID.fromString(USER_ID)));

            // When & Then
            mockMvc.perform(post("/api/v1/exams/{examId}/attempts", examId)
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"answers\": {\"q1\": \"A\"}, \"timeSpentSeconds\": 10}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.title").value("Exam Already Completed"))
                    .andExpect(jsonPath("$.examId").value(examId.toString()));
        }

        @Test
        @WithMockUser(username = "not-a-uuid")
        @DisplayName("Principal without a user id is a 403")
        void submit_BadPrincipal_Forbidden() throws Exception {
            mockMvc.perform(post("/api/v1/exams/{examId}/attempts", UUID.randomUUID())
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"answers\": {}, \"timeSpentSeconds\": 10}"))
                    .andExpect(status().isForbidden());
        }
    }

    @Nested
    @DisplayName("GET /api/v1/attempts")
    class ListTests {

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("Returns a page of completed attempts")
        void list_Ok() throws Exception {
            AttemptSummaryDto summary = new AttemptSummaryDto(UUID.randomUUID(), UUID.randomUUID(), 35, 70.0, 7, 10,
                    480, Instant.now());
            when(attemptService.listCompletedAttempts(eq(UUID.fromString(USER_ID)), any()))
                    .thenReturn(new PageImpl<>(List.of(summary), PageRequest.of(0, 20), 1));

            mockMvc.perform(get("/api/v1/attempts"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.content[0].percentage").value(70.0));
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("Page size above 100 is rejected")
        void list_SizeTooLarge_BadRequest() throws Exception {
            mockMvc.perform(get("/api/v1/attempts").param("size", "500"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Nested
    @DisplayName("GET /api/v1/attempts/{attemptId}/review")
    class ReviewTests {

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("Owner gets the review")
        void review_Ok() throws Exception {
            UUID attemptId = UUID.randomUUID();
            AttemptReviewDto review = new AttemptReviewDto(attemptId, UUID.randomUUID(), "Exam", 5, 50.0, 1, 1, 60,
                    Instant.now(), List.of(
                    new QuestionReviewDto("q1", "Q1", Map.of(), "A", true, "A", "ok", "math", QuestionDifficulty.MEDIUM),
                    new QuestionReviewDto("q2", "Q2", Map.of(), null, false, "B", "why", "math", QuestionDifficulty.HARD)));
            when(performanceQueryService.getAttemptReview(attemptId, UUID.fromString(USER_ID))).thenReturn(review);

            mockMvc.perform(get("/api/v1/attempts/{attemptId}/review", attemptId))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.questions[1].isCorrect").value(false))
                    .andExpect(jsonPath("$.questions[1].correctAnswer").value("B"))
                    .andExpect(jsonPath("$.questions[1].explanation").value("why"));
        }

        @Test
        @WithMockUser(username = USER_ID)
        @DisplayName("Other user's attempt is a 403 problem")
        void review_Forbidden() throws Exception {
            UUID attemptId = UUID.randomUUID();
            when(performanceQueryService.getAttemptReview(attemptId, UUID.fromString(USER_ID)))
                    .thenThrow(new ForbiddenException("You do not have access to attempt " + attemptId));

            mockMvc.perform(get("/api/v1/attempts/{attemptId}/review", attemptId))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.status").value(403));
        }
    }
}
