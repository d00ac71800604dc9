package uk.gegc.examinsight.features.attempt.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.examinsight.features.attempt.api.dto.AttemptResultDto;
import uk.gegc.examinsight.features.attempt.api.dto.AttemptReviewDto;
import uk.gegc.examinsight.features.attempt.api.dto.AttemptSummaryDto;
import uk.gegc.examinsight.features.attempt.api.dto.SubmitAttemptRequest;
import uk.gegc.examinsight.features.attempt.application.AttemptService;
import uk.gegc.examinsight.features.performance.application.PerformanceQueryService;
import uk.gegc.examinsight.shared.security.AuthenticatedUser;

import java.util.UUID;

@Tag(name = "Attempts", description = "Submit exams for grading and review past attempts")
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
public class AttemptController {

    private final AttemptService attemptService;
    private final PerformanceQueryService performanceQueryService;

    @Operation(
            summary = "Submit an exam",
            description = "Grades the answers, stores the attempt and returns the score, streaks and achievements. Each exam can be completed once."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Attempt graded",
                    content = @Content(schema = @Schema(implementation = AttemptResultDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid submission or exam closed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Exam belongs to another user",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Exam not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Exam already completed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/exams/{examId}/attempts")
    public ResponseEntity<AttemptResultDto> submitAttempt(
            @Parameter(description = "Exam UUID", required = true) @PathVariable UUID examId,
            @RequestBody @Valid SubmitAttemptRequest request,
            Authentication authentication
    ) {
        AttemptResultDto result = attemptService.submitAttempt(AuthenticatedUser.id(authentication), examId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @Operation(summary = "List my completed attempts", description = "Newest first")
    @GetMapping("/attempts")
    public ResponseEntity<Page<AttemptSummaryDto>> listAttempts(
            @Parameter(in = ParameterIn.QUERY, description = "Page number (0-based)", example = "0")
            @Min(0) @RequestParam(name = "page", defaultValue = "0") int page,

            @Parameter(in = ParameterIn.QUERY, description = "Page size", example = "20")
            @Min(1) @Max(100) @RequestParam(name = "size", defaultValue = "20") int size,

            Authentication authentication
    ) {
        Page<AttemptSummaryDto> result = attemptService.listCompletedAttempts(
                AuthenticatedUser.id(authentication),
                PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "completedAt"))
        );
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Review an attempt", description = "Question-by-question breakdown with answer keys and explanations.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Review returned",
                    content = @Content(schema = @Schema(implementation = AttemptReviewDto.class))),
            @ApiResponse(responseCode = "403", description = "Attempt belongs to another user",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Attempt or exam not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Attempt not completed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/attempts/{attemptId}/review")
    public ResponseEntity<AttemptReviewDto> reviewAttempt(
            @Parameter(description = "Attempt UUID", required = true) @PathVariable UUID attemptId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(performanceQueryService.getAttemptReview(attemptId, AuthenticatedUser.id(authentication)));
    }
}
