package uk.gegc.examinsight.features.exam.api;

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
import uk.gegc.examinsight.features.exam.api.dto.CreateExamRequest;
import uk.gegc.examinsight.features.exam.api.dto.ExamDto;
import uk.gegc.examinsight.features.exam.api.dto.ExamSummaryDto;
import uk.gegc.examinsight.features.exam.application.ExamService;
import uk.gegc.examinsight.shared.security.AuthenticatedUser;

import java.util.UUID;

@Tag(name = "Exams", description = "Register generated exams and fetch them for taking")
@RestController
@RequestMapping("/api/v1/exams")
@RequiredArgsConstructor
@Validated
public class ExamController {

    private final ExamService examService;

    @Operation(
            summary = "Register a generated exam",
            description = "Stores the questions produced by exam generation after checking that every question has four options and a valid answer key."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Exam stored",
                    content = @Content(schema = @Schema(implementation = ExamDto.class))),
            @ApiResponse(responseCode = "400", description = "Questions are structurally incomplete",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<ExamDto> createExam(
            @RequestBody @Valid CreateExamRequest request,
            Authentication authentication
    ) {
        ExamDto created = examService.createExam(AuthenticatedUser.id(authentication), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "List active exams", description = "Returns the caller's active exams, newest first.")
    @GetMapping
    public ResponseEntity<Page<ExamSummaryDto>> listExams(
            @Parameter(in = ParameterIn.QUERY, description = "Page number (0-based)", example = "0")
            @Min(0) @RequestParam(name = "page", defaultValue = "0") int page,

            @Parameter(in = ParameterIn.QUERY, description = "Page size", example = "20")
            @Min(1) @Max(100) @RequestParam(name = "size", defaultValue = "20") int size,

            Authentication authentication
    ) {
        Page<ExamSummaryDto> result = examService.listActiveExams(
                AuthenticatedUser.id(authentication),
                PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"))
        );
        return ResponseEntity.ok(result);
    }

    @Operation(
            summary = "Get an exam for taking",
            description = "Returns the exam questions without correct answers or explanations."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Exam returned",
                    content = @Content(schema = @Schema(implementation = ExamDto.class))),
            @ApiResponse(responseCode = "403", description = "Exam belongs to another user",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Exam not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{examId}")
    public ResponseEntity<ExamDto> getExam(
            @Parameter(description = "Exam UUID", required = true)
            @PathVariable UUID examId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(examService.getExamForTaking(AuthenticatedUser.id(authentication), examId));
    }
}
