package uk.gegc.examinsight.features.exam.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import uk.gegc.examinsight.features.exam.domain.model.ExamDifficulty;

import java.time.Instant;
import java.util.List;

@Schema(name = "CreateExamRequest", description = "Exam produced by the exam generation step")
public record CreateExamRequest(
        @Schema(description = "Exam title", example = "Algorithms Exam - 10/19/2026")
        @NotBlank(message = "Title must not be blank")
        @Size(max = 255, message = "Title must be at most 255 characters")
        String title,

        @Schema(description = "Identifier of the study folder the notes came from")
        String folderId,

        @Schema(description = "Display name of the study folder", example = "Algorithms")
        String folderName,

        @Schema(description = "Declared difficulty mix; defaults to MIXED")
        ExamDifficulty difficulty,

        @Schema(description = "Ids of the notes the questions were generated from")
        List<String> sourceNoteIds,

        @Schema(description = "Optional expiry after which the exam can no longer be submitted")
        Instant expiresAt,

        @NotEmpty(message = "An exam must contain at least one question")
        List<@Valid ExamQuestionRequest> questions
) {
}
