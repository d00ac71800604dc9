package uk.gegc.examinsight.features.progress.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.examinsight.features.progress.api.dto.AchievementDto;
import uk.gegc.examinsight.features.progress.application.AchievementService;
import uk.gegc.examinsight.shared.security.AuthenticatedUser;

import java.util.List;

@Tag(name = "Achievements", description = "Achievements earned by the current user")
@RestController
@RequestMapping("/api/v1/achievements")
@RequiredArgsConstructor
public class AchievementController {

    private final AchievementService achievementService;

    @Operation(summary = "List my achievements", description = "Newest first")
    @ApiResponse(responseCode = "200", description = "Achievements returned",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = AchievementDto.class))))
    @ApiResponse(responseCode = "401", description = "Unauthorized")
    @GetMapping("/me")
    public ResponseEntity<List<AchievementDto>> getMyAchievements(Authentication authentication) {
        return ResponseEntity.ok(achievementService.listForUser(AuthenticatedUser.id(authentication)));
    }
}
