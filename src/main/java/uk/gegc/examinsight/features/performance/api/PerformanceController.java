package uk.gegc.examinsight.features.performance.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.examinsight.features.performance.api.dto.PerformanceSnapshot;
import uk.gegc.examinsight.features.performance.application.PerformanceQueryService;
import uk.gegc.examinsight.shared.security.AuthenticatedUser;

@Tag(name = "Performance", description = "Dashboard statistics derived from exam attempts")
@RestController
@RequestMapping("/api/v1/performance")
@RequiredArgsConstructor
public class PerformanceController {

    private final PerformanceQueryService performanceQueryService;

    @Operation(
            summary = "Get my performance",
            description = "Recomputes totals, streaks, XP, topic and difficulty breakdowns, weekly trend and timing from all completed attempts."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Snapshot returned",
                    content = @Content(schema = @Schema(implementation = PerformanceSnapshot.class))),
            @ApiResponse(responseCode = "401", description = "Unauthorized")
    })
    @GetMapping("/me")
    public ResponseEntity<PerformanceSnapshot> getMyPerformance(Authentication authentication) {
        return ResponseEntity.ok(performanceQueryService.getUserPerformance(AuthenticatedUser.id(authentication)));
    }
}
