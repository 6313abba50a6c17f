package uk.gegc.examengine.features.result.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.examengine.features.result.api.dto.ResultsSummaryDto;
import uk.gegc.examengine.features.result.application.ResultsSummaryService;
import uk.gegc.examengine.shared.security.AuthenticatedUser;

@Tag(name = "Results", description = "Participant result statistics")
@RestController
@RequestMapping("/api/v1/results")
@RequiredArgsConstructor
public class ResultController {

    private final ResultsSummaryService resultsSummaryService;

    @Operation(summary = "My results summary", description = "Statistics over the caller's finished sessions.")
    @GetMapping("/me/summary")
    public ResponseEntity<ResultsSummaryDto> getMySummary(Authentication authentication) {
        return ResponseEntity.ok(resultsSummaryService.getResultsSummary(AuthenticatedUser.idOf(authentication)));
    }
}
