package uk.gegc.examengine.features.result.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.examengine.features.result.api.dto.AdminResultDto;
import uk.gegc.examengine.features.result.api.dto.ResultsSummaryDto;
import uk.gegc.examengine.features.result.application.ResultsSummaryService;
import uk.gegc.examengine.features.session.domain.model.SessionStatus;

import java.util.Map;
import java.util.UUID;

@Tag(name = "Admin Results", description = "Result listings and statistics across all participants")
@RestController
@RequestMapping("/api/v1/admin/results")
@RequiredArgsConstructor
@Validated
@PreAuthorize("hasRole('ADMIN')")
public class AdminResultController {

    private static final Map<String, String> SORTABLE = Map.of(
            "createdAt", "createdAt",
            "finishedAt", "finishedAt",
            "totalScore", "totalScore"
    );

    private final ResultsSummaryService resultsSummaryService;

    @Operation(summary = "List results", description = "Sessions filtered by exam, user and status.")
    @GetMapping
    public ResponseEntity<Page<AdminResultDto>> listResults(
            @Parameter(in = ParameterIn.QUERY, description = "Filter by exam UUID")
            @RequestParam(name = "examId", required = false) UUID examId,

            @Parameter(in = ParameterIn.QUERY, description = "Filter by user UUID")
            @RequestParam(name = "userId", required = false) UUID userId,

            @Parameter(in = ParameterIn.QUERY, description = "Filter by status")
            @RequestParam(name = "status", required = false) SessionStatus status,

            @Parameter(in = ParameterIn.QUERY, description = "createdAt, finishedAt or totalScore", example = "createdAt")
            @RequestParam(name = "sortBy", defaultValue = "createdAt") String sortBy,

            @Parameter(in = ParameterIn.QUERY, description = "ASC or DESC", example = "DESC")
            @RequestParam(name = "direction", defaultValue = "DESC") Sort.Direction direction,

            @Min(0) @RequestParam(name = "page", defaultValue = "0") int page,
            @Min(1) @Max(100) @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        String property = SORTABLE.get(sortBy);
        if (property == null) {
            throw new IllegalArgumentException("Unsupported sort field: " + sortBy);
        }
        Page<AdminResultDto> result = resultsSummaryService.listResults(
                examId, userId, status, PageRequest.of(page, size, Sort.by(direction, property)));
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "System-wide summary", description = "Statistics over all finished sessions, optionally for one exam.")
    @GetMapping("/summary")
    public ResponseEntity<ResultsSummaryDto> getSummary(
            @Parameter(in = ParameterIn.QUERY, description = "Restrict to one exam")
            @RequestParam(name = "examId", required = false) UUID examId
    ) {
        return ResponseEntity.ok(resultsSummaryService.getSystemSummary(examId));
    }
}
