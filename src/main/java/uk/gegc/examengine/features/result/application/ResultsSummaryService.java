package uk.gegc.examengine.features.result.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.examengine.features.result.api.dto.AdminResultDto;
import uk.gegc.examengine.features.result.api.dto.ResultsSummaryDto;
import uk.gegc.examengine.features.session.domain.model.SessionStatus;

import java.util.UUID;

public interface ResultsSummaryService {

    ResultsSummaryDto getResultsSummary(UUID userId);

    /**
     * Summary over every user's finished sessions, restricted to one exam when {@code examId} is given.
     */
    ResultsSummaryDto getSystemSummary(UUID examId);

    Page<AdminResultDto> listResults(UUID examId, UUID userId, SessionStatus status, Pageable pageable);
}
