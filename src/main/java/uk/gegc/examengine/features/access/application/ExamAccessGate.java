package uk.gegc.examengine.features.access.application;

import java.util.UUID;

/**
 * Entitlement check consulted before a user may start an exam.
 * The purchasing side of the platform supplies the real implementation.
 */
public interface ExamAccessGate {

    boolean hasAccess(UUID userId, UUID examId);
}
