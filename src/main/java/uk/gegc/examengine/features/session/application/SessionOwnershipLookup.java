package uk.gegc.examengine.features.session.application;

import java.util.UUID;

/**
 * Lets other subsystems, proctoring first of all, authorize writes against a session
 * without duplicating ownership rules.
 */
public interface SessionOwnershipLookup {

    /**
     * @throws uk.gegc.examengine.shared.exception.ResourceNotFoundException if the session does not exist
     */
    UUID ownerOf(UUID sessionId);
}
