package uk.gegc.examengine.shared.security;

import org.springframework.security.core.Authentication;
import uk.gegc.examengine.shared.exception.ForbiddenException;

import java.util.UUID;

public final class AuthenticatedUser {

    private AuthenticatedUser() {
    }

    public static UUID idOf(Authentication authentication) {
        if (authentication == null || authentication.getName() == null) {
            throw new ForbiddenException("Authentication required");
        }
        try {
            return UUID.fromString(authentication.getName());
        } catch (IllegalArgumentException e) {
            throw new ForbiddenException("Principal is not a user id");
        }
    }
}
