package uk.gegc.examinsight.shared.security;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;

import java.util.UUID;

/**
 * Resolves the caller's user id from the authenticated principal name.
 */
public final class AuthenticatedUser {

    private AuthenticatedUser() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static UUID id(Authentication authentication) {
        if (authentication == null || authentication.getName() == null) {
            throw new AccessDeniedException("Authentication is required");
        }
        try {
            return UUID.fromString(authentication.getName());
        } catch (IllegalArgumentException ex) {
            throw new AccessDeniedException("Authenticated principal is not a valid user id");
        }
    }
}
