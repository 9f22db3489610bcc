package com.riskscan.connect.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Reads the identity id that {@link JwtAuthenticationFilter} placed in the security context.
 */
public final class CurrentIdentity {

    private CurrentIdentity() {
    }

    /**
     * @return the connected identity id, or null for anonymous requests
     */
    public static Long id() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof Long identityId) {
            return identityId;
        }
        return null;
    }
}
