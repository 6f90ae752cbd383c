package com.intelcompliance.application;

import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/**
 * Resolves the operator behind the current request from Spring Security.
 *
 * The principal name becomes the actor recorded on incidents, containment
 * actions and audit events.
 */
@Component
public class SecurityContextProvider {

    /**
     * @throws SecurityException if the request is not authenticated
     */
    public String currentActor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            throw new SecurityException("No authenticated user");
        }
        return authentication.getName();
    }
}
