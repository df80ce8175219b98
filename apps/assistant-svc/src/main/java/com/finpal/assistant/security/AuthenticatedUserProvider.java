package com.finpal.assistant.security;

import java.util.Optional;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

@Component
public class AuthenticatedUserProvider {

    public Optional<String> currentPhone() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication instanceof JwtAuthenticationToken jwtAuthentication) {
            String subject = jwtAuthentication.getName();
            if (subject != null && !subject.isBlank()) {
                RequestContextHolder.setPhone(subject);
                return Optional.of(subject);
            }
        }
        return Optional.empty();
    }

    /** Throws {@link AccessDeniedException} unless the caller's token was issued for {@code phone}. */
    public void requireSameUser(String phone) {
        String current = currentPhone().orElseThrow(() -> new AccessDeniedException("user context missing"));
        if (!current.equals(phone)) {
            throw new AccessDeniedException("token does not belong to " + IdentifierMasker.mask(phone));
        }
    }
}
