package com.example.crosstab.service.identity;

import com.example.crosstab.model.SessionInfo;
import com.example.crosstab.model.TokenPair;

import java.util.Optional;

/**
 * The identity service that issues tokens and owns sessions. Implementations report every
 * failure as {@link com.example.crosstab.exception.CollaboratorFailureException}.
 */
public interface IdentityProvider {

    TokenPair refreshToken(String refreshToken);

    /**
     * @param deviceId limits the invalidation to one device, or {@code null} for all of the user's devices
     */
    void invalidateTokens(String userId, String deviceId);

    Optional<SessionInfo> getSession(String sessionId);

    void touchSession(String sessionId);
}
