package com.example.crosstab.service.identity;

import com.example.crosstab.config.AppProperties;
import com.example.crosstab.exception.CollaboratorFailureException;
import com.example.crosstab.model.SessionInfo;
import com.example.crosstab.model.TokenPair;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link IdentityProvider} over the identity service's REST API.
 * <p>
 * Callers run on the coordination scheduler, never on the event loop, so the calls block with
 * a bounded timeout.
 */
@Component
@Slf4j
public class HttpIdentityProvider implements IdentityProvider {

    private final WebClient webClient;
    private final Duration timeout;

    public HttpIdentityProvider(WebClient.Builder webClientBuilder, AppProperties appProperties) {
        this.webClient = webClientBuilder.baseUrl(appProperties.getIdentity().getBaseUrl()).build();
        this.timeout = appProperties.getIdentity().getTimeout();
    }

    @Override
    public TokenPair refreshToken(String refreshToken) {
        TokenPair pair = call("refresh token", webClient.post()
                .uri("/api/auth/token/refresh")
                .bodyValue(Map.of("refreshToken", refreshToken))
                .retrieve()
                .bodyToMono(TokenPair.class));
        if (pair == null || pair.getToken() == null) {
            throw new CollaboratorFailureException("Identity service returned no token");
        }
        return pair;
    }

    @Override
    public void invalidateTokens(String userId, String deviceId) {
        Map<String, String> body = new HashMap<>();
        body.put("userId", userId);
        if (deviceId != null) {
            body.put("deviceId", deviceId);
        }
        call("invalidate tokens", webClient.post()
                .uri("/api/auth/tokens/invalidate")
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public Optional<SessionInfo> getSession(String sessionId) {
        Mono<SessionInfo> request = webClient.get()
                .uri("/api/auth/sessions/{sessionId}", sessionId)
                .retrieve()
                .bodyToMono(SessionInfo.class)
                .onErrorResume(WebClientResponseException.class,
                        e -> e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND) ? Mono.empty() : Mono.error(e));
        return Optional.ofNullable(call("get session", request));
    }

    @Override
    public void touchSession(String sessionId) {
        call("touch session", webClient.post()
                .uri("/api/auth/sessions/{sessionId}/touch", sessionId)
                .retrieve()
                .toBodilessEntity());
    }

    private <T> T call(String operation, Mono<T> request) {
        try {
            return request.block(timeout);
        } catch (Exception e) {
            log.warn("Identity service call '{}' failed: {}", operation, e.getMessage());
            throw new CollaboratorFailureException("Identity service call '" + operation + "' failed", e);
        }
    }
}
