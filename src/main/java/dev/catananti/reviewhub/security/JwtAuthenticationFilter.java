package dev.catananti.reviewhub.security;

import dev.catananti.reviewhub.exception.UnauthenticatedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseCookie;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Collections;

@Component
@Slf4j
public class JwtAuthenticationFilter implements WebFilter {

    static final String ACCESS_TOKEN_COOKIE = "access_token";

    private final IdentityProvider identityProvider;

    public JwtAuthenticationFilter(IdentityProvider identityProvider) {
        this.identityProvider = identityProvider;
    }

    private String getJwtFromRequest(ServerWebExchange exchange) {
        // 1. Try Authorization header first
        String bearerToken = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (StringUtils.hasText(bearerToken) && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        // 2. Fall back to HttpOnly cookie
        HttpCookie cookie = exchange.getRequest().getCookies().getFirst(ACCESS_TOKEN_COOKIE);
        if (cookie != null && StringUtils.hasText(cookie.getValue())) {
            return cookie.getValue();
        }
        return null;
    }

    /** WebSocket upgrades authenticate from the query string inside the handler */
    private boolean isExemptPath(String path) {
        return path.startsWith("/ws/") || path.startsWith("/actuator/health");
    }

    /** Clear the invalid/expired access_token cookie from the browser */
    private void clearAccessTokenCookie(ServerWebExchange exchange) {
        exchange.getResponse().addCookie(
                ResponseCookie.from(ACCESS_TOKEN_COOKIE, "")
                        .path("/api")
                        .maxAge(0)
                        .httpOnly(true)
                        .build());
    }

    /** Build a 401 Unauthorized JSON response with the message escaped */
    private Mono<Void> unauthorizedResponse(ServerWebExchange exchange, String message) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        String safeMessage = message.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
        String body = "{\"error\":\"Unauthorized\",\"message\":\"" + safeMessage + "\"}";
        DataBuffer buffer = exchange.getResponse().bufferFactory()
                .wrap(body.getBytes(StandardCharsets.UTF_8));
        return exchange.getResponse().writeWith(Mono.just(buffer));
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String jwt = getJwtFromRequest(exchange);
        if (!StringUtils.hasText(jwt)) {
            return chain.filter(exchange);
        }

        String path = exchange.getRequest().getPath().value();
        return identityProvider.authenticate(jwt)
                .map(AuthAttempt::accepted)
                .onErrorResume(UnauthenticatedException.class, e -> Mono.just(AuthAttempt.refused(e.getMessage())))
                .flatMap(attempt -> {
                    if (attempt.identity() != null) {
                        log.debug("Authentication successful for user: {}", attempt.identity().userId());
                        var auth = new UsernamePasswordAuthenticationToken(
                                attempt.identity(), null,
                                Collections.singleton(new SimpleGrantedAuthority("ROLE_" + attempt.identity().role().name())));
                        return chain.filter(exchange)
                                .contextWrite(ReactiveSecurityContextHolder.withAuthentication(auth));
                    }
                    clearAccessTokenCookie(exchange);
                    if (isExemptPath(path)) {
                        return chain.filter(exchange);
                    }
                    log.warn("Access denied, {} for path: {}", attempt.error(), path);
                    return unauthorizedResponse(exchange, attempt.error());
                });
    }

    private record AuthAttempt(Identity identity, String error) {
        static AuthAttempt accepted(Identity identity) {
            return new AuthAttempt(identity, null);
        }

        static AuthAttempt refused(String error) {
            return new AuthAttempt(null, error == null ? "Invalid token" : error);
        }
    }
}
