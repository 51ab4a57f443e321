package dev.catananti.reviewhub.security;

import dev.catananti.reviewhub.entity.UserRole;
import dev.catananti.reviewhub.exception.UnauthenticatedException;
import io.jsonwebtoken.Claims;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

/**
 * Resolves an {@link Identity} from a signed JWT: the subject is the user id and the
 * {@code role} claim one of {@link UserRole}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtIdentityProvider implements IdentityProvider {

    private final JwtTokenProvider tokenProvider;

    @Override
    public Mono<Identity> authenticate(String token) {
        if (!StringUtils.hasText(token)) {
            return Mono.error(new UnauthenticatedException("Missing token"));
        }
        return Mono.fromCallable(() -> tokenProvider.validateAndParseClaims(token))
                .flatMap(result -> result.valid()
                        ? toIdentity(result.claims())
                        : Mono.error(new UnauthenticatedException(result.error())));
    }

    private Mono<Identity> toIdentity(Claims claims) {
        Long userId;
        try {
            userId = Long.valueOf(claims.getSubject());
        } catch (NumberFormatException e) {
            log.warn("Token subject is not a user id: {}", claims.getSubject());
            return Mono.error(new UnauthenticatedException("Invalid subject", e));
        }
        String role = claims.get(JwtTokenProvider.ROLE_CLAIM, String.class);
        return UserRole.fromClaim(role)
                .map(userRole -> Mono.just(new Identity(userId, userRole)))
                .orElseGet(() -> {
                    log.warn("Access denied, invalid role '{}' for user: {}", role, userId);
                    return Mono.error(new UnauthenticatedException("Invalid role"));
                });
    }
}
