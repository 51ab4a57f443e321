package dev.catananti.reviewhub.security;

import reactor.core.publisher.Mono;

public interface IdentityProvider {

    /**
     * Verify a bearer token.
     *
     * @return the caller's identity, or an error of
     *         {@link dev.catananti.reviewhub.exception.UnauthenticatedException}
     */
    Mono<Identity> authenticate(String token);
}
