package dev.catananti.reviewhub.security;

import dev.catananti.reviewhub.entity.UserRole;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JwtTokenProvider")
class JwtTokenProviderTest {

    static final String SECRET = "test-secret-key-that-is-long-enough-for-hs512-signing-0123456789abcdef";

    private JwtTokenProvider tokenProvider;

    static JwtTokenProvider provider(String secret) {
        JwtTokenProvider provider = new JwtTokenProvider();
        ReflectionTestUtils.setField(provider, "secret", secret);
        provider.init();
        return provider;
    }

    @BeforeEach
    void setUp() {
        tokenProvider = provider(SECRET);
    }

    @Nested
    @DisplayName("init")
    class Init {

        @Test
        @DisplayName("should refuse a secret shorter than 64 characters")
        void shouldRefuseShortSecret() {
            assertThatThrownBy(() -> provider("too-short"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("at least 64");
        }
    }

    @Nested
    @DisplayName("validateAndParseClaims")
    class Validate {

        @Test
        @DisplayName("should accept a token from the account service and expose subject and role")
        void shouldAcceptIssuedToken() {
            String token = TestTokens.issue(SECRET, 42L, UserRole.L1_APPROVER);

            JwtTokenProvider.TokenValidationResult result = tokenProvider.validateAndParseClaims(token);

            assertThat(result.valid()).isTrue();
            assertThat(result.claims().getSubject()).isEqualTo("42");
            assertThat(result.claims().get(JwtTokenProvider.ROLE_CLAIM, String.class)).isEqualTo("L1_APPROVER");
        }

        @Test
        @DisplayName("should report an expired token as expired")
        void shouldReportExpired() {
            String token = TestTokens.issue(SECRET, 1L, UserRole.ADMIN, Duration.ofSeconds(-1));

            JwtTokenProvider.TokenValidationResult result = tokenProvider.validateAndParseClaims(token);

            assertThat(result.valid()).isFalse();
            assertThat(result.expired()).isTrue();
            assertThat(result.error()).isEqualTo("Token expired");
        }

        @Test
        @DisplayName("should refuse a token signed with another key")
        void shouldRefuseForeignSignature() {
            String other = SECRET.replace('a', 'b');
            String token = TestTokens.issue(other, 1L, UserRole.ADMIN);

            JwtTokenProvider.TokenValidationResult result = tokenProvider.validateAndParseClaims(token);

            assertThat(result.valid()).isFalse();
            assertThat(result.expired()).isFalse();
        }

        @Test
        @DisplayName("should refuse a token for another audience")
        void shouldRefuseForeignAudience() {
            String token = Jwts.builder()
                    .subject("1")
                    .claim(JwtTokenProvider.ROLE_CLAIM, "ADMIN")
                    .issuer(JwtTokenProvider.ISSUER)
                    .audience().add("some-other-api").and()
                    .expiration(Date.from(Instant.now().plusSeconds(60)))
                    .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), Jwts.SIG.HS512)
                    .compact();

            assertThat(tokenProvider.validateAndParseClaims(token).valid()).isFalse();
        }

        @Test
        @DisplayName("should refuse garbage")
        void shouldRefuseMalformed() {
            JwtTokenProvider.TokenValidationResult result = tokenProvider.validateAndParseClaims("not-a-jwt");

            assertThat(result.valid()).isFalse();
            assertThat(result.error()).isEqualTo("Malformed token");
        }
    }
}
