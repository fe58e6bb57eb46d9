package blog.platform.security;

import blog.platform.exception.UnexpectedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies HS256-signed access tokens.
 *
 * Tokens are stateless: they carry user_id, username and exp, and nothing is
 * stored server-side. There is no revocation; a token is valid until it expires.
 */
@Slf4j
public class TokenService {

    public static final long DEFAULT_TTL_SECONDS = 3600;

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_USERNAME = "username";

    private final Key signingKey;
    private final long ttlSeconds;
    private final Clock clock;
    private final JwtParser parser;

    /**
     * @param secret        HMAC secret, at least 32 bytes
     * @param ttlSeconds    token lifetime; values &lt;= 0 fall back to {@link #DEFAULT_TTL_SECONDS}
     * @param leewaySeconds clock skew tolerated on expiry checks
     * @param clock         time source
     */
    public TokenService(String secret, long ttlSeconds, long leewaySeconds, Clock clock) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttlSeconds = ttlSeconds > 0 ? ttlSeconds : DEFAULT_TTL_SECONDS;
        this.clock = clock;
        this.parser = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .setAllowedClockSkewSeconds(Math.max(0, leewaySeconds))
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    /**
     * Issue a token for the given identity, expiring ttlSeconds from now
     */
    public String issue(long userId, String username) {
        Instant now = clock.instant();
        try {
            return Jwts.builder()
                    .claim(CLAIM_USER_ID, userId)
                    .claim(CLAIM_USERNAME, username)
                    .setIssuedAt(Date.from(now))
                    .setExpiration(Date.from(now.plusSeconds(ttlSeconds)))
                    .signWith(signingKey, SignatureAlgorithm.HS256)
                    .compact();
        } catch (JwtException e) {
            throw new UnexpectedException("token encode failed", e);
        }
    }

    /**
     * Verify signature and expiry (with leeway) and extract the claims.
     *
     * @throws InvalidTokenException on any failure
     */
    public TokenClaims verify(String token) {
        Claims claims;
        try {
            claims = parser.parseClaimsJws(token).getBody();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getClass().getSimpleName());
            throw new InvalidTokenException();
        }

        Object userId = claims.get(CLAIM_USER_ID);
        Object username = claims.get(CLAIM_USERNAME);
        Date expiration = claims.getExpiration();
        if (!(userId instanceof Number) || !(username instanceof String) || expiration == null) {
            throw new InvalidTokenException();
        }
        long id = ((Number) userId).longValue();
        if (id <= 0) {
            throw new InvalidTokenException();
        }
        return new TokenClaims(id, (String) username, expiration.toInstant());
    }
}
