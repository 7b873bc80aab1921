package com.climaterisklens.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier.BaseVerification;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.auth0.jwt.interfaces.JWTVerifier;
import com.climaterisklens.config.AppConfig;
import com.climaterisklens.db.UserRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Issues and verifies HMAC-signed access tokens carrying {@code sub} (user id),
 * {@code email}, {@code role} and {@code exp}.
 */
public final class JwtService {
    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    private final Algorithm algorithm;
    private final JWTVerifier verifier;
    private final int expireMinutes;
    private final Clock clock;

    public JwtService(AppConfig cfg) {
        this(cfg.jwtSecret(), cfg.jwtAlgorithm(), cfg.jwtExpireMinutes(), Clock.systemUTC());
    }

    public JwtService(String secret, String algorithmName, int expireMinutes, Clock clock) {
        this.algorithm = switch (algorithmName) {
            case "HS384" -> Algorithm.HMAC384(secret);
            case "HS512" -> Algorithm.HMAC512(secret);
            default -> Algorithm.HMAC256(secret);
        };
        // expiry is checked against the same clock that stamps exp
        this.verifier = ((BaseVerification) JWT.require(algorithm)).build(clock);
        this.expireMinutes = expireMinutes;
        this.clock = clock;
    }

    public int expiresInSeconds() {
        return expireMinutes * 60;
    }

    public String issue(UserRepo.User user) {
        Instant now = clock.instant();
        return JWT.create()
                .withSubject(user.id().toString())
                .withClaim("email", user.email())
                .withClaim("role", user.role())
                .withIssuedAt(now)
                .withExpiresAt(now.plusSeconds(expiresInSeconds()))
                .sign(algorithm);
    }

    /**
     * Verifies signature and expiry. Returns null for any invalid token.
     */
    public Claims verify(String token) {
        if (token == null || token.isBlank())
            return null;
        try {
            DecodedJWT jwt = verifier.verify(token);
            String sub = jwt.getSubject();
            if (sub == null)
                return null;
            return new Claims(UUID.fromString(sub), jwt.getClaim("email").asString(),
                    jwt.getClaim("role").asString());
        } catch (JWTVerificationException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            return null;
        }
    }

    public record Claims(UUID userId, String email, String role) {
    }
}
