package com.climaterisklens.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.climaterisklens.MutableClock;
import com.climaterisklens.db.UserRepo.User;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

class JwtServiceTest {
    private static final String SECRET = "unit-test-secret";

    private final User user = new User(UUID.randomUUID(), "ana@example.com", true, true, "analyst", null,
            Instant.now());

    @Test
    void issuedTokenVerifies() {
        JwtService jwt = new JwtService(SECRET, "HS256", 30, Clock.systemUTC());
        JwtService.Claims claims = jwt.verify(jwt.issue(user));

        assertThat(claims, is(notNullValue()));
        assertThat(claims.userId(), is(user.id()));
        assertThat(claims.email(), is("ana@example.com"));
        assertThat(claims.role(), is("analyst"));
        assertThat(jwt.expiresInSeconds(), is(1800));
    }

    @Test
    void expiredTokenIsRejected() {
        Clock past = Clock.fixed(Instant.now().minusSeconds(3600), ZoneOffset.UTC);
        JwtService issuer = new JwtService(SECRET, "HS256", 30, past);
        JwtService verifier = new JwtService(SECRET, "HS256", 30, Clock.systemUTC());
        assertThat(verifier.verify(issuer.issue(user)), is(nullValue()));
    }

    @Test
    void expiryFollowsTheServiceClock() {
        MutableClock clock = new MutableClock(Instant.parse("2020-01-01T00:00:00Z"));
        JwtService jwt = new JwtService(SECRET, "HS256", 30, clock);
        String token = jwt.issue(user);

        clock.advance(Duration.ofMinutes(29));
        assertThat(jwt.verify(token), is(notNullValue()));
        clock.advance(Duration.ofMinutes(2));
        assertThat(jwt.verify(token), is(nullValue()));
    }

    @Test
    void wrongSecretOrGarbageIsRejected() {
        JwtService a = new JwtService(SECRET, "HS256", 30, Clock.systemUTC());
        JwtService b = new JwtService("another-secret", "HS256", 30, Clock.systemUTC());
        assertThat(b.verify(a.issue(user)), is(nullValue()));
        assertThat(a.verify("not.a.token"), is(nullValue()));
        assertThat(a.verify(""), is(nullValue()));
        assertThat(a.verify(null), is(nullValue()));
    }

    @Test
    void tokenWithoutUuidSubjectIsRejected() {
        String token = JWT.create().withSubject("not-a-uuid").sign(Algorithm.HMAC256(SECRET));
        JwtService jwt = new JwtService(SECRET, "HS256", 30, Clock.systemUTC());
        assertThat(jwt.verify(token), is(nullValue()));
    }
}
