package com.webchat.server.im.auth;

import cn.hutool.jwt.JWT;
import cn.hutool.jwt.JWTUtil;
import com.webchat.server.im.exception.InvalidTokenException;
import com.webchat.server.im.model.UserIdentity;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * HS256 tokens carrying {@code user_id}, {@code username} and an optional {@code exp}
 * in epoch seconds.
 */
@Component
public class JwtTokenValidator implements TokenValidator {

    private final byte[] secret;
    private final Clock clock;

    public JwtTokenValidator(@Value("${chat.auth.jwt-secret}") String secret) {
        this(secret, Clock.systemUTC());
    }

    JwtTokenValidator(String secret, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("JWT secret not configured");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.clock = clock;
    }

    @Override
    public UserIdentity validate(String token) throws InvalidTokenException {
        if (token == null || token.isEmpty()) {
            throw new InvalidTokenException("token required");
        }

        JWT jwt;
        try {
            if (!JWTUtil.verify(token, secret)) {
                throw new InvalidTokenException("invalid token signature");
            }
            jwt = JWTUtil.parseToken(token);
        } catch (RuntimeException e) {
            throw new InvalidTokenException("malformed token", e);
        }

        Object exp = jwt.getPayload("exp");
        if (exp != null) {
            if (!(exp instanceof Number)) {
                throw new InvalidTokenException("invalid exp claim");
            }
            if (((Number) exp).longValue() <= clock.millis() / 1000) {
                throw new InvalidTokenException("token expired");
            }
        }

        Object userId = jwt.getPayload("user_id");
        if (!(userId instanceof Number) || ((Number) userId).longValue() <= 0) {
            throw new InvalidTokenException("token has no valid user_id");
        }
        Object username = jwt.getPayload("username");
        return new UserIdentity(((Number) userId).longValue(), username == null ? "" : username.toString());
    }
}
