// src/main/java/com/dnobretech/leitorbackend/auth/JwtTokenService.java
package com.dnobretech.leitorbackend.auth;

import com.dnobretech.leitorbackend.exception.TokenExpiredException;
import com.dnobretech.leitorbackend.exception.TokenInvalidException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Emite e verifica tokens de acesso (JWT HS256).
 * <p>
 * A verificacao e autocontida: assinatura + expiracao, sem consulta ao banco.
 * Um token revogado continua valido ate expirar.
 */
@Slf4j
@Component
public class JwtTokenService {

    static final String USERNAME = "username";
    static final String CREATED_ON = "created_on";
    static final String STUDY_LANG = "study_lang";
    static final String DISPLAY_LANG = "display_lang";

    private final SecretKey key;
    private final Duration ttl;
    private final Clock clock;
    private final JwtParser parser;

    public JwtTokenService(@Value("${leitor.auth.jwt-secret}") String secret,
                           @Value("${leitor.auth.access-token-ttl:PT15M}") Duration ttl,
                           Clock clock) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttl = ttl;
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public Duration ttl() {
        return ttl;
    }

    public String issue(ClaimsUser user) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(String.valueOf(user.id()))
                .claim(USERNAME, user.username())
                .claim(CREATED_ON, user.createdOn().toEpochMilli())
                .claim(STUDY_LANG, user.studyLang())
                .claim(DISPLAY_LANG, user.displayLang())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(key)
                .compact();
    }

    /** Autentica uma requisicao: assinatura valida e nao expirado. */
    public ClaimsUser verify(String token) {
        return decode(token, true).user();
    }

    public TokenClaims decode(String token) {
        return decode(token, true);
    }

    /** Assinatura ainda e exigida; so a expiracao e ignorada (usado no refresh). */
    public TokenClaims decodeIgnoringExpiry(String token) {
        return decode(token, false);
    }

    private TokenClaims decode(String token, boolean checkExpiry) {
        if (token == null || token.isBlank()) throw new TokenInvalidException();
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            // o jjwt so chega na expiracao depois de validar a assinatura
            if (checkExpiry) throw new TokenExpiredException();
            claims = e.getClaims();
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenInvalidException(e);
        }
        return toTokenClaims(claims);
    }

    private static TokenClaims toTokenClaims(Claims claims) {
        try {
            Number createdOn = claims.get(CREATED_ON, Number.class);
            Date exp = claims.getExpiration();
            if (claims.getSubject() == null || createdOn == null || exp == null) {
                throw new TokenInvalidException();
            }
            ClaimsUser user = new ClaimsUser(
                    Long.valueOf(claims.getSubject()),
                    claims.get(USERNAME, String.class),
                    Instant.ofEpochMilli(createdOn.longValue()),
                    claims.get(STUDY_LANG, String.class),
                    claims.get(DISPLAY_LANG, String.class)
            );
            return new TokenClaims(user, exp.toInstant());
        } catch (NumberFormatException | JwtException e) {
            throw new TokenInvalidException(e);
        }
    }
}
