package com.kyonggi.http.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.kyonggi.http.config.JwtConfiguration;
import com.kyonggi.http.config.SecretConfiguration;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import lombok.extern.slf4j.Slf4j;

/**
 * 세션/플래시 쿠키 값(JWT) 인코딩/디코딩
 *
 * - 쿠키 데이터(Map<String, String>)를 dataClaim 아래에 넣고 애플리케이션 secret으로 서명한다.
 * - HTTP는 모른다. 쿠키 속성(path/samesite/...)은 HttpCookieUtils 담당.
 * - 디코딩 실패(서명 불일치/만료/포맷 오류)는 예외 대신 빈 맵: 쿠키가 없는 요청과 동일하게 취급.
 *
 * JWT 구조: header.payload.signature
 * - payload: { "data": {...}, "nbf": ..., "iat": ..., "exp": ...(expiresAfter 설정 시) }
 */
@Slf4j
public class JwtCookieCodec {

    private final JwtConfiguration jwt;
    private final SignatureAlgorithm algorithm;
    private final SecretKey key;
    private final Clock clock;
    private final JwtParser parser;

    public JwtCookieCodec(JwtConfiguration jwt, SecretConfiguration secret, Clock clock) {
        this.jwt = jwt;
        this.clock = clock;
        this.algorithm = SignatureAlgorithm.forName(jwt.signatureAlgorithm());

        // 쿠키 서명은 공유 secret 기반이므로 HMAC 계열만 허용
        if (!algorithm.isHmac()) {
            throw new IllegalStateException("Cookie signing requires an HMAC algorithm (HS256/HS384/HS512), got "
                    + jwt.signatureAlgorithm());
        }

        this.key = new SecretKeySpec(secret.secret().getBytes(StandardCharsets.UTF_8), algorithm.getJcaName());
        this.parser = Jwts.parserBuilder()
                .setSigningKey(key)
                .setAllowedClockSkewSeconds(jwt.clockSkew().toSeconds())
                // JJWT는 Date 기반 clock을 쓰므로 여기서 bridge
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    public String encode(Map<String, String> data) {
        if (data == null) throw new IllegalArgumentException("data must not be null");

        Instant now = clock.instant();
        JwtBuilder builder = Jwts.builder()
                .claim(jwt.dataClaim(), new LinkedHashMap<>(data))
                .setNotBefore(Date.from(now))                 // nbf
                .setIssuedAt(Date.from(now));                 // iat

        jwt.expiresAfter().ifPresent(ttl -> builder.setExpiration(Date.from(now.plus(ttl)))); // exp

        return builder.signWith(key, algorithm).compact();
    }

    /**
     * 서명/시간 클레임 검증 후 데이터 맵 반환. 검증 실패 시 빈 맵.
     */
    public Map<String, String> decode(String token) {
        if (token == null || token.isBlank()) {
            return Collections.emptyMap();
        }

        try {
            Claims claims = parser.parseClaimsJws(token).getBody();
            Map<?, ?> raw = claims.get(jwt.dataClaim(), Map.class);
            if (raw == null) return Collections.emptyMap();

            Map<String, String> data = new LinkedHashMap<>();
            raw.forEach((k, v) -> data.put(String.valueOf(k), String.valueOf(v)));
            return data;
        } catch (ExpiredJwtException e) {
            log.debug("Expired cookie JWT: {}", e.getMessage());
            return Collections.emptyMap();
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Invalid cookie JWT, ignoring it: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
