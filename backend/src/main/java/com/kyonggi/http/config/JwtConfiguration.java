package com.kyonggi.http.config;

import java.time.Duration;
import java.util.Optional;

/**
 * 세션/플래시 쿠키를 JWT로 서명할 때 쓰는 설정
 *
 * - signatureAlgorithm: 서명 알고리즘 이름 (HS256 / HS384 / HS512 ...)
 * - expiresAfter: 설정되면 exp 클레임을 now + expiresAfter 로 넣는다
 * - clockSkew: exp/nbf 검증 시 허용하는 시계 오차
 * - dataClaim: 사용자 데이터 맵이 들어가는 클레임 키
 */
public record JwtConfiguration(
        String signatureAlgorithm,
        Optional<Duration> expiresAfter,
        Duration clockSkew,
        String dataClaim
) {

    public static final String DEFAULT_SIGNATURE_ALGORITHM = "HS256";
    public static final Duration DEFAULT_CLOCK_SKEW = Duration.ofSeconds(30);
    public static final String DEFAULT_DATA_CLAIM = "data";

    public static JwtConfiguration defaults() {
        return new JwtConfiguration(DEFAULT_SIGNATURE_ALGORITHM, Optional.empty(), DEFAULT_CLOCK_SKEW, DEFAULT_DATA_CLAIM);
    }
}
