package com.kyonggi.http.config;

import java.time.Duration;
import java.util.Optional;

/**
 * 세션 쿠키 설정
 *
 * - cookieName: 세션을 담는 쿠키 이름
 * - secure: https 에서만 전송 여부 (운영에선 true)
 * - maxAge: 없으면 브라우저 세션 쿠키 (Max-Age 미포함)
 * - httpOnly: JS 접근 차단 여부
 * - domain: 설정된 경우에만 Domain 속성 포함
 * - path: 이 경로에 해당하는 요청에만 쿠키를 같이 전송 ("/"로 시작)
 * - sameSite: empty면 SameSite 속성 자체를 생략
 * - partitioned: CHIPS Partitioned 속성
 * - jwt: 세션 쿠키 서명 설정
 */
public record SessionConfiguration(
        String cookieName,
        boolean secure,
        Optional<Duration> maxAge,
        boolean httpOnly,
        Optional<String> domain,
        String path,
        Optional<SameSite> sameSite,
        boolean partitioned,
        JwtConfiguration jwt
) {

    public static final String DEFAULT_COOKIE_NAME = "KG_SESSION";

    public static SessionConfiguration defaults() {
        return new SessionConfiguration(
                DEFAULT_COOKIE_NAME,
                false,
                Optional.empty(),
                true,
                Optional.empty(),
                "/",
                Optional.of(SameSite.Lax),
                false,
                JwtConfiguration.defaults());
    }
}
