package com.kyonggi.http.cookie;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import com.kyonggi.http.config.FlashConfiguration;
import com.kyonggi.http.config.SameSite;
import com.kyonggi.http.config.SessionConfiguration;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;

/**
 * 세션/플래시 쿠키 유틸
 *
 * - cookie 옵션(path/domain/samesite/secure/httpOnly/partitioned)을 설정 스냅샷 한 곳에서 통일한다.
 * - 세션 쿠키는 maxAge가 설정된 경우에만 Max-Age를 포함한다 (없으면 브라우저 세션 쿠키).
 * - 플래시 쿠키는 항상 브라우저 세션 쿠키.
 */
@Component
@RequiredArgsConstructor
public class HttpCookieUtils {

    private final SessionConfiguration session;
    private final FlashConfiguration flash;

    public ResponseCookie sessionCookie(String value) {
        ResponseCookie.ResponseCookieBuilder builder = baseCookie(session.cookieName(), value, session.path(),
                session.domain(), session.secure(), session.httpOnly(), session.sameSite(), session.partitioned());
        session.maxAge().ifPresent(builder::maxAge);
        return builder.build();
    }

    public ResponseCookie flashCookie(String value) {
        return baseCookie(flash.cookieName(), value, flash.path(), flash.domain(), flash.secure(),
                flash.httpOnly(), flash.sameSite(), flash.partitioned())
                .build();
    }

    /** 세션 쿠키 삭제 (속성(path/domain/sameSite/secure)이 같아야 브라우저가 제대로 삭제함) */
    public ResponseCookie discardSessionCookie() {
        return baseCookie(session.cookieName(), "", session.path(), session.domain(), session.secure(),
                session.httpOnly(), session.sameSite(), session.partitioned())
                .maxAge(Duration.ZERO)
                .build();
    }

    public ResponseCookie discardFlashCookie() {
        return baseCookie(flash.cookieName(), "", flash.path(), flash.domain(), flash.secure(),
                flash.httpOnly(), flash.sameSite(), flash.partitioned())
                .maxAge(Duration.ZERO)
                .build();
    }

    /** 이름으로 쿠키 읽기 (없거나 공백이면 null) */
    public String readCookie(HttpServletRequest request, String cookieName) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null || cookies.length == 0) return null;

        return Arrays.stream(cookies)
                .filter(c -> cookieName.equals(c.getName()))
                .map(Cookie::getValue)
                .map(v -> v == null ? null : v.trim())
                .filter(v -> v != null && !v.isBlank())
                .findFirst()
                .orElse(null);
    }

    private static ResponseCookie.ResponseCookieBuilder baseCookie(String name, String value, String path,
            Optional<String> domain, boolean secure, boolean httpOnly, Optional<SameSite> sameSite, boolean partitioned) {
        return ResponseCookie.from(name, value)
                .httpOnly(httpOnly)
                .secure(secure)
                .path(path)
                .domain(domain.orElse(null))
                .sameSite(sameSite.map(SameSite::name).orElse(null))
                .partitioned(partitioned);
    }
}
