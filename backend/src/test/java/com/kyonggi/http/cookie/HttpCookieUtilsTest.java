package com.kyonggi.http.cookie;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseCookie;
import org.springframework.mock.web.MockHttpServletRequest;

import com.kyonggi.http.config.FlashConfiguration;
import com.kyonggi.http.config.JwtConfiguration;
import com.kyonggi.http.config.SameSite;
import com.kyonggi.http.config.SessionConfiguration;

import jakarta.servlet.http.Cookie;

@DisplayName("[Cookie] HttpCookieUtils 테스트")
class HttpCookieUtilsTest {

    private static final SessionConfiguration SESSION = new SessionConfiguration(
            "KG_SESSION", true, Optional.of(Duration.ofHours(1)), true, Optional.of("kyonggi.ac.kr"),
            "/app", Optional.of(SameSite.Strict), true, JwtConfiguration.defaults());

    private static final FlashConfiguration FLASH = new FlashConfiguration(
            "KG_FLASH", false, false, Optional.empty(), "/", Optional.empty(), false, JwtConfiguration.defaults());

    private final HttpCookieUtils cookies = new HttpCookieUtils(SESSION, FLASH);

    @Test
    @DisplayName("세션 쿠키: 설정의 속성이 그대로 반영된다")
    void session_cookie_carries_configured_attributes() {
        ResponseCookie cookie = cookies.sessionCookie("jwt-value");

        assertThat(cookie.getName()).isEqualTo("KG_SESSION");
        assertThat(cookie.getValue()).isEqualTo("jwt-value");
        assertThat(cookie.getMaxAge()).isEqualTo(Duration.ofHours(1));
        assertThat(cookie.getDomain()).isEqualTo("kyonggi.ac.kr");
        assertThat(cookie.getPath()).isEqualTo("/app");
        assertThat(cookie.getSameSite()).isEqualTo("Strict");
        assertThat(cookie.isSecure()).isTrue();
        assertThat(cookie.isHttpOnly()).isTrue();
        assertThat(cookie.isPartitioned()).isTrue();
    }

    @Test
    @DisplayName("플래시 쿠키: Max-Age/SameSite/Domain 없음")
    void flash_cookie_is_a_browser_session_cookie() {
        ResponseCookie cookie = cookies.flashCookie("flash-value");

        assertThat(cookie.getName()).isEqualTo("KG_FLASH");
        assertThat(cookie.getMaxAge().isNegative()).isTrue();
        assertThat(cookie.getSameSite()).isNull();
        assertThat(cookie.getDomain()).isNull();
        assertThat(cookie.isHttpOnly()).isFalse();
        assertThat(cookie.toString()).doesNotContain("SameSite");
    }

    @Test
    @DisplayName("삭제 쿠키: 같은 속성 + Max-Age=0")
    void discard_cookies_expire_immediately() {
        ResponseCookie session = cookies.discardSessionCookie();
        ResponseCookie flash = cookies.discardFlashCookie();

        assertThat(session.getMaxAge()).isEqualTo(Duration.ZERO);
        assertThat(session.getPath()).isEqualTo("/app");
        assertThat(session.getDomain()).isEqualTo("kyonggi.ac.kr");
        assertThat(flash.getMaxAge()).isEqualTo(Duration.ZERO);
        assertThat(flash.getValue()).isEmpty();
    }

    @Test
    @DisplayName("요청 쿠키 읽기: 없거나 공백이면 null")
    void reads_request_cookie_by_name() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setCookies(new Cookie("KG_SESSION", " token "), new Cookie("KG_FLASH", " "));

        assertThat(cookies.readCookie(request, "KG_SESSION")).isEqualTo("token");
        assertThat(cookies.readCookie(request, "KG_FLASH")).isNull();
        assertThat(cookies.readCookie(new MockHttpServletRequest(), "KG_SESSION")).isNull();
    }
}
