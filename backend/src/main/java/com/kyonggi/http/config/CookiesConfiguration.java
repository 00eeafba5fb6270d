package com.kyonggi.http.config;

/**
 * strict=true 이면 쿠키 하나라도 잘못된 경우 Cookie 헤더 전체를 버린다.
 */
public record CookiesConfiguration(boolean strict) {

    public static CookiesConfiguration defaults() {
        return new CookiesConfiguration(true);
    }
}
