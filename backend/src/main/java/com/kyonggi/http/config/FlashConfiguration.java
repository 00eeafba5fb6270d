package com.kyonggi.http.config;

import java.util.Optional;

/**
 * 플래시 쿠키 설정 (한 번의 리다이렉트 동안만 살아있는 값)
 * - 필드 의미는 SessionConfiguration과 같다. 플래시는 maxAge가 없다.
 */
public record FlashConfiguration(
        String cookieName,
        boolean secure,
        boolean httpOnly,
        Optional<String> domain,
        String path,
        Optional<SameSite> sameSite,
        boolean partitioned,
        JwtConfiguration jwt
) {

    public static final String DEFAULT_COOKIE_NAME = "KG_FLASH";

    public static FlashConfiguration defaults() {
        return new FlashConfiguration(
                DEFAULT_COOKIE_NAME,
                false,
                true,
                Optional.empty(),
                "/",
                Optional.of(SameSite.Lax),
                false,
                JwtConfiguration.defaults());
    }
}
