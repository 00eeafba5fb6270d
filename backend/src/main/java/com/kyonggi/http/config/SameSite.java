package com.kyonggi.http.config;

import java.util.Arrays;
import java.util.Optional;

// SameSite는 오타가 치명적이라 enum으로 고정
public enum SameSite {
    Strict, Lax, None;

    /**
     * 대소문자 무시 파싱. 알 수 없는 값이면 empty.
     * (경고 로그는 호출자(HttpConfigResolver) 책임)
     */
    public static Optional<SameSite> parse(String value) {
        if (value == null) return Optional.empty();

        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(v -> v.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
