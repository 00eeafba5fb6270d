package com.kyonggi.http.config;

import java.util.Map;

/**
 * 파일 확장자 -> Content-Type 매핑 (불변 맵으로 복사해서 보관)
 */
public record FileMimeTypesConfiguration(Map<String, String> mimeTypes) {

    public FileMimeTypesConfiguration {
        mimeTypes = (mimeTypes == null) ? Map.of() : Map.copyOf(mimeTypes);
    }

    public static FileMimeTypesConfiguration defaults() {
        return new FileMimeTypesConfiguration(Map.of());
    }
}
