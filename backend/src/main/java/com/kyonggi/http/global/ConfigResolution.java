package com.kyonggi.http.global;

import com.kyonggi.http.config.HttpConfiguration;

/**
 * resolve() 결과: 성공(스냅샷) 또는 실패(ConfigException) 둘 중 하나만 가진다.
 *
 * 기동 중단 여부는 호출자가 결정한다.
 * - 스프링 모듈은 orElseThrow()로 예외를 다시 던져 컨텍스트 생성을 실패시킨다.
 */
public record ConfigResolution(HttpConfiguration configuration, ConfigException error) {

    public ConfigResolution {
        if ((configuration == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of configuration/error must be set");
        }
    }

    public static ConfigResolution success(HttpConfiguration configuration) {
        return new ConfigResolution(configuration, null);
    }

    public static ConfigResolution failure(ConfigException error) {
        return new ConfigResolution(null, error);
    }

    public boolean isSuccess() {
        return configuration != null;
    }

    public HttpConfiguration orElseThrow() {
        if (error != null) {
            throw error;
        }
        return configuration;
    }
}
