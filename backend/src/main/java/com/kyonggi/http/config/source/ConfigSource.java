package com.kyonggi.http.config.source;

import java.util.Optional;

/**
 * 이미 파싱된 key-value 설정을 타입 안전하게 꺼내는 접근자
 *
 * - 값이 없거나 공백이면 "없음(empty)"으로 본다.
 * - 타입 변환 실패는 ConfigException(INVALID_VALUE)로 던진다.
 * - getDeprecated: 새 키가 우선, 새 키가 없을 때만 레거시 키를 읽는다.
 */
public interface ConfigSource {

    /** key 자체 또는 key 하위(key.xxx, key[0]) 값이 하나라도 있으면 true */
    boolean has(String key);

    <T> Optional<T> getOptional(String key, Class<T> type);

    <T> Optional<T> getDeprecated(String key, String legacyKey, Class<T> type);

    default <T> T get(String key, Class<T> type, T defaultValue) {
        return getOptional(key, type).orElse(defaultValue);
    }

    default <T> T getDeprecated(String key, String legacyKey, Class<T> type, T defaultValue) {
        return getDeprecated(key, legacyKey, type).orElse(defaultValue);
    }
}
