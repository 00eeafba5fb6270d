package com.kyonggi.http.global;

/**
 * 설정 오류 종류 + 기본 메시지의 단일 소스.
 *
 * 원칙:
 * - 모든 종류는 "부팅 실패(Fail-fast)" 사유다. 재시도/부분 성공은 없다.
 * - 메시지에는 항상 문제가 된 설정 키를 함께 붙인다 (ConfigException.key).
 */
public enum ConfigErrorKind {

    INVALID_PATH("path must start with a /"),
    MISSING_SECRET("The application secret has not been set, and we are in prod mode. Your application is not secure."),
    WEAK_SECRET("The application secret is too short for the configured signature algorithm."),
    FORBIDDEN_KEY("This configuration key is no longer supported."),
    INVALID_ALGORITHM("Unknown JWT signature algorithm."),
    INVALID_VALUE("Configuration value has an invalid format.");

    private final String defaultMessage;

    ConfigErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
