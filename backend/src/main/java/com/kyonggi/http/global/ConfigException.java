package com.kyonggi.http.global;

import lombok.Getter;

/**
 * HTTP 설정 해석(resolve) 단계에서 발견된 치명적 설정 오류
 *
 * - kind: 오류 분류 (ConfigErrorKind)
 * - key: 문제가 된 설정 키 (ex: app.http.session.path)
 * - details: 추가 정보 (WEAK_SECRET이면 WeakSecretDetails)
 *
 * 이 예외가 빈 생성 중 밖으로 나가면 스프링 컨텍스트가 뜨지 않는다 = 애플리케이션 기동 중단.
 */
@Getter
public class ConfigException extends RuntimeException {

    private final ConfigErrorKind kind;
    private final String key;
    private final transient Object details;

    public ConfigException(ConfigErrorKind kind, String key) {
        this(kind, key, null, null, null);
    }

    public ConfigException(ConfigErrorKind kind, String key, String messageOverride) {
        this(kind, key, messageOverride, null, null);
    }

    public ConfigException(ConfigErrorKind kind, String key, String messageOverride, Object details) {
        this(kind, key, messageOverride, details, null);
    }

    public ConfigException(ConfigErrorKind kind, String key, String messageOverride, Object details, Throwable cause) {
        super(resolveMessage(kind, key, messageOverride), cause);

        if (kind == null)
            throw new IllegalArgumentException("ConfigErrorKind must not be null");

        this.kind = kind;
        this.key = key;
        this.details = details;
    }

    private static String resolveMessage(ConfigErrorKind kind, String key, String messageOverride) {
        String message = (messageOverride != null && !messageOverride.isBlank())
                ? messageOverride
                : (kind == null ? null : kind.defaultMessage());
        return key == null ? message : "Configuration error [" + key + "]: " + message;
    }

    /**
     * WEAK_SECRET 상세 정보
     * - algorithm: 섹션이 선택한 서명 알고리즘 (ex: HS256)
     * - requiredBits: 알고리즘 최소 키 길이
     * - actualBits: 현재 secret 바이트 길이 * 8
     */
    public record WeakSecretDetails(String algorithm, int requiredBits, int actualBits) {
    }
}
