package com.kyonggi.http.config;

import java.util.Optional;

/**
 * 애플리케이션 secret (세션/플래시 쿠키 서명 키)
 *
 * - secret: "changeme"(SENTINEL)는 "설정 안 됨"을 뜻하는 자리표시자.
 *     prod 모드에서 비어있거나 SENTINEL이면 기동 실패.
 *     dev/test 모드에서는 application.yml 위치 기반으로 안정적인 secret을 만들어 쓴다.
 * - provider: 사용할 JCE provider 이름 (없으면 플랫폼 기본값)
 */
public record SecretConfiguration(String secret, Optional<String> provider) {

    public static final String SENTINEL = "changeme";

    public static SecretConfiguration defaults() {
        return new SecretConfiguration(SENTINEL, Optional.empty());
    }

    // secret 원문이 로그/예외 메시지로 새지 않도록 마스킹
    @Override
    public String toString() {
        int length = (secret == null) ? 0 : secret.length();
        return "SecretConfiguration[secret=****(" + length + " chars), provider=" + provider + "]";
    }
}
