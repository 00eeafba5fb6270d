package com.kyonggi.http.config;

/**
 * HTTP 레이어 설정 스냅샷 (애플리케이션 기동 시 1회 생성, 이후 읽기 전용)
 *
 * - context: 애플리케이션 HTTP context path ("/"로 시작)
 * - parser: 바디 파서 버퍼 제한
 * - actionComposition: 액션 조합 순서 플래그
 * - cookies: 쿠키 파싱 엄격도
 * - session / flash: 세션/플래시 쿠키 설정 (+ 각자의 JWT 설정)
 * - fileMimeTypes: 확장자 -> MIME 타입
 * - secret: 쿠키 서명용 애플리케이션 secret
 *
 * 생성은 HttpConfigResolver만 한다고 가정한다. (검증 없이 new 하면 불변식이 보장되지 않음)
 */
public record HttpConfiguration(
        String context,
        ParserConfiguration parser,
        ActionCompositionConfiguration actionComposition,
        CookiesConfiguration cookies,
        SessionConfiguration session,
        FlashConfiguration flash,
        FileMimeTypesConfiguration fileMimeTypes,
        SecretConfiguration secret
) {

    public static final String DEFAULT_CONTEXT = "/";

    public static HttpConfiguration defaults() {
        return new HttpConfiguration(
                DEFAULT_CONTEXT,
                ParserConfiguration.defaults(),
                ActionCompositionConfiguration.defaults(),
                CookiesConfiguration.defaults(),
                SessionConfiguration.defaults(),
                FlashConfiguration.defaults(),
                FileMimeTypesConfiguration.defaults(),
                SecretConfiguration.defaults());
    }
}
