package com.kyonggi.http.config;

/**
 * 액션 조합 설정
 * - controllerAnnotationsFirst: 컨트롤러에 붙은 애노테이션을 액션 애노테이션보다 먼저 실행
 * - executeActionCreatorActionFirst: action creator가 만든 액션을 조합 액션보다 먼저 실행
 * - includeWebSocketActions: WebSocket 액션도 조합 대상에 포함
 */
public record ActionCompositionConfiguration(
        boolean controllerAnnotationsFirst,
        boolean executeActionCreatorActionFirst,
        boolean includeWebSocketActions
) {
    public static ActionCompositionConfiguration defaults() {
        return new ActionCompositionConfiguration(false, false, false);
    }
}
