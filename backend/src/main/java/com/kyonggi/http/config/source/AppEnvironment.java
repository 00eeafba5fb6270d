package com.kyonggi.http.config.source;

import java.net.URI;
import java.util.Optional;

/**
 * 실행 환경 정보
 * - mode: DEV / TEST / PROD
 * - resource(name): 클래스패스 리소스 위치 (없으면 empty)
 */
public interface AppEnvironment {

    /** dev secret 생성 시 seed로 쓰는 대표 설정 파일 */
    String PRIMARY_CONFIG_RESOURCE = "application.yml";

    AppMode mode();

    Optional<URI> resource(String name);
}
