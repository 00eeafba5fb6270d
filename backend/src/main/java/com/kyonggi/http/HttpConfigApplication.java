package com.kyonggi.http;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

import com.kyonggi.http.config.HttpConfigModule;

/**
 * 설정 값 주입 흐름:
 *    환경변수(APP_HTTP_SECRET ...) -> application.yml(${ENV:default}) -> HttpConfigResolver -> HttpConfiguration 빈
 *
 * 운영 체크 포인트 (로그로 바로 확인)
 * - "Resolved HTTP configuration (PROD)" 블록이 찍히면 secret/경로 검증 통과
 * - prod 프로필인데 APP_HTTP_SECRET이 없으면 MISSING_SECRET으로 기동 실패가 정상
 */
@Import(HttpConfigModule.class)
@SpringBootApplication
public class HttpConfigApplication {
    public static void main(String[] args) {
        SpringApplication.run(HttpConfigApplication.class, args);
    }
}
