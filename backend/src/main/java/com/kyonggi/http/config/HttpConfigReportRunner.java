package com.kyonggi.http.config;

import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import com.kyonggi.http.config.source.AppEnvironment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 기동 직후 해석된 HTTP 설정을 로그로 남긴다. (secret은 SecretConfiguration.toString()이 마스킹)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpConfigReportRunner implements CommandLineRunner {

    private final HttpConfiguration config;
    private final AppEnvironment environment;

    @Override
    public void run(String... args) {
        log.info("=============================================");
        log.info("       Resolved HTTP configuration ({})", environment.mode());
        log.info("=============================================");
        log.info("context           : {}", config.context());
        log.info("parser            : {}", config.parser());
        log.info("actionComposition : {}", config.actionComposition());
        log.info("cookies           : {}", config.cookies());
        log.info("session           : {}", config.session());
        log.info("flash             : {}", config.flash());
        log.info("fileMimeTypes     : {} entries", config.fileMimeTypes().mimeTypes().size());
        log.info("secret            : {}", config.secret());
        log.info("=============================================");
    }
}
