package com.kyonggi.http.config;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.ClassUtils;

import com.kyonggi.http.config.resolve.HttpConfigResolver;
import com.kyonggi.http.config.source.AppEnvironment;
import com.kyonggi.http.config.source.ConfigSource;
import com.kyonggi.http.config.source.PropertyResolverConfigSource;
import com.kyonggi.http.config.source.SpringAppEnvironment;
import com.kyonggi.http.global.ConfigResolution;
import com.kyonggi.http.security.JwtCookieCodec;

import lombok.extern.slf4j.Slf4j;

/**
 * HTTP 설정 모듈
 *
 * - 기동 시 HttpConfigResolver로 스냅샷을 1회 만들고, 스냅샷과 각 섹션을 싱글톤 빈으로 노출한다.
 * - 해석 실패 시 ConfigException을 그대로 던져 컨텍스트 생성 자체를 실패시킨다 (Fail-fast).
 */
@Slf4j
@Configuration
public class HttpConfigModule {

    private static final ZoneId KST = ZoneId.of("Asia/Seoul");

    /**
     * 테스트에서 별도 Clock 빈을 주면 이 빈은 만들어지지 않는다.
     */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.system(KST);
    }

    @Bean
    public ConfigSource httpConfigSource(ConfigurableEnvironment environment) {
        return new PropertyResolverConfigSource(environment);
    }

    @Bean
    public AppEnvironment appEnvironment(ConfigurableEnvironment environment, ResourceLoader resourceLoader) {
        ClassLoader classLoader = resourceLoader.getClassLoader();
        return new SpringAppEnvironment(environment,
                classLoader != null ? classLoader : ClassUtils.getDefaultClassLoader());
    }

    @Bean
    public HttpConfigResolver httpConfigResolver() {
        return new HttpConfigResolver();
    }

    @Bean
    public HttpConfiguration httpConfiguration(HttpConfigResolver resolver, ConfigSource httpConfigSource,
            AppEnvironment appEnvironment) {
        ConfigResolution resolution = resolver.resolve(httpConfigSource, appEnvironment);
        if (!resolution.isSuccess()) {
            log.error("HTTP 설정 검증 실패, 기동을 중단합니다. kind={}, key={}",
                    resolution.error().getKind(), resolution.error().getKey());
        }
        return resolution.orElseThrow();
    }

    @Bean
    public ParserConfiguration parserConfiguration(HttpConfiguration conf) {
        return conf.parser();
    }

    @Bean
    public ActionCompositionConfiguration actionCompositionConfiguration(HttpConfiguration conf) {
        return conf.actionComposition();
    }

    @Bean
    public CookiesConfiguration cookiesConfiguration(HttpConfiguration conf) {
        return conf.cookies();
    }

    @Bean
    public SessionConfiguration sessionConfiguration(HttpConfiguration conf) {
        return conf.session();
    }

    @Bean
    public FlashConfiguration flashConfiguration(HttpConfiguration conf) {
        return conf.flash();
    }

    @Bean
    public FileMimeTypesConfiguration fileMimeTypesConfiguration(HttpConfiguration conf) {
        return conf.fileMimeTypes();
    }

    @Bean
    public SecretConfiguration secretConfiguration(HttpConfiguration conf) {
        return conf.secret();
    }

    @Bean
    @Qualifier("session")
    public JwtCookieCodec sessionCookieCodec(HttpConfiguration conf, Clock clock) {
        return new JwtCookieCodec(conf.session().jwt(), conf.secret(), clock);
    }

    @Bean
    @Qualifier("flash")
    public JwtCookieCodec flashCookieCodec(HttpConfiguration conf, Clock clock) {
        return new JwtCookieCodec(conf.flash().jwt(), conf.secret(), clock);
    }
}
