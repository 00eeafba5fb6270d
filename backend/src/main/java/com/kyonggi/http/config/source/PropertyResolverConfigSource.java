package com.kyonggi.http.config.source;

import java.util.Arrays;
import java.util.Optional;

import org.springframework.boot.convert.ApplicationConversionService;
import org.springframework.core.convert.ConversionException;
import org.springframework.core.convert.ConversionService;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.EnumerablePropertySource;
import org.springframework.core.env.PropertySource;

import com.kyonggi.http.global.ConfigErrorKind;
import com.kyonggi.http.global.ConfigException;

import lombok.extern.slf4j.Slf4j;

/**
 * 스프링 Environment(application.yml + 프로필 + 환경변수 ...) 위에 얹은 ConfigSource 구현
 *
 * - 원문은 항상 String으로 꺼내고(placeholder ${ENV:default} 해석 포함),
 *   타입 변환은 ApplicationConversionService가 담당한다.
 *     "100KB" -> DataSize, "30s" / "PT30S" -> Duration, "true" -> Boolean
 * - Environment 자체의 ConversionService에 의존하지 않으므로 MockEnvironment에서도 동일하게 동작한다.
 */
@Slf4j
public class PropertyResolverConfigSource implements ConfigSource {

    private final ConfigurableEnvironment environment;
    private final ConversionService conversionService;

    public PropertyResolverConfigSource(ConfigurableEnvironment environment) {
        this(environment, ApplicationConversionService.getSharedInstance());
    }

    public PropertyResolverConfigSource(ConfigurableEnvironment environment, ConversionService conversionService) {
        this.environment = environment;
        this.conversionService = conversionService;
    }

    @Override
    public boolean has(String key) {
        if (environment.containsProperty(key)) return true;

        // YAML 중첩 키는 평탄화되어 들어오므로 (mimetype.txt=...) 하위 키까지 본다.
        String nested = key + ".";
        String indexed = key + "[";
        for (PropertySource<?> source : environment.getPropertySources()) {
            if (source instanceof EnumerablePropertySource<?> enumerable
                    && Arrays.stream(enumerable.getPropertyNames())
                            .anyMatch(name -> name.startsWith(nested) || name.startsWith(indexed))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public <T> Optional<T> getOptional(String key, Class<T> type) {
        String raw = readRaw(key);
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        if (type == String.class) {
            return Optional.of(type.cast(raw));
        }

        try {
            return Optional.ofNullable(conversionService.convert(raw.trim(), type));
        } catch (ConversionException e) {
            throw new ConfigException(ConfigErrorKind.INVALID_VALUE, key,
                    "cannot convert value to " + type.getSimpleName(), null, e);
        }
    }

    @Override
    public <T> Optional<T> getDeprecated(String key, String legacyKey, Class<T> type) {
        // 빈 값은 없는 키로 취급 (${ENV:} 가 비어 있으면 레거시 키로 넘어간다)
        Optional<T> current = getOptional(key, type);
        boolean hasLegacy = getOptional(legacyKey, String.class).isPresent();

        if (current.isPresent()) {
            if (hasLegacy) {
                log.warn("{} is deprecated and ignored, because {} is also set", legacyKey, key);
            }
            return current;
        }
        if (hasLegacy) {
            log.warn("{} is deprecated, use {} instead", legacyKey, key);
            return getOptional(legacyKey, type);
        }
        return Optional.empty();
    }

    private String readRaw(String key) {
        try {
            return environment.getProperty(key);
        } catch (IllegalArgumentException e) {
            // ${APP_HTTP_SECRET} 처럼 기본값 없는 placeholder가 풀리지 않은 경우
            throw new ConfigException(ConfigErrorKind.INVALID_VALUE, key, e.getMessage(), null, e);
        }
    }
}
