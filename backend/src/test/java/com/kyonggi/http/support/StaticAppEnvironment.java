package com.kyonggi.http.support;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

import com.kyonggi.http.config.source.AppEnvironment;
import com.kyonggi.http.config.source.AppMode;

/**
 * 모드/리소스 위치를 고정한 테스트용 AppEnvironment
 */
public record StaticAppEnvironment(AppMode mode, Map<String, URI> resources) implements AppEnvironment {

    public static StaticAppEnvironment of(AppMode mode) {
        return new StaticAppEnvironment(mode, Map.of());
    }

    public static StaticAppEnvironment withPrimaryConfigAt(AppMode mode, String location) {
        return new StaticAppEnvironment(mode, Map.of(PRIMARY_CONFIG_RESOURCE, URI.create(location)));
    }

    @Override
    public Optional<URI> resource(String name) {
        return Optional.ofNullable(resources.get(name));
    }
}
