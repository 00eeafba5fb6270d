package com.kyonggi.http.config.source;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.Optional;

import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;

import com.kyonggi.http.global.ConfigErrorKind;
import com.kyonggi.http.global.ConfigException;

/**
 * 스프링 Environment 기반 AppEnvironment
 *
 * mode 결정 순서:
 * 1) app.mode (dev / test / prod) 가 있으면 그 값
 * 2) "prod" 프로필 활성 -> PROD, "test" 프로필 활성 -> TEST
 * 3) 그 외 -> DEV
 */
public class SpringAppEnvironment implements AppEnvironment {

    public static final String MODE_KEY = "app.mode";

    private final Environment environment;
    private final ClassLoader classLoader;

    public SpringAppEnvironment(Environment environment, ClassLoader classLoader) {
        this.environment = environment;
        this.classLoader = classLoader;
    }

    @Override
    public AppMode mode() {
        String configured = environment.getProperty(MODE_KEY);
        if (configured != null && !configured.isBlank()) {
            return AppMode.parse(configured)
                    .orElseThrow(() -> new ConfigException(ConfigErrorKind.INVALID_VALUE, MODE_KEY,
                            "must be one of dev, test, prod"));
        }

        if (environment.acceptsProfiles(Profiles.of("prod"))) return AppMode.PROD;
        if (environment.acceptsProfiles(Profiles.of("test"))) return AppMode.TEST;
        return AppMode.DEV;
    }

    @Override
    public Optional<URI> resource(String name) {
        String path = name.startsWith("/") ? name.substring(1) : name;
        URL url = classLoader.getResource(path);
        if (url == null) return Optional.empty();

        try {
            return Optional.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Invalid resource location: " + url, e);
        }
    }
}
