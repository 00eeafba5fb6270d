package com.kyonggi.http.config.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import com.kyonggi.http.global.ConfigErrorKind;
import com.kyonggi.http.global.ConfigException;

@DisplayName("[Config][Source] SpringAppEnvironment 테스트")
class SpringAppEnvironmentTest {

    private final ClassLoader classLoader = getClass().getClassLoader();

    @Test
    @DisplayName("app.mode 가 있으면 프로필보다 우선")
    void explicit_mode_wins_over_profiles() {
        MockEnvironment env = new MockEnvironment().withProperty("app.mode", "Prod");
        env.setActiveProfiles("test");

        assertThat(new SpringAppEnvironment(env, classLoader).mode()).isEqualTo(AppMode.PROD);
    }

    @Test
    @DisplayName("프로필: prod → PROD, test → TEST, 없음 → DEV")
    void mode_follows_active_profiles() {
        MockEnvironment prod = new MockEnvironment();
        prod.setActiveProfiles("prod");
        MockEnvironment test = new MockEnvironment();
        test.setActiveProfiles("test");

        assertThat(new SpringAppEnvironment(prod, classLoader).mode()).isEqualTo(AppMode.PROD);
        assertThat(new SpringAppEnvironment(test, classLoader).mode()).isEqualTo(AppMode.TEST);
        assertThat(new SpringAppEnvironment(new MockEnvironment(), classLoader).mode()).isEqualTo(AppMode.DEV);
    }

    @Test
    @DisplayName("알 수 없는 app.mode → INVALID_VALUE")
    void unknown_mode_fails() {
        MockEnvironment env = new MockEnvironment().withProperty("app.mode", "staging");

        assertThatThrownBy(() -> new SpringAppEnvironment(env, classLoader).mode())
                .isInstanceOfSatisfying(ConfigException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ConfigErrorKind.INVALID_VALUE);
                    assertThat(e.getKey()).isEqualTo("app.mode");
                });
    }

    @Test
    @DisplayName("클래스패스 리소스 위치 조회 (앞의 '/'는 무시), 없으면 empty")
    void resolves_classpath_resources() {
        SpringAppEnvironment env = new SpringAppEnvironment(new MockEnvironment(), classLoader);

        assertThat(env.resource(AppEnvironment.PRIMARY_CONFIG_RESOURCE))
                .hasValueSatisfying(uri -> assertThat(uri.toString()).endsWith("application.yml"));
        assertThat(env.resource("/application.yml")).isEqualTo(env.resource("application.yml"));
        assertThat(env.resource("no-such-config.yml")).isEmpty();
    }
}
