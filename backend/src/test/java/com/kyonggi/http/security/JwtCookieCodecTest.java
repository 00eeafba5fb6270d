package com.kyonggi.http.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.kyonggi.http.config.JwtConfiguration;
import com.kyonggi.http.config.SecretConfiguration;
import com.kyonggi.http.support.MutableClock;

@DisplayName("[Security] JwtCookieCodec 테스트")
class JwtCookieCodecTest {

    private static final SecretConfiguration SECRET =
            new SecretConfiguration("0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef", Optional.empty());
    private static final SecretConfiguration OTHER_SECRET =
            new SecretConfiguration("fedcba9876543210fedcba9876543210fedcba9876543210fedcba9876543210", Optional.empty());

    private final MutableClock clock = MutableClock.startingAtTestStart();

    private static JwtConfiguration jwt(String algorithm, Duration expiresAfter) {
        return new JwtConfiguration(algorithm, Optional.ofNullable(expiresAfter), Duration.ofSeconds(30), "data");
    }

    @Test
    @DisplayName("서명한 쿠키 값은 같은 secret으로 다시 읽힌다")
    void decodes_what_it_encodes() {
        JwtCookieCodec codec = new JwtCookieCodec(jwt("HS512", null), SECRET, clock);

        String token = codec.encode(Map.of("userId", "42", "role", "USER"));

        assertThat(token.split("\\.")).hasSize(3);
        assertThat(codec.decode(token)).containsExactlyInAnyOrderEntriesOf(Map.of("userId", "42", "role", "USER"));
    }

    @Test
    @DisplayName("다른 secret으로 서명된 토큰 → 빈 맵")
    void rejects_token_signed_with_other_secret() {
        String foreign = new JwtCookieCodec(jwt("HS256", null), OTHER_SECRET, clock).encode(Map.of("userId", "1"));

        JwtCookieCodec codec = new JwtCookieCodec(jwt("HS256", null), SECRET, clock);

        assertThat(codec.decode(foreign)).isEmpty();
    }

    @Test
    @DisplayName("expiresAfter 경과 + clockSkew 허용치 이내 → 유효, 초과 → 빈 맵")
    void honours_expiry_with_clock_skew() {
        JwtCookieCodec codec = new JwtCookieCodec(jwt("HS256", Duration.ofMinutes(1)), SECRET, clock);
        String token = codec.encode(Map.of("flash", "saved"));

        clock.advance(Duration.ofSeconds(80)); // exp + 20s (skew 30s 이내)
        assertThat(codec.decode(token)).containsEntry("flash", "saved");

        clock.advance(Duration.ofSeconds(20)); // exp + 40s
        assertThat(codec.decode(token)).isEmpty();
    }

    @Test
    @DisplayName("빈 값/깨진 토큰 → 빈 맵")
    void blank_or_garbage_token_yields_empty_map() {
        JwtCookieCodec codec = new JwtCookieCodec(jwt("HS256", null), SECRET, clock);

        assertThat(codec.decode(null)).isEmpty();
        assertThat(codec.decode("  ")).isEmpty();
        assertThat(codec.decode("not.a.jwt")).isEmpty();
    }

    @Test
    @DisplayName("HMAC이 아닌 알고리즘은 쿠키 서명에 사용할 수 없다")
    void requires_hmac_algorithm() {
        assertThatThrownBy(() -> new JwtCookieCodec(jwt("RS256", null), SECRET, clock))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("HMAC");
    }
}
