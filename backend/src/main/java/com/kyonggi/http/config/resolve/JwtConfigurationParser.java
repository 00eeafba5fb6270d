package com.kyonggi.http.config.resolve;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

import com.kyonggi.http.config.JwtConfiguration;
import com.kyonggi.http.config.SecretConfiguration;
import com.kyonggi.http.config.source.ConfigSource;
import com.kyonggi.http.global.ConfigErrorKind;
import com.kyonggi.http.global.ConfigException;
import com.kyonggi.http.global.ConfigException.WeakSecretDetails;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.SignatureAlgorithm;

/**
 * <parent>.jwt.* 섹션 -> JwtConfiguration
 *
 * 세션/플래시가 서로 다른 알고리즘을 고를 수 있으므로 섹션마다 한 번씩 호출된다.
 * 호출될 때마다 "secret 길이 >= 알고리즘 최소 키 길이"를 검증한다.
 *
 *   <parent>.signature-algorithm : HS256 (기본값)
 *   <parent>.expires-after       : 없음 (exp 클레임 생략)
 *   <parent>.clock-skew          : 30s
 *   <parent>.data-claim          : data
 */
public final class JwtConfigurationParser {

    private JwtConfigurationParser() {}

    public static JwtConfiguration parse(ConfigSource config, SecretConfiguration secret, String parent) {
        String signatureAlgorithm = getSignatureAlgorithm(config, secret, parent);

        Optional<Duration> expiresAfter = config.getOptional(parent + ".expires-after", Duration.class);
        Duration clockSkew = getClockSkew(config, parent);
        String dataClaim = config.get(parent + ".data-claim", String.class, JwtConfiguration.DEFAULT_DATA_CLAIM);

        return new JwtConfiguration(signatureAlgorithm, expiresAfter, clockSkew, dataClaim);
    }

    /**
     * 알고리즘 이름 -> 최소 키 길이(bit) 조회 후 secret 길이와 비교
     * - 모르는 이름: INVALID_ALGORITHM
     * - secret bit 수 부족: WEAK_SECRET (알고리즘/필요 bit/실제 bit 포함)
     */
    private static String getSignatureAlgorithm(ConfigSource config, SecretConfiguration secret, String parent) {
        String algorithmKey = parent + ".signature-algorithm";
        String algorithmName = config.get(algorithmKey, String.class, JwtConfiguration.DEFAULT_SIGNATURE_ALGORITHM).trim();

        int minKeyLengthBits = minKeyLengthBits(algorithmKey, algorithmName);
        int secretLengthBits = secret.secret().getBytes(StandardCharsets.UTF_8).length * 8;

        if (secretLengthBits < minKeyLengthBits) {
            String message = "The application secret is too short and does not have the recommended amount of entropy"
                    + " for algorithm " + algorithmName + " defined at " + algorithmKey + "."
                    + " Current application secret bits: " + secretLengthBits
                    + ", minimal required bits for algorithm " + algorithmName + ": " + minKeyLengthBits + ".";
            throw new ConfigException(ConfigErrorKind.WEAK_SECRET, HttpConfigResolver.SECRET_KEY, message,
                    new WeakSecretDetails(algorithmName, minKeyLengthBits, secretLengthBits));
        }
        return algorithmName;
    }

    /**
     * jjwt는 허용 오차를 초 단위로만 받는다. 1초 미만 나머지는 올림 (500ms -> 1s)
     */
    private static Duration getClockSkew(ConfigSource config, String parent) {
        String clockSkewKey = parent + ".clock-skew";
        Duration clockSkew = config.get(clockSkewKey, Duration.class, JwtConfiguration.DEFAULT_CLOCK_SKEW);

        if (clockSkew.isNegative()) {
            throw new ConfigException(ConfigErrorKind.INVALID_VALUE, clockSkewKey,
                    clockSkewKey + " must not be negative: " + clockSkew);
        }
        if (clockSkew.getNano() > 0) {
            return Duration.ofSeconds(clockSkew.getSeconds() + 1);
        }
        return clockSkew;
    }

    static int minKeyLengthBits(String algorithmKey, String algorithmName) {
        try {
            return SignatureAlgorithm.forName(algorithmName).getMinKeyLength();
        } catch (JwtException e) {
            throw new ConfigException(ConfigErrorKind.INVALID_ALGORITHM, algorithmKey,
                    "Unknown JWT signature algorithm: " + algorithmName, null, e);
        }
    }
}
