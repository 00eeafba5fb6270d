package com.kyonggi.http.config.resolve;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.DigestUtils;
import org.springframework.util.unit.DataSize;

import com.kyonggi.http.config.ActionCompositionConfiguration;
import com.kyonggi.http.config.CookiesConfiguration;
import com.kyonggi.http.config.FileMimeTypesConfiguration;
import com.kyonggi.http.config.FlashConfiguration;
import com.kyonggi.http.config.HttpConfiguration;
import com.kyonggi.http.config.ParserConfiguration;
import com.kyonggi.http.config.SameSite;
import com.kyonggi.http.config.SecretConfiguration;
import com.kyonggi.http.config.SessionConfiguration;
import com.kyonggi.http.config.source.AppEnvironment;
import com.kyonggi.http.config.source.AppMode;
import com.kyonggi.http.config.source.ConfigSource;
import com.kyonggi.http.global.ConfigErrorKind;
import com.kyonggi.http.global.ConfigException;
import com.kyonggi.http.global.ConfigResolution;

/**
 * app.http.* 설정 -> 검증/기본값이 채워진 HttpConfiguration 스냅샷
 *
 * - 기동 시 1회 호출. 실패는 전부 치명적이며 재시도하지 않는다.
 * - 예외를 던지는 대신 ConfigResolution으로 돌려주고, 기동 중단은 호출자가 한다.
 * - 유일한 "관대한" 처리: 잘못된 SameSite 값은 경고 로그 후 속성 없음으로 취급.
 *
 * 처리 순서:
 * 1) 금지 키(mimetype) 검사
 * 2) 경로 검증 (context, session.path, flash.path)
 * 3) secret 해석 (prod 미설정 -> 실패 / dev,test 미설정 -> 안정적인 dev secret 생성)
 * 4) 나머지 섹션 + 세션/플래시 JWT 섹션 (섹션마다 secret 강도 검증)
 */
public class HttpConfigResolver {

    public static final String PREFIX = "app.http";

    public static final String CONTEXT_KEY = PREFIX + ".context";
    public static final String LEGACY_CONTEXT_KEY = "application.context";
    public static final String SESSION_PREFIX = PREFIX + ".session";
    public static final String FLASH_PREFIX = PREFIX + ".flash";
    public static final String FILE_MIME_TYPES_KEY = PREFIX + ".file-mime-types";
    public static final String SECRET_KEY = PREFIX + ".secret.key";
    public static final String SECRET_PROVIDER_KEY = PREFIX + ".secret.provider";
    public static final String LEGACY_SECRET_PROVIDER_KEY = "app.crypto.provider";
    public static final String FORBIDDEN_MIMETYPE_KEY = "mimetype";

    // dev/test 전용. 보안 목적이 아니라 "앱끼리 localhost 세션 쿠키가 섞이지 않게" 하는 용도
    static final String DEV_FALLBACK_SEED = "she sells sea shells on the sea shore";
    static final String DEV_SEED_SUFFIX = "the shells she sells are sea-shells";

    private final Logger log;

    public HttpConfigResolver() {
        this(LoggerFactory.getLogger(HttpConfigResolver.class));
    }

    public HttpConfigResolver(Logger log) {
        this.log = log;
    }

    public ConfigResolution resolve(ConfigSource config, AppEnvironment environment) {
        try {
            return ConfigResolution.success(fromConfiguration(config, environment));
        } catch (ConfigException e) {
            return ConfigResolution.failure(e);
        }
    }

    private HttpConfiguration fromConfiguration(ConfigSource config, AppEnvironment environment) {
        if (config.has(FORBIDDEN_MIMETYPE_KEY)) {
            throw new ConfigException(ConfigErrorKind.FORBIDDEN_KEY, FORBIDDEN_MIMETYPE_KEY,
                    "mimetype replaced by " + FILE_MIME_TYPES_KEY + " map");
        }

        String context = getPath(config, CONTEXT_KEY, LEGACY_CONTEXT_KEY);
        String sessionPath = getPath(config, SESSION_PREFIX + ".path", null);
        String flashPath = getPath(config, FLASH_PREFIX + ".path", null);

        SecretConfiguration secret = resolveSecret(config, environment);

        return new HttpConfiguration(
                context,
                parserConfiguration(config),
                actionCompositionConfiguration(config),
                new CookiesConfiguration(config.get(PREFIX + ".cookies.strict", Boolean.class,
                        CookiesConfiguration.defaults().strict())),
                sessionConfiguration(config, secret, sessionPath),
                flashConfiguration(config, secret, flashPath),
                new FileMimeTypesConfiguration(
                        parseFileMimeTypes(config.get(FILE_MIME_TYPES_KEY, String.class, ""))),
                secret);
    }

    private static String getPath(ConfigSource config, String key, String legacyKey) {
        String path = (legacyKey == null)
                ? config.get(key, String.class, "/")
                : config.getDeprecated(key, legacyKey, String.class, "/");

        if (!path.startsWith("/")) {
            throw new ConfigException(ConfigErrorKind.INVALID_PATH, key, key + " must start with a /");
        }
        return path;
    }

    private static ParserConfiguration parserConfiguration(ConfigSource config) {
        String prefix = PREFIX + ".parser";
        DataSize maxMemoryBuffer = config.getDeprecated(prefix + ".max-memory-buffer", "parsers.text.max-length",
                DataSize.class, DataSize.ofBytes(ParserConfiguration.DEFAULT_MAX_MEMORY_BUFFER));
        DataSize maxDiskBuffer = config.get(prefix + ".max-disk-buffer",
                DataSize.class, DataSize.ofBytes(ParserConfiguration.DEFAULT_MAX_DISK_BUFFER));

        return new ParserConfiguration(
                maxMemoryBuffer.toBytes(),
                maxDiskBuffer.toBytes(),
                config.get(prefix + ".allow-empty-files", Boolean.class, false));
    }

    private static ActionCompositionConfiguration actionCompositionConfiguration(ConfigSource config) {
        String prefix = PREFIX + ".action-composition";
        return new ActionCompositionConfiguration(
                config.get(prefix + ".controller-annotations-first", Boolean.class, false),
                config.get(prefix + ".execute-action-creator-action-first", Boolean.class, false),
                config.get(prefix + ".include-web-socket-actions", Boolean.class, false));
    }

    private SessionConfiguration sessionConfiguration(ConfigSource config, SecretConfiguration secret, String path) {
        SessionConfiguration defaults = SessionConfiguration.defaults();
        String p = SESSION_PREFIX;

        return new SessionConfiguration(
                config.getDeprecated(p + ".cookie-name", "session.cookie-name", String.class, defaults.cookieName()),
                config.getDeprecated(p + ".secure", "session.secure", Boolean.class, defaults.secure()),
                config.getDeprecated(p + ".max-age", "session.max-age", Duration.class),
                config.getDeprecated(p + ".http-only", "session.http-only", Boolean.class, defaults.httpOnly()),
                config.getDeprecated(p + ".domain", "session.domain", String.class),
                path,
                sameSiteOrDefault(config, p + ".same-site", defaults.sameSite()),
                config.getDeprecated(p + ".partitioned", "session.partitioned", Boolean.class, defaults.partitioned()),
                JwtConfigurationParser.parse(config, secret, p + ".jwt"));
    }

    private FlashConfiguration flashConfiguration(ConfigSource config, SecretConfiguration secret, String path) {
        FlashConfiguration defaults = FlashConfiguration.defaults();
        String p = FLASH_PREFIX;

        return new FlashConfiguration(
                config.getDeprecated(p + ".cookie-name", "flash.cookie-name", String.class, defaults.cookieName()),
                config.get(p + ".secure", Boolean.class, defaults.secure()),
                config.get(p + ".http-only", Boolean.class, defaults.httpOnly()),
                config.getOptional(p + ".domain", String.class),
                path,
                sameSiteOrDefault(config, p + ".same-site", defaults.sameSite()),
                config.get(p + ".partitioned", Boolean.class, defaults.partitioned()),
                JwtConfigurationParser.parse(config, secret, p + ".jwt"));
    }

    // 키가 아예 없으면 섹션 기본값(Lax), 키가 있으면 그 값을 해석 (빈 값 = 속성 없음)
    private Optional<SameSite> sameSiteOrDefault(ConfigSource config, String key, Optional<SameSite> defaultValue) {
        return config.has(key) ? parseSameSite(config, key) : defaultValue;
    }

    /**
     * SameSite 파싱
     * - 알 수 없는 값은 실패가 아니라 경고 후 empty (관대한 처리)
     */
    public Optional<SameSite> parseSameSite(ConfigSource config, String key) {
        return config.getOptional(key, String.class).flatMap(value -> {
            Optional<SameSite> result = SameSite.parse(value);
            if (result.isEmpty()) {
                log.warn("Assuming {} = null, since \"{}\" is not a valid SameSite value (Strict, Lax, None)", key, value);
            }
            return result;
        });
    }

    /**
     * MIME 타입 텍스트 블롭 파싱
     *
     *   # comment
     *   txt=text/plain
     *   html=text/html
     *
     * - 줄 단위 trim, 빈 줄/주석(#) 무시
     * - 첫 번째 '=' 기준으로 (확장자, MIME 타입) 분리, '='가 없는 줄만 무시
     * - '=' 양옆 공백은 그대로 둔다 ("=foo" 는 빈 확장자 키)
     * - 같은 확장자가 여러 번 나오면 마지막 값이 이긴다
     */
    public static Map<String, String> parseFileMimeTypes(String text) {
        if (text == null || text.isEmpty()) return Collections.emptyMap();

        Map<String, String> mimeTypes = new LinkedHashMap<>();
        for (String raw : text.split("\n")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;

            int eq = line.indexOf('=');
            if (eq < 0) continue;

            mimeTypes.put(line.substring(0, eq), line.substring(eq + 1));
        }
        return mimeTypes;
    }

    /**
     * secret 해석
     *
     * - 없음 / 공백 / "changeme" 는 모두 "미설정"
     * - 미설정 + PROD: MISSING_SECRET (기동 실패)
     * - 미설정 + DEV/TEST: application.yml 위치 기반 dev secret 생성 (재시작해도 동일)
     * - 그 외: 설정값 그대로
     */
    private SecretConfiguration resolveSecret(ConfigSource config, AppEnvironment environment) {
        Optional<String> configured = config.getOptional(SECRET_KEY, String.class)
                .filter(s -> !SecretConfiguration.SENTINEL.equals(s));

        String secret;
        if (configured.isPresent()) {
            secret = configured.get();
        } else if (environment.mode() == AppMode.PROD) {
            throw new ConfigException(ConfigErrorKind.MISSING_SECRET, SECRET_KEY,
                    "The application secret has not been set, and we are in prod mode. Your application is not secure."
                            + " Set " + SECRET_KEY + " (APP_HTTP_SECRET) to a long random value.");
        } else {
            Optional<URI> location = environment.resource(AppEnvironment.PRIMARY_CONFIG_RESOURCE);
            secret = deriveDevSecret(location.map(URI::toString).orElse(DEV_FALLBACK_SEED));
            log.debug("Generated dev mode secret for app at {}", location.map(URI::toString).orElse("unknown location"));
        }

        Optional<String> provider = config.getDeprecated(SECRET_PROVIDER_KEY, LEGACY_SECRET_PROVIDER_KEY, String.class);
        return new SecretConfiguration(secret, provider);
    }

    /**
     * md5hex(seed) + md5hex(seed + suffix) = 64 bytes (512 bits), HS512까지 통과하는 길이.
     * 보안 보장은 없다. 같은 seed(=같은 설정 파일 위치)면 항상 같은 값이 나와야 한다.
     */
    static String deriveDevSecret(String seed) {
        String first = DigestUtils.md5DigestAsHex(seed.getBytes(StandardCharsets.UTF_8));
        String second = DigestUtils.md5DigestAsHex((seed + DEV_SEED_SUFFIX).getBytes(StandardCharsets.UTF_8));
        return first + second;
    }
}
