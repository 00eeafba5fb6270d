package com.kyonggi.http.config.source;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum AppMode {
    DEV, TEST, PROD;

    public static Optional<AppMode> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();

        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(m -> m.name().equals(normalized))
                .findFirst();
    }
}
