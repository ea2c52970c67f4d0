package com.example.vulncases.models;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Category a test case targets. Input matching is case-insensitive; {@link #value()} is the
 * canonical spelling persisted and returned to clients.
 */
public enum Platform {
    LLM("LLM"),
    WEB("web"),
    MOBILE("mobile"),
    API("API");

    private final String value;

    Platform(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<Platform> fromInput(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String candidate = raw.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.name().equals(candidate))
                .findFirst();
    }

    public static List<String> canonicalValues() {
        return Arrays.stream(values()).map(Platform::value).toList();
    }
}
