package com.polishfootball.network.infrastructure.cache;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Builds cache keys of the form {@code namespace:token1:token2:...}.
 * <p>
 * Callers add tokens in a fixed order; absent values add nothing. Values are normalized
 * (enums and case-insensitive strings lower-cased, decimals stripped of trailing zeros,
 * collections de-duplicated and sorted) and escaped so no value can produce a separator.
 */
public final class CacheKeyBuilder {

    static final String SEPARATOR = ":";

    private static final DateTimeFormatter DATE_TOKEN = DateTimeFormatter.BASIC_ISO_DATE;

    private final List<String> parts = new ArrayList<>();

    private CacheKeyBuilder(String namespace) {
        parts.add(namespace);
    }

    public static CacheKeyBuilder forNamespace(String namespace) {
        if (namespace == null || namespace.isBlank() || namespace.contains(SEPARATOR)) {
            throw new IllegalArgumentException("Invalid cache namespace: " + namespace);
        }
        return new CacheKeyBuilder(namespace);
    }

    /**
     * Bare value token, e.g. an entity id.
     */
    public CacheKeyBuilder segment(Object value) {
        parts.add(format(Objects.requireNonNull(value, "value")));
        return this;
    }

    /**
     * {@code name-value} token that is always present.
     */
    public CacheKeyBuilder token(String name, Object value) {
        parts.add(name + "-" + format(Objects.requireNonNull(value, name)));
        return this;
    }

    public CacheKeyBuilder tokenIfPresent(String name, Object value) {
        if (value == null || (value instanceof String text && text.isBlank())) {
            return this;
        }
        return token(name, value);
    }

    /**
     * Token for a case-insensitive text field: trimmed and lower-cased.
     */
    public CacheKeyBuilder caseInsensitiveTokenIfPresent(String name, String value) {
        if (value == null || value.isBlank()) {
            return this;
        }
        return token(name, value.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Bare {@code name} token, present only when the flag is set.
     */
    public CacheKeyBuilder flag(String name, boolean enabled) {
        if (enabled) {
            parts.add(name);
        }
        return this;
    }

    /**
     * Order-insensitive token for a collection filter.
     */
    public CacheKeyBuilder setTokenIfPresent(String name, Collection<?> values) {
        if (values == null || values.isEmpty()) {
            return this;
        }
        TreeSet<String> normalized = new TreeSet<>();
        for (Object value : values) {
            if (value != null) {
                normalized.add(format(value));
            }
        }
        if (!normalized.isEmpty()) {
            parts.add(name + "-" + String.join(",", normalized));
        }
        return this;
    }

    public String build() {
        return String.join(SEPARATOR, parts);
    }

    private static String format(Object value) {
        if (value instanceof Enum<?> enumValue) {
            return enumValue.name().toLowerCase(Locale.ROOT);
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(((Number) value).doubleValue()).stripTrailingZeros().toPlainString();
        }
        if (value instanceof LocalDate date) {
            return date.format(DATE_TOKEN);
        }
        return escape(value.toString());
    }

    static String escape(String raw) {
        return raw.replace("%", "%25")
                .replace(SEPARATOR, "%3A")
                .replace(",", "%2C");
    }
}
