package com.polishfootball.network.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.TypeFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Declares how a cached value is stored.
 * <p>
 * {@link #primitive(Class)} values (strings, numbers, booleans, dates) are kept as they are;
 * {@link #json(Class)} and {@link #json(TypeReference)} values are opaque payloads serialized
 * with Jackson on write and read back into the declared type.
 */
public final class CacheValueType<T> {

    private static final Map<Class<?>, Function<String, ?>> PRIMITIVE_PARSERS = Map.of(
            String.class, Function.identity(),
            Integer.class, Integer::valueOf,
            Long.class, Long::valueOf,
            Double.class, Double::valueOf,
            Boolean.class, Boolean::valueOf,
            Instant.class, Instant::parse,
            LocalDate.class, LocalDate::parse
    );

    private final Class<T> primitiveType;
    private final JavaType jsonType;

    private CacheValueType(Class<T> primitiveType, JavaType jsonType) {
        this.primitiveType = primitiveType;
        this.jsonType = jsonType;
    }

    public static <T> CacheValueType<T> primitive(Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (!PRIMITIVE_PARSERS.containsKey(type)) {
            throw new IllegalArgumentException(type.getName() + " is not a primitive cache type, use json()");
        }
        return new CacheValueType<>(type, null);
    }

    public static <T> CacheValueType<T> json(Class<T> type) {
        return new CacheValueType<>(null, TypeFactory.defaultInstance().constructType(Objects.requireNonNull(type, "type")));
    }

    public static <T> CacheValueType<T> json(TypeReference<T> type) {
        return new CacheValueType<>(null, TypeFactory.defaultInstance().constructType(Objects.requireNonNull(type, "type")));
    }

    public boolean isPrimitive() {
        return primitiveType != null;
    }

    String encode(T value, ObjectMapper objectMapper) throws JsonProcessingException {
        return isPrimitive() ? value.toString() : objectMapper.writeValueAsString(value);
    }

    T decode(String raw, ObjectMapper objectMapper) throws JsonProcessingException {
        if (isPrimitive()) {
            return primitiveType.cast(PRIMITIVE_PARSERS.get(primitiveType).apply(raw));
        }
        return objectMapper.readValue(raw, jsonType);
    }

    /**
     * Narrows a value held in memory as-is; only primitive values are stored that way.
     */
    T cast(Object stored) {
        if (!isPrimitive()) {
            throw new IllegalStateException("JSON cache values are stored serialized: " + this);
        }
        return primitiveType.cast(stored);
    }

    @Override
    public String toString() {
        return isPrimitive() ? "primitive:" + primitiveType.getName() : "json:" + jsonType.toCanonical();
    }
}
