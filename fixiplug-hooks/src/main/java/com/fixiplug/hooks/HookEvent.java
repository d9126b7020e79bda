package com.fixiplug.hooks;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Open key/value payload threaded through a hook's handlers.
 * <p>
 * Keys keep insertion order. Values are whatever handlers put in; events made of
 * JSON-friendly values (strings, numbers, lists, maps, POJOs) serialise through
 * Jackson as a flat object.
 */
public class HookEvent {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final Map<String, Object> data;

    public HookEvent() {
        this.data = new LinkedHashMap<>();
    }

    private HookEvent(Map<String, Object> data) {
        this.data = data;
    }

    public static HookEvent empty() {
        return new HookEvent();
    }

    /**
     * Create an event holding a shallow copy of the given map.
     */
    public static HookEvent of(Map<String, ?> values) {
        HookEvent event = new HookEvent();
        if (values != null) {
            event.data.putAll(values);
        }
        return event;
    }

    public static HookEvent of(String key, Object value) {
        return new HookEvent().put(key, value);
    }

    // --- Accessors ---

    public HookEvent put(String key, Object value) {
        data.put(key, value);
        return this;
    }

    @JsonAnySetter
    void set(String key, Object value) {
        data.put(key, value);
    }

    public Object get(String key) {
        return data.get(key);
    }

    /**
     * Typed lookup; empty when the key is absent or holds another type.
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = data.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public String getString(String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    public boolean containsKey(String key) {
        return data.containsKey(key);
    }

    public Object remove(String key) {
        return data.remove(key);
    }

    public int size() {
        return data.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return data.isEmpty();
    }

    /**
     * Live, mutable view of the payload.
     */
    @JsonAnyGetter
    public Map<String, Object> asMap() {
        return data;
    }

    public Map<String, Object> toUnmodifiableMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * Copy that later handler mutations cannot reach.
     * <p>
     * JSON-friendly payloads are deep-copied through Jackson; payloads holding
     * values Jackson cannot map (callbacks, streams) fall back to a shallow copy.
     */
    public HookEvent snapshot() {
        try {
            return new HookEvent(MAPPER.convertValue(data, MAP_TYPE));
        } catch (IllegalArgumentException e) {
            return new HookEvent(new LinkedHashMap<>(data));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof HookEvent other))
            return false;
        return Objects.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return data.hashCode();
    }

    @Override
    public String toString() {
        return "HookEvent" + data;
    }
}
