package com.whereq.conductor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Job arguments after validation against the variable schema. Values keep their
 * JSON-friendly form; accessors convert on read.
 */
public class TypedArgs {

    public static final String DRYRUN = "dryrun";

    private final Map<String, Object> values;

    public TypedArgs(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static TypedArgs empty() {
        return new TypedArgs(Map.of());
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public Object get(String name) {
        return values.get(name);
    }

    public String getString(String name) {
        Object value = values.get(name);
        return value == null ? null : value.toString();
    }

    public Long getLong(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        return value instanceof Number number ? number.longValue() : Long.parseLong(value.toString());
    }

    public boolean getBoolean(String name) {
        Object value = values.get(name);
        return value instanceof Boolean bool ? bool : value != null && Boolean.parseBoolean(value.toString());
    }

    @SuppressWarnings("unchecked")
    public ObjectRef getObject(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        return toRef((Map<String, Object>) value);
    }

    @SuppressWarnings("unchecked")
    public List<ObjectRef> getObjects(String name) {
        Object value = values.get(name);
        if (value == null) {
            return List.of();
        }
        return ((List<Map<String, Object>>) value).stream()
            .map(TypedArgs::toRef)
            .collect(Collectors.toList());
    }

    public boolean isDryrun() {
        return getBoolean(DRYRUN);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private static ObjectRef toRef(Map<String, Object> raw) {
        return new ObjectRef(String.valueOf(raw.get("type")), String.valueOf(raw.get("id")));
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
