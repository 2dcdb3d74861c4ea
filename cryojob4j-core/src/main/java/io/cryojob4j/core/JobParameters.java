package io.cryojob4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only parameter bag submitted with one job.
 *
 * <p>Keys are not stable across form versions, so the same logical value may arrive under
 * several names. Values are scalars (string, number or boolean) and may be null.
 */
public final class JobParameters {

    private static final JobParameters EMPTY = new JobParameters(Map.of());

    private final Map<String, Object> values;

    private JobParameters(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static JobParameters of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values must not be null");
        return new JobParameters(new LinkedHashMap<>(values));
    }

    public static JobParameters empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Raw value stored under {@code key}, or null.
     */
    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobParameters other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "JobParameters" + values;
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        public Builder put(String key, Object value) {
            Objects.requireNonNull(key, "key must not be null");
            if (key.isBlank()) {
                throw new IllegalArgumentException("key must not be blank");
            }
            values.put(key, value);
            return this;
        }

        public Builder putAll(Map<String, ?> other) {
            if (other != null) {
                other.forEach(this::put);
            }
            return this;
        }

        public JobParameters build() {
            return new JobParameters(values);
        }
    }
}
