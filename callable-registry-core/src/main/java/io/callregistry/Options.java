package io.callregistry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Copies option and metadata maps; a null value means the name is absent.
 */
final class Options {

    private Options() {
    }

    static Map<String, Object> copyWithoutNulls(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            Objects.requireNonNull(name, "option name");
            if (value != null) {
                copy.put(name, value);
            }
        });
        return Map.copyOf(copy);
    }
}
