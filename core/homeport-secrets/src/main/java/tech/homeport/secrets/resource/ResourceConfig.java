package tech.homeport.secrets.resource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed, optional-returning accessors over an untyped configuration map.
 * A value of the wrong type is reported as absent.
 */
public final class ResourceConfig {

    private final Map<String, Object> values;

    public ResourceConfig(Map<String, Object> values) {
        this.values = values == null ? Map.of() : values;
    }

    public static ResourceConfig of(Map<?, ?> values) {
        return new ResourceConfig(copyKeys(values));
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    /**
     * String value. Blank strings are reported as absent.
     */
    public Optional<String> string(String key) {
        Object value = values.get(key);
        if (value instanceof String s && !s.isBlank()) {
            return Optional.of(s);
        }
        return Optional.empty();
    }

    public Optional<Boolean> bool(String key) {
        Object value = values.get(key);
        if (value instanceof Boolean b) {
            return Optional.of(b);
        }
        if (value instanceof String s && ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s))) {
            return Optional.of(Boolean.parseBoolean(s));
        }
        return Optional.empty();
    }

    public boolean isTrue(String key) {
        return bool(key).orElse(false);
    }

    /**
     * Nested map. A list holding a single map, as Terraform state renders
     * nested blocks, is unwrapped.
     */
    public Optional<ResourceConfig> map(String key) {
        Object value = values.get(key);
        if (value instanceof List<?> l && l.size() == 1) {
            value = l.get(0);
        }
        if (value instanceof Map<?, ?> m) {
            return Optional.of(of(m));
        }
        return Optional.empty();
    }

    public Optional<List<Object>> list(String key) {
        Object value = values.get(key);
        if (value instanceof List<?> l) {
            return Optional.of(new ArrayList<>(l));
        }
        return Optional.empty();
    }

    /**
     * Map elements of the list under {@code key}; non-map elements are skipped.
     * A single map value is treated as a one-element list.
     */
    public List<ResourceConfig> maps(String key) {
        Object value = values.get(key);
        List<ResourceConfig> result = new ArrayList<>();
        if (value instanceof Map<?, ?> m) {
            result.add(of(m));
        } else if (value instanceof List<?> l) {
            for (Object element : l) {
                if (element instanceof Map<?, ?> m) {
                    result.add(of(m));
                }
            }
        }
        return result;
    }

    /**
     * Entries of a nested map whose values are strings.
     */
    public Map<String, String> stringEntries(String key) {
        Map<String, String> result = new LinkedHashMap<>();
        Object value = values.get(key);
        if (value instanceof Map<?, ?> m) {
            m.forEach((k, v) -> {
                if (k != null && v instanceof String s) {
                    result.put(k.toString(), s);
                }
            });
        }
        return result;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private static Map<String, Object> copyKeys(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((k, v) -> {
                if (k != null) {
                    copy.put(k.toString(), v);
                }
            });
        }
        return copy;
    }
}
