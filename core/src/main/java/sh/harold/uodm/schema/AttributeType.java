package sh.harold.uodm.schema;

import java.util.List;
import java.util.Map;

/**
 * Type tag of an attribute. Every type accepts {@code null}; stored values are limited to
 * strings, booleans, boxed integral and floating point numbers, string-keyed maps of those,
 * and lists of scalars.
 */
public enum AttributeType {
    ANY {
        @Override
        boolean matches(Object value) {
            return true;
        }
    },
    STRING {
        @Override
        boolean matches(Object value) {
            return value instanceof String;
        }
    },
    INTEGER {
        @Override
        boolean matches(Object value) {
            return isIntegral(value);
        }
    },
    NUMBER {
        @Override
        boolean matches(Object value) {
            return isIntegral(value) || value instanceof Double || value instanceof Float;
        }
    },
    BOOLEAN {
        @Override
        boolean matches(Object value) {
            return value instanceof Boolean;
        }
    },
    DICTIONARY {
        @Override
        boolean matches(Object value) {
            return value instanceof Map<?, ?>;
        }
    },
    LIST {
        @Override
        boolean matches(Object value) {
            return value instanceof List<?>;
        }
    },
    /**
     * Name of another document.
     */
    REFERENCE {
        @Override
        boolean matches(Object value) {
            return value instanceof String name && !name.isBlank();
        }
    };

    abstract boolean matches(Object value);

    public boolean accepts(Object value) {
        return value == null || (isStorable(value) && matches(value));
    }

    static boolean isStorable(Object value) {
        if (isScalar(value)) {
            return true;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String) || !isStorable(entry.getValue())) {
                    return false;
                }
            }
            return true;
        }
        if (value instanceof List<?> list) {
            return list.stream().allMatch(AttributeType::isScalar);
        }
        return false;
    }

    private static boolean isScalar(Object value) {
        return value == null
            || value instanceof String
            || value instanceof Boolean
            || isIntegral(value)
            || value instanceof Double
            || value instanceof Float;
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte;
    }
}
