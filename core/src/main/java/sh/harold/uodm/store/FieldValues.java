package sh.harold.uodm.store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

public final class FieldValues {

    private FieldValues() {
    }

    public static Map<String, Object> deepCopy(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source == null) {
            return copy;
        }
        source.forEach((key, value) -> copy.put(String.valueOf(key), deepCopyValue(value)));
        return copy;
    }

    public static Object deepCopyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopy(map);
        }
        if (value instanceof List<?> list) {
            return list.stream()
                .map(FieldValues::deepCopyValue)
                .collect(Collectors.toCollection(ArrayList::new));
        }
        return value;
    }

    public static Map<String, Object> merge(Map<String, Object> current, Map<String, Object> values) {
        Map<String, Object> merged = deepCopy(current);
        values.forEach((field, value) -> merged.put(field, deepCopyValue(value)));
        return merged;
    }

    public static boolean matches(Map<String, Object> fields, Map<String, Object> criteria) {
        Objects.requireNonNull(fields, "fields");
        if (criteria == null || criteria.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> entry : criteria.entrySet()) {
            if (!fields.containsKey(entry.getKey()) && entry.getValue() != null) {
                return false;
            }
            if (!valueEquals(fields.get(entry.getKey()), entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Backends disagree on integral widths (a stored {@code 30} may come back as Integer or Long),
     * so numbers compare by value.
     */
    public static boolean valueEquals(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            if (isIntegral(a) && isIntegral(b)) {
                return a.longValue() == b.longValue();
            }
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        if (left instanceof Map<?, ?> a && right instanceof Map<?, ?> b) {
            if (a.size() != b.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : a.entrySet()) {
                if (!b.containsKey(entry.getKey()) || !valueEquals(entry.getValue(), b.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            if (a.size() != b.size()) {
                return false;
            }
            for (int i = 0; i < a.size(); i++) {
                if (!valueEquals(a.get(i), b.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(left, right);
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte;
    }
}
