package sh.harold.uodm.config;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum StoreType {
    NITRITE,
    JSON,
    MONGO,
    MYSQL;

    @JsonCreator
    public static StoreType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NITRITE;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("MONGODB")) {
            return MONGO;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException exception) {
            throw new IllegalArgumentException("Unknown store type: " + raw, exception);
        }
    }
}
