package sh.harold.uodm.store;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

public record DocumentSnapshot(DocumentKey key, Map<String, Object> fields) {

    public DocumentSnapshot {
        Objects.requireNonNull(key, "key");
        fields = Collections.unmodifiableMap(FieldValues.deepCopy(fields));
    }

    public Map<String, Object> copy() {
        return FieldValues.deepCopy(fields);
    }
}
