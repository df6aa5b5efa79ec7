package sh.harold.uodm.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Outcome counters for store calls, grouped by operation and collection.
 */
public final class StoreMetrics {

    private final Map<String, Counters> counters = new ConcurrentHashMap<>();

    public void record(String operation, String collection, long durationMillis, boolean succeeded) {
        Counters entry = counters.computeIfAbsent(operation + ":" + collection, ignored -> new Counters());
        (succeeded ? entry.succeeded : entry.failed).increment();
        entry.elapsedMillis.add(durationMillis);
    }

    /**
     * Totals for one operation on one collection; all zero if it never ran.
     */
    public OperationStats stats(String operation, String collection) {
        Counters entry = counters.get(operation + ":" + collection);
        return entry == null ? OperationStats.EMPTY : entry.read();
    }

    /**
     * Totals for every recorded {@code operation:collection}, sorted by key.
     */
    public Map<String, OperationStats> snapshot() {
        Map<String, OperationStats> copy = new TreeMap<>();
        counters.forEach((key, entry) -> copy.put(key, entry.read()));
        return copy;
    }

    public record OperationStats(long successes, long failures, long totalTimeMillis) {

        static final OperationStats EMPTY = new OperationStats(0L, 0L, 0L);

        public long calls() {
            return successes + failures;
        }
    }

    private static final class Counters {
        private final LongAdder succeeded = new LongAdder();
        private final LongAdder failed = new LongAdder();
        private final LongAdder elapsedMillis = new LongAdder();

        OperationStats read() {
            return new OperationStats(succeeded.sum(), failed.sum(), elapsedMillis.sum());
        }
    }
}
