package org.alphaminer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Distinct traces of a log with their case counts and frequencies.
 *
 * Iteration order is the order traces were added. The aggregator adds them by descending
 * count, then trace order, so that the most frequent variants come first.
 */
public final class TraceDictionary {

    private static final TraceDictionary EMPTY = new TraceDictionary(Collections.emptyMap());

    private final Map<Trace, TraceStatistics> entries;

    public TraceDictionary(Map<Trace, TraceStatistics> entries) {
        Objects.requireNonNull(entries, "entries cannot be null");
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static TraceDictionary empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<Trace, TraceStatistics> asMap() {
        return entries;
    }

    public Set<Trace> traces() {
        return entries.keySet();
    }

    public TraceStatistics get(Trace trace) {
        return entries.get(trace);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Number of distinct traces
     */
    public int size() {
        return entries.size();
    }

    /**
     * Sum of case counts over all traces
     */
    public long totalCases() {
        long total = 0;
        for (TraceStatistics statistics : entries.values()) {
            total += statistics.count;
        }
        return total;
    }

    public double totalFrequency() {
        double total = 0.0;
        for (TraceStatistics statistics : entries.values()) {
            total += statistics.frequency;
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraceDictionary)) return false;
        return entries.equals(((TraceDictionary) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "TraceDictionary" + entries;
    }

    /**
     * Assembles a dictionary entry by entry, for callers that already hold aggregated traces.
     */
    public static class Builder {
        private final Map<Trace, TraceStatistics> entries = new LinkedHashMap<>();

        public Builder add(Trace trace, int count, double frequency) {
            entries.put(trace, new TraceStatistics(count, frequency));
            return this;
        }

        /**
         * Add traces with counts only; frequencies are computed against the total of all counts at build time.
         */
        public Builder addCount(Trace trace, int count) {
            entries.put(trace, new TraceStatistics(count, Double.NaN));
            return this;
        }

        public TraceDictionary build() {
            long total = 0;
            for (TraceStatistics statistics : entries.values()) {
                total += statistics.count;
            }
            Map<Trace, TraceStatistics> resolved = new LinkedHashMap<>();
            for (Map.Entry<Trace, TraceStatistics> entry : entries.entrySet()) {
                TraceStatistics statistics = entry.getValue();
                if (Double.isNaN(statistics.frequency)) {
                    double frequency = total > 0 ? (double) statistics.count / total : 0.0;
                    statistics = new TraceStatistics(statistics.count, frequency);
                }
                resolved.put(entry.getKey(), statistics);
            }
            return new TraceDictionary(resolved);
        }
    }
}
