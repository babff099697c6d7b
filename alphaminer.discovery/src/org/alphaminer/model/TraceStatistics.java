package org.alphaminer.model;

/**
 * Number of cases that followed a trace, and their share of all cases in the log.
 * Values are not checked here; the directly-follows stage rejects non-positive counts.
 */
public final class TraceStatistics {
    public final int count;
    public final double frequency;

    public TraceStatistics(int count, double frequency) {
        this.count = count;
        this.frequency = frequency;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraceStatistics)) return false;
        TraceStatistics other = (TraceStatistics) o;
        return count == other.count && Double.compare(frequency, other.frequency) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Integer.hashCode(count) + Double.hashCode(frequency);
    }

    @Override
    public String toString() {
        return String.format("count=%d, frequency=%.4f", count, frequency);
    }
}
