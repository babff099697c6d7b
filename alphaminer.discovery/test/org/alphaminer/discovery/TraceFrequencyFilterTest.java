package org.alphaminer.discovery;

import static org.junit.jupiter.api.Assertions.*;

import org.alphaminer.model.Trace;
import org.alphaminer.model.TraceDictionary;
import org.junit.jupiter.api.Test;

public class TraceFrequencyFilterTest {

    private final TraceFrequencyFilter filter = new TraceFrequencyFilter();

    @Test
    public void testZeroKeepsEverything() {
        TraceDictionary dictionary = DiscoveryFixtures.workedExample();

        assertSame(dictionary, filter.filter(dictionary, 0.0));
    }

    @Test
    public void testThresholdIsInclusiveAndFrequenciesAreKept() {
        TraceDictionary filtered = filter.filter(DiscoveryFixtures.workedExample(), 2.0 / 6.0);

        assertEquals(2, filtered.size());
        assertEquals(2.0 / 6.0, filtered.get(Trace.of("a", "c", "b", "d")).frequency, 1e-12);
        assertNull(filtered.get(Trace.of("a", "e", "d")));
    }

    @Test
    public void testOneKeepsOnlyAnAllCaseTrace() {
        assertTrue(filter.filter(DiscoveryFixtures.workedExample(), 1.0).isEmpty());
    }

    @Test
    public void testOutOfRangeThresholdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> filter.filter(TraceDictionary.empty(), -0.1));
        assertThrows(IllegalArgumentException.class, () -> filter.filter(TraceDictionary.empty(), 1.5));
        assertThrows(IllegalArgumentException.class, () -> filter.filter(TraceDictionary.empty(), Double.NaN));
    }
}
