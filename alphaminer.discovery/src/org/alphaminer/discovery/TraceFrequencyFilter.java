package org.alphaminer.discovery;

import java.util.LinkedHashMap;
import java.util.Map;

import org.alphaminer.constants.MinerConstants;
import org.alphaminer.model.Trace;
import org.alphaminer.model.TraceDictionary;
import org.alphaminer.model.TraceStatistics;
import org.apache.log4j.Logger;

/**
 * Drops traces whose frequency is below a threshold. Kept traces retain their original
 * frequency, relative to the full log.
 */
public class TraceFrequencyFilter {

    private static final Logger logger = Logger.getLogger(TraceFrequencyFilter.class);

    /**
     * @param minimumFrequency threshold in [0, 1]; 0 keeps everything
     * @throws IllegalArgumentException if the threshold is outside [0, 1]
     */
    public TraceDictionary filter(TraceDictionary dictionary, double minimumFrequency) {
        if (Double.isNaN(minimumFrequency) || minimumFrequency < 0.0 || minimumFrequency > 1.0) {
            throw new IllegalArgumentException("Minimum frequency must be within [0, 1]: " + minimumFrequency);
        }
        if (minimumFrequency == 0.0) {
            return dictionary;
        }

        Map<Trace, TraceStatistics> kept = new LinkedHashMap<>();
        for (Map.Entry<Trace, TraceStatistics> entry : dictionary.asMap().entrySet()) {
            if (entry.getValue().frequency + MinerConstants.FREQUENCY_TOLERANCE >= minimumFrequency) {
                kept.put(entry.getKey(), entry.getValue());
            } else {
                logger.debug("Filtered out trace " + entry.getKey() + " (" + entry.getValue() + ")");
            }
        }
        logger.info("Frequency threshold " + minimumFrequency + " kept " + kept.size() + " of "
            + dictionary.size() + " traces");
        return new TraceDictionary(kept);
    }
}
