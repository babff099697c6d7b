package org.alphaminer.model;

import org.alphaminer.constants.MinerConstants;

/**
 * Footprint relation between two activities.
 */
public enum Relation {
    /** a is directly followed by b, never the reverse */
    CAUSAL_FORWARD(MinerConstants.SYMBOL_CAUSAL_FORWARD),
    /** b is directly followed by a, never the reverse */
    CAUSAL_BACKWARD(MinerConstants.SYMBOL_CAUSAL_BACKWARD),
    /** both directions observed, or a self-loop */
    PARALLEL(MinerConstants.SYMBOL_PARALLEL),
    /** never directly adjacent */
    INDEPENDENT(MinerConstants.SYMBOL_INDEPENDENT);

    private final String symbol;

    Relation(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Relation seen from the other activity of the pair
     */
    public Relation inverse() {
        switch (this) {
            case CAUSAL_FORWARD:
                return CAUSAL_BACKWARD;
            case CAUSAL_BACKWARD:
                return CAUSAL_FORWARD;
            default:
                return this;
        }
    }

    @Override
    public String toString() {
        return symbol;
    }
}
