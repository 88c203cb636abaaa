package cex.oceanbook.matching.enums;

/**
 * Order type enum - LIMIT or MARKET, derived from the presence of a price
 */
public enum OrderType {
    /**
     * Limit order - executes at specified price or better
     */
    LIMIT,

    /**
     * Market order - executes immediately at best available price
     */
    MARKET
}
