package cex.oceanbook.matching.enums;

/**
 * Order side - BUY or SELL
 */
public enum OrderSide {
    /**
     * Bid side
     */
    BUY,

    /**
     * Ask side
     */
    SELL;

    /**
     * The side an order of this side trades against
     */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
