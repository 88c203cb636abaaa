package cex.oceanbook.matching.enums;

/**
 * Order status enum representing the lifecycle of an order inside the engine
 */
public enum OrderStatus {
    /**
     * Order has been submitted but not yet processed by its order book
     */
    PENDING,

    /**
     * Stop order held in the pending-stop collection until its stop price is crossed
     */
    PENDING_TRIGGER,

    /**
     * Order is resting in the order book without any fill
     */
    OPEN,

    /**
     * Order has been partially filled
     */
    PARTIALLY_FILLED,

    /**
     * Order has been completely filled
     */
    FILLED,

    /**
     * Order was cancelled on request, or its unfilled remainder was discarded
     */
    CANCELLED
}
