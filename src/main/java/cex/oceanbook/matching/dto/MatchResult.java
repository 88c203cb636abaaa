package cex.oceanbook.matching.dto;

import cex.oceanbook.matching.domain.Order;
import cex.oceanbook.matching.domain.Trade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of submitting an order to its order book
 * Contains the incoming order, generated trades, modified resting orders and released stop orders
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchResult {
    /**
     * The incoming order with updated filledQuantity and status
     */
    private Order updatedOrder;

    /**
     * Trades generated by the incoming order and by any stop orders it triggered, in execution order
     */
    @Builder.Default
    private List<Trade> trades = new ArrayList<>();

    /**
     * Resting orders that were modified (partially or fully filled)
     */
    @Builder.Default
    private List<Order> modifiedOrders = new ArrayList<>();

    /**
     * Stop orders released into the active book during this submission, in resubmission order
     */
    @Builder.Default
    private List<Order> triggeredOrders = new ArrayList<>();

    /**
     * Whether the incoming order was fully matched
     */
    private boolean fullyMatched;
}
