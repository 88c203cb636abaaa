package cex.oceanbook.matching.strategy;

import cex.oceanbook.matching.domain.Order;
import cex.oceanbook.matching.domain.Trade;

import java.util.Optional;

/**
 * Strategy interface for matching one resting order against one incoming order
 * Different implementations handle LIMIT and MARKET takers
 */
public interface OrderMatchingStrategy {
    /**
     * Decide whether the two orders trade and, if so, execute the trade.
     * Both orders' filled quantities are increased by the traded quantity.
     *
     * @param maker the resting order from the book
     * @param taker the incoming order
     * @return the trade, or empty when the orders do not cross
     */
    Optional<Trade> match(Order maker, Order taker);
}
