package cex.oceanbook.matching.strategy;

import cex.oceanbook.matching.domain.Order;
import org.springframework.stereotype.Component;

/**
 * Matching strategy for LIMIT takers
 * Crosses only when the bid price is at or above the ask price
 */
@Component
public class LimitOrderMatchingStrategy extends AbstractOrderMatchingStrategy {

    @Override
    protected boolean crosses(Order bid, Order ask) {
        return bid.getPrice().compareTo(ask.getPrice()) >= 0;
    }
}
