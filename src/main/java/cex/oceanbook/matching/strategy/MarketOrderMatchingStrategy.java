package cex.oceanbook.matching.strategy;

import cex.oceanbook.matching.domain.Order;
import org.springframework.stereotype.Component;

/**
 * Matching strategy for MARKET takers
 * NO price constraint - a market order takes whatever the resting order offers
 */
@Component
public class MarketOrderMatchingStrategy extends AbstractOrderMatchingStrategy {

    @Override
    protected boolean crosses(Order bid, Order ask) {
        return true;
    }
}
