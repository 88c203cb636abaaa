package cex.oceanbook.matching.ordering;

import cex.oceanbook.matching.domain.OrderKey;

import java.math.BigDecimal;

/**
 * Ranks pending stop orders by stop price, then time
 */
public class StopPriceTimeComparator extends OrderKeyComparator {

    public static final StopPriceTimeComparator INSTANCE = new StopPriceTimeComparator();

    @Override
    protected BigDecimal rankedPrice(OrderKey key) {
        return key.getStopPrice();
    }
}
