package cex.oceanbook.matching.ordering;

import cex.oceanbook.matching.domain.OrderKey;

import java.math.BigDecimal;

/**
 * Ranks active orders by limit price, then time
 */
public class PriceTimeComparator extends OrderKeyComparator {

    public static final PriceTimeComparator INSTANCE = new PriceTimeComparator();

    @Override
    protected BigDecimal rankedPrice(OrderKey key) {
        return key.getPrice();
    }
}
