package cex.oceanbook.matching.ordering;

import cex.oceanbook.matching.domain.OrderKey;
import cex.oceanbook.matching.enums.OrderSide;
import cex.oceanbook.matching.exception.MatchingContractViolationException;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * Price-time ranking of same-side order keys where the best order is the maximum element.
 * <p>
 * The sell side inverts the natural price comparison so that one "take the maximum"
 * primitive yields the highest bid and the lowest ask alike. Equal prices fall back to
 * creation time (earlier ranks higher) and then to order ID (lower ranks higher).
 * Two keys are equal only when they carry the same order ID.
 */
public abstract class OrderKeyComparator implements Comparator<OrderKey> {

    /**
     * The price this policy ranks by
     */
    protected abstract BigDecimal rankedPrice(OrderKey key);

    @Override
    public int compare(OrderKey a, OrderKey b) {
        if (a.getSide() != b.getSide()) {
            throw new MatchingContractViolationException(
                "Compared orders with different sides: " + a.getOrderId() + "(" + a.getSide() + ") vs "
                    + b.getOrderId() + "(" + b.getSide() + ")");
        }

        if (a.getOrderId().equals(b.getOrderId())) {
            return 0;
        }

        int byPrice = nullToZero(rankedPrice(a)).compareTo(nullToZero(rankedPrice(b)));
        if (byPrice != 0) {
            return a.getSide() == OrderSide.SELL ? -byPrice : byPrice;
        }

        if (a.getCreatedAt().isBefore(b.getCreatedAt())) {
            return 1;
        }
        if (a.getCreatedAt().isAfter(b.getCreatedAt())) {
            return -1;
        }

        return -Long.compare(a.getOrderId(), b.getOrderId());
    }

    private static BigDecimal nullToZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
