package cex.oceanbook.matching.domain;

import cex.oceanbook.matching.enums.OrderSide;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Subset of order fields the ordering policies rank by.
 * Equality is by value; the comparators only treat two keys as equal when their IDs match.
 */
@Value
public class OrderKey {
    Long orderId;
    OrderSide side;
    BigDecimal price;
    BigDecimal stopPrice;
    LocalDateTime createdAt;
}
