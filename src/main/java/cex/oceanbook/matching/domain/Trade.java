package cex.oceanbook.matching.domain;

import cex.oceanbook.matching.enums.OrderSide;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Immutable record of a match between a resting (maker) and an incoming (taker) order
 */
@Value
@Builder
public class Trade {
    /**
     * Trading symbol (e.g., "BTC-USD", "ETH-USD")
     */
    String symbol;

    /**
     * Execution price, always the maker's price
     */
    BigDecimal price;

    /**
     * Quantity traded
     */
    BigDecimal quantity;

    /**
     * Price multiplied by quantity
     */
    BigDecimal total;

    Long makerOrderId;

    Long takerOrderId;

    Long makerMemberId;

    Long takerMemberId;

    /**
     * Side of the incoming order
     */
    OrderSide takerSide;

    /**
     * Timestamp when trade was executed
     */
    LocalDateTime createdAt;

    public Long getBuyOrderId() {
        return takerSide == OrderSide.BUY ? takerOrderId : makerOrderId;
    }

    public Long getSellOrderId() {
        return takerSide == OrderSide.SELL ? takerOrderId : makerOrderId;
    }
}
