package cex.oceanbook.matching.domain;

import cex.oceanbook.matching.enums.OrderSide;
import cex.oceanbook.matching.enums.OrderStatus;
import cex.oceanbook.matching.enums.OrderType;
import cex.oceanbook.matching.exception.MatchingContractViolationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Order entity representing a resting or incoming order and its fill progress
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Order {
    /**
     * Unique order identifier, assigned upstream in submission order
     */
    private Long orderId;

    /**
     * Trading symbol (e.g., "BTC-USD", "ETH-USD")
     */
    private String symbol;

    /**
     * Member who placed the order
     */
    private Long memberId;

    /**
     * Order side - BUY or SELL
     */
    private OrderSide side;

    /**
     * Price per unit (null for MARKET orders)
     */
    private BigDecimal price;

    /**
     * Stop price; when present the order waits in the pending-stop collection until triggered
     */
    private BigDecimal stopPrice;

    /**
     * Quantity to buy or sell
     */
    private BigDecimal quantity;

    /**
     * Quantity that has been filled (for partial fills)
     */
    @Builder.Default
    private BigDecimal filledQuantity = BigDecimal.ZERO;

    /**
     * Discard any unfilled remainder instead of resting it
     */
    private boolean immediateOrCancel;

    /**
     * Set once the stop condition has fired
     */
    private boolean triggered;

    /**
     * Current status of the order
     */
    @Builder.Default
    private OrderStatus status = OrderStatus.PENDING;

    /**
     * Timestamp when order was created, primary time-priority tiebreak
     */
    private LocalDateTime createdAt;

    /**
     * Timestamp when order was last updated
     */
    private LocalDateTime updatedAt;

    /**
     * Get remaining quantity to be filled
     */
    public BigDecimal getPendingQuantity() {
        return quantity.subtract(filledQuantity);
    }

    /**
     * Check if order is completely filled
     */
    public boolean isFilled() {
        return filledQuantity.compareTo(quantity) == 0;
    }

    /**
     * Check if order is partially filled
     */
    public boolean isPartiallyFilled() {
        return filledQuantity.signum() > 0
            && filledQuantity.compareTo(quantity) < 0;
    }

    public boolean isLimit() {
        return price != null;
    }

    public boolean isMarket() {
        return price == null;
    }

    public OrderType getType() {
        return isLimit() ? OrderType.LIMIT : OrderType.MARKET;
    }

    /**
     * Stop order that has not fired yet
     */
    public boolean isStopPending() {
        return stopPrice != null && !triggered;
    }

    /**
     * Add a fill to this order.
     *
     * @param amount quantity executed, at most the pending quantity
     * @throws MatchingContractViolationException if the fill is negative or overfills the order
     */
    public void fill(BigDecimal amount) {
        if (amount.signum() < 0 || amount.compareTo(getPendingQuantity()) > 0) {
            throw new MatchingContractViolationException(
                "Fill of " + amount + " breaks quantity bounds of order " + orderId
                    + ": filled=" + filledQuantity + ", quantity=" + quantity);
        }
        filledQuantity = filledQuantity.add(amount);
    }

    /**
     * Ranking key derived from this order
     */
    public OrderKey key() {
        return new OrderKey(orderId, side, price, stopPrice, createdAt);
    }

    /**
     * Detached copy handed to callers outside the owning order book
     */
    public Order snapshot() {
        return toBuilder().build();
    }
}
