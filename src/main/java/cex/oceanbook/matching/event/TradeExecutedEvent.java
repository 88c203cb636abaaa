package cex.oceanbook.matching.event;

import cex.oceanbook.matching.domain.Trade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.UUID;

/**
 * Event published when a trade is executed
 * Consumed by settlement and notification listeners
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeExecutedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Unique message ID for idempotency (UUID)
     */
    private String messageId;

    /**
     * Event timestamp in epoch milliseconds
     */
    private Long timestamp;

    private Long buyOrderId;

    private Long sellOrderId;

    private String symbol;

    private BigDecimal price;

    private BigDecimal quantity;

    private BigDecimal total;

    private Long takerOrderId;

    private Long makerOrderId;

    private Long takerMemberId;

    private Long makerMemberId;

    /**
     * Create event from Trade record
     *
     * @param trade the executed trade
     * @return TradeExecutedEvent
     */
    public static TradeExecutedEvent fromTrade(Trade trade) {
        return TradeExecutedEvent.builder()
                .messageId(UUID.randomUUID().toString())
                .timestamp(System.currentTimeMillis())
                .buyOrderId(trade.getBuyOrderId())
                .sellOrderId(trade.getSellOrderId())
                .symbol(trade.getSymbol())
                .price(trade.getPrice())
                .quantity(trade.getQuantity())
                .total(trade.getTotal())
                .takerOrderId(trade.getTakerOrderId())
                .makerOrderId(trade.getMakerOrderId())
                .takerMemberId(trade.getTakerMemberId())
                .makerMemberId(trade.getMakerMemberId())
                .build();
    }
}
