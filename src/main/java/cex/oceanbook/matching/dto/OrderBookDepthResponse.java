package cex.oceanbook.matching.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Aggregated order book depth
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderBookDepthResponse {

    private String symbol;

    /**
     * Buy side levels, highest price first
     */
    private List<PriceLevel> bids;

    /**
     * Sell side levels, lowest price first
     */
    private List<PriceLevel> asks;

    private BigDecimal bestBid;

    private BigDecimal bestAsk;

    private BigDecimal spread;

    private BigDecimal lastPrice;

    private LocalDateTime timestamp;

    /**
     * Price level DTO
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PriceLevel {

        private BigDecimal price;

        /**
         * Total pending quantity at this price
         */
        private BigDecimal quantity;

        private Integer orderCount;
    }
}
