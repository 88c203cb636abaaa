package cex.oceanbook.matching.service;

import cex.oceanbook.matching.domain.Order;
import cex.oceanbook.matching.domain.OrderBook;
import cex.oceanbook.matching.domain.OrderKey;
import cex.oceanbook.matching.dto.OrderBookDepthResponse;
import cex.oceanbook.matching.enums.OrderSide;
import cex.oceanbook.matching.exception.OrderBookNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;

/**
 * Registry of the per-symbol order books and read-only depth aggregation over them
 */
@Slf4j
@Service
public class OrderBookService {

    private final Map<String, OrderBook> orderBooks = new ConcurrentHashMap<>();

    @Value("${matching.depth.default-levels:20}")
    private int defaultDepthLevels;

    /**
     * Create the order book for a symbol; returns the existing one if already created
     *
     * @param symbol the trading symbol
     * @return the order book
     */
    public OrderBook createOrderBook(String symbol) {
        return orderBooks.computeIfAbsent(symbol, s -> {
            log.info("Created new order book for symbol: {}", s);
            return new OrderBook(s);
        });
    }

    /**
     * Get order book by symbol
     *
     * @param symbol the trading symbol
     * @return the order book
     * @throws OrderBookNotFoundException if no book was created for the symbol
     */
    public OrderBook getOrderBook(String symbol) {
        OrderBook orderBook = symbol == null ? null : orderBooks.get(symbol);
        if (orderBook == null) {
            throw new OrderBookNotFoundException("Order book not found: " + symbol);
        }
        return orderBook;
    }

    public Set<String> getSymbols() {
        return new TreeSet<>(orderBooks.keySet());
    }

    /**
     * Get order book aggregated depth
     *
     * @param symbol the trading symbol
     * @param limit the number of price levels per side (null for the configured default)
     * @return order book depth response
     * @throws OrderBookNotFoundException if order book not found
     */
    public OrderBookDepthResponse getOrderBookDepth(String symbol, Integer limit) {
        OrderBook orderBook = getOrderBook(symbol);
        int levels = limit != null ? limit : defaultDepthLevels;

        return OrderBookDepthResponse.builder()
            .symbol(symbol)
            .bids(aggregatePriceLevels(orderBook.activeOrders(OrderSide.BUY), levels))
            .asks(aggregatePriceLevels(orderBook.activeOrders(OrderSide.SELL), levels))
            .bestBid(orderBook.getBestBid())
            .bestAsk(orderBook.getBestAsk())
            .spread(orderBook.getSpread())
            .lastPrice(orderBook.getLastPrice())
            .timestamp(LocalDateTime.now())
            .build();
    }

    /**
     * Aggregate price levels, best first. Orders of one price are adjacent under the
     * price-time ranking, so a single pass over the collection is enough.
     */
    private List<OrderBookDepthResponse.PriceLevel> aggregatePriceLevels(
            ConcurrentNavigableMap<OrderKey, Order> orders, int limit) {

        List<OrderBookDepthResponse.PriceLevel> levels = new ArrayList<>();
        OrderBookDepthResponse.PriceLevel current = null;

        for (Order order : orders.descendingMap().values()) {
            if (current == null || current.getPrice().compareTo(order.getPrice()) != 0) {
                if (levels.size() >= limit) {
                    break;
                }
                current = OrderBookDepthResponse.PriceLevel.builder()
                    .price(order.getPrice())
                    .quantity(BigDecimal.ZERO)
                    .orderCount(0)
                    .build();
                levels.add(current);
            }

            current.setQuantity(current.getQuantity().add(order.getPendingQuantity()));
            current.setOrderCount(current.getOrderCount() + 1);
        }

        return levels;
    }
}
