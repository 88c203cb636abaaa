package cex.oceanbook.matching.domain;

import cex.oceanbook.matching.enums.OrderSide;
import cex.oceanbook.matching.ordering.PriceTimeComparator;
import cex.oceanbook.matching.ordering.StopPriceTimeComparator;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Order book for one trading symbol.
 * <p>
 * Holds four collections keyed by {@link OrderKey}: active bids and asks ranked by
 * {@link PriceTimeComparator}, and pending buy and sell stops ranked by
 * {@link StopPriceTimeComparator}. In every collection the best order is the last entry.
 * Mutations must happen while holding the book's monitor; the skip-list maps let
 * read-only queries run alongside matching.
 */
@Getter
public class OrderBook {

    private final String symbol;

    private final ConcurrentSkipListMap<OrderKey, Order> bids =
            new ConcurrentSkipListMap<>(PriceTimeComparator.INSTANCE);

    private final ConcurrentSkipListMap<OrderKey, Order> asks =
            new ConcurrentSkipListMap<>(PriceTimeComparator.INSTANCE);

    private final ConcurrentSkipListMap<OrderKey, Order> buyStops =
            new ConcurrentSkipListMap<>(StopPriceTimeComparator.INSTANCE);

    private final ConcurrentSkipListMap<OrderKey, Order> sellStops =
            new ConcurrentSkipListMap<>(StopPriceTimeComparator.INSTANCE);

    /**
     * Every order currently held by this book, active or pending-stop
     */
    private final Map<Long, Order> ordersById = new ConcurrentHashMap<>();

    private volatile BigDecimal lastPrice;

    private volatile String haltReason;

    private volatile LocalDateTime updatedAt;

    public OrderBook(String symbol) {
        this.symbol = symbol;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * Active collection for a side
     */
    public ConcurrentNavigableMap<OrderKey, Order> activeOrders(OrderSide side) {
        return side == OrderSide.BUY ? bids : asks;
    }

    /**
     * Pending-stop collection for a side
     */
    public ConcurrentNavigableMap<OrderKey, Order> stopOrders(OrderSide side) {
        return side == OrderSide.BUY ? buyStops : sellStops;
    }

    public void addActiveOrder(Order order) {
        activeOrders(order.getSide()).put(order.key(), order);
        ordersById.put(order.getOrderId(), order);
        updatedAt = LocalDateTime.now();
    }

    public void addStopOrder(Order order) {
        stopOrders(order.getSide()).put(order.key(), order);
        ordersById.put(order.getOrderId(), order);
        updatedAt = LocalDateTime.now();
    }

    /**
     * Remove an order from whichever collection holds it
     *
     * @return the removed order, or empty when this book does not hold it or the ID is null
     */
    public Optional<Order> removeOrder(Long orderId) {
        Order order = orderId == null ? null : ordersById.remove(orderId);
        if (order == null) {
            return Optional.empty();
        }

        OrderKey key = order.key();
        if (activeOrders(order.getSide()).remove(key) == null) {
            stopOrders(order.getSide()).remove(key);
        }
        updatedAt = LocalDateTime.now();
        return Optional.of(order);
    }

    public boolean contains(Long orderId) {
        return ordersById.containsKey(orderId);
    }

    /**
     * Highest-ranked active order on a side
     */
    public Optional<Order> bestOrder(OrderSide side) {
        Map.Entry<OrderKey, Order> best = activeOrders(side).lastEntry();
        return best == null ? Optional.empty() : Optional.of(best.getValue());
    }

    /**
     * Get best bid price (highest buy price)
     */
    public BigDecimal getBestBid() {
        return bestOrder(OrderSide.BUY).map(Order::getPrice).orElse(null);
    }

    /**
     * Get best ask price (lowest sell price)
     */
    public BigDecimal getBestAsk() {
        return bestOrder(OrderSide.SELL).map(Order::getPrice).orElse(null);
    }

    /**
     * Get bid-ask spread
     */
    public BigDecimal getSpread() {
        BigDecimal bid = getBestBid();
        BigDecimal ask = getBestAsk();
        if (bid == null || ask == null) {
            return null;
        }
        return ask.subtract(bid);
    }

    public void recordTradePrice(BigDecimal price) {
        this.lastPrice = price;
    }

    public boolean isHalted() {
        return haltReason != null;
    }

    public void halt(String reason) {
        this.haltReason = reason;
        this.updatedAt = LocalDateTime.now();
    }
}
