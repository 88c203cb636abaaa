package cex.oceanbook.matching.service;

import cex.oceanbook.matching.domain.Order;
import cex.oceanbook.matching.domain.OrderBook;
import cex.oceanbook.matching.domain.Trade;
import cex.oceanbook.matching.dto.MatchResult;
import cex.oceanbook.matching.enums.OrderSide;
import cex.oceanbook.matching.enums.OrderStatus;
import cex.oceanbook.matching.enums.OrderType;
import cex.oceanbook.matching.strategy.OrderMatchingStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Matching loop of one order book.
 * <p>
 * Repeatedly matches the incoming order against the best opposing resting order until it is
 * filled or no longer crosses, then rests or discards the remainder. Every pass that produced
 * trades is followed by a stop trigger sweep at the latest trade price; released stop orders
 * are queued as further incoming orders of the same submission.
 * <p>
 * Callers must hold the book's monitor for the whole call.
 */
@Slf4j
@Component
public class OrderBookMatcher {

    @Autowired
    private Map<OrderType, OrderMatchingStrategy> strategies;

    @Autowired
    private StopTriggerSweep stopTriggerSweep;

    /**
     * Process an incoming order against the book
     *
     * @param incomingOrder the validated incoming order, owned by the book from here on
     * @param orderBook the book for the order's symbol
     * @return MatchResult with detached copies of every order it reports
     */
    public MatchResult process(Order incomingOrder, OrderBook orderBook) {
        if (incomingOrder.isStopPending()) {
            incomingOrder.setStatus(OrderStatus.PENDING_TRIGGER);
            incomingOrder.setUpdatedAt(LocalDateTime.now());
            orderBook.addStopOrder(incomingOrder);

            log.debug("Stop order {} held: side={}, stopPrice={}",
                    incomingOrder.getOrderId(), incomingOrder.getSide(), incomingOrder.getStopPrice());

            return MatchResult.builder()
                    .updatedOrder(incomingOrder.snapshot())
                    .fullyMatched(false)
                    .build();
        }

        List<Trade> trades = new ArrayList<>();
        Map<Long, Order> modifiedOrders = new LinkedHashMap<>();
        List<Order> triggeredOrders = new ArrayList<>();

        Deque<Order> takers = new ArrayDeque<>();
        takers.add(incomingOrder);

        while (!takers.isEmpty()) {
            Order taker = takers.poll();
            int tradesBefore = trades.size();

            matchTaker(taker, orderBook, trades, modifiedOrders);
            restOrDiscard(taker, orderBook);

            if (trades.size() > tradesBefore) {
                BigDecimal lastPrice = trades.get(trades.size() - 1).getPrice();
                orderBook.recordTradePrice(lastPrice);

                List<Order> released = stopTriggerSweep.sweep(orderBook, lastPrice);
                triggeredOrders.addAll(released);
                takers.addAll(released);
            }
        }

        return MatchResult.builder()
                .updatedOrder(incomingOrder.snapshot())
                .trades(trades)
                .modifiedOrders(snapshots(modifiedOrders.values()))
                .triggeredOrders(snapshots(triggeredOrders))
                .fullyMatched(incomingOrder.isFilled())
                .build();
    }

    /**
     * Match one taker against the opposite side, best resting order first
     */
    private void matchTaker(Order taker, OrderBook orderBook,
                            List<Trade> trades, Map<Long, Order> modifiedOrders) {
        OrderMatchingStrategy strategy = strategies.get(taker.getType());
        if (strategy == null) {
            throw new IllegalArgumentException("No matching strategy found for order type: " + taker.getType());
        }

        OrderSide makerSide = taker.getSide().opposite();

        while (taker.getPendingQuantity().signum() > 0) {
            Optional<Order> best = orderBook.bestOrder(makerSide);
            if (best.isEmpty()) {
                log.debug("No resting {} orders left for taker {}", makerSide, taker.getOrderId());
                break;
            }

            Order maker = best.get();
            Optional<Trade> trade = strategy.match(maker, taker);
            if (trade.isEmpty()) {
                log.debug("No more matches: taker {} price {} does not cross maker {} price {}",
                        taker.getOrderId(), taker.getPrice(), maker.getOrderId(), maker.getPrice());
                break;
            }

            trades.add(trade.get());

            if (maker.isFilled()) {
                orderBook.removeOrder(maker.getOrderId());
                maker.setStatus(OrderStatus.FILLED);
                log.debug("Book order {} fully filled and removed", maker.getOrderId());
            } else {
                maker.setStatus(OrderStatus.PARTIALLY_FILLED);
                log.debug("Book order {} partially filled: {}/{}",
                        maker.getOrderId(), maker.getFilledQuantity(), maker.getQuantity());
            }
            maker.setUpdatedAt(LocalDateTime.now());
            modifiedOrders.put(maker.getOrderId(), maker);
        }
    }

    /**
     * Rest a limit remainder, or discard it for market and immediate-or-cancel orders
     */
    private void restOrDiscard(Order taker, OrderBook orderBook) {
        taker.setUpdatedAt(LocalDateTime.now());

        if (taker.isFilled()) {
            taker.setStatus(OrderStatus.FILLED);
            return;
        }

        if (taker.isMarket() || taker.isImmediateOrCancel()) {
            taker.setStatus(OrderStatus.CANCELLED);
            log.warn("Discarded unfilled remainder of {} order {}: filled {}/{}, discarded={}",
                    taker.isMarket() ? "MARKET" : "IOC",
                    taker.getOrderId(), taker.getFilledQuantity(), taker.getQuantity(),
                    taker.getPendingQuantity());
            return;
        }

        taker.setStatus(taker.isPartiallyFilled() ? OrderStatus.PARTIALLY_FILLED : OrderStatus.OPEN);
        orderBook.addActiveOrder(taker);

        log.debug("Added order {} to {} book at price {}: remaining qty={}",
                taker.getOrderId(), taker.getSide(), taker.getPrice(), taker.getPendingQuantity());
    }

    private static List<Order> snapshots(Collection<Order> orders) {
        return orders.stream().map(Order::snapshot).collect(Collectors.toList());
    }
}
