package cex.oceanbook.matching.service;

import cex.oceanbook.matching.domain.Order;
import cex.oceanbook.matching.domain.OrderBook;
import cex.oceanbook.matching.dto.MatchResult;
import cex.oceanbook.matching.dto.OrderBookDepthResponse;
import cex.oceanbook.matching.enums.OrderSide;
import cex.oceanbook.matching.enums.OrderStatus;
import cex.oceanbook.matching.event.TradeExecutedEvent;
import cex.oceanbook.matching.exception.InvalidOrderException;
import cex.oceanbook.matching.exception.MatchingContractViolationException;
import cex.oceanbook.matching.exception.OrderBookHaltedException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Core matching engine service
 * Entry point for order intake: serialises all work on one symbol's book and reports the outcome
 */
@Slf4j
@Service
public class MatchingEngineService {

    @Autowired
    private OrderBookService orderBookService;

    @Autowired
    private OrderBookMatcher orderBookMatcher;

    @Autowired
    private ApplicationEventPublisher eventPublisher;

    @Autowired
    private MeterRegistry meterRegistry;

    /**
     * Submit an order to the book of its symbol.
     * <p>
     * The book takes a private copy of the order; later changes to the argument do not reach
     * the book, and the outcome is reported only through the returned result. Orders of one
     * symbol are matched strictly one at a time and their trade events are published in match
     * order; different symbols can be matched concurrently. A contract violation halts the
     * book and is rethrown. A rejected order leaves the book unchanged.
     *
     * @param order the order to process
     * @return MatchResult containing the updated order, trades, and modified orders
     * @throws InvalidOrderException if the order fails the intake guard
     * @throws OrderBookHaltedException if the book was halted earlier
     */
    public MatchResult submit(Order order) {
        validate(order);

        log.info("Processing order: orderId={}, symbol={}, side={}, type={}, price={}, stopPrice={}, qty={}, ioc={}",
                order.getOrderId(), order.getSymbol(), order.getSide(), order.getType(),
                order.getPrice(), order.getStopPrice(), order.getQuantity(), order.isImmediateOrCancel());

        OrderBook orderBook = orderBookService.getOrderBook(order.getSymbol());
        Timer.Sample sample = Timer.start(meterRegistry);

        MatchResult result;
        synchronized (orderBook) {
            ensureNotHalted(orderBook);

            if (orderBook.contains(order.getOrderId())) {
                throw new InvalidOrderException("Order already in book: " + order.getOrderId());
            }

            Order owned = intakeCopy(order);
            try {
                result = orderBookMatcher.process(owned, orderBook);
            } catch (MatchingContractViolationException e) {
                orderBook.halt(e.getMessage());
                log.error("Contract violation, halting order book: symbol={}, orderId={}, reason={}",
                        orderBook.getSymbol(), order.getOrderId(), e.getMessage(), e);
                throw e;
            }

            result.getTrades().forEach(trade -> {
                eventPublisher.publishEvent(TradeExecutedEvent.fromTrade(trade));
                log.info("Trade executed: symbol={}, makerOrderId={}, takerOrderId={}, price={}, qty={}",
                        trade.getSymbol(), trade.getMakerOrderId(), trade.getTakerOrderId(),
                        trade.getPrice(), trade.getQuantity());
            });
        }

        sample.stop(meterRegistry.timer("matching.submit.latency", "symbol", order.getSymbol()));
        meterRegistry.counter("matching.orders.submitted", "symbol", order.getSymbol()).increment();
        meterRegistry.counter("matching.trades.executed", "symbol", order.getSymbol())
                .increment(result.getTrades().size());

        log.info("Order processing complete: orderId={}, status={}, filled={}/{}, trades={}, triggered={}, fullyMatched={}",
                result.getUpdatedOrder().getOrderId(),
                result.getUpdatedOrder().getStatus(),
                result.getUpdatedOrder().getFilledQuantity(),
                result.getUpdatedOrder().getQuantity(),
                result.getTrades().size(),
                result.getTriggeredOrders().size(),
                result.isFullyMatched());

        return result;
    }

    /**
     * Cancel a resting or pending-stop order
     *
     * @param symbol the trading symbol
     * @param orderId the order ID to cancel
     * @return true if the order was removed, false if the book does not hold it
     */
    public boolean cancel(String symbol, Long orderId) {
        OrderBook orderBook = orderBookService.getOrderBook(symbol);

        Optional<Order> removed;
        synchronized (orderBook) {
            ensureNotHalted(orderBook);
            removed = orderBook.removeOrder(orderId);
            removed.ifPresent(order -> {
                order.setStatus(OrderStatus.CANCELLED);
                order.setUpdatedAt(LocalDateTime.now());
            });
        }

        if (removed.isEmpty()) {
            log.info("Cancel ignored, order not found: symbol={}, orderId={}", symbol, orderId);
            return false;
        }

        meterRegistry.counter("matching.orders.cancelled", "symbol", symbol).increment();
        log.info("Order cancelled: symbol={}, orderId={}, filled={}/{}",
                symbol, orderId, removed.get().getFilledQuantity(), removed.get().getQuantity());
        return true;
    }

    /**
     * Highest-priority resting bid, as a detached copy
     */
    public Optional<Order> getBestBid(String symbol) {
        return bestOrder(symbol, OrderSide.BUY);
    }

    /**
     * Highest-priority resting ask, as a detached copy
     */
    public Optional<Order> getBestAsk(String symbol) {
        return bestOrder(symbol, OrderSide.SELL);
    }

    public OrderBookDepthResponse getOrderBookDepth(String symbol, Integer limit) {
        OrderBook orderBook = orderBookService.getOrderBook(symbol);
        synchronized (orderBook) {
            return orderBookService.getOrderBookDepth(symbol, limit);
        }
    }

    // copied under the monitor so fill progress and status come from the same match step
    private Optional<Order> bestOrder(String symbol, OrderSide side) {
        OrderBook orderBook = orderBookService.getOrderBook(symbol);
        synchronized (orderBook) {
            return orderBook.bestOrder(side).map(Order::snapshot);
        }
    }

    private void ensureNotHalted(OrderBook orderBook) {
        if (orderBook.isHalted()) {
            throw new OrderBookHaltedException(
                    "Order book " + orderBook.getSymbol() + " is halted: " + orderBook.getHaltReason());
        }
    }

    /**
     * Intake guard. Order-entry services validate upstream; this only rejects orders the
     * matching loop cannot hold without breaking its invariants. Reads the order only.
     */
    private void validate(Order order) {
        if (order == null) {
            throw new InvalidOrderException("Order must not be null");
        }
        if (order.getOrderId() == null) {
            throw new InvalidOrderException("Order ID is required");
        }
        if (order.getSymbol() == null || order.getSymbol().isBlank()) {
            throw new InvalidOrderException("Symbol is required: orderId=" + order.getOrderId());
        }
        if (order.getSide() == null) {
            throw new InvalidOrderException("Side is required: orderId=" + order.getOrderId());
        }
        if (order.getQuantity() == null || order.getQuantity().signum() <= 0) {
            throw new InvalidOrderException("Quantity must be positive: orderId=" + order.getOrderId());
        }
        if (order.getPrice() != null && order.getPrice().signum() <= 0) {
            throw new InvalidOrderException("Price must be positive: orderId=" + order.getOrderId());
        }
        if (order.getStopPrice() != null && order.getStopPrice().signum() <= 0) {
            throw new InvalidOrderException("Stop price must be positive: orderId=" + order.getOrderId());
        }

        BigDecimal filled = order.getFilledQuantity() != null ? order.getFilledQuantity() : BigDecimal.ZERO;
        if (filled.signum() < 0 || filled.compareTo(order.getQuantity()) >= 0) {
            throw new InvalidOrderException("Filled quantity out of range: orderId=" + order.getOrderId());
        }
    }

    /**
     * Private copy the book owns from here on, with intake defaults applied
     */
    private Order intakeCopy(Order order) {
        LocalDateTime now = LocalDateTime.now();
        Order owned = order.snapshot();
        if (owned.getFilledQuantity() == null) {
            owned.setFilledQuantity(BigDecimal.ZERO);
        }
        if (owned.getCreatedAt() == null) {
            owned.setCreatedAt(now);
        }
        owned.setStatus(OrderStatus.PENDING);
        owned.setUpdatedAt(now);
        return owned;
    }
}
