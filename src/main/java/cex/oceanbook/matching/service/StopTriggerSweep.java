package cex.oceanbook.matching.service;

import cex.oceanbook.matching.domain.Order;
import cex.oceanbook.matching.domain.OrderBook;
import cex.oceanbook.matching.enums.OrderSide;
import cex.oceanbook.matching.enums.OrderStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Releases pending stop orders whose stop price the last traded price has crossed.
 * <p>
 * A buy stop fires when the last price is at or above its stop price, a sell stop when the
 * last price is at or below it. Released orders leave the pending-stop collection and come
 * back best-first by stop priority, buy side before sell side, ready to be resubmitted.
 */
@Slf4j
@Component
public class StopTriggerSweep {

    /**
     * Must be called while holding the book's monitor
     *
     * @param orderBook the order book to sweep
     * @param lastPrice the most recent trade price
     * @return released orders in resubmission order
     */
    public List<Order> sweep(OrderBook orderBook, BigDecimal lastPrice) {
        List<Order> released = new ArrayList<>();
        released.addAll(release(orderBook, OrderSide.BUY, lastPrice));
        released.addAll(release(orderBook, OrderSide.SELL, lastPrice));

        if (!released.isEmpty()) {
            log.info("Stop orders triggered: symbol={}, lastPrice={}, count={}",
                    orderBook.getSymbol(), lastPrice, released.size());
        }
        return released;
    }

    private List<Order> release(OrderBook orderBook, OrderSide side, BigDecimal lastPrice) {
        List<Order> triggered = new ArrayList<>();
        for (Order order : orderBook.stopOrders(side).descendingMap().values()) {
            if (isTriggered(order, lastPrice)) {
                triggered.add(order);
            }
        }

        for (Order order : triggered) {
            orderBook.removeOrder(order.getOrderId());
            order.setTriggered(true);
            order.setStatus(OrderStatus.PENDING);
            order.setUpdatedAt(LocalDateTime.now());

            log.debug("Released stop order {} ({} stop={}) at last price {}",
                    order.getOrderId(), side, order.getStopPrice(), lastPrice);
        }
        return triggered;
    }

    private boolean isTriggered(Order order, BigDecimal lastPrice) {
        int cmp = lastPrice.compareTo(order.getStopPrice());
        return order.getSide() == OrderSide.BUY ? cmp >= 0 : cmp <= 0;
    }
}
