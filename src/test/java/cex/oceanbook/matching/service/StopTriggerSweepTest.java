package cex.oceanbook.matching.service;

import cex.oceanbook.matching.domain.Order;
import cex.oceanbook.matching.domain.OrderBook;
import cex.oceanbook.matching.enums.OrderStatus;
import cex.oceanbook.matching.testutil.OrderTestBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class StopTriggerSweepTest {

    private final StopTriggerSweep sweep = new StopTriggerSweep();

    private OrderBook orderBook;

    @BeforeEach
    void setUp() {
        orderBook = new OrderBook("BTC-USD");
    }

    @Test
    void sellStopFiresWhenPriceDropsThroughStop() {
        Order stop = OrderTestBuilder.market().sell().stopPrice("90").quantity("2").build();
        orderBook.addStopOrder(stop);

        assertThat(sweep.sweep(orderBook, new BigDecimal("91"))).isEmpty();
        assertThat(orderBook.getSellStops()).hasSize(1);

        List<Order> released = sweep.sweep(orderBook, new BigDecimal("89"));

        assertThat(released).containsExactly(stop);
        assertThat(stop.isTriggered()).isTrue();
        assertThat(stop.isStopPending()).isFalse();
        assertThat(stop.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(orderBook.getSellStops()).isEmpty();
        assertThat(orderBook.contains(stop.getOrderId())).isFalse();
    }

    @Test
    void stopsFireAtExactlyTheStopPrice() {
        Order buyStop = OrderTestBuilder.market().buy().stopPrice("110").build();
        Order sellStop = OrderTestBuilder.market().sell().stopPrice("90").build();
        orderBook.addStopOrder(buyStop);
        orderBook.addStopOrder(sellStop);

        assertThat(sweep.sweep(orderBook, new BigDecimal("110.00"))).containsExactly(buyStop);
        assertThat(sweep.sweep(orderBook, new BigDecimal("90"))).containsExactly(sellStop);
    }

    @Test
    void buyStopWaitsWhilePriceBelowStop() {
        orderBook.addStopOrder(OrderTestBuilder.market().buy().stopPrice("110").build());

        assertThat(sweep.sweep(orderBook, new BigDecimal("109.99"))).isEmpty();
        assertThat(orderBook.getBuyStops()).hasSize(1);
    }

    @Test
    void releasedInStopPriorityOrder() {
        Order stop90 = OrderTestBuilder.market().sell().stopPrice("90").createdAtSecond(1).build();
        Order stop95Late = OrderTestBuilder.market().sell().stopPrice("95").createdAtSecond(3).build();
        Order stop95Early = OrderTestBuilder.market().sell().stopPrice("95").createdAtSecond(2).build();
        Order untouched = OrderTestBuilder.market().sell().stopPrice("80").createdAtSecond(0).build();
        orderBook.addStopOrder(stop95Late);
        orderBook.addStopOrder(stop90);
        orderBook.addStopOrder(untouched);
        orderBook.addStopOrder(stop95Early);

        List<Order> released = sweep.sweep(orderBook, new BigDecimal("89"));

        assertThat(released).containsExactly(stop90, stop95Early, stop95Late);
        assertThat(orderBook.getSellStops().values()).containsExactly(untouched);
    }
}
