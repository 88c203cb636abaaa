package cex.oceanbook.matching.domain;

import cex.oceanbook.matching.enums.OrderSide;
import cex.oceanbook.matching.testutil.OrderTestBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class OrderBookTest {

    private OrderBook orderBook;

    @BeforeEach
    void setUp() {
        orderBook = new OrderBook("BTC-USD");
    }

    @Test
    void emptyBookHasNoBestPrices() {
        assertThat(orderBook.bestOrder(OrderSide.BUY)).isEmpty();
        assertThat(orderBook.bestOrder(OrderSide.SELL)).isEmpty();
        assertThat(orderBook.getBestBid()).isNull();
        assertThat(orderBook.getBestAsk()).isNull();
        assertThat(orderBook.getSpread()).isNull();
    }

    @Test
    void bestOrdersFollowPriceTimePriority() {
        orderBook.addActiveOrder(OrderTestBuilder.limit().buy().price("100").createdAtSecond(1).build());
        Order bestBid = OrderTestBuilder.limit().buy().price("101").createdAtSecond(2).build();
        orderBook.addActiveOrder(bestBid);
        Order bestAsk = OrderTestBuilder.limit().sell().price("103").createdAtSecond(3).build();
        orderBook.addActiveOrder(bestAsk);
        orderBook.addActiveOrder(OrderTestBuilder.limit().sell().price("103").createdAtSecond(4).build());
        orderBook.addActiveOrder(OrderTestBuilder.limit().sell().price("104").createdAtSecond(0).build());

        assertThat(orderBook.bestOrder(OrderSide.BUY)).containsSame(bestBid);
        assertThat(orderBook.bestOrder(OrderSide.SELL)).containsSame(bestAsk);
        assertThat(orderBook.getBestBid()).isEqualByComparingTo("101");
        assertThat(orderBook.getBestAsk()).isEqualByComparingTo("103");
        assertThat(orderBook.getSpread()).isEqualByComparingTo("2");
    }

    @Test
    void removeOrderFindsActiveAndStopOrders() {
        Order active = OrderTestBuilder.limit().sell().price("100").build();
        Order stop = OrderTestBuilder.market().sell().stopPrice("90").build();
        orderBook.addActiveOrder(active);
        orderBook.addStopOrder(stop);

        assertThat(orderBook.removeOrder(stop.getOrderId())).containsSame(stop);
        assertThat(orderBook.getSellStops()).isEmpty();
        assertThat(orderBook.getAsks()).hasSize(1);

        assertThat(orderBook.removeOrder(active.getOrderId())).containsSame(active);
        assertThat(orderBook.getAsks()).isEmpty();
        assertThat(orderBook.contains(active.getOrderId())).isFalse();
    }

    @Test
    void removeUnknownOrderIsEmpty() {
        assertThat(orderBook.removeOrder(null)).isEmpty();
        assertThat(orderBook.removeOrder(424242L)).isEmpty();
    }

    @Test
    void stopOrdersDoNotAffectBestPrices() {
        orderBook.addStopOrder(OrderTestBuilder.limit().buy().price("120").stopPrice("110").build());

        assertThat(orderBook.getBestBid()).isNull();
        assertThat(orderBook.getBuyStops()).hasSize(1);
    }

    @Test
    void haltRecordsReason() {
        assertThat(orderBook.isHalted()).isFalse();

        orderBook.halt("broken");

        assertThat(orderBook.isHalted()).isTrue();
        assertThat(orderBook.getHaltReason()).isEqualTo("broken");
    }
}
