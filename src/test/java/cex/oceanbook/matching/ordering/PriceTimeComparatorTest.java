package cex.oceanbook.matching.ordering;

import cex.oceanbook.matching.domain.OrderKey;
import cex.oceanbook.matching.exception.MatchingContractViolationException;
import cex.oceanbook.matching.testutil.OrderTestBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Price-time ordering policy")
class PriceTimeComparatorTest {

    private final PriceTimeComparator comparator = PriceTimeComparator.INSTANCE;

    private static OrderKey bid(long id, String price, long second) {
        return OrderTestBuilder.limit().orderId(id).buy().price(price).createdAtSecond(second).build().key();
    }

    private static OrderKey ask(long id, String price, long second) {
        return OrderTestBuilder.limit().orderId(id).sell().price(price).createdAtSecond(second).build().key();
    }

    @Test
    @DisplayName("Higher bid ranks above earlier lower bid")
    void priceBeatsTimeOnBuySide() {
        OrderKey earlier100 = bid(1, "100", 1);
        OrderKey later101 = bid(2, "101", 2);

        assertThat(comparator.compare(later101, earlier100)).isPositive();
        assertThat(comparator.compare(earlier100, later101)).isNegative();
    }

    @Test
    @DisplayName("Lower ask ranks above higher ask")
    void lowerAskIsBest() {
        OrderKey ask50 = ask(1, "50", 5);
        OrderKey ask51 = ask(2, "51", 1);

        assertThat(comparator.compare(ask50, ask51)).isPositive();
    }

    @Test
    @DisplayName("Earlier order ranks higher at equal price")
    void fifoAtEqualPrice() {
        OrderKey first = ask(7, "50", 1);
        OrderKey second = ask(3, "50", 2);

        assertThat(comparator.compare(first, second)).isPositive();
    }

    @Test
    @DisplayName("Lower ID ranks higher at identical price and timestamp")
    void idBreaksExactTimestampTie() {
        LocalDateTime sameInstant = LocalDateTime.of(2024, 5, 1, 12, 0, 0, 123_000_000);
        OrderKey low = OrderTestBuilder.limit().orderId(10).buy().price("100").createdAt(sameInstant).build().key();
        OrderKey high = OrderTestBuilder.limit().orderId(11).buy().price("100").createdAt(sameInstant).build().key();

        assertThat(comparator.compare(low, high)).isPositive();
        assertThat(comparator.compare(high, low)).isNegative();
    }

    @Test
    @DisplayName("Scale differences do not affect price comparison")
    void priceComparedNumerically() {
        OrderKey a = bid(1, "100.0", 1);
        OrderKey b = bid(2, "100.00", 2);

        assertThat(comparator.compare(a, b)).isPositive();
    }

    @Test
    void sameIdIsEqual() {
        OrderKey a = bid(5, "100", 1);
        OrderKey b = bid(5, "120", 9);

        assertThat(comparator.compare(a, b)).isZero();
    }

    @Test
    void comparingAcrossSidesIsContractViolation() {
        assertThatThrownBy(() -> comparator.compare(bid(1, "100", 1), ask(2, "100", 1)))
                .isInstanceOf(MatchingContractViolationException.class);
    }

    @Test
    @DisplayName("Maximum of a sell book is lowest price, then earliest, then lowest ID")
    void maxPickOnSellBook() {
        TreeSet<OrderKey> asks = new TreeSet<>(comparator);
        asks.add(ask(4, "52", 1));
        asks.add(ask(9, "51", 3));
        asks.add(ask(8, "51", 2));
        asks.add(ask(6, "51", 2));
        asks.add(ask(1, "53", 0));

        assertThat(asks.last().getOrderId()).isEqualTo(6L);
        assertThat(asks.descendingSet()).extracting(OrderKey::getOrderId)
                .containsExactly(6L, 8L, 9L, 4L, 1L);
    }

    @Test
    @DisplayName("Maximum of a buy book is highest price, then earliest, then lowest ID")
    void maxPickOnBuySide() {
        TreeSet<OrderKey> bids = new TreeSet<>(comparator);
        bids.add(bid(1, "99", 0));
        bids.add(bid(5, "101", 4));
        bids.add(bid(3, "101", 4));
        bids.add(bid(2, "100", 1));

        assertThat(bids.descendingSet()).extracting(OrderKey::getOrderId)
                .containsExactly(3L, 5L, 2L, 1L);
    }

    @Test
    @DisplayName("Ordering is antisymmetric and transitive over a mixed sample")
    void strictTotalOrder() {
        List<OrderKey> keys = new ArrayList<>();
        long id = 1;
        for (String price : new String[]{"10", "10.5", "11"}) {
            for (long second = 0; second < 3; second++) {
                keys.add(bid(id++, price, second));
                keys.add(bid(id++, price, second));
            }
        }

        for (OrderKey a : keys) {
            for (OrderKey b : keys) {
                int ab = Integer.signum(comparator.compare(a, b));
                int ba = Integer.signum(comparator.compare(b, a));
                assertThat(ab).isEqualTo(-ba);
                assertThat(ab == 0).isEqualTo(a.getOrderId().equals(b.getOrderId()));
                for (OrderKey c : keys) {
                    if (comparator.compare(a, b) > 0 && comparator.compare(b, c) > 0) {
                        assertThat(comparator.compare(a, c)).isPositive();
                    }
                }
            }
        }

        List<OrderKey> shuffled = new ArrayList<>(keys);
        Collections.shuffle(shuffled);
        shuffled.sort(comparator);
        TreeSet<OrderKey> sorted = new TreeSet<>(comparator);
        sorted.addAll(keys);
        assertThat(sorted).hasSize(keys.size()).containsExactlyElementsOf(shuffled);
    }
}
