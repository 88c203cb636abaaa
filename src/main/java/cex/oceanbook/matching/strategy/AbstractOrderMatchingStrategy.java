package cex.oceanbook.matching.strategy;

import cex.oceanbook.matching.domain.Order;
import cex.oceanbook.matching.domain.Trade;
import cex.oceanbook.matching.enums.OrderSide;
import cex.oceanbook.matching.exception.MatchingContractViolationException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Shared execution step: resolves bid/ask, fills both orders and builds the trade at the maker's price
 */
@Slf4j
public abstract class AbstractOrderMatchingStrategy implements OrderMatchingStrategy {

    @Override
    public Optional<Trade> match(Order maker, Order taker) {
        if (maker.getSide() == taker.getSide()) {
            throw new MatchingContractViolationException(
                "Match order with same side " + maker.getSide() + ": maker=" + maker.getOrderId()
                    + ", taker=" + taker.getOrderId());
        }

        Order bid = maker.getSide() == OrderSide.BUY ? maker : taker;
        Order ask = maker.getSide() == OrderSide.BUY ? taker : maker;

        if (!crosses(bid, ask)) {
            return Optional.empty();
        }

        return Optional.of(execute(maker, taker, bid, ask));
    }

    /**
     * Price condition for the taker's order type
     */
    protected abstract boolean crosses(Order bid, Order ask);

    private Trade execute(Order maker, Order taker, Order bid, Order ask) {
        BigDecimal quantity = bid.getPendingQuantity().min(ask.getPendingQuantity());
        BigDecimal price = maker.getPrice();

        bid.fill(quantity);
        ask.fill(quantity);

        log.debug("Matched maker {} with taker {} at price {}: qty={}",
                maker.getOrderId(), taker.getOrderId(), price, quantity);

        return Trade.builder()
                .symbol(maker.getSymbol())
                .price(price)
                .quantity(quantity)
                .total(quantity.multiply(price))
                .makerOrderId(maker.getOrderId())
                .takerOrderId(taker.getOrderId())
                .makerMemberId(maker.getMemberId())
                .takerMemberId(taker.getMemberId())
                .takerSide(taker.getSide())
                .createdAt(LocalDateTime.now())
                .build();
    }
}
