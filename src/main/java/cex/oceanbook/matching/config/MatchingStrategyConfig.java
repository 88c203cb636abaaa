package cex.oceanbook.matching.config;

import cex.oceanbook.matching.enums.OrderType;
import cex.oceanbook.matching.strategy.LimitOrderMatchingStrategy;
import cex.oceanbook.matching.strategy.MarketOrderMatchingStrategy;
import cex.oceanbook.matching.strategy.OrderMatchingStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Configuration for order matching strategies
 */
@Configuration
public class MatchingStrategyConfig {

    /**
     * Map of taker OrderType to OrderMatchingStrategy for strategy pattern injection
     *
     * @param limitStrategy the LIMIT taker matching strategy
     * @param marketStrategy the MARKET taker matching strategy
     * @return map of order type to strategy
     */
    @Bean
    public Map<OrderType, OrderMatchingStrategy> matchingStrategies(
            LimitOrderMatchingStrategy limitStrategy,
            MarketOrderMatchingStrategy marketStrategy) {
        return Map.of(
                OrderType.LIMIT, limitStrategy,
                OrderType.MARKET, marketStrategy
        );
    }
}
