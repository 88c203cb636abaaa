package cex.oceanbook.matching.config;

import cex.oceanbook.matching.service.OrderBookService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Application startup runner that creates one order book per configured symbol.
 *
 * Execution order: 1 (books must exist before any order intake starts)
 */
@Slf4j
@Component
@Order(1)
public class OrderBookInitializer implements ApplicationRunner {

    @Autowired
    private OrderBookService orderBookService;

    @Value("${matching.symbols:}")
    private List<String> symbols;

    @Override
    public void run(ApplicationArguments args) {
        log.info("=== Creating order books for {} symbols ===", symbols.size());

        for (String symbol : symbols) {
            if (symbol.isBlank()) {
                continue;
            }
            orderBookService.createOrderBook(symbol.trim());
        }

        log.info("=== Order books ready: {} ===", orderBookService.getSymbols());
    }
}
