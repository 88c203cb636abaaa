package cex.oceanbook.matching.exception;

/**
 * Raised for any request against an order book that was halted after a contract violation
 */
public class OrderBookHaltedException extends BusinessException {
    public OrderBookHaltedException(String message) {
        super(message);
    }
}
