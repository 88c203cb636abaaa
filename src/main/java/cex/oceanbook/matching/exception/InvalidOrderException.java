package cex.oceanbook.matching.exception;

/**
 * Invalid order exception
 */
public class InvalidOrderException extends BusinessException {
    public InvalidOrderException(String message) {
        super(message);
    }
}
