package cex.oceanbook.matching.exception;

/**
 * Base class for expected, reportable failures of engine requests
 */
public class BusinessException extends RuntimeException {
    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
