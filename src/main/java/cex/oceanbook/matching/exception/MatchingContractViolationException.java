package cex.oceanbook.matching.exception;

/**
 * Signals a broken matching invariant, such as matching or ranking two orders of the same side.
 * <p>
 * This is a programming error in the caller, never bad client input. It must not be caught
 * and ignored: the order book that raised it is halted and stops accepting work.
 */
public class MatchingContractViolationException extends IllegalStateException {
    public MatchingContractViolationException(String message) {
        super(message);
    }
}
