package com.chainbills.ledger.exception;

/**
 * Business exception raised by every ledger rule.
 *
 * Purpose:
 *  - Carries a {@link LedgerError} so the exception handler can answer
 *    with a stable code and the matching HTTP status.
 *  - Being unchecked, it rolls back the surrounding transaction: a rejected
 *    operation never leaves partial state behind.
 */
public class LedgerException extends RuntimeException {

    private final LedgerError error;

    public LedgerException(LedgerError error) {
        this(error, error.getDefaultMessage());
    }

    public LedgerException(LedgerError error, String message) {
        super(message);
        this.error = error;
    }

    public LedgerException(LedgerError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    /** @return the error code behind this rejection */
    public LedgerError getError() {
        return error;
    }

    /** Overflow of a counter or balance: fatal for the current transaction. */
    public static LedgerException overflow(String what, ArithmeticException cause) {
        return new LedgerException(LedgerError.ARITHMETIC_OVERFLOW, what + " overflow", cause);
    }
}
