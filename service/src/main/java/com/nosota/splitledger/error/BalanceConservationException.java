package com.nosota.splitledger.error;

/**
 * Raised when the net balances of a settlement do not sum to zero.
 */
public class BalanceConservationException extends Exception {
    public BalanceConservationException() {
    }

    public BalanceConservationException(String message) {
        super(message);
    }

    public BalanceConservationException(String message, Throwable cause) {
        super(message, cause);
    }

    public BalanceConservationException(Throwable cause) {
        super(cause);
    }

    public BalanceConservationException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
