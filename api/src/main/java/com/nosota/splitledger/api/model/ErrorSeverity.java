package com.nosota.splitledger.api.model;

/**
 * Severity of a {@link com.nosota.splitledger.api.dto.ValidationError}.
 */
public enum ErrorSeverity {
    /**
     * The computed result must not be accepted (persisted, shown as final, settled against).
     */
    BLOCKING,

    /**
     * Advisory only. The result is valid.
     */
    WARNING
}
