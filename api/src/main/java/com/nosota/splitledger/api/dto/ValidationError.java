package com.nosota.splitledger.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.nosota.splitledger.api.model.ErrorSeverity;
import com.nosota.splitledger.api.model.ValidationErrorCode;

/**
 * Problem found while computing, returned as data rather than thrown.
 *
 * @param code      What went wrong
 * @param severity  BLOCKING or WARNING
 * @param message   Human readable detail
 * @param subjectId Item, user, expense or transfer the error is about; null when global
 */
public record ValidationError(
        ValidationErrorCode code,
        ErrorSeverity severity,
        String message,
        String subjectId
) {
    public static ValidationError blocking(ValidationErrorCode code, String subjectId, String message) {
        return new ValidationError(code, ErrorSeverity.BLOCKING, message, subjectId);
    }

    public static ValidationError warning(ValidationErrorCode code, String subjectId, String message) {
        return new ValidationError(code, ErrorSeverity.WARNING, message, subjectId);
    }

    @JsonIgnore
    public boolean isBlocking() {
        return severity == ErrorSeverity.BLOCKING;
    }
}
