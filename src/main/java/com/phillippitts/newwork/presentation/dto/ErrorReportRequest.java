package com.phillippitts.newwork.presentation.dto;

import com.phillippitts.newwork.domain.ErrorCategory;
import com.phillippitts.newwork.domain.ErrorRecord;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Fault forwarded by the UI.
 *
 * @param category   error category
 * @param message    what failed
 * @param statusCode HTTP status for API errors, exit code for BACKEND errors (optional)
 * @param critical   RUNTIME only: whether the fault left the app unusable
 */
public record ErrorReportRequest(
        @NotNull ErrorCategory category,
        @NotBlank @Size(max = 2000) String message,
        Integer statusCode,
        boolean critical
) {
    public ErrorRecord toErrorRecord() {
        return switch (category) {
            case API -> ErrorRecord.api(message, statusCode, null);
            case BACKEND -> ErrorRecord.backend(message, statusCode, null);
            case RENDER -> ErrorRecord.render(message, null);
            case RUNTIME -> ErrorRecord.runtime(message, critical, null);
        };
    }
}
