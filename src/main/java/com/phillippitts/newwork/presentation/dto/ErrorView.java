package com.phillippitts.newwork.presentation.dto;

import com.phillippitts.newwork.domain.ErrorRecord;

import java.time.Instant;

/**
 * Error history entry; the raw cause is never serialized.
 */
public record ErrorView(
        String id,
        String category,
        String severity,
        String message,
        String userMessage,
        String technicalDetails,
        boolean recoverable,
        Instant timestamp
) {
    public static ErrorView of(ErrorRecord e) {
        return new ErrorView(e.id(), e.category().name(), e.severity().name(), e.message(),
                e.userMessage(), e.technicalDetails(), e.recoverable(), e.timestamp());
    }
}
