package com.phillippitts.newwork.presentation.dto;

import com.phillippitts.newwork.domain.RecoveryAttempt;

import java.time.Instant;

public record RecoveryAttemptView(
        String errorId,
        String category,
        String result,
        String actionTaken,
        Instant timestamp
) {
    public static RecoveryAttemptView of(RecoveryAttempt a) {
        return new RecoveryAttemptView(a.error().id(), a.error().category().name(), a.result().name(),
                a.actionTaken(), a.timestamp());
    }
}
