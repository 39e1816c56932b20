package com.phillippitts.newwork.presentation.dto;

/**
 * @param errorId     id assigned to the reported error
 * @param result      {@link #ACCEPTED} once the error is queued for recovery
 * @param userMessage message to show the user
 */
public record ErrorReportResponse(String errorId, String result, String userMessage) {

    public static final String ACCEPTED = "ACCEPTED";
}
