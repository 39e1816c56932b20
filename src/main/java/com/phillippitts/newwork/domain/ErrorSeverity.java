package com.phillippitts.newwork.domain;

public enum ErrorSeverity {
    INFO,
    WARNING,
    CRITICAL
}
