package com.phillippitts.newwork.domain;

/**
 * Origin of a reported fault. Each category has its own recovery strategy.
 */
public enum ErrorCategory {
    /** Failures talking to the embedded backend over its network interface. */
    API,
    /** The backend process itself: crash, unresponsive, failed (re)start. */
    BACKEND,
    /** Faults raised by the presentation layer while rendering. */
    RENDER,
    /** Uncategorized application-logic faults. */
    RUNTIME
}
