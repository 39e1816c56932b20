package com.phillippitts.newwork.service.backend;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One spawned backend process.
 *
 * <p>The intentional-stop flag belongs to the handle, not the supervisor, so the exit observer
 * of an old process can never misread a flag meant for its successor.
 */
final class BackendHandle {

    private final Process process;
    private final Path executable;
    private final String host;
    private final int port;
    private final Instant startedAt;
    private final AtomicBoolean intentionalStop = new AtomicBoolean(false);
    private volatile Thread stdoutLogger;
    private volatile Thread stderrLogger;

    BackendHandle(Process process, Path executable, String host, int port) {
        this.process = process;
        this.executable = executable;
        this.host = host;
        this.port = port;
        this.startedAt = Instant.now();
    }

    Process process() {
        return process;
    }

    Path executable() {
        return executable;
    }

    String host() {
        return host;
    }

    int port() {
        return port;
    }

    Instant startedAt() {
        return startedAt;
    }

    void markIntentionalStop() {
        intentionalStop.set(true);
    }

    boolean isIntentionalStop() {
        return intentionalStop.get();
    }

    void attachOutputLoggers(Thread stdout, Thread stderr) {
        this.stdoutLogger = stdout;
        this.stderrLogger = stderr;
    }

    /** Waits briefly for the output loggers to drain; best effort. */
    void joinOutput(Duration timeout) {
        joinQuietly(stdoutLogger, timeout);
        joinQuietly(stderrLogger, timeout);
    }

    private static void joinQuietly(Thread t, Duration timeout) {
        if (t == null || t == Thread.currentThread()) {
            return;
        }
        try {
            t.join(timeout.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        return "BackendHandle{pid=" + safePid() + ", executable=" + executable + ", port=" + port + '}';
    }

    private String safePid() {
        try {
            return String.valueOf(process.pid());
        } catch (UnsupportedOperationException e) {
            return "n/a";
        }
    }
}
