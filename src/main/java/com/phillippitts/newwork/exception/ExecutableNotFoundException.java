package com.phillippitts.newwork.exception;

import java.nio.file.Path;

/**
 * Thrown when the backend executable does not exist at its resolved location.
 * Restarting cannot fix this; the installation is broken.
 */
public class ExecutableNotFoundException extends BackendStartException {

    private final Path executablePath;

    public ExecutableNotFoundException(Path executablePath) {
        super("Backend executable not found at: " + executablePath);
        this.executablePath = executablePath;
    }

    public Path getExecutablePath() {
        return executablePath;
    }
}
