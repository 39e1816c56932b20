package com.phillippitts.newwork.service.backend;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 */
final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        // stdout and stderr are logged at different levels
        pb.redirectErrorStream(false);
        Process process = pb.start();
        // backend never reads stdin
        process.getOutputStream().close();
        return process;
    }
}
