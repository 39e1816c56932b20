package com.phillippitts.newwork.service.backend;

import com.phillippitts.newwork.util.LogSanitizer;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Drains one backend output stream line by line into the log, so the child never blocks on a
 * full pipe. Runs until EOF, which happens when the process exits.
 */
final class ProcessOutputLogger implements Runnable {

    private static final Logger LOG = LogManager.getLogger("com.phillippitts.newwork.backend.output");
    private static final int MAX_LINE_CHARS = 1000;

    private final InputStream inputStream;
    private final String name;
    private final Level level;

    private ProcessOutputLogger(InputStream inputStream, String name, Level level) {
        this.inputStream = inputStream;
        this.name = name;
        this.level = level;
    }

    /**
     * Starts a daemon thread logging each line of {@code inputStream} at {@code level}.
     */
    static Thread start(InputStream inputStream, String name, Level level) {
        Thread t = new Thread(new ProcessOutputLogger(inputStream, name, level), name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    @Override
    public void run() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String clean = LogSanitizer.singleLine(line, MAX_LINE_CHARS);
                if (!clean.isEmpty()) {
                    LOG.log(level, "[{}] {}", name, clean);
                }
            }
        } catch (IOException e) {
            // stream closed underneath us when the process is killed
            LOG.debug("{} stream closed: {}", name, e.getMessage());
        }
    }
}
