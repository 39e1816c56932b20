package com.phillippitts.newwork.service.backend;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Where the bundled backend executable lives relative to the host application's install
 * directory, per operating system.
 *
 * <ul>
 *   <li>macOS: {@code <App>.app/Contents/MacOS/../Resources/backend/<name>}</li>
 *   <li>Linux: {@code <install>/backend/<name>}</li>
 *   <li>Windows: {@code <install>\backend\<name>.exe}</li>
 * </ul>
 */
public enum HostPlatform {

    MAC_OS(List.of("..", "Resources", "backend"), ""),
    LINUX(List.of("backend"), ""),
    WINDOWS(List.of("backend"), ".exe");

    private final List<String> relativeDirs;
    private final String executableSuffix;

    HostPlatform(List<String> relativeDirs, String executableSuffix) {
        this.relativeDirs = relativeDirs;
        this.executableSuffix = executableSuffix;
    }

    /**
     * Resolves the executable path for this platform.
     *
     * @param installDir     directory containing the host application's launcher
     * @param executableName base name without platform suffix
     * @return normalized absolute path (existence is not checked here)
     */
    public Path resolve(Path installDir, String executableName) {
        Path dir = installDir.toAbsolutePath();
        for (String segment : relativeDirs) {
            dir = dir.resolve(segment);
        }
        return dir.resolve(executableName + executableSuffix).normalize();
    }

    /** Platform of the running JVM. */
    public static HostPlatform current() {
        return detect(System.getProperty("os.name", ""));
    }

    /**
     * @param osName value of the {@code os.name} system property
     * @throws IllegalStateException if no backend build exists for the platform
     */
    public static HostPlatform detect(String osName) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("mac") || os.contains("darwin")) {
            return MAC_OS;
        }
        if (os.contains("win")) {
            return WINDOWS;
        }
        if (os.contains("linux")) {
            return LINUX;
        }
        throw new IllegalStateException("Unsupported platform: " + osName);
    }
}
