package com.phillippitts.newwork.service.backend;

import com.phillippitts.newwork.NewWorkApplication;
import com.phillippitts.newwork.config.properties.BackendProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.system.ApplicationHome;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the backend executable once, at construction, from the host install directory and
 * the {@link HostPlatform} table.
 *
 * <p>Install directory lookup order:
 * <ol>
 *   <li>{@code backend.install-dir} when set</li>
 *   <li>directory of the running launcher (the native launcher of a packaged app)</li>
 *   <li>Spring Boot {@link ApplicationHome} (directory of the application jar)</li>
 * </ol>
 */
@Component
public class BackendExecutableLocator {

    private static final Logger LOG = LogManager.getLogger(BackendExecutableLocator.class);

    private final HostPlatform platform;
    private final Path executable;

    @Autowired
    public BackendExecutableLocator(BackendProperties props) {
        this(resolveInstallDir(props.getInstallDir()), HostPlatform.current(), props.getExecutableName());
    }

    public BackendExecutableLocator(Path installDir, HostPlatform platform, String executableName) {
        Objects.requireNonNull(installDir, "installDir");
        this.platform = Objects.requireNonNull(platform, "platform");
        this.executable = platform.resolve(installDir, Objects.requireNonNull(executableName, "executableName"));
        LOG.info("Backend executable resolved: platform={}, path={}", platform, executable);
    }

    /** Resolved executable path; may not exist. */
    public Path resolve() {
        return executable;
    }

    public HostPlatform getPlatform() {
        return platform;
    }

    static Path resolveInstallDir(String override) {
        if (override != null && !override.isBlank()) {
            return Path.of(override).toAbsolutePath().normalize();
        }
        Optional<String> launcher = ProcessHandle.current().info().command();
        if (launcher.isPresent()) {
            Path parent = Path.of(launcher.get()).toAbsolutePath().getParent();
            if (parent != null) {
                return parent;
            }
        }
        return new ApplicationHome(NewWorkApplication.class).getDir().toPath();
    }
}
