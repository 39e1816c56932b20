package com.phillippitts.newwork.service.backend;

import com.phillippitts.newwork.domain.ErrorRecord;
import com.phillippitts.newwork.exception.BackendStartException;
import com.phillippitts.newwork.exception.ExecutableNotFoundException;
import com.phillippitts.newwork.service.backend.event.BackendFaultEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Starts the backend once the application is ready. A failed start is reported as a
 * {@link BackendFaultEvent} so the recovery orchestrator decides what happens next; a missing
 * executable is reported as not recoverable.
 */
@Component
@ConditionalOnProperty(prefix = "backend", name = "auto-start", havingValue = "true", matchIfMissing = true)
public class BackendAutoStarter {

    private static final Logger LOG = LogManager.getLogger(BackendAutoStarter.class);

    private final BackendSupervisor supervisor;
    private final ApplicationEventPublisher publisher;

    public BackendAutoStarter(BackendSupervisor supervisor, ApplicationEventPublisher publisher) {
        this.supervisor = supervisor;
        this.publisher = publisher;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Async("recoveryExecutor")
    public void startOnReady() {
        LOG.info("Auto-starting backend");
        try {
            supervisor.startProcess();
        } catch (ExecutableNotFoundException e) {
            LOG.error("Backend auto-start failed: {}", e.getMessage());
            publisher.publishEvent(new BackendFaultEvent(
                    ErrorRecord.backend("Backend executable is missing", null, e, false)));
        } catch (BackendStartException e) {
            LOG.error("Backend auto-start failed: {}", e.getMessage());
            publisher.publishEvent(new BackendFaultEvent(
                    ErrorRecord.backend("Backend failed to start: " + e.getMessage(), e.getExitCode(), e)));
        }
    }
}
