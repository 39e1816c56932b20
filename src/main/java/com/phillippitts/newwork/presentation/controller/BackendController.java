package com.phillippitts.newwork.presentation.controller;

import com.phillippitts.newwork.domain.ErrorCategory;
import com.phillippitts.newwork.domain.ErrorRecord;
import com.phillippitts.newwork.domain.RecoveryResult;
import com.phillippitts.newwork.presentation.dto.BackendStatusResponse;
import com.phillippitts.newwork.presentation.dto.ErrorReportRequest;
import com.phillippitts.newwork.presentation.dto.ErrorReportResponse;
import com.phillippitts.newwork.presentation.dto.ErrorView;
import com.phillippitts.newwork.presentation.dto.RecoveryAttemptView;
import com.phillippitts.newwork.presentation.dto.SystemRestartStatusResponse;
import com.phillippitts.newwork.service.backend.BackendSupervisor;
import com.phillippitts.newwork.service.recovery.ErrorRecoveryOrchestrator;
import com.phillippitts.newwork.service.restart.SystemRestartCoordinator;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Local API used by the UI: backend status, manual restart, error reporting and history.
 */
@RestController
@RequestMapping("/api")
class BackendController {

    private static final Logger LOG = LogManager.getLogger(BackendController.class);

    private final BackendSupervisor supervisor;
    private final ErrorRecoveryOrchestrator orchestrator;
    private final SystemRestartCoordinator restartCoordinator;
    private final Executor recoveryExecutor;

    BackendController(BackendSupervisor supervisor, ErrorRecoveryOrchestrator orchestrator,
                      SystemRestartCoordinator restartCoordinator,
                      @Qualifier("recoveryExecutor") Executor recoveryExecutor) {
        this.supervisor = supervisor;
        this.orchestrator = orchestrator;
        this.restartCoordinator = restartCoordinator;
        this.recoveryExecutor = recoveryExecutor;
    }

    @GetMapping("/backend/status")
    BackendStatusResponse status() {
        return currentStatus();
    }

    @PostMapping("/backend/restart")
    BackendStatusResponse restart() {
        LOG.info("Manual backend restart requested via API");
        orchestrator.restartBackendManually();
        return currentStatus();
    }

    /**
     * Hands the error to the recovery executor and acknowledges at once; a backend restart can
     * take several startup polls. The outcome shows up under {@code /recovery/attempts}.
     */
    @PostMapping("/recovery/errors")
    ResponseEntity<ErrorReportResponse> reportError(@Valid @RequestBody ErrorReportRequest request) {
        ErrorRecord error = request.toErrorRecord();
        recoveryExecutor.execute(() -> {
            RecoveryResult result = orchestrator.reportError(error);
            LOG.debug("Reported error {} finished recovery with {}", error.id(), result);
        });
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new ErrorReportResponse(error.id(), ErrorReportResponse.ACCEPTED, error.userMessage()));
    }

    @GetMapping("/recovery/errors")
    List<ErrorView> errors() {
        return orchestrator.errorHistory().stream().map(ErrorView::of).toList();
    }

    @GetMapping("/recovery/errors/count")
    Map<String, Object> recentErrorCount(@RequestParam ErrorCategory category,
                                         @RequestParam(defaultValue = "300") long windowSeconds) {
        long count = orchestrator.recentErrorCount(category, Duration.ofSeconds(Math.max(0, windowSeconds)));
        return Map.of("category", category.name(), "windowSeconds", windowSeconds, "count", count);
    }

    @GetMapping("/recovery/attempts")
    List<RecoveryAttemptView> attempts() {
        return orchestrator.recoveryHistory().stream().map(RecoveryAttemptView::of).toList();
    }

    @DeleteMapping("/recovery/history")
    ResponseEntity<Void> clearHistory() {
        orchestrator.clearHistory();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/system/restart")
    ResponseEntity<Map<String, Object>> systemRestart() {
        LOG.warn("System restart requested via API");
        boolean completed = orchestrator.triggerSystemRestart();
        return ResponseEntity
                .status(completed ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("completed", completed, "backend", currentStatus()));
    }

    @PostMapping("/system/restart/quick")
    ResponseEntity<Map<String, Object>> quickRestart() {
        LOG.info("Quick backend restart requested via API");
        boolean healthy = restartCoordinator.quickRestartBackend();
        return ResponseEntity
                .status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("completed", healthy, "backend", currentStatus()));
    }

    @GetMapping("/system/restart")
    SystemRestartStatusResponse systemRestartStatus() {
        return SystemRestartStatusResponse.of(restartCoordinator.getCurrentPhase(), restartCoordinator.isRestarting());
    }

    private BackendStatusResponse currentStatus() {
        return BackendStatusResponse.of(supervisor.currentStatus(), supervisor.isRunning(),
                orchestrator.isRecovering(), orchestrator.remainingRecoveryAttempts());
    }
}
