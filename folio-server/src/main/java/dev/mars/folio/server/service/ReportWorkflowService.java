/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.folio.server.service;

import dev.mars.folio.core.ExportArtifact;
import dev.mars.folio.core.ExportFormat;
import dev.mars.folio.core.ReportState;
import dev.mars.folio.core.ReportStatus;
import dev.mars.folio.core.Section;
import dev.mars.folio.core.exceptions.ErrorCode;
import dev.mars.folio.core.exceptions.ReportWorkflowException;
import dev.mars.folio.core.plan.SectionDefinition;
import dev.mars.folio.core.plan.SectionPlan;
import dev.mars.folio.core.workflow.ReportWorkflow;
import dev.mars.folio.server.export.ExportException;
import dev.mars.folio.server.export.ReportExporter;
import dev.mars.folio.server.export.ReportExporterRegistry;
import dev.mars.folio.server.generation.GeneratedContent;
import dev.mars.folio.server.generation.GenerationRequest;
import dev.mars.folio.server.generation.MarkdownContentValidator;
import dev.mars.folio.server.generation.SectionGenerator;
import dev.mars.folio.server.observability.ServerMetrics;
import dev.mars.folio.server.store.ReportRepository;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Authoritative report workflow: applies every command through {@link ReportWorkflow}, persists the
 * result and runs generation and finalisation in the background.
 *
 * <p>Every mutation of one report happens while holding that report's lock. Asynchronous outcomes
 * re-enter through the same lock and re-check the state they expect, so a generation attempt that was
 * superseded (its section was reset, or regenerated under a newer attempt) is dropped instead of
 * overwriting newer state.</p>
 *
 * <p>Finalisation runs as two timer steps after the {@code 202}: {@code validating} is checked
 * and moves to {@code finalizing}, then every offered export format is rendered once before the
 * report is marked {@code completed}. A render failure fails the report with its reason.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ReportWorkflowService {

    private static final Logger logger = LoggerFactory.getLogger(ReportWorkflowService.class);
    private static final long IDLE_POLL_MS = 25;
    private static final String MDC_SESSION_ID = "sessionId";
    private static final String MDC_SECTION_ID = "sectionId";

    private final Vertx vertx;
    private final ReportRepository repository;
    private final ReportWorkflow workflow;
    private final SectionGenerator generator;
    private final MarkdownContentValidator validator;
    private final ReportExporterRegistry exporters;
    private final ServerMetrics metrics;
    private final SectionPlan defaultPlan;
    private final long finalizeStepDelayMs;

    // One lock per stored report; creation is serialised separately so previews never add entries
    private final Map<String, Object> locks = new ConcurrentHashMap<>();
    private final Object creationLock = new Object();
    // Latest attempt token per section; completions carrying an older token are stale
    private final Map<AttemptKey, Long> attempts = new ConcurrentHashMap<>();
    private final AtomicLong attemptSequence = new AtomicLong(0);
    // Reports between a finalize request and their last finalize step
    private final Set<String> finalizeRuns = ConcurrentHashMap.newKeySet();

    public ReportWorkflowService(Vertx vertx,
                                 ReportRepository repository,
                                 ReportWorkflow workflow,
                                 SectionGenerator generator,
                                 MarkdownContentValidator validator,
                                 ReportExporterRegistry exporters,
                                 ServerMetrics metrics,
                                 SectionPlan defaultPlan,
                                 long finalizeStepDelayMs) {
        this.vertx = vertx;
        this.repository = repository;
        this.workflow = workflow;
        this.generator = generator;
        this.validator = validator;
        this.exporters = exporters;
        this.metrics = metrics;
        this.defaultPlan = defaultPlan;
        this.finalizeStepDelayMs = finalizeStepDelayMs;
    }

    // ==================== Report commands ====================

    /**
     * Creates the report for a session, or previews it when {@code confirm} is false.
     *
     * @param definitions the requested plan, or {@code null} for the default outline
     */
    public Future<ReportState> initialize(String sessionId, boolean confirm, List<SectionDefinition> definitions) {
        SectionPlan plan = definitions != null ? new SectionPlan(definitions) : defaultPlan;
        try {
            if (!confirm) {
                Optional<ReportState> existing = repository.find(sessionId);
                if (existing.isPresent() && existing.get().isUserConfirmedStart()) {
                    return Future.succeededFuture(existing.get());
                }
                logger.debug("Previewing report {} with {} sections", sessionId, plan.getDefinitions().size());
                return Future.succeededFuture(workflow.preview(sessionId, plan));
            }
            synchronized (creationLock) {
                if (repository.find(sessionId).isPresent()) {
                    synchronized (lockFor(sessionId)) {
                        ReportState existing = require(sessionId);
                        ReportState current = workflow.initialize(sessionId, plan, existing);
                        if (current != existing) {
                            repository.save(current);
                        }
                        logger.debug("Report {} already initialized, returning it", sessionId);
                        return Future.succeededFuture(current);
                    }
                }
                ReportState created = workflow.initialize(sessionId, plan, null);
                repository.save(created);
                locks.putIfAbsent(sessionId, new Object());
                logger.info("Initialized report {} with {} sections", sessionId, created.getSections().size());
                return Future.succeededFuture(created);
            }
        } catch (ReportWorkflowException e) {
            return Future.failedFuture(e);
        }
    }

    public Future<ReportState> getReport(String sessionId) {
        try {
            return Future.succeededFuture(require(sessionId));
        } catch (ReportWorkflowException e) {
            return Future.failedFuture(e);
        }
    }

    /**
     * Starts the finalize protocol. The returned report is {@code validating}; the rest happens on timers.
     */
    public Future<ReportState> finalizeReport(String sessionId) {
        try {
            ReportState validating;
            synchronized (lockFor(sessionId)) {
                validating = workflow.beginFinalize(require(sessionId));
                repository.save(validating);
                finalizeRuns.add(sessionId);
            }
            logger.info("Finalize requested for report {}", sessionId);
            vertx.setTimer(finalizeStepDelayMs,
                    id -> inReportContext(sessionId, null, () -> runValidation(sessionId)));
            return Future.succeededFuture(validating);
        } catch (ReportWorkflowException e) {
            return Future.failedFuture(e);
        }
    }

    /**
     * Renders a completed report.
     *
     * @param formatName the wire name of the requested format
     */
    public Future<ExportArtifact> export(String sessionId, String formatName) {
        try {
            ExportFormat format = ExportFormat.fromWireName(formatName)
                    .orElseThrow(() -> ReportWorkflowException.of(ErrorCode.UNSUPPORTED_EXPORT_FORMAT, formatName));
            ReportState report = require(sessionId);
            workflow.checkExport(report, format, exporters.supportedFormats());
            ReportExporter exporter = exporters.find(format)
                    .orElseThrow(() -> ReportWorkflowException.of(ErrorCode.UNSUPPORTED_EXPORT_FORMAT, formatName));
            try {
                ExportArtifact artifact = exporter.export(report);
                metrics.recordExport(format.getWireName(), true);
                logger.info("Exported report {} as {} ({} bytes)", sessionId, format.getWireName(), artifact.getSize());
                return Future.succeededFuture(artifact);
            } catch (ExportException e) {
                metrics.recordExport(format.getWireName(), false);
                logger.error("Export of report {} as {} failed: {}", sessionId, format.getWireName(), e.getMessage(), e);
                return Future.failedFuture(new ReportWorkflowException(ErrorCode.EXPORT_FAILED,
                        ErrorCode.EXPORT_FAILED.formatMessage(format.getWireName(), e.getMessage()), e));
            }
        } catch (ReportWorkflowException e) {
            return Future.failedFuture(e);
        }
    }

    // ==================== Section commands ====================

    /**
     * Moves a section to {@code generating} and dispatches its first draft (or retry).
     */
    public Future<Section> generateSection(String sessionId, String sectionId) {
        try {
            Dispatch dispatch;
            synchronized (lockFor(sessionId)) {
                ReportState updated = workflow.generate(require(sessionId), sectionId);
                repository.save(updated);
                dispatch = newAttempt(updated, sectionId);
            }
            logger.info("Generating section {} of report {} (attempt {})", sectionId, sessionId, dispatch.token);
            dispatchGeneration(dispatch);
            return Future.succeededFuture(dispatch.section);
        } catch (ReportWorkflowException e) {
            return Future.failedFuture(e);
        }
    }

    /**
     * Records a review decision. A rejection dispatches a regeneration steered by the feedback.
     */
    public Future<Section> submitReview(String sessionId, String sectionId, boolean accepted, String feedback) {
        try {
            Dispatch dispatch = null;
            Section section;
            synchronized (lockFor(sessionId)) {
                ReportState updated = workflow.submitReview(require(sessionId), sectionId, accepted, feedback);
                repository.save(updated);
                if (accepted) {
                    section = requireSection(updated, sectionId);
                } else {
                    dispatch = newAttempt(updated, sectionId);
                    section = dispatch.section;
                }
            }
            if (dispatch != null) {
                logger.info("Section {} of report {} rejected, regenerating revision {}",
                        sectionId, sessionId, section.getRevision());
                dispatchGeneration(dispatch);
            } else {
                logger.info("Section {} of report {} accepted", sectionId, sessionId);
            }
            return Future.succeededFuture(section);
        } catch (ReportWorkflowException e) {
            return Future.failedFuture(e);
        }
    }

    public Future<Section> resetSection(String sessionId, String sectionId, boolean force) {
        try {
            Section section;
            synchronized (lockFor(sessionId)) {
                ReportState updated = workflow.reset(require(sessionId), sectionId, force);
                repository.save(updated);
                attempts.remove(new AttemptKey(sessionId, sectionId));
                section = requireSection(updated, sectionId);
            }
            logger.info("Section {} of report {} reset (force={})", sectionId, sessionId, force);
            return Future.succeededFuture(section);
        } catch (ReportWorkflowException e) {
            return Future.failedFuture(e);
        }
    }

    public Future<Void> close() {
        return generator.close();
    }

    /**
     * Number of generation attempts and finalize runs that have not reached their outcome yet.
     */
    public int activeJobCount() {
        return attempts.size() + finalizeRuns.size();
    }

    /**
     * Completes once no background job is active, or when the timeout elapses with jobs still running.
     * Never fails: a timed-out wait is logged and shutdown goes ahead.
     */
    public Future<Void> awaitIdle(long timeoutMs) {
        if (activeJobCount() == 0) {
            return Future.succeededFuture();
        }
        logger.info("Waiting up to {}ms for {} background job(s) to finish", timeoutMs, activeJobCount());
        Promise<Void> idle = Promise.promise();
        long deadline = System.currentTimeMillis() + timeoutMs;
        vertx.setPeriodic(IDLE_POLL_MS, timerId -> {
            int active = activeJobCount();
            if (active == 0) {
                vertx.cancelTimer(timerId);
                idle.tryComplete();
            } else if (System.currentTimeMillis() >= deadline) {
                vertx.cancelTimer(timerId);
                logger.warn("Gave up waiting for {} background job(s) after {}ms", active, timeoutMs);
                idle.tryComplete();
            }
        });
        return idle.future();
    }

    // ==================== Generation ====================

    private Dispatch newAttempt(ReportState report, String sectionId) throws ReportWorkflowException {
        Section section = requireSection(report, sectionId);
        long token = attemptSequence.incrementAndGet();
        attempts.put(new AttemptKey(report.getSessionId(), sectionId), token);
        return new Dispatch(GenerationRequest.forSection(report, section), section, token);
    }

    private void dispatchGeneration(Dispatch dispatch) {
        long started = System.currentTimeMillis();
        Future<GeneratedContent> attempt;
        try {
            attempt = generator.generate(dispatch.request);
        } catch (RuntimeException e) {
            attempt = Future.failedFuture(e);
        }
        attempt.onComplete(result -> inReportContext(dispatch.request.getSessionId(), dispatch.request.getSectionId(),
                () -> recordOutcome(dispatch, result, System.currentTimeMillis() - started)));
    }

    private void recordOutcome(Dispatch dispatch, AsyncResult<GeneratedContent> result, long durationMs) {
        String sessionId = dispatch.request.getSessionId();
        String sectionId = dispatch.request.getSectionId();
        Optional<Object> lock = storedLock(sessionId);
        if (lock.isEmpty()) {
            logger.warn("Dropping generation attempt {} for unknown report {}", dispatch.token, sessionId);
            attempts.remove(new AttemptKey(sessionId, sectionId), dispatch.token);
            return;
        }
        synchronized (lock.get()) {
            AttemptKey key = new AttemptKey(sessionId, sectionId);
            Long latest = attempts.get(key);
            Optional<Section> section = repository.find(sessionId).flatMap(report -> report.findSection(sectionId));
            if (latest == null || latest != dispatch.token
                    || section.isEmpty() || !section.get().getStatus().isGenerating()) {
                if (latest != null && latest == dispatch.token) {
                    attempts.remove(key);
                }
                logger.debug("Dropping superseded generation attempt {} for section {} of report {}",
                        dispatch.token, sectionId, sessionId);
                metrics.recordGeneration("superseded", durationMs);
                return;
            }
            attempts.remove(key);

            try {
                ReportState report = require(sessionId);
                ReportState next;
                if (result.succeeded()) {
                    GeneratedContent generated = result.result();
                    Optional<String> problem = validator.problem(generated.getContent());
                    if (problem.isPresent()) {
                        logger.warn("Rejecting generated content for section {} of report {}: {}",
                                sectionId, sessionId, problem.get());
                        next = workflow.failGeneration(report, sectionId);
                        metrics.recordGeneration("failed", durationMs);
                    } else {
                        String modelName = generated.getModelName() != null ? generated.getModelName() : generator.name();
                        next = workflow.completeGeneration(report, sectionId, generated.getContent(), modelName);
                        metrics.recordGeneration("completed", durationMs);
                        logger.info("Section {} of report {} ready for review ({}ms, model={})",
                                sectionId, sessionId, durationMs, modelName);
                    }
                } else {
                    logger.warn("Generation failed for section {} of report {}: {}",
                            sectionId, sessionId, result.cause().getMessage());
                    logger.debug("Generation failure cause", result.cause());
                    next = workflow.failGeneration(report, sectionId);
                    metrics.recordGeneration("failed", durationMs);
                }
                repository.save(next);
            } catch (ReportWorkflowException e) {
                logger.error("Could not record generation outcome for section {} of report {}: {}",
                        sectionId, sessionId, e.getMessage(), e);
            }
        }
    }

    // ==================== Finalize steps ====================

    private void runValidation(String sessionId) {
        Optional<Object> lock = storedLock(sessionId);
        if (lock.isEmpty()) {
            finalizeRuns.remove(sessionId);
            return;
        }
        synchronized (lock.get()) {
            Optional<ReportState> current = repository.find(sessionId);
            if (current.isEmpty() || current.get().getReportStatus() != ReportStatus.VALIDATING) {
                logger.debug("Report {} left validating before the validation step ran", sessionId);
                finalizeRuns.remove(sessionId);
                return;
            }
            try {
                ReportState next = workflow.completeValidation(current.get());
                repository.save(next);
                if (next.getReportStatus() == ReportStatus.FINALIZING) {
                    logger.info("Report {} validated, finalizing", sessionId);
                    vertx.setTimer(finalizeStepDelayMs,
                            id -> inReportContext(sessionId, null, () -> runFinalization(sessionId)));
                } else {
                    logger.warn("Report {} failed validation: {}", sessionId, next.getFailureReason());
                    metrics.recordFinalization(false);
                    finalizeRuns.remove(sessionId);
                }
            } catch (ReportWorkflowException e) {
                logger.error("Validation step failed for report {}: {}", sessionId, e.getMessage(), e);
                finalizeRuns.remove(sessionId);
            }
        }
    }

    private void runFinalization(String sessionId) {
        try {
            finalizeLocked(sessionId);
        } finally {
            finalizeRuns.remove(sessionId);
        }
    }

    private void finalizeLocked(String sessionId) {
        Optional<Object> lock = storedLock(sessionId);
        if (lock.isEmpty()) {
            return;
        }
        synchronized (lock.get()) {
            Optional<ReportState> current = repository.find(sessionId);
            if (current.isEmpty() || current.get().getReportStatus() != ReportStatus.FINALIZING) {
                logger.debug("Report {} left finalizing before the finalization step ran", sessionId);
                return;
            }
            ReportState report = current.get();
            try {
                String renderProblem = null;
                for (ExportFormat format : exporters.supportedFormats()) {
                    ReportExporter exporter = exporters.find(format).orElseThrow();
                    try {
                        exporter.export(report);
                    } catch (ExportException e) {
                        renderProblem = "Rendering " + format.getWireName() + " failed: " + e.getMessage();
                        break;
                    }
                }
                ReportState next = renderProblem == null
                        ? workflow.completeFinalization(report)
                        : workflow.failFinalize(report, renderProblem);
                repository.save(next);
                boolean completed = next.getReportStatus() == ReportStatus.COMPLETED;
                metrics.recordFinalization(completed);
                if (completed) {
                    logger.info("Report {} completed", sessionId);
                } else {
                    logger.warn("Report {} failed finalization: {}", sessionId, next.getFailureReason());
                }
            } catch (ReportWorkflowException e) {
                logger.error("Finalization step failed for report {}: {}", sessionId, e.getMessage(), e);
            }
        }
    }

    // ==================== Helpers ====================

    private ReportState require(String sessionId) throws ReportWorkflowException {
        return repository.find(sessionId)
                .orElseThrow(() -> ReportWorkflowException.of(ErrorCode.REPORT_NOT_FOUND, sessionId));
    }

    private static Section requireSection(ReportState report, String sectionId) throws ReportWorkflowException {
        return report.findSection(sectionId)
                .orElseThrow(() -> ReportWorkflowException.of(ErrorCode.SECTION_NOT_FOUND, sectionId));
    }

    /**
     * Returns the lock of a stored report, failing with {@code REPORT_NOT_FOUND} for unknown sessions.
     */
    private Object lockFor(String sessionId) throws ReportWorkflowException {
        return storedLock(sessionId)
                .orElseThrow(() -> ReportWorkflowException.of(ErrorCode.REPORT_NOT_FOUND, sessionId));
    }

    private Optional<Object> storedLock(String sessionId) {
        Object lock = locks.get(sessionId);
        if (lock != null) {
            return Optional.of(lock);
        }
        if (repository.find(sessionId).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(locks.computeIfAbsent(sessionId, id -> new Object()));
    }

    /**
     * Runs a background step with the report it works on in the MDC, as request handling does.
     */
    private static void inReportContext(String sessionId, String sectionId, Runnable step) {
        String outerSession = MDC.get(MDC_SESSION_ID);
        String outerSection = MDC.get(MDC_SECTION_ID);
        MDC.put(MDC_SESSION_ID, sessionId);
        if (sectionId != null) {
            MDC.put(MDC_SECTION_ID, sectionId);
        }
        try {
            step.run();
        } finally {
            restore(MDC_SESSION_ID, outerSession);
            restore(MDC_SECTION_ID, outerSection);
        }
    }

    private static void restore(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    int lockCount() {
        return locks.size();
    }

    private record AttemptKey(String sessionId, String sectionId) {
    }

    private static final class Dispatch {
        private final GenerationRequest request;
        private final Section section;
        private final long token;

        private Dispatch(GenerationRequest request, Section section, long token) {
            this.request = request;
            this.section = section;
            this.token = token;
        }
    }
}
