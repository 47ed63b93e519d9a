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

package dev.mars.folio.client.orchestrator;

import dev.mars.folio.client.ReportBackend;
import dev.mars.folio.client.ReportClientException;
import dev.mars.folio.client.ReportErrorClassifier;
import dev.mars.folio.client.observability.ReportClientMetrics;
import dev.mars.folio.client.session.ReportSession;
import dev.mars.folio.client.sync.ReportReconciler;
import dev.mars.folio.client.sync.ReportSynchronizer;
import dev.mars.folio.client.sync.ReportView;
import dev.mars.folio.core.ExportArtifact;
import dev.mars.folio.core.ExportFormat;
import dev.mars.folio.core.ReportState;
import dev.mars.folio.core.Section;
import dev.mars.folio.core.exceptions.ErrorCode;
import dev.mars.folio.core.exceptions.ReportWorkflowException;
import dev.mars.folio.core.plan.PlanValidationResult;
import dev.mars.folio.core.plan.SectionPlan;
import dev.mars.folio.core.workflow.ReportWorkflow;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.EnumSet;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Issues report commands for one session.
 *
 * <p>Every command goes through the same steps:</p>
 * <ol>
 *   <li>advisory check of the workflow rules against the last known snapshot</li>
 *   <li>in-flight guard, per section or for the report as a whole</li>
 *   <li>the authoritative backend request</li>
 *   <li>classification of any failure into a {@link ReportClientException}</li>
 *   <li>resynchronization after success and after recoverable failures</li>
 * </ol>
 *
 * <p>The advisory check only spares the backend requests that are bound to fail; the backend response
 * is the truth. The returned future completes once the follow-up fetch has been applied.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ReportActionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(ReportActionOrchestrator.class);

    private final ReportSession session;
    private final ReportBackend backend;
    private final ReportSynchronizer synchronizer;
    private final ReportWorkflow workflow;
    private final ReportClientMetrics metrics;

    public ReportActionOrchestrator(ReportSession session, ReportBackend backend, ReportSynchronizer synchronizer,
                                    ReportWorkflow workflow, ReportClientMetrics metrics) {
        this.session = session;
        this.backend = backend;
        this.synchronizer = synchronizer;
        this.workflow = workflow;
        this.metrics = metrics;
    }

    /**
     * Requests generation of a planned section, or a retry of one in error.
     */
    public Future<Section> generate(String sectionId) {
        String sid = session.getSessionId();
        return execute("generate", ReportSession.sectionKey(sectionId),
                state -> workflow.generate(state, sectionId),
                () -> backend.generateSection(sid, sectionId),
                this::applySection);
    }

    /**
     * Accepts a section, or rejects it with feedback to have it regenerated.
     */
    public Future<Section> submitReview(String sectionId, boolean accepted, String feedback) {
        String sid = session.getSessionId();
        return execute(accepted ? "accept" : "reject", ReportSession.sectionKey(sectionId),
                state -> workflow.submitReview(state, sectionId, accepted, feedback),
                () -> backend.submitReview(sid, sectionId, accepted, feedback),
                this::applySection);
    }

    /**
     * Returns a section to planned. Accepted sections need {@code force}.
     */
    public Future<Section> reset(String sectionId, boolean force) {
        String sid = session.getSessionId();
        return execute("reset", ReportSession.sectionKey(sectionId),
                state -> workflow.reset(state, sectionId, force),
                () -> backend.resetSection(sid, sectionId, force),
                this::applySection);
    }

    /**
     * Starts the finalize protocol. Refused locally while a previous finalize is still being observed.
     */
    public Future<ReportState> finalizeReport() {
        String sid = session.getSessionId();
        return execute("finalize", ReportSession.REPORT_KEY,
                workflow::beginFinalize,
                () -> backend.finalizeReport(sid),
                this::applyReport);
    }

    /**
     * Downloads the completed report. Whether the format is offered is for the backend to say.
     */
    public Future<ExportArtifact> export(ExportFormat format) {
        String sid = session.getSessionId();
        return execute("export", ReportSession.REPORT_KEY,
                state -> workflow.checkExport(state, format, EnumSet.allOf(ExportFormat.class)),
                () -> backend.export(sid, format),
                artifact -> UnaryOperator.identity());
    }

    /**
     * Initializes the report. With {@code confirm == false} this is a dry run: the would-be report is
     * returned and the view is not touched.
     *
     * @param plan the sections to create, or {@code null} for the backend's default outline
     */
    public Future<ReportState> initialize(boolean confirm, SectionPlan plan) {
        String sid = session.getSessionId();
        if (plan != null) {
            PlanValidationResult validation = plan.validate();
            if (!validation.isValid()) {
                ReportClientException invalid = ReportClientException.local(ErrorCode.INVALID_PLAN,
                        String.join("; ", validation.getMessages()));
                return reject("initialize", invalid);
            }
        }
        return execute(confirm ? "initialize" : "preview", ReportSession.REPORT_KEY,
                state -> { },
                () -> backend.init(sid, confirm, plan),
                report -> confirm ? applyReport(report) : UnaryOperator.identity());
    }

    private <T> Future<T> execute(String command, String key, AdvisoryCheck check, Supplier<Future<T>> request,
                                  ViewUpdate<T> onSuccess) {
        Optional<ReportState> snapshot = session.getView().getReport();
        if (snapshot.isPresent()) {
            try {
                check.verify(snapshot.get());
            } catch (ReportWorkflowException e) {
                ReportClientException rejected = ReportClientException.fromWorkflow(e);
                if (rejected.isRecoverable()) {
                    // The snapshot may be stale; show the current truth
                    log("{} rejected locally: {}", command, rejected.getMessage());
                    return synchronizer.syncNow().compose(view -> Future.<T>failedFuture(rejected));
                }
                return reject(command, rejected);
            }
        }

        if (!session.tryBeginRequest(key)) {
            return reject(command, ReportClientException.local(ErrorCode.REQUEST_IN_FLIGHT, key));
        }

        metrics.recordCommand(command);
        log("Issuing {} for {}", command, key);

        Future<T> outcome;
        try {
            outcome = request.get();
        } catch (RuntimeException e) {
            outcome = Future.failedFuture(e);
        }

        return outcome.compose(
                result -> {
                    session.endRequest(key);
                    session.update(view -> onSuccess.apply(result).apply(view));
                    return synchronizer.syncNow().map(view -> result);
                },
                err -> {
                    session.endRequest(key);
                    ReportClientException failure = ReportErrorClassifier.fromThrowable(err, command);
                    metrics.recordCommandFailure(command, failure.getKind());
                    if (failure.isRecoverable()) {
                        log("{} for {} hit {} ({}), resynchronizing", command, key,
                                failure.getErrorCode().code(), failure.getKind());
                        return synchronizer.syncNow().compose(view -> Future.<T>failedFuture(failure));
                    }
                    log("{} for {} rejected: {}", command, key, failure.getMessage());
                    return Future.<T>failedFuture(failure);
                });
    }

    private <T> Future<T> reject(String command, ReportClientException rejection) {
        log("{} rejected locally: {}", command, rejection.getMessage());
        return Future.failedFuture(rejection);
    }

    private UnaryOperator<ReportView> applySection(Section section) {
        long floor = session.lastIssuedFetchSequence();
        return view -> ReportReconciler.applySection(view, section, floor);
    }

    private UnaryOperator<ReportView> applyReport(ReportState report) {
        long floor = session.lastIssuedFetchSequence();
        return view -> ReportReconciler.applyReport(view, report, floor);
    }

    private void log(String format, Object... args) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable("sessionId", session.getSessionId())) {
            logger.debug(format, args);
        }
    }

    @FunctionalInterface
    private interface AdvisoryCheck {
        void verify(ReportState state) throws ReportWorkflowException;
    }

    @FunctionalInterface
    private interface ViewUpdate<T> {
        UnaryOperator<ReportView> apply(T result);
    }
}
