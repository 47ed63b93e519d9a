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

package dev.mars.folio.client;

import dev.mars.folio.core.ExportArtifact;
import dev.mars.folio.core.ExportFormat;
import dev.mars.folio.core.ReportState;
import dev.mars.folio.core.Section;
import dev.mars.folio.core.exceptions.ErrorCode;
import dev.mars.folio.core.exceptions.ReportWorkflowException;
import dev.mars.folio.core.plan.SectionDefinition;
import dev.mars.folio.core.plan.SectionPlan;
import dev.mars.folio.core.workflow.ReportWorkflow;
import io.vertx.core.Future;
import io.vertx.core.Promise;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * Backend that applies the shared workflow rules to reports held in memory.
 * Generation and finalization only advance when the test says so.
 */
public class InMemoryReportBackend implements ReportBackend {

    static final SectionPlan DEFAULT_PLAN = new SectionPlan(List.of(
            SectionDefinition.of("intro", "Introduction"),
            SectionDefinition.of("findings", "Findings", "intro")));

    private final ReportWorkflow workflow = new ReportWorkflow();
    private final Map<String, ReportState> reports = new HashMap<>();

    private final AtomicInteger fetchCount = new AtomicInteger();
    private final AtomicInteger commandCount = new AtomicInteger();
    private final AtomicInteger failingFetches = new AtomicInteger();
    private volatile ReportClientException nextCommandFailure;
    private volatile Promise<Void> commandGate;

    public synchronized void put(ReportState state) {
        reports.put(state.getSessionId(), state);
    }

    public synchronized ReportState stored(String sessionId) {
        return reports.get(sessionId);
    }

    public void failNextFetches(int count) {
        failingFetches.set(count);
    }

    public void failNextCommand(ReportClientException failure) {
        nextCommandFailure = failure;
    }

    /**
     * Holds every command until {@link #releaseCommands()}.
     */
    public void holdCommands() {
        commandGate = Promise.promise();
    }

    public void releaseCommands() {
        Promise<Void> gate = commandGate;
        commandGate = null;
        if (gate != null) {
            gate.complete();
        }
    }

    public int getFetchCount() {
        return fetchCount.get();
    }

    public int getCommandCount() {
        return commandCount.get();
    }

    public synchronized void completeGeneration(String sessionId, String sectionId, String content) {
        mutate(sessionId, state -> rethrow(() -> workflow.completeGeneration(state, sectionId, content, "test-model")));
    }

    public synchronized void failGeneration(String sessionId, String sectionId) {
        mutate(sessionId, state -> rethrow(() -> workflow.failGeneration(state, sectionId)));
    }

    public synchronized void completeFinalize(String sessionId) {
        mutate(sessionId, state -> rethrow(() -> workflow.completeFinalization(workflow.completeValidation(state))));
    }

    @Override
    public synchronized Future<ReportState> init(String sessionId, boolean confirm, SectionPlan plan) {
        commandCount.incrementAndGet();
        return command(() -> {
            SectionPlan effective = plan != null ? plan : DEFAULT_PLAN;
            if (!confirm) {
                return workflow.preview(sessionId, effective);
            }
            ReportState created = workflow.initialize(sessionId, effective, reports.get(sessionId));
            reports.put(sessionId, created);
            return created;
        });
    }

    @Override
    public synchronized Future<Optional<ReportState>> getState(String sessionId) {
        fetchCount.incrementAndGet();
        if (failingFetches.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            return Future.failedFuture(new ReportClientException(ErrorCode.TRANSPORT_FAILURE,
                    ErrorCode.TRANSPORT_FAILURE.formatMessage("connection refused"), null));
        }
        return Future.succeededFuture(Optional.ofNullable(reports.get(sessionId)));
    }

    @Override
    public synchronized Future<Section> generateSection(String sessionId, String sectionId) {
        return sectionCommand(sessionId, sectionId, state -> workflow.generate(state, sectionId));
    }

    @Override
    public synchronized Future<Section> submitReview(String sessionId, String sectionId, boolean accepted,
                                                     String feedback) {
        return sectionCommand(sessionId, sectionId, state -> workflow.submitReview(state, sectionId, accepted, feedback));
    }

    @Override
    public synchronized Future<Section> resetSection(String sessionId, String sectionId, boolean force) {
        return sectionCommand(sessionId, sectionId, state -> workflow.reset(state, sectionId, force));
    }

    @Override
    public synchronized Future<ReportState> finalizeReport(String sessionId) {
        commandCount.incrementAndGet();
        return command(() -> {
            ReportState finalizing = workflow.beginFinalize(require(sessionId));
            reports.put(sessionId, finalizing);
            return finalizing;
        });
    }

    @Override
    public synchronized Future<ExportArtifact> export(String sessionId, ExportFormat format) {
        commandCount.incrementAndGet();
        return command(() -> {
            ReportState state = require(sessionId);
            workflow.checkExport(state, format, Set.of(ExportFormat.MARKDOWN));
            return new ExportArtifact(sessionId, format, null, "# Report\n".getBytes(StandardCharsets.UTF_8));
        });
    }

    @Override
    public Future<Void> close() {
        return Future.succeededFuture();
    }

    private Future<Section> sectionCommand(String sessionId, String sectionId, WorkflowStep step) {
        commandCount.incrementAndGet();
        return command(() -> {
            ReportState updated = step.apply(require(sessionId));
            reports.put(sessionId, updated);
            return updated.findSection(sectionId).orElseThrow();
        });
    }

    private <T> Future<T> command(Command<T> command) {
        Promise<Void> gate = commandGate;
        if (gate != null) {
            return gate.future().compose(v -> run(command));
        }
        return run(command);
    }

    private synchronized <T> Future<T> run(Command<T> command) {
        ReportClientException failure = nextCommandFailure;
        if (failure != null) {
            nextCommandFailure = null;
            return Future.failedFuture(failure);
        }
        try {
            return Future.succeededFuture(command.run());
        } catch (ReportWorkflowException e) {
            return Future.failedFuture(new ReportClientException(e.getErrorCode(), e.getMessage(),
                    e.getErrorCode().httpStatus(), "req-test"));
        }
    }

    private ReportState require(String sessionId) throws ReportWorkflowException {
        ReportState state = reports.get(sessionId);
        if (state == null) {
            throw ReportWorkflowException.of(ErrorCode.REPORT_NOT_FOUND, sessionId);
        }
        return state;
    }

    private void mutate(String sessionId, UnaryOperator<ReportState> change) {
        reports.put(sessionId, change.apply(reports.get(sessionId)));
    }

    private static ReportState rethrow(Command<ReportState> command) {
        try {
            return command.run();
        } catch (ReportWorkflowException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface Command<T> {
        T run() throws ReportWorkflowException;
    }

    @FunctionalInterface
    private interface WorkflowStep {
        ReportState apply(ReportState state) throws ReportWorkflowException;
    }
}
