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

package dev.mars.folio.client.sync;

import dev.mars.folio.client.config.ReportClientOptions;
import dev.mars.folio.core.ReportState;

import java.util.Optional;

/**
 * Decides whether a session keeps polling and how long to wait before the next fetch.
 *
 * <p>Polling continues while the report is in progress, validating or finalizing, or while any section is
 * generating. It stops once the report is completed, failed, awaiting final review with nothing
 * generating, absent or unconfirmed, and while a visible sync error waits for a manual retry.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class PollingPolicy {

    private final long baseIntervalMs;
    private final long maxIntervalMs;
    private final double backoffMultiplier;

    public PollingPolicy(long baseIntervalMs, long maxIntervalMs, double backoffMultiplier) {
        if (baseIntervalMs <= 0) {
            throw new IllegalArgumentException("Base interval must be positive, got: " + baseIntervalMs);
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be >= 1.0, got: " + backoffMultiplier);
        }
        this.baseIntervalMs = baseIntervalMs;
        this.maxIntervalMs = Math.max(maxIntervalMs, baseIntervalMs);
        this.backoffMultiplier = backoffMultiplier;
    }

    public static PollingPolicy from(ReportClientOptions options) {
        return new PollingPolicy(options.getPollIntervalMs(), options.getPollMaxIntervalMs(),
                options.getBackoffMultiplier());
    }

    /**
     * Check if another fetch should be scheduled for this view.
     */
    public boolean shouldPoll(ReportView view) {
        if (view.getSyncError().isPresent()) {
            return false;
        }
        if (!view.isSynced()) {
            // Still trying to reach the backend for the first time
            return true;
        }
        Optional<ReportState> report = view.getReport();
        if (report.isEmpty() || !report.get().isUserConfirmedStart()) {
            return false;
        }
        ReportState state = report.get();
        if (state.hasGeneratingSection()) {
            return true;
        }
        return switch (state.getReportStatus()) {
            case IN_PROGRESS, VALIDATING, FINALIZING -> true;
            case UNINITIALIZED, AWAITING_FINAL_REVIEW, COMPLETED, FAILED -> false;
        };
    }

    /**
     * Returns the delay before the next fetch.
     *
     * @param consecutiveFailures failed fetches since the last success
     * @return the base interval multiplied once per failure, capped at the maximum interval
     */
    public long nextDelayMs(int consecutiveFailures) {
        double delay = baseIntervalMs * Math.pow(backoffMultiplier, Math.max(0, consecutiveFailures));
        return (long) Math.min(delay, (double) maxIntervalMs);
    }

    public long getBaseIntervalMs() {
        return baseIntervalMs;
    }

    public long getMaxIntervalMs() {
        return maxIntervalMs;
    }
}
