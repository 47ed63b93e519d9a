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

package dev.mars.folio.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of a report as held by the backend: the ordered sections plus the report-level status.
 * <p>
 * Immutable. The backend is the only writer of the authoritative copy; clients treat every
 * instance they hold as potentially stale and replace it wholesale on the next fetch.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ReportState implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sessionId;
    private final boolean userConfirmedStart;
    private final ReportStatus reportStatus;
    private final List<Section> sections;
    private final String sectionOrderHash;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final String failureReason;
    private final ReportMetrics metrics;

    @JsonCreator
    public ReportState(
            @JsonProperty("session_id") String sessionId,
            @JsonProperty("user_confirmed_start") boolean userConfirmedStart,
            @JsonProperty("report_status") ReportStatus reportStatus,
            @JsonProperty("sections") List<Section> sections,
            @JsonProperty("section_order_hash") String sectionOrderHash,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("updated_at") Instant updatedAt,
            @JsonProperty("failure_reason") String failureReason,
            @JsonProperty("metrics") ReportMetrics metrics) {
        this.sessionId = Objects.requireNonNull(sessionId, "Session ID cannot be null");
        this.userConfirmedStart = userConfirmedStart;
        this.reportStatus = reportStatus != null ? reportStatus : ReportStatus.UNINITIALIZED;
        this.sections = sections != null ? List.copyOf(sections) : List.of();
        this.sectionOrderHash = sectionOrderHash;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.failureReason = failureReason;
        this.metrics = metrics != null ? metrics : ReportMetrics.EMPTY;
    }

    private ReportState(Builder builder) {
        this(builder.sessionId, builder.userConfirmedStart, builder.reportStatus, builder.sections,
                builder.sectionOrderHash, builder.createdAt, builder.updatedAt, builder.failureReason,
                builder.metrics);
    }

    /**
     * Looks up a section by id.
     */
    public Optional<Section> findSection(String sectionId) {
        return sections.stream().filter(s -> s.getSectionId().equals(sectionId)).findFirst();
    }

    /**
     * Check if any section has an outstanding generation attempt.
     */
    public boolean hasGeneratingSection() {
        return sections.stream().anyMatch(s -> s.getStatus().isGenerating());
    }

    /**
     * Returns a copy with {@code replacement} in place of the section with the same id.
     *
     * @throws IllegalArgumentException if no section has that id
     */
    public ReportState withSection(Section replacement) {
        List<Section> updated = new ArrayList<>(sections.size());
        boolean found = false;
        for (Section section : sections) {
            if (section.getSectionId().equals(replacement.getSectionId())) {
                updated.add(replacement);
                found = true;
            } else {
                updated.add(section);
            }
        }
        if (!found) {
            throw new IllegalArgumentException("Section '" + replacement.getSectionId() + "' not in report " + sessionId);
        }
        return toBuilder().sections(updated).build();
    }

    @JsonIgnore
    public List<String> getSectionIds() {
        return sections.stream().map(Section::getSectionId).toList();
    }

    @JsonProperty("session_id")
    public String getSessionId() {
        return sessionId;
    }

    @JsonProperty("user_confirmed_start")
    public boolean isUserConfirmedStart() {
        return userConfirmedStart;
    }

    @JsonProperty("report_status")
    public ReportStatus getReportStatus() {
        return reportStatus;
    }

    @JsonProperty("sections")
    public List<Section> getSections() {
        return sections;
    }

    @JsonProperty("section_order_hash")
    public String getSectionOrderHash() {
        return sectionOrderHash;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("updated_at")
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @JsonProperty("failure_reason")
    public String getFailureReason() {
        return failureReason;
    }

    @JsonProperty("metrics")
    public ReportMetrics getMetrics() {
        return metrics;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.sessionId = sessionId;
        builder.userConfirmedStart = userConfirmedStart;
        builder.reportStatus = reportStatus;
        builder.sections = sections;
        builder.sectionOrderHash = sectionOrderHash;
        builder.createdAt = createdAt;
        builder.updatedAt = updatedAt;
        builder.failureReason = failureReason;
        builder.metrics = metrics;
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReportState that = (ReportState) o;
        return userConfirmedStart == that.userConfirmedStart &&
               sessionId.equals(that.sessionId) &&
               reportStatus == that.reportStatus &&
               sections.equals(that.sections) &&
               Objects.equals(sectionOrderHash, that.sectionOrderHash) &&
               Objects.equals(createdAt, that.createdAt) &&
               Objects.equals(updatedAt, that.updatedAt) &&
               Objects.equals(failureReason, that.failureReason) &&
               metrics.equals(that.metrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, userConfirmedStart, reportStatus, sections, sectionOrderHash,
                createdAt, updatedAt, failureReason, metrics);
    }

    @Override
    public String toString() {
        return "ReportState{" +
               "sessionId='" + sessionId + '\'' +
               ", confirmed=" + userConfirmedStart +
               ", status=" + reportStatus +
               ", sections=" + sections.size() +
               ", updatedAt=" + updatedAt +
               '}';
    }

    /**
     * Builder for {@link ReportState}. Only {@code sessionId} is required.
     */
    public static class Builder {
        private String sessionId;
        private boolean userConfirmedStart;
        private ReportStatus reportStatus = ReportStatus.UNINITIALIZED;
        private List<Section> sections = List.of();
        private String sectionOrderHash;
        private Instant createdAt;
        private Instant updatedAt;
        private String failureReason;
        private ReportMetrics metrics = ReportMetrics.EMPTY;

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder userConfirmedStart(boolean userConfirmedStart) {
            this.userConfirmedStart = userConfirmedStart;
            return this;
        }

        public Builder reportStatus(ReportStatus reportStatus) {
            this.reportStatus = reportStatus;
            return this;
        }

        public Builder sections(List<Section> sections) {
            this.sections = sections;
            return this;
        }

        public Builder sectionOrderHash(String sectionOrderHash) {
            this.sectionOrderHash = sectionOrderHash;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder failureReason(String failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        public Builder metrics(ReportMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public ReportState build() {
            return new ReportState(this);
        }
    }
}
