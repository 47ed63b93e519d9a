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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One independently generated and reviewed unit of a report.
 * <p>
 * Instances are immutable. State changes produce new instances through {@link #toBuilder()}, which keeps
 * every report snapshot safe to share between the polling loop and command callbacks.
 *
 * <h3>Revision accounting</h3>
 * <p>{@code revision} counts reviewer rejections that triggered a regeneration. The first draft and
 * retries after an {@link SectionStatus#ERROR} do not consume a revision. {@code revision} never
 * exceeds {@code max_revisions}; at the ceiling only a reset allows further generation.</p>
 *
 * <h3>Example</h3>
 * <pre>
 *   Section methods = Section.builder()
 *       .sectionId("methods")
 *       .title("Methods")
 *       .dependsOn(List.of("introduction"))
 *       .maxRevisions(3)
 *       .build();
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Section implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Ceiling applied when a plan does not specify one. */
    public static final int DEFAULT_MAX_REVISIONS = 3;

    private final String sectionId;
    private final String title;
    private final String description;
    private final SectionStatus status;
    private final String content;
    private final int revision;
    private final int maxRevisions;
    private final List<String> dependsOn;
    private final List<SectionHistoryEntry> history;
    private final String lastFeedback;

    @JsonCreator
    public Section(
            @JsonProperty("section_id") String sectionId,
            @JsonProperty("title") String title,
            @JsonProperty("description") String description,
            @JsonProperty("status") SectionStatus status,
            @JsonProperty("content") String content,
            @JsonProperty("revision") int revision,
            @JsonProperty("max_revisions") int maxRevisions,
            @JsonProperty("depends_on") List<String> dependsOn,
            @JsonProperty("history") List<SectionHistoryEntry> history,
            @JsonProperty("last_feedback") String lastFeedback) {
        this.sectionId = Objects.requireNonNull(sectionId, "Section ID cannot be null");
        this.title = title != null ? title : sectionId;
        this.description = description;
        this.status = status != null ? status : SectionStatus.PLANNED;
        this.content = content;
        this.revision = revision;
        this.maxRevisions = maxRevisions;
        this.dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        this.history = history != null ? List.copyOf(history) : List.of();
        this.lastFeedback = lastFeedback;
    }

    private Section(Builder builder) {
        this(builder.sectionId, builder.title, builder.description, builder.status, builder.content,
                builder.revision, builder.maxRevisions, builder.dependsOn, builder.history, builder.lastFeedback);
    }

    /**
     * Check if the reviewer may still reject this section and have it regenerated.
     *
     * @return {@code true} while {@code revision < max_revisions}
     */
    public boolean hasRevisionsRemaining() {
        return revision < maxRevisions;
    }

    /**
     * Returns how many rejections with regeneration remain.
     */
    @JsonIgnore
    public int getRevisionsRemaining() {
        return Math.max(0, maxRevisions - revision);
    }

    /**
     * Returns this section in its freshly planned form: no content, no history, revision 0.
     */
    public Section resetToPlanned() {
        return toBuilder()
                .status(SectionStatus.PLANNED)
                .content(null)
                .revision(0)
                .history(List.of())
                .lastFeedback(null)
                .build();
    }

    @JsonProperty("section_id")
    public String getSectionId() {
        return sectionId;
    }

    @JsonProperty("title")
    public String getTitle() {
        return title;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("status")
    public SectionStatus getStatus() {
        return status;
    }

    @JsonProperty("content")
    public String getContent() {
        return content;
    }

    @JsonProperty("revision")
    public int getRevision() {
        return revision;
    }

    @JsonProperty("max_revisions")
    public int getMaxRevisions() {
        return maxRevisions;
    }

    @JsonProperty("depends_on")
    public List<String> getDependsOn() {
        return dependsOn;
    }

    @JsonProperty("history")
    public List<SectionHistoryEntry> getHistory() {
        return history;
    }

    @JsonProperty("last_feedback")
    public String getLastFeedback() {
        return lastFeedback;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.sectionId = sectionId;
        builder.title = title;
        builder.description = description;
        builder.status = status;
        builder.content = content;
        builder.revision = revision;
        builder.maxRevisions = maxRevisions;
        builder.dependsOn = dependsOn;
        builder.history = history;
        builder.lastFeedback = lastFeedback;
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Section section = (Section) o;
        return revision == section.revision &&
               maxRevisions == section.maxRevisions &&
               sectionId.equals(section.sectionId) &&
               Objects.equals(title, section.title) &&
               Objects.equals(description, section.description) &&
               status == section.status &&
               Objects.equals(content, section.content) &&
               dependsOn.equals(section.dependsOn) &&
               history.equals(section.history) &&
               Objects.equals(lastFeedback, section.lastFeedback);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sectionId, title, description, status, content, revision, maxRevisions,
                dependsOn, history, lastFeedback);
    }

    @Override
    public String toString() {
        return "Section{" +
               "id='" + sectionId + '\'' +
               ", status=" + status +
               ", revision=" + revision + "/" + maxRevisions +
               ", dependsOn=" + dependsOn +
               ", history=" + history.size() +
               '}';
    }

    /**
     * Builder for {@link Section}. Only {@code sectionId} is required.
     */
    public static class Builder {
        private String sectionId;
        private String title;
        private String description;
        private SectionStatus status = SectionStatus.PLANNED;
        private String content;
        private int revision;
        private int maxRevisions = DEFAULT_MAX_REVISIONS;
        private List<String> dependsOn = List.of();
        private List<SectionHistoryEntry> history = List.of();
        private String lastFeedback;

        public Builder sectionId(String sectionId) {
            this.sectionId = sectionId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(SectionStatus status) {
            this.status = status;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder revision(int revision) {
            this.revision = revision;
            return this;
        }

        public Builder maxRevisions(int maxRevisions) {
            this.maxRevisions = maxRevisions;
            return this;
        }

        public Builder dependsOn(List<String> dependsOn) {
            this.dependsOn = dependsOn;
            return this;
        }

        public Builder history(List<SectionHistoryEntry> history) {
            this.history = history;
            return this;
        }

        /**
         * Appends an entry to the history.
         */
        public Builder addHistory(SectionHistoryEntry entry) {
            List<SectionHistoryEntry> updated = new ArrayList<>(history != null ? history : List.of());
            updated.add(entry);
            this.history = updated;
            return this;
        }

        public Builder lastFeedback(String lastFeedback) {
            this.lastFeedback = lastFeedback;
            return this;
        }

        public Section build() {
            if (revision < 0 || maxRevisions < 0) {
                throw new IllegalArgumentException("Revision counters cannot be negative");
            }
            if (revision > maxRevisions) {
                throw new IllegalArgumentException(String.format(
                        "Revision %d exceeds max revisions %d for section '%s'", revision, maxRevisions, sectionId));
            }
            return new Section(this);
        }
    }
}
