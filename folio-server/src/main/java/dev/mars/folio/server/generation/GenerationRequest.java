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

package dev.mars.folio.server.generation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.folio.core.ReportState;
import dev.mars.folio.core.Section;
import dev.mars.folio.core.SectionStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a generation engine gets to produce one attempt of a section.
 *
 * <p>{@code dependencyContents} maps each accepted dependency id to its content, in declaration
 * order. {@code feedback} is the reviewer's steering input on a regeneration and {@code null}
 * on a first draft or a retry after an error.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GenerationRequest {

    private final String sessionId;
    private final String sectionId;
    private final String title;
    private final String description;
    private final int revision;
    private final String feedback;
    private final Map<String, String> dependencyContents;

    @JsonCreator
    public GenerationRequest(
            @JsonProperty("session_id") String sessionId,
            @JsonProperty("section_id") String sectionId,
            @JsonProperty("title") String title,
            @JsonProperty("description") String description,
            @JsonProperty("revision") int revision,
            @JsonProperty("feedback") String feedback,
            @JsonProperty("dependency_contents") Map<String, String> dependencyContents) {
        this.sessionId = Objects.requireNonNull(sessionId, "Session ID cannot be null");
        this.sectionId = Objects.requireNonNull(sectionId, "Section ID cannot be null");
        this.title = title;
        this.description = description;
        this.revision = revision;
        this.feedback = feedback;
        this.dependencyContents = dependencyContents != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(dependencyContents))
                : Map.of();
    }

    /**
     * Builds the request for a section that has just entered {@code generating}.
     */
    public static GenerationRequest forSection(ReportState report, Section section) {
        Map<String, String> dependencies = new LinkedHashMap<>();
        for (String dependencyId : section.getDependsOn()) {
            report.findSection(dependencyId)
                    .filter(dependency -> dependency.getStatus() == SectionStatus.ACCEPTED)
                    .filter(dependency -> dependency.getContent() != null)
                    .ifPresent(dependency -> dependencies.put(dependencyId, dependency.getContent()));
        }
        String feedback = section.getRevision() > 0 ? section.getLastFeedback() : null;
        return new GenerationRequest(report.getSessionId(), section.getSectionId(), section.getTitle(),
                section.getDescription(), section.getRevision(), feedback, dependencies);
    }

    @JsonProperty("session_id")
    public String getSessionId() {
        return sessionId;
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

    @JsonProperty("revision")
    public int getRevision() {
        return revision;
    }

    @JsonProperty("feedback")
    public String getFeedback() {
        return feedback;
    }

    @JsonProperty("dependency_contents")
    public Map<String, String> getDependencyContents() {
        return dependencyContents;
    }

    @Override
    public String toString() {
        return "GenerationRequest{" +
                "sessionId='" + sessionId + '\'' +
                ", sectionId='" + sectionId + '\'' +
                ", revision=" + revision +
                ", dependencies=" + dependencyContents.keySet() +
                ", feedback=" + (feedback != null) +
                '}';
    }
}
