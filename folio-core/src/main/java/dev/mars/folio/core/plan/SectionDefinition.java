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

package dev.mars.folio.core.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.folio.core.Section;

import java.util.List;
import java.util.Objects;

/**
 * Planned section as supplied in an init request or by a server-side outline.
 * {@code max_revisions} may be omitted, in which case the backend default applies.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SectionDefinition {

    private final String sectionId;
    private final String title;
    private final String description;
    private final List<String> dependsOn;
    private final Integer maxRevisions;

    @JsonCreator
    public SectionDefinition(
            @JsonProperty("section_id") String sectionId,
            @JsonProperty("title") String title,
            @JsonProperty("description") String description,
            @JsonProperty("depends_on") List<String> dependsOn,
            @JsonProperty("max_revisions") Integer maxRevisions) {
        this.sectionId = sectionId;
        this.title = title;
        this.description = description;
        this.dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        this.maxRevisions = maxRevisions;
    }

    public static SectionDefinition of(String sectionId, String title, String... dependsOn) {
        return new SectionDefinition(sectionId, title, null, List.of(dependsOn), null);
    }

    /**
     * Creates the planned section for this definition.
     *
     * @param defaultMaxRevisions ceiling used when the definition does not carry one
     */
    public Section toSection(int defaultMaxRevisions) {
        return Section.builder()
                .sectionId(sectionId)
                .title(title)
                .description(description)
                .dependsOn(dependsOn)
                .maxRevisions(maxRevisions != null ? maxRevisions : defaultMaxRevisions)
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

    @JsonProperty("depends_on")
    public List<String> getDependsOn() {
        return dependsOn;
    }

    @JsonProperty("max_revisions")
    public Integer getMaxRevisions() {
        return maxRevisions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SectionDefinition that = (SectionDefinition) o;
        return Objects.equals(sectionId, that.sectionId) &&
               Objects.equals(title, that.title) &&
               Objects.equals(description, that.description) &&
               dependsOn.equals(that.dependsOn) &&
               Objects.equals(maxRevisions, that.maxRevisions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sectionId, title, description, dependsOn, maxRevisions);
    }

    @Override
    public String toString() {
        return "SectionDefinition{id='" + sectionId + "', dependsOn=" + dependsOn + '}';
    }
}
