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

package dev.mars.folio.core.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.folio.core.plan.SectionDefinition;

import java.util.List;

/**
 * Body of {@code POST /api/v1/reports/{sessionId}/init}.
 * {@code confirm=false} asks for a dry run; {@code sections} is optional.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class InitReportRequest {

    private final boolean confirm;
    private final List<SectionDefinition> sections;

    @JsonCreator
    public InitReportRequest(
            @JsonProperty("confirm") boolean confirm,
            @JsonProperty("sections") List<SectionDefinition> sections) {
        this.confirm = confirm;
        this.sections = sections != null ? List.copyOf(sections) : null;
    }

    @JsonProperty("confirm")
    public boolean isConfirm() {
        return confirm;
    }

    /**
     * Returns the requested plan, or {@code null} to use the backend's default outline.
     */
    @JsonProperty("sections")
    public List<SectionDefinition> getSections() {
        return sections;
    }
}
