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

/**
 * Body of {@code POST .../sections/{sectionId}/review}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ReviewRequest {

    private final boolean accepted;
    private final String feedback;

    @JsonCreator
    public ReviewRequest(
            @JsonProperty("accepted") boolean accepted,
            @JsonProperty("feedback") String feedback) {
        this.accepted = accepted;
        this.feedback = feedback;
    }

    @JsonProperty("accepted")
    public boolean isAccepted() {
        return accepted;
    }

    @JsonProperty("feedback")
    public String getFeedback() {
        return feedback;
    }
}
