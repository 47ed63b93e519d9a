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
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One completed generation attempt: the produced markdown and the engine that produced it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class GeneratedContent {

    private final String content;
    private final String modelName;

    @JsonCreator
    public GeneratedContent(
            @JsonProperty("content") String content,
            @JsonProperty("model_name") String modelName) {
        this.content = content;
        this.modelName = modelName;
    }

    @JsonProperty("content")
    public String getContent() {
        return content;
    }

    @JsonProperty("model_name")
    public String getModelName() {
        return modelName;
    }

    @Override
    public String toString() {
        return "GeneratedContent{modelName='" + modelName + "', length="
                + (content != null ? content.length() : 0) + '}';
    }
}
