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

import io.vertx.core.Future;

/**
 * External engine that writes section content.
 *
 * <p>Implementations must not block the calling event loop. A failed future marks the attempt
 * as a generation error; the workflow never retries on its own.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public interface SectionGenerator {

    Future<GeneratedContent> generate(GenerationRequest request);

    /**
     * Short name for logs and metrics.
     */
    String name();

    default Future<Void> close() {
        return Future.succeededFuture();
    }
}
