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

package dev.mars.folio.server;

import dev.mars.folio.server.generation.GeneratedContent;
import dev.mars.folio.server.generation.GenerationRequest;
import dev.mars.folio.server.generation.SectionGenerator;
import io.vertx.core.Future;
import io.vertx.core.Promise;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test generator whose attempts stay pending until the test completes or fails them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ControlledSectionGenerator implements SectionGenerator {

    public static final String MODEL_NAME = "test-model";

    private final List<GenerationRequest> requests = new CopyOnWriteArrayList<>();
    private final Map<String, Promise<GeneratedContent>> pending = new ConcurrentHashMap<>();

    @Override
    public Future<GeneratedContent> generate(GenerationRequest request) {
        requests.add(request);
        Promise<GeneratedContent> promise = Promise.promise();
        pending.put(request.getSectionId(), promise);
        return promise.future();
    }

    @Override
    public String name() {
        return MODEL_NAME;
    }

    public void complete(String sectionId, String content) {
        take(sectionId).complete(new GeneratedContent(content, MODEL_NAME));
    }

    public void fail(String sectionId, String reason) {
        take(sectionId).fail(new IllegalStateException(reason));
    }

    public boolean isPending(String sectionId) {
        return pending.containsKey(sectionId);
    }

    public List<GenerationRequest> getRequests() {
        return List.copyOf(requests);
    }

    public GenerationRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    private Promise<GeneratedContent> take(String sectionId) {
        Promise<GeneratedContent> promise = pending.remove(sectionId);
        if (promise == null) {
            throw new IllegalStateException("No pending generation for section " + sectionId);
        }
        return promise;
    }
}
