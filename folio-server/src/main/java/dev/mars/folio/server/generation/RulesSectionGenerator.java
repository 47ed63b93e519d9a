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
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Deterministic generator used when no external engine is configured.
 *
 * <p>Renders a markdown skeleton from the section's title and description, a provenance table of the
 * accepted dependencies it builds on, and the reviewer feedback it answers. The same request always
 * yields the same content. Completion is delayed by a timer so callers observe {@code generating}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class RulesSectionGenerator implements SectionGenerator {

    public static final String MODEL_NAME = "rules_engine";

    private static final Logger logger = LoggerFactory.getLogger(RulesSectionGenerator.class);
    private static final int EXCERPT_LENGTH = 80;

    private final Vertx vertx;
    private final long delayMs;

    public RulesSectionGenerator(Vertx vertx, long delayMs) {
        if (delayMs < 1) {
            throw new IllegalArgumentException("Delay must be at least 1ms, got: " + delayMs);
        }
        this.vertx = vertx;
        this.delayMs = delayMs;
    }

    @Override
    public Future<GeneratedContent> generate(GenerationRequest request) {
        Promise<GeneratedContent> promise = Promise.promise();
        vertx.setTimer(delayMs, id -> {
            try {
                promise.complete(new GeneratedContent(render(request), MODEL_NAME));
            } catch (RuntimeException e) {
                logger.warn("Rules engine failed for section {}: {}", request.getSectionId(), e.getMessage());
                promise.fail(e);
            }
        });
        return promise.future();
    }

    @Override
    public String name() {
        return MODEL_NAME;
    }

    /**
     * Renders the section body. Visible for tests.
     */
    String render(GenerationRequest request) {
        StringBuilder md = new StringBuilder();
        String title = request.getTitle() != null ? request.getTitle() : request.getSectionId();
        md.append("## ").append(escape(title)).append("\n\n");
        if (request.getDescription() != null && !request.getDescription().isBlank()) {
            md.append(escape(request.getDescription().trim())).append("\n\n");
        }

        Map<String, String> dependencies = request.getDependencyContents();
        if (!dependencies.isEmpty()) {
            md.append("### Builds On\n\n");
            md.append("| Section | Excerpt |\n");
            md.append("|---|---|\n");
            dependencies.forEach((sectionId, content) ->
                    md.append("| ").append(escape(sectionId)).append(" | ")
                            .append(excerpt(content)).append(" |\n"));
            md.append('\n');
        }

        if (request.getFeedback() != null && !request.getFeedback().isBlank()) {
            md.append("### Revision ").append(request.getRevision()).append("\n\n");
            md.append("> ").append(escape(request.getFeedback().trim()).replace("\n", "\n> ")).append("\n\n");
        }

        md.append("_Draft ").append(request.getRevision() + 1).append(" for session ")
                .append(escape(request.getSessionId())).append("._\n");
        return md.toString();
    }

    private static String excerpt(String content) {
        String flattened = content.replaceAll("(?m)^#+[ \\t]*", "")
                .replaceAll("\\s+", " ")
                .replace("|", "\\|")
                .trim();
        if (flattened.length() > EXCERPT_LENGTH) {
            flattened = flattened.substring(0, EXCERPT_LENGTH).trim() + "...";
        }
        return escape(flattened);
    }

    private static String escape(String text) {
        return text.replace("<", "&lt;").replace(">", "&gt;");
    }
}
