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

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Checks generated content before it reaches review.
 *
 * <p>Content must be non-blank markdown without raw HTML tags. Comparisons such as {@code x < y}
 * pass; anything shaped like {@code <tag>} or {@code </tag>} does not.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class MarkdownContentValidator {

    private static final Pattern HTML_TAG = Pattern.compile("</?[a-zA-Z][^>]*>");

    /**
     * Returns the reason the content is rejected, or empty if it is acceptable.
     */
    public Optional<String> problem(String content) {
        if (content == null || content.isBlank()) {
            return Optional.of("generated content is empty");
        }
        if (HTML_TAG.matcher(content).find()) {
            return Optional.of("generated content contains HTML tags");
        }
        return Optional.empty();
    }

    public boolean isValid(String content) {
        return problem(content).isEmpty();
    }
}
