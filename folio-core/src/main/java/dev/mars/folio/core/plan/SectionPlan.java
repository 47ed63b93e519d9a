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

import dev.mars.folio.core.Section;
import dev.mars.folio.core.exceptions.PlanValidationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Ordered list of section definitions that a report is initialized from.
 * <p>
 * The list order is the authoring order of the report and is fixed at initialization;
 * {@link #orderHash(List)} fingerprints it so the backend can detect reordering later.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class SectionPlan {

    private final List<SectionDefinition> definitions;

    public SectionPlan(List<SectionDefinition> definitions) {
        this.definitions = definitions != null ? List.copyOf(definitions) : List.of();
    }

    public List<SectionDefinition> getDefinitions() {
        return definitions;
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    /**
     * Checks the plan is non-empty, every id is present and unique, and the dependency graph is sound.
     */
    public PlanValidationResult validate() {
        if (definitions.isEmpty()) {
            PlanValidationResult result = new PlanValidationResult();
            result.addError("sections", "Plan must contain at least one section");
            return result;
        }
        for (int i = 0; i < definitions.size(); i++) {
            SectionDefinition definition = definitions.get(i);
            if (definition.getSectionId() == null || definition.getSectionId().isBlank()) {
                PlanValidationResult result = new PlanValidationResult();
                result.addError("sections[" + i + "].section_id", "Section id is required");
                return result;
            }
            if (definition.getMaxRevisions() != null && definition.getMaxRevisions() < 0) {
                PlanValidationResult result = new PlanValidationResult();
                result.addError("sections." + definition.getSectionId() + ".max_revisions",
                        "Max revisions cannot be negative");
                return result;
            }
        }
        return SectionDependencyGraph.of(definitions).validate();
    }

    /**
     * Validates the plan and creates its planned sections in authoring order.
     *
     * @param defaultMaxRevisions ceiling for definitions that do not carry one
     * @throws PlanValidationException if {@link #validate()} reports any problem
     */
    public List<Section> toSections(int defaultMaxRevisions) throws PlanValidationException {
        PlanValidationResult result = validate();
        if (!result.isValid()) {
            throw new PlanValidationException(result.getMessages());
        }
        return definitions.stream().map(d -> d.toSection(defaultMaxRevisions)).toList();
    }

    /**
     * Fingerprints an ordered list of section ids.
     *
     * @return {@code sha256:} followed by the hex digest of the ids joined by newlines
     */
    public static String orderHash(List<String> sectionIds) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(String.join("\n", sectionIds).getBytes(StandardCharsets.UTF_8));
            return "sha256:" + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return "SectionPlan{sections=" + definitions.size() + '}';
    }
}
