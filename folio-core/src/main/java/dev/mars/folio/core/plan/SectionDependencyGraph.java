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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structural checks over the {@code depends_on} edges of a plan.
 *
 * <p>Reports duplicate ids, dependencies on unknown sections, self dependencies and cycles. A cycle
 * is reported with the path that closes it, for example {@code a -> b -> a}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class SectionDependencyGraph {

    private enum Mark { VISITING, DONE }

    // Authoring order is kept so the first reported cycle is stable
    private final Map<String, List<String>> edges = new LinkedHashMap<>();
    private final Set<String> duplicateIds = new LinkedHashSet<>();

    private SectionDependencyGraph() {
    }

    public static SectionDependencyGraph of(List<SectionDefinition> definitions) {
        SectionDependencyGraph graph = new SectionDependencyGraph();
        for (SectionDefinition definition : definitions) {
            if (graph.edges.putIfAbsent(definition.getSectionId(), definition.getDependsOn()) != null) {
                graph.duplicateIds.add(definition.getSectionId());
            }
        }
        return graph;
    }

    public PlanValidationResult validate() {
        PlanValidationResult result = new PlanValidationResult();

        for (String duplicate : duplicateIds) {
            result.addError("sections." + duplicate, "Duplicate section id '" + duplicate + "'");
        }

        edges.forEach((sectionId, dependsOn) -> {
            for (String dependency : dependsOn) {
                if (dependency.equals(sectionId)) {
                    result.addError("sections." + sectionId + ".depends_on", "Section cannot depend on itself");
                } else if (!edges.containsKey(dependency)) {
                    result.addError("sections." + sectionId + ".depends_on",
                            "Dependency '" + dependency + "' not found");
                }
            }
        });

        findCycle().ifPresent(cycle ->
                result.addError("sections", "Circular dependency: " + String.join(" -> ", cycle)));
        return result;
    }

    /**
     * Returns the first cycle found, as the ids along it with the starting id repeated at the end.
     * Self dependencies are reported separately and skipped here.
     */
    Optional<List<String>> findCycle() {
        Map<String, Mark> marks = new HashMap<>();
        for (String sectionId : edges.keySet()) {
            List<String> path = new ArrayList<>();
            Optional<List<String>> cycle = visit(sectionId, marks, path);
            if (cycle.isPresent()) {
                return cycle;
            }
        }
        return Optional.empty();
    }

    private Optional<List<String>> visit(String sectionId, Map<String, Mark> marks, List<String> path) {
        Mark mark = marks.get(sectionId);
        if (mark == Mark.DONE) {
            return Optional.empty();
        }
        if (mark == Mark.VISITING) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(sectionId), path.size()));
            cycle.add(sectionId);
            return Optional.of(cycle);
        }

        marks.put(sectionId, Mark.VISITING);
        path.add(sectionId);
        for (String dependency : edges.getOrDefault(sectionId, List.of())) {
            if (dependency.equals(sectionId) || !edges.containsKey(dependency)) {
                continue;
            }
            Optional<List<String>> cycle = visit(dependency, marks, path);
            if (cycle.isPresent()) {
                return cycle;
            }
        }
        path.remove(path.size() - 1);
        marks.put(sectionId, Mark.DONE);
        return Optional.empty();
    }
}
