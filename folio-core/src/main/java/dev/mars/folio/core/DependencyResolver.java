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

package dev.mars.folio.core;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes whether sections are locked behind unaccepted dependencies.
 * <p>
 * A section is locked iff any id in its {@code depends_on} maps to a section that is not
 * {@link SectionStatus#ACCEPTED}. An id that names no section in the snapshot counts as not accepted.
 * Results are computed from the snapshot passed in and never cached, so a reset of an upstream
 * section re-locks its dependents on the next evaluation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class DependencyResolver {

    private DependencyResolver() {
    }

    /**
     * Check if {@code section} is blocked by a dependency in {@code allSections}.
     */
    public static boolean isLocked(Section section, Collection<Section> allSections) {
        return !unresolvedDependencies(section, allSections).isEmpty();
    }

    /**
     * Lists the dependencies of {@code section} that are not accepted, in declaration order.
     *
     * @param section     the section to check
     * @param allSections every section of the same report snapshot
     * @return blocking section ids, empty when the section is unlocked
     */
    public static List<String> unresolvedDependencies(Section section, Collection<Section> allSections) {
        if (section.getDependsOn().isEmpty()) {
            return List.of();
        }
        Map<String, SectionStatus> statusById = allSections.stream()
                .collect(Collectors.toMap(Section::getSectionId, Section::getStatus, (a, b) -> a));
        return section.getDependsOn().stream()
                .filter(id -> statusById.get(id) != SectionStatus.ACCEPTED)
                .distinct()
                .toList();
    }

    /**
     * Returns the ids of all locked sections in report order.
     */
    public static Set<String> lockedSectionIds(Collection<Section> allSections) {
        return allSections.stream()
                .filter(s -> isLocked(s, allSections))
                .map(Section::getSectionId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
