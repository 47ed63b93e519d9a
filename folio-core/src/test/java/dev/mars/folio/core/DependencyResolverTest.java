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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyResolverTest {

    @Test
    void sectionWithoutDependenciesIsNeverLocked() {
        Section intro = section("intro", SectionStatus.PLANNED);
        assertFalse(DependencyResolver.isLocked(intro, List.of(intro)));
    }

    @Test
    void sectionIsLockedUntilEveryDependencyIsAccepted() {
        Section a = section("a", SectionStatus.ACCEPTED);
        Section b = section("b", SectionStatus.REVIEW);
        Section c = section("c", SectionStatus.PLANNED, "a", "b");

        assertTrue(DependencyResolver.isLocked(c, List.of(a, b, c)));
        assertEquals(List.of("b"), DependencyResolver.unresolvedDependencies(c, List.of(a, b, c)));

        Section bAccepted = b.toBuilder().status(SectionStatus.ACCEPTED).build();
        assertFalse(DependencyResolver.isLocked(c, List.of(a, bAccepted, c)));
    }

    @Test
    void missingDependencyCountsAsNotAccepted() {
        Section c = section("c", SectionStatus.PLANNED, "ghost");
        assertTrue(DependencyResolver.isLocked(c, List.of(c)));
        assertEquals(List.of("ghost"), DependencyResolver.unresolvedDependencies(c, List.of(c)));
    }

    @Test
    void unresolvedDependenciesKeepDeclarationOrder() {
        Section x = section("x", SectionStatus.PLANNED);
        Section y = section("y", SectionStatus.ERROR);
        Section z = section("z", SectionStatus.PLANNED, "y", "x");

        assertEquals(List.of("y", "x"), DependencyResolver.unresolvedDependencies(z, List.of(x, y, z)));
    }

    @Test
    void lockedSectionIdsRecomputeAfterUpstreamReset() {
        Section a = section("a", SectionStatus.ACCEPTED);
        Section b = section("b", SectionStatus.PLANNED, "a");
        Section c = section("c", SectionStatus.PLANNED, "b");

        assertEquals(Set.of("c"), DependencyResolver.lockedSectionIds(List.of(a, b, c)));

        Section aReset = a.resetToPlanned();
        assertEquals(Set.of("b", "c"), DependencyResolver.lockedSectionIds(List.of(aReset, b, c)));
    }

    @Test
    void repeatedDependencyIsReportedOnceAndLockedIdsKeepReportOrder() {
        Section a = section("a", SectionStatus.REVIEW);
        Section d = section("d", SectionStatus.PLANNED, "a", "a");
        Section b = section("b", SectionStatus.PLANNED, "a");

        assertEquals(List.of("a"), DependencyResolver.unresolvedDependencies(d, List.of(a, d, b)));
        assertEquals(List.of("d", "b"), List.copyOf(DependencyResolver.lockedSectionIds(List.of(a, d, b))));
    }

    private static Section section(String id, SectionStatus status, String... dependsOn) {
        return Section.builder().sectionId(id).status(status).dependsOn(List.of(dependsOn)).build();
    }
}
