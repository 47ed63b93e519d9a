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

package dev.mars.folio.client.view;

import dev.mars.folio.client.session.ReportSession;
import dev.mars.folio.core.DependencyResolver;
import dev.mars.folio.core.Section;
import dev.mars.folio.core.SectionStatus;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * What the user may do with one section in the current snapshot.
 * <p>
 * Recomputed from scratch for every snapshot; lock state is never cached.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class SectionAffordances {

    private final Section section;
    private final List<String> blockingDependencies;
    private final boolean commandsAllowed;
    private final boolean inFlight;

    private SectionAffordances(Section section, List<String> blockingDependencies, boolean commandsAllowed,
                               boolean inFlight) {
        this.section = section;
        this.blockingDependencies = List.copyOf(blockingDependencies);
        this.commandsAllowed = commandsAllowed;
        this.inFlight = inFlight;
    }

    static SectionAffordances derive(Section section, Collection<Section> allSections, boolean commandsAllowed,
                                     Set<String> inFlightKeys) {
        return new SectionAffordances(section,
                DependencyResolver.unresolvedDependencies(section, allSections),
                commandsAllowed,
                inFlightKeys.contains(ReportSession.sectionKey(section.getSectionId())));
    }

    public Section getSection() {
        return section;
    }

    public String getSectionId() {
        return section.getSectionId();
    }

    public SectionStatus getStatus() {
        return section.getStatus();
    }

    public boolean isLocked() {
        return !blockingDependencies.isEmpty();
    }

    /**
     * Dependencies that are not accepted yet, in declaration order.
     */
    public List<String> getBlockingDependencies() {
        return blockingDependencies;
    }

    public boolean isInFlight() {
        return inFlight;
    }

    public boolean canGenerate() {
        return actionable() && section.getStatus().canStartGeneration() && !isLocked();
    }

    public boolean canAccept() {
        return actionable() && section.getStatus() == SectionStatus.REVIEW;
    }

    /**
     * Check if the section can be rejected for regeneration. Feedback is still required.
     */
    public boolean canRegenerate() {
        return canAccept() && section.hasRevisionsRemaining();
    }

    public boolean canReset() {
        SectionStatus status = section.getStatus();
        return actionable() && status != SectionStatus.GENERATING && status != SectionStatus.PLANNED;
    }

    public boolean isForceRequiredToReset() {
        return section.getStatus() == SectionStatus.ACCEPTED;
    }

    public int getRevisionsRemaining() {
        return section.getRevisionsRemaining();
    }

    private boolean actionable() {
        return commandsAllowed && !inFlight;
    }

    @Override
    public String toString() {
        return "SectionAffordances{" +
               "sectionId='" + section.getSectionId() + '\'' +
               ", status=" + section.getStatus() +
               ", locked=" + isLocked() +
               ", inFlight=" + inFlight +
               '}';
    }
}
