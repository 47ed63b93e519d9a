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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Counters kept on a report: completed generation attempts and total rejections across all sections.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class ReportMetrics implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final ReportMetrics EMPTY = new ReportMetrics(0, 0);

    private final int generationCount;
    private final int totalRevisions;

    @JsonCreator
    public ReportMetrics(
            @JsonProperty("generation_count") int generationCount,
            @JsonProperty("total_revisions") int totalRevisions) {
        this.generationCount = generationCount;
        this.totalRevisions = totalRevisions;
    }

    public ReportMetrics withGeneration() {
        return new ReportMetrics(generationCount + 1, totalRevisions);
    }

    public ReportMetrics withRevision() {
        return new ReportMetrics(generationCount, totalRevisions + 1);
    }

    @JsonProperty("generation_count")
    public int getGenerationCount() {
        return generationCount;
    }

    @JsonProperty("total_revisions")
    public int getTotalRevisions() {
        return totalRevisions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReportMetrics that = (ReportMetrics) o;
        return generationCount == that.generationCount && totalRevisions == that.totalRevisions;
    }

    @Override
    public int hashCode() {
        return 31 * generationCount + totalRevisions;
    }

    @Override
    public String toString() {
        return "ReportMetrics{generations=" + generationCount + ", revisions=" + totalRevisions + '}';
    }
}
