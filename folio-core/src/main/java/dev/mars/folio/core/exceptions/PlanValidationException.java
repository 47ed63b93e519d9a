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

package dev.mars.folio.core.exceptions;

import java.util.List;

/**
 * Thrown when a section plan cannot be turned into a report: it is empty, repeats an id,
 * references an unknown section, or contains a dependency cycle.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class PlanValidationException extends FolioException {

    private final List<String> problems;

    public PlanValidationException(List<String> problems) {
        super("Invalid section plan: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public PlanValidationException(String problem) {
        this(List.of(problem));
    }

    public List<String> getProblems() {
        return problems;
    }
}
