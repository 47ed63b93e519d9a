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
import java.util.List;
import java.util.Objects;

/**
 * Outcome of validating a section plan. Each issue names the offending field path.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class PlanValidationResult {

    private final List<Issue> errors = new ArrayList<>();

    public void addError(String message) {
        errors.add(new Issue(null, message));
    }

    public void addError(String fieldPath, String message) {
        errors.add(new Issue(fieldPath, message));
    }

    public List<Issue> getErrors() {
        return List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    /**
     * Returns each issue rendered as a single line.
     */
    public List<String> getMessages() {
        return errors.stream().map(Issue::toString).toList();
    }

    @Override
    public String toString() {
        return "PlanValidationResult{valid=" + isValid() + ", errors=" + errors.size() + "}";
    }

    /**
     * A single validation problem.
     */
    public static final class Issue {

        private final String fieldPath;
        private final String message;

        public Issue(String fieldPath, String message) {
            this.fieldPath = fieldPath;
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        public String getFieldPath() {
            return fieldPath;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Issue issue = (Issue) o;
            return Objects.equals(fieldPath, issue.fieldPath) && message.equals(issue.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(fieldPath, message);
        }

        @Override
        public String toString() {
            return fieldPath != null ? "[" + fieldPath + "] " + message : message;
        }
    }
}
