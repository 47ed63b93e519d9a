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

package dev.mars.folio.server.store;

import dev.mars.folio.core.ReportState;

import java.util.Collection;
import java.util.Optional;

/**
 * Authoritative storage of report aggregates, keyed by research session id.
 *
 * <p>Implementations only store and return whole snapshots. Serialising concurrent mutations of
 * one report is the caller's job.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public interface ReportRepository {

    Optional<ReportState> find(String sessionId);

    /**
     * Stores the snapshot, replacing any previous one for the same session.
     */
    void save(ReportState report);

    Collection<String> sessionIds();
}
