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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ReportRepository} held in memory. Reports are immutable snapshots so no copies are needed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class InMemoryReportRepository implements ReportRepository {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryReportRepository.class);

    private final Map<String, ReportState> reports = new ConcurrentHashMap<>();

    @Override
    public Optional<ReportState> find(String sessionId) {
        return Optional.ofNullable(reports.get(sessionId));
    }

    @Override
    public void save(ReportState report) {
        Objects.requireNonNull(report, "Report cannot be null");
        reports.put(report.getSessionId(), report);
        logger.trace("Stored report {} in state {}", report.getSessionId(), report.getReportStatus());
    }

    @Override
    public Collection<String> sessionIds() {
        return List.copyOf(reports.keySet());
    }
}
