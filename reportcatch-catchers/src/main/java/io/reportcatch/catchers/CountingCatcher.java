/*
 * Copyright 2015-2025 Endre Stølsvik
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

package io.reportcatch.catchers;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.reportcatch.CatchContext;
import io.reportcatch.CatchDecision;
import io.reportcatch.ReportCatcher;
import io.reportcatch.Severity;

/**
 * Observes every report passing it without modifying it, counting per severity and per id. The counts reflect the
 * report as it was when it reached this catcher, so place it according to what you want to observe. Logs each seen
 * report at debug level - through SLF4J, not as a report, so no re-entrance.
 */
public class CountingCatcher implements ReportCatcher {
    private static final Logger log = LoggerFactory.getLogger(CountingCatcher.class);

    private final Map<Severity, AtomicLong> _severityCounts = new EnumMap<>(Severity.class);
    private final ConcurrentHashMap<String, AtomicLong> _idCounts = new ConcurrentHashMap<>();

    public CountingCatcher() {
        for (Severity severity : Severity.values()) {
            _severityCounts.put(severity, new AtomicLong());
        }
    }

    @Override
    public CatchDecision catchReport(CatchContext context) {
        _severityCounts.get(context.getSeverity()).incrementAndGet();
        _idCounts.computeIfAbsent(context.getId(), k -> new AtomicLong()).incrementAndGet();
        if (log.isDebugEnabled()) {
            log.debug("Catcher [" + context.getCatcherName() + "] saw report [" + context.getSeverity() + ":"
                    + context.getId() + "].");
        }
        return CatchDecision.THROW;
    }

    public long getCount(Severity severity) {
        return _severityCounts.get(severity).get();
    }

    public long getCount(String id) {
        AtomicLong count = _idCounts.get(id);
        return count == null ? 0 : count.get();
    }

    public long getTotalCount() {
        return _severityCounts.values().stream().mapToLong(AtomicLong::get).sum();
    }
}
