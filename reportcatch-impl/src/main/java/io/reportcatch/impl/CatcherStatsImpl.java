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

package io.reportcatch.impl;

import java.util.EnumMap;
import java.util.concurrent.atomic.AtomicLong;

import io.reportcatch.CatcherStats;
import io.reportcatch.Severity;

/**
 * Default {@link CatcherStats}, six monotonically increasing counters which only go back to zero on
 * {@link #reset()}.
 */
public class CatcherStatsImpl implements CatcherStats {
    private final EnumMap<Severity, AtomicLong> _demoted = new EnumMap<>(Severity.class);
    private final EnumMap<Severity, AtomicLong> _caught = new EnumMap<>(Severity.class);

    public CatcherStatsImpl() {
        for (Severity severity : new Severity[] { Severity.FATAL, Severity.ERROR, Severity.WARNING }) {
            _demoted.put(severity, new AtomicLong());
            _caught.put(severity, new AtomicLong());
        }
    }

    @Override
    public long getDemoted(Severity originalSeverity) {
        AtomicLong counter = _demoted.get(originalSeverity);
        return counter == null ? 0 : counter.get();
    }

    @Override
    public long getCaught(Severity originalSeverity) {
        AtomicLong counter = _caught.get(originalSeverity);
        return counter == null ? 0 : counter.get();
    }

    @Override
    public void countDemoted(Severity originalSeverity) {
        AtomicLong counter = _demoted.get(originalSeverity);
        // ?: Do we have a bucket for this severity? (INFO has none)
        if (counter != null) {
            counter.incrementAndGet();
        }
    }

    @Override
    public void countCaught(Severity originalSeverity) {
        AtomicLong counter = _caught.get(originalSeverity);
        if (counter != null) {
            counter.incrementAndGet();
        }
    }

    @Override
    public void reset() {
        _demoted.values().forEach(c -> c.set(0));
        _caught.values().forEach(c -> c.set(0));
    }

    @Override
    public String toString() {
        return "CatcherStats{demoted:[F:" + getDemoted(Severity.FATAL) + ",E:" + getDemoted(Severity.ERROR)
                + ",W:" + getDemoted(Severity.WARNING) + "], caught:[F:" + getCaught(Severity.FATAL)
                + ",E:" + getCaught(Severity.ERROR) + ",W:" + getCaught(Severity.WARNING) + "]}";
    }
}
