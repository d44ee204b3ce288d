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

import java.util.concurrent.atomic.AtomicLong;

import io.reportcatch.CatchContext;
import io.reportcatch.CatchDecision;
import io.reportcatch.ReportCatcher;

/**
 * Catches matching reports, so that they are not emitted. Typically used for expected errors in tests.
 */
public class SuppressingCatcher implements ReportCatcher {
    private final ReportMatcher _matcher;
    private final AtomicLong _suppressed = new AtomicLong();

    public SuppressingCatcher(ReportMatcher matcher) {
        if (matcher == null) {
            throw new NullPointerException("matcher");
        }
        _matcher = matcher;
    }

    public static SuppressingCatcher ids(String... ids) {
        return new SuppressingCatcher(ReportMatcher.idIn(ids));
    }

    @Override
    public CatchDecision catchReport(CatchContext context) {
        if (_matcher.test(context)) {
            _suppressed.incrementAndGet();
            return CatchDecision.CAUGHT;
        }
        return CatchDecision.THROW;
    }

    /**
     * @return how many reports this catcher has returned CAUGHT for. (Whether the chain honored it depends on the debug
     *         flags.)
     */
    public long getSuppressedCount() {
        return _suppressed.get();
    }
}
