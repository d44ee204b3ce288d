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

import io.reportcatch.CatchContext;
import io.reportcatch.CatchDecision;
import io.reportcatch.ReportCatcher;
import io.reportcatch.Severity;

/**
 * Changes the severity of matching reports, and passes them on. Demoting e.g. an ERROR to a WARNING makes the action
 * follow the severity, as long as the action was the ERROR default - which is counted as a demotion in the catcher
 * stats.
 */
public class SeverityChangingCatcher implements ReportCatcher {
    private final ReportMatcher _matcher;
    private final Severity _newSeverity;

    public SeverityChangingCatcher(ReportMatcher matcher, Severity newSeverity) {
        if (matcher == null) {
            throw new NullPointerException("matcher");
        }
        if (newSeverity == null) {
            throw new NullPointerException("newSeverity");
        }
        _matcher = matcher;
        _newSeverity = newSeverity;
    }

    /**
     * Demotes reports with the given ids to {@link Severity#WARNING}.
     */
    public static SeverityChangingCatcher demoteToWarning(String... ids) {
        return new SeverityChangingCatcher(ReportMatcher.idIn(ids), Severity.WARNING);
    }

    /**
     * Demotes reports with the given ids to {@link Severity#INFO}.
     */
    public static SeverityChangingCatcher demoteToInfo(String... ids) {
        return new SeverityChangingCatcher(ReportMatcher.idIn(ids), Severity.INFO);
    }

    @Override
    public CatchDecision catchReport(CatchContext context) {
        if (_matcher.test(context)) {
            context.setSeverity(_newSeverity);
        }
        return CatchDecision.THROW;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[->" + _newSeverity + "]";
    }
}
