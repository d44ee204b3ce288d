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
import io.reportcatch.ReportAction;
import io.reportcatch.ReportCatcher;
import io.reportcatch.Severity;

/**
 * Sets the action of matching reports explicitly, optionally also changing the severity. Since the action is set
 * explicitly, it is kept as given even though the severity changes.
 */
public class ActionOverridingCatcher implements ReportCatcher {
    private final ReportMatcher _matcher;
    private final int _action;
    private final Severity _newSeverity;

    public ActionOverridingCatcher(ReportMatcher matcher, int action) {
        this(matcher, action, null);
    }

    /**
     * @param newSeverity
     *            the severity to set, or <code>null</code> to keep the severity.
     */
    public ActionOverridingCatcher(ReportMatcher matcher, int action, Severity newSeverity) {
        if (matcher == null) {
            throw new NullPointerException("matcher");
        }
        if (!ReportAction.isValid(action)) {
            throw new IllegalArgumentException("Unknown action bits in [0x" + Integer.toHexString(action) + "].");
        }
        _matcher = matcher;
        _action = action;
        _newSeverity = newSeverity;
    }

    @Override
    public CatchDecision catchReport(CatchContext context) {
        if (_matcher.test(context)) {
            if (_newSeverity != null) {
                context.setSeverity(_newSeverity);
            }
            context.setAction(_action);
        }
        return CatchDecision.THROW;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + ReportAction.toString(_action) + "]";
    }
}
