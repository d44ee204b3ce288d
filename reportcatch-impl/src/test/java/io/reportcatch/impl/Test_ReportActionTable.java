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

import org.junit.Assert;
import org.junit.Test;

import io.reportcatch.ActionResolver;
import io.reportcatch.ReportAction;
import io.reportcatch.ReportSink;
import io.reportcatch.ReportVerbosity;
import io.reportcatch.Severity;

public class Test_ReportActionTable {
    private final ReportActionTable _table = new ReportActionTable();

    @Test
    public void severityDefaults() {
        Assert.assertEquals(ReportAction.DISPLAY, _table.getDefaultAction(Severity.INFO, "x"));
        Assert.assertEquals(ReportAction.DISPLAY, _table.getDefaultAction(Severity.WARNING, "x"));
        Assert.assertEquals(ReportAction.DISPLAY | ReportAction.COUNT, _table.getDefaultAction(Severity.ERROR, "x"));
        Assert.assertEquals(ReportAction.DISPLAY | ReportAction.EXIT, _table.getDefaultAction(Severity.FATAL, "x"));
    }

    @Test
    public void precedence_severityId_over_id_over_severity() {
        _table.setIdAction("Id", ReportAction.LOG);
        _table.setSeverityIdAction(Severity.WARNING, "Id", ReportAction.COUNT);

        Assert.assertEquals(ReportAction.COUNT, _table.getDefaultAction(Severity.WARNING, "Id"));
        Assert.assertEquals(ReportAction.LOG, _table.getDefaultAction(Severity.ERROR, "Id"));
        Assert.assertEquals(ReportAction.DISPLAY, _table.getDefaultAction(Severity.WARNING, "Other"));
    }

    @Test
    public void severityDefaultKey_ignoresIdOverrides() {
        _table.setSeverityAction(Severity.ERROR, ReportAction.LOG | ReportAction.COUNT);

        Assert.assertEquals(ReportAction.LOG | ReportAction.COUNT,
                _table.getDefaultAction(Severity.ERROR, ActionResolver.SEVERITY_DEFAULT_KEY));
    }

    @Test(expected = IllegalArgumentException.class)
    public void severityDefaultKey_cannotBeConfiguredAsId() {
        _table.setIdAction(ActionResolver.SEVERITY_DEFAULT_KEY, ReportAction.LOG);
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownActionBits_areRejected() {
        _table.setSeverityAction(Severity.INFO, 1 << 10);
    }

    @Test
    public void destinations_idOverSeverity() {
        ReportSink severitySink = (m, t) -> {
        };
        ReportSink idSink = (m, t) -> {
        };
        Assert.assertNull(_table.getDestination(Severity.ERROR, "Id"));

        _table.setSeverityDestination(Severity.ERROR, severitySink);
        Assert.assertSame(severitySink, _table.getDestination(Severity.ERROR, "Id"));

        _table.setIdDestination("Id", idSink);
        Assert.assertSame(idSink, _table.getDestination(Severity.ERROR, "Id"));
        Assert.assertSame(severitySink, _table.getDestination(Severity.ERROR, "Other"));

        _table.setIdDestination("Id", null);
        Assert.assertSame(severitySink, _table.getDestination(Severity.ERROR, "Id"));
    }

    @Test
    public void maxVerbosity_perId() {
        _table.setIdMaxVerbosity("Loud", ReportVerbosity.DEBUG);
        Assert.assertEquals(ReportVerbosity.DEBUG, _table.getMaxVerbosity("Loud", ReportVerbosity.MEDIUM));
        Assert.assertEquals(ReportVerbosity.MEDIUM, _table.getMaxVerbosity("Quiet", ReportVerbosity.MEDIUM));
    }

    @Test
    public void actionToString() {
        Assert.assertEquals("NO_ACTION", ReportAction.toString(ReportAction.NO_ACTION));
        Assert.assertEquals("DISPLAY|COUNT", ReportAction.toString(ReportAction.DISPLAY | ReportAction.COUNT));
    }
}
