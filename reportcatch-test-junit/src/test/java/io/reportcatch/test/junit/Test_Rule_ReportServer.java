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

package io.reportcatch.test.junit;

import org.junit.Assert;
import org.junit.ClassRule;
import org.junit.Rule;
import org.junit.Test;

import io.reportcatch.Severity;
import io.reportcatch.test.ReportTestHelp;

public class Test_Rule_ReportServer {
    @ClassRule
    public static final Rule_ReportServer CLASS_REPORTS = Rule_ReportServer.create("ClassScoped");

    @Rule
    public final Rule_ReportServer _reports = Rule_ReportServer.create();

    @Test
    public void freshServerPerTest_recordsDisplayedReports() {
        Assert.assertNotSame(CLASS_REPORTS.getReportServer(), _reports.getReportServer());
        Assert.assertEquals(0, _reports.getSink().size());

        _reports.getReportServer().warning(ReportTestHelp.id("Warn"), "A warning");

        Assert.assertEquals(1, _reports.getSink().size());
        Assert.assertEquals("Test_Rule_ReportServer.freshServerPerTest_recordsDisplayedReports.Warn",
                _reports.getSink().getRecorded().get(0).getId());
    }

    @Test
    public void fatal_isRecordedAsExit_insteadOfThrowing() {
        _reports.getReportServer().fatal("Fatal", "Recorded");

        Assert.assertEquals(1, _reports.getExits().size());
        Assert.assertEquals(Severity.FATAL, _reports.getExits().get(0).getSeverity());
    }
}
