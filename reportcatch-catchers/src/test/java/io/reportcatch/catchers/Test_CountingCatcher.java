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

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;

import io.reportcatch.ReportObject;
import io.reportcatch.ReportVerbosity;
import io.reportcatch.Severity;
import io.reportcatch.test.ReportTestHelp;
import io.reportcatch.test.junit.Rule_ReportServer;

public class Test_CountingCatcher {
    @Rule
    public final Rule_ReportServer _reports = Rule_ReportServer.create();

    @Test
    public void countsWhatItSees_afterEarlierCatchers() {
        CountingCatcher before = new CountingCatcher();
        CountingCatcher after = new CountingCatcher();
        _reports.getCatcherRegistry().addCatcher("before", before);
        _reports.getCatcherRegistry().addCatcher("demote", SeverityChangingCatcher.demoteToInfo("Noise"));
        _reports.getCatcherRegistry().addCatcher("after", after);

        _reports.getReportServer().warning("Noise", "n1");
        _reports.getReportServer().warning("Noise", "n2");
        _reports.getReportServer().error("Signal", "s1");

        Assert.assertEquals(2, before.getCount(Severity.WARNING));
        Assert.assertEquals(0, after.getCount(Severity.WARNING));
        Assert.assertEquals(2, after.getCount(Severity.INFO));
        Assert.assertEquals(2, after.getCount("Noise"));
        Assert.assertEquals(3, after.getTotalCount());
        Assert.assertEquals(2, _reports.getCatcherStats().getDemoted(Severity.WARNING));
    }

    @Test
    public void ownerScoped_onlySeesOwnersReports() {
        ReportObject agent = ReportTestHelp.reportObject("top.env.agent");
        ReportObject monitor = ReportTestHelp.reportObject("top.env.monitor");
        CountingCatcher agentOnly = new CountingCatcher();
        _reports.getCatcherRegistry().addCatcher(agent, "agentOnly", agentOnly);

        String id = ReportTestHelp.id("Report");
        _reports.getReportServer().report(Severity.INFO, id, "from agent", ReportVerbosity.NONE, agent);
        _reports.getReportServer().report(Severity.INFO, id, "from monitor", ReportVerbosity.NONE, monitor);

        Assert.assertEquals(1, agentOnly.getCount(id));
        Assert.assertEquals(2, _reports.getSink().getRecorded(id).size());
        Assert.assertTrue(_reports.getSink().getRecorded(id).get(0).getComposedText().contains("@ top.env.agent"));
    }
}
