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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import io.reportcatch.CatchDebugFlags;
import io.reportcatch.CatchDecision;
import io.reportcatch.ReportAction;
import io.reportcatch.ReportMessage;
import io.reportcatch.ReportObject;
import io.reportcatch.ReportSink;
import io.reportcatch.ReportVerbosity;
import io.reportcatch.Severity;
import io.reportcatch.impl.ReportServerException.ReportExitException;

/**
 * Tests the {@link ReportServer} as the emission subsystem around the catcher chain.
 */
public class Test_ReportServer {
    private ReportServer _server;
    private final List<String> _displayed = new ArrayList<>();
    private final List<ReportMessage> _exits = new ArrayList<>();

    @Before
    public void setup() {
        _server = ReportServer.create("Test");
        _server.setDefaultSink((message, text) -> _displayed.add(message.getSeverity() + ":" + message.getId()));
        _server.setExitHandler(_exits::add);
    }

    @Test
    public void uncaughtReport_isDisplayed_caughtIsNot() {
        _server.getCatcherRegistry().addCatcher("dropper", ctx -> "Drop".equals(ctx.getId())
                ? CatchDecision.CAUGHT
                : CatchDecision.THROW);

        _server.warning("Keep", "Kept");
        _server.warning("Drop", "Dropped");

        Assert.assertEquals(List.of("WARNING:Keep"), _displayed);
        Assert.assertEquals(1, _server.getCatcherStats().getCaught(Severity.WARNING));
    }

    @Test
    public void tooVerboseReport_neverEntersTheChain() {
        AtomicInteger invoked = new AtomicInteger();
        _server.getCatcherRegistry().addCatcher("observer", ctx -> {
            invoked.incrementAndGet();
            return CatchDecision.THROW;
        });

        _server.info("Chatty", "Too verbose", ReportVerbosity.HIGH);
        Assert.assertEquals(0, invoked.get());
        Assert.assertTrue(_displayed.isEmpty());

        _server.getActionTable().setIdMaxVerbosity("Chatty", ReportVerbosity.FULL);
        _server.info("Chatty", "Now allowed", ReportVerbosity.HIGH);
        Assert.assertEquals(1, invoked.get());
        Assert.assertEquals(List.of("INFO:Chatty"), _displayed);
    }

    @Test
    public void noActionReport_isNotEnabled() {
        _server.getActionTable().setIdAction("Silent", ReportAction.NO_ACTION);
        Assert.assertFalse(_server.isEmissionEnabled(ReportVerbosity.NONE, Severity.ERROR, "Silent"));
        Assert.assertFalse(_server.report(Severity.ERROR, "Silent", "Nothing", ReportVerbosity.NONE, null,
                null, null, 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void severityDefaultKey_cannotBeUsedAsReportId() {
        _server.warning(ReportServer.SEVERITY_DEFAULT_KEY, "Not a real id");
    }

    @Test
    public void demotedFatal_doesNotExit() {
        _server.getCatcherRegistry().addCatcher("demoter", ctx -> {
            ctx.setSeverity(Severity.WARNING);
            return CatchDecision.THROW;
        });

        _server.fatal("Fatal", "Not so fatal after all");

        Assert.assertEquals(List.of("WARNING:Fatal"), _displayed);
        Assert.assertTrue(_exits.isEmpty());
        Assert.assertEquals(1, _server.getCatcherStats().getDemoted(Severity.FATAL));
    }

    @Test
    public void fatal_withDefaultExitHandler_throws() {
        ReportServer server = ReportServer.create("Exiting");
        server.setDefaultSink((message, text) -> {
        });
        try {
            server.fatal("Die", "Goodbye");
            Assert.fail("Should have thrown ReportExitException");
        }
        catch (ReportExitException e) {
            Assert.assertEquals("Die", e.getReportMessage().getId());
        }
        // The pass is over, so a new report is processed normally.
        Assert.assertFalse(server.getCatchChainExecutor().isPassInProgress());
    }

    @Test
    public void countedReports_reachingMaxQuitCount_exit() {
        _server.getServerConfig().setMaxQuitCount(2);

        _server.error("E1", "first");
        Assert.assertTrue(_exits.isEmpty());
        _server.error("E2", "second");

        Assert.assertEquals(1, _exits.size());
        Assert.assertEquals("E2", _exits.get(0).getId());
        Assert.assertEquals(2, _server.getSeverityCount(Severity.ERROR));
        Assert.assertEquals(1, _server.getIdCount("E1"));
        Assert.assertEquals(0, _server.getSeverityCount(Severity.WARNING));

        _server.resetCounts();
        Assert.assertEquals(0, _server.getSeverityCount(Severity.ERROR));
        Assert.assertEquals(0, _server.getQuitCount());
    }

    @Test
    public void reportHook_canVetoTheRemainingActions() {
        List<String> hooked = new ArrayList<>();
        ReportObject vetoing = new ReportObject() {
            @Override
            public String getFullName() {
                return "top.vetoing";
            }

            @Override
            public boolean reportHook(ReportMessage message) {
                hooked.add(message.getId());
                return false;
            }
        };
        _server.getActionTable().setSeverityAction(Severity.WARNING, ReportAction.CALL_HOOK | ReportAction.DISPLAY);

        _server.report(Severity.WARNING, "Hooked", "Vetoed", ReportVerbosity.NONE, vetoing);

        Assert.assertEquals(List.of("Hooked"), hooked);
        Assert.assertTrue(_displayed.isEmpty());
    }

    @Test
    public void stopAction_invokesStopHandler() {
        List<String> stops = new ArrayList<>();
        _server.setStopHandler(message -> stops.add(message.getId()));
        _server.getActionTable().setIdAction("Halt", ReportAction.DISPLAY | ReportAction.STOP);

        _server.error("Halt", "Stopping");

        Assert.assertEquals(List.of("Halt"), stops);
        Assert.assertEquals(List.of("ERROR:Halt"), _displayed);
    }

    @Test
    public void reportFromCatcher_bypassesTheChain_andIsEmitted() {
        AtomicInteger invoked = new AtomicInteger();
        _server.getCatcherRegistry().addCatcher("catchAndComplain", ctx -> {
            invoked.incrementAndGet();
            ctx.reportWarning("Complaint", "Caught [" + ctx.getId() + "]");
            return CatchDecision.CAUGHT;
        });

        _server.error("Original", "Will be caught");

        Assert.assertEquals(1, invoked.get());
        Assert.assertEquals(List.of("WARNING:Complaint"), _displayed);
        Assert.assertEquals(1, _server.getCatcherStats().getCaught(Severity.ERROR));
        Assert.assertEquals(0, _server.getCatcherStats().getCaught(Severity.WARNING));
    }

    @Test
    public void issue_emitsImmediately_inCurrentState() {
        List<String> texts = new ArrayList<>();
        _server.setDefaultSink((message, text) -> texts.add(text));
        _server.getCatcherRegistry().addCatcher("issueAndCatch", ctx -> {
            ctx.setText("Issued by catcher");
            ctx.issue();
            return CatchDecision.CAUGHT;
        });
        _server.getCatcherRegistry().addCatcher("neverReached", ctx -> {
            throw new AssertionError("Should not be invoked after CAUGHT");
        });

        _server.warning("Issued", "Original text");

        Assert.assertEquals(List.of("WARNING [Issued] Issued by catcher"), texts);
    }

    @Test
    public void invalidDecision_isEmittedAsError_andReportProceeds() {
        _server.getCatcherRegistry().addCatcher("broken", ctx -> null);

        _server.warning("Proceeds", "Still emitted");

        Assert.assertEquals(List.of("ERROR:" + ReportCatchStatics.REPORT_ID_INVALID_DECISION, "WARNING:Proceeds"),
                _displayed);
    }

    @Test
    public void composeText_includesLocationOwnerAndContext() {
        ReportMessageImpl message = new ReportMessageImpl(Severity.ERROR, "Id", "Some text", ReportVerbosity.NONE,
                ReportAction.DISPLAY)
                .setLocation("src/Thing.java", 42)
                .setReportObject(() -> "top.env.agent")
                .setContext("phase:run");

        Assert.assertEquals("ERROR src/Thing.java(42) @ top.env.agent [phase:run] [Id] Some text",
                _server.composeText(message));
    }

    @Test
    public void summary_hasFixedFormat_andBypassesCatchers() {
        List<String> summary = new ArrayList<>();
        _server.getCatcherRegistry().addCatcher("demoteFatal", ctx -> {
            if (ctx.getSeverity() == Severity.FATAL) {
                ctx.setSeverity(Severity.WARNING);
            }
            return CatchDecision.THROW;
        });
        _server.getCatcherRegistry().addCatcher("catchErrors", ctx -> ctx.getSeverity() == Severity.ERROR
                ? CatchDecision.CAUGHT
                : CatchDecision.THROW);
        _server.fatal("F", "demoted");
        _server.error("E1", "caught");
        _server.error("E2", "caught");
        int displayedBefore = _displayed.size();

        _server.summarizeCatchers((message, text) -> summary.add(text));

        String nl = System.lineSeparator();
        String expected = nl + "--- Report Catcher Summary ---" + nl + nl
                + "Number of demoted FATAL reports  :     1" + nl
                + "Number of demoted ERROR reports  :     0" + nl
                + "Number of demoted WARNING reports:     0" + nl
                + "Number of caught FATAL reports   :     0" + nl
                + "Number of caught ERROR reports   :     2" + nl
                + "Number of caught WARNING reports :     0" + nl;
        Assert.assertEquals(List.of(expected), summary);
        Assert.assertEquals(displayedBefore, _displayed.size());
        Assert.assertEquals(2, _server.getCatcherStats().getCaught(Severity.ERROR));
    }

    @Test
    public void summary_restoresPreviousActionAndDestination() {
        List<String> other = new ArrayList<>();
        ReportSink previous = (message, text) -> other.add(text);
        String summaryId = ReportCatchStatics.REPORT_ID_CATCHER_SUMMARY;
        _server.getActionTable().setIdAction(summaryId, ReportAction.NO_ACTION);
        _server.getActionTable().setIdDestination(summaryId, previous);
        List<String> summary = new ArrayList<>();

        _server.summarizeCatchers((message, text) -> summary.add(text));

        Assert.assertEquals(1, summary.size());
        Assert.assertTrue(other.isEmpty());
        Assert.assertEquals(Integer.valueOf(ReportAction.NO_ACTION), _server.getActionTable().getIdAction(summaryId));
        Assert.assertSame(previous, _server.getActionTable().getIdDestination(summaryId));
    }

    @Test
    public void summary_isEmitted_evenIfSeverityIdActionSilencesTheId() {
        String summaryId = ReportCatchStatics.REPORT_ID_CATCHER_SUMMARY;
        _server.getActionTable().setSeverityIdAction(Severity.INFO, summaryId, ReportAction.NO_ACTION);
        List<String> summary = new ArrayList<>();

        _server.summarizeCatchers((message, text) -> summary.add(text));

        Assert.assertEquals(1, summary.size());
        Assert.assertTrue(summary.get(0).contains("--- Report Catcher Summary ---"));
        // The (severity, id) override is left as it was.
        Assert.assertEquals(ReportAction.NO_ACTION, _server.getActionTable().getDefaultAction(Severity.INFO,
                summaryId));
    }

    @Test
    public void summary_isEmitted_regardlessOfMaxVerbosity() {
        String summaryId = ReportCatchStatics.REPORT_ID_CATCHER_SUMMARY;
        List<String> summary = new ArrayList<>();

        _server.getActionTable().setIdMaxVerbosity(summaryId, -1);
        _server.summarizeCatchers((message, text) -> summary.add(text));
        _server.getActionTable().setIdMaxVerbosity(summaryId, ReportVerbosity.FULL);
        _server.getServerConfig().setMaxVerbosity(-1);
        _server.summarizeCatchers((message, text) -> summary.add(text));

        Assert.assertEquals(2, summary.size());
        Assert.assertTrue(_displayed.isEmpty());
    }

    @Test
    public void summary_restoresMissingOverrides_evenWhenSinkThrows() {
        String summaryId = ReportCatchStatics.REPORT_ID_CATCHER_SUMMARY;
        try {
            _server.summarizeCatchers((message, text) -> {
                throw new IllegalStateException("Sink broke");
            });
            Assert.fail("Should have propagated");
        }
        catch (IllegalStateException e) {
            Assert.assertEquals("Sink broke", e.getMessage());
        }
        Assert.assertNull(_server.getActionTable().getIdAction(summaryId));
        Assert.assertNull(_server.getActionTable().getIdDestination(summaryId));
    }

    @Test
    public void catcherDebugFlags_fromSystemProperty() {
        System.setProperty(ReportCatchStatics.SYSPROP_CATCHER_DEBUG_FLAGS,
                Integer.toString(CatchDebugFlags.IGNORE_CATCH));
        try {
            ReportServer server = ReportServer.create("FromSysProp");
            Assert.assertEquals(CatchDebugFlags.IGNORE_CATCH, server.getServerConfig().getCatcherDebugFlags());
            List<String> displayed = new ArrayList<>();
            server.setDefaultSink((message, text) -> displayed.add(message.getId()));
            server.getCatcherRegistry().addCatcher("catcher", ctx -> CatchDecision.CAUGHT);

            server.warning("NotCaught", "IGNORE_CATCH is set");

            Assert.assertEquals(List.of("NotCaught"), displayed);
            Assert.assertEquals(0, server.getCatcherStats().getCaught(Severity.WARNING));
        }
        finally {
            System.clearProperty(ReportCatchStatics.SYSPROP_CATCHER_DEBUG_FLAGS);
        }
    }
}
