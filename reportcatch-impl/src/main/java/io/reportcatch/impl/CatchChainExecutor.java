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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import io.reportcatch.ActionResolver;
import io.reportcatch.CatchContext;
import io.reportcatch.CatchDebugFlags;
import io.reportcatch.CatchDecision;
import io.reportcatch.CatcherRegistry;
import io.reportcatch.CatcherStats;
import io.reportcatch.RegisteredCatcher;
import io.reportcatch.ReportAttribute;
import io.reportcatch.ReportEmitter;
import io.reportcatch.ReportMessage;
import io.reportcatch.ReportObject;
import io.reportcatch.ReportVerbosity;
import io.reportcatch.Severity;

/**
 * Runs the catcher chain over a report: {@link #process(ReportMessageImpl)} is invoked exactly once per emission
 * request by the emission subsystem, which then emits the report iff it was not caught.
 * <p/>
 * One pass at a time: the pass runs while holding the executor's lock, so concurrent emission requests from other
 * threads wait. A nested emission from the same thread, i.e. a catcher (or something it calls) issuing a report while
 * the pass runs, finds the pass in progress and bypasses the chain altogether, being treated as not caught.
 * <p/>
 * The executor owns the single {@link CatchContext} handed to every catcher invocation, holding the report in flight.
 */
public class CatchChainExecutor implements ReportCatchStatics {
    private static final Logger log = LoggerFactory.getLogger(CatchChainExecutor.class);

    private final CatcherRegistry _catcherRegistry;
    private final ReportEmitter _reportEmitter;
    private final CatcherStats _catcherStats;

    // Set by test harnesses, read once at the start of each pass.
    private volatile int _debugFlags;

    // :: State of the pass in progress - ALL access shall hold this lock.
    private final Object _stateLockObject = new Object();
    private final CatchContextImpl _catchContext = new CatchContextImpl();
    private boolean _passInProgress;
    private ReportMessageImpl _currentMessage;
    private RegisteredCatcher _currentCatcher;
    private boolean _actionExplicitlySet;

    public CatchChainExecutor(CatcherRegistry catcherRegistry, ReportEmitter reportEmitter,
            CatcherStats catcherStats) {
        if (catcherRegistry == null) {
            throw new NullPointerException("catcherRegistry");
        }
        if (reportEmitter == null) {
            throw new NullPointerException("reportEmitter");
        }
        if (catcherStats == null) {
            throw new NullPointerException("catcherStats");
        }
        _catcherRegistry = catcherRegistry;
        _reportEmitter = reportEmitter;
        _catcherStats = catcherStats;
    }

    /**
     * @param debugFlags
     *            bitmask of {@link CatchDebugFlags}, taking effect from the next pass.
     */
    public void setDebugFlags(int debugFlags) {
        if ((debugFlags & ~CatchDebugFlags.ALL) != 0) {
            throw new IllegalArgumentException("Unknown debug flag bits in [0x" + Integer.toHexString(debugFlags)
                    + "].");
        }
        if (debugFlags != CatchDebugFlags.NONE) {
            log.info(LOG_PREFIX + "Setting catcher debug flags: IGNORE_CATCH:["
                    + ((debugFlags & CatchDebugFlags.IGNORE_CATCH) != 0) + "], DISCARD_MUTATIONS:["
                    + ((debugFlags & CatchDebugFlags.DISCARD_MUTATIONS) != 0) + "].");
        }
        _debugFlags = debugFlags;
    }

    public int getDebugFlags() {
        return _debugFlags;
    }

    public CatcherStats getCatcherStats() {
        return _catcherStats;
    }

    /**
     * @return whether a chain pass is in progress on the current thread, i.e. whether an emission now would bypass
     *         the chain.
     */
    public boolean isPassInProgress() {
        synchronized (_stateLockObject) {
            return _passInProgress;
        }
    }

    /**
     * Runs one chain pass over the report.
     *
     * @return <code>true</code> if the report was caught, and hence shall not be emitted.
     */
    public boolean process(ReportMessageImpl message) {
        if (message == null) {
            throw new NullPointerException("message");
        }
        synchronized (_stateLockObject) {
            // ?: Is there already a pass in progress? (Lock is re-entrant, so this is the same thread)
            if (_passInProgress) {
                // -> Yes, so this is a report raised from within the chain: bypass it, to avoid recursion.
                return false;
            }
            _passInProgress = true;
            // :: Silence the registry's dispatch tracing for this thread for the duration of the pass.
            boolean tracingSuppressed = _catcherRegistry.suppressTracingOnCurrentThread(true);
            try {
                return runPass(message);
            }
            finally {
                _currentMessage = null;
                _currentCatcher = null;
                _catcherRegistry.suppressTracingOnCurrentThread(tracingSuppressed);
                _passInProgress = false;
            }
        }
    }

    private boolean runPass(ReportMessageImpl message) {
        int debugFlags = _debugFlags;
        boolean ignoreCatch = (debugFlags & CatchDebugFlags.IGNORE_CATCH) != 0;
        boolean discardMutations = (debugFlags & CatchDebugFlags.DISCARD_MUTATIONS) != 0;

        Severity originalSeverity = message.getSeverity();
        _currentMessage = message;
        ReportMessageImpl pristine = discardMutations ? message.copy() : null;

        List<RegisteredCatcher> catchers = _catcherRegistry.getCatchersFor(message.getReportObject());
        boolean caught = false;
        for (RegisteredCatcher registered : catchers) {
            // ?: Is the catcher disabled?
            if (!registered.isEnabled()) {
                // -> Yes, so skip it without invoking.
                continue;
            }
            Severity prevSeverity = message.getSeverity();
            _actionExplicitlySet = false;

            CatchDecision decision = invokeCatcher(registered);
            // ?: Did the catcher break the contract?
            if (decision == null) {
                // -> Yes, report it directly, and go on as if it threw.
                reportInvalidDecision(registered, message);
                decision = CatchDecision.THROW;
            }

            if (discardMutations) {
                message.restoreFrom(pristine);
            }

            recomputeActionOnSeverityChange(message, prevSeverity);

            if ((decision == CatchDecision.CAUGHT) && !ignoreCatch) {
                _catcherStats.countCaught(originalSeverity);
                caught = true;
                break;
            }
        }

        // Demotion is counted independently of being caught.
        if (message.getSeverity().isLessSevereThan(originalSeverity)) {
            _catcherStats.countDemoted(originalSeverity);
        }
        return caught;
    }

    private CatchDecision invokeCatcher(RegisteredCatcher registered) {
        _currentCatcher = registered;
        MDC.put(MDC_CATCHER_NAME, registered.getName());
        try {
            return registered.getCatcher().catchReport(_catchContext);
        }
        finally {
            MDC.remove(MDC_CATCHER_NAME);
            _currentCatcher = null;
        }
    }

    /**
     * If the catcher changed the severity without setting the action, and the action still was the default of the
     * previous severity, then the action follows the severity. Compares with the severity's default, not the id's.
     */
    private void recomputeActionOnSeverityChange(ReportMessageImpl message, Severity prevSeverity) {
        if (_actionExplicitlySet || (message.getSeverity() == prevSeverity)) {
            return;
        }
        int prevDefault = _reportEmitter.getDefaultAction(prevSeverity, ActionResolver.SEVERITY_DEFAULT_KEY);
        if (message.getAction() == prevDefault) {
            message.setAction(_reportEmitter.getDefaultAction(message.getSeverity(),
                    ActionResolver.SEVERITY_DEFAULT_KEY));
        }
    }

    private void reportInvalidDecision(RegisteredCatcher registered, ReportMessageImpl message) {
        ReportMessageImpl violation = new ReportMessageImpl(Severity.ERROR, REPORT_ID_INVALID_DECISION,
                "Catcher [" + registered.getName() + "] returned an invalid decision [null] for report ["
                        + message.getId() + "], expected THROW or CAUGHT - treating it as THROW.",
                ReportVerbosity.NONE,
                _reportEmitter.getDefaultAction(Severity.ERROR, REPORT_ID_INVALID_DECISION));
        violation.setReportObject(message.getReportObject());
        emitDirectly(violation);
    }

    private void emitDirectly(ReportMessage message) {
        if (_reportEmitter.isEmissionEnabled(message.getVerbosity(), message.getSeverity(), message.getId())) {
            _reportEmitter.execute(message, _reportEmitter.composeText(message));
        }
    }

    /**
     * The single context object, delegating to the report in flight. Only usable from the thread running the pass,
     * while a catcher is being invoked.
     */
    private class CatchContextImpl implements CatchContext {
        private ReportMessageImpl active() {
            if (!Thread.holdsLock(_stateLockObject) || (_currentCatcher == null)) {
                throw new IllegalStateException("The CatchContext is only valid while a catcher is being invoked,"
                        + " on the thread running the chain pass.");
            }
            return _currentMessage;
        }

        @Override
        public String getCatcherName() {
            active();
            return _currentCatcher.getName();
        }

        @Override
        public ReportMessage getMessage() {
            // The context itself, so that the live message and its unmarked setters never leak.
            active();
            return this;
        }

        @Override
        public Severity getSeverity() {
            return active().getSeverity();
        }

        @Override
        public String getId() {
            return active().getId();
        }

        @Override
        public String getText() {
            return active().getText();
        }

        @Override
        public int getVerbosity() {
            return active().getVerbosity();
        }

        @Override
        public int getAction() {
            return active().getAction();
        }

        @Override
        public String getContext() {
            return active().getContext();
        }

        @Override
        public String getFile() {
            return active().getFile();
        }

        @Override
        public int getLine() {
            return active().getLine();
        }

        @Override
        public ReportObject getReportObject() {
            return active().getReportObject();
        }

        @Override
        public List<ReportAttribute> getAttributes() {
            return active().getAttributes();
        }

        @Override
        public CatchContext setSeverity(Severity severity) {
            active().setSeverity(severity);
            return this;
        }

        @Override
        public CatchContext setId(String id) {
            if (ActionResolver.SEVERITY_DEFAULT_KEY.equals(id)) {
                throw new IllegalArgumentException("The id [" + id + "] is reserved.");
            }
            active().setId(id);
            return this;
        }

        @Override
        public CatchContext setText(String text) {
            active().setText(text);
            return this;
        }

        @Override
        public CatchContext setVerbosity(int verbosity) {
            active().setVerbosity(verbosity);
            return this;
        }

        @Override
        public CatchContext setAction(int action) {
            active().setAction(action);
            _actionExplicitlySet = true;
            return this;
        }

        @Override
        public CatchContext setContext(String context) {
            active().setContext(context);
            return this;
        }

        @Override
        public CatchContext addIntAttribute(String name, long value) {
            active().addAttribute(ReportAttribute.ofInt(name, value));
            return this;
        }

        @Override
        public CatchContext addStringAttribute(String name, String value) {
            active().addAttribute(ReportAttribute.ofString(name, value));
            return this;
        }

        @Override
        public CatchContext addObjectAttribute(String name, Object value) {
            active().addAttribute(ReportAttribute.ofObject(name, value));
            return this;
        }

        @Override
        public void issue() {
            emitDirectly(active());
        }

        @Override
        public void reportInfo(String id, String text, int verbosity) {
            report(Severity.INFO, id, text, verbosity);
        }

        @Override
        public void reportWarning(String id, String text) {
            report(Severity.WARNING, id, text, ReportVerbosity.NONE);
        }

        @Override
        public void reportError(String id, String text) {
            report(Severity.ERROR, id, text, ReportVerbosity.NONE);
        }

        @Override
        public void reportFatal(String id, String text) {
            report(Severity.FATAL, id, text, ReportVerbosity.NONE);
        }

        private void report(Severity severity, String id, String text, int verbosity) {
            ReportObject reportObject = active().getReportObject();
            _reportEmitter.report(severity, id, text, verbosity, reportObject);
        }

        @Override
        public String toString() {
            return "CatchContext[" + (_currentCatcher != null ? _currentCatcher.getName() : "-inactive-") + "]";
        }
    }
}
