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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import io.reportcatch.CatchDebugFlags;
import io.reportcatch.CatcherRegistry;
import io.reportcatch.CatcherStats;
import io.reportcatch.ReportAction;
import io.reportcatch.ReportEmitter;
import io.reportcatch.ReportMessage;
import io.reportcatch.ReportObject;
import io.reportcatch.ReportSink;
import io.reportcatch.ReportVerbosity;
import io.reportcatch.Severity;
import io.reportcatch.impl.ReportServerException.ReportExitException;

/**
 * The emission subsystem: every report is issued through {@link #report(Severity, String, String, int, ReportObject,
 * String, String, int) report(..)}, which resolves its action, checks whether it is enabled, runs it through the
 * {@link CatchChainExecutor catcher chain}, and executes its actions unless it was caught.
 * <p/>
 * The actions are executed as follows: {@link ReportAction#CALL_HOOK} first, which may drop the report; then
 * {@link ReportAction#COUNT}, {@link ReportAction#DISPLAY} to the resolved {@link ReportSink},
 * {@link ReportAction#LOG} to SLF4J; then the quit count check, {@link ReportAction#STOP} and finally
 * {@link ReportAction#EXIT}.
 */
public class ReportServer implements ReportEmitter, ReportCatchStatics {
    private static final Logger log = LoggerFactory.getLogger(ReportServer.class);

    private static final Logger displayLog = LoggerFactory.getLogger("io.reportcatch.Display");

    public static ReportServer create(String name) {
        return new ReportServer(name, new CatcherRegistryImpl(), new CatcherStatsImpl());
    }

    public static ReportServer create(String name, CatcherRegistry catcherRegistry, CatcherStats catcherStats) {
        return new ReportServer(name, catcherRegistry, catcherStats);
    }

    private final ServerConfigImpl _serverConfig;
    private final CatcherRegistry _catcherRegistry;
    private final ReportActionTable _actionTable = new ReportActionTable();
    private final CatchChainExecutor _catchChainExecutor;

    private final EnumMap<Severity, AtomicLong> _severityCounts = new EnumMap<>(Severity.class);
    private final ConcurrentHashMap<String, AtomicLong> _idCounts = new ConcurrentHashMap<>();
    private final AtomicLong _quitCount = new AtomicLong();

    private volatile ReportSink _defaultSink = ReportServer::displayThroughSlf4j;
    private volatile Consumer<ReportMessage> _stopHandler = ReportServer::defaultStop;
    private volatile Consumer<ReportMessage> _exitHandler = ReportServer::defaultExit;

    protected ReportServer(String name, CatcherRegistry catcherRegistry, CatcherStats catcherStats) {
        if (name == null) {
            throw new NullPointerException("name");
        }
        _catcherRegistry = catcherRegistry;
        _catchChainExecutor = new CatchChainExecutor(catcherRegistry, this, catcherStats);
        _serverConfig = new ServerConfigImpl(name);
        for (Severity severity : Severity.values()) {
            _severityCounts.put(severity, new AtomicLong());
        }
        log.info(LOG_PREFIX + "Created ReportServer [" + name + "], maxVerbosity:[" + _serverConfig
                .getMaxVerbosity() + "], maxQuitCount:[" + _serverConfig.getMaxQuitCount() + "].");
    }

    public ServerConfig getServerConfig() {
        return _serverConfig;
    }

    public CatcherRegistry getCatcherRegistry() {
        return _catcherRegistry;
    }

    public CatcherStats getCatcherStats() {
        return _catchChainExecutor.getCatcherStats();
    }

    public ReportActionTable getActionTable() {
        return _actionTable;
    }

    public CatchChainExecutor getCatchChainExecutor() {
        return _catchChainExecutor;
    }

    /**
     * Sets the sink used for {@link ReportAction#DISPLAY} when no destination is configured for the report's
     * severity or id. The default writes to the SLF4J logger <code>"io.reportcatch.Display"</code>.
     */
    public void setDefaultSink(ReportSink defaultSink) {
        if (defaultSink == null) {
            throw new NullPointerException("defaultSink");
        }
        _defaultSink = defaultSink;
    }

    /**
     * Invoked for {@link ReportAction#STOP}. The default logs a warning.
     */
    public void setStopHandler(Consumer<ReportMessage> stopHandler) {
        if (stopHandler == null) {
            throw new NullPointerException("stopHandler");
        }
        _stopHandler = stopHandler;
    }

    /**
     * Invoked for {@link ReportAction#EXIT}, and when the max quit count is reached. The default throws
     * {@link ReportExitException}.
     */
    public void setExitHandler(Consumer<ReportMessage> exitHandler) {
        if (exitHandler == null) {
            throw new NullPointerException("exitHandler");
        }
        _exitHandler = exitHandler;
    }

    // =========== Issuing reports

    public void info(String id, String text, int verbosity) {
        report(Severity.INFO, id, text, verbosity, null);
    }

    public void warning(String id, String text) {
        report(Severity.WARNING, id, text, ReportVerbosity.NONE, null);
    }

    public void error(String id, String text) {
        report(Severity.ERROR, id, text, ReportVerbosity.NONE, null);
    }

    public void fatal(String id, String text) {
        report(Severity.FATAL, id, text, ReportVerbosity.NONE, null);
    }

    @Override
    public void report(Severity severity, String id, String text, int verbosity, ReportObject reportObject) {
        report(severity, id, text, verbosity, reportObject, null, null, 0);
    }

    /**
     * Issues a report.
     *
     * @return <code>true</code> if the report was emitted, <code>false</code> if it was not enabled, or caught.
     */
    public boolean report(Severity severity, String id, String text, int verbosity, ReportObject reportObject,
            String context, String file, int line) {
        if (severity == null) {
            throw new NullPointerException("severity");
        }
        if (id == null) {
            throw new NullPointerException("id");
        }
        if (SEVERITY_DEFAULT_KEY.equals(id)) {
            throw new IllegalArgumentException("The id [" + id + "] is reserved for the severity default.");
        }
        int action = _actionTable.getDefaultAction(severity, id);
        // ?: Is this report enabled at all?
        if (!isEmissionEnabled(verbosity, severity, id)) {
            // -> No, so it never enters the chain.
            return false;
        }
        ReportMessageImpl message = new ReportMessageImpl(severity, id, text, verbosity, action)
                .setReportObject(reportObject)
                .setContext(context)
                .setLocation(file, line);
        return process(message);
    }

    /**
     * Runs an already built report through the catcher chain, and executes it unless caught.
     *
     * @return <code>true</code> if the report was emitted, <code>false</code> if it was caught.
     */
    public boolean process(ReportMessageImpl message) {
        boolean caught = _catchChainExecutor.process(message);
        if (caught) {
            return false;
        }
        execute(message, composeText(message));
        return true;
    }

    // =========== ReportEmitter

    @Override
    public int getDefaultAction(Severity severity, String id) {
        return _actionTable.getDefaultAction(severity, id);
    }

    @Override
    public boolean isEmissionEnabled(int verbosity, Severity severity, String id) {
        if (verbosity > _actionTable.getMaxVerbosity(id, _serverConfig.getMaxVerbosity())) {
            return false;
        }
        return _actionTable.getDefaultAction(severity, id) != ReportAction.NO_ACTION;
    }

    @Override
    public String composeText(ReportMessage message) {
        StringBuilder buf = new StringBuilder(64 + message.getText().length());
        buf.append(message.getSeverity());
        if (!message.getFile().isEmpty()) {
            buf.append(' ').append(message.getFile()).append('(').append(message.getLine()).append(')');
        }
        if (message.getReportObject() != null) {
            buf.append(" @ ").append(message.getReportObject().getFullName());
        }
        if (!message.getContext().isEmpty()) {
            buf.append(" [").append(message.getContext()).append(']');
        }
        buf.append(" [").append(message.getId()).append("] ").append(message.getText());
        return buf.toString();
    }

    @Override
    public void execute(ReportMessage message, String composedText) {
        int action = message.getAction();
        // ?: Should the owner's hook be invoked?
        if (ReportAction.has(action, ReportAction.CALL_HOOK) && (message.getReportObject() != null)) {
            // -> Yes, and it may veto the rest.
            if (!message.getReportObject().reportHook(message)) {
                return;
            }
        }
        if (ReportAction.has(action, ReportAction.COUNT)) {
            _severityCounts.get(message.getSeverity()).incrementAndGet();
            _idCounts.computeIfAbsent(message.getId(), k -> new AtomicLong()).incrementAndGet();
        }
        if (ReportAction.has(action, ReportAction.DISPLAY)) {
            ReportSink sink = _actionTable.getDestination(message.getSeverity(), message.getId());
            (sink != null ? sink : _defaultSink).write(message, composedText);
        }
        if (ReportAction.has(action, ReportAction.LOG)) {
            logReport(message, composedText);
        }
        if (ReportAction.has(action, ReportAction.COUNT)) {
            long quitCount = _quitCount.incrementAndGet();
            int maxQuitCount = _serverConfig.getMaxQuitCount();
            if ((maxQuitCount > 0) && (quitCount >= maxQuitCount)) {
                log.warn(LOG_PREFIX + "Quit count reached [" + quitCount + "/" + maxQuitCount + "], exiting.");
                _exitHandler.accept(message);
                return;
            }
        }
        if (ReportAction.has(action, ReportAction.STOP)) {
            _stopHandler.accept(message);
        }
        if (ReportAction.has(action, ReportAction.EXIT)) {
            _exitHandler.accept(message);
        }
    }

    // =========== Counts

    public long getSeverityCount(Severity severity) {
        return _severityCounts.get(severity).get();
    }

    public long getIdCount(String id) {
        AtomicLong count = _idCounts.get(id);
        return count == null ? 0 : count.get();
    }

    public long getQuitCount() {
        return _quitCount.get();
    }

    /**
     * Resets the severity, id and quit counts - not the {@link #getCatcherStats() catcher stats}.
     */
    public void resetCounts() {
        _severityCounts.values().forEach(c -> c.set(0));
        _idCounts.clear();
        _quitCount.set(0);
    }

    // =========== Catcher summary

    /**
     * Emits the catcher summary to the default sink.
     */
    public void summarizeCatchers() {
        summarizeCatchers(_defaultSink);
    }

    /**
     * Emits the catcher summary, as an {@link Severity#INFO} report with id {@link #REPORT_ID_CATCHER_SUMMARY},
     * directly to the given sink without passing the catcher chain. The report is always emitted, whatever the
     * action table or max verbosity say about that id. The action and destination of that id are temporarily
     * overridden, and restored afterwards.
     */
    public void summarizeCatchers(ReportSink sink) {
        if (sink == null) {
            throw new NullPointerException("sink");
        }
        synchronized (_actionTable) {
            Integer previousAction = _actionTable.getIdAction(REPORT_ID_CATCHER_SUMMARY);
            ReportSink previousSink = _actionTable.getIdDestination(REPORT_ID_CATCHER_SUMMARY);
            try {
                _actionTable.setIdAction(REPORT_ID_CATCHER_SUMMARY, ReportAction.DISPLAY);
                _actionTable.setIdDestination(REPORT_ID_CATCHER_SUMMARY, sink);
                // Action is fixed, and no verbosity gate: (severity, id) overrides or max verbosity cannot drop it.
                ReportMessageImpl summary = new ReportMessageImpl(Severity.INFO, REPORT_ID_CATCHER_SUMMARY,
                        formatSummary(getCatcherStats()), ReportVerbosity.NONE, ReportAction.DISPLAY);
                execute(summary, summary.getText());
            }
            finally {
                if (previousAction == null) {
                    _actionTable.removeIdAction(REPORT_ID_CATCHER_SUMMARY);
                }
                else {
                    _actionTable.setIdAction(REPORT_ID_CATCHER_SUMMARY, previousAction);
                }
                _actionTable.setIdDestination(REPORT_ID_CATCHER_SUMMARY, previousSink);
            }
        }
    }

    /**
     * @return the fixed summary block: demoted fatal/error/warning, then caught fatal/error/warning.
     */
    public static String formatSummary(CatcherStats stats) {
        return String.format("%n--- Report Catcher Summary ---%n%n")
                + String.format("Number of demoted FATAL reports  : %5d%n", stats.getDemoted(Severity.FATAL))
                + String.format("Number of demoted ERROR reports  : %5d%n", stats.getDemoted(Severity.ERROR))
                + String.format("Number of demoted WARNING reports: %5d%n", stats.getDemoted(Severity.WARNING))
                + String.format("Number of caught FATAL reports   : %5d%n", stats.getCaught(Severity.FATAL))
                + String.format("Number of caught ERROR reports   : %5d%n", stats.getCaught(Severity.ERROR))
                + String.format("Number of caught WARNING reports : %5d%n", stats.getCaught(Severity.WARNING));
    }

    // =========== Internals

    private void logReport(ReportMessage message, String composedText) {
        MDC.put(MDC_REPORT_ID, message.getId());
        MDC.put(MDC_REPORT_SEVERITY, message.getSeverity().name());
        try {
            switch (message.getSeverity()) {
                case INFO:
                    log.info(composedText);
                    break;
                case WARNING:
                    log.warn(composedText);
                    break;
                default:
                    log.error(composedText);
            }
        }
        finally {
            MDC.remove(MDC_REPORT_ID);
            MDC.remove(MDC_REPORT_SEVERITY);
        }
    }

    private static void displayThroughSlf4j(ReportMessage message, String composedText) {
        switch (message.getSeverity()) {
            case INFO:
                displayLog.info(composedText);
                break;
            case WARNING:
                displayLog.warn(composedText);
                break;
            default:
                displayLog.error(composedText);
        }
    }

    private static void defaultStop(ReportMessage message) {
        log.warn(LOG_PREFIX + "STOP requested by report [" + message.getId() + "] - no stop handler installed,"
                + " continuing.");
    }

    private static void defaultExit(ReportMessage message) {
        throw new ReportExitException("EXIT requested by report [" + message.getSeverity() + ":" + message.getId()
                + "]: " + message.getText(), message);
    }

    // =========== Config

    /**
     * Provides for both configuring the server, and introspecting the configuration. Defaults are taken from System
     * Properties where they exist.
     */
    public interface ServerConfig {
        String getName();

        /**
         * Reports with a verbosity above this are not emitted, unless overridden per id with
         * {@link ReportActionTable#setIdMaxVerbosity(String, int)}. Default is {@link ReportVerbosity#MEDIUM}, or
         * System Property "reportcatch.maxVerbosity".
         */
        int getMaxVerbosity();

        ServerConfig setMaxVerbosity(int maxVerbosity);

        /**
         * The number of {@link ReportAction#COUNT counted} reports after which the exit handler is invoked. 0 means
         * unlimited, which is the default unless System Property "reportcatch.maxQuitCount" is set.
         */
        int getMaxQuitCount();

        ServerConfig setMaxQuitCount(int maxQuitCount);

        /**
         * @return the {@link CatchDebugFlags} of the catcher chain. Default is none, or System Property
         *         "reportcatch.catcherDebugFlags".
         */
        int getCatcherDebugFlags();

        ServerConfig setCatcherDebugFlags(int catcherDebugFlags);
    }

    private class ServerConfigImpl implements ServerConfig {
        private final String _name;
        private volatile int _maxVerbosity;
        private volatile int _maxQuitCount;

        ServerConfigImpl(String name) {
            _name = name;
            _maxVerbosity = Integer.parseInt(System.getProperty(SYSPROP_MAX_VERBOSITY,
                    Integer.toString(ReportVerbosity.MEDIUM)));
            setMaxQuitCount(Integer.parseInt(System.getProperty(SYSPROP_MAX_QUIT_COUNT, "0")));
            setCatcherDebugFlags(Integer.parseInt(System.getProperty(SYSPROP_CATCHER_DEBUG_FLAGS, "0")));
        }

        @Override
        public String getName() {
            return _name;
        }

        @Override
        public int getMaxVerbosity() {
            return _maxVerbosity;
        }

        @Override
        public ServerConfig setMaxVerbosity(int maxVerbosity) {
            _maxVerbosity = maxVerbosity;
            return this;
        }

        @Override
        public int getMaxQuitCount() {
            return _maxQuitCount;
        }

        @Override
        public ServerConfig setMaxQuitCount(int maxQuitCount) {
            if (maxQuitCount < 0) {
                throw new IllegalArgumentException("maxQuitCount must be >= 0, was [" + maxQuitCount + "]");
            }
            _maxQuitCount = maxQuitCount;
            return this;
        }

        @Override
        public int getCatcherDebugFlags() {
            return _catchChainExecutor.getDebugFlags();
        }

        @Override
        public ServerConfig setCatcherDebugFlags(int catcherDebugFlags) {
            _catchChainExecutor.setDebugFlags(catcherDebugFlags);
            return this;
        }
    }

    @Override
    public String toString() {
        return "ReportServer[" + _serverConfig.getName() + "]@" + Integer.toHexString(System.identityHashCode(
                this));
    }
}
