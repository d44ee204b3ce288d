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

import io.reportcatch.ActionResolver;
import io.reportcatch.ReportAction;
import io.reportcatch.ReportSink;
import io.reportcatch.Severity;

/**
 * The configurable {@link ActionResolver}: actions, destinations and max verbosity, each layered as
 * <i>(severity, id)</i> override &gt; <i>id</i> override &gt; <i>severity</i> default.
 * <p/>
 * The {@link ActionResolver#SEVERITY_DEFAULT_KEY} bypasses both override layers, and resolves to the severity
 * default.
 */
public class ReportActionTable implements ActionResolver {
    private final EnumMap<Severity, Integer> _severityActions = new EnumMap<>(Severity.class);
    private final ConcurrentHashMap<String, Integer> _idActions = new ConcurrentHashMap<>();
    private final EnumMap<Severity, ConcurrentHashMap<String, Integer>> _severityIdActions = new EnumMap<>(
            Severity.class);

    private final EnumMap<Severity, ReportSink> _severityDestinations = new EnumMap<>(Severity.class);
    private final ConcurrentHashMap<String, ReportSink> _idDestinations = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, Integer> _idMaxVerbosities = new ConcurrentHashMap<>();

    public ReportActionTable() {
        _severityActions.put(Severity.INFO, ReportAction.DISPLAY);
        _severityActions.put(Severity.WARNING, ReportAction.DISPLAY);
        _severityActions.put(Severity.ERROR, ReportAction.DISPLAY | ReportAction.COUNT);
        _severityActions.put(Severity.FATAL, ReportAction.DISPLAY | ReportAction.EXIT);
        for (Severity severity : Severity.values()) {
            _severityIdActions.put(severity, new ConcurrentHashMap<>());
        }
    }

    @Override
    public int getDefaultAction(Severity severity, String id) {
        if (severity == null) {
            throw new NullPointerException("severity");
        }
        // ?: Asking for the pure severity default?
        if ((id != null) && !SEVERITY_DEFAULT_KEY.equals(id)) {
            // -> No, so check the overrides, most specific first.
            Integer action = _severityIdActions.get(severity).get(id);
            if (action != null) {
                return action;
            }
            action = _idActions.get(id);
            if (action != null) {
                return action;
            }
        }
        synchronized (_severityActions) {
            return _severityActions.get(severity);
        }
    }

    // ===== Actions

    public ReportActionTable setSeverityAction(Severity severity, int action) {
        assertValidAction(action);
        synchronized (_severityActions) {
            _severityActions.put(severity, action);
        }
        return this;
    }

    public ReportActionTable setIdAction(String id, int action) {
        assertValidId(id);
        assertValidAction(action);
        _idActions.put(id, action);
        return this;
    }

    public ReportActionTable setSeverityIdAction(Severity severity, String id, int action) {
        assertValidId(id);
        assertValidAction(action);
        _severityIdActions.get(severity).put(id, action);
        return this;
    }

    /**
     * @return the id-level action override, or <code>null</code> if none.
     */
    public Integer getIdAction(String id) {
        return _idActions.get(id);
    }

    public void removeIdAction(String id) {
        _idActions.remove(id);
    }

    // ===== Destinations

    /**
     * @return the destination for a report, or <code>null</code> if none is configured, meaning the server's default
     *         sink.
     */
    public ReportSink getDestination(Severity severity, String id) {
        ReportSink sink = _idDestinations.get(id);
        if (sink != null) {
            return sink;
        }
        synchronized (_severityDestinations) {
            return _severityDestinations.get(severity);
        }
    }

    public ReportActionTable setSeverityDestination(Severity severity, ReportSink sink) {
        synchronized (_severityDestinations) {
            if (sink == null) {
                _severityDestinations.remove(severity);
            }
            else {
                _severityDestinations.put(severity, sink);
            }
        }
        return this;
    }

    public ReportActionTable setIdDestination(String id, ReportSink sink) {
        assertValidId(id);
        if (sink == null) {
            _idDestinations.remove(id);
        }
        else {
            _idDestinations.put(id, sink);
        }
        return this;
    }

    /**
     * @return the id-level destination override, or <code>null</code> if none.
     */
    public ReportSink getIdDestination(String id) {
        return _idDestinations.get(id);
    }

    // ===== Verbosity

    public ReportActionTable setIdMaxVerbosity(String id, int maxVerbosity) {
        assertValidId(id);
        _idMaxVerbosities.put(id, maxVerbosity);
        return this;
    }

    /**
     * @return the max verbosity for the id, or the given default if no override exists for it.
     */
    public int getMaxVerbosity(String id, int defaultMaxVerbosity) {
        Integer maxVerbosity = _idMaxVerbosities.get(id);
        return maxVerbosity != null ? maxVerbosity : defaultMaxVerbosity;
    }

    private static void assertValidId(String id) {
        if (id == null) {
            throw new NullPointerException("id");
        }
        if (SEVERITY_DEFAULT_KEY.equals(id)) {
            throw new IllegalArgumentException("The id [" + id + "] is reserved for the severity default.");
        }
    }

    private static void assertValidAction(int action) {
        if (!ReportAction.isValid(action)) {
            throw new IllegalArgumentException("Unknown action bits in [0x" + Integer.toHexString(action) + "].");
        }
    }
}
