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
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.reportcatch.CatcherRegistry;
import io.reportcatch.RegisteredCatcher;
import io.reportcatch.ReportCatcher;
import io.reportcatch.ReportObject;

/**
 * Default {@link CatcherRegistry}: a single list in registration order, where each registration carries its owner
 * scope. The effective chain for a report object is the registrations for all objects interleaved with the ones for
 * that specific object, still in registration order.
 */
public class CatcherRegistryImpl implements CatcherRegistry, ReportCatchStatics {
    private static final Logger log = LoggerFactory.getLogger(CatcherRegistryImpl.class);

    // ALL *modifications* shall take this sync object. Reads can be done without sync, since the list is COWAL.
    private final Object _stateLockObject = new Object();

    private final CopyOnWriteArrayList<RegisteredCatcherImpl> _registrations = new CopyOnWriteArrayList<>();

    private volatile boolean _tracing;
    private final ThreadLocal<Boolean> _tracingSuppressed = ThreadLocal.withInitial(() -> Boolean.FALSE);

    @Override
    public RegisteredCatcher addCatcher(String name, ReportCatcher catcher) {
        return addCatcher(null, name, catcher);
    }

    @Override
    public RegisteredCatcher addCatcher(ReportObject owner, String name, ReportCatcher catcher) {
        if (name == null) {
            throw new NullPointerException("name");
        }
        if (catcher == null) {
            throw new NullPointerException("catcher");
        }
        synchronized (_stateLockObject) {
            // :: Assert that we don't add the same instance twice to the same scope.
            for (RegisteredCatcherImpl existing : _registrations) {
                if ((existing.getCatcher() == catcher) && (existing.getOwner() == owner)) {
                    throw new IllegalStateException("Cannot add catcher twice to the same scope: name:[" + name
                            + "], scope:[" + scopeName(owner) + "], catcher:[" + catcher + "]");
                }
            }
            RegisteredCatcherImpl registration = new RegisteredCatcherImpl(owner, name, catcher);
            _registrations.add(registration);
            if (isTracingActive()) {
                log.debug(LOG_PREFIX + "Added catcher [" + name + "] for scope [" + scopeName(owner)
                        + "], now [" + _registrations.size() + "] registrations.");
            }
            return registration;
        }
    }

    @Override
    public List<RegisteredCatcher> getCatchers() {
        return new ArrayList<>(_registrations);
    }

    @Override
    public List<RegisteredCatcher> getCatchersFor(ReportObject reportObject) {
        List<RegisteredCatcher> ret = new ArrayList<>();
        for (RegisteredCatcherImpl registration : _registrations) {
            if (registration.appliesTo(reportObject)) {
                ret.add(registration);
            }
        }
        if (isTracingActive()) {
            log.debug(LOG_PREFIX + "Dispatch list for [" + scopeName(reportObject) + "]: " + ret);
        }
        return ret;
    }

    @Override
    public Optional<RegisteredCatcher> getCatcher(String name) {
        List<RegisteredCatcher> matches = getCatchers(name);
        if (matches.size() > 1) {
            log.warn(LOG_PREFIX + "Catcher name [" + name + "] is ambiguous: [" + matches.size()
                    + "] registrations carry it - returning the first registered. Use getCatchers(name) to get all.");
        }
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    @Override
    public List<RegisteredCatcher> getCatchers(String name) {
        if (name == null) {
            throw new NullPointerException("name");
        }
        List<RegisteredCatcher> ret = new ArrayList<>();
        for (RegisteredCatcherImpl registration : _registrations) {
            if (registration.getName().equals(name)) {
                ret.add(registration);
            }
        }
        return ret;
    }

    @Override
    public void setTracing(boolean tracing) {
        _tracing = tracing;
    }

    @Override
    public boolean isTracing() {
        return _tracing;
    }

    @Override
    public boolean suppressTracingOnCurrentThread(boolean suppressed) {
        boolean previous = _tracingSuppressed.get();
        if (suppressed) {
            _tracingSuppressed.set(Boolean.TRUE);
        }
        else {
            _tracingSuppressed.remove();
        }
        return previous;
    }

    /**
     * @return whether tracing is suppressed on the current thread.
     */
    public boolean isTracingSuppressedOnCurrentThread() {
        return _tracingSuppressed.get();
    }

    private boolean isTracingActive() {
        return _tracing && !_tracingSuppressed.get();
    }

    @Override
    public String describe() {
        StringBuilder buf = new StringBuilder();
        buf.append("Registered catchers: ").append(_registrations.size()).append('\n');
        int idx = 0;
        for (RegisteredCatcherImpl registration : _registrations) {
            buf.append(String.format("  #%-3d %-30s scope:%-30s %s%n", idx++, registration.getName(),
                    scopeName(registration.getOwner()), registration.isEnabled() ? "ON" : "OFF"));
        }
        return buf.toString();
    }

    static String scopeName(ReportObject reportObject) {
        return reportObject == null ? "*" : reportObject.getFullName();
    }

    static final class RegisteredCatcherImpl implements RegisteredCatcher {
        private final ReportObject _owner;
        private final String _name;
        private final ReportCatcher _catcher;

        private volatile boolean _enabled = true;

        RegisteredCatcherImpl(ReportObject owner, String name, ReportCatcher catcher) {
            _owner = owner;
            _name = name;
            _catcher = catcher;
        }

        @Override
        public String getName() {
            return _name;
        }

        @Override
        public ReportObject getOwner() {
            return _owner;
        }

        @Override
        public ReportCatcher getCatcher() {
            return _catcher;
        }

        @Override
        public boolean isEnabled() {
            return _enabled;
        }

        @Override
        public void setEnabled(boolean enabled) {
            _enabled = enabled;
        }

        @Override
        public String toString() {
            return _name + "@" + scopeName(_owner) + (_enabled ? "" : "(disabled)");
        }
    }
}
