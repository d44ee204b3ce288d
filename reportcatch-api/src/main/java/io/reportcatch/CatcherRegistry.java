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

package io.reportcatch;

import java.util.List;
import java.util.Optional;

/**
 * The ordered collection of {@link ReportCatcher}s. The iteration order is the registration order, and is not
 * affected by enabling or disabling catchers. Catchers are registered for the lifetime of the registry.
 */
public interface CatcherRegistry {
    /**
     * Registers a catcher applying to all reports.
     *
     * @throws IllegalStateException
     *             if the same catcher instance is already registered for all reports.
     */
    RegisteredCatcher addCatcher(String name, ReportCatcher catcher);

    /**
     * Registers a catcher applying only to reports issued by the given report object. <code>null</code> owner means
     * all reports, as with {@link #addCatcher(String, ReportCatcher)}.
     *
     * @throws IllegalStateException
     *             if the same catcher instance is already registered for this owner.
     */
    RegisteredCatcher addCatcher(ReportObject owner, String name, ReportCatcher catcher);

    /**
     * @return all registrations, in registration order.
     */
    List<RegisteredCatcher> getCatchers();

    /**
     * @return the registrations applying to reports from the given report object (<code>null</code> for reports
     *         without an owner), in registration order.
     */
    List<RegisteredCatcher> getCatchersFor(ReportObject reportObject);

    /**
     * Names are not required to be unique: this returns the first registration with the given name. If several
     * registrations share the name, this is logged, and {@link #getCatchers(String)} should be used instead.
     */
    Optional<RegisteredCatcher> getCatcher(String name);

    /**
     * @return all registrations with the given name, in registration order.
     */
    List<RegisteredCatcher> getCatchers(String name);

    /**
     * Enables or disables debug-level tracing of registrations and of every dispatch list lookup.
     */
    void setTracing(boolean tracing);

    /**
     * @return the setting from {@link #setTracing(boolean)}, unaffected by any per-thread suppression.
     */
    boolean isTracing();

    /**
     * Suppresses (or un-suppresses) tracing for the current thread only, leaving {@link #setTracing(boolean)} and
     * other threads alone. Used by the chain executor for the duration of a pass.
     *
     * @return the previous suppression state of the current thread, to be passed back in when done.
     */
    boolean suppressTracingOnCurrentThread(boolean suppressed);

    /**
     * @return a multi-line listing of all registrations, with name, scope and enabled state.
     */
    String describe();
}
