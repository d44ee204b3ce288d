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

/**
 * <b>Implement this interface to intercept reports</b>, then register with
 * {@link CatcherRegistry#addCatcher(String, ReportCatcher)}.
 * <p/>
 * The catcher is invoked for every report passing the chain, in registration order, and may inspect and modify the
 * report through the supplied {@link CatchContext}. Modifications are visible to every catcher invoked later in the
 * same pass, and to the emission if the report is not caught.
 * <p/>
 * A catcher shall not hold per-report state between invocations, and must not block: the chain pass holds a lock
 * for its duration.
 */
@FunctionalInterface
public interface ReportCatcher {
    /**
     * @param context
     *            the context of the current chain pass, only valid for the duration of this invocation.
     * @return {@link CatchDecision#THROW} to pass the report on, or {@link CatchDecision#CAUGHT} to stop it. Returning
     *         <code>null</code> is a contract violation: it is reported, and treated as THROW.
     */
    CatchDecision catchReport(CatchContext context);
}
