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
 * Handed to {@link ReportCatcher#catchReport(CatchContext)}: a live view of the report currently in flight, with the
 * ability to modify it. Every modification is immediately visible to the catchers invoked later in the same chain
 * pass.
 * <p/>
 * The context is only valid during the catcher invocation it was handed to, on the thread running the chain pass. Any
 * method invoked outside of that will throw {@link IllegalStateException}. The {@link ReportMessage} instance held
 * by the issuer of the report keeps the committed values after the pass.
 */
public interface CatchContext extends ReportMessage {
    /**
     * @return the name the currently invoked catcher was registered with.
     */
    String getCatcherName();

    /**
     * @return a read view of the report currently in flight, with the same values as the accessors on this context,
     *         and with the same validity: it may not be retained past the invocation.
     */
    ReportMessage getMessage();

    /**
     * Changes the severity. Unless {@link #setAction(int)} is also invoked in the same catcher invocation, the action
     * will follow the severity change if it was still at the default action for the previous severity.
     */
    CatchContext setSeverity(Severity severity);

    CatchContext setId(String id);

    CatchContext setText(String text);

    CatchContext setVerbosity(int verbosity);

    /**
     * Sets the {@link ReportAction} bitmask explicitly - this disables the automatic recomputation of the action on
     * severity change for the current catcher invocation.
     */
    CatchContext setAction(int action);

    CatchContext setContext(String context);

    CatchContext addIntAttribute(String name, long value);

    CatchContext addStringAttribute(String name, String value);

    CatchContext addObjectAttribute(String name, Object value);

    /**
     * Emits the report in its current state immediately, bypassing the rest of the chain, if emission is enabled for
     * its verbosity, severity and id. The chain still continues according to the returned decision, so the
     * catcher will typically return {@link CatchDecision#CAUGHT} after issuing, to avoid a double emission.
     */
    void issue();

    /**
     * Issues a new report on behalf of the catcher. Since a chain pass is in progress, this report bypasses the
     * catcher chain entirely and is never caught.
     */
    void reportInfo(String id, String text, int verbosity);

    void reportWarning(String id, String text);

    void reportError(String id, String text);

    void reportFatal(String id, String text);
}
