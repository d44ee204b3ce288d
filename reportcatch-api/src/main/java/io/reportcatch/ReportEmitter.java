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
 * The emission subsystem, as seen from the catcher chain: the chain consults it for default actions, and uses it to
 * emit reports directly, bypassing the chain.
 */
public interface ReportEmitter extends ActionResolver {
    /**
     * @return whether a report with the given verbosity, severity and id is to be emitted at all.
     */
    boolean isEmissionEnabled(int verbosity, Severity severity, String id);

    /**
     * @return the single-line text of the report, as it will be displayed and logged.
     */
    String composeText(ReportMessage message);

    /**
     * Executes the actions of the report, e.g. displaying, logging and counting it.
     */
    void execute(ReportMessage message, String composedText);

    /**
     * The ordinary emission entry point: builds a report, runs it through the catcher chain, and emits it unless
     * caught. If invoked while a chain pass is in progress on the current thread, the report bypasses the chain.
     *
     * @param reportObject
     *            the owning report object, or <code>null</code>.
     */
    void report(Severity severity, String id, String text, int verbosity, ReportObject reportObject);
}
