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
 * Resolves the default {@link ReportAction} bitmask for a report.
 */
public interface ActionResolver {
    /**
     * Key which resolves to the default action of the severity itself, ignoring any per-id configuration. It is not a
     * legal report id.
     */
    String SEVERITY_DEFAULT_KEY = "<severity-default>";

    /**
     * @param severity
     *            the severity of the report.
     * @param id
     *            the id of the report, or {@link #SEVERITY_DEFAULT_KEY} to get the severity's default action.
     * @return the action bitmask that a report with this severity and id gets when issued.
     */
    int getDefaultAction(Severity severity, String id);
}
