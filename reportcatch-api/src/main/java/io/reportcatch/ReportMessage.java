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

/**
 * Read-only view of a report being evaluated. While a catcher chain pass is running, the values reflect every
 * mutation done by the catchers invoked so far in that pass; outside a pass, the last committed values are returned.
 * Mutation is only possible through the {@link CatchContext} handed to a {@link ReportCatcher}.
 */
public interface ReportMessage {
    Severity getSeverity();

    String getId();

    String getText();

    int getVerbosity();

    /**
     * @return the {@link ReportAction} bitmask.
     */
    int getAction();

    /**
     * @return the context string, typically the hierarchical scope the report concerns. Empty if not set.
     */
    String getContext();

    /**
     * @return the source file the report was issued from, or empty if unknown.
     */
    String getFile();

    /**
     * @return the source line the report was issued from, or 0 if unknown.
     */
    int getLine();

    /**
     * @return the owning report object, or <code>null</code> if the report was issued without one.
     */
    ReportObject getReportObject();

    /**
     * @return an unmodifiable snapshot of the attached attributes, in the order they were added.
     */
    List<ReportAttribute> getAttributes();
}
