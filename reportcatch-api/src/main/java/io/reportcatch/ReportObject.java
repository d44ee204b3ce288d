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
 * The object on whose behalf a report is issued, e.g. a component in a hierarchy. Catchers may be registered
 * specifically for one report object, in which case they only see that object's reports (in addition to the
 * catchers registered for all objects).
 */
public interface ReportObject {
    /**
     * @return the full hierarchical name of this report object, used in composed report text.
     */
    String getFullName();

    /**
     * Invoked by the emission subsystem when a report's action contains {@link ReportAction#CALL_HOOK}, before the
     * other actions are executed.
     *
     * @return <code>false</code> to drop the report, so that no further actions are executed.
     */
    default boolean reportHook(ReportMessage message) {
        return true;
    }
}
