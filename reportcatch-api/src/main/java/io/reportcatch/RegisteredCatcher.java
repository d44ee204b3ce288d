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
 * The registration of a {@link ReportCatcher} in the {@link CatcherRegistry}. Enabling or disabling never changes the
 * position of the catcher in the chain.
 */
public interface RegisteredCatcher {
    String getName();

    /**
     * @return the report object this catcher is registered for, or <code>null</code> if registered for all.
     */
    ReportObject getOwner();

    ReportCatcher getCatcher();

    boolean isEnabled();

    /**
     * A disabled catcher is skipped without being invoked, and does not affect any counts.
     */
    void setEnabled(boolean enabled);

    /**
     * @return whether this registration applies to reports issued by the given report object, which is the case if
     *         registered for all objects, or for this specific object.
     */
    default boolean appliesTo(ReportObject reportObject) {
        ReportObject owner = getOwner();
        return owner == null || owner == reportObject;
    }
}
