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
 * The severity of a report, totally ordered: {@link #INFO} &lt; {@link #WARNING} &lt; {@link #ERROR} &lt;
 * {@link #FATAL}. A report is <i>demoted</i> if it leaves the catcher chain with a severity strictly less severe than
 * the one it entered with.
 */
public enum Severity {
    INFO,

    WARNING,

    ERROR,

    FATAL;

    /**
     * @return <code>true</code> if this severity is strictly more severe than the other.
     */
    public boolean isMoreSevereThan(Severity other) {
        return compareTo(other) > 0;
    }

    /**
     * @return <code>true</code> if this severity is strictly less severe than the other.
     */
    public boolean isLessSevereThan(Severity other) {
        return compareTo(other) < 0;
    }
}
