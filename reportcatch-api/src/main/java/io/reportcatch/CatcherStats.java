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
 * Counts of reports that the catcher chain demoted or caught, keyed by the severity the report entered the chain
 * with. Only {@link Severity#FATAL}, {@link Severity#ERROR} and {@link Severity#WARNING} are counted - for
 * {@link Severity#INFO} the counts are always zero.
 */
public interface CatcherStats {
    long getDemoted(Severity originalSeverity);

    long getCaught(Severity originalSeverity);

    void countDemoted(Severity originalSeverity);

    void countCaught(Severity originalSeverity);

    /**
     * Sets all counts to zero.
     */
    void reset();
}
