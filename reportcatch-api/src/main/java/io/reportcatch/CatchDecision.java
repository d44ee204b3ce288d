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
 * The outcome of one {@link ReportCatcher} invocation.
 */
public enum CatchDecision {
    /**
     * Pass the report onwards to the next catcher, and eventually to emission.
     */
    THROW,

    /**
     * Stop the chain: the report will not be emitted.
     */
    CAUGHT
}
