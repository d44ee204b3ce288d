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
 * Debug flags for the catcher chain, intended for test harnesses. Combine with <code>|</code>.
 */
public final class CatchDebugFlags {
    private CatchDebugFlags() {
        /* constants only */
    }

    public static final int NONE = 0;

    /**
     * A catcher returning {@link CatchDecision#CAUGHT} does not stop the chain, and the report is not counted as
     * caught.
     */
    public static final int IGNORE_CATCH = 1;

    /**
     * All modifications a catcher does to the report are reverted after its invocation. Its decision still stands.
     */
    public static final int DISCARD_MUTATIONS = 2;

    public static final int ALL = IGNORE_CATCH | DISCARD_MUTATIONS;
}
