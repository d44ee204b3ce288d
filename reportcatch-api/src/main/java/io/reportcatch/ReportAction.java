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

import java.util.StringJoiner;

/**
 * The action bitmask of a report, deciding what the emission subsystem does with a report that was not caught. The
 * bits are independent and may be combined with <code>|</code>; {@link #NO_ACTION} is the empty mask.
 */
public final class ReportAction {
    private ReportAction() {
        /* constants only */
    }

    public static final int NO_ACTION = 0;

    /**
     * Write the composed text to the resolved {@link ReportSink destination}.
     */
    public static final int DISPLAY = 1;

    /**
     * Write the composed text to the SLF4J log, at a level derived from the severity.
     */
    public static final int LOG = 2;

    /**
     * Count the report towards the per-severity and per-id counts, possibly reaching the max quit count.
     */
    public static final int COUNT = 4;

    /**
     * Invoke the exit handler, which by default terminates the current operation by throwing.
     */
    public static final int EXIT = 8;

    /**
     * Invoke {@link ReportObject#reportHook(ReportMessage)} on the owning report object.
     */
    public static final int CALL_HOOK = 16;

    /**
     * Invoke the stop handler.
     */
    public static final int STOP = 32;

    static final int ALL_BITS = DISPLAY | LOG | COUNT | EXIT | CALL_HOOK | STOP;

    /**
     * @return whether the <code>action</code> mask has all bits of <code>bit</code> set.
     */
    public static boolean has(int action, int bit) {
        return (action & bit) == bit;
    }

    /**
     * @return whether the <code>action</code> only consists of known bits.
     */
    public static boolean isValid(int action) {
        return (action & ~ALL_BITS) == 0;
    }

    /**
     * @return a human readable rendition of the mask, e.g. <code>"DISPLAY|COUNT"</code>, or <code>"NO_ACTION"</code>.
     */
    public static String toString(int action) {
        if (action == NO_ACTION) {
            return "NO_ACTION";
        }
        StringJoiner joiner = new StringJoiner("|");
        if (has(action, DISPLAY)) {
            joiner.add("DISPLAY");
        }
        if (has(action, LOG)) {
            joiner.add("LOG");
        }
        if (has(action, COUNT)) {
            joiner.add("COUNT");
        }
        if (has(action, EXIT)) {
            joiner.add("EXIT");
        }
        if (has(action, CALL_HOOK)) {
            joiner.add("CALL_HOOK");
        }
        if (has(action, STOP)) {
            joiner.add("STOP");
        }
        int unknown = action & ~ALL_BITS;
        if (unknown != 0) {
            joiner.add("0x" + Integer.toHexString(unknown));
        }
        return joiner.toString();
    }
}
