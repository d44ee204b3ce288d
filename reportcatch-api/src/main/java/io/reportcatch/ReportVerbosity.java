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
 * Standard verbosity levels. A report is only emitted if its verbosity is less than or equal to the configured max
 * verbosity - thus {@link #NONE} is always emitted, while {@link #DEBUG} typically is not. Any integer is a legal
 * verbosity, these are just the customary steps.
 */
public final class ReportVerbosity {
    private ReportVerbosity() {
        /* constants only */
    }

    public static final int NONE = 0;
    public static final int LOW = 100;
    public static final int MEDIUM = 200;
    public static final int HIGH = 300;
    public static final int FULL = 400;
    public static final int DEBUG = 500;
}
