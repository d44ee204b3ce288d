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

package io.reportcatch.impl;

import io.reportcatch.ReportMessage;

/**
 * Base for the exceptions raised by the {@link ReportServer}.
 */
public class ReportServerException extends RuntimeException {
    public ReportServerException(String message) {
        super(message);
    }

    public ReportServerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown by the default exit handler when a report with {@link io.reportcatch.ReportAction#EXIT EXIT} action is
     * emitted, or when the max quit count is reached. Carries the report that caused it.
     */
    public static class ReportExitException extends ReportServerException {
        private final transient ReportMessage _reportMessage;

        public ReportExitException(String message, ReportMessage reportMessage) {
            super(message);
            _reportMessage = reportMessage;
        }

        public ReportMessage getReportMessage() {
            return _reportMessage;
        }
    }
}
