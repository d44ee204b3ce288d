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

/**
 * Common "static" stash, hacked up as an interface to be implemented if you need it.
 */
public interface ReportCatchStatics {

    String LOG_PREFIX = "#RPTCATCH# ";

    // ===== MDC properties set while a catcher is being invoked

    String MDC_CATCHER_NAME = "reportcatch.Catcher";

    // ===== MDC properties set on the LOG action's log line

    String MDC_REPORT_ID = "reportcatch.ReportId";
    String MDC_REPORT_SEVERITY = "reportcatch.Severity";

    // ===== Reserved report ids

    /**
     * Id of the error report issued when a catcher returns something else than THROW or CAUGHT.
     */
    String REPORT_ID_INVALID_DECISION = "CATCHER/INVALID_DECISION";

    /**
     * Id of the catcher summary report.
     */
    String REPORT_ID_CATCHER_SUMMARY = "CATCHER/SUMMARY";

    // ===== System properties giving the defaults for the ServerConfig

    String SYSPROP_MAX_VERBOSITY = "reportcatch.maxVerbosity";
    String SYSPROP_MAX_QUIT_COUNT = "reportcatch.maxQuitCount";
    String SYSPROP_CATCHER_DEBUG_FLAGS = "reportcatch.catcherDebugFlags";
}
