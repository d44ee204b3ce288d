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

package io.reportcatch.catchers;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Predicate;

import io.reportcatch.ReportMessage;
import io.reportcatch.Severity;

/**
 * Selects the reports a catcher acts on. Combine with {@link #and(Predicate)} / {@link #or(Predicate)}.
 */
@FunctionalInterface
public interface ReportMatcher extends Predicate<ReportMessage> {

    static ReportMatcher any() {
        return message -> true;
    }

    /**
     * @return a matcher matching reports whose id is exactly one of the given.
     */
    static ReportMatcher idIn(String... ids) {
        Set<String> idSet = new HashSet<>(Arrays.asList(ids));
        return message -> idSet.contains(message.getId());
    }

    static ReportMatcher idStartsWith(String prefix) {
        if (prefix == null) {
            throw new NullPointerException("prefix");
        }
        return message -> message.getId().startsWith(prefix);
    }

    static ReportMatcher textContains(String fragment) {
        if (fragment == null) {
            throw new NullPointerException("fragment");
        }
        return message -> message.getText().contains(fragment);
    }

    static ReportMatcher severityIs(Severity severity) {
        if (severity == null) {
            throw new NullPointerException("severity");
        }
        return message -> message.getSeverity() == severity;
    }

    @Override
    default ReportMatcher and(Predicate<? super ReportMessage> other) {
        return message -> test(message) && other.test(message);
    }

    @Override
    default ReportMatcher or(Predicate<? super ReportMessage> other) {
        return message -> test(message) || other.test(message);
    }
}
