package me.flobot.bot.domain.handler;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.regex.Pattern;

/**
 * Text matching rules for triggers.
 */
public final class TriggerMatcher {

    private TriggerMatcher() {
    }

    /**
     * Compile a trigger into the pattern used to validate it before it is
     * stored.
     *
     * @throws java.util.regex.PatternSyntaxException
     *             if the trigger cannot be compiled
     */
    public static Pattern compile(String trigger) {
        return Pattern.compile("(?ms)^.*(" + Pattern.quote(trigger) + ").*$");
    }

    /**
     * Check that {@code needle} occurs in {@code haystack} as a whole word.
     *
     * <p>
     * Only the first raw occurrence is considered: it is valid when the
     * character before it (if any) and the character after it (if any) are
     * ASCII whitespace. A later, well delimited occurrence does not count when
     * the first one is glued to other text. Non-ASCII spaces such as U+00A0 are
     * not delimiters.
     */
    public static boolean validMatch(String needle, String haystack) {
        if (needle == null || needle.isEmpty() || haystack == null) {
            return false;
        }

        int start = haystack.indexOf(needle);
        if (start < 0) {
            return false;
        }
        int end = start + needle.length();

        if (start > 0 && !isAsciiWhitespace(haystack.charAt(start - 1))) {
            return false;
        }
        return end >= haystack.length() || isAsciiWhitespace(haystack.charAt(end));
    }

    static boolean isAsciiWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\f' || c == '\r';
    }
}
