/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.cpptree;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * Pure text helpers for directive lines.
 *
 * None of these methods throw on malformed input; callers decide
 * what a missing keyword means.
 */
public final class Directives {

    private static final Pattern IDENTIFIER_PREFIX = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern CONTINUATION = Pattern.compile("\\\\\r?\n");

    private Directives() {
    }

    /**
     * Returns the text following the leading <code>#</code>, with the
     * whitespace on both sides of the <code>#</code> removed.
     *
     * @return null if the first non-whitespace character is not <code>#</code>.
     */
    @CheckForNull
    /* pp */ static String afterHash(@CheckForNull String raw) {
        if (raw == null)
            return null;
        String s = stripLeading(raw);
        if (s.isEmpty() || s.charAt(0) != '#')
            return null;
        return stripLeading(s.substring(1));
    }

    /**
     * Extracts the directive keyword from a raw directive line.
     *
     * <code>"#define X 1"</code>, <code>"  #  define X"</code> both
     * yield <code>"define"</code>. The keyword is the longest leading
     * C identifier after the <code>#</code>, so <code>"#else//x"</code>
     * yields <code>"else"</code>.
     *
     * @return the keyword, the empty string if no identifier follows
     *  the <code>#</code>, or null if there is no <code>#</code>.
     */
    @CheckForNull
    public static String keyword(@CheckForNull String raw) {
        String s = afterHash(raw);
        if (s == null)
            return null;
        Matcher m = IDENTIFIER_PREFIX.matcher(s);
        return m.find() ? m.group() : "";
    }

    /**
     * Returns the command named by the raw line, or null if the line is
     * not a directive or names an unknown command.
     */
    @CheckForNull
    public static PreprocessorCommand command(@CheckForNull String raw) {
        String kw = keyword(raw);
        if (kw == null || kw.isEmpty())
            return null;
        return PreprocessorCommand.forText(kw);
    }

    /**
     * Returns everything after the keyword, with line continuations
     * removed and surrounding whitespace trimmed.
     *
     * @return the argument text, or null if the raw line has no keyword.
     */
    @CheckForNull
    public static String argument(@CheckForNull String raw) {
        String s = afterHash(raw);
        if (s == null)
            return null;
        Matcher m = IDENTIFIER_PREFIX.matcher(s);
        if (!m.find())
            return null;
        return strip(joinContinuations(s.substring(m.end())));
    }

    /**
     * Returns true if the whole string is a C identifier.
     */
    public static boolean isIdentifier(@CheckForNull String text) {
        return text != null && IDENTIFIER.matcher(text).matches();
    }

    /**
     * Returns the C identifier at the start of the string, or the
     * empty string.
     */
    @Nonnull
    public static String leadingIdentifier(@Nonnull String text) {
        Matcher m = IDENTIFIER_PREFIX.matcher(text);
        return m.find() ? m.group() : "";
    }

    /**
     * Deletes backslash-newline sequences.
     */
    @Nonnull
    public static String joinContinuations(@Nonnull String text) {
        return CONTINUATION.matcher(text).replaceAll("");
    }

    /**
     * Returns true if the string is null or contains only whitespace.
     */
    public static boolean isBlank(@CheckForNull String text) {
        return text == null || strip(text).isEmpty();
    }

    /**
     * Returns true for any Unicode whitespace or space separator,
     * including the no-break spaces which Character.isWhitespace
     * excludes.
     */
    public static boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    /**
     * Removes leading and trailing {@link #isSpace(char) spaces}.
     */
    @Nonnull
    public static String strip(@Nonnull String s) {
        int end = s.length();
        while (end > 0 && isSpace(s.charAt(end - 1)))
            end--;
        return stripLeading(s.substring(0, end));
    }

    @Nonnull
    private static String stripLeading(@Nonnull String s) {
        int i = 0;
        while (i < s.length() && isSpace(s.charAt(i)))
            i++;
        return s.substring(i);
    }
}
