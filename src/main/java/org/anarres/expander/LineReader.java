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
package org.anarres.expander;

import java.util.Iterator;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * Assembles physical lines into {@link LogicalLine}s.
 *
 * Comments are stripped from the code text, string and character
 * literals are left alone, and backslash continuations are spliced.
 * The raw text of every physical line is kept so that a logical line
 * can be reproduced unchanged.
 */
public class LineReader {

    private final Iterator<String> lines;
    private int lineNumber = 0;

    /* Scanner state carried across physical lines. */
    private char quote = 0;
    /* The closing )delim" of an open raw string literal. */
    private String rawTerminator = null;
    private boolean inBlockComment = false;
    private boolean inLineComment = false;

    /**
     * @param lines physical lines with their terminators removed.
     */
    public LineReader(@Nonnull Iterator<String> lines) {
        this.lines = lines;
    }

    /**
     * Returns the next logical line, or null at the end of input.
     */
    @CheckForNull
    public LogicalLine readLine() {
        if (!lines.hasNext())
            return null;

        StringBuilder raw = new StringBuilder();
        StringBuilder code = new StringBuilder();
        int start = lineNumber + 1;
        while (lines.hasNext()) {
            String line = lines.next();
            lineNumber++;
            raw.append(line).append('\n');

            int end = continuation(line);
            boolean continued = end >= 0;
            if (!continued)
                end = line.length();
            scan(line, end, code);

            if (rawTerminator != null) {
                code.append('\n');
                continue;
            }
            if (continued || inBlockComment)
                continue;
            /* An unterminated literal does not survive the newline. */
            quote = 0;
            inLineComment = false;
            break;
        }
        inLineComment = false;
        return new LogicalLine(start, raw.toString(), code.toString());
    }

    private void scan(@Nonnull String line, int end, @Nonnull StringBuilder code) {
        for (int p = 0; p < end; p++) {
            char c = line.charAt(p);
            if (inLineComment)
                return;
            if (inBlockComment) {
                if (c == '*' && p + 1 < end && line.charAt(p + 1) == '/') {
                    inBlockComment = false;
                    code.append(' ');
                    p++;
                }
                continue;
            }
            if (rawTerminator != null) {
                if (p + rawTerminator.length() <= end && line.startsWith(rawTerminator, p)) {
                    code.append(rawTerminator);
                    p += rawTerminator.length() - 1;
                    rawTerminator = null;
                } else {
                    code.append(c);
                }
                continue;
            }
            if (quote != 0) {
                code.append(c);
                if (c == '\\' && p + 1 < end) {
                    code.append(line.charAt(++p));
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"':
                    rawTerminator = rawStringTerminator(line, p, end);
                    if (rawTerminator == null)
                        quote = c;
                    code.append(c);
                    break;
                case '\'':
                    if (!isDigitSeparator(line, p, end))
                        quote = c;
                    code.append(c);
                    break;
                case '/':
                    if (p + 1 < end && line.charAt(p + 1) == '*') {
                        inBlockComment = true;
                        p++;
                    } else if (p + 1 < end && line.charAt(p + 1) == '/') {
                        inLineComment = true;
                        return;
                    } else {
                        code.append(c);
                    }
                    break;
                default:
                    code.append(c);
                    break;
            }
        }
    }

    /**
     * Returns the index of a trailing continuation backslash, which may
     * only be followed by whitespace, or -1.
     */
    private static int continuation(@Nonnull String line) {
        int p = line.length() - 1;
        while (p >= 0 && Character.isWhitespace(line.charAt(p)))
            p--;
        if (p >= 0 && line.charAt(p) == '\\')
            return p;
        return -1;
    }

    /**
     * Returns the terminator of a C++11 raw string literal whose opening
     * quote is at p, as in R"x(...)x", or null if the quote opens an
     * ordinary literal.
     */
    @CheckForNull
    private static String rawStringTerminator(@Nonnull String line, int p, int end) {
        int start = p - 1;
        if (start < 0 || line.charAt(start) != 'R')
            return null;
        if (start >= 2 && line.startsWith("u8", start - 2))
            start -= 2;
        else if (start >= 1 && "uUL".indexOf(line.charAt(start - 1)) >= 0)
            start -= 1;
        if (start > 0 && (Character.isLetterOrDigit(line.charAt(start - 1)) || line.charAt(start - 1) == '_'))
            return null;
        int open = line.indexOf('(', p + 1);
        if (open < 0 || open >= end || open - p - 1 > 16)
            return null;
        String delimiter = line.substring(p + 1, open);
        for (int i = 0; i < delimiter.length(); i++) {
            char c = delimiter.charAt(i);
            if (Character.isWhitespace(c) || c == '\\' || c == ')' || c == '"')
                return null;
        }
        return ")" + delimiter + "\"";
    }

    /* C++14 1'000'000 and 0xFF'FF: a quote inside a pp-number. */
    private static boolean isDigitSeparator(@Nonnull String line, int p, int end) {
        if (p == 0 || p + 1 >= end)
            return false;
        if (!Character.isLetterOrDigit(line.charAt(p - 1)) || !Character.isLetterOrDigit(line.charAt(p + 1)))
            return false;
        int q = p - 1;
        while (q > 0) {
            char c = line.charAt(q - 1);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '\'' || c == '.')
                q--;
            else
                break;
        }
        char first = line.charAt(q);
        if (first == '.' && q + 1 < p)
            first = line.charAt(q + 1);
        return Character.isDigit(first);
    }
}
