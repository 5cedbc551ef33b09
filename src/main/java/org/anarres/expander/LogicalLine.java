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

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * One logical source line: a run of physical lines joined by
 * backslash continuations or by an open block comment.
 */
public class LogicalLine {

    private final int line;
    private final String raw;
    private final String code;

    public LogicalLine(@Nonnegative int line, @Nonnull String raw, @Nonnull String code) {
        this.line = line;
        this.raw = raw;
        this.code = code;
    }

    /** Returns the physical line number this logical line starts on. */
    @Nonnegative
    public int getLine() {
        return line;
    }

    /**
     * Returns the physical text, terminators included, exactly as it
     * should be reproduced in the output.
     */
    @Nonnull
    public String getRaw() {
        return raw;
    }

    /**
     * Returns the text with comments removed and continuations
     * spliced, as seen by the directive parser.
     */
    @Nonnull
    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return line + ": " + code.trim();
    }
}
