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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * One element of the normalized directive stream.
 *
 * Either a line read from the source, with or without a directive,
 * or a directive synthesized by the {@link DirectiveTranslator}, which
 * has no source line of its own.
 */
public class DirectiveLine {

    private final LogicalLine line;
    private final Directive directive;
    private final int lineNumber;

    private DirectiveLine(@CheckForNull LogicalLine line, @CheckForNull Directive directive, int lineNumber) {
        this.line = line;
        this.directive = directive;
        this.lineNumber = lineNumber;
    }

    /** A line as read, possibly rewritten into an equivalent directive. */
    @Nonnull
    public static DirectiveLine read(@Nonnull LogicalLine line, @CheckForNull Directive directive) {
        return new DirectiveLine(line, directive, line.getLine());
    }

    @Nonnull
    public static DirectiveLine synthetic(@Nonnull Directive directive, int lineNumber) {
        return new DirectiveLine(null, directive, lineNumber);
    }

    /** The directive, or null for plain code. */
    @CheckForNull
    public Directive getDirective() {
        return directive;
    }

    public boolean isSynthetic() {
        return line == null;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Returns the text to write when this line survives: the raw
     * source text, or the canonical text of a synthetic directive.
     */
    @Nonnull
    public String getText() {
        if (line != null)
            return line.getRaw();
        return directive + "\n";
    }

    @Override
    public String toString() {
        return lineNumber + (isSynthetic() ? "* " : ": ") + (directive != null ? directive : line.getCode().trim());
    }
}
