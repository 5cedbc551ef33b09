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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * Classifies the code text of a logical line.
 */
public class DirectiveParser {

    private static final Pattern DIRECTIVE = Pattern.compile(
            "^\\s*#\\s*([A-Za-z_]\\w*)(.*)$", Pattern.DOTALL);
    private static final Pattern INCLUDE = Pattern.compile(
            "^(?:\"([^\"]*)\"|<([^>]*)>)$");
    private static final Pattern DEFINE = Pattern.compile(
            "^([A-Za-z_]\\w*)(?:\\(([^)]*)\\)\\s*(.*)|(?:\\s+(.*))?)$", Pattern.DOTALL);
    private static final Pattern PARAMETER = Pattern.compile(
            "^(?:[A-Za-z_]\\w*(?:\\s*\\.\\.\\.)?|\\.\\.\\.)$");

    private final String path;

    /**
     * @param path the file being parsed, for error messages.
     */
    public DirectiveParser(@Nonnull String path) {
        this.path = path;
    }

    /**
     * Parses the given logical line.
     *
     * @return the directive, or null if the line is plain code or an
     * unrecognized directive.
     * @throws ExpanderException if a recognized directive is malformed.
     */
    @CheckForNull
    public Directive parse(@Nonnull LogicalLine line)
            throws ExpanderException {
        Matcher m = DIRECTIVE.matcher(line.getCode());
        if (!m.matches())
            return null;
        DirectiveCommand command = DirectiveCommand.forText(m.group(1));
        if (command == null)
            return null;
        String argument = m.group(2).trim();

        switch (command) {
            case PP_INCLUDE:
                return include(line, argument);
            case PP_DEFINE:
                return define(line, argument);
            case PP_UNDEF:
                return new Directive.Undef(identifier(line, command, argument));
            case PP_PRAGMA:
                return new Directive.Pragma(argument);
            case PP_IF:
                return new Directive.If(argument);
            case PP_IFDEF:
                return new Directive.Ifdef(identifier(line, command, argument));
            case PP_IFNDEF:
                return new Directive.Ifndef(identifier(line, command, argument));
            case PP_ELIF:
                return new Directive.Elif(argument);
            case PP_ELSE:
                return new Directive.Else();
            case PP_ENDIF:
                return new Directive.Endif();
            default:
                throw new IllegalStateException("Unhandled directive " + command);
        }
    }

    @Nonnull
    private Directive include(@Nonnull LogicalLine line, @Nonnull String argument)
            throws ExpanderException {
        Matcher m = INCLUDE.matcher(argument);
        if (!m.matches())
            throw new ExpanderException(path, line.getLine(),
                    "Expected \"file\" or <file> after #" + "include, not " + argument);
        if (m.group(1) != null)
            return new Directive.Include(m.group(1), true);
        return new Directive.Include(m.group(2), false);
    }

    @Nonnull
    private Directive define(@Nonnull LogicalLine line, @Nonnull String argument)
            throws ExpanderException {
        Matcher m = DEFINE.matcher(argument);
        if (!m.matches())
            throw new ExpanderException(path, line.getLine(),
                    "Malformed #" + "define " + argument);
        List<String> parameters = null;
        if (m.group(2) != null) {
            parameters = new ArrayList<String>();
            String list = m.group(2).trim();
            if (!list.isEmpty()) {
                for (String parameter : list.split(",", -1)) {
                    parameter = parameter.trim();
                    if (!PARAMETER.matcher(parameter).matches())
                        throw new ExpanderException(path, line.getLine(),
                                "Malformed macro parameter '" + parameter + "' in #" + "define " + argument);
                    parameters.add(parameter);
                }
            }
        }
        /* A function-like body may follow the ')' directly. */
        String body = m.group(3) != null ? m.group(3) : m.group(4);
        body = body == null ? "" : body.trim();
        return new Directive.Define(m.group(1), parameters, body);
    }

    /* #undef, #ifdef and #ifndef: the first token names the macro. */
    @Nonnull
    private String identifier(@Nonnull LogicalLine line, @Nonnull DirectiveCommand command, @Nonnull String argument)
            throws ExpanderException {
        String[] words = argument.split("\\s+", 2);
        if (words[0].isEmpty())
            throw new ExpanderException(path, line.getLine(),
                    "Expected identifier after #" + command.getText());
        return words[0];
    }
}
