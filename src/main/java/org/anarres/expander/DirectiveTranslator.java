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

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes the directive stream of one file.
 *
 * The output contains no #elif and no #pragma once:
 * <ul>
 * <li>#elif E becomes #else, #if E; the enclosing block then owes
 * one more #endif, emitted after its real #endif.
 * <li>#if defined(X) and #if !defined(X) become #ifdef X and #ifndef X.
 * <li>The first top-level #pragma once becomes #ifndef G, #define G
 * where G is derived from the file path, and a closing #endif is
 * emitted at the end of the file.
 * </ul>
 */
public class DirectiveTranslator {

    private static final Logger LOG = LoggerFactory.getLogger(DirectiveTranslator.class);

    public static final String GUARD_PREFIX = "CPP_EXPANDER_ONCE_";

    private static final Pattern DEFINED = Pattern.compile(
            "^defined\\s*(?:\\(\\s*([A-Za-z_]\\w*)\\s*\\)|\\s+([A-Za-z_]\\w*))$");

    private final Path path;
    private final LineReader reader;
    private final DirectiveParser parser;

    /* One entry per open block: the number of extra #endifs it owes. */
    private final Deque<Integer> blocks = new ArrayDeque<Integer>();
    private final Deque<DirectiveLine> pending = new ArrayDeque<DirectiveLine>();
    private boolean guarded = false;
    private boolean finished = false;
    private int lastLine = 0;

    /**
     * @param path the resolved absolute path of the file, which keys
     * the guard synthesized for #pragma once.
     */
    public DirectiveTranslator(@Nonnull Path path, @Nonnull LineReader reader) {
        this.path = path;
        this.reader = reader;
        this.parser = new DirectiveParser(path.toString());
    }

    /**
     * Returns the next normalized line, or null at the end of the file.
     *
     * @throws ExpanderException if a directive is malformed or the
     * conditional structure is unbalanced.
     */
    @CheckForNull
    public DirectiveLine next()
            throws ExpanderException {
        while (pending.isEmpty()) {
            if (finished)
                return null;
            LogicalLine line = reader.readLine();
            if (line == null)
                finish();
            else
                translate(line);
        }
        return pending.poll();
    }

    private void translate(@Nonnull LogicalLine line)
            throws ExpanderException {
        lastLine = line.getLine();
        Directive directive = parser.parse(line);
        if (directive == null) {
            pending.add(DirectiveLine.read(line, null));
            return;
        }

        switch (directive.getCommand()) {
            case PP_IF:
                blocks.push(0);
                pending.add(DirectiveLine.read(line, rewriteDefined((Directive.If) directive)));
                break;
            case PP_IFDEF:
            case PP_IFNDEF:
                blocks.push(0);
                pending.add(DirectiveLine.read(line, directive));
                break;
            case PP_ELIF:
                if (blocks.isEmpty())
                    throw new ExpanderException(path.toString(), line.getLine(),
                            "#" + "elif without #" + "if");
                blocks.push(blocks.pop() + 1);
                pending.add(DirectiveLine.synthetic(new Directive.Else(), line.getLine()));
                pending.add(DirectiveLine.synthetic(
                        rewriteDefined(new Directive.If(((Directive.Elif) directive).getExpression())),
                        line.getLine()));
                break;
            case PP_ELSE:
                if (blocks.isEmpty())
                    throw new ExpanderException(path.toString(), line.getLine(),
                            "#" + "else without #" + "if");
                pending.add(DirectiveLine.read(line, directive));
                break;
            case PP_ENDIF:
                if (blocks.isEmpty())
                    throw new ExpanderException(path.toString(), line.getLine(),
                            "#" + "endif without #" + "if");
                int owed = blocks.pop();
                pending.add(DirectiveLine.read(line, directive));
                for (int i = 0; i < owed; i++)
                    pending.add(DirectiveLine.synthetic(new Directive.Endif(), line.getLine()));
                break;
            case PP_PRAGMA:
                if (((Directive.Pragma) directive).isOnce())
                    pragma_once(line);
                else
                    pending.add(DirectiveLine.read(line, directive));
                break;
            default:
                pending.add(DirectiveLine.read(line, directive));
                break;
        }
    }

    private void pragma_once(@Nonnull LogicalLine line) {
        if (guarded) {
            LOG.debug("{}:{}: repeated #" + "pragma once ignored", path, line.getLine());
        } else if (!blocks.isEmpty()) {
            LOG.warn("{}:{}: #" + "pragma once inside a conditional block dropped", path, line.getLine());
        } else {
            String guard = guardName(path);
            guarded = true;
            pending.add(DirectiveLine.synthetic(new Directive.Ifndef(guard), line.getLine()));
            pending.add(DirectiveLine.synthetic(new Directive.Define(guard, null, ""), line.getLine()));
        }
    }

    private void finish()
            throws ExpanderException {
        finished = true;
        if (!blocks.isEmpty())
            throw new ExpanderException(path.toString(), lastLine,
                    "Unterminated #" + "if at end of file");
        if (guarded)
            pending.add(DirectiveLine.synthetic(new Directive.Endif(), lastLine));
    }

    /**
     * Rewrites #if defined(X) and #if !defined(X), with any amount of
     * redundant parentheses, into #ifdef X and #ifndef X.
     */
    @Nonnull
    static Directive rewriteDefined(@Nonnull Directive.If directive) {
        String expression = stripParentheses(directive.getExpression());
        boolean negated = false;
        if (expression.startsWith("!")) {
            negated = true;
            expression = stripParentheses(expression.substring(1));
        }
        Matcher m = DEFINED.matcher(expression);
        if (!m.matches())
            return directive;
        String identifier = m.group(1) != null ? m.group(1) : m.group(2);
        if (negated)
            return new Directive.Ifndef(identifier);
        return new Directive.Ifdef(identifier);
    }

    @Nonnull
    private static String stripParentheses(@Nonnull String expression) {
        for (;;) {
            expression = expression.trim();
            if (expression.length() < 2 || expression.charAt(0) != '(')
                return expression;
            int depth = 0;
            for (int i = 0; i < expression.length(); i++) {
                char c = expression.charAt(i);
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                    /* (a) || (b) closes before the end. */
                    if (depth == 0 && i != expression.length() - 1)
                        return expression;
                }
            }
            if (depth != 0)
                return expression;
            expression = expression.substring(1, expression.length() - 1);
        }
    }

    /**
     * Returns the include guard standing in for #pragma once in the
     * given file.
     */
    @Nonnull
    public static String guardName(@Nonnull Path path) {
        byte[] digest;
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            digest = md.digest(path.toString().getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
        StringBuilder buf = new StringBuilder(GUARD_PREFIX);
        for (int i = 0; i < 8; i++)
            buf.append(String.format("%02X", digest[i] & 0xff));
        return buf.toString();
    }
}
