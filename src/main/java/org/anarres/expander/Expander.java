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

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.pcollections.ConsPStack;
import org.pcollections.PStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inlines local #include files into a single translation unit.
 *
 * Conditional blocks are evaluated against what is known about macro
 * names: a block whose outcome is known is reduced to the taken
 * branch, and a block whose outcome is unknown is kept whole with its
 * directives. Macro values are never expanded.
 *
 * An Expander may be reused; each call to {@link #expand(Path, Writer)}
 * starts from the macros given by {@link #addMacro(String)} and
 * {@link #removeMacro(String)}.
 */
public class Expander {

    private static final Logger LOG = LoggerFactory.getLogger(Expander.class);

    private final List<Path> includePath = new ArrayList<Path>();
    /* Seeded macro states; true for defined, false for undefined. */
    private final Map<String, Boolean> macros = new LinkedHashMap<String, Boolean>();
    private Pattern excludePattern;
    private Charset charset = StandardCharsets.UTF_8;

    /**
     * Returns the mutable list of include roots searched for
     * &lt;bracketed&gt; targets and for unresolved "quoted" ones.
     */
    @Nonnull
    public List<Path> getIncludePath() {
        return includePath;
    }

    /**
     * Sets a pattern which, when found in an include target as written,
     * suppresses expansion of that include. The directive is copied
     * to the output instead.
     */
    public void setExcludePattern(@CheckForNull Pattern excludePattern) {
        this.excludePattern = excludePattern;
    }

    @CheckForNull
    public Pattern getExcludePattern() {
        return excludePattern;
    }

    public void setCharset(@Nonnull Charset charset) {
        this.charset = charset;
    }

    /** Treats the named macro as defined from the start. */
    public void addMacro(@Nonnull String name) {
        macros.put(name, Boolean.TRUE);
    }

    /** Treats the named macro as undefined from the start. */
    public void removeMacro(@Nonnull String name) {
        macros.put(name, Boolean.FALSE);
    }

    @Nonnull
    private MacroContext initialContext() {
        MacroContext context = new MacroContext();
        for (Map.Entry<String, Boolean> e : macros.entrySet()) {
            if (e.getValue())
                context.define(e.getKey());
            else
                context.undef(e.getKey());
        }
        return context;
    }

    /**
     * Expands the given source file and everything it includes.
     *
     * @throws IOException if a file cannot be read or the output written.
     * @throws ExpanderException if any file is malformed.
     */
    public void expand(@Nonnull Path source, @Nonnull Writer out)
            throws IOException,
            ExpanderException {
        Path path = source.toRealPath();
        Expansion expansion = new Expansion(out, new IncludeResolver(includePath), initialContext());
        expansion.expand(path, ConsPStack.<Path>empty());
        out.flush();
    }

    /** Expands the given source file into a String. */
    @Nonnull
    public String expand(@Nonnull Path source)
            throws IOException,
            ExpanderException {
        StringWriter out = new StringWriter();
        expand(source, out);
        return out.toString();
    }

    /**
     * The state of one top-level expansion, threaded through every
     * nested include.
     */
    private class Expansion {

        private final Writer out;
        private final IncludeResolver resolver;
        private MacroContext context;
        private final Deque<ConditionalBlock> blocks = new ArrayDeque<ConditionalBlock>();
        private boolean inUnreachableBlock = false;

        Expansion(@Nonnull Writer out, @Nonnull IncludeResolver resolver, @Nonnull MacroContext context) {
            this.out = out;
            this.resolver = resolver;
            this.context = context;
        }

        /**
         * @param ancestors the files currently being expanded, innermost
         * first; path is skipped if it is one of them.
         */
        void expand(@Nonnull Path path, @Nonnull PStack<Path> ancestors)
                throws IOException,
                ExpanderException {
            if (ancestors.contains(path)) {
                LOG.debug("pp: skipping recursive include of {}", path);
                return;
            }
            PStack<Path> chain = ancestors.plus(path);
            LOG.debug("pp: expanding {}", path);
            try (LineIterator lines = FileUtils.lineIterator(path.toFile(), charset.name())) {
                DirectiveTranslator translator = new DirectiveTranslator(path, new LineReader(lines));
                for (;;) {
                    DirectiveLine line = translator.next();
                    if (line == null)
                        break;
                    process(path, chain, line);
                }
            }
        }

        private void process(@Nonnull Path path, @Nonnull PStack<Path> chain, @Nonnull DirectiveLine line)
                throws IOException,
                ExpanderException {
            Directive directive = line.getDirective();
            if (directive != null) {
                switch (directive.getCommand()) {
                    case PP_IF:
                    case PP_IFDEF:
                    case PP_IFNDEF:
                        open(line, directive);
                        return;
                    case PP_ELSE:
                        else_branch(line);
                        return;
                    case PP_ENDIF:
                        endif(line);
                        return;
                    default:
                        break;
                }
            }

            if (inUnreachableBlock)
                return;

            if (directive == null) {
                write(line);
                return;
            }
            switch (directive.getCommand()) {
                case PP_DEFINE:
                    context.define(((Directive.Define) directive).getIdentifier());
                    write(line);
                    break;
                case PP_UNDEF:
                    context.undef(((Directive.Undef) directive).getIdentifier());
                    write(line);
                    break;
                case PP_INCLUDE:
                    include(path, chain, line, (Directive.Include) directive);
                    break;
                default:
                    write(line);
                    break;
            }
        }

        private void open(@Nonnull DirectiveLine line, @Nonnull Directive directive)
                throws IOException {
            if (inUnreachableBlock) {
                blocks.push(ConditionalBlock.placeholder(directive));
                return;
            }
            MacroState state = evaluate(directive);
            if (state.isKnown()) {
                boolean outcome = state == MacroState.DEFINED;
                if (directive.getCommand() == DirectiveCommand.PP_IFNDEF)
                    outcome = !outcome;
                ConditionalBlock block = ConditionalBlock.determined(directive, outcome);
                blocks.push(block);
                inUnreachableBlock = !outcome;
                LOG.debug("pp: {}", block);
            } else {
                ConditionalBlock block = ConditionalBlock.undetermined(directive, context);
                blocks.push(block);
                context = block.getActiveContext();
                LOG.debug("pp: {}", block);
                write(line);
            }
        }

        /* What is known about the name an #ifdef or #ifndef tests. */
        @Nonnull
        private MacroState evaluate(@Nonnull Directive directive) {
            switch (directive.getCommand()) {
                case PP_IFDEF:
                    return context.isDefined(((Directive.Ifdef) directive).getIdentifier());
                case PP_IFNDEF:
                    return context.isDefined(((Directive.Ifndef) directive).getIdentifier());
                default:
                    /* #if expressions are not evaluated. */
                    return MacroState.UNKNOWN;
            }
        }

        private void else_branch(@Nonnull DirectiveLine line)
                throws IOException {
            ConditionalBlock block = blocks.peek();
            block.enterElse();
            switch (block.getKind()) {
                case UNDETERMINED:
                    context = block.getActiveContext();
                    write(line);
                    break;
                case DETERMINED:
                    inUnreachableBlock = !block.isBranchTaken();
                    break;
                default:
                    break;
            }
        }

        private void endif(@Nonnull DirectiveLine line)
                throws IOException {
            ConditionalBlock block = blocks.pop();
            switch (block.getKind()) {
                case UNDETERMINED:
                    context = block.close();
                    for (ConditionalBlock ancestor : blocks) {
                        if (ancestor.getKind() == ConditionalBlock.Kind.UNDETERMINED) {
                            ancestor.setActiveContext(context);
                            break;
                        }
                    }
                    LOG.debug("pp: after {} context is {}", block.getOpening(), context);
                    write(line);
                    break;
                case DETERMINED:
                    inUnreachableBlock = false;
                    break;
                default:
                    break;
            }
        }

        private void include(@Nonnull Path path, @Nonnull PStack<Path> chain,
                @Nonnull DirectiveLine line, @Nonnull Directive.Include directive)
                throws IOException,
                ExpanderException {
            String target = directive.getTarget();
            if (excludePattern != null && excludePattern.matcher(target).find()) {
                LOG.debug("pp: {} excluded from expansion", target);
                write(line);
                return;
            }
            Path file = resolver.resolve(target, directive.isQuoted() ? path : null);
            if (file == null) {
                LOG.warn("{}:{}: cannot find {}; directive kept", path, line.getLineNumber(), directive);
                write(line);
                return;
            }
            LOG.debug("pp: including {} as {}", target, file);
            expand(file, chain);
        }

        private void write(@Nonnull DirectiveLine line)
                throws IOException {
            out.write(line.getText());
        }
    }
}
