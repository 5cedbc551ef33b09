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

import java.util.Collections;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A parsed preprocessor directive.
 *
 * The set of subclasses is closed: each corresponds to exactly one
 * {@link DirectiveCommand}, and callers dispatch on {@link #getCommand()}.
 * {@link #toString()} reconstructs the canonical directive text.
 */
public abstract class Directive {

    private final DirectiveCommand command;

    private Directive(@Nonnull DirectiveCommand command) {
        this.command = command;
    }

    @Nonnull
    public DirectiveCommand getCommand() {
        return command;
    }

    public boolean isIfLike() {
        return command.isIfLike();
    }

    /** The text following the keyword, or the empty string. */
    @Nonnull
    protected abstract String getArgument();

    @Override
    public String toString() {
        String argument = getArgument();
        if (argument.isEmpty())
            return "#" + command.getText();
        return "#" + command.getText() + " " + argument;
    }

    public static final class Include extends Directive {

        private final String target;
        private final boolean quoted;

        public Include(@Nonnull String target, boolean quoted) {
            super(DirectiveCommand.PP_INCLUDE);
            this.target = target;
            this.quoted = quoted;
        }

        /** The file name as written between the delimiters. */
        @Nonnull
        public String getTarget() {
            return target;
        }

        /** True for "file", false for &lt;file&gt;. */
        public boolean isQuoted() {
            return quoted;
        }

        @Override
        protected String getArgument() {
            return quoted ? "\"" + target + "\"" : "<" + target + ">";
        }
    }

    public static final class Define extends Directive {

        private final String identifier;
        private final List<String> parameters;
        private final String body;

        /**
         * @param parameters the parameter list of a function-like macro,
         * or null for an object-like macro.
         */
        public Define(@Nonnull String identifier, @CheckForNull List<String> parameters, @Nonnull String body) {
            super(DirectiveCommand.PP_DEFINE);
            this.identifier = identifier;
            this.parameters = parameters == null ? null : Collections.unmodifiableList(parameters);
            this.body = body;
        }

        @Nonnull
        public String getIdentifier() {
            return identifier;
        }

        public boolean isFunctionLike() {
            return parameters != null;
        }

        @CheckForNull
        public List<String> getParameters() {
            return parameters;
        }

        @Nonnull
        public String getBody() {
            return body;
        }

        @Override
        protected String getArgument() {
            StringBuilder buf = new StringBuilder(identifier);
            if (parameters != null)
                buf.append('(').append(String.join(", ", parameters)).append(')');
            if (!body.isEmpty())
                buf.append(' ').append(body);
            return buf.toString();
        }
    }

    public static final class Undef extends Directive {

        private final String identifier;

        public Undef(@Nonnull String identifier) {
            super(DirectiveCommand.PP_UNDEF);
            this.identifier = identifier;
        }

        @Nonnull
        public String getIdentifier() {
            return identifier;
        }

        @Override
        protected String getArgument() {
            return identifier;
        }
    }

    public static final class Pragma extends Directive {

        private final String pragmaCommand;

        public Pragma(@Nonnull String pragmaCommand) {
            super(DirectiveCommand.PP_PRAGMA);
            this.pragmaCommand = pragmaCommand;
        }

        @Nonnull
        public String getPragmaCommand() {
            return pragmaCommand;
        }

        public boolean isOnce() {
            return "once".equals(pragmaCommand);
        }

        @Override
        protected String getArgument() {
            return pragmaCommand;
        }
    }

    public static final class If extends Directive {

        private final String expression;

        public If(@Nonnull String expression) {
            super(DirectiveCommand.PP_IF);
            this.expression = expression;
        }

        @Nonnull
        public String getExpression() {
            return expression;
        }

        @Override
        protected String getArgument() {
            return expression;
        }
    }

    public static final class Ifdef extends Directive {

        private final String identifier;

        public Ifdef(@Nonnull String identifier) {
            super(DirectiveCommand.PP_IFDEF);
            this.identifier = identifier;
        }

        @Nonnull
        public String getIdentifier() {
            return identifier;
        }

        @Override
        protected String getArgument() {
            return identifier;
        }
    }

    public static final class Ifndef extends Directive {

        private final String identifier;

        public Ifndef(@Nonnull String identifier) {
            super(DirectiveCommand.PP_IFNDEF);
            this.identifier = identifier;
        }

        @Nonnull
        public String getIdentifier() {
            return identifier;
        }

        @Override
        protected String getArgument() {
            return identifier;
        }
    }

    public static final class Elif extends Directive {

        private final String expression;

        public Elif(@Nonnull String expression) {
            super(DirectiveCommand.PP_ELIF);
            this.expression = expression;
        }

        @Nonnull
        public String getExpression() {
            return expression;
        }

        @Override
        protected String getArgument() {
            return expression;
        }
    }

    public static final class Else extends Directive {

        public Else() {
            super(DirectiveCommand.PP_ELSE);
        }

        @Override
        protected String getArgument() {
            return "";
        }
    }

    public static final class Endif extends Directive {

        public Endif() {
            super(DirectiveCommand.PP_ENDIF);
        }

        @Override
        protected String getArgument() {
            return "";
        }
    }
}
