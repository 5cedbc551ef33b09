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
 * One open #if, #ifdef or #ifndef on the expander's block stack.
 */
/* pp */ class ConditionalBlock {

    /* pp */ enum Kind {
        /** The outcome was fixed by the context at entry. */
        DETERMINED,
        /** The outcome is unknown; both branches are kept. */
        UNDETERMINED,
        /** Opened inside an unreachable block; only balances the stack. */
        PLACEHOLDER
    }

    private final Kind kind;
    private final Directive opening;
    private final boolean outcome;
    private MacroContext trueBranchContext;
    private MacroContext falseBranchContext;
    private boolean takingElseBranch = false;
    private boolean sawElse = false;

    private ConditionalBlock(@Nonnull Kind kind, @Nonnull Directive opening, boolean outcome,
            @CheckForNull MacroContext trueBranchContext, @CheckForNull MacroContext falseBranchContext) {
        this.kind = kind;
        this.opening = opening;
        this.outcome = outcome;
        this.trueBranchContext = trueBranchContext;
        this.falseBranchContext = falseBranchContext;
    }

    @Nonnull
    /* pp */ static ConditionalBlock determined(@Nonnull Directive opening, boolean outcome) {
        return new ConditionalBlock(Kind.DETERMINED, opening, outcome, null, null);
    }

    @Nonnull
    /* pp */ static ConditionalBlock placeholder(@Nonnull Directive opening) {
        return new ConditionalBlock(Kind.PLACEHOLDER, opening, false, null, null);
    }

    /**
     * Forks the entry context into one context per branch. A tested
     * name becomes known in each fork.
     */
    @Nonnull
    /* pp */ static ConditionalBlock undetermined(@Nonnull Directive opening, @Nonnull MacroContext entry) {
        MacroContext whenTrue = entry.copy();
        MacroContext whenFalse = entry.copy();
        switch (opening.getCommand()) {
            case PP_IFDEF: {
                String name = ((Directive.Ifdef) opening).getIdentifier();
                whenTrue.define(name);
                whenFalse.undef(name);
                break;
            }
            case PP_IFNDEF: {
                String name = ((Directive.Ifndef) opening).getIdentifier();
                whenTrue.undef(name);
                whenFalse.define(name);
                break;
            }
            default:
                break;
        }
        return new ConditionalBlock(Kind.UNDETERMINED, opening, false, whenTrue, whenFalse);
    }

    @Nonnull
    /* pp */ Kind getKind() {
        return kind;
    }

    @Nonnull
    /* pp */ Directive getOpening() {
        return opening;
    }

    /** The fixed outcome of a determined block. */
    /* pp */ boolean getOutcome() {
        return outcome;
    }

    /* pp */ boolean isTakingElseBranch() {
        return takingElseBranch;
    }

    /* pp */ void enterElse() {
        takingElseBranch = !takingElseBranch;
        sawElse = true;
    }

    /** True if the current branch of a determined block is reachable. */
    /* pp */ boolean isBranchTaken() {
        return outcome != takingElseBranch;
    }

    @Nonnull
    /* pp */ MacroContext getActiveContext() {
        return takingElseBranch ? falseBranchContext : trueBranchContext;
    }

    /* pp */ void setActiveContext(@Nonnull MacroContext context) {
        if (takingElseBranch)
            falseBranchContext = context;
        else
            trueBranchContext = context;
    }

    /**
     * Returns the context after the #endif of an undetermined block.
     *
     * An #ifndef X whose true branch defines X and which has no #else
     * is taken to be an include guard: the true branch context is
     * carried forward as is. Anything else keeps only what both
     * branches agree on.
     */
    @Nonnull
    /* pp */ MacroContext close() {
        if (isIncludeGuard())
            return trueBranchContext;
        return MacroContext.merge(trueBranchContext, falseBranchContext);
    }

    /* pp */ boolean isIncludeGuard() {
        if (kind != Kind.UNDETERMINED || sawElse || opening.getCommand() != DirectiveCommand.PP_IFNDEF)
            return false;
        String name = ((Directive.Ifndef) opening).getIdentifier();
        return trueBranchContext.isDefined(name) == MacroState.DEFINED;
    }

    @Override
    public String toString() {
        return kind
                + " " + opening
                + (kind == Kind.DETERMINED ? ", outcome=" + outcome : "")
                + ", else=" + takingElseBranch;
    }
}
