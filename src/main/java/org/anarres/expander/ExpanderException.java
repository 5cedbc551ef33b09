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

import javax.annotation.Nonnull;

/**
 * A fatal error in the structure or syntax of a source file.
 *
 * Raised for malformed directives and for unbalanced conditionals;
 * aborts the whole expansion.
 */
public class ExpanderException extends Exception {

    public ExpanderException(@Nonnull String path, int line, @Nonnull String msg) {
        super("Error at " + path + ":" + line + ": " + msg);
    }
}
