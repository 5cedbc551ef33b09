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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.util.TreeSet;
import javax.annotation.Nonnull;
import org.pcollections.HashTreePSet;
import org.pcollections.PSet;

/**
 * Tri-state knowledge of macro names.
 *
 * A name is known to be defined, known to be undefined, or, when it
 * is in neither set, unknown. The sets are persistent, so {@link #copy()}
 * is cheap and copies never observe each other's changes.
 */
public class MacroContext {

    private PSet<String> defined;
    private PSet<String> undefined;

    public MacroContext() {
        this(HashTreePSet.<String>empty(), HashTreePSet.<String>empty());
    }

    private MacroContext(@Nonnull PSet<String> defined, @Nonnull PSet<String> undefined) {
        this.defined = defined;
        this.undefined = undefined;
    }

    @Nonnull
    public MacroState isDefined(@Nonnull String name) {
        if (defined.contains(name))
            return MacroState.DEFINED;
        if (undefined.contains(name))
            return MacroState.UNDEFINED;
        return MacroState.UNKNOWN;
    }

    public void define(@Nonnull String name) {
        defined = defined.plus(name);
        undefined = undefined.minus(name);
    }

    public void undef(@Nonnull String name) {
        undefined = undefined.plus(name);
        defined = defined.minus(name);
    }

    @Nonnull
    public MacroContext copy() {
        return new MacroContext(defined, undefined);
    }

    /**
     * Returns the knowledge common to both contexts: a name keeps its
     * status only where a and b agree on it.
     */
    @Nonnull
    public static MacroContext merge(@Nonnull MacroContext a, @Nonnull MacroContext b) {
        return new MacroContext(intersect(a.defined, b.defined), intersect(a.undefined, b.undefined));
    }

    @Nonnull
    private static PSet<String> intersect(@Nonnull PSet<String> a, @Nonnull PSet<String> b) {
        PSet<String> result = a;
        for (String name : a) {
            if (!b.contains(name))
                result = result.minus(name);
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof MacroContext) {
            MacroContext o = (MacroContext) obj;
            return defined.equals(o.defined) && undefined.equals(o.undefined);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * defined.hashCode() + undefined.hashCode();
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.add("defined", toJson(defined));
        result.add("undefined", toJson(undefined));
        return result;
    }

    @Nonnull
    private static JsonArray toJson(@Nonnull PSet<String> names) {
        JsonArray array = new JsonArray();
        for (String name : new TreeSet<String>(names))
            array.add(new JsonPrimitive(name));
        return array;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
