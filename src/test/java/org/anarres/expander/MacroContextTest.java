package org.anarres.expander;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class MacroContextTest {

    @Test
    void namesAreUnknownByDefault() {
        MacroContext context = new MacroContext();

        assertThat(context.isDefined("FOO")).isEqualTo(MacroState.UNKNOWN);
        assertThat(MacroState.UNKNOWN.isKnown()).isFalse();
    }

    @Test
    void defineAndUndefAreMutuallyExclusive() {
        MacroContext context = new MacroContext();

        context.define("FOO");
        assertThat(context.isDefined("FOO")).isEqualTo(MacroState.DEFINED);

        context.undef("FOO");
        assertThat(context.isDefined("FOO")).isEqualTo(MacroState.UNDEFINED);

        context.define("FOO");
        assertThat(context.isDefined("FOO")).isEqualTo(MacroState.DEFINED);
        assertThat(context.toString()).isEqualTo("{\"defined\":[\"FOO\"],\"undefined\":[]}");
    }

    @Test
    void copiesAreIndependent() {
        MacroContext original = new MacroContext();
        original.define("A");
        MacroContext copy = original.copy();

        copy.undef("A");
        copy.define("B");

        assertThat(original.isDefined("A")).isEqualTo(MacroState.DEFINED);
        assertThat(original.isDefined("B")).isEqualTo(MacroState.UNKNOWN);
        assertThat(copy.isDefined("A")).isEqualTo(MacroState.UNDEFINED);
    }

    @Test
    void mergeKeepsOnlyAgreement() {
        MacroContext a = new MacroContext();
        a.define("X");
        a.define("Y");
        a.undef("Z");
        a.define("ONLY_A");
        MacroContext b = new MacroContext();
        b.define("X");
        b.undef("Y");
        b.undef("Z");

        MacroContext merged = MacroContext.merge(a, b);

        assertThat(merged.isDefined("X")).isEqualTo(MacroState.DEFINED);
        assertThat(merged.isDefined("Y")).isEqualTo(MacroState.UNKNOWN);
        assertThat(merged.isDefined("Z")).isEqualTo(MacroState.UNDEFINED);
        assertThat(merged.isDefined("ONLY_A")).isEqualTo(MacroState.UNKNOWN);
        assertThat(MacroContext.merge(b, a)).isEqualTo(merged);
    }
}
