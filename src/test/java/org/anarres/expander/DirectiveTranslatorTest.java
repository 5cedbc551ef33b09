package org.anarres.expander;

import java.io.StringReader;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.io.IOUtils;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DirectiveTranslatorTest {

    private static final Path PATH = Paths.get("/work/src/util.h").toAbsolutePath();

    private static List<DirectiveLine> translateLines(String text) throws ExpanderException {
        DirectiveTranslator translator = new DirectiveTranslator(PATH,
                new LineReader(IOUtils.lineIterator(new StringReader(text))));
        List<DirectiveLine> lines = new ArrayList<>();
        for (DirectiveLine line = translator.next(); line != null; line = translator.next())
            lines.add(line);
        return lines;
    }

    /* Directives as canonical text, plain code as trimmed source. */
    private static List<String> translate(String text) throws ExpanderException {
        List<String> result = new ArrayList<>();
        for (DirectiveLine line : translateLines(text)) {
            if (line.getDirective() != null)
                result.add(line.getDirective().toString());
            else
                result.add(line.getText().trim());
        }
        return result;
    }

    @Test
    void elifBecomesElseIfWithExtraEndif() throws Exception {
        List<DirectiveLine> lines = translateLines(
                "#if A\na\n#elif B\nb\n#else\nc\n#endif\n");

        List<String> text = new ArrayList<>();
        for (DirectiveLine line : lines)
            text.add(line.getText());
        assertThat(text).containsExactly(
                "#if A\n", "a\n", "#else\n", "#if B\n", "b\n", "#else\n", "c\n", "#endif\n", "#endif\n");
        assertThat(lines.get(2).isSynthetic()).isTrue();
        assertThat(lines.get(3).isSynthetic()).isTrue();
        assertThat(lines.get(7).isSynthetic()).isFalse();
        assertThat(lines.get(8).isSynthetic()).isTrue();
    }

    @Test
    void elifChainOwesOneEndifPerElif() throws Exception {
        List<String> lines = translate("#if A\n#elif B\n#elif C\n#endif\n");

        assertThat(lines).containsExactly(
                "#if A", "#else", "#if B", "#else", "#if C", "#endif", "#endif", "#endif");
    }

    @Test
    void nestedBlockInsideElifKeepsItsOwnEndif() throws Exception {
        List<String> lines = translate("#if A\n#elif B\n#ifdef X\n#endif\n#endif\n");

        assertThat(lines).containsExactly(
                "#if A", "#else", "#if B", "#ifdef X", "#endif", "#endif", "#endif");
    }

    @Test
    void definedTestsBecomeIfdefAndIfndef() throws Exception {
        assertThat(translate("#if defined(FOO)\n#endif\n")).containsExactly("#ifdef FOO", "#endif");
        assertThat(translate("#if defined FOO\n#endif\n")).containsExactly("#ifdef FOO", "#endif");
        assertThat(translate("#if !defined(FOO)\n#endif\n")).containsExactly("#ifndef FOO", "#endif");
        assertThat(translate("#if (!(defined( FOO )))\n#endif\n")).containsExactly("#ifndef FOO", "#endif");
        assertThat(translate("#if 0\n#elif defined(BAR)\n#endif\n"))
                .containsExactly("#if 0", "#else", "#ifdef BAR", "#endif", "#endif");
    }

    @Test
    void compoundExpressionsAreLeftAlone() throws Exception {
        assertThat(translate("#if defined(A) && defined(B)\n#endif\n"))
                .containsExactly("#if defined(A) && defined(B)", "#endif");
        assertThat(translate("#if (A) || (B)\n#endif\n"))
                .containsExactly("#if (A) || (B)", "#endif");
    }

    @Test
    void rewrittenDirectiveKeepsItsSourceText() throws Exception {
        List<DirectiveLine> lines = translateLines("#if defined(FOO) // why\n#endif\n");

        assertThat(lines.get(0).getDirective().getCommand()).isEqualTo(DirectiveCommand.PP_IFDEF);
        assertThat(lines.get(0).getText()).isEqualTo("#if defined(FOO) // why\n");
    }

    @Test
    void pragmaOnceBecomesGuard() throws Exception {
        String guard = DirectiveTranslator.guardName(PATH);

        assertThat(translate("#pragma once\nint helper();\n"))
                .containsExactly("#ifndef " + guard, "#define " + guard, "int helper();", "#endif");
    }

    @Test
    void repeatedPragmaOnceIsIgnored() throws Exception {
        String guard = DirectiveTranslator.guardName(PATH);

        assertThat(translate("#pragma once\n#pragma once\nx\n"))
                .containsExactly("#ifndef " + guard, "#define " + guard, "x", "#endif");
    }

    @Test
    void pragmaOnceInsideConditionalIsDropped() throws Exception {
        assertThat(translate("#ifdef X\n#pragma once\n#endif\n")).containsExactly("#ifdef X", "#endif");
    }

    @Test
    void otherPragmasPassThrough() throws Exception {
        List<DirectiveLine> lines = translateLines("#pragma GCC optimize(\"O3\")\n");

        assertThat(lines).hasSize(1);
        assertThat(lines.get(0).getText()).isEqualTo("#pragma GCC optimize(\"O3\")\n");
    }

    @Test
    void unbalancedConditionalsAreFatal() {
        assertThatThrownBy(() -> translate("#endif\n"))
                .isInstanceOf(ExpanderException.class)
                .hasMessageContaining("#endif without #if");
        assertThatThrownBy(() -> translate("#else\n"))
                .isInstanceOf(ExpanderException.class)
                .hasMessageContaining("#else without #if");
        assertThatThrownBy(() -> translate("x\n#elif A\n"))
                .isInstanceOf(ExpanderException.class)
                .hasMessageContaining(":2:");
        assertThatThrownBy(() -> translate("#ifdef A\n"))
                .isInstanceOf(ExpanderException.class)
                .hasMessageContaining("Unterminated");
    }

    @Test
    void guardNameIsDeterministicPerPath() {
        String guard = DirectiveTranslator.guardName(PATH);

        assertThat(guard).startsWith(DirectiveTranslator.GUARD_PREFIX);
        assertThat(guard).hasSize(DirectiveTranslator.GUARD_PREFIX.length() + 16);
        assertThat(guard).matches("[A-Z0-9_]+");
        assertThat(DirectiveTranslator.guardName(Paths.get(PATH.toString()))).isEqualTo(guard);
        assertThat(DirectiveTranslator.guardName(PATH.resolveSibling("other.h"))).isNotEqualTo(guard);
    }
}
