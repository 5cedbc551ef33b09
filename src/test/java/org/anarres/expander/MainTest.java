package org.anarres.expander;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

public class MainTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream stdout;
    private ByteArrayOutputStream stderr;

    @BeforeEach
    void setUp() {
        stdout = new ByteArrayOutputStream();
        stderr = new ByteArrayOutputStream();
    }

    private int run(String environmentIncludePath, String... args) throws Exception {
        PrintStream out = new PrintStream(stdout, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(stderr, true, StandardCharsets.UTF_8);
        return new Main().run(args, out, err, environmentIncludePath);
    }

    private String stdout() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String text) throws Exception {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, text);
        return file;
    }

    @Test
    void writesExpansionToStandardOutput() throws Exception {
        write("util.h", "int util();\n");
        Path source = write("main.cpp", "#include \"util.h\"\nint main() {}\n");

        assertThat(run(null, source.toString())).isEqualTo(Main.EXIT_OK);
        assertThat(stdout()).isEqualTo("int util();\nint main() {}\n");
    }

    @Test
    void writesExpansionToOutputFile() throws Exception {
        write("util.h", "int util();\n");
        Path source = write("main.cpp", "#include \"util.h\"\n");
        Path output = tempDir.resolve("build/expanded.cpp");
        write("build/expanded.cpp", "stale contents that are longer than the new ones\n");

        assertThat(run(null, source.toString(), "--out", output.toString())).isEqualTo(Main.EXIT_OK);
        assertThat(Files.readString(output)).isEqualTo("int util();\n");
        assertThat(stdout()).isEmpty();
    }

    @Test
    void excludeOptionKeepsMatchingIncludes() throws Exception {
        Path source = write("main.cpp", "#include <atcoder/all>\nint x;\n");

        assertThat(run(null, source.toString(), "-e", "^(?:atcoder|boost)/")).isEqualTo(Main.EXIT_OK);
        assertThat(stdout()).isEqualTo("#include <atcoder/all>\nint x;\n");
    }

    @Test
    void includePathComesFromEnvironmentAndOptions() throws Exception {
        write("env/a.h", "from env\n");
        write("opt/b.h", "from option\n");
        Path source = write("src/main.cpp", "#include <a.h>\n#include <b.h>\n");

        int status = run(tempDir.resolve("env").toString(),
                "-I", tempDir.resolve("opt").toString(), source.toString());

        assertThat(status).isEqualTo(Main.EXIT_OK);
        assertThat(stdout()).isEqualTo("from env\nfrom option\n");
    }

    @Test
    void defineAndUndefineSeedMacros() throws Exception {
        Path source = write("main.cpp", "#ifdef A\na\n#endif\n#ifdef B\nb\n#endif\n");

        assertThat(run(null, "-D", "A=1", "--undefine", "B", source.toString())).isEqualTo(Main.EXIT_OK);
        assertThat(stdout()).isEqualTo("a\n");
    }

    @Test
    void fatalErrorProducesNoOutput() throws Exception {
        Path source = write("main.cpp", "int x;\n#else\n");

        assertThat(run(null, source.toString())).isEqualTo(Main.EXIT_FAILURE);
        assertThat(stdout()).isEmpty();
    }

    @Test
    void missingSourceFileFails() throws Exception {
        assertThat(run(null, tempDir.resolve("nope.cpp").toString())).isEqualTo(Main.EXIT_FAILURE);
    }

    @Test
    void usageErrors() throws Exception {
        assertThat(run(null)).isEqualTo(Main.EXIT_USAGE);
        assertThat(run(null, "a.cpp", "b.cpp")).isEqualTo(Main.EXIT_USAGE);
        assertThat(run(null, "--bogus", "a.cpp")).isEqualTo(Main.EXIT_USAGE);
        assertThat(run(null, "--exclude", "(", "a.cpp")).isEqualTo(Main.EXIT_USAGE);
        assertThat(stdout()).isEmpty();
    }

    @Test
    void nonAsciiSourceIsWrittenAsUtf8WhateverTheStreamCharset() throws Exception {
        Path source = write("main.cpp", "int a; // \u3042\nconst char *s = \"\u00e9t\u00e9\";\n");
        PrintStream out = new PrintStream(stdout, true, StandardCharsets.US_ASCII);
        PrintStream err = new PrintStream(stderr, true, StandardCharsets.UTF_8);

        assertThat(new Main().run(new String[]{source.toString()}, out, err, null)).isEqualTo(Main.EXIT_OK);
        assertThat(stdout.toByteArray()).isEqualTo(Files.readAllBytes(source));
    }

    @Test
    void debugOptionLogsTheIncludeSearchList() throws Exception {
        Path incdir = Files.createDirectories(tempDir.resolve("inc"));
        Path source = write("main.cpp", "int x;\n");
        ByteArrayOutputStream log = new ByteArrayOutputStream();
        PrintStream saved = System.err;
        System.setErr(new PrintStream(log, true, StandardCharsets.UTF_8));
        try {
            assertThat(run(null, "--debug", "-I", incdir.toString(), source.toString())).isEqualTo(Main.EXIT_OK);
        } finally {
            System.setErr(saved);
            System.clearProperty("org.slf4j.simpleLogger.log.org.anarres.expander");
        }

        assertThat(log.toString(StandardCharsets.UTF_8))
                .contains("search starts here:")
                .contains(incdir.toAbsolutePath().normalize().toString())
                .contains("End of search list.");
        assertThat(stdout()).isEqualTo("int x;\n");
    }

    @Test
    void helpIsPrintedToStandardOutput() throws Exception {
        assertThat(run(null, "--help")).isEqualTo(Main.EXIT_OK);
        assertThat(stdout()).contains("--exclude", "--out");
    }
}
