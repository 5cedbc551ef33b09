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

import java.io.File;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <pre>
 * expand &lt;source-file&gt; [--out &lt;path&gt;] [--exclude &lt;regex&gt;]
 * </pre>
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private final OptionParser parser = new OptionParser();
    private final OptionSpec<?> helpOption = parser.accepts("help",
            "Displays command-line help.")
            .forHelp();
    private final OptionSpec<?> debugOption = parser.accepts("debug",
            "Enables debug output.");
    private final OptionSpec<File> outOption = parser.acceptsAll(Arrays.asList("out", "o"),
            "Writes the expanded source to the given file instead of standard output.")
            .withRequiredArg().ofType(File.class).describedAs("path");
    private final OptionSpec<String> excludeOption = parser.acceptsAll(Arrays.asList("exclude", "e"),
            "Leaves includes whose target matches the given regular expression unexpanded.")
            .withRequiredArg().ofType(String.class).describedAs("regex");
    private final OptionSpec<File> incdirOption = parser.acceptsAll(Arrays.asList("incdir", "I"),
            "Adds the directory dir to the list of directories to be searched for header files.")
            .withRequiredArg().ofType(File.class).describedAs("dir");
    private final OptionSpec<String> defineOption = parser.acceptsAll(Arrays.asList("define", "D"),
            "Treats the given macro as defined.")
            .withRequiredArg().ofType(String.class).describedAs("name[=definition]");
    private final OptionSpec<String> undefineOption = parser.acceptsAll(Arrays.asList("undefine", "U"),
            "Treats the given macro as undefined.")
            .withRequiredArg().describedAs("name");
    private final OptionSpec<File> inputsOption = parser.nonOptions()
            .ofType(File.class).describedAs("Source file to expand.");

    public static void main(String[] args) throws Exception {
        PrintStream out = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
        int status = new Main().run(args, out, System.err,
                System.getenv(IncludeResolver.INCLUDE_PATH_VARIABLE));
        if (status != EXIT_OK)
            System.exit(status);
    }

    /**
     * Runs the expander.
     *
     * @param environmentIncludePath the value of
     * {@value IncludeResolver#INCLUDE_PATH_VARIABLE}, if set.
     * @return the process exit status.
     */
    public int run(@Nonnull String[] args, @Nonnull PrintStream out, @Nonnull PrintStream err,
            @CheckForNull String environmentIncludePath)
            throws IOException {
        OptionSet options;
        try {
            options = parser.parse(args);
        } catch (OptionException e) {
            err.println(e.getMessage());
            parser.printHelpOn(err);
            return EXIT_USAGE;
        }

        if (options.has(helpOption)) {
            parser.printHelpOn(out);
            return EXIT_OK;
        }

        List<File> inputs = options.valuesOf(inputsOption);
        if (inputs.size() != 1) {
            err.println("Expected exactly one source file, got " + inputs.size());
            parser.printHelpOn(err);
            return EXIT_USAGE;
        }

        if (options.has(debugOption))
            System.setProperty("org.slf4j.simpleLogger.log.org.anarres.expander", "debug");

        Expander expander = new Expander();
        if (options.has(excludeOption)) {
            try {
                expander.setExcludePattern(Pattern.compile(options.valueOf(excludeOption)));
            } catch (PatternSyntaxException e) {
                err.println("Invalid --exclude pattern: " + e.getMessage());
                return EXIT_USAGE;
            }
        }
        for (File dir : options.valuesOf(incdirOption))
            expander.getIncludePath().add(dir.toPath().toAbsolutePath().normalize());
        expander.getIncludePath().addAll(IncludeResolver.parseIncludePath(environmentIncludePath));

        for (String arg : options.valuesOf(defineOption)) {
            int idx = arg.indexOf('=');
            expander.addMacro(idx == -1 ? arg : arg.substring(0, idx));
        }
        for (String arg : options.valuesOf(undefineOption))
            expander.removeMacro(arg);

        if (options.has(debugOption)) {
            /* Created after the level is raised; LOG already has its level. */
            Logger search = LoggerFactory.getLogger(Main.class.getName() + ".search");
            search.info("#" + "include <...> search starts here:");
            for (Path dir : expander.getIncludePath())
                search.info("  " + dir);
            search.info("End of search list.");
        }

        Path source = inputs.get(0).toPath();
        String expanded;
        try {
            expanded = expander.expand(source);
        } catch (ExpanderException e) {
            LOG.error("Expansion of " + source + " failed: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            LOG.error("Expansion of " + source + " failed", e);
            return EXIT_FAILURE;
        }

        if (options.has(outOption)) {
            FileUtils.writeStringToFile(options.valueOf(outOption), expanded, StandardCharsets.UTF_8);
        } else {
            /* Bytes, not print(): the stream may use another charset. */
            byte[] bytes = expanded.getBytes(StandardCharsets.UTF_8);
            out.write(bytes, 0, bytes.length);
            out.flush();
        }
        return EXIT_OK;
    }
}
