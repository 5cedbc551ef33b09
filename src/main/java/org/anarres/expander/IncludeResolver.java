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
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps #include targets to files.
 *
 * A "quoted" target is looked up in the directory of the including
 * file and then in each of its ancestors up to the filesystem root.
 * Failing that, and for every &lt;bracketed&gt; target, the include
 * path is searched in order.
 */
public class IncludeResolver {

    private static final Logger LOG = LoggerFactory.getLogger(IncludeResolver.class);

    /** The environment variable listing include roots. */
    public static final String INCLUDE_PATH_VARIABLE = "CPLUS_INCLUDE_PATH";

    private final List<Path> includePath;

    public IncludeResolver(@Nonnull List<Path> includePath) {
        this.includePath = new ArrayList<Path>(includePath);
    }

    /**
     * Splits a platform path list such as the value of
     * {@value #INCLUDE_PATH_VARIABLE} into absolute directories.
     * Empty entries are skipped.
     */
    @Nonnull
    public static List<Path> parseIncludePath(@CheckForNull String value) {
        List<Path> dirs = new ArrayList<Path>();
        if (value == null)
            return dirs;
        for (String entry : value.split(File.pathSeparator)) {
            if (!entry.isEmpty())
                dirs.add(Paths.get(entry).toAbsolutePath().normalize());
        }
        return dirs;
    }

    @Nonnull
    public List<Path> getIncludePath() {
        return includePath;
    }

    /**
     * Resolves an include target.
     *
     * @param target the file name exactly as written in the directive.
     * @param includingFile the file containing a quoted include, or null
     * for a bracketed include.
     * @return the real path of the file, or null if there is none.
     * @throws IOException if a file exists but its real path cannot be
     * determined.
     */
    @CheckForNull
    public Path resolve(@Nonnull String target, @CheckForNull Path includingFile)
            throws IOException {
        if (includingFile != null) {
            for (Path dir = includingFile.getParent(); dir != null; dir = dir.getParent()) {
                Path file = dir.resolve(target);
                if (Files.isRegularFile(file))
                    return file.toRealPath();
            }
        }
        for (Path dir : includePath) {
            Path file = dir.resolve(target);
            if (Files.isRegularFile(file))
                return file.toRealPath();
        }
        LOG.debug("{} not found in {}", target, includePath);
        return null;
    }
}
