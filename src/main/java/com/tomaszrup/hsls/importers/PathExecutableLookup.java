////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.hsls.importers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Looks an executable up on the directories of a {@code PATH}-style search
 * string. On Windows the {@code PATHEXT} extensions are tried as well.
 */
public class PathExecutableLookup implements ExecutableLookup {

    private static final Logger logger = LoggerFactory.getLogger(PathExecutableLookup.class);

    private final List<Path> searchDirs;
    private final List<String> extensions;

    public PathExecutableLookup() {
        this(System.getenv("PATH"), isWindows() ? System.getenv("PATHEXT") : null);
    }

    public PathExecutableLookup(String searchPath, String pathExt) {
        this.searchDirs = parseSearchPath(searchPath);
        this.extensions = parseExtensions(pathExt);
    }

    @Override
    public boolean isExecutableOnPath(String name) {
        for (Path dir : searchDirs) {
            for (String ext : extensions) {
                Path candidate = dir.resolve(name + ext);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    logger.debug("Found {} at {}", name, candidate);
                    return true;
                }
            }
        }
        return false;
    }

    List<Path> getSearchDirs() {
        return searchDirs;
    }

    private static List<Path> parseSearchPath(String searchPath) {
        if (searchPath == null || searchPath.isEmpty()) {
            return Collections.emptyList();
        }
        List<Path> dirs = new ArrayList<>();
        for (String entry : searchPath.split(File.pathSeparator)) {
            if (entry.isEmpty()) {
                continue;
            }
            try {
                dirs.add(Paths.get(entry));
            } catch (InvalidPathException e) {
                logger.debug("Skipping invalid PATH entry '{}'", entry);
            }
        }
        return Collections.unmodifiableList(dirs);
    }

    private static List<String> parseExtensions(String pathExt) {
        List<String> exts = new ArrayList<>();
        exts.add("");
        if (pathExt != null) {
            for (String ext : pathExt.split(File.pathSeparator)) {
                if (!ext.isEmpty()) {
                    exts.add(ext.toLowerCase(Locale.ROOT));
                }
            }
        }
        return Collections.unmodifiableList(exts);
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }
}
