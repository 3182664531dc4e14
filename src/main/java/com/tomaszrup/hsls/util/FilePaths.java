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
package com.tomaszrup.hsls.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Pure path helpers used by project location and component matching.
 * None of these methods touch the filesystem.
 */
public final class FilePaths {

    private static final Path CURRENT_DIR = Paths.get(".");

    private FilePaths() {
        // utility class
    }

    /**
     * Returns the given directory followed by each of its parents, up to and
     * including the filesystem root. Relative paths end with {@code "."}.
     *
     * <pre>
     * ancestors("/a/b/c") = ["/a/b/c", "/a/b", "/a", "/"]
     * ancestors("a/b")    = ["a/b", "a", "."]
     * </pre>
     */
    public static List<Path> ancestors(Path dir) {
        Path current = normalise(dir);
        List<Path> result = new ArrayList<>();
        while (current != null) {
            result.add(current);
            Path parent = current.getParent();
            if (parent == null && !current.isAbsolute() && !current.equals(CURRENT_DIR)) {
                parent = CURRENT_DIR;
            }
            current = parent;
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Normalises a path, turning the empty path (what {@code "./"} collapses
     * to) into {@code "."}.
     */
    public static Path normalise(Path path) {
        Path normalised = path.normalize();
        if (normalised.toString().isEmpty()) {
            return CURRENT_DIR;
        }
        return normalised;
    }

    /**
     * Strips {@code dir} from {@code file} if and only if {@code dir} is a
     * component-wise prefix of {@code file}. Both paths are normalised first.
     *
     * <pre>
     * stripFilePath("app", "app/File.hs")       = "File.hs"
     * stripFilePath("src", "src-dir/File.hs")   = empty
     * stripFilePath(".", "src/File.hs")         = "src/File.hs"
     * stripFilePath("/app/", "./app/File.hs")   = empty
     * </pre>
     */
    public static Optional<Path> stripFilePath(Path dir, Path file) {
        Path normalDir = normalise(dir);
        Path normalFile = normalise(file);
        if (normalDir.equals(CURRENT_DIR)) {
            return normalFile.isAbsolute() ? Optional.empty() : Optional.of(normalFile);
        }
        if (normalDir.isAbsolute() != normalFile.isAbsolute()) {
            return Optional.empty();
        }
        if (normalDir.isAbsolute() && !sameRoot(normalDir, normalFile)) {
            return Optional.empty();
        }
        int dirCount = normalDir.getNameCount();
        int fileCount = normalFile.getNameCount();
        if (dirCount > fileCount) {
            return Optional.empty();
        }
        for (int i = 0; i < dirCount; i++) {
            if (!normalDir.getName(i).equals(normalFile.getName(i))) {
                return Optional.empty();
            }
        }
        if (dirCount == fileCount) {
            return Optional.of(CURRENT_DIR);
        }
        return Optional.of(normalFile.subpath(dirCount, fileCount));
    }

    public static boolean isFilePathPrefixOf(Path dir, Path file) {
        return stripFilePath(dir, file).isPresent();
    }

    /**
     * Strips the first matching source directory from the given file.
     *
     * <pre>
     * relativeTo("src/Lib/Lib.hs", ["src", "src/Lib"]) = "Lib/Lib.hs"
     * relativeTo("src/Lib/Lib.hs", ["app"])            = empty
     * </pre>
     */
    public static Optional<Path> relativeTo(Path file, List<Path> sourceDirs) {
        for (Path sourceDir : sourceDirs) {
            Optional<Path> stripped = stripFilePath(sourceDir, file);
            if (stripped.isPresent()) {
                return stripped;
            }
        }
        return Optional.empty();
    }

    /**
     * Converts a source-directory-relative file into a dotted module name:
     * {@code Lib/Foo.hs} becomes {@code Lib.Foo}.
     */
    public static String toModuleName(Path relativeFile) {
        StringBuilder sb = new StringBuilder();
        int last = relativeFile.getNameCount() - 1;
        for (int i = 0; i < last; i++) {
            sb.append(relativeFile.getName(i)).append('.');
        }
        sb.append(dropExtension(relativeFile.getName(last).toString()));
        return sb.toString();
    }

    /**
     * Makes {@code file} relative to {@code root} when it lies beneath it,
     * otherwise returns {@code file} unchanged.
     */
    public static Path makeRelative(Path root, Path file) {
        return stripFilePath(root, file).orElse(file);
    }

    /** Joins with forward slashes regardless of platform, matching helper output. */
    public static String toSlashString(Path path) {
        return path.toString().replace('\\', '/');
    }

    static String dropExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return fileName;
        }
        return fileName.substring(0, dot);
    }

    private static boolean sameRoot(Path a, Path b) {
        Path rootA = a.getRoot();
        Path rootB = b.getRoot();
        return rootA == null ? rootB == null : rootA.equals(rootB);
    }
}
