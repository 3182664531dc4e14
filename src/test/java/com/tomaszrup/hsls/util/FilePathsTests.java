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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

class FilePathsTests {

    @Test
    void testAncestorsOfAbsolutePathEndAtRoot() {
        List<Path> ancestors = FilePaths.ancestors(Paths.get("/a/b/c"));

        Assertions.assertEquals(List.of(Paths.get("/a/b/c"), Paths.get("/a/b"), Paths.get("/a"), Paths.get("/")),
                ancestors);
    }

    @Test
    void testAncestorsOfRelativePathEndAtCurrentDir() {
        List<Path> ancestors = FilePaths.ancestors(Paths.get("a/b"));

        Assertions.assertEquals(List.of(Paths.get("a/b"), Paths.get("a"), Paths.get(".")), ancestors);
    }

    @Test
    void testAncestorsOfCurrentDir() {
        Assertions.assertEquals(List.of(Paths.get(".")), FilePaths.ancestors(Paths.get(".")));
        Assertions.assertEquals(List.of(Paths.get(".")), FilePaths.ancestors(Paths.get("./")));
    }

    @Test
    void testStripFilePathRemovesPrefixDirectory() {
        Assertions.assertEquals(Optional.of(Paths.get("File.hs")),
                FilePaths.stripFilePath(Paths.get("app"), Paths.get("app/File.hs")));
        Assertions.assertEquals(Optional.of(Paths.get("Lib/Foo.hs")),
                FilePaths.stripFilePath(Paths.get("src/"), Paths.get("./src/Lib/Foo.hs")));
    }

    @Test
    void testStripFilePathComparesWholeComponents() {
        Assertions.assertEquals(Optional.empty(),
                FilePaths.stripFilePath(Paths.get("src"), Paths.get("src-dir/File.hs")));
    }

    @Test
    void testStripFilePathWithCurrentDir() {
        Assertions.assertEquals(Optional.of(Paths.get("src/File.hs")),
                FilePaths.stripFilePath(Paths.get("."), Paths.get("src/File.hs")));
        Assertions.assertEquals(Optional.empty(),
                FilePaths.stripFilePath(Paths.get("."), Paths.get("/src/File.hs")));
    }

    @Test
    void testStripFilePathRejectsMixedAbsoluteAndRelative() {
        Assertions.assertEquals(Optional.empty(),
                FilePaths.stripFilePath(Paths.get("/app/"), Paths.get("./app/File.hs")));
        Assertions.assertEquals(Optional.empty(),
                FilePaths.stripFilePath(Paths.get("app"), Paths.get("/app/File.hs")));
    }

    @Test
    void testStripFilePathOfSamePathIsCurrentDir() {
        Assertions.assertEquals(Optional.of(Paths.get(".")),
                FilePaths.stripFilePath(Paths.get("/repo/pkg"), Paths.get("/repo/pkg")));
    }

    @Test
    void testIsFilePathPrefixOf() {
        Assertions.assertTrue(FilePaths.isFilePathPrefixOf(Paths.get("/repo"), Paths.get("/repo/Sub/A.hs")));
        Assertions.assertFalse(FilePaths.isFilePathPrefixOf(Paths.get("/repo/Sub"), Paths.get("/repo/A.hs")));
    }

    @Test
    void testRelativeToUsesFirstMatchingSourceDir() {
        Path file = Paths.get("src/Lib/Lib.hs");

        Assertions.assertEquals(Optional.of(Paths.get("Lib/Lib.hs")),
                FilePaths.relativeTo(file, List.of(Paths.get("src"))));
        Assertions.assertEquals(Optional.empty(),
                FilePaths.relativeTo(file, List.of(Paths.get("app"))));
        Assertions.assertEquals(Optional.of(Paths.get("Lib/Lib.hs")),
                FilePaths.relativeTo(file, List.of(Paths.get("src"), Paths.get("src/Lib"))));
    }

    @Test
    void testToModuleName() {
        Assertions.assertEquals("Lib.Foo", FilePaths.toModuleName(Paths.get("Lib/Foo.hs")));
        Assertions.assertEquals("Main", FilePaths.toModuleName(Paths.get("Main.lhs")));
        Assertions.assertEquals("A.B.C", FilePaths.toModuleName(Paths.get("A/B/C.hs")));
    }

    @Test
    void testDropExtensionKeepsDotFiles() {
        Assertions.assertEquals(".ghci", FilePaths.dropExtension(".ghci"));
        Assertions.assertEquals("Foo.Bar", FilePaths.dropExtension("Foo.Bar.hs"));
    }

    @Test
    void testMakeRelative() {
        Assertions.assertEquals(Paths.get("src/A.hs"),
                FilePaths.makeRelative(Paths.get("/repo/pkg"), Paths.get("/repo/pkg/src/A.hs")));
        Assertions.assertEquals(Paths.get("/other/A.hs"),
                FilePaths.makeRelative(Paths.get("/repo/pkg"), Paths.get("/other/A.hs")));
    }
}
