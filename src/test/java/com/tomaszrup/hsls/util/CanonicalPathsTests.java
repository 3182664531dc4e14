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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;

class CanonicalPathsTests {

    private Path tempDir;

    @BeforeEach
    void setup() throws IOException {
        tempDir = Files.createTempDirectory("hsls-canonical-test").toRealPath();
    }

    @AfterEach
    void tearDown() throws IOException {
        if (tempDir != null && Files.exists(tempDir)) {
            Files.walk(tempDir)
                    .sorted(Comparator.reverseOrder())
                    .forEach(p -> {
                        try { Files.deleteIfExists(p); } catch (IOException ignored) {}
                    });
        }
    }

    @Test
    void testExistingFileIsNormalised() throws IOException {
        Path file = Files.createFile(tempDir.resolve("A.hs"));

        Assertions.assertEquals(file, CanonicalPaths.canonicalize(tempDir.resolve("sub/../A.hs")));
    }

    @Test
    void testMissingFileUsesCanonicalParent() {
        Path missing = tempDir.resolve("./Missing.hs");

        Assertions.assertEquals(tempDir.resolve("Missing.hs"), CanonicalPaths.canonicalize(missing));
    }

    @Test
    void testSymlinkIsResolved() throws IOException {
        Path target = Files.createDirectories(tempDir.resolve("real"));
        Files.createFile(target.resolve("B.hs"));
        Path link = tempDir.resolve("link");
        try {
            Files.createSymbolicLink(link, target);
        } catch (UnsupportedOperationException | IOException e) {
            Assumptions.assumeTrue(false, "symbolic links not supported");
        }

        Assertions.assertEquals(target.resolve("B.hs"), CanonicalPaths.canonicalize(link.resolve("B.hs")));
    }

    @Test
    void testNullStaysNull() {
        Assertions.assertNull(CanonicalPaths.canonicalize(null));
    }
}
