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
package com.tomaszrup.hsls.cradle;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

class CradleCacheTests {

    private Path tempDir;
    private CradleCache cache;

    @BeforeEach
    void setup() throws IOException {
        tempDir = Files.createTempDirectory("hsls-cradle-cache-test").toRealPath();
        cache = new CradleCache();
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
    void testEmptyCacheFindsNothing() {
        Assertions.assertEquals(Optional.empty(), cache.lookup(tempDir.resolve("A.hs")));
    }

    @Test
    void testLookupByRootDirectory() {
        Path root = tempDir.resolve("pkg");
        Cradle cradle = Cradle.none(root, "Cabal-Helper-Cabal-V2");

        cache.register(cradle, new ComponentOptions(List.of("-Wall")));

        Assertions.assertEquals(Optional.of(cradle), cache.lookup(root.resolve("src/A.hs")));
        Assertions.assertEquals(Optional.empty(), cache.lookup(tempDir.resolve("other/A.hs")));
        Assertions.assertEquals(1, cache.size());
    }

    @Test
    void testAbsoluteImportDirsAreRegistered() {
        Path root = tempDir.resolve("pkg");
        Path shared = tempDir.resolve("shared/src");
        Cradle cradle = Cradle.none(root, "Cabal-Helper-Cabal-V2");

        cache.register(cradle, new ComponentOptions(List.of("-i" + shared, "-irelative", "-i")));

        Assertions.assertEquals(Optional.of(cradle), cache.lookup(shared.resolve("Shared.hs")));
        Assertions.assertEquals(2, cache.size());
    }

    @Test
    void testLongestRegisteredPrefixWins() {
        Path outerRoot = tempDir.resolve("repo");
        Path innerRoot = outerRoot.resolve("sub");
        Cradle outer = Cradle.none(outerRoot, "outer");
        Cradle inner = Cradle.none(innerRoot, "inner");

        cache.register(inner, new ComponentOptions(List.of()));
        cache.register(outer, new ComponentOptions(List.of()));

        Assertions.assertEquals(Optional.of(inner), cache.lookup(innerRoot.resolve("A.hs")));
        Assertions.assertEquals(Optional.of(outer), cache.lookup(outerRoot.resolve("A.hs")));
    }

    @Test
    void testClearForgetsEverything() {
        Path root = tempDir.resolve("pkg");
        cache.register(Cradle.none(root, "c"), new ComponentOptions(List.of()));

        cache.clear();

        Assertions.assertEquals(0, cache.size());
        Assertions.assertEquals(Optional.empty(), cache.lookup(root.resolve("A.hs")));
    }

    @Test
    void testCloserPackageOfSameProjectIsLeftToResolver() {
        Path outerRoot = tempDir.resolve("repo");
        Path innerRoot = outerRoot.resolve("sub");
        Cradle outer = new Cradle(outerRoot, "outer", file -> CradleLoadResult.none(), List.of(innerRoot));

        cache.register(outer, new ComponentOptions(List.of("-i" + innerRoot.resolve("src"))));

        Assertions.assertEquals(Optional.empty(), cache.lookup(innerRoot.resolve("src/X.hs")));
        Assertions.assertEquals(Optional.of(outer), cache.lookup(outerRoot.resolve("src/A.hs")));
    }

    @Test
    void testImportDirOutsideEveryPackageIsReused() {
        Path root = tempDir.resolve("repo/app");
        Path other = tempDir.resolve("repo/lib");
        Path shared = tempDir.resolve("shared/src");
        Cradle cradle = new Cradle(root, "app", file -> CradleLoadResult.none(), List.of(other));

        cache.register(cradle, new ComponentOptions(List.of("-i" + shared, "-i" + other.resolve("src"))));

        Assertions.assertEquals(Optional.of(cradle), cache.lookup(shared.resolve("Shared.hs")));
        Assertions.assertEquals(Optional.empty(), cache.lookup(other.resolve("src/Lib.hs")));
    }
}
