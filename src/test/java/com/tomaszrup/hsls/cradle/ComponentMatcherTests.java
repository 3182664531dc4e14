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

import com.tomaszrup.hsls.importers.ComponentInfo;
import com.tomaszrup.hsls.importers.Entrypoint;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

class ComponentMatcherTests {

    private static ComponentInfo library(List<String> exposed, List<String> other, String... sourceDirs) {
        return new ComponentInfo("lib", dirs(sourceDirs), Entrypoint.library(exposed, other), List.of());
    }

    private static ComponentInfo executable(String mainIs, List<String> other, String... sourceDirs) {
        return new ComponentInfo("exe", dirs(sourceDirs), Entrypoint.executable(mainIs, other), List.of());
    }

    private static List<Path> dirs(String... sourceDirs) {
        Path[] paths = new Path[sourceDirs.length];
        for (int i = 0; i < sourceDirs.length; i++) {
            paths[i] = Paths.get(sourceDirs[i]);
        }
        return List.of(paths);
    }

    // --- partOfComponent ---

    @Test
    void testExposedModuleBelongsToLibrary() {
        ComponentInfo lib = library(List.of("Lib.Foo"), List.of("Lib.Internal"), "src");

        Assertions.assertTrue(ComponentMatcher.partOfComponent(Paths.get("src/Lib/Foo.hs"), lib));
        Assertions.assertTrue(ComponentMatcher.partOfComponent(Paths.get("src/Lib/Internal.hs"), lib));
    }

    @Test
    void testUnlistedModuleDoesNotBelongToLibrary() {
        ComponentInfo lib = library(List.of("Lib.Foo"), List.of(), "src");

        Assertions.assertFalse(ComponentMatcher.partOfComponent(Paths.get("src/Lib/Bar.hs"), lib));
    }

    @Test
    void testFileOutsideSourceDirsDoesNotBelong() {
        ComponentInfo lib = library(List.of("Lib.Foo"), List.of(), "src");

        Assertions.assertFalse(ComponentMatcher.partOfComponent(Paths.get("test/Lib/Foo.hs"), lib));
        Assertions.assertFalse(ComponentMatcher.partOfComponent(Paths.get("src-extra/Lib/Foo.hs"), lib));
    }

    @Test
    void testMainIsBelongsToExecutable() {
        ComponentInfo exe = executable("Main.hs", List.of("Paths_foo"), "app");

        Assertions.assertTrue(ComponentMatcher.partOfComponent(Paths.get("app/Main.hs"), exe));
        Assertions.assertTrue(ComponentMatcher.partOfComponent(Paths.get("app/Paths_foo.hs"), exe));
        Assertions.assertFalse(ComponentMatcher.partOfComponent(Paths.get("app/Other.hs"), exe));
    }

    @Test
    void testSetupScriptBelongsToSetupComponent() {
        ComponentInfo setup = new ComponentInfo("setup", dirs("."), Entrypoint.setup("Setup.hs"), List.of());

        Assertions.assertTrue(ComponentMatcher.partOfComponent(Paths.get("Setup.hs"), setup));
        Assertions.assertFalse(ComponentMatcher.partOfComponent(Paths.get("Other.hs"), setup));
    }

    // --- getTargets ---

    @Test
    void testLibraryTargetsAreExposedThenOtherModules() {
        ComponentInfo lib = library(List.of("A", "B"), List.of("C"), "src");

        Assertions.assertEquals(List.of("A", "B", "C"),
                ComponentMatcher.getTargets(lib, Paths.get("src/A.hs")));
    }

    @Test
    void testExecutableTargetUsesSourceDirOfFile() {
        ComponentInfo exe = executable("Main.hs", List.of("Util"), "app", "app2");

        Assertions.assertEquals(List.of("app2/Main.hs", "Util"),
                ComponentMatcher.getTargets(exe, Paths.get("app2/Util.hs")));
    }

    @Test
    void testExecutableWithoutMatchingSourceDirHasOnlyOtherModules() {
        ComponentInfo exe = executable("Main.hs", List.of("Util"), "app");

        Assertions.assertEquals(List.of("Util"), ComponentMatcher.getTargets(exe, Paths.get("src/Util.hs")));
    }

    @Test
    void testSetupHasNoTargets() {
        ComponentInfo setup = new ComponentInfo("setup", dirs("."), Entrypoint.setup("Setup.hs"), List.of());

        Assertions.assertTrue(ComponentMatcher.getTargets(setup, Paths.get("Setup.hs")).isEmpty());
    }

    // --- fixImportDirs ---

    @Test
    void testRelativeImportDirIsAnchoredAtRoot() {
        Path root = Paths.get("/repo/pkg");

        Assertions.assertEquals("-i" + root.resolve("src"), ComponentMatcher.fixImportDirs(root, "-isrc"));
    }

    @Test
    void testOtherFlagsAreUnchanged() {
        Path root = Paths.get("/repo/pkg");

        Assertions.assertEquals("-i", ComponentMatcher.fixImportDirs(root, "-i"));
        Assertions.assertEquals("-i/abs/src", ComponentMatcher.fixImportDirs(root, "-i/abs/src"));
        Assertions.assertEquals("-Wall", ComponentMatcher.fixImportDirs(root, "-Wall"));
        Assertions.assertEquals("-package-id", ComponentMatcher.fixImportDirs(root, "-package-id"));
    }
}
