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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

class HelperOutputParserTests {

    private final Path root = Paths.get("/repo");
    private final ProjectReference project = ProjectReference.cabalV2File(root.resolve("cabal.project"), root);

    @Test
    void testParsePackagesResolvesRelativeSourceDirs() throws IOException {
        String json = "{\"packages\": ["
                + "{\"name\": \"a\", \"sourceDir\": \"/repo/./a\", \"units\": [\"lib:a\", \"exe:a\"]},"
                + "{\"name\": \"b\", \"sourceDir\": \"b\", \"units\": [\"lib:b\"]}"
                + "]}";

        List<CabalPackage> packages = HelperOutputParser.parsePackages(json, project);

        Assertions.assertEquals(2, packages.size());
        CabalPackage a = packages.get(0);
        Assertions.assertEquals("a", a.getName());
        Assertions.assertEquals(Paths.get("/repo/a"), a.getSourceDir());
        Assertions.assertEquals(2, a.getUnits().size());
        Assertions.assertEquals("exe:a", a.getUnits().get(1).getUnitId());
        Assertions.assertEquals(project, a.getUnits().get(1).getProject());
        Assertions.assertEquals(Paths.get("/repo/b"), packages.get(1).getSourceDir());
    }

    @Test
    void testParsePackagesSkipsPackagesWithoutUnits() throws IOException {
        String json = "{\"packages\": [{\"name\": \"empty\", \"sourceDir\": \"/repo/empty\", \"units\": []}]}";

        Assertions.assertTrue(HelperOutputParser.parsePackages(json, project).isEmpty());
    }

    @Test
    void testParseUnitInfoWithAllEntrypointTypes() throws IOException {
        String json = "{\"unitId\": \"lib:a\", \"components\": ["
                + "{\"name\": \"lib:a\", \"sourceDirs\": [\"src\"],"
                + " \"entrypoint\": {\"type\": \"library\", \"exposedModules\": [\"A\", \"A.B\"], \"otherModules\": [\"A.Internal\"]},"
                + " \"ghcOptions\": [\"-isrc\", \"-Wall\"]},"
                + "{\"name\": \"exe:a\", \"sourceDirs\": [\"app\"],"
                + " \"entrypoint\": {\"type\": \"executable\", \"mainIs\": \"Main.hs\", \"otherModules\": []}},"
                + "{\"name\": \"setup:a\", \"sourceDirs\": [\".\"],"
                + " \"entrypoint\": {\"type\": \"setup\", \"mainIs\": \"Setup.hs\"}}"
                + "]}";
        CabalUnit unit = new CabalUnit("lib:a", project, root.resolve("a"));

        UnitInfo info = HelperOutputParser.parseUnitInfo(json, unit);

        Assertions.assertEquals("lib:a", info.getUnitId());
        Assertions.assertEquals(3, info.getComponents().size());

        ComponentInfo lib = info.getComponents().get(0);
        Assertions.assertEquals(List.of(Paths.get("src")), lib.getSourceDirs());
        Assertions.assertEquals(Entrypoint.Type.LIBRARY, lib.getEntrypoint().getType());
        Assertions.assertEquals(List.of("A", "A.B"), lib.getEntrypoint().getExposedModules());
        Assertions.assertEquals(List.of("A.Internal"), lib.getEntrypoint().getOtherModules());
        Assertions.assertEquals(List.of("-isrc", "-Wall"), lib.getGhcOptions());

        ComponentInfo exe = info.getComponents().get(1);
        Assertions.assertEquals(Entrypoint.Type.EXECUTABLE, exe.getEntrypoint().getType());
        Assertions.assertEquals("Main.hs", exe.getEntrypoint().getMainIs());
        Assertions.assertTrue(exe.getGhcOptions().isEmpty());

        ComponentInfo setup = info.getComponents().get(2);
        Assertions.assertEquals(Entrypoint.Type.SETUP, setup.getEntrypoint().getType());
        Assertions.assertEquals("Setup.hs", setup.getEntrypoint().getMainIs());
    }

    @Test
    void testUnitIdDefaultsToRequestedUnit() throws IOException {
        CabalUnit unit = new CabalUnit("lib:x", project, root);

        UnitInfo info = HelperOutputParser.parseUnitInfo("{\"components\": []}", unit);

        Assertions.assertEquals("lib:x", info.getUnitId());
        Assertions.assertTrue(info.getComponents().isEmpty());
    }

    @Test
    void testMalformedOutputThrowsIOException() {
        CabalUnit unit = new CabalUnit("lib:x", project, root);

        Assertions.assertThrows(IOException.class, () -> HelperOutputParser.parsePackages("", project));
        Assertions.assertThrows(IOException.class, () -> HelperOutputParser.parsePackages("{not json", project));
        Assertions.assertThrows(IOException.class, () -> HelperOutputParser.parsePackages("[]", project));
        Assertions.assertThrows(IOException.class, () -> HelperOutputParser.parsePackages("{}", project));
        Assertions.assertThrows(IOException.class,
                () -> HelperOutputParser.parseUnitInfo("{\"components\": [{\"name\": \"c\"}]}", unit));
        Assertions.assertThrows(IOException.class, () -> HelperOutputParser.parseUnitInfo(
                "{\"components\": [{\"name\": \"c\", \"entrypoint\": {\"type\": \"benchmark\"}}]}", unit));
    }
}
