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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

class ProjectMarkersTests {

    private Path tempDir;

    @BeforeEach
    void setup() throws IOException {
        tempDir = Files.createTempDirectory("hsls-markers-test");
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
    void testEmptyDirectoryHasNoProjects() {
        Assertions.assertTrue(ProjectMarkers.findProjects(tempDir).isEmpty());
    }

    @Test
    void testMissingDirectoryHasNoProjects() {
        Assertions.assertTrue(ProjectMarkers.findProjects(tempDir.resolve("missing")).isEmpty());
    }

    @Test
    void testAllMarkersAreReportedInPriorityOrder() throws IOException {
        Files.createFile(tempDir.resolve("cabal.project"));
        Files.createFile(tempDir.resolve("stack.yaml"));
        Files.createDirectory(tempDir.resolve("dist-newstyle"));
        Files.createFile(tempDir.resolve("foo.cabal"));
        Files.createDirectory(tempDir.resolve("dist"));

        List<ProjectReference> projects = ProjectMarkers.findProjects(tempDir);

        Assertions.assertEquals(5, projects.size());
        Assertions.assertEquals(ProjectKind.CABAL_V2_FILE, projects.get(0).getKind());
        Assertions.assertEquals(ProjectKind.STACK_YAML, projects.get(1).getKind());
        Assertions.assertEquals(ProjectKind.CABAL_V2_DIR, projects.get(2).getKind());
        Assertions.assertEquals(ProjectKind.CABAL_V1_FILE, projects.get(3).getKind());
        Assertions.assertEquals(ProjectKind.CABAL_V1_DIR, projects.get(4).getKind());
        for (ProjectReference project : projects) {
            Assertions.assertEquals(tempDir, project.getRootDir());
        }
    }

    @Test
    void testStackProjectRootIsDirectoryOfStackYaml() throws IOException {
        Path stackYaml = Files.createFile(tempDir.resolve("stack.yaml"));

        ProjectReference project = ProjectMarkers.findProjects(tempDir).get(0);

        Assertions.assertEquals(stackYaml, project.getMarker());
        Assertions.assertEquals(tempDir, project.getRootDir());
        Assertions.assertEquals(tempDir.resolve(".stack-work"), project.getDistDir());
        Assertions.assertEquals("Stack", project.getDiscriminator());
    }

    @Test
    void testSingleCabalFileIsV1Project() throws IOException {
        Path cabalFile = Files.createFile(tempDir.resolve("foo.cabal"));

        List<ProjectReference> projects = ProjectMarkers.findProjects(tempDir);

        Assertions.assertEquals(1, projects.size());
        Assertions.assertEquals(ProjectReference.cabalV1File(cabalFile, tempDir), projects.get(0));
        Assertions.assertEquals(tempDir.resolve("dist"), projects.get(0).getDistDir());
    }

    @Test
    void testSeveralCabalFilesAreAmbiguous() throws IOException {
        Files.createFile(tempDir.resolve("foo.cabal"));
        Files.createFile(tempDir.resolve("bar.cabal"));

        Assertions.assertTrue(ProjectMarkers.findProjects(tempDir).isEmpty());
    }

    @Test
    void testCabalConfigDirectoryIsNotAPackage() throws IOException {
        Files.createDirectory(tempDir.resolve(".cabal"));
        Files.createDirectory(tempDir.resolve("sub.cabal"));

        Assertions.assertTrue(ProjectMarkers.findProjects(tempDir).isEmpty());
    }

    @Test
    void testMarkerFilesMustBeFiles() throws IOException {
        Files.createDirectory(tempDir.resolve("stack.yaml"));
        Files.createFile(tempDir.resolve("dist-newstyle"));

        Assertions.assertTrue(ProjectMarkers.findProjects(tempDir).isEmpty());
    }
}
