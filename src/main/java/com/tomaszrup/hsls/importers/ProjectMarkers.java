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

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Detects Stack and Cabal project markers in a single directory. Unlike a
 * workspace walk this never descends; ancestor traversal is done by
 * {@link ProjectLocator}.
 *
 * <h3>Markers, in reporting order</h3>
 * <ul>
 *   <li>{@code cabal.project} file: Cabal v2 project file</li>
 *   <li>{@code stack.yaml} file: Stack project</li>
 *   <li>{@code dist-newstyle} directory: Cabal v2 build directory</li>
 *   <li>exactly one {@code *.cabal} file: Cabal v1 package</li>
 *   <li>{@code dist} directory: Cabal v1 build directory</li>
 * </ul>
 */
public final class ProjectMarkers {

    private static final Logger logger = LoggerFactory.getLogger(ProjectMarkers.class);

    static final String CABAL_PROJECT_FILE = "cabal.project";
    static final String STACK_YAML_FILE = "stack.yaml";
    static final String CABAL_V2_DIST_DIR = "dist-newstyle";
    static final String CABAL_V1_DIST_DIR = "dist";
    static final String CABAL_FILE_SUFFIX = ".cabal";

    private ProjectMarkers() {
        // utility class
    }

    public static List<ProjectReference> findProjects(Path dir) {
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        List<ProjectReference> found = new ArrayList<>();

        Path cabalProject = dir.resolve(CABAL_PROJECT_FILE);
        if (Files.isRegularFile(cabalProject)) {
            found.add(ProjectReference.cabalV2File(cabalProject, dir));
        }
        Path stackYaml = dir.resolve(STACK_YAML_FILE);
        if (Files.isRegularFile(stackYaml)) {
            found.add(ProjectReference.stackYaml(stackYaml));
        }
        if (Files.isDirectory(dir.resolve(CABAL_V2_DIST_DIR))) {
            found.add(ProjectReference.cabalV2Dir(dir));
        }
        List<Path> cabalFiles = findCabalFiles(dir);
        if (cabalFiles.size() == 1) {
            found.add(ProjectReference.cabalV1File(cabalFiles.get(0), dir));
        } else if (cabalFiles.size() > 1) {
            logger.debug("Ignoring {} ambiguous .cabal files in {}", cabalFiles.size(), dir);
        }
        if (Files.isDirectory(dir.resolve(CABAL_V1_DIST_DIR))) {
            found.add(ProjectReference.cabalV1Dir(dir));
        }
        return found;
    }

    static List<Path> findCabalFiles(Path dir) {
        List<Path> result = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + CABAL_FILE_SUFFIX)) {
            for (Path entry : stream) {
                String name = entry.getFileName().toString();
                // ".cabal" alone is a config directory, not a package description
                if (name.length() > CABAL_FILE_SUFFIX.length() && Files.isRegularFile(entry)) {
                    result.add(entry);
                }
            }
        } catch (IOException e) {
            logger.debug("Cannot list {}: {}", dir, e.getMessage());
        }
        Collections.sort(result);
        return result;
    }
}
