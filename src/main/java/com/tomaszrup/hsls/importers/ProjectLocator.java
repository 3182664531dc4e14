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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.tomaszrup.hsls.util.FilePaths;

/**
 * Finds the Stack or Cabal project a file belongs to.
 *
 * <p>A file may sit below several projects at once. Consider
 * {@code /Foo/B/src/Lib2.hs} where {@code /Foo/B/B.cabal},
 * {@code /Foo/stack.yaml} and {@code /Foo/cabal.project} all exist: the
 * nearest marker ({@code B.cabal}) is not the project root, because the
 * Stack and Cabal v2 files in {@code /Foo} include {@code B} as a package and
 * influence how it is compiled. So every ancestor is searched and Stack or
 * Cabal v2 projects are preferred over Cabal v1 ones. Between Stack and
 * Cabal v2 there is no right answer; the first one found wins.</p>
 *
 * <p>Projects whose build tool is not installed are ignored.</p>
 */
public class ProjectLocator {

    private static final Logger logger = LoggerFactory.getLogger(ProjectLocator.class);

    private final BuildToolBackend backend;
    private final ExecutableLookup executableLookup;

    public ProjectLocator(BuildToolBackend backend, ExecutableLookup executableLookup) {
        this.backend = backend;
        this.executableLookup = executableLookup;
    }

    public Optional<ProjectReference> findEntryPoint(Path file) {
        Path dir = file.getParent() != null ? file.getParent() : Paths.get(".");

        List<ProjectReference> allProjects = new ArrayList<>();
        for (Path ancestor : FilePaths.ancestors(dir)) {
            allProjects.addAll(backend.findProjects(ancestor));
        }
        logger.debug("Found these projects for {}: {}", file, allProjects);

        Map<String, Boolean> installed = new HashMap<>();
        List<ProjectReference> supported = new ArrayList<>();
        for (ProjectReference project : allProjects) {
            String tool = project.getKind().getToolName();
            if (installed.computeIfAbsent(tool, executableLookup::isExecutableOnPath)) {
                supported.add(project);
            }
        }
        logger.debug("These projects have their build tool installed: {}", supported);

        for (ProjectReference project : supported) {
            if (!project.getKind().isLegacy()) {
                return Optional.of(project);
            }
        }
        for (ProjectReference project : supported) {
            if (project.getKind().isLegacy()) {
                return Optional.of(project);
            }
        }
        return Optional.empty();
    }
}
