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

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over the build-tool metadata source for Stack and Cabal
 * projects. Metadata objects it returns are read-only and may be shared
 * between concurrent resolutions within the same project.
 */
public interface BuildToolBackend {

    /**
     * Returns every project whose marker lives directly in {@code dir}.
     * Must not throw; unreadable directories yield an empty list.
     */
    List<ProjectReference> findProjects(Path dir);

    /**
     * Lists the packages of the given project, in the order the build tool
     * reports them.
     *
     * @throws IOException if the build tool could not be queried
     */
    List<CabalPackage> listPackages(ProjectReference project) throws IOException;

    /**
     * Initialises a unit (configuring its dependencies if needed) and reports
     * its components. This is the expensive step; callers invoke it lazily
     * and only for units they actually need. Failures are returned, not
     * thrown.
     */
    UnitIntrospection introspectUnit(CabalUnit unit);
}
