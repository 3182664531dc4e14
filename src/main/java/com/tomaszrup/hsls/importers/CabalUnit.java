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

import java.nio.file.Path;
import java.util.Objects;

/**
 * A buildable target of a package, such as {@code lib:foo} or
 * {@code exe:foo}. Only the identity is known up front; its components are
 * obtained through {@link BuildToolBackend#introspectUnit(CabalUnit)}.
 */
public final class CabalUnit {

    private final String unitId;
    private final ProjectReference project;
    private final Path packageDir;

    public CabalUnit(String unitId, ProjectReference project, Path packageDir) {
        this.unitId = Objects.requireNonNull(unitId, "unitId");
        this.project = Objects.requireNonNull(project, "project");
        this.packageDir = Objects.requireNonNull(packageDir, "packageDir");
    }

    public String getUnitId() {
        return unitId;
    }

    public ProjectReference getProject() {
        return project;
    }

    public Path getPackageDir() {
        return packageDir;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CabalUnit)) {
            return false;
        }
        CabalUnit that = (CabalUnit) o;
        return unitId.equals(that.unitId) && packageDir.equals(that.packageDir)
                && project.equals(that.project);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unitId, packageDir, project);
    }

    @Override
    public String toString() {
        return unitId + " (" + packageDir + ")";
    }
}
