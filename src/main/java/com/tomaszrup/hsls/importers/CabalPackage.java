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
import java.util.List;
import java.util.Objects;

/**
 * A package of a project. Identified by its source directory, which is
 * unique within a project.
 */
public final class CabalPackage {

    private final String name;
    private final Path sourceDir;
    private final List<CabalUnit> units;

    public CabalPackage(String name, Path sourceDir, List<CabalUnit> units) {
        if (units.isEmpty()) {
            throw new IllegalArgumentException("Package " + name + " has no units");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.sourceDir = Objects.requireNonNull(sourceDir, "sourceDir");
        this.units = List.copyOf(units);
    }

    public String getName() {
        return name;
    }

    /** As reported by the helper; may contain {@code "."} segments. */
    public Path getSourceDir() {
        return sourceDir;
    }

    public List<CabalUnit> getUnits() {
        return units;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CabalPackage)) {
            return false;
        }
        return sourceDir.equals(((CabalPackage) o).sourceDir);
    }

    @Override
    public int hashCode() {
        return sourceDir.hashCode();
    }

    @Override
    public String toString() {
        return "CabalPackage{" + name + ", " + sourceDir + ", units=" + units.size() + "}";
    }
}
