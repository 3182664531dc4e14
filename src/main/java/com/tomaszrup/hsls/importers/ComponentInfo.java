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
 * A single component of a unit (library, executable, test-suite, benchmark
 * or setup script). Read-only after creation.
 *
 * <p>Source directories are relative to the package source directory.
 * Several may be listed; the first one prefixing a file wins.</p>
 */
public final class ComponentInfo {

    private final String name;
    private final List<Path> sourceDirs;
    private final Entrypoint entrypoint;
    private final List<String> ghcOptions;

    public ComponentInfo(String name, List<Path> sourceDirs, Entrypoint entrypoint, List<String> ghcOptions) {
        this.name = Objects.requireNonNull(name, "name");
        this.sourceDirs = List.copyOf(sourceDirs);
        this.entrypoint = Objects.requireNonNull(entrypoint, "entrypoint");
        this.ghcOptions = List.copyOf(ghcOptions);
    }

    public String getName() {
        return name;
    }

    public List<Path> getSourceDirs() {
        return sourceDirs;
    }

    public Entrypoint getEntrypoint() {
        return entrypoint;
    }

    /** Compiler flags exactly as reported by the helper, relative to the package dir. */
    public List<String> getGhcOptions() {
        return ghcOptions;
    }

    @Override
    public String toString() {
        return "ComponentInfo{" + name + ", sourceDirs=" + sourceDirs + ", " + entrypoint + "}";
    }
}
