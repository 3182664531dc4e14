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
 * An immutable reference to a discovered Stack or Cabal project.
 *
 * <p>The marker is the file or directory that identified the project:
 * {@code stack.yaml}, {@code cabal.project}, the single {@code *.cabal}
 * file, or the {@code dist-newstyle}/{@code dist} directory's parent.</p>
 */
public final class ProjectReference {

    private final ProjectKind kind;
    private final Path marker;
    private final Path rootDir;

    private ProjectReference(ProjectKind kind, Path marker, Path rootDir) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.marker = Objects.requireNonNull(marker, "marker");
        this.rootDir = Objects.requireNonNull(rootDir, "rootDir");
    }

    public static ProjectReference stackYaml(Path stackYaml) {
        Path parent = stackYaml.getParent();
        return new ProjectReference(ProjectKind.STACK_YAML, stackYaml,
                parent != null ? parent : stackYaml);
    }

    public static ProjectReference cabalV2File(Path cabalProject, Path projectDir) {
        return new ProjectReference(ProjectKind.CABAL_V2_FILE, cabalProject, projectDir);
    }

    public static ProjectReference cabalV2Dir(Path projectDir) {
        return new ProjectReference(ProjectKind.CABAL_V2_DIR, projectDir, projectDir);
    }

    public static ProjectReference cabalV1File(Path cabalFile, Path projectDir) {
        return new ProjectReference(ProjectKind.CABAL_V1_FILE, cabalFile, projectDir);
    }

    public static ProjectReference cabalV1Dir(Path projectDir) {
        return new ProjectReference(ProjectKind.CABAL_V1_DIR, projectDir, projectDir);
    }

    public ProjectKind getKind() {
        return kind;
    }

    public Path getMarker() {
        return marker;
    }

    public Path getRootDir() {
        return rootDir;
    }

    public String getDiscriminator() {
        return kind.getDiscriminator();
    }

    /** The build output directory the metadata helper reads from. */
    public Path getDistDir() {
        return rootDir.resolve(kind.getDefaultDistDir());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProjectReference)) {
            return false;
        }
        ProjectReference that = (ProjectReference) o;
        return kind == that.kind && marker.equals(that.marker) && rootDir.equals(that.rootDir);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, marker, rootDir);
    }

    @Override
    public String toString() {
        return kind.getDiscriminator() + "(" + marker + ")";
    }
}
