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

import com.tomaszrup.hsls.util.FilePaths;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The build configuration able to compile files under {@link #getRootDir()}.
 *
 * <p>Discovering a cradle is cheap. The flags for a particular file are only
 * computed when {@link #load(Path)} is called, since that may initialise
 * units and configure their dependencies.</p>
 */
public final class Cradle {

    /**
     * Computes the options for one file. Must not throw; problems are
     * reported through {@link CradleLoadResult}.
     */
    @FunctionalInterface
    public interface Action {
        CradleLoadResult run(Path file);
    }

    public static final String ACTION_PREFIX = "Cabal-Helper";
    public static final String NONE_SUFFIX = "-None";

    private static final Set<String> STACK_ACTION_NAMES = Set.of(
            "stack", ACTION_PREFIX + "-Stack", ACTION_PREFIX + "-Stack" + NONE_SUFFIX);

    private final Path rootDir;
    private final String actionName;
    private final Action action;
    private final List<Path> otherPackageRoots;

    public Cradle(Path rootDir, String actionName, Action action) {
        this(rootDir, actionName, action, List.of());
    }

    /**
     * @param otherPackageRoots source directories of the other packages of
     *                          the same project
     */
    public Cradle(Path rootDir, String actionName, Action action, List<Path> otherPackageRoots) {
        this.rootDir = Objects.requireNonNull(rootDir, "rootDir");
        this.actionName = Objects.requireNonNull(actionName, "actionName");
        this.action = Objects.requireNonNull(action, "action");
        this.otherPackageRoots = List.copyOf(otherPackageRoots);
    }

    /** A cradle that can be queried for its root but never compiles anything. */
    public static Cradle none(Path rootDir, String actionName) {
        return new Cradle(rootDir, actionName, file -> CradleLoadResult.none());
    }

    public Path getRootDir() {
        return rootDir;
    }

    /**
     * Name identifying how the cradle was found, e.g.
     * {@code Cabal-Helper-Cabal-V2} or {@code Cabal-Helper-Stack-None}.
     */
    public String getActionName() {
        return actionName;
    }

    public CradleLoadResult load(Path file) {
        return action.run(file);
    }

    public List<Path> getOtherPackageRoots() {
        return otherPackageRoots;
    }

    /**
     * Whether no other package of the project is a closer match for
     * {@code file} than this cradle's package. A file outside every package
     * root, e.g. under an import directory, is accepted.
     */
    public boolean isNearestPackageFor(Path file) {
        boolean underRoot = FilePaths.isFilePathPrefixOf(rootDir, file);
        for (Path other : otherPackageRoots) {
            if (FilePaths.isFilePathPrefixOf(other, file)
                    && (!underRoot || other.getNameCount() > rootDir.getNameCount())) {
                return false;
            }
        }
        return true;
    }

    public boolean isNone() {
        return actionName.endsWith(NONE_SUFFIX);
    }

    /**
     * Whether the project is built with Stack, which decides how the compiler
     * version should be queried.
     */
    public boolean isStackCradle() {
        return STACK_ACTION_NAMES.contains(actionName);
    }

    @Override
    public String toString() {
        return "Cradle{" + actionName + ", root=" + rootDir + "}";
    }
}
