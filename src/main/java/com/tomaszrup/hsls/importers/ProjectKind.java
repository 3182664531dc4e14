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

/**
 * Supported build-tool project layouts.
 */
public enum ProjectKind {
    STACK_YAML("Stack", "stack", ".stack-work", false),
    CABAL_V2_FILE("Cabal-V2", "cabal", "dist-newstyle", false),
    CABAL_V2_DIR("Cabal-V2-Dir", "cabal", "dist-newstyle", false),
    CABAL_V1_FILE("Cabal-V1", "cabal", "dist", true),
    CABAL_V1_DIR("Cabal-V1-Dir", "cabal", "dist", true);

    private final String discriminator;
    private final String toolName;
    private final String defaultDistDir;
    private final boolean legacy;

    ProjectKind(String discriminator, String toolName, String defaultDistDir, boolean legacy) {
        this.discriminator = discriminator;
        this.toolName = toolName;
        this.defaultDistDir = defaultDistDir;
        this.legacy = legacy;
    }

    /** Stable name used as the cradle action suffix, e.g. {@code "Cabal-V2"}. */
    public String getDiscriminator() {
        return discriminator;
    }

    /** Executable that must be on the PATH to build this kind of project. */
    public String getToolName() {
        return toolName;
    }

    public String getDefaultDistDir() {
        return defaultDistDir;
    }

    /** Cabal v1 layouts only win when no Stack or Cabal v2 project was found. */
    public boolean isLegacy() {
        return legacy;
    }
}
