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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Describes how a component is entered: a library exposing modules, an
 * executable with a {@code main-is} file, or a custom {@code Setup.hs}.
 */
public final class Entrypoint {

    public enum Type {
        LIBRARY,
        EXECUTABLE,
        SETUP
    }

    private final Type type;
    private final List<String> exposedModules;
    private final List<String> otherModules;
    private final String mainIs;

    private Entrypoint(Type type, List<String> exposedModules, List<String> otherModules, String mainIs) {
        this.type = type;
        this.exposedModules = Collections.unmodifiableList(exposedModules);
        this.otherModules = Collections.unmodifiableList(otherModules);
        this.mainIs = mainIs;
    }

    public static Entrypoint library(List<String> exposedModules, List<String> otherModules) {
        return new Entrypoint(Type.LIBRARY, List.copyOf(exposedModules), List.copyOf(otherModules), null);
    }

    public static Entrypoint executable(String mainIs, List<String> otherModules) {
        return new Entrypoint(Type.EXECUTABLE, Collections.emptyList(), List.copyOf(otherModules),
                Objects.requireNonNull(mainIs, "mainIs"));
    }

    public static Entrypoint setup(String mainIs) {
        return new Entrypoint(Type.SETUP, Collections.emptyList(), Collections.emptyList(),
                Objects.requireNonNull(mainIs, "mainIs"));
    }

    public Type getType() {
        return type;
    }

    public List<String> getExposedModules() {
        return exposedModules;
    }

    public List<String> getOtherModules() {
        return otherModules;
    }

    /** The {@code main-is} file, or {@code null} for libraries. */
    public String getMainIs() {
        return mainIs;
    }

    @Override
    public String toString() {
        switch (type) {
            case LIBRARY:
                return "Library{exposed=" + exposedModules + ", other=" + otherModules + "}";
            case EXECUTABLE:
                return "Executable{mainIs=" + mainIs + ", other=" + otherModules + "}";
            default:
                return "Setup{mainIs=" + mainIs + "}";
        }
    }
}
