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

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Compiler flags (followed by compile targets) for one file, plus files
 * whose change should invalidate them.
 */
public final class ComponentOptions {

    private final List<String> options;
    private final List<Path> dependencies;

    public ComponentOptions(List<String> options, List<Path> dependencies) {
        this.options = List.copyOf(options);
        this.dependencies = List.copyOf(dependencies);
    }

    public ComponentOptions(List<String> options) {
        this(options, Collections.emptyList());
    }

    public List<String> getOptions() {
        return options;
    }

    public List<Path> getDependencies() {
        return dependencies;
    }

    @Override
    public String toString() {
        return "ComponentOptions" + options;
    }
}
