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
package com.tomaszrup.hsls;

import java.nio.file.Path;

import com.tomaszrup.hsls.cradle.ComponentOptions;
import com.tomaszrup.hsls.cradle.Cradle;

/**
 * Compiles a single module with the flags its cradle produced.
 *
 * @param <A> the compiled artifact, stored in the artifact cache
 */
@FunctionalInterface
public interface ModuleCompiler<A> {

    /**
     * @param cradle  the cradle that produced {@code options}; its root is the
     *                directory the compiler should run in
     * @param file    canonical path of the module to compile
     * @param options flags followed by the targets to load
     * @throws CompileException if the module does not compile
     */
    A compile(Cradle cradle, Path file, ComponentOptions options) throws CompileException;
}
