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

/**
 * Why a cradle could not produce flags for a file.
 */
public final class CradleError {

    /** Exit code used when no component claims the file. */
    public static final int NO_COMPONENT_EXIT_CODE = 2;

    private final int exitCode;
    private final String message;
    private final Path file;

    public CradleError(int exitCode, String message, Path file) {
        this.exitCode = exitCode;
        this.message = message;
        this.file = file;
    }

    public static CradleError noComponent(Path file) {
        return new CradleError(NO_COMPONENT_EXIT_CODE, "Could not obtain flags for " + file, file);
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getMessage() {
        return message;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public String toString() {
        return "CradleError{exit=" + exitCode + ", " + message + "}";
    }
}
