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

import java.io.IOException;
import java.util.Objects;

/**
 * Outcome of asking the backend for a unit's components: either the
 * {@link UnitInfo} or the I/O error that prevented it. Callers skip failed
 * units and move on to the next one.
 */
public final class UnitIntrospection {

    private final CabalUnit unit;
    private final UnitInfo info;
    private final IOException error;

    private UnitIntrospection(CabalUnit unit, UnitInfo info, IOException error) {
        this.unit = unit;
        this.info = info;
        this.error = error;
    }

    public static UnitIntrospection success(CabalUnit unit, UnitInfo info) {
        return new UnitIntrospection(unit, Objects.requireNonNull(info, "info"), null);
    }

    public static UnitIntrospection failure(CabalUnit unit, IOException error) {
        return new UnitIntrospection(unit, null, Objects.requireNonNull(error, "error"));
    }

    public CabalUnit getUnit() {
        return unit;
    }

    public boolean isSuccess() {
        return info != null;
    }

    /** The unit's info; {@code null} when introspection failed. */
    public UnitInfo getInfo() {
        return info;
    }

    /** The failure cause; {@code null} on success. */
    public IOException getError() {
        return error;
    }
}
