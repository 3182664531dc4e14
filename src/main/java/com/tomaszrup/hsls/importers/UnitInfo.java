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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of initialising a unit: the components it is made of, in the
 * order the helper reported them.
 */
public final class UnitInfo {

    private final String unitId;
    private final List<ComponentInfo> components;

    public UnitInfo(String unitId, List<ComponentInfo> components) {
        this.unitId = unitId;
        this.components = Collections.unmodifiableList(new ArrayList<>(components));
    }

    public String getUnitId() {
        return unitId;
    }

    public List<ComponentInfo> getComponents() {
        return components;
    }

    @Override
    public String toString() {
        return "UnitInfo{" + unitId + ", components=" + components + "}";
    }
}
