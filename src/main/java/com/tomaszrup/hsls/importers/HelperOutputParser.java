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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parses the JSON printed by the project metadata helper.
 *
 * <p>{@code packages} output:</p>
 * <pre>{@code
 * {"packages": [
 *   {"name": "foo", "sourceDir": "/repo/./foo", "units": ["lib:foo", "exe:foo"]}
 * ]}
 * }</pre>
 *
 * <p>{@code unit-info} output:</p>
 * <pre>{@code
 * {"unitId": "exe:foo", "components": [
 *   {"name": "exe:foo", "sourceDirs": ["app"],
 *    "entrypoint": {"type": "executable", "mainIs": "Main.hs", "otherModules": []},
 *    "ghcOptions": ["-iapp", "-package-id", "base-4.12.0.0"]}
 * ]}
 * }</pre>
 *
 * <p>Entry point types are {@code library} (with {@code exposedModules} and
 * {@code otherModules}), {@code executable} and {@code setup}.</p>
 */
class HelperOutputParser {

    static final String KEY_PACKAGES = "packages";
    static final String KEY_NAME = "name";
    static final String KEY_SOURCE_DIR = "sourceDir";
    static final String KEY_UNITS = "units";
    static final String KEY_UNIT_ID = "unitId";
    static final String KEY_COMPONENTS = "components";
    static final String KEY_SOURCE_DIRS = "sourceDirs";
    static final String KEY_ENTRYPOINT = "entrypoint";
    static final String KEY_TYPE = "type";
    static final String KEY_EXPOSED_MODULES = "exposedModules";
    static final String KEY_OTHER_MODULES = "otherModules";
    static final String KEY_MAIN_IS = "mainIs";
    static final String KEY_GHC_OPTIONS = "ghcOptions";

    private HelperOutputParser() {
    }

    /**
     * Parses the package listing. Relative source directories are resolved
     * against the project root, and all of them normalised. Packages without units are skipped.
     */
    static List<CabalPackage> parsePackages(String output, ProjectReference project) throws IOException {
        JsonObject root = parseObject(output);
        JsonArray packages = requireArray(root, KEY_PACKAGES);
        List<CabalPackage> result = new ArrayList<>();
        for (JsonElement element : packages) {
            JsonObject pkg = asObject(element, KEY_PACKAGES);
            String name = requireString(pkg, KEY_NAME);
            Path sourceDir = Paths.get(requireString(pkg, KEY_SOURCE_DIR));
            if (!sourceDir.isAbsolute()) {
                sourceDir = project.getRootDir().resolve(sourceDir);
            }
            sourceDir = sourceDir.normalize();
            List<CabalUnit> units = new ArrayList<>();
            for (String unitId : stringList(pkg, KEY_UNITS)) {
                units.add(new CabalUnit(unitId, project, sourceDir));
            }
            if (!units.isEmpty()) {
                result.add(new CabalPackage(name, sourceDir, units));
            }
        }
        return result;
    }

    static UnitInfo parseUnitInfo(String output, CabalUnit unit) throws IOException {
        JsonObject root = parseObject(output);
        String unitId = root.has(KEY_UNIT_ID) ? requireString(root, KEY_UNIT_ID) : unit.getUnitId();
        List<ComponentInfo> components = new ArrayList<>();
        for (JsonElement element : requireArray(root, KEY_COMPONENTS)) {
            components.add(parseComponent(asObject(element, KEY_COMPONENTS)));
        }
        return new UnitInfo(unitId, components);
    }

    static ComponentInfo parseComponent(JsonObject component) throws IOException {
        String name = requireString(component, KEY_NAME);
        List<Path> sourceDirs = new ArrayList<>();
        for (String dir : stringList(component, KEY_SOURCE_DIRS)) {
            sourceDirs.add(Paths.get(dir));
        }
        if (!component.has(KEY_ENTRYPOINT)) {
            throw new IOException("Component " + name + " has no " + KEY_ENTRYPOINT);
        }
        Entrypoint entrypoint = parseEntrypoint(asObject(component.get(KEY_ENTRYPOINT), KEY_ENTRYPOINT));
        return new ComponentInfo(name, sourceDirs, entrypoint, stringList(component, KEY_GHC_OPTIONS));
    }

    static Entrypoint parseEntrypoint(JsonObject entrypoint) throws IOException {
        String type = requireString(entrypoint, KEY_TYPE);
        switch (type) {
            case "library":
                return Entrypoint.library(stringList(entrypoint, KEY_EXPOSED_MODULES),
                        stringList(entrypoint, KEY_OTHER_MODULES));
            case "executable":
                return Entrypoint.executable(requireString(entrypoint, KEY_MAIN_IS),
                        stringList(entrypoint, KEY_OTHER_MODULES));
            case "setup":
                return Entrypoint.setup(requireString(entrypoint, KEY_MAIN_IS));
            default:
                throw new IOException("Unknown entrypoint type '" + type + "'");
        }
    }

    // ---- JSON helpers ----

    private static JsonObject parseObject(String output) throws IOException {
        if (output == null || output.isBlank()) {
            throw new IOException("Helper produced no output");
        }
        try {
            JsonElement element = JsonParser.parseString(output);
            if (!element.isJsonObject()) {
                throw new IOException("Helper output is not a JSON object");
            }
            return element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("Malformed helper output: " + e.getMessage(), e);
        }
    }

    private static JsonObject asObject(JsonElement element, String context) throws IOException {
        if (element == null || !element.isJsonObject()) {
            throw new IOException("Expected an object in '" + context + "'");
        }
        return element.getAsJsonObject();
    }

    private static JsonArray requireArray(JsonObject obj, String key) throws IOException {
        JsonElement element = obj.get(key);
        if (element == null || !element.isJsonArray()) {
            throw new IOException("Missing array '" + key + "'");
        }
        return element.getAsJsonArray();
    }

    private static String requireString(JsonObject obj, String key) throws IOException {
        JsonElement element = obj.get(key);
        if (element == null || !element.isJsonPrimitive()) {
            throw new IOException("Missing string '" + key + "'");
        }
        return element.getAsString();
    }

    private static List<String> stringList(JsonObject obj, String key) throws IOException {
        JsonElement element = obj.get(key);
        if (element == null || element.isJsonNull()) {
            return Collections.emptyList();
        }
        if (!element.isJsonArray()) {
            throw new IOException("Expected array '" + key + "'");
        }
        List<String> values = new ArrayList<>();
        for (JsonElement value : element.getAsJsonArray()) {
            if (value.isJsonPrimitive()) {
                values.add(value.getAsString());
            }
        }
        return values;
    }
}
