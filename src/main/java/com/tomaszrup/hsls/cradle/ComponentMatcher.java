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

import com.tomaszrup.hsls.importers.BuildToolBackend;
import com.tomaszrup.hsls.importers.CabalUnit;
import com.tomaszrup.hsls.importers.ComponentInfo;
import com.tomaszrup.hsls.importers.Entrypoint;
import com.tomaszrup.hsls.importers.UnitInfo;
import com.tomaszrup.hsls.importers.UnitIntrospection;
import com.tomaszrup.hsls.util.FilePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Finds the component of a package that a source file belongs to and builds
 * the compiler flags for it.
 *
 * <p>Units are asked lazily, in order. Successful unit introspections are
 * memoised for the lifetime of the matcher; failed ones are retried on the
 * next request. If a file belongs to several components, the first one in
 * unit order wins.</p>
 */
public class ComponentMatcher {

    private static final Logger logger = LoggerFactory.getLogger(ComponentMatcher.class);

    private static final String IMPORT_DIR_FLAG = "-i";

    private final BuildToolBackend backend;
    private final List<CabalUnit> units;
    private final Map<CabalUnit, UnitInfo> introspected = new ConcurrentHashMap<>();

    public ComponentMatcher(BuildToolBackend backend, List<CabalUnit> units) {
        this.backend = backend;
        this.units = List.copyOf(units);
    }

    /**
     * Computes the options for {@code file}, which is made relative to
     * {@code root} first.
     */
    public CradleLoadResult load(Path root, Path file) {
        Path relativeFile = FilePaths.makeRelative(root, file);
        logger.debug("Relative module path: {}", relativeFile);
        Optional<ComponentInfo> component = findComponent(relativeFile);
        if (component.isEmpty()) {
            return CradleLoadResult.failed(CradleError.noComponent(file));
        }
        ComponentInfo comp = component.get();
        List<String> flags = new ArrayList<>();
        for (String option : comp.getGhcOptions()) {
            flags.add(fixImportDirs(root, option));
        }
        flags.addAll(getTargets(comp, relativeFile));
        logger.debug("Flags for {}: {} (component {})", file, flags, comp.getName());
        return CradleLoadResult.success(new ComponentOptions(flags));
    }

    /**
     * First component, in unit order, that claims {@code relativeFile}.
     * Units whose introspection fails are skipped with a warning.
     */
    public Optional<ComponentInfo> findComponent(Path relativeFile) {
        for (CabalUnit unit : units) {
            UnitInfo info = introspect(unit, relativeFile);
            if (info == null) {
                continue;
            }
            for (ComponentInfo component : info.getComponents()) {
                if (partOfComponent(relativeFile, component)) {
                    return Optional.of(component);
                }
            }
        }
        return Optional.empty();
    }

    private UnitInfo introspect(CabalUnit unit, Path relativeFile) {
        UnitInfo cached = introspected.get(unit);
        if (cached != null) {
            return cached;
        }
        UnitIntrospection result = backend.introspectUnit(unit);
        if (!result.isSuccess()) {
            logger.warn("Skipping unit {} while looking for the component of {}: {}",
                    unit, relativeFile, result.getError().getMessage());
            return null;
        }
        UnitInfo previous = introspected.putIfAbsent(unit, result.getInfo());
        return previous != null ? previous : result.getInfo();
    }

    /**
     * A file belongs to a component when one of the component's source
     * directories is a prefix of it and either its module name (or the path
     * itself) is one of the component's targets, or the remainder is the
     * component's {@code main-is}.
     */
    public static boolean partOfComponent(Path relativeFile, ComponentInfo component) {
        Optional<Path> relative = FilePaths.relativeTo(relativeFile, component.getSourceDirs());
        if (relative.isEmpty()) {
            return false;
        }
        List<String> targets = getTargets(component, relativeFile);
        String moduleName = FilePaths.toModuleName(relative.get());
        if (targets.contains(moduleName) || targets.contains(FilePaths.toSlashString(relativeFile))) {
            return true;
        }
        String mainIs = component.getEntrypoint().getMainIs();
        return mainIs != null && Paths.get(mainIs).equals(relative.get());
    }

    /**
     * Everything the component should load alongside the file.
     * Executables contribute their main module under the first source
     * directory that prefixes {@code relativeFile}.
     */
    public static List<String> getTargets(ComponentInfo component, Path relativeFile) {
        Entrypoint entrypoint = component.getEntrypoint();
        switch (entrypoint.getType()) {
            case LIBRARY: {
                List<String> targets = new ArrayList<>(entrypoint.getExposedModules());
                targets.addAll(entrypoint.getOtherModules());
                return targets;
            }
            case EXECUTABLE: {
                List<String> targets = new ArrayList<>();
                for (Path sourceDir : component.getSourceDirs()) {
                    if (FilePaths.isFilePathPrefixOf(sourceDir, relativeFile)) {
                        Path main = sourceDir.resolve(entrypoint.getMainIs()).normalize();
                        targets.add(FilePaths.toSlashString(main));
                        break;
                    }
                }
                targets.addAll(entrypoint.getOtherModules());
                return targets;
            }
            default:
                return Collections.emptyList();
        }
    }

    /**
     * Import directories reported by the helper are relative to the package
     * source directory. Anchors them at {@code root}; a bare {@code -i}
     * keeps its meaning of clearing the search path.
     */
    public static String fixImportDirs(Path root, String option) {
        if (!option.startsWith(IMPORT_DIR_FLAG)) {
            return option;
        }
        String dir = option.substring(IMPORT_DIR_FLAG.length());
        if (dir.isEmpty() || Paths.get(dir).isAbsolute()) {
            return option;
        }
        return IMPORT_DIR_FLAG + root.resolve(dir);
    }
}
