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

import com.tomaszrup.hsls.util.CanonicalPaths;
import com.tomaszrup.hsls.util.FilePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers cradles that successfully loaded a file, so that other files
 * under the same directories skip project and package discovery.
 *
 * <p>A cradle is registered under its root directory and every absolute
 * import directory ({@code -i<dir>}) of the flags it produced. Lookup picks
 * the cradle registered under the longest directory that prefixes the
 * file, unless the source directory of another package of its project is a
 * closer match. Such files are left to the resolver.</p>
 */
public class CradleCache {

	private static final Logger logger = LoggerFactory.getLogger(CradleCache.class);

	private final Map<Path, Cradle> cradlesByDir = new HashMap<>();

	public synchronized void register(Cradle cradle, ComponentOptions options) {
		List<Path> dirs = new ArrayList<>();
		dirs.add(cradle.getRootDir());
		for (String option : options.getOptions()) {
			if (option.startsWith("-i") && option.length() > 2) {
				Path dir = Paths.get(option.substring(2));
				if (dir.isAbsolute()) {
					dirs.add(dir);
				}
			}
		}
		for (Path dir : dirs) {
			cradlesByDir.put(CanonicalPaths.canonicalize(dir), cradle);
		}
		logger.debug("Registered {} under {}", cradle, dirs);
	}

	public synchronized Optional<Cradle> lookup(Path file) {
		Path canonical = CanonicalPaths.canonicalize(file);
		Path bestDir = null;
		Cradle best = null;
		for (Map.Entry<Path, Cradle> entry : cradlesByDir.entrySet()) {
			Path dir = entry.getKey();
			if (FilePaths.isFilePathPrefixOf(dir, canonical)
					&& (bestDir == null || dir.getNameCount() > bestDir.getNameCount())) {
				bestDir = dir;
				best = entry.getValue();
			}
		}
		if (best != null && !best.isNearestPackageFor(canonical)) {
			logger.debug("{} is registered for {} but another package is closer", best, canonical);
			return Optional.empty();
		}
		return Optional.ofNullable(best);
	}

	public synchronized int size() {
		return cradlesByDir.size();
	}

	/** Forgets every cradle, e.g. after a project or package file changed. */
	public synchronized void clear() {
		if (!cradlesByDir.isEmpty()) {
			logger.info("Clearing {} cached cradle location(s)", cradlesByDir.size());
		}
		cradlesByDir.clear();
	}
}
