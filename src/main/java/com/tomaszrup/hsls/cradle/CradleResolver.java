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
import com.tomaszrup.hsls.importers.CabalPackage;
import com.tomaszrup.hsls.importers.ProjectLocator;
import com.tomaszrup.hsls.importers.ProjectReference;
import com.tomaszrup.hsls.util.CanonicalPaths;
import com.tomaszrup.hsls.util.FilePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the {@link Cradle} for a source file.
 *
 * <p>Resolution has three steps:</p>
 * <ol>
 *   <li>Find the project the file belongs to, see {@link ProjectLocator}.</li>
 *   <li>Pick the package of that project whose source directory is the
 *       longest prefix of the file. Its canonical directory becomes the
 *       cradle root.</li>
 *   <li>Lazily, when the cradle is loaded, find the component of the package
 *       that contains the file and compute its flags, see
 *       {@link ComponentMatcher}.</li>
 * </ol>
 *
 * <p>Only the first two steps run here. They are cheap compared to the third,
 * which may configure the whole unit. Resolution never throws: a file outside
 * any project or package gets a cradle that loads nothing.</p>
 */
public class CradleResolver {

	private static final Logger logger = LoggerFactory.getLogger(CradleResolver.class);

	private final ProjectLocator locator;
	private final BuildToolBackend backend;
	private final Path workingDirectory;

	public CradleResolver(ProjectLocator locator, BuildToolBackend backend, Path workingDirectory) {
		this.locator = locator;
		this.backend = backend;
		this.workingDirectory = workingDirectory;
	}

	public Cradle resolve(Path file) {
		Path absoluteFile = file.toAbsolutePath().normalize();
		Optional<ProjectReference> entryPoint = locator.findEntryPoint(absoluteFile);
		if (entryPoint.isEmpty()) {
			logger.error("Could not find a project for {}. Neither a stack nor a cabal project "
					+ "was found, or the build tool is not installed", file);
			return Cradle.none(workingDirectory, Cradle.ACTION_PREFIX + Cradle.NONE_SUFFIX);
		}
		ProjectReference project = entryPoint.get();
		logger.info("Using project {} for {}", project, file);

		List<CabalPackage> packages;
		try {
			packages = backend.listPackages(project);
		} catch (IOException e) {
			logger.warn("Could not list packages of {}: {}", project, e.getMessage());
			return projectNoneCradle(project);
		}

		Optional<CabalPackage> match = findPackageFor(packages, absoluteFile);
		if (match.isEmpty()) {
			logger.debug("No package of {} contains {}", project, file);
			return projectNoneCradle(project);
		}
		CabalPackage pkg = match.get();
		Path root = CanonicalPaths.canonicalize(pkg.getSourceDir());
		logger.debug("Package {} at {} contains {}", pkg.getName(), root, file);

		List<Path> otherRoots = new ArrayList<>();
		for (CabalPackage other : packages) {
			if (other != pkg) {
				otherRoots.add(CanonicalPaths.canonicalize(other.getSourceDir()));
			}
		}
		ComponentMatcher matcher = new ComponentMatcher(backend, pkg.getUnits());
		return new Cradle(root, actionName(project),
				target -> matcher.load(root, CanonicalPaths.canonicalize(target)), otherRoots);
	}

	/**
	 * The package whose source directory is the longest path-prefix of
	 * {@code file}, if any.
	 */
	static Optional<CabalPackage> findPackageFor(List<CabalPackage> packages, Path file) {
		List<CabalPackage> sorted = new ArrayList<>(packages);
		sorted.sort((a, b) -> b.getSourceDir().getNameCount() - a.getSourceDir().getNameCount());
		for (CabalPackage pkg : sorted) {
			if (FilePaths.isFilePathPrefixOf(pkg.getSourceDir(), file)) {
				return Optional.of(pkg);
			}
		}
		return Optional.empty();
	}

	private static Cradle projectNoneCradle(ProjectReference project) {
		return Cradle.none(project.getRootDir(), actionName(project) + Cradle.NONE_SUFFIX);
	}

	private static String actionName(ProjectReference project) {
		return Cradle.ACTION_PREFIX + "-" + project.getDiscriminator();
	}
}
