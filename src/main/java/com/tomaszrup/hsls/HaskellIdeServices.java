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

import com.tomaszrup.hsls.cache.ArtifactCache;
import com.tomaszrup.hsls.cradle.CradleCache;
import com.tomaszrup.hsls.cradle.CradleResolver;
import com.tomaszrup.hsls.importers.BuildToolBackend;
import com.tomaszrup.hsls.importers.CabalHelperBackend;
import com.tomaszrup.hsls.importers.ExecutableLookup;
import com.tomaszrup.hsls.importers.PathExecutableLookup;
import com.tomaszrup.hsls.importers.ProjectLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Owns the settings, thread pools, caches and services of one server
 * instance.
 *
 * <p>Lifecycle: construct, call {@link #initialize(Object)} once with the
 * client's initialization options, use the services, then call
 * {@link #shutdown()}.</p>
 *
 * @param <A> artifact type produced by the {@link ModuleCompiler}
 */
public class HaskellIdeServices<A> {

	private static final Logger logger = LoggerFactory.getLogger(HaskellIdeServices.class);

	private final ModuleCompiler<A> compiler;
	private final BuildToolBackend backendOverride;
	private final ExecutableLookup executableLookup;
	private final Path workingDirectory;

	private ServerSettings settings;
	private ExecutorPools executorPools;
	private ArtifactCache<A> artifactCache;
	private CradleResolver cradleResolver;
	private ModuleLoadService<A> moduleLoadService;
	private boolean shutDown;

	public HaskellIdeServices(ModuleCompiler<A> compiler) {
		this(compiler, null, new PathExecutableLookup(), Paths.get("").toAbsolutePath());
	}

	/**
	 * @param backendOverride backend to use instead of a {@link CabalHelperBackend}
	 *                        configured from the settings; may be {@code null}
	 */
	public HaskellIdeServices(ModuleCompiler<A> compiler, BuildToolBackend backendOverride,
							  ExecutableLookup executableLookup, Path workingDirectory) {
		this.compiler = compiler;
		this.backendOverride = backendOverride;
		this.executableLookup = executableLookup;
		this.workingDirectory = workingDirectory;
	}

	public synchronized void initialize(Object initializationOptions) {
		if (settings != null) {
			throw new IllegalStateException("Already initialized");
		}
		if (shutDown) {
			throw new IllegalStateException("Already shut down");
		}
		ServerSettings parsed = InitializationOptionsParser.parse(initializationOptions);
		logger.info("Initializing with {}", parsed);

		BuildToolBackend backend = backendOverride != null
				? backendOverride
				: new CabalHelperBackend(parsed.getHelperCommand(), parsed.getHelperTimeoutSeconds());
		ProjectLocator locator = new ProjectLocator(backend, executableLookup);

		this.executorPools = new ExecutorPools();
		this.artifactCache = new ArtifactCache<>();
		this.cradleResolver = new CradleResolver(locator, backend, workingDirectory);
		CradleCache cradleCache = parsed.isCradleCacheEnabled() ? new CradleCache() : null;
		this.moduleLoadService = new ModuleLoadService<>(cradleResolver, cradleCache, compiler,
				artifactCache, executorPools, parsed.getRequestTimeoutSeconds());
		this.settings = parsed;
	}

	public synchronized void shutdown() {
		if (shutDown) {
			return;
		}
		shutDown = true;
		if (executorPools != null) {
			executorPools.shutdownAll();
		}
		if (artifactCache != null) {
			artifactCache.clear();
		}
		logger.info("Shut down");
	}

	public synchronized ServerSettings getSettings() {
		requireInitialized();
		return settings;
	}

	public synchronized ArtifactCache<A> getArtifactCache() {
		requireInitialized();
		return artifactCache;
	}

	public synchronized CradleResolver getCradleResolver() {
		requireInitialized();
		return cradleResolver;
	}

	public synchronized ModuleLoadService<A> getModuleLoadService() {
		requireInitialized();
		return moduleLoadService;
	}

	private void requireInitialized() {
		if (settings == null) {
			throw new IllegalStateException("Not initialized");
		}
	}
}
