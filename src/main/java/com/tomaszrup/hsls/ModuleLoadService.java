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
import com.tomaszrup.hsls.cache.CacheEntry;
import com.tomaszrup.hsls.cradle.Cradle;
import com.tomaszrup.hsls.cradle.CradleCache;
import com.tomaszrup.hsls.cradle.CradleLoadResult;
import com.tomaszrup.hsls.cradle.CradleResolver;
import com.tomaszrup.hsls.util.CanonicalPaths;
import com.tomaszrup.hsls.util.MdcProjectContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Loads modules into the {@link ArtifactCache}.
 *
 * <p>A load runs in two stages:</p>
 * <ol>
 *   <li>On the import pool: find the cradle for the file, from the
 *       {@link CradleCache} if possible, otherwise through the
 *       {@link CradleResolver}, and ask it for the file's flags. A cached
 *       cradle that does not claim the file is bypassed and the file is
 *       resolved from scratch.</li>
 *   <li>On the single-threaded compile pool: compile, and either store the
 *       artifact or mark the file as failed. Either way everything waiting
 *       on the file is resumed.</li>
 * </ol>
 *
 * <p>Concurrent load requests for the same file share one in-flight load.
 * Requests for cached data go through {@link #awaitEntry(Path)}, which gives
 * up after the configured request timeout; the abandoned wait is resumed
 * later and simply ignored.</p>
 *
 * @param <A> artifact type
 */
public class ModuleLoadService<A> {

	private static final Logger logger = LoggerFactory.getLogger(ModuleLoadService.class);

	private final CradleResolver resolver;
	private final CradleCache cradleCache;
	private final ModuleCompiler<A> compiler;
	private final ArtifactCache<A> artifactCache;
	private final ExecutorService importPool;
	private final ExecutorService compilePool;
	private final long requestTimeoutSeconds;

	private final ConcurrentHashMap<Path, CompletableFuture<CacheEntry<A>>> inFlight = new ConcurrentHashMap<>();

	/**
	 * @param cradleCache cache of resolved cradles, or {@code null} to resolve
	 *                    every file from scratch
	 */
	public ModuleLoadService(CradleResolver resolver, CradleCache cradleCache, ModuleCompiler<A> compiler,
							 ArtifactCache<A> artifactCache, ExecutorPools executorPools, long requestTimeoutSeconds) {
		this.resolver = resolver;
		this.cradleCache = cradleCache;
		this.compiler = compiler;
		this.artifactCache = artifactCache;
		this.importPool = executorPools.getImportPool();
		this.compilePool = executorPools.getCompilePool();
		this.requestTimeoutSeconds = requestTimeoutSeconds;
	}

	/**
	 * Starts loading {@code file} unless a load is already in flight.
	 *
	 * @return completes with the entry stored for the file: a success entry
	 *         with the new artifact, or a failed one
	 */
	public CompletableFuture<CacheEntry<A>> load(Path file) {
		Path canonical = CanonicalPaths.canonicalize(file);
		CompletableFuture<CacheEntry<A>> started = new CompletableFuture<>();
		CompletableFuture<CacheEntry<A>> existing = inFlight.putIfAbsent(canonical, started);
		if (existing != null) {
			logger.debug("Load already in flight for {}", canonical);
			return existing;
		}
		logger.info("Scheduling load of {}", canonical);
		CompletableFuture
				.supplyAsync(() -> resolveFlags(canonical), importPool)
				.thenApplyAsync(resolved -> compileAndStore(resolved, canonical), compilePool)
				.whenComplete((entry, error) -> {
					inFlight.remove(canonical, started);
					if (error != null) {
						logger.error("Load of {} failed unexpectedly: {}", canonical, error.getMessage(), error);
						started.complete(artifactCache.markFailed(canonical));
					} else {
						started.complete(entry);
					}
				});
		return started;
	}

	/**
	 * Waits up to the request timeout for an entry of {@code file}. Returns
	 * immediately if a fresh entry is cached. Does not start a load.
	 */
	public Optional<CacheEntry<A>> awaitEntry(Path file) {
		CompletableFuture<CacheEntry<A>> future = artifactCache.awaitEntry(file);
		try {
			return Optional.of(future.get(requestTimeoutSeconds, TimeUnit.SECONDS));
		} catch (TimeoutException e) {
			logger.warn("Timed out after {}s waiting for {}", requestTimeoutSeconds, file);
			return Optional.empty();
		} catch (ExecutionException e) {
			logger.warn("Waiting for {} failed: {}", file, e.getCause().getMessage());
			return Optional.empty();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return Optional.empty();
		}
	}

	/**
	 * Forgets cached cradles. Call when a project or package description
	 * changed, as the package and component layout may be different now.
	 */
	public void invalidateCradles() {
		if (cradleCache != null) {
			cradleCache.clear();
		}
	}

	/** Drops the cached artifact of a deleted file. */
	public void fileDeleted(Path file) {
		artifactCache.delete(file);
	}

	public boolean isLoading(Path file) {
		return inFlight.containsKey(CanonicalPaths.canonicalize(file));
	}

	private ResolvedFlags resolveFlags(Path file) {
		if (cradleCache != null) {
			Optional<Cradle> cached = cradleCache.lookup(file);
			if (cached.isPresent()) {
				logger.debug("Reusing {} for {}", cached.get(), file);
				CradleLoadResult result = loadFlags(cached.get(), file);
				if (result.getStatus() != CradleLoadResult.Status.FAILED) {
					return new ResolvedFlags(cached.get(), result);
				}
				logger.debug("{} does not claim {}, resolving again", cached.get(), file);
			}
		}
		Cradle cradle = resolver.resolve(file);
		return new ResolvedFlags(cradle, loadFlags(cradle, file));
	}

	private static CradleLoadResult loadFlags(Cradle cradle, Path file) {
		MdcProjectContext.setProject(cradle.getRootDir());
		try {
			return cradle.load(file);
		} finally {
			MdcProjectContext.clear();
		}
	}

	private CacheEntry<A> compileAndStore(ResolvedFlags resolved, Path file) {
		Cradle cradle = resolved.cradle;
		CradleLoadResult result = resolved.result;
		MdcProjectContext.setProject(cradle.getRootDir());
		try {
			switch (result.getStatus()) {
				case NONE:
					logger.info("No cradle can compile {} ({})", file, cradle.getActionName());
					return artifactCache.markFailed(file);
				case FAILED:
					logger.warn("Could not get flags for {}: {}", file, result.getError().getMessage());
					return artifactCache.markFailed(file);
				default:
					break;
			}
			if (cradleCache != null) {
				cradleCache.register(cradle, result.getOptions());
			}
			A artifact;
			try {
				artifact = compiler.compile(cradle, file, result.getOptions());
			} catch (CompileException e) {
				logger.warn("Compilation of {} failed: {}", file, e.getMessage());
				return artifactCache.markFailed(file);
			}
			logger.info("Loaded {}", file);
			return artifactCache.store(file, artifact);
		} finally {
			MdcProjectContext.clear();
		}
	}

	private static final class ResolvedFlags {
		final Cradle cradle;
		final CradleLoadResult result;

		ResolvedFlags(Cradle cradle, CradleLoadResult result) {
			this.cradle = cradle;
			this.result = result;
		}
	}
}
