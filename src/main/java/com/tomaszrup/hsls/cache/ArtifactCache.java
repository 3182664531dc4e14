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
package com.tomaszrup.hsls.cache;

import com.tomaszrup.hsls.util.CanonicalPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Compiled artifacts keyed by canonical file path, with content-hash
 * invalidation and a queue of continuations for files that are still being
 * loaded.
 *
 * <p>Reads are lock-free. A success entry is only returned while the file's
 * current {@link ContentHash} matches the one recorded when the artifact was
 * stored; a stale entry stays in the map but is reported as absent. Failed
 * entries are returned as they are.</p>
 *
 * <p>Writes ({@link #store}, {@link #markFailed}, {@link #delete}) and the
 * decision to enqueue a continuation are serialised on one monitor, so a
 * continuation is either run immediately or seen by the next write. Queued
 * continuations run after the monitor is released, in the order they were
 * added, exactly once.</p>
 *
 * <p>Each entry owns the values derived from its artifact
 * ({@link #getOrCompute}). Storing a new artifact replaces the entry and
 * with it all derived values; {@link #updateKeepingDerived} keeps them.</p>
 *
 * @param <A> artifact type
 */
public class ArtifactCache<A> {

    private static final Logger logger = LoggerFactory.getLogger(ArtifactCache.class);

    private final Object lock = new Object();
    private final Map<Path, CacheEntry<A>> entries = new ConcurrentHashMap<>();
    private final Map<Path, Deque<CacheContinuation<A>>> pending = new HashMap<>();

    // ---- Reads ----

    /**
     * The entry for {@code path}, unless there is none or the file changed
     * since its artifact was stored.
     */
    public Optional<CacheEntry<A>> lookup(Path path) {
        return freshEntry(CanonicalPaths.canonicalize(path));
    }

    /**
     * Applies {@code fn} to the cached artifact if a fresh success entry
     * exists, otherwise returns {@code defaultValue} without waiting.
     */
    public <R> R ifCached(Path path, R defaultValue, Function<? super A, ? extends R> fn) {
        Optional<CacheEntry<A>> entry = lookup(path);
        if (entry.isPresent() && entry.get().isSuccess()) {
            return fn.apply(entry.get().getArtifact());
        }
        return defaultValue;
    }

    /**
     * Like {@link #ifCached}, but only for an artifact satisfying
     * {@code ready}, and hands {@code fn} the value derived under
     * {@code key} as well, computing it if needed.
     */
    public <T, R> R ifCachedAndData(Path path, R defaultValue, Predicate<? super A> ready, DerivedDataKey<T> key,
            Function<? super A, ? extends T> producer, BiFunction<? super A, ? super T, ? extends R> fn) {
        Optional<CacheEntry<A>> entry = lookup(path);
        if (entry.isEmpty() || !entry.get().isSuccess() || !ready.test(entry.get().getArtifact())) {
            return defaultValue;
        }
        return fn.apply(entry.get().getArtifact(), getOrCompute(entry.get(), key, producer));
    }

    // ---- Writes ----

    /**
     * Stores a freshly compiled artifact, replacing any previous entry and its
     * derived values, then resumes everything waiting on the file.
     *
     * @return the new entry
     */
    public CacheEntry<A> store(Path path, A artifact) {
        Path canonical = CanonicalPaths.canonicalize(path);
        CacheEntry<A> entry = CacheEntry.success(canonical, artifact, ContentHash.of(canonical));
        Deque<CacheContinuation<A>> waiting;
        synchronized (lock) {
            entries.put(canonical, entry);
            waiting = pending.remove(canonical);
        }
        logger.debug("Cached artifact for {} ({})", canonical, entry.getHash());
        resume(canonical, waiting, entry);
        return entry;
    }

    public void storeAll(Map<Path, ? extends A> artifacts) {
        for (Map.Entry<Path, ? extends A> artifact : artifacts.entrySet()) {
            store(artifact.getKey(), artifact.getValue());
        }
    }

    /**
     * Replaces the artifact of an existing success entry with
     * {@code update(artifact)} while keeping its content hash and derived
     * values. Used to attach extra information to an artifact without
     * invalidating what was computed from it. Missing and failed entries are
     * left alone, and no continuation is resumed.
     *
     * @return the updated entry, if there was a success entry to update
     */
    public Optional<CacheEntry<A>> updateKeepingDerived(Path path, UnaryOperator<A> update) {
        Path canonical = CanonicalPaths.canonicalize(path);
        synchronized (lock) {
            CacheEntry<A> current = entries.get(canonical);
            if (current == null || !current.isSuccess()) {
                logger.debug("No artifact to update for {}", canonical);
                return Optional.empty();
            }
            CacheEntry<A> updated = current.withArtifact(update.apply(current.getArtifact()));
            entries.put(canonical, updated);
            return Optional.of(updated);
        }
    }

    /**
     * Records that loading {@code path} failed. An existing entry, successful
     * or not, is kept so a broken edit does not discard the last good
     * artifact. Waiting continuations are resumed with a failed entry either
     * way.
     *
     * @return the failed entry handed to waiting continuations
     */
    public CacheEntry<A> markFailed(Path path) {
        Path canonical = CanonicalPaths.canonicalize(path);
        CacheEntry<A> failed = CacheEntry.failed(canonical);
        Deque<CacheContinuation<A>> waiting;
        synchronized (lock) {
            CacheEntry<A> previous = entries.putIfAbsent(canonical, failed);
            if (previous != null) {
                logger.debug("Load of {} failed, keeping previous entry {}", canonical, previous);
            }
            waiting = pending.remove(canonical);
        }
        resume(canonical, waiting, failed);
        return failed;
    }

    /** Removes the entry for {@code path}. Queued continuations stay queued. */
    public void delete(Path path) {
        Path canonical = CanonicalPaths.canonicalize(path);
        synchronized (lock) {
            entries.remove(canonical);
        }
    }

    /** Drops every entry and every queued continuation. */
    public void clear() {
        int dropped;
        synchronized (lock) {
            entries.clear();
            dropped = pending.values().stream().mapToInt(Deque::size).sum();
            pending.clear();
        }
        if (dropped > 0) {
            logger.warn("Cleared artifact cache with {} continuation(s) still waiting", dropped);
        }
    }

    // ---- Waiting ----

    /**
     * Runs {@code continuation} now if a fresh entry exists, otherwise queues
     * it until the file is stored or marked as failed.
     */
    public void awaitOrDefer(Path path, CacheContinuation<A> continuation) {
        Path canonical = CanonicalPaths.canonicalize(path);
        Optional<CacheEntry<A>> entry;
        synchronized (lock) {
            entry = freshEntry(canonical);
            if (entry.isEmpty()) {
                enqueue(canonical, continuation);
                return;
            }
        }
        continuation.resume(entry.get());
    }

    /**
     * Queues {@code continuation} without looking at the current entry. Used
     * by continuations that found the artifact not yet usable.
     */
    public void defer(Path path, CacheContinuation<A> continuation) {
        Path canonical = CanonicalPaths.canonicalize(path);
        synchronized (lock) {
            enqueue(canonical, continuation);
        }
    }

    /** Completes with the entry as soon as one is available. */
    public CompletableFuture<CacheEntry<A>> awaitEntry(Path path) {
        CompletableFuture<CacheEntry<A>> future = new CompletableFuture<>();
        awaitOrDefer(path, future::complete);
        return future;
    }

    /**
     * Waits for the artifact of {@code path} and applies {@code fn} to it.
     * Completes with {@code defaultValue} if the load fails. An artifact that
     * does not satisfy {@code ready} (e.g. parsed but not yet type-checked)
     * is skipped and the wait continues until a ready one is stored.
     */
    public <R> CompletableFuture<R> withCached(Path path, R defaultValue, Predicate<? super A> ready,
            Function<? super A, ? extends R> fn) {
        return whenReady(path, defaultValue, ready, entry -> fn.apply(entry.getArtifact()));
    }

    /**
     * Like {@link #withCached}, but also hands {@code fn} the value derived
     * under {@code key} from the ready artifact, computing it if needed.
     */
    public <T, R> CompletableFuture<R> withCachedAndData(Path path, R defaultValue, Predicate<? super A> ready,
            DerivedDataKey<T> key, Function<? super A, ? extends T> producer,
            BiFunction<? super A, ? super T, ? extends R> fn) {
        return whenReady(path, defaultValue, ready,
                entry -> fn.apply(entry.getArtifact(), getOrCompute(entry, key, producer)));
    }

    private <R> CompletableFuture<R> whenReady(Path path, R defaultValue, Predicate<? super A> ready,
            Function<CacheEntry<A>, ? extends R> fn) {
        CompletableFuture<R> result = new CompletableFuture<>();
        awaitOrDefer(path, new CacheContinuation<A>() {
            @Override
            public void resume(CacheEntry<A> entry) {
                if (!entry.isSuccess()) {
                    result.complete(defaultValue);
                    return;
                }
                if (!ready.test(entry.getArtifact())) {
                    defer(entry.getPath(), this);
                    return;
                }
                try {
                    result.complete(fn.apply(entry));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            }
        });
        return result;
    }

    // ---- Derived data ----

    /**
     * Returns the value stored under {@code key} for the entry's artifact,
     * computing it with {@code producer} on a miss.
     *
     * <p>The producer runs without holding the cache monitor. Its result is
     * kept only if {@code entry} is still the current entry for its path and
     * the file has not changed meanwhile; otherwise it is returned but not
     * remembered. Two concurrent misses may both run the producer.</p>
     *
     * <p>A {@code null} result is returned but never remembered, so the
     * producer runs again on the next call.</p>
     *
     * @throws IllegalArgumentException if {@code entry} is a failed entry
     */
    public <T> T getOrCompute(CacheEntry<A> entry, DerivedDataKey<T> key, Function<? super A, ? extends T> producer) {
        if (!entry.isSuccess()) {
            throw new IllegalArgumentException("No artifact to derive " + key + " from: " + entry);
        }
        T cached = entry.getDerived(key);
        if (cached != null) {
            return cached;
        }
        T value = producer.apply(entry.getArtifact());
        if (value == null) {
            logger.debug("Producer of {} returned null for {}, not caching", key, entry.getPath());
            return null;
        }
        ContentHash currentHash = ContentHash.of(entry.getPath());
        synchronized (lock) {
            if (entries.get(entry.getPath()) == entry && currentHash.equals(entry.getHash())) {
                entry.putDerived(key, value);
            } else {
                logger.debug("Not caching {} for {}: artifact replaced or file changed", key, entry.getPath());
            }
        }
        return value;
    }

    /**
     * Same as {@link #getOrCompute(CacheEntry, DerivedDataKey, Function)} for
     * the current fresh success entry of {@code path}, if there is one.
     */
    public <T> Optional<T> getOrCompute(Path path, DerivedDataKey<T> key, Function<? super A, ? extends T> producer) {
        Optional<CacheEntry<A>> entry = lookup(path);
        if (entry.isEmpty() || !entry.get().isSuccess()) {
            return Optional.empty();
        }
        return Optional.ofNullable(getOrCompute(entry.get(), key, producer));
    }

    // ---- Diagnostics ----

    public int size() {
        return entries.size();
    }

    public int pendingCount(Path path) {
        Path canonical = CanonicalPaths.canonicalize(path);
        synchronized (lock) {
            Deque<CacheContinuation<A>> waiting = pending.get(canonical);
            return waiting == null ? 0 : waiting.size();
        }
    }

    // ---- Internals ----

    private Optional<CacheEntry<A>> freshEntry(Path canonical) {
        CacheEntry<A> entry = entries.get(canonical);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isSuccess() && !ContentHash.of(canonical).equals(entry.getHash())) {
            logger.debug("Cached artifact for {} is stale", canonical);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private void enqueue(Path canonical, CacheContinuation<A> continuation) {
        pending.computeIfAbsent(canonical, k -> new ArrayDeque<>()).addLast(continuation);
    }

    private void resume(Path canonical, Deque<CacheContinuation<A>> waiting, CacheEntry<A> entry) {
        if (waiting == null) {
            return;
        }
        logger.debug("Resuming {} continuation(s) for {}", waiting.size(), canonical);
        for (CacheContinuation<A> continuation : waiting) {
            try {
                continuation.resume(entry);
            } catch (RuntimeException e) {
                logger.error("Continuation waiting on {} failed", canonical, e);
            }
        }
    }
}
