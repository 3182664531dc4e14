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

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * What the {@link ArtifactCache} knows about one file: either a compiled
 * artifact with the content hash it was built from, or the fact that the
 * last load failed.
 *
 * <p>Entries are replaced as a whole. Derived data lives inside the entry,
 * so replacing the artifact drops every value computed from the old one.</p>
 *
 * @param <A> artifact type
 */
public final class CacheEntry<A> {

    public enum Status {
        SUCCESS,
        FAILED
    }

    private final Path path;
    private final Status status;
    private final A artifact;
    private final ContentHash hash;
    private final Map<DerivedDataKey<?>, Object> derivedData;

    private CacheEntry(Path path, Status status, A artifact, ContentHash hash) {
        this(path, status, artifact, hash, status == Status.SUCCESS ? new ConcurrentHashMap<>() : Map.of());
    }

    private CacheEntry(Path path, Status status, A artifact, ContentHash hash,
                       Map<DerivedDataKey<?>, Object> derivedData) {
        this.path = path;
        this.status = status;
        this.artifact = artifact;
        this.hash = hash;
        this.derivedData = derivedData;
    }

    static <A> CacheEntry<A> success(Path path, A artifact, ContentHash hash) {
        return new CacheEntry<>(path, Status.SUCCESS, artifact, hash);
    }

    static <A> CacheEntry<A> failed(Path path) {
        return new CacheEntry<>(path, Status.FAILED, null, null);
    }

    /** Same file, hash and derived values, with a different artifact. */
    CacheEntry<A> withArtifact(A newArtifact) {
        return new CacheEntry<>(path, status, newArtifact, hash, derivedData);
    }

    /** Canonical path of the file this entry describes. */
    public Path getPath() {
        return path;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /** The artifact; {@code null} for failed entries. */
    public A getArtifact() {
        return artifact;
    }

    /** Hash of the file contents the artifact was built from; {@code null} for failed entries. */
    public ContentHash getHash() {
        return hash;
    }

    <T> T getDerived(DerivedDataKey<T> key) {
        Object value = derivedData.get(key);
        return value == null ? null : key.cast(value);
    }

    /** {@code value} must not be null. */
    <T> void putDerived(DerivedDataKey<T> key, T value) {
        derivedData.put(key, value);
    }

    int derivedCount() {
        return derivedData.size();
    }

    @Override
    public String toString() {
        if (status == Status.FAILED) {
            return "CacheEntry{" + path + ", FAILED}";
        }
        return "CacheEntry{" + path + ", SUCCESS, hash=" + hash + ", derived=" + derivedData.size() + "}";
    }
}
