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

import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.hsls.util.MdcProjectContext;

/**
 * Thread pools shared by the services.
 *
 * <ul>
 *   <li><b>Import pool</b>: project discovery, package listing and unit
 *       introspection. These mostly wait on helper processes, so a few run
 *       in parallel. Sized to {@code max(2, min(4, availableProcessors))}.</li>
 *   <li><b>Compile pool</b>: single-threaded. Only one module load
 *       mutates compiler state at a time.</li>
 * </ul>
 *
 * <p>Both pools propagate the submitting thread's MDC, so log lines of a
 * background task carry the same {@code project} tag as the request that
 * started it. Create one instance, share it, and call {@link #shutdownAll()}
 * on shutdown.</p>
 */
public class ExecutorPools {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorPools.class);

    private final ExecutorService importPool;
    private final ExecutorService compilePool;

    public ExecutorPools() {
        int importThreads = Math.max(2, Math.min(4, Runtime.getRuntime().availableProcessors()));
        this.importPool = new MdcExecutorService(
                Executors.newFixedThreadPool(importThreads, daemonThreads("hsls-import")));
        this.compilePool = new MdcExecutorService(
                Executors.newSingleThreadExecutor(daemonThreads("hsls-compile")));
        logger.debug("Import pool threads: {}", importThreads);
    }

    /** Pool for cradle resolution work. */
    public ExecutorService getImportPool() {
        return importPool;
    }

    /** Single-threaded pool for module compilation. */
    public ExecutorService getCompilePool() {
        return compilePool;
    }

    /**
     * Shut down both pools, interrupting running tasks, and wait up to 5
     * seconds for each to terminate.
     */
    public void shutdownAll() {
        logger.debug("Shutting down executor pools");
        importPool.shutdownNow();
        compilePool.shutdownNow();
        try {
            importPool.awaitTermination(5, TimeUnit.SECONDS);
            compilePool.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Every {@code submit}/{@code invoke*} of {@link AbstractExecutorService}
     * ends in {@link #execute(Runnable)}, which captures the caller's MDC.
     */
    private static class MdcExecutorService extends AbstractExecutorService {
        private final ExecutorService delegate;

        MdcExecutorService(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override public void execute(Runnable command) {
            delegate.execute(MdcProjectContext.wrap(command));
        }

        @Override public void shutdown() { delegate.shutdown(); }
        @Override public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override public boolean isShutdown() { return delegate.isShutdown(); }
        @Override public boolean isTerminated() { return delegate.isTerminated(); }
        @Override public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }
    }
}
