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
package com.tomaszrup.hsls.util;

import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.Map;

/**
 * Maintains the SLF4J MDC key {@code "project"} so that log lines written
 * while a file is being resolved or loaded carry the package directory they
 * belong to. The logback pattern prints it via {@code %X{project}}.
 *
 * <pre>{@code
 * MdcProjectContext.setProject(cradle.getRootDir());
 * try {
 *     // log calls here are tagged with the package directory name
 * } finally {
 *     MdcProjectContext.clear();
 * }
 * }</pre>
 */
public final class MdcProjectContext {

    public static final String MDC_KEY = "project";

    private MdcProjectContext() {
        // utility class
    }

    /**
     * Tags the current thread with the last path segment of the given root,
     * or {@code "none"} when no root is known.
     */
    public static void setProject(Path projectRoot) {
        if (projectRoot == null) {
            MDC.put(MDC_KEY, "none");
            return;
        }
        Path fileName = projectRoot.getFileName();
        MDC.put(MDC_KEY, fileName != null ? fileName.toString() : projectRoot.toString());
    }

    public static void clear() {
        MDC.remove(MDC_KEY);
    }

    static Map<String, String> snapshot() {
        return MDC.getCopyOfContextMap();
    }

    static void restore(Map<String, String> contextMap) {
        if (contextMap != null) {
            MDC.setContextMap(contextMap);
        } else {
            MDC.clear();
        }
    }

    /**
     * Captures the caller's MDC and restores it around {@code task} on the
     * executing thread.
     */
    public static Runnable wrap(Runnable task) {
        Map<String, String> callerContext = snapshot();
        return () -> {
            Map<String, String> previousContext = snapshot();
            restore(callerContext);
            try {
                task.run();
            } finally {
                restore(previousContext);
            }
        };
    }
}
