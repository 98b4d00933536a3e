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
package com.tomaszrup.lspclient.util;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Manages the SLF4J MDC (Mapped Diagnostic Context) key {@code "server"} so
 * that log lines from several clients living in one JVM can be told apart.
 *
 * <h3>Usage around client operations:</h3>
 * <pre>{@code
 * Map<String, String> previous = MdcServerContext.setServer("sqls");
 * try {
 *     // ... log calls here include [sqls]
 * } finally {
 *     MdcServerContext.restore(previous);
 * }
 * }</pre>
 *
 * <h3>Propagation to the reader thread:</h3>
 * <pre>{@code
 * new Thread(MdcServerContext.wrap(() -> readLoop()), "lsp-reader");
 * }</pre>
 */
public final class MdcServerContext {

    /** MDC key used in the logback pattern via {@code %X{server}}. */
    public static final String MDC_KEY = "server";

    private MdcServerContext() {
        // utility class
    }

    /**
     * Sets the MDC {@code "server"} key on the current thread.
     *
     * @param serverName short server label, usually the executable's file name;
     *                   {@code null} maps to {@code "unknown"}
     * @return the context that was active before the call, for {@link #restore}
     */
    public static Map<String, String> setServer(String serverName) {
        Map<String, String> previous = snapshot();
        MDC.put(MDC_KEY, serverName != null && !serverName.isBlank() ? serverName : "unknown");
        return previous;
    }

    /**
     * Returns a snapshot of the current thread's MDC context map.
     *
     * @return the current MDC context map, or null if empty
     */
    public static Map<String, String> snapshot() {
        return MDC.getCopyOfContextMap();
    }

    /**
     * Restores a previously captured MDC context map on the current thread.
     *
     * @param contextMap the context map to restore (may be null)
     */
    public static void restore(Map<String, String> contextMap) {
        if (contextMap != null) {
            MDC.setContextMap(contextMap);
        } else {
            MDC.clear();
        }
    }

    /**
     * Wraps a {@link Runnable} so that the caller's MDC context is restored in
     * the executing thread, and that thread's own context is put back after
     * the task completes.
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
