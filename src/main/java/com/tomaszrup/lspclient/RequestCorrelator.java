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
package com.tomaszrup.lspclient;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.tomaszrup.lspclient.jsonrpc.Message;
import com.tomaszrup.lspclient.process.ServerSupervisor;

/**
 * Matches responses to the requests that are waiting for them.
 *
 * <p>Identifiers start at 1 and increase by one per request. The counter is
 * only advanced under the same lock that registers the {@link PendingCall},
 * so concurrent callers always get distinct identifiers and a pending entry
 * exists before its request can possibly be answered.</p>
 *
 * <p>A response whose identifier has no pending entry (it timed out, or was
 * never sent) is an orphan: logged and dropped without affecting anything
 * else.</p>
 */
public class RequestCorrelator {

    private static final Logger logger = LoggerFactory.getLogger(RequestCorrelator.class);

    private final ServerSupervisor supervisor;

    private final Object lock = new Object();
    /** Guarded by {@link #lock}. */
    private final Map<Long, PendingCall> pendingCalls = new HashMap<>();
    /** Guarded by {@link #lock}. */
    private long nextId = 1;

    public RequestCorrelator(ServerSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    /**
     * Send a request and block until its response arrives. The timeout
     * covers writing the request as well as waiting for the answer.
     *
     * @return the response's {@code result}; {@link JsonNull#INSTANCE} for a
     *         {@code null} result
     * @throws NotRunningException      if the server is not running, or the
     *                                  connection terminated while waiting
     * @throws RequestTimeoutException  if no response arrived within
     *                                  {@code timeout}
     * @throws ProtocolException        if the server answered with an error
     * @throws LspClientException       if the request could not be written
     */
    public JsonElement call(String method, JsonElement params, Duration timeout) throws LspClientException {
        if (!supervisor.isRunning()) {
            throw new NotRunningException("Cannot send " + method + ": language server "
                    + supervisor.getServerName() + " is " + supervisor.getState());
        }

        PendingCall pending;
        synchronized (lock) {
            pending = new PendingCall(nextId++, method);
            pendingCalls.put(pending.getId(), pending);
        }
        long id = pending.getId();

        CompletableFuture<Void> written;
        try {
            written = supervisor.sendAsync(Message.request(id, method, params));
        } catch (NotRunningException e) {
            remove(id);
            throw e;
        }
        written.whenComplete((ignored, error) -> {
            if (error != null) {
                remove(id);
                pending.fail(sendFailure(pending, error));
            }
        });

        Message response;
        try {
            response = pending.await(timeout);
        } catch (TimeoutException e) {
            if (remove(id) != null || !pending.isDone()) {
                logger.warn("Request {} ({}) timed out after {} ms", id, method, timeout.toMillis());
                throw new RequestTimeoutException(method, id, timeout);
            }
            // Completed between the timeout and the removal.
            response = pending.completed();
        } catch (InterruptedException e) {
            remove(id);
            Thread.currentThread().interrupt();
            throw new LspClientException("Interrupted while waiting for " + method, e);
        }

        if (response.getError() != null) {
            throw new ProtocolException(method, response.getError());
        }
        return response.getResult() != null ? response.getResult() : JsonNull.INSTANCE;
    }

    /**
     * Send a notification. Returns once the frame is written.
     */
    public void notify(String method, JsonElement params) throws LspClientException {
        try {
            supervisor.send(Message.notification(method, params));
        } catch (IOException e) {
            throw new LspClientException("Failed to send notification " + method, e);
        }
    }

    /**
     * Hand a response to the call waiting for it. Only integral numeric ids
     * are correlated, since that is all this client sends; a response with
     * a string id, even one such as {@code "1"}, is treated as an orphan.
     *
     * @return {@code false} if the response was an orphan and was discarded
     */
    public boolean deliver(Message response) {
        Long id = response.getIdAsLong();
        PendingCall pending = null;
        if (id != null) {
            synchronized (lock) {
                pending = pendingCalls.remove(id);
            }
        }
        if (pending == null) {
            logger.warn("Discarding response with no waiting request, id={}", response.getId());
            return false;
        }
        pending.complete(response);
        return true;
    }

    /**
     * Fail every outstanding call; used when the connection terminates so
     * callers do not sit out their full timeout.
     */
    public void failAll(String reason) {
        List<PendingCall> failed;
        synchronized (lock) {
            failed = new ArrayList<>(pendingCalls.values());
            pendingCalls.clear();
        }
        if (!failed.isEmpty()) {
            logger.info("Failing {} outstanding request(s): {}", failed.size(), reason);
        }
        for (PendingCall call : failed) {
            call.fail(new NotRunningException("Request " + call.getId() + " (" + call.getMethod()
                    + ") abandoned: " + reason));
        }
    }

    /** Number of requests currently waiting for a response. */
    public int pendingCount() {
        synchronized (lock) {
            return pendingCalls.size();
        }
    }

    private PendingCall remove(long id) {
        synchronized (lock) {
            return pendingCalls.remove(id);
        }
    }

    private static LspClientException sendFailure(PendingCall pending, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof LspClientException) {
            return (LspClientException) cause;
        }
        return new LspClientException("Failed to send request " + pending.getId() + " (" + pending.getMethod() + ")",
                cause);
    }
}
