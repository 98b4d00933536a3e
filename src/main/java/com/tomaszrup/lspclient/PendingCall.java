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

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.tomaszrup.lspclient.jsonrpc.Message;

/**
 * Single-slot delivery channel for the response to one request. Only the
 * first completion counts.
 */
final class PendingCall {

    private final long id;
    private final String method;
    private final CompletableFuture<Message> response = new CompletableFuture<>();

    PendingCall(long id, String method) {
        this.id = id;
        this.method = method;
    }

    long getId() {
        return id;
    }

    String getMethod() {
        return method;
    }

    boolean complete(Message message) {
        return response.complete(message);
    }

    boolean fail(LspClientException cause) {
        return response.completeExceptionally(cause);
    }

    boolean isDone() {
        return response.isDone();
    }

    /**
     * Wait for the response.
     *
     * @throws TimeoutException     if nothing arrived within {@code timeout}
     * @throws LspClientException   if the call was failed, e.g. because the
     *                              connection terminated
     */
    Message await(Duration timeout) throws LspClientException, InterruptedException, TimeoutException {
        try {
            return response.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw failure(e.getCause());
        }
    }

    /**
     * The outcome of a call that is already done. Never blocks.
     *
     * @throws IllegalStateException if the call is still outstanding
     * @throws LspClientException    if the call was failed
     */
    Message completed() throws LspClientException {
        if (!response.isDone()) {
            throw new IllegalStateException("Request " + id + " (" + method + ") is still outstanding");
        }
        try {
            return response.join();
        } catch (CompletionException e) {
            throw failure(e.getCause());
        }
    }

    private LspClientException failure(Throwable cause) {
        if (cause instanceof LspClientException) {
            return (LspClientException) cause;
        }
        return new LspClientException("Request " + id + " (" + method + ") failed", cause);
    }
}
