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
package com.tomaszrup.lspclient.process;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lspclient.LaunchException;
import com.tomaszrup.lspclient.NotRunningException;
import com.tomaszrup.lspclient.jsonrpc.Message;
import com.tomaszrup.lspclient.jsonrpc.MessageCodec;
import com.tomaszrup.lspclient.jsonrpc.MessageReader;
import com.tomaszrup.lspclient.jsonrpc.MessageWriter;
import com.tomaszrup.lspclient.util.MdcServerContext;

/**
 * Owns the connection to one language server and its lifecycle.
 *
 * <p>Lifecycle is strictly {@code UNSTARTED → RUNNING → STOPPED}. A
 * supervisor whose launch failed, that was stopped, or whose server closed
 * its output is stopped for good; there is no restart.</p>
 *
 * <p>While running, a dedicated daemon thread decodes frames from the
 * server and hands every message to the {@link Listener}. Malformed frames
 * are logged and skipped. End of stream or a read failure releases the
 * connection and moves the supervisor to {@code STOPPED}.</p>
 *
 * <p>Frames are written by a second daemon thread, one at a time and in
 * submission order. A write blocked on a server that stopped reading holds
 * up later writes but never the caller of {@link #sendAsync(Message)}, and
 * it fails once the connection is closed by {@link #stop()}. The connection
 * is always closed outside the lifecycle lock.</p>
 */
public class ServerSupervisor {

    private static final Logger logger = LoggerFactory.getLogger(ServerSupervisor.class);

    public enum State {
        UNSTARTED,
        RUNNING,
        STOPPED
    }

    /**
     * Receives what the reader thread produces. Both callbacks run on the
     * reader thread (or, for termination after {@link #stop()}, on the
     * stopping thread) and must not block for long.
     */
    public interface Listener {

        void messageReceived(Message message);

        /** Called exactly once, when the supervisor leaves {@code RUNNING}. */
        void connectionTerminated();
    }

    private final String serverName;
    private final MessageCodec codec;
    private final Listener listener;

    private final Object lifecycleLock = new Object();
    private final AtomicBoolean terminationReported = new AtomicBoolean();

    private volatile State state = State.UNSTARTED;
    private volatile ServerConnection connection;
    private volatile MessageReader reader;
    private volatile MessageWriter writer;
    private volatile ExecutorService writerPool;
    private volatile Thread readerThread;

    public ServerSupervisor(String serverName, MessageCodec codec, Listener listener) {
        this.serverName = serverName;
        this.codec = codec;
        this.listener = listener;
    }

    /**
     * Open the connection and start the reader and writer threads.
     *
     * @throws LaunchException       if the connection could not be opened;
     *                               the supervisor is then stopped
     * @throws IllegalStateException if the supervisor was started before
     */
    public void start(ServerConnector connector) throws LaunchException {
        synchronized (lifecycleLock) {
            if (state != State.UNSTARTED) {
                throw new IllegalStateException("Language server " + serverName + " is " + state
                        + " and cannot be started again");
            }
            ServerConnection conn;
            try {
                conn = connector.connect();
            } catch (LaunchException e) {
                state = State.STOPPED;
                throw e;
            } catch (RuntimeException e) {
                state = State.STOPPED;
                throw new LaunchException("Failed to connect to language server " + serverName, e);
            }
            MessageReader messageReader = codec.newReader(conn.getInputStream());
            connection = conn;
            reader = messageReader;
            writer = codec.newWriter(conn.getOutputStream());
            writerPool = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(() -> {
                    MdcServerContext.setServer(serverName);
                    r.run();
                }, "lsp-writer-" + serverName);
                t.setDaemon(true);
                return t;
            });
            state = State.RUNNING;

            Thread thread = new Thread(MdcServerContext.wrap(() -> readLoop(conn, messageReader)),
                    "lsp-reader-" + serverName);
            thread.setDaemon(true);
            readerThread = thread;
            thread.start();
            logger.info("Language server {} running ({})", serverName, conn.describe());
        }
    }

    /**
     * Close the connection and stop for good. Idempotent; a supervisor that
     * was never started just becomes stopped. Returns once the connection is
     * released, even if a write is blocked on it.
     */
    public void stop() {
        ServerConnection conn;
        Thread thread;
        synchronized (lifecycleLock) {
            if (state == State.STOPPED) {
                return;
            }
            boolean wasRunning = state == State.RUNNING;
            state = State.STOPPED;
            if (!wasRunning) {
                logger.debug("Language server {} stopped before it was started", serverName);
                return;
            }
            conn = connection;
            thread = readerThread;
            connection = null;
        }
        release(conn);
        logger.info("Language server {} stopped", serverName);
        if (thread != null && thread != Thread.currentThread()) {
            // Unblocks a reader waiting for space in a blocking notification sink.
            thread.interrupt();
        }
        reportTermination();
    }

    /**
     * Queue one message for writing.
     *
     * @return completes once the frame is written and flushed; fails with
     *         {@link NotRunningException} if the supervisor stopped first, or
     *         with the {@link IOException} the write raised
     * @throws NotRunningException if the supervisor is not running; nothing
     *                             is queued in that case
     */
    public CompletableFuture<Void> sendAsync(Message message) throws NotRunningException {
        ExecutorService pool = writerPool;
        MessageWriter out = writer;
        if (state != State.RUNNING || pool == null || out == null) {
            throw notRunning("is not running (" + state + ")");
        }
        CompletableFuture<Void> written = new CompletableFuture<>();
        try {
            pool.execute(() -> {
                try {
                    write(out, message);
                    written.complete(null);
                } catch (IOException | NotRunningException | RuntimeException e) {
                    written.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            throw notRunning("stopped before " + message.getMethod() + " could be sent");
        }
        return written;
    }

    /**
     * Write one message and wait until it is flushed.
     *
     * @throws NotRunningException if the supervisor is not running, or
     *                             stopped before the write completed
     * @throws IOException         if writing to a running server failed
     */
    public void send(Message message) throws NotRunningException, IOException {
        CompletableFuture<Void> written = sendAsync(message);
        try {
            written.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while sending " + message.getMethod());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof NotRunningException) {
                throw (NotRunningException) cause;
            }
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException("Failed to send " + message.getMethod(), cause);
        }
    }

    public State getState() {
        return state;
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    public String getServerName() {
        return serverName;
    }

    private void write(MessageWriter out, Message message) throws IOException, NotRunningException {
        if (state != State.RUNNING) {
            throw notRunning("stopped before " + message.getMethod() + " could be sent");
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Sending LSP message method={} id={}", message.getMethod(), message.getId());
        }
        try {
            out.write(message);
        } catch (IOException e) {
            if (state != State.RUNNING) {
                throw notRunning("stopped while sending " + message.getMethod());
            }
            throw e;
        }
    }

    private void readLoop(ServerConnection conn, MessageReader messageReader) {
        MdcServerContext.setServer(serverName);
        try {
            messageReader.readAll(message -> {
                if (logger.isDebugEnabled()) {
                    logger.debug("Received LSP message method={} id={}", message.getMethod(), message.getId());
                }
                dispatch(message);
            });
            if (state == State.RUNNING) {
                logger.info("Language server {} closed its output (process alive: {})", serverName, conn.isAlive());
            }
        } catch (IOException e) {
            if (state == State.RUNNING) {
                logger.warn("Reading from language server {} failed: {}", serverName, e.getMessage());
            } else {
                logger.debug("Reader for {} ended after stop: {}", serverName, e.getMessage());
            }
        } finally {
            connectionLost(conn);
        }
    }

    private void dispatch(Message message) {
        try {
            listener.messageReceived(message);
        } catch (RuntimeException e) {
            logger.warn("Failed to handle {} from {}", message, serverName, e);
        }
    }

    private void connectionLost(ServerConnection conn) {
        boolean lost = false;
        synchronized (lifecycleLock) {
            if (state == State.RUNNING && connection == conn) {
                state = State.STOPPED;
                connection = null;
                lost = true;
            }
        }
        if (lost) {
            logger.warn("Connection to language server {} lost", serverName);
            release(conn);
        }
        reportTermination();
    }

    /**
     * Close the connection, then let the writer thread drain: writes still
     * queued fail fast with {@link NotRunningException}.
     */
    private void release(ServerConnection conn) {
        MessageReader messageReader = reader;
        if (messageReader != null) {
            messageReader.close();
        }
        conn.close();
        ExecutorService pool = writerPool;
        if (pool != null) {
            pool.shutdown();
        }
    }

    private NotRunningException notRunning(String detail) {
        return new NotRunningException("Language server " + serverName + " " + detail);
    }

    private void reportTermination() {
        if (terminationReported.compareAndSet(false, true)) {
            listener.connectionTerminated();
        }
    }
}
