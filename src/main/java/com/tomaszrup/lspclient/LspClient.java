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

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.TextDocumentItem;
import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.tomaszrup.lspclient.jsonrpc.Message;
import com.tomaszrup.lspclient.jsonrpc.MessageCodec;
import com.tomaszrup.lspclient.process.ProcessServerConnection;
import com.tomaszrup.lspclient.process.ServerConnector;
import com.tomaszrup.lspclient.process.ServerSupervisor;
import com.tomaszrup.lspclient.util.MdcServerContext;

/**
 * Client for one language server spoken to over stdio.
 *
 * <p>Lifecycle: constructed inert, {@link #start()} launches the server,
 * {@link #stop()} (or {@link #close()}) ends it for good. A client cannot
 * be restarted; build a new one instead. Every operation may be called from
 * any thread; requests block only their caller.</p>
 *
 * <p>The client does not enforce the protocol's call order. Callers are
 * expected to run {@link #initialize} then {@link #initialized} before any
 * document operation; whatever is asked is sent, and errors the server
 * reports come back as {@link ProtocolException}.</p>
 *
 * <pre>{@code
 * try (LspClient client = new LspClient(LspClientSettings.forSqls(configPath))) {
 *     client.start();
 *     client.initialize("file:///tmp", new JsonObject());
 *     client.initialized();
 *     client.didOpen(uri, "sql", text);
 *     List<CompletionItem> items = client.completionItems(uri, 0, 7);
 * }
 * }</pre>
 */
public class LspClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LspClient.class);

    private final LspClientSettings settings;
    private final ServerConnector connector;
    private final NotificationSink notifications;
    private final ServerSupervisor supervisor;
    private final RequestCorrelator correlator;

    public LspClient(LspClientSettings settings) {
        this(settings, ProcessServerConnection.connector(settings));
    }

    /**
     * Client over a custom connection, e.g. a socket or an in-process
     * server. The settings' command only names the server in logs.
     */
    public LspClient(LspClientSettings settings, ServerConnector connector) {
        this.settings = settings;
        this.connector = connector;
        this.notifications = new NotificationSink(settings.getNotificationCapacity(),
                settings.getNotificationOverflow());
        this.supervisor = new ServerSupervisor(settings.getServerName(), new MessageCodec(), new Router());
        this.correlator = new RequestCorrelator(supervisor);
    }

    /**
     * Launch the server and start reading from it.
     *
     * @throws LaunchException       if the server could not be launched;
     *                               this client is then stopped for good
     * @throws IllegalStateException if the client was started before
     */
    public void start() throws LaunchException {
        Map<String, String> previous = MdcServerContext.setServer(settings.getServerName());
        try {
            logger.debug("Starting language server: {}", settings.getCommandLine());
            supervisor.start(connector);
        } finally {
            MdcServerContext.restore(previous);
        }
    }

    /**
     * Stop the server. Idempotent, and safe on a client never started.
     * Requests still waiting fail with {@link NotRunningException}.
     */
    public void stop() {
        Map<String, String> previous = MdcServerContext.setServer(settings.getServerName());
        try {
            supervisor.stop();
        } finally {
            MdcServerContext.restore(previous);
        }
    }

    @Override
    public void close() {
        stop();
    }

    public ServerSupervisor.State getState() {
        return supervisor.getState();
    }

    public boolean isRunning() {
        return supervisor.isRunning();
    }

    public LspClientSettings getSettings() {
        return settings;
    }

    /** Server-initiated messages not yet consumed. */
    public NotificationSink getNotifications() {
        return notifications;
    }

    /** Requests currently waiting for a response. */
    public int getPendingRequestCount() {
        return correlator.pendingCount();
    }

    /**
     * Send an arbitrary request with the configured timeout and wait for its
     * result.
     */
    public JsonElement call(String method, JsonElement params) throws LspClientException {
        return correlator.call(method, params, settings.getRequestTimeout());
    }

    /** Send an arbitrary notification. */
    public void notify(String method, JsonElement params) throws LspClientException {
        correlator.notify(method, params);
    }

    // -----------------------------------------------------------------------
    // Protocol operations
    // -----------------------------------------------------------------------

    /**
     * Send {@code initialize}. The client never reports its own process id,
     * so {@code processId} is always {@code null}.
     *
     * @param rootUri      workspace root, e.g. {@code file:///tmp}
     * @param capabilities client capabilities; {@code null} sends {@code {}}
     * @return the server's result object, unchanged
     */
    public JsonElement initialize(String rootUri, JsonObject capabilities) throws LspClientException {
        JsonObject params = new JsonObject();
        params.add("processId", JsonNull.INSTANCE);
        params.addProperty("rootUri", rootUri);
        params.add("capabilities", capabilities != null ? capabilities : new JsonObject());
        return call(Protocol.REQUEST_INITIALIZE, params);
    }

    /** Send {@code initialized} once {@link #initialize} has succeeded. */
    public void initialized() throws LspClientException {
        notify(Protocol.NOTIFICATION_INITIALIZED, new JsonObject());
    }

    /** Announce an opened document with its full text, as version 1. */
    public void didOpen(String uri, String languageId, String text) throws LspClientException {
        TextDocumentItem document = new TextDocumentItem(uri, languageId, Protocol.INITIAL_DOCUMENT_VERSION, text);
        notify(Protocol.NOTIFICATION_DID_OPEN, ProtocolJson.toJsonTree(new DidOpenTextDocumentParams(document)));
    }

    /**
     * Replace a document's content. Every change carries the full text; the
     * caller supplies increasing version numbers.
     */
    public void didChange(String uri, String text, int version) throws LspClientException {
        DidChangeTextDocumentParams params = new DidChangeTextDocumentParams(
                new VersionedTextDocumentIdentifier(uri, version),
                List.of(new TextDocumentContentChangeEvent(text)));
        notify(Protocol.NOTIFICATION_DID_CHANGE, ProtocolJson.toJsonTree(params));
    }

    /**
     * Request completions at a zero-based position.
     *
     * @return the raw result: an item array, a completion list or JSON null
     */
    public JsonElement completion(String uri, int line, int character) throws LspClientException {
        CompletionParams params = new CompletionParams(new TextDocumentIdentifier(uri), new Position(line, character));
        return call(Protocol.REQUEST_COMPLETION, ProtocolJson.toJsonTree(params));
    }

    /**
     * Request hover information at a zero-based position.
     *
     * @return the raw result, JSON null when there is nothing to show
     */
    public JsonElement hover(String uri, int line, int character) throws LspClientException {
        HoverParams params = new HoverParams(new TextDocumentIdentifier(uri), new Position(line, character));
        return call(Protocol.REQUEST_HOVER, ProtocolJson.toJsonTree(params));
    }

    /** {@link #completion} decoded into completion items. */
    public List<CompletionItem> completionItems(String uri, int line, int character) throws LspClientException {
        return ProtocolJson.completionItems(completion(uri, line, character));
    }

    /** {@link #hover} decoded; empty when the server has nothing to show. */
    public Optional<Hover> hoverInfo(String uri, int line, int character) throws LspClientException {
        return ProtocolJson.hover(hover(uri, line, character));
    }

    /**
     * Routes what the reader thread decodes: responses to the waiting
     * callers, everything else to the notification sink.
     */
    private class Router implements ServerSupervisor.Listener {

        @Override
        public void messageReceived(Message message) {
            if (message.isResponse()) {
                correlator.deliver(message);
            } else {
                notifications.offer(message);
            }
        }

        @Override
        public void connectionTerminated() {
            correlator.failAll("language server " + settings.getServerName() + " is no longer running");
        }
    }
}
