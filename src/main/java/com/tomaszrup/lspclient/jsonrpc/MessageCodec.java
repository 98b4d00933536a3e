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
package com.tomaszrup.lspclient.jsonrpc;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.Collections;

import org.eclipse.lsp4j.jsonrpc.json.MessageJsonHandler;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.jsonrpc.messages.NotificationMessage;
import org.eclipse.lsp4j.jsonrpc.messages.RequestMessage;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseMessage;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;

/**
 * LSP base protocol framing on top of lsp4j's stream reader and writer:
 *
 * <pre>
 * Content-Length: &lt;n&gt;\r\n
 * \r\n
 * &lt;n bytes of UTF-8 JSON&gt;
 * </pre>
 *
 * <p>Frames are parsed and serialized by lsp4j's {@link MessageJsonHandler}
 * with no registered methods, so params and results stay raw JSON trees.
 * This class maps lsp4j's message types onto {@link Message} and back.</p>
 *
 * <p>One codec may be shared by any number of readers and writers.</p>
 */
public class MessageCodec {

    // Nulls inside params (e.g. initialize's processId) must reach the wire.
    private final MessageJsonHandler jsonHandler = new MessageJsonHandler(Collections.emptyMap(),
            builder -> builder.serializeNulls().disableHtmlEscaping());

    public MessageJsonHandler getJsonHandler() {
        return jsonHandler;
    }

    /**
     * Reader for the frames arriving on {@code in}.
     */
    public MessageReader newReader(InputStream in) {
        return new MessageReader(in, this);
    }

    /**
     * Writer that frames messages onto {@code out}.
     */
    public MessageWriter newWriter(OutputStream out) {
        return new MessageWriter(out, this);
    }

    /**
     * Convert to lsp4j's representation for serialization.
     *
     * @throws IllegalArgumentException if the message has neither an id nor
     *                                  a method
     */
    public org.eclipse.lsp4j.jsonrpc.messages.Message toLsp4j(Message message) {
        if (message.isRequest()) {
            RequestMessage request = new RequestMessage();
            request.setJsonrpc(Message.JSONRPC_VERSION);
            request.setRawId(toRawId(message.getId()));
            request.setMethod(message.getMethod());
            request.setParams(message.getParams());
            return request;
        }
        if (message.isNotification()) {
            NotificationMessage notification = new NotificationMessage();
            notification.setJsonrpc(Message.JSONRPC_VERSION);
            notification.setMethod(message.getMethod());
            notification.setParams(message.getParams());
            return notification;
        }
        if (message.isResponse()) {
            ResponseMessage response = new ResponseMessage();
            response.setJsonrpc(Message.JSONRPC_VERSION);
            response.setRawId(toRawId(message.getId()));
            if (message.getError() != null) {
                response.setError(message.getError());
            } else {
                response.setResult(message.getResult());
            }
            return response;
        }
        throw new IllegalArgumentException("Message has neither id nor method: " + message);
    }

    /**
     * Convert a parsed lsp4j message. Responses without an error always carry
     * a result, {@link JsonNull#INSTANCE} when the server sent {@code null}.
     */
    public Message fromLsp4j(org.eclipse.lsp4j.jsonrpc.messages.Message message) {
        if (message instanceof RequestMessage) {
            RequestMessage request = (RequestMessage) message;
            return new Message(toId(request.getRawId()), request.getMethod(), toTree(request.getParams()),
                    null, null);
        }
        if (message instanceof NotificationMessage) {
            NotificationMessage notification = (NotificationMessage) message;
            return new Message(null, notification.getMethod(), toTree(notification.getParams()), null, null);
        }
        if (message instanceof ResponseMessage) {
            ResponseMessage response = (ResponseMessage) message;
            if (response.getError() != null) {
                return new Message(toId(response.getRawId()), null, null, null, response.getError());
            }
            JsonElement result = toTree(response.getResult());
            return new Message(toId(response.getRawId()), null, null,
                    result != null ? result : JsonNull.INSTANCE, null);
        }
        throw new IllegalArgumentException("Unsupported message type " + message.getClass().getName());
    }

    private JsonElement toTree(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof JsonElement) {
            return (JsonElement) value;
        }
        return jsonHandler.getGson().toJsonTree(value);
    }

    private static Either<String, Number> toRawId(JsonElement id) {
        JsonPrimitive primitive = id.getAsJsonPrimitive();
        if (primitive.isNumber()) {
            return Either.forRight(primitive.getAsNumber());
        }
        return Either.forLeft(primitive.getAsString());
    }

    private static JsonElement toId(Either<String, Number> rawId) {
        if (rawId == null) {
            return null;
        }
        if (rawId.isRight()) {
            return new JsonPrimitive(rawId.getRight());
        }
        return new JsonPrimitive(rawId.getLeft());
    }
}
