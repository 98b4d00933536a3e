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

import java.util.Objects;

import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;

/**
 * A JSON-RPC 2.0 envelope as exchanged with the language server.
 *
 * <p>Every field is optional on the wire. The combination of {@code id} and
 * {@code method} decides the kind of message:</p>
 * <ul>
 *   <li><b>request</b>: both an id and a method</li>
 *   <li><b>notification</b>: a method but no id</li>
 *   <li><b>response</b>: an id but no method; carries either a
 *       {@code result} (possibly JSON {@code null}) or an {@code error}</li>
 * </ul>
 *
 * <p>Instances are immutable.</p>
 */
public final class Message {

    /** Value of the {@code jsonrpc} member on every outbound message. */
    public static final String JSONRPC_VERSION = "2.0";

    private final JsonElement id;
    private final String method;
    private final JsonElement params;
    private final JsonElement result;
    private final ResponseError error;

    Message(JsonElement id, String method, JsonElement params, JsonElement result, ResponseError error) {
        this.id = id;
        this.method = method;
        this.params = params;
        this.result = result;
        this.error = error;
    }

    public static Message request(long id, String method, JsonElement params) {
        return new Message(new JsonPrimitive(id), Objects.requireNonNull(method, "method"), params, null, null);
    }

    public static Message notification(String method, JsonElement params) {
        return new Message(null, Objects.requireNonNull(method, "method"), params, null, null);
    }

    public static Message response(JsonElement id, JsonElement result) {
        return new Message(Objects.requireNonNull(id, "id"), null, null, result, null);
    }

    public static Message errorResponse(JsonElement id, ResponseError error) {
        return new Message(Objects.requireNonNull(id, "id"), null, null, null, Objects.requireNonNull(error, "error"));
    }

    /** The raw identifier, or {@code null} when the message has none. */
    public JsonElement getId() {
        return id;
    }

    /**
     * The identifier as a long, or {@code null} if the message has no
     * identifier or the identifier is not an integral number. String ids
     * are never converted, so {@code "1"} yields {@code null} and a response
     * carrying it is not matched to request {@code 1}.
     */
    public Long getIdAsLong() {
        if (id == null || !id.isJsonPrimitive() || !id.getAsJsonPrimitive().isNumber()) {
            return null;
        }
        try {
            return Long.parseLong(id.getAsString());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public String getMethod() {
        return method;
    }

    public JsonElement getParams() {
        return params;
    }

    public JsonElement getResult() {
        return result;
    }

    public ResponseError getError() {
        return error;
    }

    public boolean hasId() {
        return id != null;
    }

    public boolean isRequest() {
        return id != null && method != null;
    }

    public boolean isNotification() {
        return id == null && method != null;
    }

    public boolean isResponse() {
        return id != null && method == null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Message)) {
            return false;
        }
        Message other = (Message) obj;
        return Objects.equals(id, other.id)
                && Objects.equals(method, other.method)
                && Objects.equals(params, other.params)
                && Objects.equals(result, other.result)
                && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        // Hashes method and error code only; ids, params and results are left out.
        return Objects.hash(method, error != null ? error.getCode() : null);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Message{");
        if (id != null) {
            sb.append("id=").append(id).append(", ");
        }
        if (method != null) {
            sb.append("method=").append(method).append(", ");
        }
        if (error != null) {
            sb.append("error=").append(error.getCode()).append(' ').append(error.getMessage()).append(", ");
        }
        if (sb.length() > "Message{".length()) {
            sb.setLength(sb.length() - 2);
        }
        return sb.append('}').toString();
    }
}
