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

import java.lang.reflect.Type;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.jsonrpc.json.MessageJsonHandler;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

/**
 * Converts between lsp4j protocol objects and the raw JSON trees carried in
 * messages. Uses lsp4j's own Gson configuration, so {@code Either} fields
 * and protocol enums map the same way they do inside lsp4j.
 */
public final class ProtocolJson {

    private static final Gson GSON = new MessageJsonHandler(Collections.emptyMap()).getGson();

    private static final Type COMPLETION_ITEMS_TYPE = new TypeToken<List<CompletionItem>>() {
    }.getType();

    private ProtocolJson() {
    }

    public static JsonElement toJsonTree(Object params) {
        return GSON.toJsonTree(params);
    }

    /**
     * Normalize a {@code textDocument/completion} result. The server may
     * answer with an item array, a {@link CompletionList} or {@code null}.
     *
     * @return the items, empty for a {@code null} result
     * @throws JsonParseException if the result has neither shape
     */
    public static List<CompletionItem> completionItems(JsonElement result) {
        if (result == null || result.isJsonNull()) {
            return Collections.emptyList();
        }
        if (result.isJsonArray()) {
            List<CompletionItem> items = GSON.fromJson(result, COMPLETION_ITEMS_TYPE);
            return items != null ? items : Collections.emptyList();
        }
        if (result.isJsonObject()) {
            CompletionList list = GSON.fromJson(result, CompletionList.class);
            return list != null && list.getItems() != null ? list.getItems() : Collections.emptyList();
        }
        throw new JsonParseException("Unexpected completion result: " + result);
    }

    /**
     * Decode a {@code textDocument/hover} result; empty when the server has
     * nothing to show.
     */
    public static Optional<Hover> hover(JsonElement result) {
        if (result == null || result.isJsonNull()) {
            return Optional.empty();
        }
        return Optional.ofNullable(GSON.fromJson(result, Hover.class));
    }
}
