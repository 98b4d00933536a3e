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
import java.util.Optional;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionItemKind;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Tests for {@link ProtocolJson}: verifies normalization of completion
 * results in both shapes and decoding of hover results.
 */
class ProtocolJsonTests {

	// ------------------------------------------------------------------
	// completionItems()
	// ------------------------------------------------------------------

	@Test
	void testCompletionItemsFromArray() {
		JsonElement result = JsonParser.parseString(
				"[{\"label\":\"SELECT\",\"kind\":14},{\"label\":\"users\",\"kind\":7,\"detail\":\"table\"}]");

		List<CompletionItem> items = ProtocolJson.completionItems(result);

		Assertions.assertEquals(2, items.size());
		Assertions.assertEquals("SELECT", items.get(0).getLabel());
		Assertions.assertEquals(CompletionItemKind.Keyword, items.get(0).getKind());
		Assertions.assertEquals(CompletionItemKind.Class, items.get(1).getKind());
		Assertions.assertEquals("table", items.get(1).getDetail());
	}

	@Test
	void testCompletionItemsFromCompletionList() {
		JsonElement result = JsonParser.parseString(
				"{\"isIncomplete\":true,\"items\":[{\"label\":\"id\"},{\"label\":\"name\"}]}");

		List<CompletionItem> items = ProtocolJson.completionItems(result);

		Assertions.assertEquals(2, items.size());
		Assertions.assertEquals("name", items.get(1).getLabel());
	}

	@Test
	void testCompletionItemsFromNull() {
		Assertions.assertTrue(ProtocolJson.completionItems(JsonNull.INSTANCE).isEmpty());
		Assertions.assertTrue(ProtocolJson.completionItems(null).isEmpty());
	}

	@Test
	void testCompletionItemsRejectsOtherShapes() {
		Assertions.assertThrows(JsonParseException.class,
				() -> ProtocolJson.completionItems(new JsonPrimitive("SELECT")));
	}

	// ------------------------------------------------------------------
	// hover()
	// ------------------------------------------------------------------

	@Test
	void testHoverWithMarkupContent() {
		Optional<Hover> hover = ProtocolJson.hover(JsonParser.parseString(
				"{\"contents\":{\"kind\":\"plaintext\",\"value\":\"users.id integer\"},"
						+ "\"range\":{\"start\":{\"line\":0,\"character\":7},\"end\":{\"line\":0,\"character\":9}}}"));

		Assertions.assertTrue(hover.isPresent());
		Assertions.assertEquals("users.id integer", hover.get().getContents().getRight().getValue());
		Assertions.assertEquals(new Position(0, 7), hover.get().getRange().getStart());
	}

	@Test
	void testHoverWithPlainString() {
		Optional<Hover> hover = ProtocolJson.hover(JsonParser.parseString("{\"contents\":\"plain\"}"));

		Assertions.assertTrue(hover.isPresent());
		Assertions.assertEquals("plain", hover.get().getContents().getLeft().get(0).getLeft());
	}

	@Test
	void testHoverNullIsEmpty() {
		Assertions.assertFalse(ProtocolJson.hover(JsonNull.INSTANCE).isPresent());
	}

	// ------------------------------------------------------------------
	// toJsonTree()
	// ------------------------------------------------------------------

	@Test
	void testToJsonTreeUsesProtocolFieldNames() {
		JsonObject tree = ProtocolJson.toJsonTree(
				new HoverParams(new TextDocumentIdentifier("file:///a.sql"), new Position(2, 4))).getAsJsonObject();

		Assertions.assertEquals("file:///a.sql", tree.getAsJsonObject("textDocument").get("uri").getAsString());
		Assertions.assertEquals(2, tree.getAsJsonObject("position").get("line").getAsInt());
		Assertions.assertEquals(4, tree.getAsJsonObject("position").get("character").getAsInt());
	}
}
