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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;

/**
 * Tests for {@link MessageReader}: header parsing, byte-exact body reads,
 * skipping of malformed frames and end of stream.
 */
class MessageReaderTests {

	private static final String NEXT = "Content-Length: 17\r\n\r\n{\"method\":\"next\"}";

	private MessageCodec codec;

	@BeforeEach
	void setup() {
		codec = new MessageCodec();
	}

	private MessageReader reader(String content) {
		return codec.newReader(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));
	}

	@Test
	void testReadsWhatWasWritten() throws IOException {
		JsonArray items = new JsonArray();
		items.add("SELECT");
		Message request = Message.request(42, "textDocument/completion", items);
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		codec.newWriter(out).write(request);

		Message read = codec.newReader(new ByteArrayInputStream(out.toByteArray())).read();

		Assertions.assertEquals(request, read);
		Assertions.assertTrue(read.isRequest());
		Assertions.assertEquals(42L, read.getIdAsLong());
		Assertions.assertEquals(items, read.getParams());
	}

	@Test
	void testReadsErrorResponse() throws IOException {
		MessageReader reader = reader("Content-Length: 75\r\n\r\n"
				+ "{\"jsonrpc\":\"2.0\",\"id\":2,\"error\":{\"code\":-32601,\"message\":\"no such method\"}}");

		Message message = reader.read();

		Assertions.assertTrue(message.isResponse());
		Assertions.assertEquals(2L, message.getIdAsLong());
		ResponseError error = message.getError();
		Assertions.assertNotNull(error);
		Assertions.assertEquals(-32601, error.getCode());
		Assertions.assertEquals("no such method", error.getMessage());
	}

	@Test
	void testReadsTwoFramesBackToBack() throws IOException {
		MessageReader reader = reader("Content-Length: 14\r\n\r\n{\"method\":\"a\"}"
				+ "Content-Length: 14\r\n\r\n{\"method\":\"b\"}");

		Assertions.assertEquals("a", reader.read().getMethod());
		Assertions.assertEquals("b", reader.read().getMethod());
		Assertions.assertThrows(EOFException.class, reader::read);
	}

	@Test
	void testReadAllDeliversInOrderUntilEnd() throws IOException {
		MessageReader reader = reader("Content-Length: 14\r\n\r\n{\"method\":\"a\"}" + NEXT);
		List<String> methods = new ArrayList<>();

		reader.readAll(message -> methods.add(message.getMethod()));

		Assertions.assertEquals(List.of("a", "next"), methods);
	}

	@Test
	void testIgnoresOtherHeaders() throws IOException {
		MessageReader reader = reader("Content-Type: application/vscode-jsonrpc; charset=utf-8\r\n" + NEXT);
		Assertions.assertEquals("next", reader.read().getMethod());
		Assertions.assertEquals(0, reader.getErrorCount());
	}

	@Test
	void testAcceptsBareLineFeeds() throws IOException {
		Message message = reader("Content-Length: 17\n\n{\"method\":\"ping\"}").read();
		Assertions.assertEquals("ping", message.getMethod());
		Assertions.assertTrue(message.isNotification());
	}

	@Test
	void testServerRequestIsRequestNotResponse() throws IOException {
		Message message = reader(
				"Content-Length: 43\r\n\r\n{\"id\":9,\"method\":\"workspace/configuration\"}").read();
		Assertions.assertTrue(message.isRequest());
		Assertions.assertFalse(message.isResponse());
	}

	@Test
	void testNullResultBecomesJsonNull() throws IOException {
		Message message = reader("Content-Length: 22\r\n\r\n{\"id\":3,\"result\":null}").read();
		Assertions.assertTrue(message.isResponse());
		Assertions.assertTrue(message.getResult().isJsonNull());
	}

	// ------------------------------------------------------------------
	// Malformed frames
	// ------------------------------------------------------------------

	@Test
	void testMissingContentLengthIsSkipped() throws IOException {
		MessageReader reader = reader("Content-Type: foo\r\n\r\n" + NEXT);

		Assertions.assertEquals("next", reader.read().getMethod());
		Assertions.assertEquals(1, reader.getErrorCount());
	}

	@Test
	void testInvalidContentLengthIsSkipped() throws IOException {
		MessageReader reader = reader("Content-Length: abc\r\n\r\n" + NEXT);

		Assertions.assertEquals("next", reader.read().getMethod());
		Assertions.assertTrue(reader.getErrorCount() > 0);
	}

	@Test
	void testZeroContentLengthIsSkipped() throws IOException {
		MessageReader reader = reader("Content-Length: 0\r\n\r\n" + NEXT);

		Assertions.assertEquals("next", reader.read().getMethod());
		Assertions.assertEquals(1, reader.getErrorCount());
	}

	@Test
	void testBodyReadIsByteExact() throws IOException {
		// "[1,2]" parses as JSON but not as a message; the next header must
		// start right after its fifth byte.
		MessageReader reader = reader("Content-Length: 5\r\n\r\n[1,2]" + NEXT);

		Assertions.assertEquals("next", reader.read().getMethod());
		Assertions.assertEquals(1, reader.getErrorCount());
	}

	@Test
	void testUnparseableBodyIsSkipped() throws IOException {
		MessageReader reader = reader("Content-Length: 3\r\n\r\n{{{" + NEXT);

		Assertions.assertEquals("next", reader.read().getMethod());
		Assertions.assertEquals(1, reader.getErrorCount());
	}

	@Test
	void testJsonNullBodyIsSkipped() throws IOException {
		MessageReader reader = reader("Content-Length: 4\r\n\r\nnull" + NEXT);

		Assertions.assertEquals("next", reader.read().getMethod());
		Assertions.assertEquals(1, reader.getErrorCount());
	}

	// ------------------------------------------------------------------
	// End of stream
	// ------------------------------------------------------------------

	@Test
	void testEmptyStreamIsEof() {
		Assertions.assertThrows(EOFException.class, () -> reader("").read());
	}

	@Test
	void testEofInsideHeaders() {
		Assertions.assertThrows(EOFException.class, () -> reader("Content-Len").read());
	}

	@Test
	void testTruncatedBodyIsEof() {
		EOFException e = Assertions.assertThrows(EOFException.class,
				() -> reader("Content-Length: 10\r\n\r\n{}").read());
		Assertions.assertTrue(e.getMessage().contains("2 of 10"), e.getMessage());
	}
}
