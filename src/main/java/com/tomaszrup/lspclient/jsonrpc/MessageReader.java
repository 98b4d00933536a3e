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
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.eclipse.lsp4j.jsonrpc.JsonRpcException;
import org.eclipse.lsp4j.jsonrpc.json.StreamMessageProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads framed messages from a server's output.
 *
 * <p>Header parsing is lsp4j's: lines up to an empty line, a case-sensitive
 * {@code Content-Length} key, other headers ignored. A header block without
 * a usable {@code Content-Length}, or a body that does not parse as a
 * message, is logged and skipped; reading continues with the next frame.</p>
 *
 * <p>The body is read byte-exact before it is parsed. A body shorter than its
 * declared length therefore consumes bytes of the following frame instead of
 * stopping at a line break, and a body that fails to parse leaves the stream
 * at the next frame boundary.</p>
 *
 * <p>Not thread-safe; one thread reads.</p>
 */
public class MessageReader extends StreamMessageProducer {

    private static final Logger logger = LoggerFactory.getLogger(MessageReader.class);

    private final MessageCodec codec;
    private final AtomicInteger errorCount = new AtomicInteger();
    private volatile String endReason = "End of stream";

    MessageReader(InputStream input, MessageCodec codec) {
        super(input, codec.getJsonHandler());
        this.codec = codec;
    }

    /**
     * Hand every message to {@code handler} until the stream ends, is closed,
     * or {@link #close()} is called. Blocks the calling thread.
     *
     * @throws IOException if reading failed for a reason other than the
     *                     stream being closed
     */
    public void readAll(Consumer<Message> handler) throws IOException {
        try {
            listen(message -> {
                if (message == null) {
                    fireError(new IllegalStateException("Message body is JSON null"));
                    return;
                }
                handler.accept(codec.fromLsp4j(message));
            });
        } catch (JsonRpcException e) {
            throw unwrap(e);
        }
    }

    /**
     * Read the next message, skipping malformed frames.
     *
     * @throws EOFException if the stream ended before another message
     */
    public Message read() throws IOException {
        Message[] next = new Message[1];
        readAll(message -> {
            next[0] = message;
            close();
        });
        if (next[0] == null) {
            throw new EOFException(endReason);
        }
        return next[0];
    }

    /** Frames skipped so far because they could not be decoded. */
    public int getErrorCount() {
        return errorCount.get();
    }

    @Override
    protected boolean handleMessage(InputStream input, Headers headers) throws IOException {
        if (headers.contentLength <= 0) {
            fireError(new IllegalStateException("Non-positive Content-Length: " + headers.contentLength));
            return true;
        }
        byte[] body = new byte[headers.contentLength];
        int offset = 0;
        while (offset < body.length) {
            int read = input.read(body, offset, body.length - offset);
            if (read < 0) {
                endReason = "Stream ended after " + offset + " of " + body.length + " body bytes";
                logger.debug(endReason);
                return false;
            }
            offset += read;
        }
        return super.handleMessage(new ByteArrayInputStream(body), headers);
    }

    @Override
    protected void fireError(Throwable error) {
        errorCount.incrementAndGet();
        logger.warn("Skipping malformed frame: {}", error.getMessage());
        logger.debug("Frame decoding failure", error);
    }

    @Override
    protected void fireStreamClosed(Exception cause) {
        endReason = "Stream closed: " + cause.getMessage();
        logger.debug(endReason);
    }

    private static IOException unwrap(JsonRpcException e) {
        if (e.getCause() instanceof IOException) {
            return (IOException) e.getCause();
        }
        return new IOException(e.getMessage(), e);
    }
}
