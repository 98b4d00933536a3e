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

import java.io.IOException;
import java.io.OutputStream;

import org.eclipse.lsp4j.jsonrpc.JsonRpcException;
import org.eclipse.lsp4j.jsonrpc.json.StreamMessageConsumer;

/**
 * Writes framed messages through lsp4j's {@link StreamMessageConsumer}. The
 * {@code Content-Length} header counts the UTF-8 bytes of the body; header
 * and body are written and flushed as one unit, so frames from concurrent
 * writers never interleave.
 */
public class MessageWriter {

    private final StreamMessageConsumer consumer;
    private final MessageCodec codec;

    MessageWriter(OutputStream output, MessageCodec codec) {
        this.consumer = new StreamMessageConsumer(output, codec.getJsonHandler());
        this.codec = codec;
    }

    public void write(Message message) throws IOException {
        try {
            consumer.consume(codec.toLsp4j(message));
        } catch (JsonRpcException e) {
            if (e.getCause() instanceof IOException) {
                throw (IOException) e.getCause();
            }
            throw e;
        }
    }
}
