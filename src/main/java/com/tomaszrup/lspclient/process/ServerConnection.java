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

import java.io.InputStream;
import java.io.OutputStream;

/**
 * A duplex byte connection to a language server: the server's input
 * (our write-end) and the server's output (our read-end).
 *
 * <p>{@link ProcessServerConnection} is the production implementation; any
 * other transport (sockets, in-memory pipes) can be plugged in through a
 * {@link ServerConnector}.</p>
 */
public interface ServerConnection {

    /** Frames from the server. Only the supervisor's reader thread reads it. */
    InputStream getInputStream();

    /** Frames to the server. */
    OutputStream getOutputStream();

    boolean isAlive();

    /**
     * Release the connection: terminate the peer, then close both ends. A
     * write blocked on the write-end must fail rather than keep this call
     * waiting. Must be safe to call more than once.
     */
    void close();

    /** Short label used in log lines and thread names. */
    String describe();
}
