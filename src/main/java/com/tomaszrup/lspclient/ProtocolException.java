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

import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;

/**
 * The server answered a request with a JSON-RPC error object. The error's
 * code, message and data are kept exactly as received.
 */
public class ProtocolException extends LspClientException {

    private static final long serialVersionUID = 1L;

    private final String method;
    private final transient ResponseError error;

    public ProtocolException(String method, ResponseError error) {
        super(method + " failed with error " + error.getCode() + ": " + error.getMessage());
        this.method = method;
        this.error = error;
    }

    public String getMethod() {
        return method;
    }

    public ResponseError getError() {
        return error;
    }

    public int getCode() {
        return error.getCode();
    }
}
