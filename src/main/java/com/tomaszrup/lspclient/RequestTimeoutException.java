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

import java.time.Duration;

/**
 * No response arrived for a request within its timeout. The request is
 * forgotten; a late response is discarded. Callers may retry with a new
 * request.
 */
public class RequestTimeoutException extends LspClientException {

    private static final long serialVersionUID = 1L;

    private final String method;
    private final long requestId;
    private final Duration timeout;

    public RequestTimeoutException(String method, long requestId, Duration timeout) {
        super("Request " + requestId + " (" + method + ") timed out after " + timeout.toMillis() + " ms");
        this.method = method;
        this.requestId = requestId;
        this.timeout = timeout;
    }

    public String getMethod() {
        return method;
    }

    public long getRequestId() {
        return requestId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
