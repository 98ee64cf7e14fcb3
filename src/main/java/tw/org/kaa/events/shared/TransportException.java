/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package tw.org.kaa.events.shared;

import java.io.IOException;

/**
 * Signals that a page could not be retrieved: a non-2xx response or a connection failure.
 */
public class TransportException extends IOException {

    private static final long serialVersionUID = 1L;

    private final String url;
    private final int statusCode;

    public TransportException(String url, int statusCode, String reasonPhrase) {
        super(String.format("Failed to fetch %s: %d %s", url, statusCode,
            reasonPhrase != null ? reasonPhrase : ""));
        this.url = url;
        this.statusCode = statusCode;
    }

    public TransportException(String url, IOException cause) {
        super(String.format("Failed to fetch %s: %s", url, cause.getMessage()), cause);
        this.url = url;
        this.statusCode = -1;
    }

    public String getUrl() {
        return url;
    }

    /**
     * @return the HTTP status, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
