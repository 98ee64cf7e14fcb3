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

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HTTP fetching and charset fallback.
 */
public class HttpPageFetcherTest {

    private HttpServer server;
    private HttpPageFetcher fetcher;
    private String baseUrl;

    @BeforeEach
    void setup() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/utf8", exchange -> respond(exchange, 200, "<p>理事會議</p>".getBytes(StandardCharsets.UTF_8)));
        server.createContext("/big5", exchange -> respond(exchange, 200, "<p>理事會議</p>".getBytes(Charset.forName("Big5"))));
        server.createContext("/files", exchange -> respond(exchange, 200,
            (exchange.getRequestURI().getPath() + "?" + exchange.getRequestURI().getQuery())
                .getBytes(StandardCharsets.UTF_8)));
        server.createContext("/missing", exchange -> respond(exchange, 404, new byte[0]));
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        Configuration config = new Configuration();
        config.setConnectTimeoutMs(5000);
        config.setReadTimeoutMs(5000);
        fetcher = new HttpPageFetcher(config);
    }

    @AfterEach
    void cleanup() {
        fetcher.close();
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    @Test
    public void testFetchUtf8Page() throws IOException {
        assertEquals("<p>理事會議</p>", fetcher.fetch(baseUrl + "/utf8"));
    }

    @Test
    public void testFetchBig5PageFallsBack() throws IOException {
        assertEquals("<p>理事會議</p>", fetcher.fetch(baseUrl + "/big5"));
    }

    @Test
    public void testNonSuccessStatusThrowsTransportException() {
        TransportException e = assertThrows(TransportException.class, () -> fetcher.fetch(baseUrl + "/missing"));
        assertEquals(404, e.getStatusCode());
        assertEquals(baseUrl + "/missing", e.getUrl());
    }

    @Test
    public void testConnectionFailureThrowsTransportException() throws IOException {
        HttpServer stopped = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        String closedUrl = "http://127.0.0.1:" + stopped.getAddress().getPort() + "/";
        stopped.stop(0);

        TransportException e = assertThrows(TransportException.class, () -> fetcher.fetch(closedUrl));
        assertEquals(-1, e.getStatusCode());
    }

    @Test
    public void testDecodeValidUtf8() {
        assertEquals("備註", HttpPageFetcher.decode("備註".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testDecodeBig5Fallback() {
        byte[] big5 = "備註：請攜帶證件".getBytes(Charset.forName("Big5"));
        assertEquals("備註：請攜帶證件", HttpPageFetcher.decode(big5));
    }

    @Test
    public void testDecodeGarbageNeverFails() {
        byte[] garbage = {(byte) 0xFF, (byte) 0xFE, 'a', (byte) 0x80, 'b'};
        String text = HttpPageFetcher.decode(garbage);
        assertNotNull(text);
        assertTrue(text.contains("a"));
        assertTrue(text.contains("b"));
    }

    @Test
    public void testUrlWithSpacesAndNonAsciiIsEncoded() throws IOException {
        String body = fetcher.fetch(baseUrl + "/files/annual report.html?id=1&t=年會 活動");

        assertEquals("/files/annual report.html?id=1&t=年會 活動", body);
    }

    @Test
    public void testRequestUriKeepsExistingEscapes() throws IOException {
        assertEquals("https://www.kaa.org.tw/news_view.php?id=1&t=%E5%B9%B4%20a",
            HttpPageFetcher.toRequestUri("https://www.kaa.org.tw/news_view.php?id=1&t=年%20a").toString());
    }

    @Test
    public void testInvalidUrlIsTransportException() {
        TransportException e = assertThrows(TransportException.class, () -> fetcher.fetch("http://[bad/page"));

        assertEquals("http://[bad/page", e.getUrl());
        assertEquals(-1, e.getStatusCode());
        assertThrows(TransportException.class, () -> fetcher.fetch("news_view.php?id=1"));
    }
}
