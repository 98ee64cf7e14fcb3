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

import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Fetches pages over HTTP and decodes them as UTF-8, falling back to Big5
 * (dropping undecodable bytes) when the body is not valid UTF-8.
 */
public class HttpPageFetcher implements PageSource, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(HttpPageFetcher.class);

    private static final Charset FALLBACK_CHARSET = Charset.forName("Big5");
    private static final String ILLEGAL_URI_CHARS = "\"<>\\^`{|}";

    private final Configuration config;
    private final CloseableHttpClient httpClient;

    public HttpPageFetcher(Configuration config) {
        this.config = config;

        // Configure HTTP client with timeouts
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(config.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                .setResponseTimeout(config.getReadTimeoutMs(), TimeUnit.MILLISECONDS)
                .build();

        this.httpClient = HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .build();
    }

    @Override
    public String fetch(String url) throws IOException {
        logger.debug("Fetching {}", url);
        HttpGet request = new HttpGet(toRequestUri(url));
        request.setHeader(HttpHeaders.USER_AGENT, config.getUserAgent());
        request.setHeader(HttpHeaders.REFERER, config.getReferer());

        byte[] body;
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int status = response.getCode();
            if (status < 200 || status >= 300) {
                throw new TransportException(url, status, response.getReasonPhrase());
            }
            HttpEntity entity = response.getEntity();
            body = entity != null ? EntityUtils.toByteArray(entity) : new byte[0];
        } catch (TransportException e) {
            throw e;
        } catch (IOException e) {
            throw new TransportException(url, e);
        }

        logger.debug("Fetched {} ({} bytes)", url, body.length);
        return decode(body);
    }

    /**
     * Builds the request URI, percent-encoding spaces, non-ASCII and other
     * characters that may not appear raw in a URI. Existing escapes are kept.
     *
     * @throws TransportException if the URL is still not a valid URI
     */
    static URI toRequestUri(String url) throws TransportException {
        StringBuilder encoded = new StringBuilder(url.length());
        for (int i = 0; i < url.length(); i++) {
            char c = url.charAt(i);
            if (c > 0x20 && c < 0x7f && ILLEGAL_URI_CHARS.indexOf(c) < 0) {
                encoded.append(c);
                continue;
            }
            int end = Character.isHighSurrogate(c) && i + 1 < url.length() ? i + 2 : i + 1;
            for (byte b : url.substring(i, end).getBytes(StandardCharsets.UTF_8)) {
                encoded.append('%').append(String.format("%02X", b & 0xff));
            }
            i = end - 1;
        }
        try {
            URI uri = new URI(encoded.toString());
            if (uri.getHost() == null) {
                throw new URISyntaxException(url, "Missing host");
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new TransportException(url, new IOException("Invalid URL: " + e.getMessage(), e));
        }
    }

    /**
     * Decodes a response body as strict UTF-8, or as Big5 ignoring bad bytes
     * if that fails. Never throws.
     */
    public static String decode(byte[] body) {
        CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return utf8.decode(ByteBuffer.wrap(body)).toString();
        } catch (CharacterCodingException e) {
            logger.debug("Body is not valid UTF-8, decoding as {}", FALLBACK_CHARSET);
        }

        CharsetDecoder fallback = FALLBACK_CHARSET.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        try {
            return fallback.decode(ByteBuffer.wrap(body)).toString();
        } catch (CharacterCodingException e) {
            // IGNORE never reports; keep a lossy result regardless
            return new String(body, FALLBACK_CHARSET);
        }
    }

    /**
     * Closes the HTTP client.
     */
    @Override
    public void close() {
        try {
            httpClient.close();
        } catch (IOException e) {
            logger.error("Error closing HTTP client: {}", e.getMessage());
        }
    }
}
