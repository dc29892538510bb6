/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.util;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.common.unit.TimeValue;

/**
 * Thin blocking wrapper around the Apache HTTP client shared by the ingestion, registry and sink clients.
 */
public class HttpClientUtil implements Closeable {
    private static final Logger logger = LogManager.getLogger(HttpClientUtil.class);

    private final CloseableHttpClient client;

    public HttpClientUtil(TimeValue timeout) {
        Timeout httpTimeout = Timeout.ofMilliseconds(timeout.millis());
        ConnectionConfig connectionConfig = ConnectionConfig.custom().setConnectTimeout(httpTimeout).setSocketTimeout(httpTimeout).build();
        RequestConfig requestConfig = RequestConfig
            .custom()
            .setConnectionRequestTimeout(httpTimeout)
            .setResponseTimeout(httpTimeout)
            .build();
        this.client = HttpClients
            .custom()
            .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create().setDefaultConnectionConfig(connectionConfig).build())
            .setDefaultRequestConfig(requestConfig)
            .build();
    }

    /**
     * Issues a GET request.
     *
     * @param uri target
     * @return status and body of the response
     * @throws IOException on transport failures
     */
    public HttpResult get(URI uri) throws IOException {
        HttpGet get = new HttpGet(uri);
        get.setHeader(HttpHeaders.ACCEPT, ContentType.APPLICATION_JSON.getMimeType());
        return execute(get);
    }

    /**
     * Issues a POST request with a JSON body.
     *
     * @param uri target
     * @param json request body
     * @return status and body of the response
     * @throws IOException on transport failures
     */
    public HttpResult postJson(URI uri, String json) throws IOException {
        HttpPost post = new HttpPost(uri);
        post.setEntity(new StringEntity(json, ContentType.APPLICATION_JSON));
        return execute(post);
    }

    private HttpResult execute(ClassicHttpRequest request) throws IOException {
        logger.debug("{} {}", request.getMethod(), request.getRequestUri());
        return client.execute(request, response -> {
            String body = response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
            return new HttpResult(response.getCode(), body);
        });
    }

    @Override
    public void close() throws IOException {
        client.close();
    }

    /**
     * Status code and body of a completed exchange.
     */
    public static class HttpResult {
        private final int status;
        private final String body;

        public HttpResult(int status, String body) {
            this.status = status;
            this.body = body;
        }

        public int getStatus() {
            return status;
        }

        public String getBody() {
            return body;
        }

        public boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }
}
