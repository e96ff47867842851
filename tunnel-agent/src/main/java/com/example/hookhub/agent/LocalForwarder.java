package com.example.hookhub.agent;

import com.example.hookhub.protocol.HttpHeader;
import com.example.hookhub.protocol.RelayedRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.support.ClassicRequestBuilder;
import org.apache.hc.core5.util.Timeout;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Replays a {@link RelayedRequest} against the local server.
 * The response is read and thrown away; failures are logged and never propagated.
 */
@Slf4j
public class LocalForwarder implements Closeable {

    // The client sets these itself for the local hop; Host is rewritten to the local endpoint
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
            "host", "content-length", "transfer-encoding", "connection", "keep-alive",
            "proxy-connection", "upgrade", "te", "trailer", "expect");

    private final CloseableHttpClient httpClient;

    public LocalForwarder() {
        this(Timeout.ofSeconds(10), Timeout.ofSeconds(30));
    }

    public LocalForwarder(Timeout connectTimeout, Timeout responseTimeout) {
        this.httpClient = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(connectTimeout)
                                .setSocketTimeout(responseTimeout)
                                .build())
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(responseTimeout)
                        .build())
                // forward exactly what was received
                .disableRedirectHandling()
                .disableAutomaticRetries()
                .disableContentCompression()
                .build();
    }

    /**
     * Sends the request to {@code localOrigin} plus the request's path and query.
     *
     * @param request     decoded request
     * @param localOrigin scheme, host and port of the local server
     * @return what happened, for logging
     */
    public ForwardResult forward(RelayedRequest request, URI localOrigin) {
        long start = System.nanoTime();
        try {
            ClassicHttpRequest httpRequest = toHttpRequest(request, localOrigin);
            int statusCode = httpClient.execute(httpRequest, response -> {
                EntityUtils.consume(response.getEntity());
                return response.getCode();
            });
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            log.info("[Forwarder] Forwarded request: {} {} - {} ({}ms)",
                    request.getMethod(), request.getFullPath(), statusCode, elapsed);
            return ForwardResult.builder()
                    .success(true)
                    .statusCode(statusCode)
                    .elapsedMillis(elapsed)
                    .build();
        } catch (IOException | RuntimeException e) {
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            log.error("[Forwarder] Forwarded request error: {} {} - {}",
                    request.getMethod(), request.getFullPath(), e.toString());
            return ForwardResult.builder()
                    .success(false)
                    .elapsedMillis(elapsed)
                    .error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }

    static ClassicHttpRequest toHttpRequest(RelayedRequest request, URI localOrigin) {
        ClassicRequestBuilder builder = ClassicRequestBuilder.create(request.getMethod().name())
                .setUri(resolve(localOrigin, request.getFullPath()));

        for (HttpHeader header : request.getHeaders()) {
            if (!RESTRICTED_HEADERS.contains(header.getName().toLowerCase())) {
                builder.addHeader(header.getName(), header.getValue());
            }
        }

        if (request.getBody().length > 0) {
            // Content-Type travels as a copied header
            builder.setEntity(new ByteArrayEntity(request.getBody(), null));
        }
        return builder.build();
    }

    /**
     * Joins the local origin with an already-encoded path and query.
     */
    static URI resolve(URI localOrigin, String fullPath) {
        return URI.create(localOrigin.getScheme() + "://" + localOrigin.getRawAuthority() + fullPath);
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
