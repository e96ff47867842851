package com.example.hookhub.server.filter;

import com.example.hookhub.protocol.HttpHeader;
import com.example.hookhub.protocol.HttpVerb;
import com.example.hookhub.protocol.RelayedRequest;
import com.example.hookhub.protocol.TunnelMessageCodec;
import com.example.hookhub.protocol.TunnelProtocol;
import com.example.hookhub.server.websocket.TunnelHub;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Set;

/**
 * Public webhook endpoint.
 * Every request outside the tunnel path is turned into a {@link RelayedRequest}, broadcast to
 * all connected tunnels and answered with 200 right away. The sender never waits on a client.
 * Bodies are read through a size guard that counts actual bytes, so chunked uploads cannot
 * get past the limit by omitting Content-Length.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@Slf4j
public class IngressFilter extends OncePerRequestFilter {

    // Describe the hop to this server, not the original call
    private static final Set<String> SKIPPED_HEADERS = Set.of("host", "origin", "connection");

    private static final String TUNNEL_ROOT = TunnelProtocol.TUNNEL_PATH.substring(0,
            TunnelProtocol.TUNNEL_PATH.length() - 1);

    private final TunnelHub hub;
    private final TunnelMessageCodec codec;
    private final long maxBodyBytes;
    private final Duration readTimeout;
    private final Counter relayedCounter;
    private final Counter droppedCounter;

    public IngressFilter(TunnelHub hub,
                         TunnelMessageCodec codec,
                         MeterRegistry meterRegistry,
                         @Value("${hookhub.ingress.max-body-size:2MB}") DataSize maxBodySize,
                         @Value("${hookhub.ingress.read-timeout:30s}") Duration readTimeout) {
        this.hub = hub;
        this.codec = codec;
        this.maxBodyBytes = maxBodySize.toBytes();
        this.readTimeout = readTimeout;
        this.relayedCounter = Counter.builder("hookhub.ingress.requests")
                .tag("outcome", "relayed")
                .register(meterRegistry);
        this.droppedCounter = Counter.builder("hookhub.ingress.requests")
                .tag("outcome", "dropped")
                .register(meterRegistry);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.equals(TUNNEL_ROOT) || path.startsWith(TunnelProtocol.TUNNEL_PATH);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String fullPath = fullPath(request);

        // 1. Fast path: Check Header if present
        long contentLength = request.getContentLengthLong();
        if (contentLength > maxBodyBytes) {
            reject(response, fullPath, contentLength);
            return;
        }

        // 2. Slow path: count bytes for chunked/streaming requests
        byte[] body;
        try {
            body = readBody(request.getInputStream(), maxBodyBytes, System.nanoTime() + readTimeout.toNanos());
        } catch (ReadDeadlineExceededException e) {
            log.warn("[Ingress] Body of {} {} not complete after {}, dropping", request.getMethod(), fullPath,
                    readTimeout);
            droppedCounter.increment();
            response.sendError(HttpServletResponse.SC_REQUEST_TIMEOUT, "Request body too slow");
            return;
        } catch (IOException e) {
            // Sender went away or hit the connector read timeout; nothing complete to relay
            log.warn("[Ingress] Failed to read body of {} {}: {}", request.getMethod(), fullPath, e.getMessage());
            droppedCounter.increment();
            return;
        }
        if (body == null) {
            reject(response, fullPath, maxBodyBytes + 1);
            return;
        }

        relay(request, fullPath, body);

        response.setStatus(HttpServletResponse.SC_OK);
        response.setContentLength(0);
    }

    private void relay(HttpServletRequest request, String fullPath, byte[] body) {
        HttpVerb verb = HttpVerb.fromToken(request.getMethod());
        if (verb == null) {
            log.warn("[Ingress] Dropping request with unsupported method {} {}", request.getMethod(), fullPath);
            droppedCounter.increment();
            return;
        }

        try {
            RelayedRequest relayed = RelayedRequest.builder()
                    .method(verb)
                    .fullPath(fullPath)
                    .headers(headers(request))
                    .body(body)
                    .build();

            int clients = hub.broadcast(codec.encode(relayed));
            relayedCounter.increment();
            log.info("[Ingress] Forwarded {} {} to {} client(s)", verb, fullPath, clients);
        } catch (RuntimeException e) {
            droppedCounter.increment();
            log.error("[Ingress] Failed to relay {} {}", verb, fullPath, e);
        }
    }

    private static String fullPath(HttpServletRequest request) {
        String query = request.getQueryString();
        return query == null ? request.getRequestURI() : request.getRequestURI() + "?" + query;
    }

    private static List<HttpHeader> headers(HttpServletRequest request) {
        List<HttpHeader> headers = new ArrayList<>();
        Enumeration<String> headerNames = request.getHeaderNames();
        if (headerNames == null) {
            return headers;
        }
        for (String name : Collections.list(headerNames)) {
            if (SKIPPED_HEADERS.contains(name.toLowerCase())) {
                continue;
            }
            Enumeration<String> values = request.getHeaders(name);
            while (values.hasMoreElements()) {
                headers.add(new HttpHeader(name, values.nextElement()));
            }
        }
        return headers;
    }

    /**
     * The connector timeout only bounds a single read, so a sender trickling one byte at a time
     * is cut off here once the whole body has taken longer than the deadline.
     *
     * @return the body, or {@code null} once more than {@code maxBytes} have been read
     * @throws ReadDeadlineExceededException when {@code deadlineNanos} passes before the end of the body
     */
    private static byte[] readBody(InputStream in, long maxBytes, long deadlineNanos) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        long bytesRead = 0;
        int n;
        while ((n = in.read(buffer)) != -1) {
            bytesRead += n;
            if (bytesRead > maxBytes) {
                return null;
            }
            out.write(buffer, 0, n);
            if (System.nanoTime() - deadlineNanos > 0) {
                throw new ReadDeadlineExceededException();
            }
        }
        return out.toByteArray();
    }

    private void reject(HttpServletResponse response, String path, long size) throws IOException {
        log.warn("[DoS Protection] Rejected request to {} with {} bytes", path, size);
        droppedCounter.increment();
        response.sendError(HttpServletResponse.SC_REQUEST_ENTITY_TOO_LARGE, "Payload too large");
    }

    private static class ReadDeadlineExceededException extends IOException {
        ReadDeadlineExceededException() {
            super("Request body read deadline exceeded");
        }
    }
}
