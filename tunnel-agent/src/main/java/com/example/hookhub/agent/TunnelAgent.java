package com.example.hookhub.agent;

import com.example.hookhub.agent.history.HistoryItem;
import com.example.hookhub.agent.history.HistoryStore;
import com.example.hookhub.protocol.DecodeException;
import com.example.hookhub.protocol.Handshake;
import com.example.hookhub.protocol.HandshakeAck;
import com.example.hookhub.protocol.HandshakeReject;
import com.example.hookhub.protocol.RelayedRequest;
import com.example.hookhub.protocol.TunnelMessage;
import com.example.hookhub.protocol.TunnelMessageCodec;
import com.example.hookhub.protocol.TunnelProtocol;
import lombok.extern.slf4j.Slf4j;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.handshake.ServerHandshake;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Client half of the tunnel.
 * <p>
 * Connects, authenticates with the shared secret, then replays every relayed request against
 * the local server. Lifecycle: DISCONNECTED, CONNECTING, AUTHENTICATING, RELAYING, and back to
 * DISCONNECTED on any failure. Transport failures are retried after a fixed delay; a rejected
 * handshake is final.
 */
@Slf4j
public class TunnelAgent extends WebSocketClient {

    public enum State {
        DISCONNECTED,
        CONNECTING,
        AUTHENTICATING,
        RELAYING
    }

    private static final int PING_INTERVAL_SECONDS = 20;
    private static final int FORWARD_THREADS = 4;
    private static final int DEFAULT_FORWARD_QUEUE_CAPACITY = 256;

    private final String secret;
    private final URI localOrigin;
    private final LocalForwarder forwarder;
    private final HistoryStore history;
    private final Duration reconnectDelay;
    private final TunnelMessageCodec codec = new TunnelMessageCodec();

    private final ExecutorService forwardPool;
    private final ScheduledExecutorService reconnectScheduler =
            Executors.newSingleThreadScheduledExecutor(daemon("TunnelReconnect"));

    private final CountDownLatch terminated = new CountDownLatch(1);
    private final Object stateLock = new Object();
    private State state = State.DISCONNECTED;
    private volatile boolean stopped;
    private volatile String rejectionReason;

    /**
     * @param remote         tunnel endpoint, e.g. {@code wss://hooks.example.com/__hookhub__/}
     * @param secret         shared secret presented at handshake
     * @param localOrigin    scheme, host and port of the local server
     * @param forwarder      sends the replayed requests
     * @param history        records received requests; {@code null} disables history
     * @param reconnectDelay wait before reconnecting after a transport failure
     */
    public TunnelAgent(URI remote, String secret, URI localOrigin, LocalForwarder forwarder,
                       HistoryStore history, Duration reconnectDelay) {
        this(remote, secret, localOrigin, forwarder, history, reconnectDelay, DEFAULT_FORWARD_QUEUE_CAPACITY);
    }

    /**
     * @param forwardQueueCapacity requests allowed to wait for a forward thread; more are dropped
     */
    TunnelAgent(URI remote, String secret, URI localOrigin, LocalForwarder forwarder,
                HistoryStore history, Duration reconnectDelay, int forwardQueueCapacity) {
        super(remote);
        this.secret = secret;
        this.localOrigin = localOrigin;
        this.forwarder = forwarder;
        this.history = history;
        this.reconnectDelay = reconnectDelay;
        this.forwardPool = new ThreadPoolExecutor(FORWARD_THREADS, FORWARD_THREADS, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(forwardQueueCapacity), daemon("TunnelForward"));
        setConnectionLostTimeout(PING_INTERVAL_SECONDS);
    }

    public void start() {
        setState(State.CONNECTING);
        log.info("[Agent] Connecting to {}", getURI());
        connect();
    }

    /**
     * Closes the tunnel for good and waits briefly for in-flight forwards.
     */
    public void stop() {
        stopped = true;
        reconnectScheduler.shutdownNow();
        try {
            closeBlocking();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        forwardPool.shutdown();
        try {
            if (!forwardPool.awaitTermination(5, TimeUnit.SECONDS)) {
                forwardPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            forwardPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        setState(State.DISCONNECTED);
        terminated.countDown();
    }

    /**
     * Blocks until {@link #stop()} is called or the server refuses the handshake.
     */
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public State getTunnelState() {
        synchronized (stateLock) {
            return state;
        }
    }

    /**
     * Reason the server gave for refusing the handshake, or {@code null}.
     */
    public String getRejectionReason() {
        return rejectionReason;
    }

    /**
     * Blocks until the agent reaches {@code expected} or the timeout passes.
     */
    public boolean awaitState(State expected, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (stateLock) {
            while (state != expected) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(stateLock, remaining);
            }
            return true;
        }
    }

    @Override
    public void onOpen(ServerHandshake handshakedata) {
        setState(State.AUTHENTICATING);
        send(codec.encode(Handshake.builder()
                .secret(secret)
                .protocolVersion(TunnelProtocol.PROTOCOL_VERSION)
                .build()));
    }

    @Override
    public void onMessage(String message) {
        log.warn("[Agent] Ignoring unexpected text frame ({} chars)", message.length());
    }

    @Override
    public void onMessage(ByteBuffer bytes) {
        TunnelMessage message;
        try {
            message = codec.decode(bytes);
        } catch (DecodeException e) {
            log.warn("[Agent] Discarding malformed frame: {}", e.getMessage());
            return;
        }

        if (message instanceof HandshakeAck) {
            setState(State.RELAYING);
            log.info("[Agent] {}, waiting for events", ((HandshakeAck) message).getMessage());
        } else if (message instanceof HandshakeReject) {
            rejectionReason = ((HandshakeReject) message).getReason();
            log.error("[Agent] Server rejected the tunnel: {}", rejectionReason);
            close();
        } else if (message instanceof RelayedRequest) {
            if (getTunnelState() != State.RELAYING) {
                log.warn("[Agent] Request received before handshake completed, discarding");
                return;
            }
            relay((RelayedRequest) message);
        } else {
            log.debug("[Agent] Ignoring {}", message.getClass().getSimpleName());
        }
    }

    private void relay(RelayedRequest request) {
        log.info("[Agent] Received {} {}", request.getMethod(), request.getFullPath());
        if (history != null) {
            try {
                history.add(HistoryItem.of(request, Instant.now(), localOrigin));
            } catch (IOException e) {
                log.warn("[Agent] Could not record request in history: {}", e.getMessage());
            }
        }
        try {
            forwardPool.execute(() -> forwarder.forward(request, localOrigin));
        } catch (RejectedExecutionException e) {
            if (forwardPool.isShutdown()) {
                log.warn("[Agent] Shutting down, not forwarding {} {}", request.getMethod(), request.getFullPath());
            } else {
                log.warn("[Agent] Local server is falling behind, dropping {} {}",
                        request.getMethod(), request.getFullPath());
            }
        }
    }

    @Override
    public void onClose(int code, String reason, boolean remote) {
        setState(State.DISCONNECTED);
        log.info("[Agent] Disconnected (code {}){}", code, reason == null || reason.isEmpty() ? "" : ": " + reason);

        if (rejectionReason != null) {
            terminated.countDown();
            return;
        }
        if (stopped) {
            return;
        }

        // reconnect() must not run on the WebSocket thread
        log.info("[Agent] Trying again in {} seconds...", reconnectDelay.getSeconds());
        try {
            reconnectScheduler.schedule(this::reconnectQuietly, reconnectDelay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[Agent] Reconnect skipped, agent stopped");
        }
    }

    private void reconnectQuietly() {
        if (stopped) {
            return;
        }
        setState(State.CONNECTING);
        log.info("[Agent] Reconnecting to {}", getURI());
        reconnect();
    }

    @Override
    public void onError(Exception ex) {
        log.warn("[Agent] WebSocket error: {}", ex.getMessage());
    }

    private void setState(State next) {
        synchronized (stateLock) {
            state = next;
            stateLock.notifyAll();
        }
    }

    private static ThreadFactory daemon(String prefix) {
        return runnable -> {
            Thread thread = new Thread(runnable, prefix);
            thread.setDaemon(true);
            return thread;
        };
    }
}
