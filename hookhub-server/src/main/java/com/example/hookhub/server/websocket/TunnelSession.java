package com.example.hookhub.server.websocket;

import com.example.hookhub.protocol.DecodeException;
import com.example.hookhub.protocol.Handshake;
import com.example.hookhub.protocol.HandshakeAck;
import com.example.hookhub.protocol.HandshakeReject;
import com.example.hookhub.protocol.TunnelMessage;
import com.example.hookhub.protocol.TunnelMessageCodec;
import com.example.hookhub.server.security.HandshakeVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 服务端单个隧道连接的状态机：CONNECTED -> AUTHENTICATED -> CLOSED。
 * <p>
 * 只有握手成功的会话才会进入 Hub；进入 CLOSED 后一定已从 Hub 移除，且不会再复用。
 */
@Slf4j
public class TunnelSession {

    public enum State {
        CONNECTED,
        AUTHENTICATED,
        CLOSED
    }

    private final WebSocketSession webSocketSession;
    private final TunnelHub hub;
    private final TunnelMessageCodec codec;
    private final HandshakeVerifier verifier;

    private final AtomicReference<State> state = new AtomicReference<>(State.CONNECTED);
    private volatile ClientConnection connection;
    private volatile ScheduledFuture<?> handshakeTimeout;

    public TunnelSession(WebSocketSession webSocketSession, TunnelHub hub, TunnelMessageCodec codec,
                         HandshakeVerifier verifier) {
        this.webSocketSession = webSocketSession;
        this.hub = hub;
        this.codec = codec;
        this.verifier = verifier;
    }

    public String getId() {
        return webSocketSession.getId();
    }

    public State getState() {
        return state.get();
    }

    public String getRemoteAddress() {
        InetSocketAddress address = webSocketSession.getRemoteAddress();
        return address != null ? address.toString() : "unknown";
    }

    /**
     * 在超时时间内未完成握手则关闭连接。
     */
    public void startHandshakeTimer(TaskScheduler scheduler, Duration timeout) {
        handshakeTimeout = scheduler.schedule(this::handshakeTimedOut, Instant.now().plus(timeout));
    }

    /**
     * 处理客户端发来的一帧。
     *
     * @param frame 原始二进制帧
     */
    public void onFrame(byte[] frame) {
        State current = state.get();
        if (current == State.AUTHENTICATED) {
            // 握手之后客户端不需要再发送业务数据
            log.debug("[TunnelWebSocket] Ignoring {} byte frame from authenticated session {}", frame.length, getId());
            return;
        }
        if (current == State.CLOSED) {
            return;
        }

        TunnelMessage message;
        try {
            message = codec.decode(frame);
        } catch (DecodeException e) {
            log.warn("[TunnelWebSocket] Undecodable handshake from {}: {}", getRemoteAddress(), e.getMessage());
            reject("Malformed handshake");
            return;
        }

        if (!(message instanceof Handshake)) {
            log.warn("[TunnelWebSocket] Expected HANDSHAKE from {} but got {}", getRemoteAddress(),
                    message.getClass().getSimpleName());
            reject("Expected handshake");
            return;
        }

        String rejection = verifier.verify((Handshake) message);
        if (rejection != null) {
            log.warn("[TunnelWebSocket] Connection rejected for {}: {}", getRemoteAddress(), rejection);
            reject(rejection);
            return;
        }

        authenticate();
    }

    private void authenticate() {
        if (!state.compareAndSet(State.CONNECTED, State.AUTHENTICATED)) {
            return;
        }
        cancelHandshakeTimer();

        byte[] ack = codec.encode(HandshakeAck.builder()
                .message("Tunnel connected successfully")
                .build());
        connection = hub.register(this, ack);

        // 注册期间连接可能已断开，此时 close() 看不到 connection，需要在这里补偿移除
        if (state.get() == State.CLOSED) {
            hub.unregister(connection);
        }
        log.info("[TunnelWebSocket] Session {} authenticated from {}", getId(), getRemoteAddress());
    }

    private void reject(String reason) {
        if (!state.compareAndSet(State.CONNECTED, State.CLOSED)) {
            return;
        }
        cancelHandshakeTimer();

        try {
            byte[] frame = codec.encode(HandshakeReject.builder().reason(reason).build());
            webSocketSession.sendMessage(new BinaryMessage(frame));
        } catch (IOException | RuntimeException e) {
            log.debug("[TunnelWebSocket] Could not send rejection to {}: {}", getRemoteAddress(), e.getMessage());
        }
        closeTransport(CloseStatus.POLICY_VIOLATION.withReason(reason));
    }

    void handshakeTimedOut() {
        if (state.get() != State.CONNECTED) {
            return;
        }
        log.warn("[TunnelWebSocket] Handshake timed out for {}", getRemoteAddress());
        reject("Handshake timeout");
    }

    /**
     * 写入一帧，只由该会话的发送任务调用。
     */
    void send(byte[] frame) throws IOException {
        webSocketSession.sendMessage(new BinaryMessage(frame));
    }

    /**
     * 关闭会话并从 Hub 移除，可重复调用。
     *
     * @param status 关闭状态
     */
    public void close(CloseStatus status) {
        State previous = state.getAndSet(State.CLOSED);
        cancelHandshakeTimer();
        hub.unregister(connection);
        if (previous != State.CLOSED) {
            log.info("[TunnelWebSocket] Closing session {} ({}), status: {}", getId(), previous, status);
            closeTransport(status);
        }
    }

    /**
     * 传输层已关闭或出错。
     */
    public void onTransportClosed(CloseStatus status) {
        State previous = state.getAndSet(State.CLOSED);
        cancelHandshakeTimer();
        hub.unregister(connection);
        if (previous != State.CLOSED) {
            log.info("[TunnelWebSocket] Session {} finished ({}), status: {}", getId(), previous, status);
        }
    }

    private void closeTransport(CloseStatus status) {
        try {
            if (webSocketSession.isOpen()) {
                webSocketSession.close(status);
            }
        } catch (IOException e) {
            log.debug("[TunnelWebSocket] Error closing session {}: {}", getId(), e.getMessage());
        }
    }

    private void cancelHandshakeTimer() {
        ScheduledFuture<?> timer = handshakeTimeout;
        if (timer != null) {
            timer.cancel(false);
        }
    }
}
