package com.example.hookhub.server.websocket;

import com.example.hookhub.protocol.TunnelMessageCodec;
import com.example.hookhub.server.security.HandshakeVerifier;
import jakarta.websocket.Session;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.adapter.NativeWebSocketSession;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.BinaryWebSocketHandler;

import java.nio.ByteBuffer;
import java.time.Duration;

/**
 * 隧道 WebSocket 处理器
 * 每个连接对应一个 {@link TunnelSession}，鉴权、注册和清理都由它完成
 */
@Component
@Slf4j
public class TunnelWebSocketHandler extends BinaryWebSocketHandler {

    static final String SESSION_ATTRIBUTE = TunnelSession.class.getName();

    // Tomcat 对阻塞发送的超时（默认 20 秒），按会话设置
    static final String BLOCKING_SEND_TIMEOUT = "org.apache.tomcat.websocket.BLOCKING_SEND_TIMEOUT";

    private final TunnelHub hub;
    private final TunnelMessageCodec codec;
    private final HandshakeVerifier verifier;
    private final TaskScheduler handshakeScheduler;
    private final Duration handshakeTimeout;
    private final Duration sendTimeout;

    public TunnelWebSocketHandler(TunnelHub hub,
                                  TunnelMessageCodec codec,
                                  HandshakeVerifier verifier,
                                  @Qualifier("tunnelHandshakeScheduler") TaskScheduler handshakeScheduler,
                                  @Value("${hookhub.tunnel.handshake-timeout:10s}") Duration handshakeTimeout,
                                  @Value("${hookhub.tunnel.send-timeout:5s}") Duration sendTimeout) {
        this.hub = hub;
        this.codec = codec;
        this.verifier = verifier;
        this.handshakeScheduler = handshakeScheduler;
        this.handshakeTimeout = handshakeTimeout;
        this.sendTimeout = sendTimeout;
    }

    /**
     * 建立连接后等待客户端握手，超时未握手则关闭。
     *
     * @param session 会话
     */
    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        limitSendTime(session);
        TunnelSession tunnelSession = new TunnelSession(session, hub, codec, verifier);
        session.getAttributes().put(SESSION_ATTRIBUTE, tunnelSession);
        tunnelSession.startHandshakeTimer(handshakeScheduler, handshakeTimeout);
        log.info("[TunnelWebSocket] Session {} started from {}", session.getId(), tunnelSession.getRemoteAddress());
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        TunnelSession tunnelSession = tunnelSession(session);
        if (tunnelSession == null) {
            return;
        }
        ByteBuffer payload = message.getPayload().duplicate();
        byte[] frame = new byte[payload.remaining()];
        payload.get(frame);
        tunnelSession.onFrame(frame);
    }

    /**
     * 处理传输异常并清理会话。
     *
     * @param session   会话
     * @param exception 异常
     */
    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[TunnelWebSocket] Transport error for session {}: {}", session.getId(), exception.getMessage());
        TunnelSession tunnelSession = tunnelSession(session);
        if (tunnelSession != null) {
            tunnelSession.close(CloseStatus.SERVER_ERROR);
        }
    }

    /**
     * 连接关闭后从 Hub 移除。
     *
     * @param session 会话
     * @param status  关闭状态
     */
    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        TunnelSession tunnelSession = tunnelSession(session);
        if (tunnelSession != null) {
            tunnelSession.onTransportClosed(status);
        }
    }

    /**
     * 限制单次阻塞写的时长，卡住的客户端最多占用一个发送线程这么久（每次重试各算一次）。
     */
    private void limitSendTime(WebSocketSession session) {
        if (!(session instanceof NativeWebSocketSession)) {
            return;
        }
        Session nativeSession = ((NativeWebSocketSession) session).getNativeSession(Session.class);
        if (nativeSession != null) {
            nativeSession.getUserProperties().put(BLOCKING_SEND_TIMEOUT, sendTimeout.toMillis());
        }
    }

    private TunnelSession tunnelSession(WebSocketSession session) {
        return (TunnelSession) session.getAttributes().get(SESSION_ATTRIBUTE);
    }
}
