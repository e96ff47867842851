package com.example.hookhub.server.websocket;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * 隧道连接注册表
 * 保存所有已完成握手的隧道客户端，并把每条 Webhook 广播给它们
 */
@Component
@Slf4j
public class TunnelHub {

    private final Executor sendExecutor;
    private final RetryTemplate sendRetryTemplate;
    private final int queueCapacity;

    // 键：会话 ID，值：成员句柄
    private final Map<String, ClientConnection> members = new ConcurrentHashMap<>();

    public TunnelHub(@Qualifier("tunnelSendExecutor") Executor sendExecutor,
                     @Qualifier("tunnelSendRetryTemplate") RetryTemplate sendRetryTemplate,
                     @Value("${hookhub.tunnel.queue-capacity:256}") int queueCapacity) {
        this.sendExecutor = sendExecutor;
        this.sendRetryTemplate = sendRetryTemplate;
        this.queueCapacity = queueCapacity;
    }

    /**
     * 注册新的隧道连接
     * 握手确认帧先入队，再对广播可见，保证客户端收到的第一帧一定是确认
     */
    public ClientConnection register(TunnelSession session, byte[] greeting) {
        ClientConnection connection = new ClientConnection(session, this, queueCapacity, sendExecutor,
                sendRetryTemplate);
        connection.enqueue(greeting);
        members.put(session.getId(), connection);
        log.info("[TunnelHub] Registered session {} from {}, Total active: {}",
                session.getId(), session.getRemoteAddress(), members.size());
        return connection;
    }

    /**
     * 移除指定连接，可重复调用
     * 只有当 Map 中的句柄就是要移除的那个时才移除
     */
    public void unregister(ClientConnection connection) {
        if (connection == null) {
            return;
        }
        connection.markClosed();
        boolean removed = members.remove(connection.getId(), connection);
        if (removed) {
            log.info("[TunnelHub] Removed session {}, Total active: {}", connection.getId(), members.size());
        }
    }

    /**
     * 把一帧交给所有成员的发送队列；只做交接，不等待任何客户端
     *
     * @param frame 已编码的帧
     * @return 成功交接的成员数
     */
    public int broadcast(byte[] frame) {
        int delivered = 0;
        for (ClientConnection connection : members.values()) {
            if (connection.enqueue(frame)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * 获取活跃连接数
     */
    public int getActiveConnectionCount() {
        return members.size();
    }

    public boolean isRegistered(String sessionId) {
        return members.containsKey(sessionId);
    }

    @PreDestroy
    public void shutdown() {
        List<ClientConnection> remaining = new ArrayList<>(members.values());
        if (!remaining.isEmpty()) {
            log.info("[TunnelHub] Closing {} tunnel(s) on shutdown", remaining.size());
        }
        for (ClientConnection connection : remaining) {
            unregister(connection);
            connection.getSession().close(CloseStatus.GOING_AWAY);
        }
    }
}
