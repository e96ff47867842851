package com.example.hookhub.server.websocket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一个已认证隧道在 Hub 中的成员句柄。
 * <p>
 * 每个成员有独立的有界 FIFO 发送队列，同一时刻最多一个发送任务在共享线程池里排空它，
 * 所以某个客户端写阻塞只会拖慢它自己。队列溢出或重试耗尽时关闭该会话。
 */
@Slf4j
public class ClientConnection {

    private final TunnelSession session;
    private final TunnelHub hub;
    private final BlockingQueue<byte[]> outbound;
    private final Executor sendExecutor;
    private final RetryTemplate retryTemplate;

    private final AtomicBoolean draining = new AtomicBoolean(false);
    private volatile boolean open = true;

    ClientConnection(TunnelSession session, TunnelHub hub, int queueCapacity,
                     Executor sendExecutor, RetryTemplate retryTemplate) {
        this.session = session;
        this.hub = hub;
        this.outbound = new ArrayBlockingQueue<>(queueCapacity);
        this.sendExecutor = sendExecutor;
        this.retryTemplate = retryTemplate;
    }

    public String getId() {
        return session.getId();
    }

    public TunnelSession getSession() {
        return session;
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * 将帧放入发送队列，不阻塞调用方。
     *
     * @param frame 已编码的帧
     * @return 是否已交付到队列
     */
    public boolean enqueue(byte[] frame) {
        if (!open) {
            return false;
        }
        if (!outbound.offer(frame)) {
            log.warn("[TunnelHub] Outbound queue full for session {}, dropping client", getId());
            fail(CloseStatus.SESSION_NOT_RELIABLE.withReason("Client is not keeping up"));
            return false;
        }
        scheduleDrain();
        return true;
    }

    /**
     * 标记为已关闭并丢弃未发送的帧；由 {@link TunnelHub#unregister} 调用。
     */
    void markClosed() {
        open = false;
        outbound.clear();
    }

    int pendingFrames() {
        return outbound.size();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            sendExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.error("[TunnelHub] Send executor rejected session {}", getId(), e);
            fail(CloseStatus.SERVER_ERROR.withReason("Server overloaded"));
        }
    }

    private void drain() {
        try {
            byte[] frame;
            while (open && (frame = outbound.poll()) != null) {
                if (!write(frame)) {
                    return;
                }
            }
        } finally {
            draining.set(false);
        }

        // 排空结束到释放标记之间可能有新帧入队
        if (open && !outbound.isEmpty()) {
            scheduleDrain();
        }
    }

    private boolean write(byte[] frame) {
        try {
            retryTemplate.<Void, IOException>execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.debug("[TunnelHub] Retrying send to session {} (attempt {})",
                            getId(), context.getRetryCount() + 1);
                }
                session.send(frame);
                return null;
            });
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("[TunnelHub] Failed to deliver frame to session {}: {}", getId(), e.getMessage());
            fail(CloseStatus.SESSION_NOT_RELIABLE.withReason("Delivery failed"));
            return false;
        }
    }

    /**
     * 立即移出 Hub，传输层的关闭放到发送线程池执行，避免阻塞广播线程。
     */
    private void fail(CloseStatus status) {
        hub.unregister(this);
        try {
            sendExecutor.execute(() -> session.close(status));
        } catch (RejectedExecutionException e) {
            session.close(status);
        }
    }
}
