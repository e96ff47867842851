package com.example.hookhub.server.config;

import com.example.hookhub.protocol.TunnelProtocol;
import com.example.hookhub.server.websocket.TunnelWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * WebSocket 配置
 * 配置隧道客户端连接的 WebSocket 端点
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final TunnelWebSocketHandler tunnelWebSocketHandler;

    @Value("${hookhub.tunnel.allowed-origins:*}")
    private String allowedOrigins;

    /**
     * 注册 WebSocket 处理器。
     *
     * @param registry 注册器
     */
    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String[] origins = allowedOrigins.split(",");
        registry.addHandler(tunnelWebSocketHandler, TunnelProtocol.TUNNEL_PATH)
                .setAllowedOrigins(origins);
    }

    /**
     * 客户端只会发送很小的握手帧，入站缓冲保持较小。
     *
     * @return 容器配置
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer(
            @Value("${hookhub.tunnel.max-inbound-frame-bytes:8192}") int maxInboundFrameBytes) {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxBinaryMessageBufferSize(maxInboundFrameBytes);
        container.setMaxTextMessageBufferSize(maxInboundFrameBytes);
        return container;
    }
}
