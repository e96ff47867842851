package com.example.hookhub.server.config;

import com.example.hookhub.protocol.TunnelMessageCodec;
import com.example.hookhub.server.websocket.TunnelHub;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import java.io.IOException;

/**
 * 隧道相关 Bean：编解码器、发送重试策略和连接数指标。
 */
@Configuration
public class TunnelConfig {

    @Bean
    public TunnelMessageCodec tunnelMessageCodec() {
        return new TunnelMessageCodec();
    }

    /**
     * 单帧写失败的有界重试，耗尽后由调用方关闭会话。
     *
     * @param maxAttempts 最大尝试次数
     * @param backoffMs   固定退避毫秒数
     * @return 重试模板
     */
    @Bean(name = "tunnelSendRetryTemplate")
    public RetryTemplate tunnelSendRetryTemplate(
            @Value("${hookhub.tunnel.send-attempts:3}") int maxAttempts,
            @Value("${hookhub.tunnel.send-backoff-ms:100}") long backoffMs) {
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .fixedBackoff(backoffMs)
                .retryOn(IOException.class)
                .build();
    }

    @Bean
    public MeterBinder tunnelMetrics(TunnelHub hub) {
        return registry -> Gauge.builder("hookhub.tunnels.active", hub, TunnelHub::getActiveConnectionCount)
                .description("Authenticated tunnel clients currently registered")
                .register(registry);
    }
}
