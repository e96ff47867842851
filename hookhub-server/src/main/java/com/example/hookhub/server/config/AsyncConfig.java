package com.example.hookhub.server.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class AsyncConfig {

    @Bean(name = "tunnelSendExecutor")
    public ThreadPoolTaskExecutor tunnelSendExecutor(
            @Value("${hookhub.tunnel.send-pool.core-size:10}") int coreSize,
            @Value("${hookhub.tunnel.send-pool.max-size:500}") int maxSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        // Core pool size: threads to keep alive
        executor.setCorePoolSize(coreSize);
        // Max pool size: one thread per member that is sending at the same time
        executor.setMaxPoolSize(maxSize);
        // No queue: a drain task never waits behind a member blocked in a write
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(30);
        executor.setThreadNamePrefix("TunnelSend-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "tunnelHandshakeScheduler")
    public ThreadPoolTaskScheduler tunnelHandshakeScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setThreadNamePrefix("TunnelHandshake-");
        scheduler.initialize();
        return scheduler;
    }
}
