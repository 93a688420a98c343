package com.alibou.deliverychat.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Общий пул, который разгребает исходящие очереди WebSocket-соединений. */
@Configuration
public class OutboundExecutorConfig {

    @Bean(name = "chatOutboundExecutor")
    public ThreadPoolTaskExecutor chatOutboundExecutor(ChatProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getOutboundThreads());
        executor.setMaxPoolSize(properties.getOutboundThreads());
        executor.setThreadNamePrefix("chat-out-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
