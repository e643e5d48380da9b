package com.community.portal.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 数据源异步拉取使用的线程池
 */
@Configuration
public class AsyncConfig {

    @Value("${portal.executor.core-pool-size:4}")
    private int corePoolSize;

    @Value("${portal.executor.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${portal.executor.queue-capacity:200}")
    private int queueCapacity;

    @Bean(name = "portalDataExecutor")
    public ThreadPoolTaskExecutor portalDataExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("portal-data-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
