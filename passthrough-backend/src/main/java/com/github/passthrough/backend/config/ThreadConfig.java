package com.github.passthrough.backend.config;

import com.github.passthrough.backend.config.properties.PassthroughProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ThreadConfig {
    /**
     * The number of stream requests which can resolve at full concurrency at the same time.
     */
    private static final int CONCURRENT_REQUESTS = 4;
    private static final int THREAD_KEEP_ALIVE_SECONDS = 20;

    @Bean
    public ThreadPoolTaskExecutor resolverExecutor(PassthroughProperties properties) {
        var maxConcurrency = properties.getResolution().getMaxConcurrency();
        var poolSize = maxConcurrency * CONCURRENT_REQUESTS;
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setKeepAliveSeconds(THREAD_KEEP_ALIVE_SECONDS);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setThreadNamePrefix("PT-resolver");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
