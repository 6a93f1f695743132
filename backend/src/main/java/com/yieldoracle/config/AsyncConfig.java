package com.yieldoracle.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Worker pool for the per-protocol fan-out of a yield cycle.
 */
@Configuration
public class AsyncConfig {

    public static final String COLLECTOR_EXECUTOR = "collector-executor";

    @Bean(name = COLLECTOR_EXECUTOR)
    public Executor collectorExecutor(AppProps props) {
        int threads = props.getPolling().getCollectorThreads();
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(threads);
        e.setMaxPoolSize(threads);
        e.setThreadNamePrefix("collector-");
        e.initialize();
        return e;
    }
}
