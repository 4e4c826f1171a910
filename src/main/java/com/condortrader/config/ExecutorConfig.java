package com.condortrader.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for blocking broker calls (place, cancel, order-book polls).
 *
 * <p>The decision thread is not a bean: each trading session owns its single-thread
 * executor so it can drain it in order during shutdown. This pool keeps accepting work after
 * the context starts closing, since the shutdown sequence may still cancel or poll orders.
 */
@Configuration
public class ExecutorConfig {

    @Bean("brokerIoExecutor")
    public ThreadPoolTaskExecutor brokerIoExecutor(TradingProperties tradingProperties) {
        int threads = tradingProperties.getExecution().getIoThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("broker-io-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setAcceptTasksAfterContextClose(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
