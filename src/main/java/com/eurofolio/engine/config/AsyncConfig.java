package com.eurofolio.engine.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 배치 백테스트용 비동기 실행 설정
 */
@Slf4j
@Configuration
@EnableAsync
public class AsyncConfig {

    /**
     * 배치 백테스트 전용 ThreadPool
     * 엔진은 상태가 없으므로 스레드 수는 DB 커넥션 여유에 맞춰 제한한다.
     */
    @Bean(name = "backtestExecutor")
    public Executor backtestExecutor(@Value("${backtest.async.core-pool-size:2}") int corePoolSize,
                                     @Value("${backtest.async.max-pool-size:4}") int maxPoolSize,
                                     @Value("${backtest.async.queue-capacity:10}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("BacktestBatch-");

        // 큐가 가득 차면 호출한 스레드에서 실행
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        log.info("backtestExecutor 초기화: core={}, max={}, queue={}", corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }
}
