package com.purchasingpower.tendermatch.configuration;

import com.purchasingpower.tendermatch.config.RankingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool used to score candidate contracts in parallel.
 *
 * Scoring calls share no mutable state, so the pool only bounds CPU use.
 */
@Slf4j
@Configuration
public class ScoringExecutorConfig {

    @Bean(name = "scoringExecutor")
    public Executor scoringExecutor(RankingConfig rankingConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(rankingConfig.getCorePoolSize());
        executor.setMaxPoolSize(rankingConfig.getMaxPoolSize());
        executor.setQueueCapacity(rankingConfig.getQueueCapacity());
        executor.setThreadNamePrefix("match-scoring-");

        // Full queue: run on the caller thread instead of rejecting
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("Scoring executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                rankingConfig.getQueueCapacity());

        return executor;
    }
}
