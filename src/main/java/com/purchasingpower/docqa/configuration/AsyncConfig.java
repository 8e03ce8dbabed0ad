package com.purchasingpower.docqa.configuration;

import com.purchasingpower.docqa.config.GlobalRetryConfig;
import com.purchasingpower.docqa.service.ConversationSequencer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Thread pool for question answering and document ingestion.
 *
 * Requests are handed to this pool so that slow provider calls of one
 * conversation never hold a servlet thread needed by another. The async request
 * timeout covers one run's provider retry budget plus its commit wait.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AsyncConfig implements WebMvcConfigurer {

    private final AppProperties appProperties;
    private final GlobalRetryConfig retryConfig;
    private final ConversationSequencer sequencer;

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        long timeoutMs = requestTimeoutMs();
        configurer.setDefaultTimeout(timeoutMs);
        log.info("✅ Chat request timeout: {} ms (commit wait {} ms)", timeoutMs, sequencer.commitWaitMs());
    }

    long requestTimeoutMs() {
        long needed = retryConfig.runBudgetMs() + sequencer.commitWaitMs();
        return Math.max(appProperties.getConcurrency().getRequestTimeoutMs(), needed);
    }

    @Bean(name = "qaExecutor")
    public ThreadPoolTaskExecutor qaExecutor() {
        ConcurrencyProperties concurrency = appProperties.getConcurrency();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(concurrency.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(concurrency.getCorePoolSize(), concurrency.getMaxPoolSize()));
        executor.setQueueCapacity(concurrency.getQueueCapacity());
        executor.setThreadNamePrefix("qa-async-");

        // In-flight runs finish their commit on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("✅ QA executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                concurrency.getQueueCapacity());

        return executor;
    }
}
