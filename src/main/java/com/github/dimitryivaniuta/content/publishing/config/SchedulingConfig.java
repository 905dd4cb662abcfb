package com.github.dimitryivaniuta.content.publishing.config;

import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.PostTransitionEngine;
import com.github.dimitryivaniuta.content.publishing.domain.lifecycle.RetryPolicy;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans of the lifecycle core: clock, transition engine and the executor that bounds publish calls.
 */
@Configuration
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy(AppProperties properties) {
        return new RetryPolicy(properties.getLifecycle().getMaxRetries());
    }

    @Bean
    public PostTransitionEngine postTransitionEngine(RetryPolicy retryPolicy) {
        return new PostTransitionEngine(retryPolicy);
    }

    /**
     * Executor running external publish calls so the scheduler can stop waiting after the timeout.
     *
     * @param properties app properties
     * @return executor, shut down with the context
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService publishExecutor(AppProperties properties) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "post-publish-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getScheduler().getPublishThreads()), factory);
    }
}
