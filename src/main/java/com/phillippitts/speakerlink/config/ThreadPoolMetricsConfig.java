package com.phillippitts.speakerlink.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the classification pool through Micrometer.
 *
 * <ul>
 *   <li>classify.pool.size - Current number of threads in the pool</li>
 *   <li>classify.pool.active - Number of actively executing tasks</li>
 *   <li>classify.pool.queued - Number of tasks waiting in the queue</li>
 *   <li>classify.pool.completed - Cumulative count of completed tasks</li>
 *   <li>classify.pool.max.size - Configured maximum pool size</li>
 * </ul>
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> classifyExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("classifyExecutor") ObjectProvider<ThreadPoolTaskExecutor> classifyExecutorProvider) {
        this.classifyExecutorProvider = classifyExecutorProvider;
    }

    @Bean
    public MeterBinder classifyExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = classifyExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("classify.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the classification pool")
                    .register(registry);

            Gauge.builder("classify.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively classifying records")
                    .register(registry);

            Gauge.builder("classify.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of classification tasks waiting in the queue")
                    .register(registry);

            Gauge.builder("classify.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed classification tasks")
                    .register(registry);

            Gauge.builder("classify.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Configured maximum pool size for the classification executor")
                    .register(registry);

            LOG.info("Classification pool metrics registered: classify.pool.*");
        };
    }
}
