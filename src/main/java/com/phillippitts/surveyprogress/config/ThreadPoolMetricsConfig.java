package com.phillippitts.surveyprogress.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import com.phillippitts.surveyprogress.service.progress.SurveyProgressController;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for progress executor metrics exposure via Micrometer.
 *
 * <p>Exposes:
 * <ul>
 *   <li>progress.pool.size - Current number of threads in the pool</li>
 *   <li>progress.pool.active - Number of workers currently draining a session</li>
 *   <li>progress.pool.queued - Number of drain tasks waiting for a thread</li>
 *   <li>progress.pool.completed - Cumulative count of completed drain tasks</li>
 *   <li>progress.session.pending - Commands accepted for the active session but not yet applied</li>
 * </ul>
 *
 * <p>Additionally logs a health summary every 5 minutes for operational visibility.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> progressExecutorProvider;
    private final ObjectProvider<SurveyProgressController> controllerProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("progressExecutor") ObjectProvider<ThreadPoolTaskExecutor> progressExecutorProvider,
            ObjectProvider<SurveyProgressController> controllerProvider) {
        this.progressExecutorProvider = progressExecutorProvider;
        this.controllerProvider = controllerProvider;
    }

    /**
     * Binds progress executor metrics to the Micrometer registry.
     *
     * @return MeterBinder that registers custom metrics
     */
    @Bean
    public MeterBinder progressExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = this.progressExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("progress.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the progress pool")
                    .register(registry);

            Gauge.builder("progress.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of session workers currently draining commands")
                    .register(registry);

            Gauge.builder("progress.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of drain tasks waiting for a thread")
                    .register(registry);

            Gauge.builder("progress.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed drain tasks")
                    .register(registry);

            // Resolved on read; the controller depends on the registry.
            Gauge.builder("progress.session.pending", this.controllerProvider, ThreadPoolMetricsConfig::pendingCommands)
                    .description("Commands accepted for the active session but not yet applied")
                    .register(registry);

            LOG.info("Progress metrics registered: progress.pool.* and progress.session.pending "
                    + "available via /actuator/metrics");
        };
    }

    /**
     * Logs thread pool health summary every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = this.progressExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Progress Thread Pool Health: size={}/{}, active={}, queued={}, completed={}, "
                        + "sessionPending={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount(),
                pendingCommands(this.controllerProvider)
        );
    }

    private static int pendingCommands(ObjectProvider<SurveyProgressController> controllerProvider) {
        SurveyProgressController controller = controllerProvider.getIfAvailable();
        return controller == null ? 0 : controller.pendingCommandCount();
    }
}
