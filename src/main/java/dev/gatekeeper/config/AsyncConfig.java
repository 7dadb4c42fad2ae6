package dev.gatekeeper.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Async execution configuration.
 *
 * <p>Two pools: {@code reviewExecutor} runs whole review tasks triggered by webhooks,
 * {@code analyzerExecutorService} runs the per-file analysis units of one review.
 * Both propagate MDC so the review id stays on every log line of a run.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "reviewExecutor")
    public TaskExecutor reviewExecutor(ReviewProperties reviewProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setTaskDecorator(new MdcPropagatingTaskDecorator());
        executor.setCorePoolSize(reviewProperties.reviewThreads());
        executor.setMaxPoolSize(reviewProperties.reviewThreads());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("review-");
        executor.initialize();
        return executor;
    }

    /**
     * ExecutorService for CompletableFuture.supplyAsync fan-out in the review pipeline.
     */
    @Bean(name = "analyzerExecutorService", destroyMethod = "shutdown")
    public ExecutorService analyzerExecutorService(ReviewProperties reviewProperties) {
        ExecutorService base = Executors.newFixedThreadPool(reviewProperties.analyzerThreads(),
                new CustomizableThreadFactory("analyzer-"));
        return new DelegatingExecutorService(base, new MdcPropagatingTaskDecorator());
    }

    /**
     * Propagates MDC context (reviewId, pullRequest) from the calling thread
     * to the worker thread.
     */
    static class MdcPropagatingTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }

    /**
     * Wraps an ExecutorService to apply MDC propagation to all submitted tasks.
     */
    static class DelegatingExecutorService extends AbstractExecutorService {
        private final ExecutorService delegate;
        private final MdcPropagatingTaskDecorator decorator;

        DelegatingExecutorService(ExecutorService delegate, MdcPropagatingTaskDecorator decorator) {
            this.delegate = delegate;
            this.decorator = decorator;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(decorator.decorate(command));
        }

        @Override public void shutdown() { delegate.shutdown(); }
        @Override public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override public boolean isShutdown() { return delegate.isShutdown(); }
        @Override public boolean isTerminated() { return delegate.isTerminated(); }
        @Override public boolean awaitTermination(long timeout, TimeUnit unit)
                throws InterruptedException { return delegate.awaitTermination(timeout, unit); }
    }
}
