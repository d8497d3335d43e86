package uk.gegc.quizforge.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.aop.interceptor.SimpleAsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools used by the generation service.
 *
 * - fan-out pool runs chunked provider calls of a single generation
 * - job pool runs queued generation jobs, sized to the queue worker count
 * - general pool runs fire-and-forget work such as cache writes
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.fan-out.core-pool-size:5}")
    private int fanOutCorePoolSize;

    @Value("${async.fan-out.max-pool-size:16}")
    private int fanOutMaxPoolSize;

    @Value("${async.fan-out.queue-capacity:100}")
    private int fanOutQueueCapacity;

    @Value("${quizforge.jobs.max-concurrent:3}")
    private int jobWorkers;

    @Value("${async.general.core-pool-size:2}")
    private int generalCorePoolSize;

    @Value("${async.general.max-pool-size:4}")
    private int generalMaxPoolSize;

    @Value("${async.general.queue-capacity:100}")
    private int generalQueueCapacity;

    /**
     * Executor for the chunks of a parallel generation. Concurrency per request is
     * additionally bounded by the fan-out worker limit.
     */
    @Bean(name = "fanOutTaskExecutor")
    public ThreadPoolTaskExecutor fanOutTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(fanOutCorePoolSize);
        executor.setMaxPoolSize(Math.max(fanOutCorePoolSize, fanOutMaxPoolSize));
        executor.setQueueCapacity(fanOutQueueCapacity);
        executor.setThreadNamePrefix("fan-out-");
        // Caller runs the chunk itself if the pool is saturated
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Fan-out Task Executor configured - Core: {}, Max: {}, Queue: {}",
                fanOutCorePoolSize, fanOutMaxPoolSize, fanOutQueueCapacity);
        return executor;
    }

    /**
     * Executor for queued generation jobs. The queue itself bounds in-flight jobs,
     * so the pool never has to reject work.
     */
    @Bean(name = "jobTaskExecutor")
    public ThreadPoolTaskExecutor jobTaskExecutor() {
        int workers = Math.max(1, jobWorkers);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix("job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        log.info("Job Task Executor configured - Workers: {}", workers);
        return executor;
    }

    @Bean(name = "generalTaskExecutor")
    public ThreadPoolTaskExecutor generalTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(generalCorePoolSize);
        executor.setMaxPoolSize(generalMaxPoolSize);
        executor.setQueueCapacity(generalQueueCapacity);
        executor.setThreadNamePrefix("general-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("General Task Executor configured - Core: {}, Max: {}, Queue: {}",
                generalCorePoolSize, generalMaxPoolSize, generalQueueCapacity);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return generalTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new SimpleAsyncUncaughtExceptionHandler() {
            @Override
            public void handleUncaughtException(Throwable ex, java.lang.reflect.Method method, Object... params) {
                log.error("Uncaught exception in async method: {}.{}()",
                        method.getDeclaringClass().getSimpleName(),
                        method.getName(), ex);
                super.handleUncaughtException(ex, method, params);
            }
        };
    }
}
