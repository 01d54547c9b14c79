package io.github.rfplot.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pools: one for file reads, one for CPU-bound analysis. Both are shut down with the
 * application context.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService spectrogramIoExecutor(final RfPlotProperties properties) {
        final var threads = properties.executors().spectrogramIo();
        log.info("Spectrogram I/O pool: {} threads", threads);
        return Executors.newFixedThreadPool(threads, named("spectrogram-io"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService analysisExecutor(final RfPlotProperties properties) {
        final var threads = properties.executors().analysis();
        log.info("Analysis pool: {} threads", threads);
        return Executors.newFixedThreadPool(threads, named("analysis"));
    }

    private static ThreadFactory named(final String prefix) {
        final var counter = new AtomicInteger();
        return runnable -> {
            final var thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
