package com.keystone.core.engine;

import com.keystone.core.resilience.RetryExecutor;
import com.keystone.core.resilience.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans: the clock, the sleeper, the retry executor and
 * the worker pools for pipeline runs, quality checkers and deployment steps.
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public RetryExecutor retryExecutor(Sleeper sleeper) {
        return new RetryExecutor(sleeper, () -> ThreadLocalRandom.current().nextDouble(-1.0, 1.0));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pipelineExecutor() {
        return Executors.newFixedThreadPool(8, named("pipeline"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService checkerExecutor() {
        return Executors.newFixedThreadPool(8, named("quality-checker"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService deployExecutor() {
        return Executors.newCachedThreadPool(named("deploy"));
    }

    static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
