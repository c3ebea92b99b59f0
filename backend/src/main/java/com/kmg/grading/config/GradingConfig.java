package com.kmg.grading.config;

import com.kmg.grading.service.Sleeper;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class GradingConfig {

    /**
     * The only thread that dispatches evaluations; batch runs and retries queue up behind each other here.
     */
    @Bean(name = "gradingWorker", destroyMethod = "shutdownNow")
    public ExecutorService gradingWorker() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "grading-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public Sleeper sleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestClientCustomizer gradingServiceTimeouts(GradingProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getService().getConnectTimeout());
        requestFactory.setReadTimeout(properties.getService().getReadTimeout());
        return builder -> builder.requestFactory(requestFactory);
    }
}
