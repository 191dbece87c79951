package com.example.feedreader.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    /**
     * Bounded pool for blocking JDBC calls made from reactive pipelines.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler jdbcScheduler() {
        return Schedulers.newBoundedElastic(20, 10_000, "jdbc-io");
    }
}
