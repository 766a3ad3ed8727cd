package com.stableledger.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * One thread per keeper job (observation poke, unit-of-account refresh). A poke in flight at
 * shutdown is allowed to finish its Mongo write.
 */
@Configuration
@EnableScheduling
@Slf4j
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";
    static final int KEEPER_JOBS = 2;

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(KEEPER_JOBS);
        s.setThreadNamePrefix("keeper-");
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.setAwaitTerminationSeconds(30);
        s.setErrorHandler(t -> log.error("Keeper job failed: {}", t.getMessage(), t));
        return s;
    }
}
