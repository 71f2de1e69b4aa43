package com.tutornexus.availability.common.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Clock, conflict-check executor and scheduling.
 * All "today" / "now" decisions use the business time zone, not the host default.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties({
        ConflictCheckProperties.class,
        SlotSyncProperties.class,
        RolloverProperties.class
})
public class SchedulingConfig {

    @Value("${scheduling.zone:Asia/Jerusalem}")
    private String zone;

    @Bean
    public Clock schedulingClock() {
        return Clock.system(ZoneId.of(zone));
    }

    @Bean(name = "conflictCheckExecutor")
    public ThreadPoolTaskExecutor conflictCheckExecutor(ConflictCheckProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getPoolSize());
        executor.setMaxPoolSize(properties.getPoolSize());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("conflict-check-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
