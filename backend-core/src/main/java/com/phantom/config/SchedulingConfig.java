package com.phantom.config;

import com.phantom.service.CategoryPriorityTable;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class SchedulingConfig {

    @Bean
    public Clock schedulingClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CategoryPriorityTable categoryPriorityTable(SchedulingProperties properties) {
        return CategoryPriorityTable.of(properties.safeCategoryPriorities());
    }

    @Bean(name = "calendarSyncExecutor")
    public Executor calendarSyncExecutor(CalendarSyncProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = properties.safeSyncThreads();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.safeSyncQueueCapacity());
        executor.setThreadNamePrefix("calendar-sync-");
        executor.initialize();
        return executor;
    }
}
