package com.phantom.scheduler;

import com.phantom.config.CalendarSyncProperties;
import com.phantom.config.SchedulingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.phantom")
@EntityScan("com.phantom.domain")
@EnableJpaRepositories("com.phantom.repository")
@EnableConfigurationProperties({SchedulingProperties.class, CalendarSyncProperties.class})
public class PhantomSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhantomSchedulerApplication.class, args);
    }
}
