package com.etphysics.omnimeasure.config;

import com.etphysics.omnimeasure.alerts.GlobalUncaughtHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

@Slf4j
@Configuration
@EnableScheduling
public class SchedulingConfig implements SchedulingConfigurer {
    private final GlobalUncaughtHandler handler;

    public SchedulingConfig(GlobalUncaughtHandler handler) {
        this.handler = handler;
    }

    // sensor feed, stale watchdog and status summary
    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService scheduler() {
        ScheduledThreadPoolExecutor ex = new ScheduledThreadPoolExecutor(4, r -> {
            Thread t = new Thread(r);
            t.setName("om-sched-" + t.getId());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(handler);
            return t;
        });
        ex.setRemoveOnCancelPolicy(true); // the feed cancels and reschedules on every rate change
        ex.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        ex.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return ex;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.setScheduler(scheduler());
    }
}
