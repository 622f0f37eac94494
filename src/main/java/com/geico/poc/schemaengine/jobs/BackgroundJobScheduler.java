package com.geico.poc.schemaengine.jobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Scheduler for periodic maintenance jobs.
 *
 * Each enabled {@link BackgroundJob} bean runs at a fixed rate on a daemon
 * thread. A failing run is logged and the job stays scheduled.
 */
@Component
public class BackgroundJobScheduler {

    private static final Logger log = LoggerFactory.getLogger(BackgroundJobScheduler.class);

    @Autowired(required = false)
    private List<BackgroundJob> jobs;

    private ScheduledExecutorService scheduler;
    private int scheduledCount;

    public BackgroundJobScheduler() {
    }

    public BackgroundJobScheduler(List<BackgroundJob> jobs) {
        this.jobs = jobs;
    }

    @PostConstruct
    public void start() {
        if (jobs == null || jobs.isEmpty()) {
            log.info("📋 No background jobs configured");
            return;
        }

        List<BackgroundJob> enabled = jobs.stream().filter(BackgroundJob::isEnabled).toList();
        for (BackgroundJob job : jobs) {
            if (!job.isEnabled()) {
                log.info("📋 Background job disabled: {}", job.getName());
            }
        }
        if (enabled.isEmpty()) {
            log.info("📋 No background jobs enabled");
            return;
        }

        scheduler = Executors.newScheduledThreadPool(
            enabled.size(),
            r -> {
                Thread t = new Thread(r);
                t.setName("background-job-" + t.getId());
                t.setDaemon(true);
                return t;
            }
        );

        for (BackgroundJob job : enabled) {
            scheduleJob(job);
        }
        scheduledCount = enabled.size();
        log.info("✅ Background job scheduler started ({} jobs)", scheduledCount);
    }

    private void scheduleJob(BackgroundJob job) {
        log.info("📋 Scheduling background job: {} (period: {}s)", job.getName(), job.getPeriodMs() / 1000);

        scheduler.scheduleAtFixedRate(
            () -> runJob(job),
            job.getInitialDelayMs(),
            job.getPeriodMs(),
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Run one job once, containing any failure
     *
     * @return true when the run completed without error
     */
    public boolean runJob(BackgroundJob job) {
        try {
            long startTime = System.currentTimeMillis();
            log.info("🔄 Running background job: {}", job.getName());

            job.execute();

            long duration = System.currentTimeMillis() - startTime;
            log.info("✅ Background job completed: {} (duration: {}ms)", job.getName(), duration);
            return true;
        } catch (Exception e) {
            // Keep the schedule alive
            log.error("❌ Background job failed: {}", job.getName(), e);
            return false;
        }
    }

    public int getScheduledCount() {
        return scheduledCount;
    }

    @PreDestroy
    public void stop() {
        if (scheduler != null) {
            log.info("🛑 Stopping background job scheduler...");
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("✅ Background job scheduler stopped");
        }
    }
}
