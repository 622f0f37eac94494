package com.geico.poc.schemaengine.jobs;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BackgroundJobScheduler.
 *
 * Tests:
 * - Enabled jobs run periodically
 * - Disabled jobs are never scheduled
 * - A failing job stays scheduled
 */
public class BackgroundJobSchedulerTest {

    private BackgroundJobScheduler scheduler;

    @AfterEach
    public void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    // ========================================
    // Test Jobs
    // ========================================

    /**
     * Test job that counts executions
     */
    static class TestCountingJob implements BackgroundJob {
        private final AtomicInteger executionCount = new AtomicInteger(0);
        private final CountDownLatch latch;
        private final boolean enabled;

        TestCountingJob(int targetExecutions, boolean enabled) {
            this.latch = new CountDownLatch(targetExecutions);
            this.enabled = enabled;
        }

        @Override
        public void execute() {
            executionCount.incrementAndGet();
            latch.countDown();
        }

        @Override
        public String getName() {
            return "TestCountingJob";
        }

        @Override
        public long getInitialDelayMs() {
            return 50;
        }

        @Override
        public long getPeriodMs() {
            return 100;
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }

        int getExecutionCount() {
            return executionCount.get();
        }

        boolean awaitExecutions(long timeoutMs) throws InterruptedException {
            return latch.await(timeoutMs, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Test job that always throws
     */
    static class TestFailingJob extends TestCountingJob {

        TestFailingJob(int targetExecutions) {
            super(targetExecutions, true);
        }

        @Override
        public void execute() {
            super.execute();
            throw new RuntimeException("Test exception from TestFailingJob");
        }

        @Override
        public String getName() {
            return "TestFailingJob";
        }
    }

    // ========================================
    // Scheduling
    // ========================================

    @Test
    public void testEnabledJobRunsRepeatedly() throws Exception {
        TestCountingJob job = new TestCountingJob(3, true);
        scheduler = new BackgroundJobScheduler(List.of(job));
        scheduler.start();

        assertEquals(1, scheduler.getScheduledCount());
        assertTrue(job.awaitExecutions(5000), "Job should run at least 3 times");
    }

    @Test
    public void testDisabledJobIsNotScheduled() throws Exception {
        TestCountingJob job = new TestCountingJob(1, false);
        scheduler = new BackgroundJobScheduler(List.of(job));
        scheduler.start();

        assertEquals(0, scheduler.getScheduledCount());
        assertFalse(job.awaitExecutions(300));
        assertEquals(0, job.getExecutionCount());
    }

    @Test
    public void testNoJobs() {
        scheduler = new BackgroundJobScheduler(List.of());
        assertDoesNotThrow(() -> scheduler.start());
        assertEquals(0, scheduler.getScheduledCount());
    }

    // ========================================
    // Error Handling
    // ========================================

    @Test
    public void testFailingJobStaysScheduled() throws Exception {
        TestFailingJob job = new TestFailingJob(3);
        scheduler = new BackgroundJobScheduler(List.of(job));
        scheduler.start();

        assertTrue(job.awaitExecutions(5000), "Failing job should keep running");
    }

    @Test
    public void testRunJobReportsOutcome() {
        scheduler = new BackgroundJobScheduler(List.of());
        assertTrue(scheduler.runJob(new TestCountingJob(1, true)));
        assertFalse(scheduler.runJob(new TestFailingJob(1)));
    }
}
