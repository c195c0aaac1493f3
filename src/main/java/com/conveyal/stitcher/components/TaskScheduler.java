package com.conveyal.stitcher.components;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * This provides application-wide executors for repeating tasks, short one-off tasks, and the few long-running loops
 * that occupy a thread for the whole life of the process (the dispatcher). Every submitted task is wrapped in an
 * ErrorTrap so that no Throwable can silently kill a thread or halt a periodic task.
 */
public class TaskScheduler implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(TaskScheduler.class);

    // The Javadoc on the ExecutorService interface implies that it's threadsafe by mentioning happens-before.
    // So we don't need to explicitly synchronize use of these executor services from multiple simultaneous requests.
    private final ScheduledExecutorService scheduledExecutor;
    private final ExecutorService lightExecutor;
    private final ExecutorService longRunningExecutor;

    // Keep the futures returned when periodic tasks are scheduled, giving access to status information and exceptions.
    private final List<ScheduledFuture<?>> periodicTaskFutures = new ArrayList<>();

    public interface Config {
        int lightThreads ();
    }

    /**
     * Interface for all actions that we want to repeat at regular intervals.
     * Single-method interfaces provide for some syntactic flexibility (lambdas and method references).
     */
    public interface PeriodicTask extends Runnable {
        int getPeriodSeconds();
    }

    public TaskScheduler (Config config) {
        scheduledExecutor = Executors.newScheduledThreadPool(1);
        lightExecutor = Executors.newFixedThreadPool(config.lightThreads());
        longRunningExecutor = Executors.newCachedThreadPool();
    }

    /**
     * Run the task immediately and then every getPeriodSeconds() seconds. A fixed delay is used rather than a fixed
     * rate so a slow run (e.g. a cloud API call that hangs until it times out) does not cause a burst of catch-up runs.
     */
    public synchronized void repeatRegularly (PeriodicTask periodicTask) {
        String className = periodicTask.getClass().getSimpleName();
        int periodSeconds = periodicTask.getPeriodSeconds();
        LOG.info("An instance of {} will run every {} seconds.", className, periodSeconds);
        ErrorTrap wrappedPeriodicTask = new ErrorTrap(periodicTask);
        periodicTaskFutures.add(
            scheduledExecutor.scheduleWithFixedDelay(wrappedPeriodicTask, 0, periodSeconds, TimeUnit.SECONDS)
        );
    }

    public void enqueueLightTask (Runnable runnable) {
        lightExecutor.submit(new ErrorTrap(runnable));
    }

    /**
     * Start a task that is expected to run until the process shuts down, on its own thread. The task should respond
     * to thread interruption by returning, which is how shutDown() stops it.
     */
    public void startLongRunningTask (Runnable runnable) {
        LOG.info("Starting long running task {}.", runnable.getClass().getSimpleName());
        longRunningExecutor.submit(new ErrorTrap(runnable));
    }

    /** Interrupt all running tasks and stop accepting new ones. */
    public synchronized void shutDown () {
        LOG.info("Shutting down task scheduler.");
        periodicTaskFutures.forEach(future -> future.cancel(true));
        periodicTaskFutures.clear();
        scheduledExecutor.shutdownNow();
        longRunningExecutor.shutdownNow();
        lightExecutor.shutdownNow();
    }

    /**
     * Wrap a runnable, catching any Errors or Exceptions that occur. This prevents them from propagating up to the
     * scheduled executor, which would swallow them and silently halt the periodic execution of the runnable.
     */
    private static class ErrorTrap implements Runnable {

        private final Runnable runnable;

        public ErrorTrap (Runnable runnable) {
            this.runnable = runnable;
        }

        @Override
        public final void run () {
            try {
                runnable.run();
            } catch (Throwable t) {
                LOG.error("Background execution of {} caused exception.", runnable.getClass(), t);
            }
        }
    }

}
