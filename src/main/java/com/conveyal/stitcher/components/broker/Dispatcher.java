package com.conveyal.stitcher.components.broker;

import com.conveyal.stitcher.catalog.CatalogException;
import com.conveyal.stitcher.catalog.WorkCatalog;
import com.conveyal.stitcher.components.eventbus.ErrorEvent;
import com.conveyal.stitcher.components.eventbus.EventBus;
import com.conveyal.stitcher.models.StitchJob;
import com.conveyal.stitcher.models.StitchRequest;
import com.conveyal.stitcher.models.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Sends every unstitched catalog item to a worker, one at a time, waiting for an idle worker before each one. Jobs on
 * the reschedule queue go ahead of the next backlog item. After the backlog read at startup has been dispatched, keeps
 * dispatching jobs from the reschedule queue until the thread is interrupted.
 * <p>
 * The catalog is read only once. Items that are in flight are still unstitched in the catalog, so reading it again
 * would send them out a second time. Lost jobs come back through the reschedule queue instead.
 */
public class Dispatcher implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    /** How long to wait on the reschedule queue before checking for interruption again. */
    private static final int RESCHEDULE_POLL_SECONDS = 5;

    public interface Config {
        int dispatchRetryBaseMillis ();
        int dispatchRetryMaxMillis ();
    }

    private final WorkCatalog workCatalog;
    private final Broker broker;
    private final WorkerClient workerClient;
    private final EventBus eventBus;
    private final RetryPolicy retryPolicy;

    public Dispatcher (
            Config config, WorkCatalog workCatalog, Broker broker, WorkerClient workerClient, EventBus eventBus
    ) {
        this(workCatalog, broker, workerClient, eventBus, RetryPolicy.exponential(
                Duration.ofMillis(config.dispatchRetryBaseMillis()),
                Duration.ofMillis(config.dispatchRetryMaxMillis())
        ));
    }

    public Dispatcher (
            WorkCatalog workCatalog, Broker broker, WorkerClient workerClient, EventBus eventBus,
            RetryPolicy retryPolicy
    ) {
        this.workCatalog = workCatalog;
        this.broker = broker;
        this.workerClient = workerClient;
        this.eventBus = eventBus;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public void run () {
        LOG.info("Dispatcher starting with {}.", retryPolicy);
        try {
            dispatchBacklog();
            serveRescheduleQueue();
        } catch (InterruptedException e) {
            LOG.info("Dispatcher was interrupted, stopping.");
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            eventBus.send(new ErrorEvent(e));
            throw e;
        }
    }

    /**
     * Dispatch each item that was unstitched when the catalog was read, blocking while all workers are busy. Before
     * each item, any jobs waiting on the reschedule queue are dispatched first.
     */
    public void dispatchBacklog () throws InterruptedException {
        List<WorkItem> backlog = readBacklogWithRetry();
        RescheduleQueue rescheduleQueue = broker.getRescheduleQueue();
        int nDispatched = 0;
        for (WorkItem item : backlog) {
            if (Thread.interrupted()) {
                throw new InterruptedException();
            }
            for (StitchJob lost = rescheduleQueue.poll(); lost != null; lost = rescheduleQueue.poll()) {
                LOG.info("Redispatching lost job {} ahead of the backlog.", lost);
                dispatchWithRetry(lost);
            }
            dispatchWithRetry(item.toJob());
            nDispatched += 1;
            if (nDispatched % 1000 == 0) {
                LOG.info("Dispatched {} of {} backlog items.", nDispatched, backlog.size());
            }
        }
        LOG.info("Finished dispatching all {} backlog items.", backlog.size());
    }

    /**
     * Read the backlog, waiting and trying again according to the retry policy if the catalog can't be read.
     * @throws CatalogException if the retry policy gives up.
     */
    private List<WorkItem> readBacklogWithRetry () throws InterruptedException {
        for (long attempt = 1; ; attempt++) {
            try {
                return workCatalog.readBacklog();
            } catch (CatalogException e) {
                eventBus.send(new ErrorEvent(e));
                if (!retryPolicy.allowsRetry(attempt)) {
                    throw e;
                }
                Duration delay = retryPolicy.delayAfterAttempt(attempt);
                LOG.warn("Attempt {} to read the backlog failed, retrying in {} msec.", attempt, delay.toMillis());
                Thread.sleep(delay.toMillis());
            }
        }
    }

    /** Dispatch jobs from lost sessions as they appear, until interrupted. */
    public void serveRescheduleQueue () throws InterruptedException {
        RescheduleQueue rescheduleQueue = broker.getRescheduleQueue();
        while (!Thread.currentThread().isInterrupted()) {
            StitchJob job = rescheduleQueue.poll(RESCHEDULE_POLL_SECONDS, TimeUnit.SECONDS);
            if (job != null) {
                LOG.info("Redispatching lost job {}.", job);
                dispatchWithRetry(job);
            }
        }
        throw new InterruptedException();
    }

    /**
     * Keep trying to start the job on some worker, waiting between attempts according to the retry policy. Each
     * attempt acquires a worker afresh, since the worker that failed has been evicted.
     */
    public void dispatchWithRetry (StitchJob job) throws InterruptedException {
        for (long attempt = 1; ; attempt++) {
            try {
                dispatchOnce(job);
                return;
            } catch (DispatchException e) {
                if (!retryPolicy.allowsRetry(attempt)) {
                    LOG.error("Giving up on job {} after {} attempts.", job, attempt);
                    eventBus.send(new ErrorEvent(e));
                    return;
                }
                Duration delay = retryPolicy.delayAfterAttempt(attempt);
                LOG.warn("Attempt {} to dispatch {} failed, retrying in {} msec: {}",
                        attempt, job, delay.toMillis(), e.getMessage());
                Thread.sleep(delay.toMillis());
            }
        }
    }

    /**
     * Make one attempt to start the job on an idle worker.
     * @throws DispatchException if the job should be retried.
     */
    private void dispatchOnce (StitchJob job) throws InterruptedException, DispatchException {
        String workerAddress = broker.acquireWorker();
        StitchRequest request = broker.openSession(workerAddress, job);
        String statusUrl;
        try {
            statusUrl = workerClient.startStitch(workerAddress, request);
        } catch (DispatchException e) {
            failed(workerAddress, request, e);
            return;
        } catch (RuntimeException e) {
            failed(workerAddress, request, new DispatchException(
                    String.format("Unexpected error sending %s to worker %s.", job, workerAddress), e));
            return;
        }
        broker.acknowledge(workerAddress, request, statusUrl);
    }

    /** Evict the worker and discard the session, then rethrow unless the session was already resolved. */
    private void failed (String workerAddress, StitchRequest request, DispatchException e) throws DispatchException {
        if (broker.handleDispatchFailure(workerAddress, request.sessionId, e)) {
            throw e;
        }
        LOG.info("Session {} was resolved during a failed dispatch, not retrying {}.",
                request.sessionId, request.jobPayload);
    }

}
