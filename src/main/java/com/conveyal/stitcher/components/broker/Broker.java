package com.conveyal.stitcher.components.broker;

import com.conveyal.stitcher.StitcherException;
import com.conveyal.stitcher.catalog.CatalogException;
import com.conveyal.stitcher.catalog.WorkCatalog;
import com.conveyal.stitcher.components.Component;
import com.conveyal.stitcher.components.eventbus.ErrorEvent;
import com.conveyal.stitcher.components.eventbus.EventBus;
import com.conveyal.stitcher.components.eventbus.SessionEvent;
import com.conveyal.stitcher.components.eventbus.WorkerEvent;
import com.conveyal.stitcher.models.StitchJob;
import com.conveyal.stitcher.models.StitchRequest;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static com.conveyal.stitcher.components.eventbus.SessionEvent.State.COMPLETED;
import static com.conveyal.stitcher.components.eventbus.SessionEvent.State.LOST;
import static com.conveyal.stitcher.components.eventbus.SessionEvent.State.OPENED;
import static com.conveyal.stitcher.components.eventbus.WorkerEvent.Action.DISCOVERED;
import static com.conveyal.stitcher.components.eventbus.WorkerEvent.Action.EVICTED;

/**
 * The coordinator's shared in-memory state and the operations that change it. There is exactly one Broker per
 * process. The dispatcher, the fleet monitor and the HTTP controllers all receive it explicitly and never touch the
 * structures it holds except through these methods.
 * <p>
 * Three things run concurrently against the Broker: the dispatcher thread sending jobs to workers, the fleet monitor
 * reconciling the set of workers with what cloud discovery reports, and HTTP handler threads receiving completion
 * callbacks from workers. The worker registry and the session table are each internally synchronized and are updated
 * independently, so for a moment a session may refer to a worker the registry has already dropped. The next
 * reconciliation sweeps such sessions up. Each session is resolved exactly once, by whichever of completion or loss
 * removes it from the session table first. A completion that arrives while its worker is being dropped does not put
 * that worker back in the registry.
 */
public class Broker implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(Broker.class);

    /** Path on this coordinator that workers call when they finish a job. */
    public static final String COMPLETION_PATH = "/api/v1/processing_complete";

    public interface Config {
        String externalIp ();
        int externalPort ();
        String bucketUriPrefix ();
        double wgs84PixelSize ();
    }

    private final Config config;

    // Component Dependencies
    private final WorkCatalog workCatalog;
    private final EventBus eventBus;
    private final ResultSink resultSink;

    private final WorkerRegistry workerRegistry = new WorkerRegistry();
    private final SessionTable sessionTable = new SessionTable();
    private final RescheduleQueue rescheduleQueue = new RescheduleQueue();

    /** Every job sent to a worker asks it to report completion here. */
    private final String callbackUrl;

    public Broker (Config config, WorkCatalog workCatalog, EventBus eventBus, ResultSink resultSink) {
        this.config = config;
        this.workCatalog = workCatalog;
        this.eventBus = eventBus;
        this.resultSink = resultSink;
        this.callbackUrl = String.format("http://%s:%d%s", config.externalIp(), config.externalPort(), COMPLETION_PATH);
    }

    /**
     * Block until a worker is idle and claim it. This is how the dispatcher is held back when the whole fleet is
     * busy.
     */
    public String acquireWorker () throws InterruptedException {
        return workerRegistry.acquireReady();
    }

    /**
     * Record a new session for the given job on the given worker and return the request to send it. The session is
     * recorded before the request is sent so a worker that finishes very quickly can report completion before the
     * dispatcher has seen the acknowledgment.
     */
    public StitchRequest openSession (String workerAddress, StitchJob job) {
        String sessionId = UUID.randomUUID().toString();
        sessionTable.open(sessionId, workerAddress, job);
        return new StitchRequest(job, callbackUrl, config.bucketUriPrefix(), sessionId, config.wgs84PixelSize());
    }

    /**
     * Record that a worker acknowledged the job in the given session.
     * @return false if the session was already resolved (completed or swept) before the acknowledgment arrived.
     */
    public boolean acknowledge (String workerAddress, StitchRequest request, String statusUrl) {
        if (sessionTable.acknowledge(request.sessionId, statusUrl)) {
            eventBus.send(new SessionEvent(request.sessionId, workerAddress, request.jobPayload, OPENED));
            return true;
        }
        LOG.debug("Session {} was resolved before worker {} acknowledged it.", request.sessionId, workerAddress);
        return false;
    }

    /**
     * A worker failed to accept the job in the given session. The worker is presumed broken and dropped from the
     * registry. Fleet discovery will add it back if it is still running, and it will then be tried again.
     * @return true if the job should be retried on another worker, or false if the session was already resolved
     *         by a completion or a sweep, in which case the job has been finished or rescheduled already.
     */
    public boolean handleDispatchFailure (String workerAddress, String sessionId, DispatchException e) {
        LOG.warn("Evicting worker {}: {}", workerAddress, e.getMessage());
        if (workerRegistry.remove(workerAddress)) {
            eventBus.send(new WorkerEvent(EVICTED, workerAddress));
        }
        return sessionTable.remove(sessionId) != null;
    }

    /**
     * A worker reports that the job in the given session is finished. Mark the catalog item stitched, pass the
     * worker's payload on to the result sink, and make the worker available for another job.
     * @throws StitcherException (not found) if there is no such session, which is the case when the worker was
     *         already declared lost and its job rescheduled, or when the same completion is reported twice.
     */
    public void handleCompletion (String sessionId, JsonNode result) {
        Session session = sessionTable.remove(sessionId);
        if (session == null) {
            LOG.warn("Received completion for unknown session {}.", sessionId);
            throw StitcherException.notFound("No session with ID " + sessionId);
        }
        try {
            workCatalog.markStitched(session.job);
        } catch (CatalogException e) {
            // The job is done whether or not we could record it. It will be redone after a restart.
            eventBus.send(new ErrorEvent(e));
        }
        resultSink.accept(sessionId, result);
        if (!workerRegistry.releaseIfTracked(session.workerAddress)) {
            LOG.info("Worker {} finished session {} after it was dropped from the fleet, not reusing it.",
                    session.workerAddress, sessionId);
        }
        eventBus.send(new SessionEvent(sessionId, session.workerAddress, session.job, COMPLETED));
    }

    /**
     * Bring the worker registry in line with the hosts currently reported by fleet discovery. Hosts that have
     * disappeared lose their sessions, and the jobs in those sessions are placed on the reschedule queue.
     * @return the number of jobs rescheduled.
     */
    public int reconcileWorkers (Collection<String> activeHosts) {
        for (String host : activeHosts) {
            if (workerRegistry.add(host)) {
                eventBus.send(new WorkerEvent(DISCOVERED, host));
            }
        }
        Set<String> deadHosts = workerRegistry.reconcile(activeHosts);
        for (String host : deadHosts) {
            eventBus.send(new WorkerEvent(WorkerEvent.Action.LOST, host));
        }
        List<Session> lostSessions = sessionTable.removeForHosts(deadHosts);
        for (Session session : lostSessions) {
            rescheduleQueue.add(session.job);
            eventBus.send(new SessionEvent(session.sessionId, session.workerAddress, session.job, LOST));
        }
        if (!deadHosts.isEmpty()) {
            LOG.info("Lost {} workers, rescheduled {} jobs.", deadHosts.size(), lostSessions.size());
        }
        return lostSessions.size();
    }

    public ClusterStatus getClusterStatus () {
        WorkerCounts workerCounts = workerRegistry.counts();
        WorkCatalog.Counts itemCounts = workCatalog.countItems();
        return new ClusterStatus(workerCounts.running, workerCounts.ready, sessionTable.size(),
                rescheduleQueue.size(), itemCounts.total, itemCounts.stitched);
    }

    public WorkerRegistry getWorkerRegistry () {
        return workerRegistry;
    }

    public SessionTable getSessionTable () {
        return sessionTable;
    }

    public RescheduleQueue getRescheduleQueue () {
        return rescheduleQueue;
    }

    public String getCallbackUrl () {
        return callbackUrl;
    }

}
