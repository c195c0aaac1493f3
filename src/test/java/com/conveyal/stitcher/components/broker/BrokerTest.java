package com.conveyal.stitcher.components.broker;

import com.conveyal.stitcher.StitcherConfig;
import com.conveyal.stitcher.StitcherException;
import com.conveyal.stitcher.StitcherTestUtils;
import com.conveyal.stitcher.StitcherTestUtils.RecordingEventHandler;
import com.conveyal.stitcher.catalog.WorkCatalog;
import com.conveyal.stitcher.components.eventbus.SessionEvent;
import com.conveyal.stitcher.components.eventbus.WorkerEvent;
import com.conveyal.stitcher.models.StitchJob;
import com.conveyal.stitcher.models.StitchRequest;
import com.conveyal.stitcher.models.WorkItem;
import com.conveyal.stitcher.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

class BrokerTest {

    @TempDir
    Path workspace;

    private WorkCatalog workCatalog;
    private QueuedResultSink resultSink;
    private RecordingEventHandler events;
    private Broker broker;
    private List<WorkItem> backlog;

    @BeforeEach
    void setUp () {
        StitcherConfig config = StitcherTestUtils.testConfig(workspace);
        workCatalog = new WorkCatalog(config);
        workCatalog.initialize();
        backlog = workCatalog.readBacklog();
        resultSink = new QueuedResultSink();
        events = new RecordingEventHandler();
        broker = new Broker(config, workCatalog, StitcherTestUtils.recordingEventBus(events), resultSink);
    }

    private static JsonNode completionBody (String sessionId) {
        return JsonUtil.objectNode().put("session_id", sessionId).put("stitched_raster", "s3://out.tif");
    }

    @Test
    void requestCarriesCoordinatorSettings () {
        broker.reconcileWorkers(List.of("w1:8888"));
        StitchJob job = backlog.get(0).toJob();
        StitchRequest request = broker.openSession("w1:8888", job);
        Assertions.assertEquals(job, request.jobPayload);
        Assertions.assertEquals("http://localhost:8080/api/v1/processing_complete", request.callbackUrl);
        Assertions.assertEquals("s3://test-bucket/stitched", request.bucketUriPrefix);
        Assertions.assertEquals(0.002, request.wgs84PixelSize);
        Assertions.assertNotNull(request.sessionId);
        // Session IDs are fresh for every dispatch, even of the same job.
        Assertions.assertNotEquals(request.sessionId, broker.openSession("w1:8888", job).sessionId);
    }

    @Test
    void completionResolvesSession () throws Exception {
        broker.reconcileWorkers(List.of("w1:8888"));
        String worker = broker.acquireWorker();
        StitchJob job = backlog.get(0).toJob();
        StitchRequest request = broker.openSession(worker, job);
        Assertions.assertTrue(broker.acknowledge(worker, request, "http://w1:8888/status/1"));
        Assertions.assertEquals("http://w1:8888/status/1",
                broker.getSessionTable().get(request.sessionId).getStatusUrl());

        broker.handleCompletion(request.sessionId, completionBody(request.sessionId));

        Assertions.assertEquals(0, broker.getSessionTable().size());
        Assertions.assertEquals(Set.of("w1:8888"), broker.getWorkerRegistry().readyHosts());
        Assertions.assertEquals(1, workCatalog.countItems().stitched);
        List<QueuedResultSink.CompletedResult> results = resultSink.drain();
        Assertions.assertEquals(1, results.size());
        Assertions.assertEquals(request.sessionId, results.get(0).sessionId);
        Assertions.assertEquals("s3://out.tif", results.get(0).result.get("stitched_raster").asText());

        List<SessionEvent> sessionEvents = events.eventsOfType(SessionEvent.class);
        Assertions.assertEquals(2, sessionEvents.size());
        Assertions.assertEquals(SessionEvent.State.OPENED, sessionEvents.get(0).state);
        Assertions.assertEquals(SessionEvent.State.COMPLETED, sessionEvents.get(1).state);
    }

    @Test
    void unknownSessionIsNotFound () throws Exception {
        broker.reconcileWorkers(List.of("w1:8888"));
        String worker = broker.acquireWorker();
        StitchRequest request = broker.openSession(worker, backlog.get(0).toJob());
        broker.handleCompletion(request.sessionId, completionBody(request.sessionId));

        // A repeated completion of the same session changes nothing.
        StitcherException e = Assertions.assertThrows(StitcherException.class,
                () -> broker.handleCompletion(request.sessionId, completionBody(request.sessionId)));
        Assertions.assertEquals(404, e.httpCode);
        Assertions.assertEquals(StitcherException.Type.NOT_FOUND, e.type);
        Assertions.assertThrows(StitcherException.class,
                () -> broker.handleCompletion("no-such-session", completionBody("no-such-session")));
        Assertions.assertEquals(1, workCatalog.countItems().stitched);
        Assertions.assertEquals(1, resultSink.size());
        Assertions.assertEquals(1, broker.getWorkerRegistry().counts().ready);
    }

    @Test
    void lostWorkerSessionsAreRescheduled () throws Exception {
        broker.reconcileWorkers(List.of("w1:8888", "w2:8888"));
        String first = broker.acquireWorker();
        String second = broker.acquireWorker();
        StitchRequest lost = broker.openSession(first, backlog.get(0).toJob());
        StitchRequest kept = broker.openSession(second, backlog.get(1).toJob());

        int nRescheduled = broker.reconcileWorkers(List.of(second));

        Assertions.assertEquals(1, nRescheduled);
        Assertions.assertEquals(1, broker.getRescheduleQueue().size());
        Assertions.assertEquals(lost.jobPayload, broker.getRescheduleQueue().poll(1, TimeUnit.SECONDS));
        Assertions.assertNull(broker.getSessionTable().get(lost.sessionId));
        Assertions.assertNotNull(broker.getSessionTable().get(kept.sessionId));
        Assertions.assertEquals(Set.of(second), broker.getWorkerRegistry().runningHosts());

        // The lost worker reporting completion late is rejected and does not mark the item stitched.
        Assertions.assertThrows(StitcherException.class,
                () -> broker.handleCompletion(lost.sessionId, completionBody(lost.sessionId)));
        Assertions.assertEquals(0, workCatalog.countItems().stitched);

        List<WorkerEvent> workerEvents = events.eventsOfType(WorkerEvent.class);
        Assertions.assertEquals(3, workerEvents.size());
        Assertions.assertEquals(WorkerEvent.Action.LOST, workerEvents.get(2).action);
        Assertions.assertEquals(first, workerEvents.get(2).host);
    }

    @Test
    void oneRescheduleEntryPerLostSession () throws Exception {
        broker.reconcileWorkers(List.of("w1:8888"));
        String worker = broker.acquireWorker();
        // Sessions on a single host can pile up if completions and releases race, all are rescheduled.
        for (int i = 0; i < 3; i++) {
            broker.openSession(worker, backlog.get(i).toJob());
        }
        Assertions.assertEquals(3, broker.reconcileWorkers(List.of()));
        Assertions.assertEquals(3, broker.getRescheduleQueue().size());
        // A second sweep finds nothing more.
        Assertions.assertEquals(0, broker.reconcileWorkers(List.of()));
        Assertions.assertEquals(3, broker.getRescheduleQueue().size());
    }

    @Test
    void dispatchFailureEvictsWorker () throws Exception {
        broker.reconcileWorkers(List.of("w1:8888"));
        String worker = broker.acquireWorker();
        StitchRequest request = broker.openSession(worker, backlog.get(0).toJob());
        boolean retry = broker.handleDispatchFailure(worker, request.sessionId, new DispatchException("refused"));
        Assertions.assertTrue(retry);
        Assertions.assertEquals(0, broker.getWorkerRegistry().counts().total());
        Assertions.assertEquals(0, broker.getSessionTable().size());
        // Once the session is gone, a further failure report says not to retry.
        Assertions.assertFalse(broker.handleDispatchFailure(worker, request.sessionId, new DispatchException("x")));
        Assertions.assertEquals(WorkerEvent.Action.EVICTED,
                events.eventsOfType(WorkerEvent.class).get(1).action);
    }

    /**
     * A completion callback racing a sweep that loses the worker must resolve the session exactly once: either the
     * item is stitched, or the job is rescheduled, never both and never neither.
     */
    @Test
    void completionAndSweepResolveExactlyOnce () throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            int nCompleted = 0;
            for (int i = 0; i < 200; i++) {
                broker.reconcileWorkers(List.of("w1:8888"));
                String worker = broker.acquireWorker();
                StitchRequest request = broker.openSession(worker, backlog.get(0).toJob());
                CountDownLatch start = new CountDownLatch(1);
                Future<Boolean> completion = executor.submit(() -> {
                    start.await();
                    try {
                        broker.handleCompletion(request.sessionId, completionBody(request.sessionId));
                        return true;
                    } catch (StitcherException e) {
                        return false;
                    }
                });
                Future<Integer> sweep = executor.submit(() -> {
                    start.await();
                    return broker.reconcileWorkers(List.of());
                });
                start.countDown();
                boolean completed = completion.get(5, TimeUnit.SECONDS);
                int rescheduled = sweep.get(5, TimeUnit.SECONDS);
                Assertions.assertEquals(1, (completed ? 1 : 0) + rescheduled);
                if (completed) nCompleted += 1;
                Assertions.assertEquals(0, broker.getSessionTable().size());
                Assertions.assertEquals(0, broker.getWorkerRegistry().counts().total());
            }
            Assertions.assertEquals(200 - nCompleted, broker.getRescheduleQueue().size());
            Assertions.assertEquals(nCompleted, resultSink.size());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * A completion arriving after reconciliation dropped the worker from the registry, but before its sessions were
     * swept, does not bring the dropped worker back.
     */
    @Test
    void completionDuringReconciliationKeepsWorkerDropped () throws Exception {
        broker.reconcileWorkers(List.of("w1:8888"));
        String worker = broker.acquireWorker();
        StitchRequest request = broker.openSession(worker, backlog.get(0).toJob());
        broker.getWorkerRegistry().reconcile(List.of());

        broker.handleCompletion(request.sessionId, completionBody(request.sessionId));
        Assertions.assertEquals(0, broker.getWorkerRegistry().counts().total());
        Assertions.assertEquals(1, workCatalog.countItems().stitched);
        Assertions.assertEquals(0, broker.reconcileWorkers(List.of()));
        Assertions.assertEquals(0, broker.getRescheduleQueue().size());
    }

    @Test
    void clusterStatus () throws Exception {
        broker.reconcileWorkers(List.of("w1:8888", "w2:8888"));
        String worker = broker.acquireWorker();
        broker.openSession(worker, backlog.get(0).toJob());
        ClusterStatus status = broker.getClusterStatus();
        Assertions.assertEquals(1, status.running);
        Assertions.assertEquals(1, status.ready);
        Assertions.assertEquals(1, status.sessions);
        Assertions.assertEquals(0, status.pendingReschedules);
        Assertions.assertEquals(8, status.workItems);
        Assertions.assertEquals(0, status.stitched);

        JsonNode json = JsonUtil.objectMapper.valueToTree(status);
        Assertions.assertEquals(8, json.get("work_items").asInt());
        Assertions.assertEquals(0, json.get("pending_reschedules").asInt());
    }

}
