package com.conveyal.stitcher.components.broker;

import com.conveyal.stitcher.components.Component;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Holds completion payloads in memory for whatever consumes them downstream. When full, the oldest result is dropped
 * to make room, since the catalog already records which jobs are done and the payloads are informational.
 */
public class QueuedResultSink implements ResultSink, Component {

    private static final Logger LOG = LoggerFactory.getLogger(QueuedResultSink.class);

    public static final int DEFAULT_CAPACITY = 10_000;

    private final BlockingQueue<CompletedResult> results;

    public QueuedResultSink (int capacity) {
        this.results = new LinkedBlockingQueue<>(capacity);
    }

    public QueuedResultSink () {
        this(DEFAULT_CAPACITY);
    }

    @Override
    public void accept (String sessionId, JsonNode result) {
        CompletedResult completedResult = new CompletedResult(sessionId, result);
        while (!results.offer(completedResult)) {
            CompletedResult dropped = results.poll();
            if (dropped != null) {
                LOG.warn("Result queue is full, dropping result of session {}.", dropped.sessionId);
            }
        }
    }

    /** @return the next result, or null if none arrives within the timeout. */
    public CompletedResult poll (long timeout, TimeUnit unit) throws InterruptedException {
        return results.poll(timeout, unit);
    }

    /** Remove and return all results currently queued. */
    public List<CompletedResult> drain () {
        List<CompletedResult> drained = new ArrayList<>();
        results.drainTo(drained);
        return drained;
    }

    public int size () {
        return results.size();
    }

    public static class CompletedResult {
        public final String sessionId;
        public final JsonNode result;

        public CompletedResult (String sessionId, JsonNode result) {
            this.sessionId = sessionId;
            this.result = result;
        }
    }

}
