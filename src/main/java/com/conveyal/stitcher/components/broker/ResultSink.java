package com.conveyal.stitcher.components.broker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives the payloads workers send when they finish a job, after the job is recorded as stitched.
 */
public interface ResultSink {

    void accept (String sessionId, JsonNode result);

}
