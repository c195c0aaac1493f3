package com.conveyal.stitcher.controllers;

import com.conveyal.stitcher.StitcherException;
import com.conveyal.stitcher.components.broker.Broker;
import com.conveyal.stitcher.components.broker.ClusterStatus;
import com.conveyal.stitcher.util.HttpStatus;
import com.conveyal.stitcher.util.JsonUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import spark.Request;
import spark.Response;

/**
 * The endpoints contacted by workers: a liveness check, and the callback workers use to report a finished job.
 * There is also a status summary for people watching the progress of the whole run.
 */
public class StitchController implements HttpController {

    private final Broker broker;

    public StitchController (Broker broker) {
        this.broker = broker;
    }

    @Override
    public void registerEndpoints (spark.Service sparkService) {
        sparkService.get("/api/v1/processing_status", this::processingStatus);
        sparkService.post(Broker.COMPLETION_PATH, this::processingComplete);
        sparkService.get("/api/v1/cluster_status", this::clusterStatus, JsonUtil.toJson);
    }

    private Object processingStatus (Request request, Response response) {
        response.type("text/plain");
        return "OK";
    }

    /**
     * A worker reports that it finished a job. The body is a JSON object which must contain the session_id the
     * coordinator sent with the job. The whole body is passed on as the result.
     */
    private Object processingComplete (Request request, Response response) {
        JsonNode body;
        try {
            body = JsonUtil.objectMapper.readTree(request.body());
        } catch (JsonProcessingException e) {
            throw StitcherException.badRequest("Completion body is not valid JSON: " + e.getOriginalMessage());
        }
        if (body == null || !body.isObject()) {
            throw StitcherException.badRequest("Completion body must be a JSON object.");
        }
        JsonNode sessionId = body.get("session_id");
        if (sessionId == null || !sessionId.isTextual()) {
            throw StitcherException.badRequest("Completion body must contain a session_id string.");
        }
        broker.handleCompletion(sessionId.asText(), body);
        response.status(HttpStatus.ACCEPTED_202);
        response.type("text/plain");
        return "complete";
    }

    private ClusterStatus clusterStatus (Request request, Response response) {
        return broker.getClusterStatus();
    }

}
