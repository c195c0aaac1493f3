package com.conveyal.stitcher.components;

import com.conveyal.stitcher.StitcherException;
import com.conveyal.stitcher.components.eventbus.ErrorEvent;
import com.conveyal.stitcher.components.eventbus.EventBus;
import com.conveyal.stitcher.components.eventbus.HttpApiEvent;
import com.conveyal.stitcher.controllers.HttpController;
import com.conveyal.stitcher.util.HttpStatus;
import com.conveyal.stitcher.util.JsonUtil;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spark.Request;
import spark.Response;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.conveyal.stitcher.StitcherException.Type.RUNTIME;

/**
 * This Component is a web server that serves up our HTTP API endpoints, which are contacted mostly by the workers.
 * It must be supplied with a list of HttpController instances implementing the endpoints.
 */
public class HttpApi implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(HttpApi.class);

    // These "attributes" are attached to an incoming HTTP request with String keys, making them available in handlers
    private static final String REQUEST_START_TIME_ATTRIBUTE = "requestStartTime";

    public interface Config {
        int serverPort ();
    }

    private final EventBus eventBus;
    private final Config config;

    private final spark.Service sparkService;

    public HttpApi (EventBus eventBus, Config config, List<HttpController> httpControllers) {
        this.eventBus = eventBus;
        this.config = config;

        sparkService = configureSparkService();
        for (HttpController httpController : httpControllers) {
            httpController.registerEndpoints(sparkService);
        }
    }

    private spark.Service configureSparkService () {
        // Set up Spark, the HTTP framework wrapping Jetty, including the port on which it will listen for connections.
        LOG.info("Coordinator will listen for HTTP connections on port {}.", config.serverPort());
        spark.Service sparkService = spark.Service.ignite();
        sparkService.port(config.serverPort());

        // Specify actions to take before the main logic of handling each HTTP request.
        sparkService.before((req, res) -> {
            // Record when the request started, so we can measure elapsed response time.
            req.attribute(REQUEST_START_TIME_ATTRIBUTE, Instant.now());
            // The default MIME type is JSON. This will be overridden by the few handlers that do not return JSON.
            res.type("application/json");
        });

        sparkService.after((req, res) -> {
            // Firing an event after the request allows us to report the response time.
            Instant requestStartTime = req.attribute(REQUEST_START_TIME_ATTRIBUTE);
            Duration elapsed = Duration.between(requestStartTime, Instant.now());
            eventBus.send(new HttpApiEvent(req.requestMethod(), res.status(), req.pathInfo(), elapsed.toMillis()));
        });

        sparkService.exception(StitcherException.class, (e, request, response) -> {
            respondToException(e, request, response, e.type, e.message, e.httpCode);
        });

        sparkService.exception(RuntimeException.class, (e, request, response) -> {
            respondToException(e, request, response, RUNTIME, e.toString(), HttpStatus.SERVER_ERROR_500);
        });

        return sparkService;
    }

    private void respondToException (Exception e, Request request, Response response,
                                     StitcherException.Type type, String message, int code) {

        // Stacktrace in ErrorEvent reused below to avoid repeatedly generating String of stacktrace.
        ErrorEvent errorEvent = new ErrorEvent(e, request.pathInfo());
        // Unknown sessions and malformed callbacks are the worker's problem, not ours, so are not reported as errors.
        if (code >= HttpStatus.SERVER_ERROR_500) {
            eventBus.send(errorEvent);
        } else {
            LOG.warn("Responding {} to {} {}: {}", code, request.requestMethod(), request.pathInfo(), message);
        }

        ObjectNode body = JsonUtil.objectNode()
                .put("type", type.toString())
                .put("message", message)
                .put("stackTrace", errorEvent.filteredStackTrace);
        response.status(code);
        response.type("application/json");
        response.body(JsonUtil.toJsonString(body));
    }

    /** Block until the server is ready to accept connections. */
    public void awaitInitialization () {
        sparkService.awaitInitialization();
    }

    // Maybe this should be done or called with a JVM shutdown hook
    public void shutDown () {
        sparkService.stop();
        sparkService.awaitStop();
    }

}
