package com.conveyal.stitcher.components;

import com.conveyal.stitcher.StitcherConfig;
import com.conveyal.stitcher.catalog.WorkCatalog;
import com.conveyal.stitcher.components.broker.Broker;
import com.conveyal.stitcher.components.broker.Dispatcher;
import com.conveyal.stitcher.components.broker.QueuedResultSink;
import com.conveyal.stitcher.components.broker.WorkerClient;
import com.conveyal.stitcher.components.discovery.FleetMonitor;
import com.conveyal.stitcher.components.eventbus.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * We are adopting a lightweight dependency injection approach, where we manually wire up our components instead of
 * relying on a framework. For our simple case the approach is almost identical but we have to manage the order in
 * which the components are instantiated. This amounts to a manual depth-first traversal of the dependency graph which
 * is not prohibitive for a limited number of components.
 *
 * Outside code should never reference these component fields, and this class should be essentially unused after
 * application construction. Each component holds final references to all the other components it needs, and those
 * references are passed into the component's constructor by the wiring-up code in subclasses.
 */
public abstract class Components {

    private static final Logger LOG = LoggerFactory.getLogger(Components.class);

    public StitcherConfig config;
    public TaskScheduler taskScheduler;
    public EventBus eventBus;
    /** Durable record of every grid cell and whether it has been stitched. */
    public WorkCatalog workCatalog;
    public QueuedResultSink resultSink;
    public Broker broker;
    public WorkerClient workerClient;
    public Dispatcher dispatcher;
    public FleetMonitor fleetMonitor;
    /** Null until the HTTP server is started. */
    public HttpApi httpApi;

    /** Stop the HTTP server and interrupt all background tasks including the dispatcher. */
    public void shutDown () {
        LOG.info("Shutting down components.");
        if (httpApi != null) {
            httpApi.shutDown();
        }
        taskScheduler.shutDown();
    }

}
