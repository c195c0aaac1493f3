package com.conveyal.stitcher.components;

import com.conveyal.stitcher.StitcherConfig;
import com.conveyal.stitcher.catalog.WorkCatalog;
import com.conveyal.stitcher.components.broker.Broker;
import com.conveyal.stitcher.components.broker.Dispatcher;
import com.conveyal.stitcher.components.broker.HttpWorkerClient;
import com.conveyal.stitcher.components.broker.QueuedResultSink;
import com.conveyal.stitcher.components.discovery.Ec2WorkerHostSource;
import com.conveyal.stitcher.components.discovery.FleetMonitor;
import com.conveyal.stitcher.components.discovery.StaticWorkerHostSource;
import com.conveyal.stitcher.components.discovery.WorkerHostSource;
import com.conveyal.stitcher.components.eventbus.ActivityLogger;
import com.conveyal.stitcher.components.eventbus.ErrorLogger;
import com.conveyal.stitcher.components.eventbus.EventBus;
import com.conveyal.stitcher.controllers.HttpController;
import com.conveyal.stitcher.controllers.StitchController;

import java.util.List;

/**
 * Wires up the components for a coordinator talking to real workers over HTTP. Workers are found through EC2
 * unless the config lists them explicitly.
 */
public class LocalComponents extends Components {

    public LocalComponents (StitcherConfig config) {
        this.config = config;
        taskScheduler = new TaskScheduler(config);
        eventBus = new EventBus(taskScheduler);
        eventBus.addHandlers(new ErrorLogger(), new ActivityLogger());
        workCatalog = new WorkCatalog(config);
        resultSink = new QueuedResultSink();
        broker = new Broker(config, workCatalog, eventBus, resultSink);
        workerClient = new HttpWorkerClient(config);
        dispatcher = new Dispatcher(config, workCatalog, broker, workerClient, eventBus);
        fleetMonitor = new FleetMonitor(config, hostSource(config), broker, eventBus);
        // The HttpApi is created when the server starts, since creating it begins listening for connections.
    }

    private static WorkerHostSource hostSource (StitcherConfig config) {
        if (config.useStaticWorkers()) {
            return new StaticWorkerHostSource(config.workerList());
        } else {
            return new Ec2WorkerHostSource(config);
        }
    }

    /**
     * Create the standard list of HttpControllers.
     * We pass these controllers into the HttpApi (rather than constructing them in the HttpApi constructor) to allow
     * injecting custom controllers in other deployment environments.
     */
    public static List<HttpController> standardHttpControllers (Components components) {
        return List.of(new StitchController(components.broker));
    }

}
