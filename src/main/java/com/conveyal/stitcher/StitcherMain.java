package com.conveyal.stitcher;

import com.conveyal.stitcher.components.Components;
import com.conveyal.stitcher.components.HttpApi;
import com.conveyal.stitcher.components.LocalComponents;
import com.conveyal.stitcher.components.discovery.DiscoveryException;
import com.conveyal.stitcher.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is the main entry point for starting the stitching coordinator. The only optional argument is the path of the
 * properties file, which defaults to stitcher.properties in the working directory.
 */
public abstract class StitcherMain {

    private static final Logger LOG = LoggerFactory.getLogger(StitcherMain.class);

    public static void main (String... args) {
        // We have several non-daemon background thread pools which will keep the JVM alive if the main thread crashes.
        // If initialization fails, we need to catch the exception or error and force JVM shutdown.
        try {
            StitcherConfig config = args.length > 0
                    ? StitcherConfig.fromFile(args[0])
                    : StitcherConfig.fromDefaultFile();
            Components components = new LocalComponents(config);
            startCoordinator(components);
        } catch (Throwable throwable) {
            LOG.error("Exception while starting up coordinator, shutting down JVM.\n{}",
                    ExceptionUtils.stackTraceString(throwable));
            System.exit(1);
        }
    }

    /**
     * Bring up a coordinator on the given components: create the work catalog if needed, learn which workers exist,
     * then start dispatching and serving worker callbacks.
     */
    public static void startCoordinator (Components components) throws DiscoveryException {
        StitcherConfig config = components.config;
        LOG.info("Starting grid stitching coordinator.");

        // A failure here throws CatalogException and is fatal.
        components.workCatalog.initializeIfNeeded();
        if (config.immediateShutdown) {
            LOG.info("Startup has completed successfully. Exiting immediately as requested.");
            System.exit(0);
        }

        // Start the HTTP server before dispatching, so workers that finish quickly can report back.
        components.httpApi = new HttpApi(
                components.eventBus, config, LocalComponents.standardHttpControllers(components)
        );

        if (config.useStaticWorkers()) {
            LOG.info("Using fixed list of {} workers.", config.workerList().size());
            components.fleetMonitor.reconcileOnce();
        } else {
            LOG.info("Discovering workers tagged {} in EC2 region {}.", config.workerTag(), config.awsRegion());
            components.taskScheduler.repeatRegularly(components.fleetMonitor);
        }
        components.taskScheduler.startLongRunningTask(components.dispatcher);
        LOG.info("Grid stitching coordinator is ready, callbacks at {}.", components.broker.getCallbackUrl());
    }

}
