package com.conveyal.stitcher.components.discovery;

import com.conveyal.stitcher.components.Component;
import com.conveyal.stitcher.components.TaskScheduler;
import com.conveyal.stitcher.components.broker.Broker;
import com.conveyal.stitcher.components.eventbus.ErrorEvent;
import com.conveyal.stitcher.components.eventbus.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Periodically asks the host source which workers exist and reconciles the broker's registry with the answer. A poll
 * that fails for any reason leaves the registry unchanged until the next poll. It is important that this keeps
 * running, since it is the only way lost jobs are noticed and rescheduled.
 */
public class FleetMonitor implements TaskScheduler.PeriodicTask, Component {

    private static final Logger LOG = LoggerFactory.getLogger(FleetMonitor.class);

    public interface Config {
        int discoveryPollSeconds ();
    }

    private final Config config;
    private final WorkerHostSource hostSource;
    private final Broker broker;
    private final EventBus eventBus;

    public FleetMonitor (Config config, WorkerHostSource hostSource, Broker broker, EventBus eventBus) {
        this.config = config;
        this.hostSource = hostSource;
        this.broker = broker;
        this.eventBus = eventBus;
    }

    @Override
    public void run () {
        try {
            reconcileOnce();
        } catch (DiscoveryException e) {
            LOG.warn("Fleet discovery failed, will try again in {} seconds: {}", getPeriodSeconds(), e.getMessage());
            eventBus.send(new ErrorEvent(e));
        } catch (RuntimeException e) {
            eventBus.send(new ErrorEvent(e));
        }
    }

    /**
     * Poll the host source once and reconcile. With a static worker list this is called once at startup instead of
     * scheduling the monitor.
     * @return the number of jobs rescheduled because their workers are gone.
     */
    public int reconcileOnce () throws DiscoveryException {
        Set<String> activeHosts = hostSource.activeHosts();
        LOG.debug("Fleet discovery found {} workers.", activeHosts.size());
        return broker.reconcileWorkers(activeHosts);
    }

    @Override
    public int getPeriodSeconds () {
        return config.discoveryPollSeconds();
    }

}
