package com.conveyal.stitcher.components.discovery;

import java.util.Set;

/**
 * Somewhere to find out which worker hosts currently exist.
 */
public interface WorkerHostSource {

    /**
     * @return the host:port addresses of all workers that are currently running. An empty set is a valid answer,
     *         meaning all workers are gone.
     */
    Set<String> activeHosts () throws DiscoveryException;

}
