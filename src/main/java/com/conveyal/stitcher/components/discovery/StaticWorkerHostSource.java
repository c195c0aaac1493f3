package com.conveyal.stitcher.components.discovery;

import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.Set;

/** A fixed list of worker hosts, for running against workers that are not discovered through the cloud API. */
public class StaticWorkerHostSource implements WorkerHostSource {

    private final Set<String> hosts;

    public StaticWorkerHostSource (Collection<String> hosts) {
        this.hosts = ImmutableSet.copyOf(hosts);
    }

    @Override
    public Set<String> activeHosts () {
        return hosts;
    }

}
