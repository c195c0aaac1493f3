package com.conveyal.stitcher.components.broker;

import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

/**
 * Tracks which worker hosts are idle ("ready") and which are busy with a job ("running"). A host is in at most one of
 * the two sets at any moment, and a host absent from both is unknown to the coordinator.
 *
 * All methods are synchronized on this object. The dispatcher blocks in acquireReady() by waiting on the same monitor,
 * and every method that might make a ready host available notifies it.
 */
public class WorkerRegistry {

    private final Set<String> ready = new HashSet<>();
    private final Set<String> running = new HashSet<>();

    /**
     * Register a newly seen host as ready. Hosts that are already tracked, whether ready or running, are unaffected.
     * @return true if the host was not already tracked.
     */
    public synchronized boolean add (String host) {
        if (ready.contains(host) || running.contains(host)) {
            return false;
        }
        ready.add(host);
        notifyAll();
        return true;
    }

    /**
     * Block until some host is ready, then mark it running and return it. Which of several ready hosts is chosen is
     * unspecified.
     * @throws InterruptedException if the calling thread is interrupted while waiting, which is how the dispatcher
     *         is cancelled.
     */
    public synchronized String acquireReady () throws InterruptedException {
        while (ready.isEmpty()) {
            wait();
        }
        Iterator<String> iterator = ready.iterator();
        String host = iterator.next();
        iterator.remove();
        running.add(host);
        return host;
    }

    /**
     * Return a host to the ready set after it finishes a job. A host that was not running (for example a completion
     * arriving after the host was swept and rediscovered) is simply made ready.
     */
    public synchronized void release (String host) {
        running.remove(host);
        ready.add(host);
        notifyAll();
    }

    /**
     * Return a host to the ready set after it finishes a job, unless the host is no longer tracked. A completion can
     * arrive after reconciliation has dropped its host but before the host's sessions are swept, and the host must
     * then stay dropped.
     * @return true if the host is now ready.
     */
    public synchronized boolean releaseIfTracked (String host) {
        if (running.remove(host)) {
            ready.add(host);
            notifyAll();
            return true;
        }
        return ready.contains(host);
    }

    /**
     * Forget a host entirely, whichever state it was in.
     * @return true if the host was tracked.
     */
    public synchronized boolean remove (String host) {
        boolean removedReady = ready.remove(host);
        boolean removedRunning = running.remove(host);
        return removedReady || removedRunning;
    }

    /**
     * Bring the registry in line with the set of hosts currently reported by fleet discovery: hosts not yet tracked
     * become ready, and tracked hosts that are no longer reported are removed.
     * @return the removed hosts, which may still have jobs in flight that will never complete.
     */
    public synchronized Set<String> reconcile (Collection<String> activeHosts) {
        Set<String> active = new HashSet<>(activeHosts);
        Set<String> deadHosts = new HashSet<>();
        for (String host : ready) {
            if (!active.contains(host)) deadHosts.add(host);
        }
        for (String host : running) {
            if (!active.contains(host)) deadHosts.add(host);
        }
        ready.removeAll(deadHosts);
        running.removeAll(deadHosts);
        for (String host : active) {
            if (!running.contains(host)) {
                ready.add(host);
            }
        }
        if (!ready.isEmpty()) {
            notifyAll();
        }
        return deadHosts;
    }

    public synchronized WorkerCounts counts () {
        return new WorkerCounts(running.size(), ready.size());
    }

    /** @return a copy of the ready set, which may be stale as soon as it is returned. */
    public synchronized Set<String> readyHosts () {
        return new HashSet<>(ready);
    }

    /** @return a copy of the running set, which may be stale as soon as it is returned. */
    public synchronized Set<String> runningHosts () {
        return new HashSet<>(running);
    }

}
