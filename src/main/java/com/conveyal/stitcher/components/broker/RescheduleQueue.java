package com.conveyal.stitcher.components.broker;

import com.conveyal.stitcher.models.StitchJob;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Jobs that were in flight on a worker that disappeared, waiting to be dispatched again. Fleet discovery adds to this
 * queue and the dispatcher takes from it. It is unbounded since it can hold at most one entry per catalog item.
 */
public class RescheduleQueue {

    private final BlockingQueue<StitchJob> jobs = new LinkedBlockingQueue<>();

    public void add (StitchJob job) {
        jobs.add(job);
    }

    /** @return the next job, or null if the queue is empty. */
    public StitchJob poll () {
        return jobs.poll();
    }

    /** @return the next job, or null if none arrived within the timeout. */
    public StitchJob poll (long timeout, TimeUnit unit) throws InterruptedException {
        return jobs.poll(timeout, unit);
    }

    public int size () {
        return jobs.size();
    }

}
