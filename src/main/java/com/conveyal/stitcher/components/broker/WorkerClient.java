package com.conveyal.stitcher.components.broker;

import com.conveyal.stitcher.models.StitchRequest;

/**
 * Sends jobs to workers. This is an interface so tests can stand in for the fleet without any network.
 */
public interface WorkerClient {

    /**
     * Ask the worker at the given host:port address to start the requested job. The call returns once the worker has
     * acknowledged the job, not when the job is finished.
     * @return the status URL reported by the worker for the job.
     * @throws DispatchException if the worker did not acknowledge the job.
     */
    String startStitch (String workerAddress, StitchRequest request) throws DispatchException;

}
