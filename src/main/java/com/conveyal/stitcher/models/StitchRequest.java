package com.conveyal.stitcher.models;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The body of the POST that starts a stitching job on a worker. Everything except the job itself is the same for every
 * request from a given coordinator: the worker reports back to the callback URL, uploads its output under the bucket
 * prefix, and echoes the session ID so the coordinator can tell which dispatch completed.
 */
public class StitchRequest {

    @JsonProperty("job_payload")
    public StitchJob jobPayload;

    @JsonProperty("callback_url")
    public String callbackUrl;

    @JsonProperty("bucket_uri_prefix")
    public String bucketUriPrefix;

    @JsonProperty("session_id")
    public String sessionId;

    @JsonProperty("wgs84_pixel_size")
    public double wgs84PixelSize;

    /** No-arg constructor for deserialization. */
    public StitchRequest () { }

    public StitchRequest (
            StitchJob jobPayload, String callbackUrl, String bucketUriPrefix, String sessionId, double wgs84PixelSize
    ) {
        this.jobPayload = jobPayload;
        this.callbackUrl = callbackUrl;
        this.bucketUriPrefix = bucketUriPrefix;
        this.sessionId = sessionId;
        this.wgs84PixelSize = wgs84PixelSize;
    }

}
