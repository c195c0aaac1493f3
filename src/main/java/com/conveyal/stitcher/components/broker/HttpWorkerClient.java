package com.conveyal.stitcher.components.broker;

import com.conveyal.stitcher.components.Component;
import com.conveyal.stitcher.models.StitchRequest;
import com.conveyal.stitcher.util.HttpStatus;
import com.conveyal.stitcher.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.HttpClient;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.config.SocketConfig;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Starts jobs on workers by POSTing a StitchRequest as JSON to the worker's stitching endpoint. The worker replies
 * immediately with a JSON object containing a status URL, and later reports completion to the callback URL in the
 * request.
 */
public class HttpWorkerClient implements WorkerClient, Component {

    private static final Logger LOG = LoggerFactory.getLogger(HttpWorkerClient.class);

    public static final String STITCH_PATH = "/api/v1/stitch_grid_cell";

    public interface Config {
        int dispatchTimeoutSeconds ();
    }

    private final HttpClient httpClient;

    public HttpWorkerClient (Config config) {
        this.httpClient = makeHttpClient(config.dispatchTimeoutSeconds() * 1000);
    }

    /**
     * Failed requests are not retried by the client. The dispatcher decides whether and where to retry, and a
     * worker that fails once is evicted.
     */
    public static HttpClient makeHttpClient (int timeoutMilliseconds) {
        PoolingHttpClientConnectionManager mgr = new PoolingHttpClientConnectionManager();
        mgr.setDefaultMaxPerRoute(20);
        SocketConfig cfg = SocketConfig.custom()
                .setSoTimeout(timeoutMilliseconds)
                .build();
        mgr.setDefaultSocketConfig(cfg);
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeoutMilliseconds)
                .setSocketTimeout(timeoutMilliseconds)
                .build();
        return HttpClients.custom().disableAutomaticRetries()
                .setConnectionManager(mgr)
                .setDefaultRequestConfig(requestConfig)
                .build();
    }

    @Override
    public String startStitch (String workerAddress, StitchRequest request) throws DispatchException {
        HttpEntity responseEntity = null;
        try {
            HttpPost httpPost = new HttpPost("http://" + workerAddress + STITCH_PATH);
            httpPost.setEntity(new StringEntity(JsonUtil.toJsonString(request), ContentType.APPLICATION_JSON));
            HttpResponse response = httpClient.execute(httpPost);
            responseEntity = response.getEntity();
            int statusCode = response.getStatusLine().getStatusCode();
            String body = responseEntity == null ? "" : EntityUtils.toString(responseEntity);
            if (!HttpStatus.isSuccess(statusCode)) {
                throw new DispatchException(String.format("Worker %s responded to job %s with status %d: %s",
                        workerAddress, request.sessionId, statusCode, body));
            }
            JsonNode statusUrl = JsonUtil.objectMapper.readTree(body).get("status_url");
            if (statusUrl == null || !statusUrl.isTextual()) {
                throw new DispatchException(String.format("Worker %s acknowledged job %s without a status URL: %s",
                        workerAddress, request.sessionId, body));
            }
            LOG.debug("Worker {} accepted session {}, status at {}.", workerAddress, request.sessionId,
                    statusUrl.asText());
            return statusUrl.asText();
        } catch (IOException e) {
            // Includes timeouts, refused connections and unparseable JSON.
            throw new DispatchException(String.format("Could not start job %s on worker %s.",
                    request.sessionId, workerAddress), e);
        } catch (RuntimeException e) {
            // For example a worker address that does not form a valid URI.
            throw new DispatchException(String.format("Could not send job %s to worker %s.",
                    request.sessionId, workerAddress), e);
        } finally {
            // We have to properly close any streams so the HTTP connection is released back to the (finite) pool.
            EntityUtils.consumeQuietly(responseEntity);
        }
    }

}
