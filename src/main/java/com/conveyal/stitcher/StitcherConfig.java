package com.conveyal.stitcher;

import com.conveyal.stitcher.catalog.WorkCatalog;
import com.conveyal.stitcher.components.HttpApi;
import com.conveyal.stitcher.components.TaskScheduler;
import com.conveyal.stitcher.components.broker.Broker;
import com.conveyal.stitcher.components.broker.Dispatcher;
import com.conveyal.stitcher.components.broker.HttpWorkerClient;
import com.conveyal.stitcher.components.discovery.Ec2WorkerHostSource;
import com.conveyal.stitcher.components.discovery.FleetMonitor;

import java.util.List;
import java.util.Properties;

/** Loads config information for the stitching coordinator and exposes it to the Components and HttpControllers. */
public class StitcherConfig extends ConfigBase implements
        TaskScheduler.Config,
        HttpApi.Config,
        WorkCatalog.Config,
        Broker.Config,
        Dispatcher.Config,
        HttpWorkerClient.Config,
        FleetMonitor.Config,
        Ec2WorkerHostSource.Config
{

    // CONSTANTS AND STATIC FIELDS

    public static final String STITCHER_CONFIG_FILE = "stitcher.properties";

    // INSTANCE FIELDS

    private final int serverPort;
    private final String externalIp;
    private final int externalPort;
    private final List<String> workerList;
    private final int workerPort;
    private final String workerTag;
    private final String awsRegion;
    private final int discoveryPollSeconds;
    private final double gridStepDegrees;
    private final List<String> scenarioIds;
    private final List<String> rasterIds;
    private final String bucketUriPrefix;
    private final double wgs84PixelSize;
    private final String workspaceDirectory;
    private final int dispatchTimeoutSeconds;
    private final int dispatchRetryBaseMillis;
    private final int dispatchRetryMaxMillis;
    private final int lightThreads;
    // If set to true, the coordinator will create its work catalog and immediately exit with a success code.
    public final boolean immediateShutdown;

    // CONSTRUCTORS

    private StitcherConfig (String filename) {
        this(propsFromFile(filename));
    }

    protected StitcherConfig (Properties properties) {
        super(properties);
        // We intentionally don't supply any defaults here.
        // Any 'defaults' should be shipped in an example config file.
        immediateShutdown = boolProp("immediate-shutdown");
        serverPort = intProp("server-port");
        externalIp = strProp("external-ip");
        externalPort = intProp("external-port");
        workerList = listProp("worker-list");
        workerPort = intProp("worker-port");
        workerTag = strProp("worker-tag");
        awsRegion = strProp("aws-region");
        discoveryPollSeconds = intProp("discovery-poll-seconds");
        gridStepDegrees = doubleProp("grid-step-degrees");
        scenarioIds = listProp("scenario-ids");
        rasterIds = listProp("raster-ids");
        bucketUriPrefix = strProp("bucket-uri-prefix");
        wgs84PixelSize = doubleProp("wgs84-pixel-size");
        workspaceDirectory = strProp("workspace-directory");
        dispatchTimeoutSeconds = intProp("dispatch-timeout-seconds");
        dispatchRetryBaseMillis = intProp("dispatch-retry-base-millis");
        dispatchRetryMaxMillis = intProp("dispatch-retry-max-millis");
        lightThreads = intProp("light-threads");
        exitIfErrors();
    }

    // INTERFACE IMPLEMENTATIONS
    // Methods implementing Component and HttpController Config interfaces.
    // Note that one method can implement several Config interfaces at once.

    @Override public int          serverPort()              { return serverPort; }
    @Override public String       externalIp()              { return externalIp; }
    @Override public int          externalPort()            { return externalPort; }
    @Override public int          workerPort()              { return workerPort; }
    @Override public String       workerTag()               { return workerTag; }
    @Override public String       awsRegion()               { return awsRegion; }
    @Override public int          discoveryPollSeconds()    { return discoveryPollSeconds; }
    @Override public double       gridStepDegrees()         { return gridStepDegrees; }
    @Override public List<String> scenarioIds()             { return scenarioIds; }
    @Override public List<String> rasterIds()               { return rasterIds; }
    @Override public String       bucketUriPrefix()         { return bucketUriPrefix; }
    @Override public double       wgs84PixelSize()          { return wgs84PixelSize; }
    @Override public String       workspaceDirectory()      { return workspaceDirectory; }
    @Override public int          dispatchTimeoutSeconds()  { return dispatchTimeoutSeconds; }
    @Override public int          dispatchRetryBaseMillis() { return dispatchRetryBaseMillis; }
    @Override public int          dispatchRetryMaxMillis()  { return dispatchRetryMaxMillis; }
    @Override public int          lightThreads()            { return lightThreads; }

    /** Workers given explicitly in the config. When this is empty, workers are discovered through EC2. */
    public List<String> workerList () {
        return workerList;
    }

    public boolean useStaticWorkers () {
        return !workerList.isEmpty();
    }

    // STATIC FACTORY METHODS
    // Always use these to construct StitcherConfig objects for readability.

    public static StitcherConfig fromDefaultFile () {
        return new StitcherConfig(STITCHER_CONFIG_FILE);
    }

    public static StitcherConfig fromFile (String filename) {
        return new StitcherConfig(filename);
    }

    public static StitcherConfig fromProperties (Properties properties) {
        return new StitcherConfig(properties);
    }

}
