package com.conveyal.stitcher.components.discovery;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.AmazonEC2ClientBuilder;
import com.amazonaws.services.ec2.model.DescribeInstancesRequest;
import com.amazonaws.services.ec2.model.DescribeInstancesResult;
import com.amazonaws.services.ec2.model.Filter;
import com.amazonaws.services.ec2.model.Instance;
import com.amazonaws.services.ec2.model.Reservation;
import com.amazonaws.services.ec2.model.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds workers among the running EC2 instances in one region. An instance is a worker if any of its tags has the
 * configured worker tag as its value, and it is addressed on its private IP at the configured worker port.
 */
public class Ec2WorkerHostSource implements WorkerHostSource {

    private static final Logger LOG = LoggerFactory.getLogger(Ec2WorkerHostSource.class);

    public interface Config {
        String awsRegion ();
        String workerTag ();
        int workerPort ();
    }

    private final AmazonEC2 ec2;
    private final String workerTag;
    private final int workerPort;

    public Ec2WorkerHostSource (Config config) {
        this(AmazonEC2ClientBuilder.standard().withRegion(config.awsRegion()).build(), config);
    }

    public Ec2WorkerHostSource (AmazonEC2 ec2, Config config) {
        this.ec2 = ec2;
        this.workerTag = config.workerTag();
        this.workerPort = config.workerPort();
    }

    @Override
    public Set<String> activeHosts () throws DiscoveryException {
        Set<String> hosts = new HashSet<>();
        DescribeInstancesRequest request = new DescribeInstancesRequest()
                .withFilters(new Filter("instance-state-name").withValues("running"));
        try {
            DescribeInstancesResult result;
            do {
                result = ec2.describeInstances(request);
                for (Reservation reservation : result.getReservations()) {
                    for (Instance instance : reservation.getInstances()) {
                        String host = workerHost(instance);
                        if (host != null) hosts.add(host);
                    }
                }
                request.setNextToken(result.getNextToken());
            } while (result.getNextToken() != null);
        } catch (AmazonClientException e) {
            throw new DiscoveryException("Could not describe EC2 instances.", e);
        }
        return hosts;
    }

    /** @return the address of the instance if it is a running worker, otherwise null. */
    String workerHost (Instance instance) {
        List<Tag> tags = instance.getTags();
        if (tags == null || tags.stream().noneMatch(tag -> workerTag.equals(tag.getValue()))) {
            return null;
        }
        if (instance.getState() == null || !"running".equals(instance.getState().getName())) {
            return null;
        }
        String privateIp = instance.getPrivateIpAddress();
        if (privateIp == null || privateIp.isEmpty()) {
            LOG.warn("Skipping worker instance {} which has no private IP address.", instance.getInstanceId());
            return null;
        }
        return privateIp + ":" + workerPort;
    }

}
