package com.platform.chaosmonkey.aws;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.autoscaling.AmazonAutoScaling;
import com.amazonaws.services.autoscaling.model.DescribeAutoScalingGroupsRequest;
import com.amazonaws.services.autoscaling.model.DescribeAutoScalingGroupsResult;
import com.amazonaws.services.autoscaling.model.Instance;
import com.amazonaws.services.autoscaling.model.LifecycleState;
import com.amazonaws.services.simpledb.AmazonSimpleDB;
import com.amazonaws.services.simpledb.model.DeleteDomainRequest;
import com.amazonaws.services.simpledb.model.ListDomainsRequest;
import com.amazonaws.services.simpledb.model.ListDomainsResult;
import com.platform.chaosmonkey.error.CloudServiceException;
import com.platform.chaosmonkey.error.ResourceNotFoundException;
import com.platform.chaosmonkey.error.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Access to the AWS resources Chaos Monkey works with: the auto scaling groups
 * it breaks instances of, and the SimpleDB domain it records events in.
 * 
 * AWS credentials are taken from the default provider chain.
 */
@Slf4j
public class AwsResources {
    
    private final AwsClientFactory clientFactory;
    
    public AwsResources(AwsClientFactory clientFactory) {
        this.clientFactory = clientFactory;
    }
    
    /**
     * All auto scaling groups of a region, across every result page.
     */
    public List<AutoScalingGroup> autoScalingGroups(String region) {
        requireRegion(region);
        AmazonAutoScaling autoScaling = clientFactory.autoScaling(region);
        try {
            PagedResults<DescribeAutoScalingGroupsResult> pages = new PagedResults<>(
                token -> autoScaling.describeAutoScalingGroups(
                    new DescribeAutoScalingGroupsRequest().withNextToken(token)),
                DescribeAutoScalingGroupsResult::getNextToken);
            
            List<AutoScalingGroup> groups = new ArrayList<>();
            for (DescribeAutoScalingGroupsResult page : pages) {
                for (com.amazonaws.services.autoscaling.model.AutoScalingGroup group : page.getAutoScalingGroups()) {
                    groups.add(toAutoScalingGroup(group));
                }
            }
            log.debug("Found {} auto scaling groups in {}", groups.size(), region);
            return groups;
        } catch (AmazonClientException e) {
            throw CloudServiceException.autoScaling("DescribeAutoScalingGroups", e);
        } finally {
            autoScaling.shutdown();
        }
    }
    
    /**
     * Delete an existing SimpleDB domain.
     *
     * @throws ResourceNotFoundException if the region has no domain of that name;
     *         nothing is deleted in that case
     */
    public void deleteSimpleDbDomain(String domainName, String region) {
        requireRegion(region);
        AmazonSimpleDB simpleDb = clientFactory.simpleDb(region);
        try {
            if (!domainExists(simpleDb, domainName)) {
                throw ResourceNotFoundException.simpleDbDomain(domainName);
            }
            try {
                simpleDb.deleteDomain(new DeleteDomainRequest(domainName));
            } catch (AmazonClientException e) {
                throw CloudServiceException.simpleDb("DeleteDomain", e);
            }
            log.info("Deleted SimpleDB domain {} in {}", domainName, region);
        } finally {
            simpleDb.shutdown();
        }
    }
    
    private static boolean domainExists(AmazonSimpleDB simpleDb, String domainName) {
        PagedResults<ListDomainsResult> pages = new PagedResults<>(
            token -> simpleDb.listDomains(new ListDomainsRequest().withNextToken(token)),
            ListDomainsResult::getNextToken);
        
        try {
            for (ListDomainsResult page : pages) {
                if (page.getDomainNames().contains(domainName)) {
                    return true;
                }
            }
            return false;
        } catch (AmazonClientException e) {
            throw CloudServiceException.simpleDb("ListDomains", e);
        }
    }
    
    private static AutoScalingGroup toAutoScalingGroup(com.amazonaws.services.autoscaling.model.AutoScalingGroup group) {
        int inService = 0;
        for (Instance instance : group.getInstances()) {
            if (LifecycleState.InService.toString().equals(instance.getLifecycleState())) {
                inService++;
            }
        }
        return new AutoScalingGroup(
            group.getAutoScalingGroupName(),
            inService,
            intValue(group.getDesiredCapacity()),
            intValue(group.getMinSize()),
            intValue(group.getMaxSize())
        );
    }
    
    private static int intValue(Integer value) {
        return value == null ? 0 : value;
    }
    
    private static void requireRegion(String region) {
        if (region == null || region.isBlank()) {
            throw new ValidationException("region", "must not be blank");
        }
    }
}
