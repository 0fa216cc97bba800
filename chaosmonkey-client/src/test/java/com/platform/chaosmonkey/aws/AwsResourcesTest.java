package com.platform.chaosmonkey.aws;

import com.amazonaws.AmazonServiceException;
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
import com.platform.chaosmonkey.error.ErrorCode;
import com.platform.chaosmonkey.error.ResourceNotFoundException;
import com.platform.chaosmonkey.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AwsResourcesTest {
    
    @Mock
    private AmazonAutoScaling autoScaling;
    
    @Mock
    private AmazonSimpleDB simpleDb;
    
    private AwsResources resources;
    
    @BeforeEach
    void setUp() {
        AwsClientFactory factory = new AwsClientFactory() {
            @Override
            public AmazonAutoScaling autoScaling(String region) {
                return autoScaling;
            }
            
            @Override
            public AmazonSimpleDB simpleDb(String region) {
                return simpleDb;
            }
        };
        resources = new AwsResources(factory);
    }
    
    private static Instance instance(LifecycleState state) {
        return new Instance().withInstanceId("i-" + state).withLifecycleState(state);
    }
    
    private static com.amazonaws.services.autoscaling.model.AutoScalingGroup group(String name, Instance... instances) {
        return new com.amazonaws.services.autoscaling.model.AutoScalingGroup()
            .withAutoScalingGroupName(name)
            .withDesiredCapacity(3)
            .withMinSize(1)
            .withMaxSize(5)
            .withInstances(instances);
    }
    
    @Test
    void autoScalingGroupsCollectsEveryPage() {
        DescribeAutoScalingGroupsResult first = new DescribeAutoScalingGroupsResult()
            .withAutoScalingGroups(group("web",
                instance(LifecycleState.InService),
                instance(LifecycleState.Pending),
                instance(LifecycleState.InService)))
            .withNextToken("page-2");
        DescribeAutoScalingGroupsResult second = new DescribeAutoScalingGroupsResult()
            .withAutoScalingGroups(group("worker", instance(LifecycleState.Terminating)));
        when(autoScaling.describeAutoScalingGroups(any(DescribeAutoScalingGroupsRequest.class))).thenAnswer(invocation -> {
            DescribeAutoScalingGroupsRequest request = invocation.getArgument(0);
            return request.getNextToken() == null ? first : second;
        });
        
        List<AutoScalingGroup> groups = resources.autoScalingGroups("us-east-1");
        
        assertThat(groups).containsExactly(
            new AutoScalingGroup("web", 2, 3, 1, 5),
            new AutoScalingGroup("worker", 0, 3, 1, 5));
        verify(autoScaling).shutdown();
    }
    
    @Test
    void autoScalingFailureIsWrapped() {
        when(autoScaling.describeAutoScalingGroups(any(DescribeAutoScalingGroupsRequest.class)))
            .thenThrow(new AmazonServiceException("Rate exceeded"));
        
        assertThatThrownBy(() -> resources.autoScalingGroups("us-east-1"))
            .isInstanceOfSatisfying(CloudServiceException.class, e -> {
                assertThat(e.getErrorCode()).isEqualTo(ErrorCode.AWS_SERVICE_ERROR);
                assertThat(e.getServiceName()).isEqualTo("autoscaling");
            });
        verify(autoScaling).shutdown();
    }
    
    @Test
    void deleteSimpleDbDomainDeletesExistingDomain() {
        when(simpleDb.listDomains(any(ListDomainsRequest.class))).thenAnswer(invocation -> {
            ListDomainsRequest request = invocation.getArgument(0);
            return request.getNextToken() == null
                ? new ListDomainsResult().withDomainNames("other").withNextToken("more")
                : new ListDomainsResult().withDomainNames("SIMIAN_ARMY");
        });
        
        resources.deleteSimpleDbDomain("SIMIAN_ARMY", "us-east-1");
        
        ArgumentCaptor<DeleteDomainRequest> captor = ArgumentCaptor.forClass(DeleteDomainRequest.class);
        verify(simpleDb).deleteDomain(captor.capture());
        assertThat(captor.getValue().getDomainName()).isEqualTo("SIMIAN_ARMY");
        verify(simpleDb).shutdown();
    }
    
    @Test
    void deleteMissingDomainFailsWithoutDeleting() {
        when(simpleDb.listDomains(any(ListDomainsRequest.class)))
            .thenReturn(new ListDomainsResult().withDomainNames("other"));
        
        assertThatThrownBy(() -> resources.deleteSimpleDbDomain("SIMIAN_ARMY", "us-east-1"))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessage("SimpleDB domain \"SIMIAN_ARMY\" does not exist");
        verify(simpleDb, never()).deleteDomain(any(DeleteDomainRequest.class));
    }
    
    @Test
    void listingFailureNamesListDomains() {
        when(simpleDb.listDomains(any(ListDomainsRequest.class)))
            .thenThrow(new AmazonServiceException("Access denied"));
        
        assertThatThrownBy(() -> resources.deleteSimpleDbDomain("SIMIAN_ARMY", "us-east-1"))
            .isInstanceOfSatisfying(CloudServiceException.class, e -> {
                assertThat(e.getServiceName()).isEqualTo("simpledb");
                assertThat(e.getOperation()).isEqualTo("ListDomains");
            });
        verify(simpleDb, never()).deleteDomain(any(DeleteDomainRequest.class));
        verify(simpleDb).shutdown();
    }
    
    @Test
    void deleteFailureNamesDeleteDomain() {
        when(simpleDb.listDomains(any(ListDomainsRequest.class)))
            .thenReturn(new ListDomainsResult().withDomainNames("SIMIAN_ARMY"));
        when(simpleDb.deleteDomain(any(DeleteDomainRequest.class)))
            .thenThrow(new AmazonServiceException("Throttled"));
        
        assertThatThrownBy(() -> resources.deleteSimpleDbDomain("SIMIAN_ARMY", "us-east-1"))
            .isInstanceOfSatisfying(CloudServiceException.class,
                e -> assertThat(e.getOperation()).isEqualTo("DeleteDomain"));
    }
    
    @Test
    void regionIsRequired() {
        assertThatThrownBy(() -> resources.autoScalingGroups(" "))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> resources.deleteSimpleDbDomain("SIMIAN_ARMY", null))
            .isInstanceOf(ValidationException.class);
        verify(simpleDb, never()).listDomains(any(ListDomainsRequest.class));
    }
}
