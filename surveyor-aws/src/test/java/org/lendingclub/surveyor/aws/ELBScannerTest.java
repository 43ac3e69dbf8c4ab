/**
 * Copyright 2017-2018 LendingClub, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.lendingclub.surveyor.aws;

import java.util.List;

import org.assertj.core.api.Assertions;
import org.junit.Test;
import org.lendingclub.surveyor.core.ProviderException;
import org.lendingclub.surveyor.core.Resource;
import org.lendingclub.surveyor.test.FakeCloudProvider;
import org.lendingclub.surveyor.test.SurveyorScannerTest;

public class ELBScannerTest extends SurveyorScannerTest {

	void loadBalancers() {
		provider.withPages("elasticloadbalancing", "us-east-1", "DescribeLoadBalancers",
				"{'LoadBalancerDescriptions':[{'LoadBalancerName':'old-web','DNSName':'old-web.elb.amazonaws.com',"
						+ "'Scheme':'internet-facing','VPCId':'vpc-1','AvailabilityZones':['us-east-1a','us-east-1b'],"
						+ "'Instances':[{'InstanceId':'i-1'},{'InstanceId':'i-2'}]}]}");
		provider.withPages("elasticloadbalancingv2", "us-east-1", "DescribeLoadBalancers",
				"{'LoadBalancers':[{'LoadBalancerArn':'arn:alb','LoadBalancerName':'api','Type':'application',"
						+ "'State':{'Code':'active'},'AvailabilityZones':[{'ZoneName':'us-east-1a'}]},"
						+ "{'LoadBalancerArn':'arn:nlb','LoadBalancerName':'tcp','Type':'network','State':{'Code':'provisioning'}},"
						+ "{'LoadBalancerArn':'arn:odd','LoadBalancerName':'odd','Type':'quantum','State':{'Code':'active'}}]}");
	}

	@Test
	public void testLoadBalancers() {
		loadBalancers();
		ELBScanner scanner = new AWSScannerBuilder().withCloudProvider(provider).withConfig(config)
				.build(ELBScanner.class);
		List<Resource> resources = scanner.scanRegion("us-east-1");
		Assertions.assertThat(resources).hasSize(4);

		Resource classic = find(resources, "old-web");
		Assertions.assertThat(classic.getType()).isEqualTo(ELBScanner.CLASSIC_LOAD_BALANCER);
		Assertions.assertThat(classic.getState()).contains("active");
		Assertions.assertThat(classic.getAdditionalInfo()).containsEntry("instanceCount", 2)
				.containsEntry("vpcId", "vpc-1").containsEntry("dnsName", "old-web.elb.amazonaws.com");
		assertCost(classic, 25.0);

		Resource alb = find(resources, "arn:alb");
		Assertions.assertThat(alb.getType()).isEqualTo("Application Load Balancer");
		Assertions.assertThat(alb.getName()).contains("api");
		assertCost(alb, 23.0);

		Resource nlb = find(resources, "arn:nlb");
		Assertions.assertThat(nlb.getType()).isEqualTo("Network Load Balancer");
		assertCost(nlb, 0.0);

		Resource odd = find(resources, "arn:odd");
		Assertions.assertThat(odd.getType()).isEqualTo(ELBScanner.UNKNOWN);
		assertCost(odd, 0.0);
	}

	@Test
	public void testClassicDenied() {
		loadBalancers();
		provider.withError("elasticloadbalancing", FakeCloudProvider.ANY_REGION, "DescribeLoadBalancers",
				new ProviderException("AccessDenied", "User is not authorized"));
		ELBScanner scanner = new AWSScannerBuilder().withCloudProvider(provider).withConfig(config)
				.build(ELBScanner.class);
		Assertions.assertThat(scanner.scanRegion("us-east-1")).extracting(Resource::getId)
				.containsExactly("arn:alb", "arn:nlb", "arn:odd");
	}
}
