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

import java.time.Instant;
import java.util.List;

import org.assertj.core.api.Assertions;
import org.junit.Before;
import org.junit.Test;
import org.lendingclub.surveyor.core.ProviderException;
import org.lendingclub.surveyor.core.Resource;
import org.lendingclub.surveyor.test.FakeCloudProvider;
import org.lendingclub.surveyor.test.SurveyorScannerTest;

public class EC2ScannerTest extends SurveyorScannerTest {

	EC2Scanner scanner;

	@Before
	public void setUpScanner() {
		scanner = new AWSScannerBuilder().withCloudProvider(provider).withConfig(config).build(EC2Scanner.class);

		provider.withPages("ec2", "us-east-1", "DescribeInstances",
				"{'Reservations':[{'Instances':["
						+ "{'InstanceId':'i-1','InstanceType':'t3.micro','State':{'Name':'running'},"
						+ "'Tags':[{'Key':'Name','Value':'web'}],'Placement':{'AvailabilityZone':'us-east-1a'},"
						+ "'VpcId':'vpc-1','PrivateIpAddress':'10.0.0.1','LaunchTime':1500000000000},"
						+ "{'InstanceId':'i-2','InstanceType':'t3.micro','State':{'Name':'terminated'}}]}]}",
				"{'Reservations':[{'Instances':[{'InstanceId':'i-3','InstanceType':'m5.large','State':{'Name':'stopped'}}]}]}");
		provider.withPages("ec2", "us-east-1", "DescribeVolumes",
				"{'Volumes':[{'VolumeId':'vol-1','VolumeType':'gp3','Size':100,'State':'in-use',"
						+ "'Attachments':[{'InstanceId':'i-1'}],'Encrypted':true},"
						+ "{'VolumeId':'vol-2','Size':10,'State':'deleted'},"
						+ "{'VolumeId':'vol-3','Size':10,'State':'available'}]}");
		provider.withPages("ec2", "us-east-1", "DescribeSnapshots",
				"{'Snapshots':[{'SnapshotId':'snap-1','VolumeSize':100,'State':'completed',"
						+ "'Description':'nightly backup','StartTime':'2020-01-01T00:00:00Z'}]}");
		provider.withPages("ec2", "us-east-1", "DescribeAddresses",
				"{'Addresses':[{'AllocationId':'eipalloc-1','PublicIp':'1.2.3.4','Domain':'vpc'},"
						+ "{'AllocationId':'eipalloc-2','PublicIp':'1.2.3.5','InstanceId':'i-1'}]}");
		provider.withPages("ec2", "us-east-1", "DescribeNatGateways",
				"{'NatGateways':[{'NatGatewayId':'nat-1','State':'available','VpcId':'vpc-1',"
						+ "'NatGatewayAddresses':[{'PublicIp':'5.6.7.8'}]},"
						+ "{'NatGatewayId':'nat-2','State':'deleted'}]}");
	}

	@Test
	public void testInstances() {
		List<Resource> resources = scanner.scanRegion("us-east-1");

		Resource web = find(resources, "i-1");
		Assertions.assertThat(web.getType()).isEqualTo(EC2Scanner.INSTANCE);
		Assertions.assertThat(web.getService()).isEqualTo("EC2");
		Assertions.assertThat(web.getRegion()).isEqualTo("us-east-1");
		Assertions.assertThat(web.getName()).contains("web");
		Assertions.assertThat(web.getState()).contains("running");
		Assertions.assertThat(web.getCreatedAt()).contains(Instant.ofEpochMilli(1500000000000L));
		Assertions.assertThat(web.getAdditionalInfo()).containsEntry("instanceType", "t3.micro")
				.containsEntry("availabilityZone", "us-east-1a").containsEntry("vpcId", "vpc-1")
				.containsEntry("privateIp", "10.0.0.1").doesNotContainKey("publicIp");
		assertCost(web, 7.5);

		assertCost(find(resources, "i-3"), 0.0);
		Assertions.assertThat(resources).extracting(Resource::getId).doesNotContain("i-2");
	}

	@Test
	public void testStorage() {
		List<Resource> resources = scanner.scanRegion("us-east-1");

		Resource volume = find(resources, "vol-1");
		Assertions.assertThat(volume.getType()).isEqualTo(EC2Scanner.EBS_VOLUME);
		Assertions.assertThat(volume.getAdditionalInfo()).containsEntry("attachments", 1)
				.containsEntry("encrypted", true).containsEntry("volumeType", "gp3");
		assertCost(volume, 8.0);

		// gp2 when the type is missing
		assertCost(find(resources, "vol-3"), 1.0);
		Assertions.assertThat(resources).extracting(Resource::getId).doesNotContain("vol-2");

		Resource snapshot = find(resources, "snap-1");
		Assertions.assertThat(snapshot.getName()).contains("nightly backup");
		Assertions.assertThat(snapshot.getCreatedAt()).contains(Instant.parse("2020-01-01T00:00:00Z"));
		assertCost(snapshot, 5.0);
	}

	@Test
	public void testNetwork() {
		List<Resource> resources = scanner.scanRegion("us-east-1");

		Resource idle = find(resources, "eipalloc-1");
		Assertions.assertThat(idle.getState()).contains("unattached");
		assertCost(idle, 3.6);
		Resource used = find(resources, "eipalloc-2");
		Assertions.assertThat(used.getState()).contains("attached");
		assertCost(used, 0.0);

		Resource nat = find(resources, "nat-1");
		Assertions.assertThat(nat.getType()).isEqualTo(EC2Scanner.NAT_GATEWAY);
		Assertions.assertThat((List<Object>) nat.getAdditionalInfo().get("natGatewayAddresses")).containsExactly("5.6.7.8");
		assertCost(nat, 45.0);
		Assertions.assertThat(resources).extracting(Resource::getId).doesNotContain("nat-2");

		Assertions.assertThat(resources).hasSize(8);
	}

	@Test
	public void testPaginationFetchesEveryPage() {
		scanner.scanRegion("us-east-1");
		Assertions.assertThat(provider.getCallCount("ec2", "us-east-1", "DescribeInstances")).isEqualTo(2);
	}

	@Test
	public void testDeniedSectionIsSkipped() {
		provider.withError("ec2", FakeCloudProvider.ANY_REGION, "DescribeSnapshots",
				new ProviderException("UnauthorizedOperation", "not allowed"));
		List<Resource> resources = scanner.scanRegion("us-east-1");
		Assertions.assertThat(resources).extracting(Resource::getId).contains("i-1", "vol-1", "nat-1")
				.doesNotContain("snap-1");
	}

	@Test
	public void testEverySectionDenied() {
		for (String operation : new String[] { "DescribeInstances", "DescribeVolumes", "DescribeSnapshots",
				"DescribeAddresses", "DescribeNatGateways" }) {
			provider.withError("ec2", FakeCloudProvider.ANY_REGION, operation,
					new ProviderException("UnauthorizedOperation", "not allowed"));
		}
		Assertions.assertThatThrownBy(() -> scanner.scanRegion("us-east-1")).isInstanceOf(ProviderException.class)
				.hasMessageContaining("not allowed");
	}

	@Test
	public void testOtherErrorsFailTheRegion() {
		provider.withError("ec2", "us-east-1", "DescribeVolumes", new ProviderException("InternalError", "boom"));
		Assertions.assertThatThrownBy(() -> scanner.scanRegion("us-east-1")).isInstanceOf(ProviderException.class)
				.hasMessageContaining("boom");
	}

	@Test
	public void testEmptyRegion() {
		Assertions.assertThat(scanner.scanRegion("eu-west-1")).isEmpty();
	}
}
