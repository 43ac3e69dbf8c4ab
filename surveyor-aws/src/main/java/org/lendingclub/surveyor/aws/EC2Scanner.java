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
import java.util.Map;
import java.util.Set;

import org.lendingclub.surveyor.core.JsonUtil;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

/**
 * EC2 instances, EBS volumes, EBS snapshots owned by the account, Elastic IPs
 * and NAT gateways.
 */
public class EC2Scanner extends AWSScanner {

	public static final String SERVICE_NAME = "EC2";

	public static final String INSTANCE = "Instance";
	public static final String EBS_VOLUME = "EBS Volume";
	public static final String SNAPSHOT = "Snapshot";
	public static final String ELASTIC_IP = "Elastic IP";
	public static final String NAT_GATEWAY = "NAT Gateway";

	static final Set<String> GONE_NAT_GATEWAY_STATES = ImmutableSet.of("deleted", "deleting", "failed");

	public EC2Scanner(AWSScannerBuilder builder) {
		super(builder, SERVICE_NAME);
	}

	@Override
	protected void doScan(RegionScan scan) {
		section(scan, "instances", () -> scanInstances(scan));
		section(scan, "volumes", () -> scanVolumes(scan));
		section(scan, "snapshots", () -> scanSnapshots(scan));
		section(scan, "elastic ips", () -> scanElasticIps(scan));
		section(scan, "nat gateways", () -> scanNatGateways(scan));
	}

	void scanInstances(RegionScan scan) {
		scan.forEachItem(AwsOperations.EC2, "DescribeInstances", ImmutableMap.of(), "Reservations", reservation -> {
			for (JsonNode instance : reservation.path("Instances")) {
				String state = instance.path("State").path("Name").asText();
				if ("terminated".equals(state)) {
					continue;
				}
				String instanceType = instance.path("InstanceType").asText();
				scan.add(newResource(scan, INSTANCE, instance.path("InstanceId").asText())
						.withName(tags(instance).get("Name"))
						.withCreatedAt(JsonUtil.instant(instance, "LaunchTime").orElse(null))
						.withState(state)
						.withEstimatedMonthlyCost(estimateCost(AwsCostEstimator.EC2_INSTANCE,
								attributes("instanceType", instanceType, "state", state)))
						.withInfo("instanceType", instanceType)
						.withInfo("publicIp", value(instance, "PublicIpAddress"))
						.withInfo("privateIp", value(instance, "PrivateIpAddress"))
						.withInfo("vpcId", value(instance, "VpcId"))
						.withInfo("subnetId", value(instance, "SubnetId"))
						.withInfo("availabilityZone", value(instance.path("Placement"), "AvailabilityZone"))
						.withInfo("platform", value(instance, "Platform"))
						.withInfo("architecture", value(instance, "Architecture"))
						.build());
			}
		});
	}

	void scanVolumes(RegionScan scan) {
		scan.forEachItem(AwsOperations.EC2, "DescribeVolumes", ImmutableMap.of(), "Volumes", volume -> {
			String state = volume.path("State").asText();
			if ("deleted".equals(state)) {
				return;
			}
			String volumeType = JsonUtil.text(volume, "VolumeType").orElse("gp2");
			int size = volume.path("Size").asInt(0);
			scan.add(newResource(scan, EBS_VOLUME, volume.path("VolumeId").asText())
					.withName(tags(volume).get("Name"))
					.withCreatedAt(JsonUtil.instant(volume, "CreateTime").orElse(null))
					.withState(state)
					.withEstimatedMonthlyCost(estimateCost(AwsCostEstimator.EC2_VOLUME,
							attributes("volumeType", volumeType, "size", size)))
					.withInfo("volumeType", volumeType)
					.withInfo("size", size)
					.withInfo("iops", value(volume, "Iops"))
					.withInfo("throughput", value(volume, "Throughput"))
					.withInfo("encrypted", value(volume, "Encrypted"))
					.withInfo("availabilityZone", value(volume, "AvailabilityZone"))
					.withInfo("attachments", volume.path("Attachments").size())
					.build());
		});
	}

	void scanSnapshots(RegionScan scan) {
		scan.forEachItem(AwsOperations.EC2, "DescribeSnapshots", ImmutableMap.of("OwnerIds", "self"), "Snapshots",
				snapshot -> {
					String description = JsonUtil.text(snapshot, "Description").orElse(null);
					String name = tags(snapshot).get("Name");
					int size = snapshot.path("VolumeSize").asInt(0);
					scan.add(newResource(scan, SNAPSHOT, snapshot.path("SnapshotId").asText())
							.withName(name != null ? name : description)
							.withCreatedAt(JsonUtil.instant(snapshot, "StartTime").orElse(null))
							.withState(JsonUtil.text(snapshot, "State").orElse(null))
							.withEstimatedMonthlyCost(
									estimateCost(AwsCostEstimator.EC2_SNAPSHOT, attributes("size", size)))
							.withInfo("volumeId", value(snapshot, "VolumeId"))
							.withInfo("volumeSize", size)
							.withInfo("progress", value(snapshot, "Progress"))
							.withInfo("encrypted", value(snapshot, "Encrypted"))
							.withInfo("description", description)
							.build());
				});
	}

	void scanElasticIps(RegionScan scan) {
		scan.forEachItem(AwsOperations.EC2, "DescribeAddresses", ImmutableMap.of(), "Addresses", address -> {
			boolean attached = JsonUtil.text(address, "InstanceId").isPresent()
					|| JsonUtil.text(address, "AssociationId").isPresent();
			String id = JsonUtil.text(address, "AllocationId").orElse(address.path("PublicIp").asText());
			scan.add(newResource(scan, ELASTIC_IP, id)
					.withName(tags(address).get("Name"))
					.withState(attached ? "attached" : "unattached")
					.withEstimatedMonthlyCost(
							estimateCost(AwsCostEstimator.EC2_ELASTIC_IP, attributes("attached", attached)))
					.withInfo("publicIp", value(address, "PublicIp"))
					.withInfo("domain", value(address, "Domain"))
					.withInfo("instanceId", value(address, "InstanceId"))
					.withInfo("networkInterfaceId", value(address, "NetworkInterfaceId"))
					.withInfo("privateIpAddress", value(address, "PrivateIpAddress"))
					.build());
		});
	}

	void scanNatGateways(RegionScan scan) {
		scan.forEachItem(AwsOperations.EC2, "DescribeNatGateways", ImmutableMap.of(), "NatGateways", gateway -> {
			String state = gateway.path("State").asText();
			if (GONE_NAT_GATEWAY_STATES.contains(state)) {
				return;
			}
			List<String> publicIps = Lists.newArrayList();
			for (JsonNode address : gateway.path("NatGatewayAddresses")) {
				JsonUtil.text(address, "PublicIp").ifPresent(publicIps::add);
			}
			Map<String, String> tags = tags(gateway);
			scan.add(newResource(scan, NAT_GATEWAY, gateway.path("NatGatewayId").asText())
					.withName(tags.get("Name"))
					.withCreatedAt(JsonUtil.instant(gateway, "CreateTime").orElse(null))
					.withState(state)
					.withEstimatedMonthlyCost(
							estimateCost(AwsCostEstimator.EC2_NAT_GATEWAY, attributes("state", state)))
					.withInfo("vpcId", value(gateway, "VpcId"))
					.withInfo("subnetId", value(gateway, "SubnetId"))
					.withInfo("connectivityType", value(gateway, "ConnectivityType"))
					.withInfo("natGatewayAddresses", publicIps)
					.build());
		});
	}
}
