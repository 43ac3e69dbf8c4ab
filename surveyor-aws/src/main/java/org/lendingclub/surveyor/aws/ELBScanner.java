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
import java.util.Locale;
import java.util.Map;

import org.lendingclub.surveyor.core.JsonUtil;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

/**
 * Classic load balancers and application, network and gateway load balancers.
 * Both APIs are scanned as sections of the ELB service.
 */
public class ELBScanner extends AWSScanner {

	public static final String SERVICE_NAME = "ELB";

	public static final String CLASSIC_LOAD_BALANCER = "Classic Load Balancer";
	public static final String UNKNOWN = "Unknown";

	public static final Map<String, String> LOAD_BALANCER_TYPES = ImmutableMap.of("application",
			"Application Load Balancer", "network", "Network Load Balancer", "gateway", "Gateway Load Balancer");

	public ELBScanner(AWSScannerBuilder builder) {
		super(builder, SERVICE_NAME);
	}

	@Override
	protected void doScan(RegionScan scan) {
		section(scan, "classic load balancers", () -> scanClassic(scan));
		section(scan, "load balancers", () -> scanV2(scan));
	}

	void scanClassic(RegionScan scan) {
		scan.forEachItem(AwsOperations.ELB, "DescribeLoadBalancers", ImmutableMap.of(), "LoadBalancerDescriptions",
				lb -> {
					String name = lb.path("LoadBalancerName").asText();
					scan.add(newResource(scan, CLASSIC_LOAD_BALANCER, name).withName(name)
							.withCreatedAt(JsonUtil.instant(lb, "CreatedTime").orElse(null))
							.withState("active")
							.withEstimatedMonthlyCost(
									estimateCost(AwsCostEstimator.ELB_CLASSIC, attributes()))
							.withInfo("dnsName", value(lb, "DNSName"))
							.withInfo("scheme", value(lb, "Scheme"))
							.withInfo("vpcId", value(lb, "VPCId"))
							.withInfo("availabilityZones", value(lb, "AvailabilityZones"))
							.withInfo("instanceCount", lb.path("Instances").size())
							.build());
				});
	}

	void scanV2(RegionScan scan) {
		scan.forEachItem(AwsOperations.ELBV2, "DescribeLoadBalancers", ImmutableMap.of(), "LoadBalancers", lb -> {
			String type = lb.path("Type").asText().toLowerCase(Locale.ROOT);
			String state = lb.path("State").path("Code").asText();
			List<String> zones = Lists.newArrayList();
			for (JsonNode zone : lb.path("AvailabilityZones")) {
				JsonUtil.text(zone, "ZoneName").ifPresent(zones::add);
			}
			String name = JsonUtil.text(lb, "LoadBalancerName").orElse(null);
			scan.add(newResource(scan, LOAD_BALANCER_TYPES.getOrDefault(type, UNKNOWN),
					JsonUtil.text(lb, "LoadBalancerArn").orElse(name))
					.withName(name)
					.withCreatedAt(JsonUtil.instant(lb, "CreatedTime").orElse(null))
					.withState(state)
					.withEstimatedMonthlyCost(
							estimateCost(AwsCostEstimator.ELB_V2, attributes("type", type, "state", state)))
					.withInfo("dnsName", value(lb, "DNSName"))
					.withInfo("scheme", value(lb, "Scheme"))
					.withInfo("vpcId", value(lb, "VpcId"))
					.withInfo("availabilityZones", zones)
					.withInfo("ipAddressType", value(lb, "IpAddressType"))
					.build());
		});
	}
}
