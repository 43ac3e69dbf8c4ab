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

import org.lendingclub.surveyor.core.JsonUtil;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * EKS clusters and their managed node groups. A cluster is priced for its
 * control plane only; each node group carries the cost of its instances.
 */
public class EKSScanner extends AWSScanner {

	public static final String SERVICE_NAME = "EKS";

	public static final String CLUSTER = "Cluster";
	public static final String NODE_GROUP = "Node Group";

	public EKSScanner(AWSScannerBuilder builder) {
		super(builder, SERVICE_NAME);
	}

	@Override
	protected void doScan(RegionScan scan) {
		section(scan, "clusters", () -> {
			List<String> names = Lists.newArrayList();
			scan.forEachItem(AwsOperations.EKS, "ListClusters", ImmutableMap.of(), "Clusters",
					name -> names.add(name.asText()));
			for (String name : names) {
				scanCluster(scan, name);
			}
		});
	}

	void scanCluster(RegionScan scan, String name) {
		JsonNode cluster = scan.call(AwsOperations.EKS, "DescribeCluster", ImmutableMap.of("Name", name))
				.path("Cluster");
		String status = JsonUtil.text(cluster, "Status").orElse(null);

		List<String> nodegroups = Lists.newArrayList();
		scan.forEachItem(AwsOperations.EKS, "ListNodegroups", ImmutableMap.of("ClusterName", name), "Nodegroups",
				ng -> nodegroups.add(ng.asText()));
		double nodegroupCost = 0;
		for (String nodegroup : nodegroups) {
			nodegroupCost += scanNodegroup(scan, name, nodegroup);
		}

		List<Map<String, Object>> logging = Lists.newArrayList();
		for (JsonNode setup : cluster.path("Logging").path("ClusterLogging")) {
			Map<String, Object> entry = Maps.newLinkedHashMap();
			entry.put("types", value(setup, "Types"));
			entry.put("enabled", setup.path("Enabled").asBoolean(false));
			logging.add(entry);
		}
		scan.add(newResource(scan, CLUSTER, JsonUtil.text(cluster, "Arn").orElse(name)).withName(name)
				.withCreatedAt(JsonUtil.instant(cluster, "CreatedAt").orElse(null))
				.withState(status)
				.withEstimatedMonthlyCost(estimateCost(AwsCostEstimator.EKS_CLUSTER, attributes("status", status)))
				.withInfo("version", value(cluster, "Version"))
				.withInfo("platformVersion", value(cluster, "PlatformVersion"))
				.withInfo("endpoint", value(cluster, "Endpoint"))
				.withInfo("nodeGroupCount", nodegroups.size())
				.withInfo("nodeGroups", nodegroups)
				.withInfo("nodeGroupCost", Math.round(nodegroupCost * 100.0) / 100.0)
				.withInfo("logging", logging.isEmpty() ? null : logging)
				.withInfo("tags", emptyToNull(tagMap(cluster, "Tags")))
				.build());
	}

	/**
	 * Adds the node group and returns its estimated monthly cost.
	 */
	double scanNodegroup(RegionScan scan, String cluster, String name) {
		JsonNode nodegroup = scan.call(AwsOperations.EKS, "DescribeNodegroup",
				ImmutableMap.of("ClusterName", cluster, "NodegroupName", name)).path("Nodegroup");
		JsonNode scaling = nodegroup.path("ScalingConfig");
		List<String> instanceTypes = Lists.newArrayList();
		nodegroup.path("InstanceTypes").forEach(it -> instanceTypes.add(it.asText()));
		if (instanceTypes.isEmpty()) {
			instanceTypes.add(AwsPricing.EKS_DEFAULT_NODE_TYPE);
		}
		String status = JsonUtil.text(nodegroup, "Status").orElse(null);
		int desired = scaling.path("DesiredSize").asInt(0);
		double cost = estimateCost(AwsCostEstimator.EKS_NODEGROUP,
				attributes("instanceType", instanceTypes.get(0), "desiredSize", desired, "status", status));
		scan.add(newResource(scan, NODE_GROUP, JsonUtil.text(nodegroup, "NodegroupArn").orElse(cluster + "/" + name))
				.withName(name)
				.withCreatedAt(JsonUtil.instant(nodegroup, "CreatedAt").orElse(null))
				.withState(status)
				.withEstimatedMonthlyCost(cost)
				.withInfo("clusterName", cluster)
				.withInfo("instanceTypes", instanceTypes)
				.withInfo("desiredSize", desired)
				.withInfo("minSize", scaling.path("MinSize").asInt(0))
				.withInfo("maxSize", scaling.path("MaxSize").asInt(0))
				.withInfo("diskSize", value(nodegroup, "DiskSize"))
				.withInfo("amiType", value(nodegroup, "AmiType"))
				.withInfo("capacityType", JsonUtil.text(nodegroup, "CapacityType").orElse("ON_DEMAND"))
				.withInfo("tags", emptyToNull(tagMap(nodegroup, "Tags")))
				.build());
		return cost;
	}
}
