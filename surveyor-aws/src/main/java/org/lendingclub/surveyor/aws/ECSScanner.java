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
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;

/**
 * ECS clusters and the services running in them. Fargate services are priced
 * per task; services on EC2 capacity are already paid for as instances.
 */
public class ECSScanner extends AWSScanner {

	public static final String SERVICE_NAME = "ECS";

	public static final String CLUSTER = "Cluster";
	public static final String SERVICE = "Service";

	// most names DescribeClusters and DescribeServices accept per call
	static final int CLUSTER_BATCH_SIZE = 100;
	static final int SERVICE_BATCH_SIZE = 10;

	public ECSScanner(AWSScannerBuilder builder) {
		super(builder, SERVICE_NAME);
	}

	@Override
	protected void doScan(RegionScan scan) {
		section(scan, "clusters", () -> scanClusters(scan));
	}

	void scanClusters(RegionScan scan) {
		List<String> arns = Lists.newArrayList();
		scan.forEachItem(AwsOperations.ECS, "ListClusters", ImmutableMap.of(), "ClusterArns",
				arn -> arns.add(arn.asText()));
		for (List<String> batch : Lists.partition(arns, CLUSTER_BATCH_SIZE)) {
			JsonNode page = scan.call(AwsOperations.ECS, "DescribeClusters", ImmutableMap.of("Clusters", batch));
			for (JsonNode cluster : page.path("Clusters")) {
				String arn = cluster.path("ClusterArn").asText();
				String name = cluster.path("ClusterName").asText();
				Map<String, String> tags = tags(cluster);
				int runningTasks = cluster.path("RunningTasksCount").asInt(0);
				scan.add(newResource(scan, CLUSTER, arn).withName(tags.getOrDefault("Name", name))
						.withState(JsonUtil.text(cluster, "Status").orElse(null))
						.withEstimatedMonthlyCost(estimateCost(AwsCostEstimator.ECS_CLUSTER,
								attributes("runningTasksCount", runningTasks)))
						.withInfo("clusterName", name)
						.withInfo("runningTasksCount", runningTasks)
						.withInfo("pendingTasksCount", cluster.path("PendingTasksCount").asInt(0))
						.withInfo("activeServicesCount", cluster.path("ActiveServicesCount").asInt(0))
						.withInfo("registeredContainerInstancesCount",
								cluster.path("RegisteredContainerInstancesCount").asInt(0))
						.withInfo("capacityProviders", value(cluster, "CapacityProviders"))
						.withInfo("tags", tags.isEmpty() ? null : tags)
						.build());
				scanServices(scan, arn);
			}
		}
	}

	void scanServices(RegionScan scan, String clusterArn) {
		List<String> arns = Lists.newArrayList();
		scan.forEachItem(AwsOperations.ECS, "ListServices", ImmutableMap.of("Cluster", clusterArn), "ServiceArns",
				arn -> arns.add(arn.asText()));
		for (List<String> batch : Lists.partition(arns, SERVICE_BATCH_SIZE)) {
			JsonNode page = scan.call(AwsOperations.ECS, "DescribeServices",
					ImmutableMap.of("Cluster", clusterArn, "Services", batch));
			for (JsonNode service : page.path("Services")) {
				String name = service.path("ServiceName").asText();
				Map<String, String> tags = tags(service);
				String launchType = JsonUtil.text(service, "LaunchType").orElse("EC2");
				int desired = service.path("DesiredCount").asInt(0);
				String taskDefinition = JsonUtil.text(service, "TaskDefinition").orElse(null);
				scan.add(newResource(scan, SERVICE, JsonUtil.text(service, "ServiceArn").orElse(name))
						.withName(tags.getOrDefault("Name", name))
						.withCreatedAt(JsonUtil.instant(service, "CreatedAt").orElse(null))
						.withState(JsonUtil.text(service, "Status").orElse(null))
						.withEstimatedMonthlyCost(estimateCost(AwsCostEstimator.ECS_SERVICE,
								attributes("launchType", launchType, "desiredCount", desired)))
						.withInfo("clusterArn", clusterArn)
						.withInfo("serviceName", name)
						.withInfo("launchType", launchType)
						.withInfo("desiredCount", desired)
						.withInfo("runningCount", service.path("RunningCount").asInt(0))
						.withInfo("pendingCount", service.path("PendingCount").asInt(0))
						.withInfo("taskDefinition", taskDefinition == null ? null
								: Iterables.getLast(Splitter.on('/').split(taskDefinition)))
						.withInfo("deploymentController", value(service.path("DeploymentController"), "Type"))
						.withInfo("tags", tags.isEmpty() ? null : tags)
						.build());
			}
		}
	}
}
