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

public class ECSScannerTest extends SurveyorScannerTest {

	ECSScanner scanner() {
		return new AWSScannerBuilder().withCloudProvider(provider).withConfig(config).build(ECSScanner.class);
	}

	void clusters() {
		provider.withPages("ecs", "us-east-1", "ListClusters", "{'ClusterArns':['arn:ecs:cluster/web']}");
		provider.withPages("ecs", "us-east-1", "DescribeClusters",
				"{'Clusters':[{'ClusterArn':'arn:ecs:cluster/web','ClusterName':'web','Status':'ACTIVE',"
						+ "'RunningTasksCount':3,'PendingTasksCount':1,'ActiveServicesCount':2,"
						+ "'RegisteredContainerInstancesCount':0,'CapacityProviders':['FARGATE'],"
						+ "'Tags':[{'Key':'team','Value':'platform'}]}]}");
		provider.withPages("ecs", "us-east-1", "ListServices",
				"{'ServiceArns':['arn:ecs:service/web/api','arn:ecs:service/web/worker']}");
		provider.withHandler("ecs", "us-east-1", "DescribeServices", params -> {
			Assertions.assertThat(params.get("Cluster")).isEqualTo("arn:ecs:cluster/web");
			return json("{'Services':[{'ServiceArn':'arn:ecs:service/web/api','ServiceName':'api','Status':'ACTIVE',"
					+ "'LaunchType':'FARGATE','DesiredCount':2,'RunningCount':2,"
					+ "'TaskDefinition':'arn:ecs:task-definition/api:7','DeploymentController':{'Type':'ECS'},"
					+ "'Tags':[{'Key':'Name','Value':'Public API'}]},"
					+ "{'ServiceArn':'arn:ecs:service/web/worker','ServiceName':'worker','Status':'ACTIVE',"
					+ "'DesiredCount':4,'RunningCount':3}]}");
		});
	}

	@Test
	public void testClustersAndServices() {
		clusters();
		List<Resource> resources = scanner().scanRegion("us-east-1");
		Assertions.assertThat(resources).hasSize(3);

		Resource cluster = find(resources, "arn:ecs:cluster/web");
		Assertions.assertThat(cluster.getType()).isEqualTo(ECSScanner.CLUSTER);
		Assertions.assertThat(cluster.getName()).contains("web");
		Assertions.assertThat(cluster.getState()).contains("ACTIVE");
		Assertions.assertThat(cluster.getAdditionalInfo()).containsEntry("runningTasksCount", 3)
				.containsEntry("activeServicesCount", 2).containsKey("tags");
		assertCost(cluster, 3 * AwsPricing.ECS_TASK_MONTHLY);

		Resource api = find(resources, "arn:ecs:service/web/api");
		Assertions.assertThat(api.getType()).isEqualTo(ECSScanner.SERVICE);
		Assertions.assertThat(api.getName()).contains("Public API");
		Assertions.assertThat(api.getAdditionalInfo()).containsEntry("launchType", "FARGATE")
				.containsEntry("taskDefinition", "api:7").containsEntry("deploymentController", "ECS")
				.containsEntry("clusterArn", "arn:ecs:cluster/web");
		assertCost(api, 2 * AwsPricing.ECS_TASK_MONTHLY);

		Resource worker = find(resources, "arn:ecs:service/web/worker");
		Assertions.assertThat(worker.getAdditionalInfo()).containsEntry("launchType", "EC2")
				.containsEntry("desiredCount", 4).doesNotContainKey("tags");
		assertCost(worker, 0.0);
	}

	@Test
	public void testNoClusters() {
		Assertions.assertThat(scanner().scanRegion("us-east-1")).isEmpty();
		Assertions.assertThat(provider.getCallCount("ecs", "us-east-1", "DescribeClusters")).isEqualTo(0);
	}

	@Test
	public void testDenied() {
		clusters();
		provider.withError("ecs", FakeCloudProvider.ANY_REGION, "ListClusters",
				new ProviderException("AccessDeniedException", "User is not authorized"));
		Assertions.assertThatThrownBy(() -> scanner().scanRegion("us-east-1"))
				.hasMessageContaining("not authorized");
	}
}
