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

import org.assertj.core.api.Assertions;
import org.junit.Test;
import org.lendingclub.surveyor.core.Resource;
import org.lendingclub.surveyor.test.SurveyorScannerTest;

public class EKSScannerTest extends SurveyorScannerTest {

	EKSScanner scanner() {
		return new AWSScannerBuilder().withCloudProvider(provider).withConfig(config).build(EKSScanner.class);
	}

	@Test
	public void testClustersAndNodeGroups() {
		provider.withPages("eks", "us-west-2", "ListClusters", "{'Clusters':['prod']}");
		provider.withPages("eks", "us-west-2", "DescribeCluster",
				"{'Cluster':{'Name':'prod','Arn':'arn:eks:cluster/prod','Status':'ACTIVE','Version':'1.27',"
						+ "'Endpoint':'https://prod.eks.amazonaws.com','Tags':{'team':'platform'},"
						+ "'Logging':{'ClusterLogging':[{'Types':['api','audit'],'Enabled':true}]}}}");
		provider.withPages("eks", "us-west-2", "ListNodegroups", "{'Nodegroups':['general','spare']}");
		provider.withHandler("eks", "us-west-2", "DescribeNodegroup", params -> {
			Assertions.assertThat(params.get("ClusterName")).isEqualTo("prod");
			if (params.get("NodegroupName").equals("general")) {
				return json("{'Nodegroup':{'NodegroupName':'general','NodegroupArn':'arn:eks:nodegroup/prod/general',"
						+ "'Status':'ACTIVE','InstanceTypes':['t3.small'],"
						+ "'ScalingConfig':{'MinSize':1,'MaxSize':5,'DesiredSize':3},'DiskSize':20}}");
			}
			return json("{'Nodegroup':{'NodegroupName':'spare','NodegroupArn':'arn:eks:nodegroup/prod/spare',"
					+ "'Status':'ACTIVE','ScalingConfig':{'DesiredSize':1},'CapacityType':'SPOT'}}");
		});

		List<Resource> resources = scanner().scanRegion("us-west-2");
		Assertions.assertThat(resources).hasSize(3);

		Resource general = find(resources, "arn:eks:nodegroup/prod/general");
		Assertions.assertThat(general.getType()).isEqualTo(EKSScanner.NODE_GROUP);
		Assertions.assertThat(general.getAdditionalInfo()).containsEntry("desiredSize", 3)
				.containsEntry("maxSize", 5).containsEntry("capacityType", "ON_DEMAND")
				.containsEntry("clusterName", "prod");
		assertCost(general, 3 * 15.0);

		Resource spare = find(resources, "arn:eks:nodegroup/prod/spare");
		Assertions.assertThat((List<Object>) spare.getAdditionalInfo().get("instanceTypes"))
				.containsExactly(AwsPricing.EKS_DEFAULT_NODE_TYPE);
		Assertions.assertThat(spare.getAdditionalInfo()).containsEntry("capacityType", "SPOT");
		assertCost(spare, 30.0);

		// the cluster is priced for its control plane, node groups are not counted twice
		Resource cluster = find(resources, "arn:eks:cluster/prod");
		Assertions.assertThat(cluster.getType()).isEqualTo(EKSScanner.CLUSTER);
		Assertions.assertThat(cluster.getName()).contains("prod");
		Assertions.assertThat(cluster.getAdditionalInfo()).containsEntry("version", "1.27")
				.containsEntry("nodeGroupCount", 2).containsEntry("nodeGroupCost", 75.0).containsKey("logging");
		Assertions.assertThat((Map<Object, Object>) cluster.getAdditionalInfo().get("tags"))
				.containsEntry("team", "platform");
		assertCost(cluster, AwsPricing.EKS_CONTROL_PLANE_MONTHLY);
	}

	@Test
	public void testInactiveCluster() {
		provider.withPages("eks", "us-east-1", "ListClusters", "{'Clusters':['old']}");
		provider.withPages("eks", "us-east-1", "DescribeCluster",
				"{'Cluster':{'Name':'old','Status':'DELETING'}}");

		List<Resource> resources = scanner().scanRegion("us-east-1");
		Resource cluster = find(resources, "old");
		Assertions.assertThat(cluster.getState()).contains("DELETING");
		Assertions.assertThat(cluster.getAdditionalInfo()).containsEntry("nodeGroupCount", 0)
				.doesNotContainKey("tags");
		assertCost(cluster, 0.0);
	}
}
