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
package org.lendingclub.surveyor.report;

import java.time.Instant;
import java.util.List;

import org.lendingclub.surveyor.core.Resource;

import com.google.common.collect.ImmutableList;

/**
 * Small inventories shared by the report tests.
 */
public class Inventories {

	public static Resource resource(String service, String region, String id, double cost) {
		return Resource.builder().withService(service).withRegion(region).withId(id).withType("Thing")
				.withEstimatedMonthlyCost(cost).build();
	}

	/**
	 * Two services in two regions, 10 in us-east-1 and 20 in us-west-2 each.
	 */
	public static List<Resource> twoByTwo() {
		return ImmutableList.of(resource("EC2", "us-east-1", "i-1", 10), resource("EC2", "us-west-2", "i-2", 20),
				resource("RDS", "us-east-1", "db-1", 10), resource("RDS", "us-west-2", "db-2", 20));
	}

	public static Resource instance() {
		return Resource.builder().withService("EC2").withRegion("us-east-1").withId("i-0abc").withType("Instance")
				.withName("web|1").withState("running").withCreatedAt(Instant.parse("2020-01-01T00:00:00Z"))
				.withEstimatedMonthlyCost(1234.5).withInfo("instanceType", "m5.large").withInfo("publicIp", "")
				.withInfo("ebsOptimized", false).withInfo("cpuCount", 2).withInfo("securityGroups",
						ImmutableList.of("sg-1"))
				.withInfo("vpcId", "vpc-1").withInfo("subnetId", "subnet-1").build();
	}
}
