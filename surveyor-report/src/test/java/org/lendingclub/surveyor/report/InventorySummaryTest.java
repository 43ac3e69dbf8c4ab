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

import org.assertj.core.api.Assertions;
import org.junit.Test;
import org.lendingclub.surveyor.core.Resource;

public class InventorySummaryTest {

	@Test
	public void testTwoServicesTwoRegions() {
		InventorySummary summary = InventorySummary.of(Inventories.twoByTwo());

		Assertions.assertThat(summary.getTotalResources()).isEqualTo(4);
		Assertions.assertThat(summary.getTotalEstimatedMonthlyCost()).isEqualTo(60.0);
		Assertions.assertThat(summary.getServices()).extracting(ServiceSummary::getService).containsExactly("EC2",
				"RDS");
		for (ServiceSummary s : summary.getServices()) {
			Assertions.assertThat(s.getResourceCount()).isEqualTo(2);
			Assertions.assertThat(s.getTotalEstimatedMonthlyCost()).isEqualTo(30.0);
			Assertions.assertThat(s.getResourcesByRegion()).containsEntry("us-east-1", 1).containsEntry("us-west-2",
					1);
		}
	}

	@Test
	public void testMostExpensive() {
		InventorySummary summary = new InventorySummary(3);
		for (int i = 0; i < 20; i++) {
			summary.add(Inventories.resource("EC2", "us-east-1", "i-" + i, i));
		}
		Assertions.assertThat(summary.getMostExpensive()).extracting(Resource::getId).containsExactly("i-19", "i-18",
				"i-17");
		Assertions.assertThat(summary.getTotalResources()).isEqualTo(20);
	}

	@Test
	public void testFreeResourcesAreNotRanked() {
		InventorySummary summary = new InventorySummary()
				.add(Resource.builder().withService("S3").withRegion("global").withId("b").withType("Bucket").build())
				.add(Inventories.resource("EC2", "us-east-1", "i-0", 0));
		Assertions.assertThat(summary.getMostExpensive()).isEmpty();
		Assertions.assertThat(summary.getService("S3").get().getTotalEstimatedMonthlyCost()).isEqualTo(0.0);
		Assertions.assertThat(summary.getService("Lambda")).isEmpty();
	}

	@Test
	public void testEmpty() {
		InventorySummary summary = new InventorySummary();
		Assertions.assertThat(summary.isEmpty()).isTrue();
		Assertions.assertThat(summary.getServices()).isEmpty();
		Assertions.assertThat(summary.getTotalEstimatedMonthlyCost()).isEqualTo(0.0);
	}
}
