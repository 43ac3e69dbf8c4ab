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

import java.io.IOException;
import java.io.StringWriter;

import org.assertj.core.api.Assertions;
import org.junit.Test;
import org.lendingclub.surveyor.core.Resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

public class JsonReportWriterTest {

	ObjectMapper mapper = new ObjectMapper();

	@Test
	public void testInventory() throws IOException {
		StringWriter out = new StringWriter();
		new JsonReportWriter().write(Inventories.twoByTwo(), out);

		JsonNode n = mapper.readTree(out.toString());
		Assertions.assertThat(n.path("resources").size()).isEqualTo(4);
		Assertions.assertThat(n.path("resources").path(0).path("id").asText()).isEqualTo("i-1");
		Assertions.assertThat(n.path("resources").path(0).path("estimatedMonthlyCost").asDouble()).isEqualTo(10.0);
		Assertions.assertThat(n.path("resources").path(0).has("name")).isFalse();

		JsonNode summary = n.path("summary");
		Assertions.assertThat(summary.path("totalResources").asInt()).isEqualTo(4);
		Assertions.assertThat(summary.path("totalEstimatedMonthlyCost").asDouble()).isEqualTo(60.0);
		Assertions.assertThat(summary.path("services").size()).isEqualTo(2);
		JsonNode ec2 = summary.path("services").path(0);
		Assertions.assertThat(ec2.path("service").asText()).isEqualTo("EC2");
		Assertions.assertThat(ec2.path("resourceCount").asInt()).isEqualTo(2);
		Assertions.assertThat(ec2.path("estimatedMonthlyCost").asDouble()).isEqualTo(30.0);
		Assertions.assertThat(ec2.path("resourcesByRegion").path("us-west-2").asInt()).isEqualTo(1);
	}

	@Test
	public void testResourceFields() throws IOException {
		StringWriter out = new StringWriter();
		new JsonReportWriter().withPrettyPrint(false).write(ImmutableList.of(Inventories.instance()), out);

		Assertions.assertThat(out.toString().trim()).doesNotContain("\n");
		JsonNode r = mapper.readTree(out.toString()).path("resources").path(0);
		Assertions.assertThat(r.path("name").asText()).isEqualTo("web|1");
		Assertions.assertThat(r.path("state").asText()).isEqualTo("running");
		Assertions.assertThat(r.path("createdAt").asText()).isEqualTo("2020-01-01T00:00:00Z");
		Assertions.assertThat(r.path("additionalInfo").path("instanceType").asText()).isEqualTo("m5.large");
		Assertions.assertThat(r.path("additionalInfo").path("securityGroups").path(0).asText()).isEqualTo("sg-1");
	}

	@Test
	public void testEmpty() throws IOException {
		StringWriter out = new StringWriter();
		InventorySummary summary = new JsonReportWriter().writeStreaming(ImmutableList.<Resource>of().iterator(), out);
		Assertions.assertThat(summary.isEmpty()).isTrue();

		JsonNode n = mapper.readTree(out.toString());
		Assertions.assertThat(n.path("resources").isArray()).isTrue();
		Assertions.assertThat(n.path("resources").size()).isEqualTo(0);
		Assertions.assertThat(n.path("summary").path("totalResources").asInt()).isEqualTo(0);
	}
}
