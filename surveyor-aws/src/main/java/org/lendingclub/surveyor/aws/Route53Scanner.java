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

import java.util.Map;

import org.lendingclub.surveyor.core.JsonUtil;
import org.lendingclub.surveyor.core.Resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;

/**
 * Route 53 hosted zones and health checks. Route 53 is global and is scanned
 * once, from the global region.
 */
public class Route53Scanner extends AWSScanner {

	public static final String SERVICE_NAME = "Route53";

	public static final String HOSTED_ZONE = "Hosted Zone";
	public static final String HEALTH_CHECK = "Health Check";

	public Route53Scanner(AWSScannerBuilder builder) {
		super(builder, SERVICE_NAME);
	}

	@Override
	public boolean isGlobal() {
		return true;
	}

	@Override
	protected void doScan(RegionScan scan) {
		section(scan, "hosted zones", () -> scanHostedZones(scan));
		section(scan, "health checks", () -> scanHealthChecks(scan));
	}

	void scanHostedZones(RegionScan scan) {
		scan.forEachItem(AwsOperations.ROUTE53, "ListHostedZones", ImmutableMap.of(), "HostedZones", zone -> {
			// ids come back as /hostedzone/Z123
			String id = Iterables.getLast(Splitter.on('/').split(zone.path("Id").asText()));
			String name = zone.path("Name").asText();
			Map<String, String> tags = tags(scan, "hostedzone", id);
			JsonNode config = zone.path("Config");
			scan.add(newResource(scan, HOSTED_ZONE, id).withRegion(Resource.GLOBAL_REGION)
					.withName(tags.getOrDefault("Name", name))
					.withState("active")
					.withEstimatedMonthlyCost(estimateCost(AwsCostEstimator.ROUTE53_HOSTED_ZONE, attributes()))
					.withInfo("domainName", name)
					.withInfo("recordSetCount", zone.path("ResourceRecordSetCount").asLong(0))
					.withInfo("privateZone", config.path("PrivateZone").asBoolean(false))
					.withInfo("comment", JsonUtil.text(config, "Comment").orElse(null))
					.withInfo("callerReference", value(zone, "CallerReference"))
					.withInfo("tags", emptyToNull(tags))
					.build());
		});
	}

	void scanHealthChecks(RegionScan scan) {
		scan.forEachItem(AwsOperations.ROUTE53, "ListHealthChecks", ImmutableMap.of(), "HealthChecks", check -> {
			String id = check.path("Id").asText();
			JsonNode config = check.path("HealthCheckConfig");
			String type = JsonUtil.text(config, "Type").orElse(null);
			boolean measureLatency = config.path("MeasureLatency").asBoolean(false);
			Map<String, String> tags = tags(scan, "healthcheck", id);
			scan.add(newResource(scan, HEALTH_CHECK, id).withRegion(Resource.GLOBAL_REGION)
					.withName(tags.getOrDefault("Name", "Health Check " + id))
					.withState("active")
					.withEstimatedMonthlyCost(estimateCost(AwsCostEstimator.ROUTE53_HEALTH_CHECK,
							attributes("type", type, "measureLatency", measureLatency)))
					.withInfo("type", type)
					.withInfo("resourcePath", value(config, "ResourcePath"))
					.withInfo("fullyQualifiedDomainName", value(config, "FullyQualifiedDomainName"))
					.withInfo("port", value(config, "Port"))
					.withInfo("measureLatency", measureLatency)
					.withInfo("failureThreshold", value(config, "FailureThreshold"))
					.withInfo("disabled", config.path("Disabled").asBoolean(false))
					.withInfo("tags", emptyToNull(tags))
					.build());
		});
	}

	Map<String, String> tags(RegionScan scan, String resourceType, String id) {
		return callQuietly(scan, AwsOperations.ROUTE53, "ListTagsForResource",
				ImmutableMap.of("ResourceType", resourceType, "ResourceId", id))
						.map(n -> tags(n.path("ResourceTagSet"))).orElse(ImmutableMap.of());
	}
}
