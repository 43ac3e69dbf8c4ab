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
import com.google.common.collect.ImmutableMap;

/**
 * CloudFront distributions. CloudFront is global: distributions are listed once,
 * from the global region, and reported in the <code>global</code> region.
 */
public class CloudFrontScanner extends AWSScanner {

	public static final String SERVICE_NAME = "CloudFront";
	public static final String DISTRIBUTION = "Distribution";

	public CloudFrontScanner(AWSScannerBuilder builder) {
		super(builder, SERVICE_NAME);
	}

	@Override
	public boolean isGlobal() {
		return true;
	}

	@Override
	protected void doScan(RegionScan scan) {
		section(scan, "distributions", () -> {
			scan.forEachItem(AwsOperations.CLOUDFRONT, "ListDistributions", ImmutableMap.of(),
					"DistributionList/Items", item -> scan.add(distribution(scan, item)));
		});
	}

	Resource distribution(RegionScan scan, JsonNode item) {
		String id = item.path("Id").asText();
		Map<String, String> tags = JsonUtil.text(item, "ARN")
				.flatMap(arn -> callQuietly(scan, AwsOperations.CLOUDFRONT, "ListTagsForResource",
						ImmutableMap.of("Resource", arn)))
				.map(n -> tags(n.path("Tags"), "Items")).orElse(ImmutableMap.of());
		boolean enabled = item.path("Enabled").asBoolean(false);
		String priceClass = JsonUtil.text(item, "PriceClass").orElse("PriceClass_All");
		String comment = JsonUtil.text(item, "Comment").orElse(null);
		return newResource(scan, DISTRIBUTION, id).withRegion(Resource.GLOBAL_REGION)
				.withName(tags.getOrDefault("Name", comment))
				.withCreatedAt(JsonUtil.instant(item, "LastModifiedTime").orElse(null))
				.withState(enabled ? "Enabled" : "Disabled")
				.withEstimatedMonthlyCost(estimateCost(AwsCostEstimator.CLOUDFRONT_DISTRIBUTION,
						attributes("enabled", enabled, "priceClass", priceClass)))
				.withInfo("domainName", value(item, "DomainName"))
				.withInfo("aliases", value(item.path("Aliases"), "Items"))
				.withInfo("priceClass", priceClass)
				.withInfo("httpVersion", value(item, "HttpVersion"))
				.withInfo("isIPV6Enabled", value(item, "IsIPV6Enabled"))
				.withInfo("viewerCertificate", value(item.path("ViewerCertificate"), "CertificateSource"))
				.withInfo("webACLId", JsonUtil.text(item, "WebACLId").orElse(null))
				.withInfo("comment", comment)
				.withInfo("origins", item.path("Origins").path("Items").size())
				.withInfo("status", value(item, "Status"))
				.withInfo("tags", emptyToNull(tags))
				.build();
	}
}
