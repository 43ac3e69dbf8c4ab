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

/**
 * REST APIs from API Gateway and HTTP or WebSocket APIs from API Gateway v2.
 * Stage details are best-effort: an API whose stages cannot be read is still
 * reported, priced without a cache.
 */
public class APIGatewayScanner extends AWSScanner {

	public static final String SERVICE_NAME = "API Gateway";

	public static final String REST_API = "REST API";

	public APIGatewayScanner(AWSScannerBuilder builder) {
		super(builder, SERVICE_NAME);
	}

	@Override
	protected void doScan(RegionScan scan) {
		section(scan, "rest apis", () -> scanRestApis(scan));
		section(scan, "apis", () -> scanApis(scan));
	}

	void scanRestApis(RegionScan scan) {
		scan.forEachItem(AwsOperations.APIGATEWAY, "GetRestApis", ImmutableMap.of(), "Items", api -> {
			String id = api.path("Id").asText();
			List<String> stages = Lists.newArrayList();
			List<String> cacheSizes = Lists.newArrayList();
			callQuietly(scan, AwsOperations.APIGATEWAY, "GetStages", ImmutableMap.of("RestApiId", id))
					.ifPresent(page -> {
						for (JsonNode stage : page.path("Item")) {
							JsonUtil.text(stage, "StageName").ifPresent(stages::add);
							if (stage.path("CacheClusterEnabled").asBoolean(false)) {
								JsonUtil.text(stage, "CacheClusterSize").ifPresent(cacheSizes::add);
							}
						}
					});
			Map<String, String> tags = tagMap(api, "Tags");
			scan.add(newResource(scan, REST_API, id)
					.withName(tags.getOrDefault("Name", JsonUtil.text(api, "Name").orElse(null)))
					.withCreatedAt(JsonUtil.instant(api, "CreatedDate").orElse(null))
					.withState("active")
					.withEstimatedMonthlyCost(
							estimateCost(AwsCostEstimator.APIGATEWAY_REST_API, attributes("cacheSizes", cacheSizes)))
					.withInfo("description", JsonUtil.text(api, "Description").orElse(null))
					.withInfo("endpointTypes", value(api.path("EndpointConfiguration"), "Types"))
					.withInfo("apiKeySource", value(api, "ApiKeySource"))
					.withInfo("stages", stages)
					.withInfo("cacheSizes", emptyToNull(cacheSizes))
					.withInfo("tags", emptyToNull(tags))
					.build());
		});
	}

	void scanApis(RegionScan scan) {
		scan.forEachItem(AwsOperations.APIGATEWAYV2, "GetApis", ImmutableMap.of(), "Items", api -> {
			String id = api.path("ApiId").asText();
			String protocolType = JsonUtil.text(api, "ProtocolType").orElse("HTTP");
			List<String> stages = Lists.newArrayList();
			callQuietly(scan, AwsOperations.APIGATEWAYV2, "GetStages", ImmutableMap.of("ApiId", id))
					.ifPresent(page -> page.path("Items")
							.forEach(stage -> JsonUtil.text(stage, "StageName").ifPresent(stages::add)));
			Map<String, String> tags = tagMap(api, "Tags");
			JsonNode cors = api.path("CorsConfiguration");
			scan.add(newResource(scan, protocolType + " API", id)
					.withName(tags.getOrDefault("Name", JsonUtil.text(api, "Name").orElse(null)))
					.withCreatedAt(JsonUtil.instant(api, "CreatedDate").orElse(null))
					.withState("active")
					.withEstimatedMonthlyCost(estimateCost(AwsCostEstimator.APIGATEWAY_V2_API,
							attributes("protocolType", protocolType)))
					.withInfo("protocolType", protocolType)
					.withInfo("apiEndpoint", value(api, "ApiEndpoint"))
					.withInfo("description", JsonUtil.text(api, "Description").orElse(null))
					.withInfo("cors", !cors.isMissingNode() && !cors.isNull())
					.withInfo("stages", stages)
					.withInfo("tags", emptyToNull(tags))
					.build());
		});
	}
}
