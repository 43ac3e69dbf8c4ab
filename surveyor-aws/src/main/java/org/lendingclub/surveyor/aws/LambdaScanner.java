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

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

import org.lendingclub.surveyor.core.JsonUtil;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

public class LambdaScanner extends AWSScanner {

	public static final String SERVICE_NAME = "Lambda";
	public static final String FUNCTION = "Function";

	// Lambda reports 2019-03-01T12:00:00.000+0000
	static final DateTimeFormatter LAST_MODIFIED = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ");

	public LambdaScanner(AWSScannerBuilder builder) {
		super(builder, SERVICE_NAME);
	}

	@Override
	protected void doScan(RegionScan scan) {
		section(scan, "functions", () -> {
			scan.forEachItem(AwsOperations.LAMBDA, "ListFunctions", ImmutableMap.of(), "Functions", function -> {
				String name = function.path("FunctionName").asText();
				int memory = function.path("MemorySize").asInt(AwsPricing.LAMBDA_DEFAULT_MEMORY_MB);
				List<String> architectures = Lists.newArrayList();
				for (JsonNode a : function.path("Architectures")) {
					architectures.add(a.asText());
				}
				String lastModified = JsonUtil.text(function, "LastModified").orElse(null);
				scan.add(newResource(scan, FUNCTION, JsonUtil.text(function, "FunctionArn").orElse(name))
						.withName(name)
						.withCreatedAt(parseLastModified(lastModified))
						.withState(JsonUtil.text(function, "State").orElse("unknown"))
						.withEstimatedMonthlyCost(estimateCost(AwsCostEstimator.LAMBDA_FUNCTION,
								attributes("memorySize", memory, "architectures", architectures)))
						.withInfo("runtime", value(function, "Runtime"))
						.withInfo("memorySize", memory)
						.withInfo("timeout", value(function, "Timeout"))
						.withInfo("handler", value(function, "Handler"))
						.withInfo("codeSize", value(function, "CodeSize"))
						.withInfo("lastModified", lastModified)
						.withInfo("architectures", architectures.isEmpty() ? null : architectures)
						.build());
			});
		});
	}

	static Instant parseLastModified(String s) {
		if (s == null) {
			return null;
		}
		try {
			return OffsetDateTime.parse(s, LAST_MODIFIED).toInstant();
		} catch (DateTimeParseException e) {
			try {
				return OffsetDateTime.parse(s).toInstant();
			} catch (DateTimeParseException e2) {
				return null;
			}
		}
	}
}
