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

import java.util.Locale;
import java.util.Optional;

import org.lendingclub.surveyor.core.JsonUtil;
import org.lendingclub.surveyor.core.ProviderException;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableMap;

/**
 * DynamoDB tables. The control plane API has a low request limit, so this
 * scanner runs slower than the others unless configured otherwise.
 */
public class DynamoDBScanner extends AWSScanner {

	public static final String SERVICE_NAME = "DynamoDB";
	public static final String TABLE = "Table";

	public static final double DEFAULT_RATE_LIMIT = 5.0;

	public DynamoDBScanner(AWSScannerBuilder builder) {
		super(builder, SERVICE_NAME);
	}

	@Override
	public Optional<Double> getDefaultRateLimitPerSecond() {
		return Optional.of(DEFAULT_RATE_LIMIT);
	}

	@Override
	protected void doScan(RegionScan scan) {
		section(scan, "tables", () -> {
			scan.forEachItem(AwsOperations.DYNAMODB, "ListTables", ImmutableMap.of(), "TableNames", tableName -> {
				scanTable(scan, tableName.asText());
			});
		});
	}

	void scanTable(RegionScan scan, String tableName) {
		JsonNode table;
		try {
			table = scan.call(AwsOperations.DYNAMODB, "DescribeTable", ImmutableMap.of("TableName", tableName))
					.path("Table");
		} catch (ProviderException e) {
			if (isResourceNotFound(e)) {
				// deleted between list and describe
				logger.debug("table {} no longer exists", tableName);
				return;
			}
			throw e;
		}
		String billingMode = JsonUtil.text(table.path("BillingModeSummary"), "BillingMode").orElse("PROVISIONED");
		JsonNode throughput = table.path("ProvisionedThroughput");
		long readCapacity = throughput.path("ReadCapacityUnits").asLong(0);
		long writeCapacity = throughput.path("WriteCapacityUnits").asLong(0);
		long sizeBytes = table.path("TableSizeBytes").asLong(0);
		double sizeGb = sizeBytes / (1024.0 * 1024.0 * 1024.0);
		scan.add(newResource(scan, TABLE, JsonUtil.text(table, "TableArn").orElse(tableName)).withName(tableName)
				.withCreatedAt(JsonUtil.instant(table, "CreationDateTime").orElse(null))
				.withState(JsonUtil.text(table, "TableStatus").orElse(null))
				.withEstimatedMonthlyCost(estimateCost(AwsCostEstimator.DYNAMODB_TABLE,
						attributes("billingMode", billingMode, "readCapacityUnits", readCapacity,
								"writeCapacityUnits", writeCapacity, "sizeBytes", sizeBytes)))
				.withInfo("billingMode", billingMode)
				.withInfo("itemCount", table.path("ItemCount").asLong(0))
				.withInfo("sizeBytes", sizeBytes)
				.withInfo("sizeGB", String.format(Locale.ROOT, "%.2f", sizeGb))
				.withInfo("readCapacityUnits", readCapacity)
				.withInfo("writeCapacityUnits", writeCapacity)
				.build());
	}

	static boolean isResourceNotFound(Throwable t) {
		for (Throwable cause : Throwables.getCausalChain(t)) {
			if (cause instanceof ProviderException
					&& "ResourceNotFoundException".equals(((ProviderException) cause).getErrorCode())) {
				return true;
			}
		}
		return false;
	}
}
