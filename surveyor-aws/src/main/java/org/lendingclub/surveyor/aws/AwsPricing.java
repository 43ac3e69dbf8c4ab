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

import com.google.common.collect.ImmutableMap;

/**
 * Approximate us-east-1 on-demand list prices, in USD per month. These are
 * estimates for inventory reports, not billing data.
 */
public final class AwsPricing {

	public static final double HOURS_PER_MONTH = 730;

	public static final double UNKNOWN_INSTANCE_MONTHLY = 50.0;
	public static final double DEFAULT_EBS_PER_GB = 0.10;
	public static final double EBS_SNAPSHOT_PER_GB = 0.05;
	public static final double UNATTACHED_ELASTIC_IP_MONTHLY = 3.60;
	public static final double NAT_GATEWAY_MONTHLY = 45.0;

	public static final double DEFAULT_RDS_INSTANCE_MONTHLY = 100.0;
	public static final double RDS_STORAGE_PER_GB = 0.115;
	public static final double RDS_CLUSTER_MEMBER_MONTHLY = 100.0;
	public static final double RDS_SNAPSHOT_PER_GB = 0.095;

	public static final double S3_STANDARD_PER_GB = 0.023;
	public static final double S3_REQUESTS_PER_THOUSAND = 0.0004;
	public static final double S3_VERSIONING_FACTOR = 1.2;
	public static final double S3_LIFECYCLE_FACTOR = 0.8;
	public static final double S3_MINIMUM_MONTHLY = 0.50;

	public static final double LAMBDA_GB_SECOND = 0.0000166667;
	public static final double LAMBDA_PER_MILLION_REQUESTS = 0.20;
	public static final double LAMBDA_ARM_FACTOR = 0.8;
	// assumed workload: 100k invocations of 100ms each per month
	public static final double LAMBDA_ASSUMED_INVOCATIONS = 100_000;
	public static final double LAMBDA_ASSUMED_DURATION_SECONDS = 0.1;
	public static final int LAMBDA_DEFAULT_MEMORY_MB = 128;

	public static final double DYNAMODB_ON_DEMAND_MONTHLY = 5.0;
	public static final double DYNAMODB_CAPACITY_UNIT_MONTHLY = 0.47;
	public static final double DYNAMODB_STORAGE_PER_GB = 0.25;

	public static final double CLASSIC_LOAD_BALANCER_MONTHLY = 25.0;
	public static final double LOAD_BALANCER_V2_MONTHLY = 23.0;

	// fargate task of 0.5 vCPU and 1 GB running all month
	public static final double FARGATE_VCPU_HOUR = 0.04;
	public static final double FARGATE_GB_HOUR = 0.004;
	public static final double ECS_TASK_MONTHLY = (FARGATE_VCPU_HOUR * 0.5 + FARGATE_GB_HOUR * 1) * HOURS_PER_MONTH;

	public static final double EKS_CONTROL_PLANE_MONTHLY = 73.0;
	public static final String EKS_DEFAULT_NODE_TYPE = "t3.medium";

	public static final double CLOUDFRONT_PRICE_CLASS_ALL_MONTHLY = 20.0;
	public static final double CLOUDFRONT_PRICE_CLASS_200_MONTHLY = 15.0;
	public static final double CLOUDFRONT_PRICE_CLASS_100_MONTHLY = 10.0;

	public static final double ROUTE53_HOSTED_ZONE_MONTHLY = 0.50;
	public static final double ROUTE53_HEALTH_CHECK_MONTHLY = 0.50;
	public static final double ROUTE53_STRING_MATCH_HEALTH_CHECK_MONTHLY = 0.75;
	public static final double ROUTE53_LATENCY_MEASUREMENT_MONTHLY = 0.20;

	public static final double TRANSIT_GATEWAY_MONTHLY = 36.50;
	public static final double TRANSIT_GATEWAY_VPN_ATTACHMENT_MONTHLY = 36.50;
	public static final double INTERFACE_ENDPOINT_MONTHLY = 7.30;
	public static final double VPN_CONNECTION_MONTHLY = 36.50;
	public static final double DIRECT_CONNECT_INTERFACE_MONTHLY = 30.0;

	// assumed workload: one million calls or messages per month
	public static final double API_ASSUMED_MILLIONS_OF_CALLS = 1.0;
	public static final double REST_API_PER_MILLION = 3.50;
	public static final double HTTP_API_PER_MILLION = 1.00;
	public static final double WEBSOCKET_PER_MILLION_MESSAGES = 1.00;
	public static final double WEBSOCKET_PER_MILLION_CONNECTION_MINUTES = 0.25;
	// 100 connections of one hour a day
	public static final double WEBSOCKET_ASSUMED_CONNECTION_MINUTES = 100 * 60 * 30;

	static final Map<String, Double> INSTANCE_MONTHLY = ImmutableMap.<String, Double>builder()
			.put("t2.nano", 4.25).put("t2.micro", 8.5).put("t2.small", 17.0).put("t2.medium", 34.0)
			.put("t2.large", 68.0).put("t2.xlarge", 136.0).put("t2.2xlarge", 272.0)
			.put("t3.nano", 3.8).put("t3.micro", 7.5).put("t3.small", 15.0).put("t3.medium", 30.0)
			.put("t3.large", 60.0).put("t3.xlarge", 120.0).put("t3.2xlarge", 240.0)
			.put("m5.large", 70.0).put("m5.xlarge", 140.0).put("m5.2xlarge", 280.0).put("m5.4xlarge", 560.0)
			.put("m5.8xlarge", 1120.0)
			.put("c5.large", 62.0).put("c5.xlarge", 124.0).put("c5.2xlarge", 248.0).put("c5.4xlarge", 496.0)
			.put("r5.large", 92.0).put("r5.xlarge", 184.0).put("r5.2xlarge", 368.0).put("r5.4xlarge", 736.0)
			.build();

	static final Map<String, Double> EBS_PER_GB = ImmutableMap.<String, Double>builder().put("gp3", 0.08)
			.put("gp2", 0.10).put("io1", 0.125).put("io2", 0.125).put("st1", 0.045).put("sc1", 0.025)
			.put("standard", 0.05).build();

	static final Map<String, Double> RDS_INSTANCE_MONTHLY = ImmutableMap.<String, Double>builder()
			.put("db.t3.micro", 13.0).put("db.t3.small", 26.0).put("db.t3.medium", 52.0).put("db.t3.large", 104.0)
			.put("db.m5.large", 125.0).put("db.m5.xlarge", 250.0).put("db.m5.2xlarge", 500.0)
			.put("db.r5.large", 180.0).put("db.r5.xlarge", 360.0).build();

	static final Map<String, Double> API_CACHE_MONTHLY = ImmutableMap.of("0.5", 38.0, "1.6", 106.0, "6.1", 365.0);

	private AwsPricing() {
	}

	public static boolean isKnownInstanceType(String instanceType) {
		return instanceType != null && INSTANCE_MONTHLY.containsKey(instanceType);
	}

	public static double getInstanceMonthly(String instanceType) {
		Double price = instanceType == null ? null : INSTANCE_MONTHLY.get(instanceType);
		return price == null ? UNKNOWN_INSTANCE_MONTHLY : price;
	}

	public static double getEbsPerGb(String volumeType) {
		Double price = volumeType == null ? null : EBS_PER_GB.get(volumeType);
		return price == null ? DEFAULT_EBS_PER_GB : price;
	}

	/**
	 * Monthly price of an API Gateway stage cache of the given size in GB; unknown
	 * sizes cost nothing.
	 */
	public static double getApiCacheMonthly(String cacheSize) {
		Double price = cacheSize == null ? null : API_CACHE_MONTHLY.get(cacheSize);
		return price == null ? 0.0 : price;
	}

	public static double getRdsInstanceMonthly(String instanceClass) {
		Double price = instanceClass == null ? null : RDS_INSTANCE_MONTHLY.get(instanceClass);
		return price == null ? DEFAULT_RDS_INSTANCE_MONTHLY : price;
	}
}
