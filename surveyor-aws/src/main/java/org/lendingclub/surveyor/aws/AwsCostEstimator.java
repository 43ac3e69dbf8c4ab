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

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

import org.lendingclub.surveyor.core.CostEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

/**
 * Estimates the monthly cost of a resource from its kind and a few attributes.
 * Estimation never fails: missing or unparseable attributes count as zero and
 * unknown kinds cost nothing.
 *
 * <table>
 * <tr><th>kind</th><th>attributes</th></tr>
 * <tr><td>ec2.instance</td><td>instanceType, state</td></tr>
 * <tr><td>ec2.volume</td><td>volumeType, size</td></tr>
 * <tr><td>ec2.snapshot</td><td>size</td></tr>
 * <tr><td>ec2.elastic-ip</td><td>attached</td></tr>
 * <tr><td>ec2.nat-gateway</td><td>state</td></tr>
 * <tr><td>rds.instance</td><td>instanceClass, allocatedStorage, status</td></tr>
 * <tr><td>rds.cluster</td><td>memberCount, status</td></tr>
 * <tr><td>rds.snapshot</td><td>allocatedStorage</td></tr>
 * <tr><td>s3.bucket</td><td>sizeGb, objectCount, versioning, lifecycleRules</td></tr>
 * <tr><td>lambda.function</td><td>memorySize, architectures</td></tr>
 * <tr><td>dynamodb.table</td><td>billingMode, readCapacityUnits, writeCapacityUnits, sizeBytes</td></tr>
 * <tr><td>elb.classic</td><td></td></tr>
 * <tr><td>elb.v2</td><td>type, state</td></tr>
 * <tr><td>ecs.cluster</td><td>runningTasksCount</td></tr>
 * <tr><td>ecs.service</td><td>launchType, desiredCount</td></tr>
 * <tr><td>eks.cluster</td><td>status</td></tr>
 * <tr><td>eks.nodegroup</td><td>instanceType, desiredSize, status</td></tr>
 * <tr><td>cloudfront.distribution</td><td>enabled, priceClass</td></tr>
 * <tr><td>route53.hosted-zone</td><td></td></tr>
 * <tr><td>route53.health-check</td><td>type, measureLatency</td></tr>
 * <tr><td>vpc.transit-gateway</td><td>state</td></tr>
 * <tr><td>vpc.transit-gateway-attachment</td><td>resourceType, state</td></tr>
 * <tr><td>vpc.endpoint</td><td>endpointType, state</td></tr>
 * <tr><td>vpc.vpn-connection</td><td>state</td></tr>
 * <tr><td>vpc.direct-connect-interface</td><td>state</td></tr>
 * <tr><td>apigateway.rest-api</td><td>cacheSizes</td></tr>
 * <tr><td>apigateway.v2-api</td><td>protocolType</td></tr>
 * </table>
 */
public class AwsCostEstimator implements CostEstimator {

	public static final String EC2_INSTANCE = "ec2.instance";
	public static final String EC2_VOLUME = "ec2.volume";
	public static final String EC2_SNAPSHOT = "ec2.snapshot";
	public static final String EC2_ELASTIC_IP = "ec2.elastic-ip";
	public static final String EC2_NAT_GATEWAY = "ec2.nat-gateway";
	public static final String RDS_INSTANCE = "rds.instance";
	public static final String RDS_CLUSTER = "rds.cluster";
	public static final String RDS_SNAPSHOT = "rds.snapshot";
	public static final String S3_BUCKET = "s3.bucket";
	public static final String LAMBDA_FUNCTION = "lambda.function";
	public static final String DYNAMODB_TABLE = "dynamodb.table";
	public static final String ELB_CLASSIC = "elb.classic";
	public static final String ELB_V2 = "elb.v2";
	public static final String ECS_CLUSTER = "ecs.cluster";
	public static final String ECS_SERVICE = "ecs.service";
	public static final String EKS_CLUSTER = "eks.cluster";
	public static final String EKS_NODEGROUP = "eks.nodegroup";
	public static final String CLOUDFRONT_DISTRIBUTION = "cloudfront.distribution";
	public static final String ROUTE53_HOSTED_ZONE = "route53.hosted-zone";
	public static final String ROUTE53_HEALTH_CHECK = "route53.health-check";
	public static final String VPC_TRANSIT_GATEWAY = "vpc.transit-gateway";
	public static final String VPC_TRANSIT_GATEWAY_ATTACHMENT = "vpc.transit-gateway-attachment";
	public static final String VPC_ENDPOINT = "vpc.endpoint";
	public static final String VPC_VPN_CONNECTION = "vpc.vpn-connection";
	public static final String VPC_DIRECT_CONNECT_INTERFACE = "vpc.direct-connect-interface";
	public static final String APIGATEWAY_REST_API = "apigateway.rest-api";
	public static final String APIGATEWAY_V2_API = "apigateway.v2-api";

	static Logger logger = LoggerFactory.getLogger(AwsCostEstimator.class);

	@Override
	public double estimate(String kind, Map<String, ?> attributes) {
		if (kind == null || attributes == null) {
			return 0.0;
		}
		switch (kind) {
		case EC2_INSTANCE:
			return instance(string(attributes, "instanceType"), string(attributes, "state"));
		case EC2_VOLUME:
			return AwsPricing.getEbsPerGb(string(attributes, "volumeType")) * number(attributes, "size");
		case EC2_SNAPSHOT:
			return AwsPricing.EBS_SNAPSHOT_PER_GB * number(attributes, "size");
		case EC2_ELASTIC_IP:
			return bool(attributes, "attached") ? 0.0 : AwsPricing.UNATTACHED_ELASTIC_IP_MONTHLY;
		case EC2_NAT_GATEWAY:
			return "available".equals(string(attributes, "state")) ? AwsPricing.NAT_GATEWAY_MONTHLY : 0.0;
		case RDS_INSTANCE:
			if (!"available".equals(string(attributes, "status"))) {
				return 0.0;
			}
			return AwsPricing.getRdsInstanceMonthly(string(attributes, "instanceClass"))
					+ number(attributes, "allocatedStorage") * AwsPricing.RDS_STORAGE_PER_GB;
		case RDS_CLUSTER:
			if (!"available".equals(string(attributes, "status"))) {
				return 0.0;
			}
			return number(attributes, "memberCount") * AwsPricing.RDS_CLUSTER_MEMBER_MONTHLY;
		case RDS_SNAPSHOT:
			return number(attributes, "allocatedStorage") * AwsPricing.RDS_SNAPSHOT_PER_GB;
		case S3_BUCKET:
			return bucket(attributes);
		case LAMBDA_FUNCTION:
			return function(attributes);
		case DYNAMODB_TABLE:
			return table(attributes);
		case ELB_CLASSIC:
			return AwsPricing.CLASSIC_LOAD_BALANCER_MONTHLY;
		case ELB_V2:
			if (!"active".equals(string(attributes, "state"))) {
				return 0.0;
			}
			String type = Strings.nullToEmpty(string(attributes, "type")).toLowerCase(Locale.ROOT);
			return ELBScanner.LOAD_BALANCER_TYPES.containsKey(type) ? AwsPricing.LOAD_BALANCER_V2_MONTHLY : 0.0;
		case ECS_CLUSTER:
			return number(attributes, "runningTasksCount") * AwsPricing.ECS_TASK_MONTHLY;
		case ECS_SERVICE:
			// tasks on EC2 capacity are paid for as instances
			if (!"FARGATE".equals(string(attributes, "launchType"))) {
				return 0.0;
			}
			return number(attributes, "desiredCount") * AwsPricing.ECS_TASK_MONTHLY;
		case EKS_CLUSTER:
			return "ACTIVE".equals(string(attributes, "status")) ? AwsPricing.EKS_CONTROL_PLANE_MONTHLY : 0.0;
		case EKS_NODEGROUP:
			return nodegroup(attributes);
		case CLOUDFRONT_DISTRIBUTION:
			return distribution(attributes);
		case ROUTE53_HOSTED_ZONE:
			return AwsPricing.ROUTE53_HOSTED_ZONE_MONTHLY;
		case ROUTE53_HEALTH_CHECK:
			return healthCheck(attributes);
		case VPC_TRANSIT_GATEWAY:
			return available(attributes) ? AwsPricing.TRANSIT_GATEWAY_MONTHLY : 0.0;
		case VPC_TRANSIT_GATEWAY_ATTACHMENT:
			// vpc attachments are free
			return available(attributes) && "vpn".equalsIgnoreCase(string(attributes, "resourceType"))
					? AwsPricing.TRANSIT_GATEWAY_VPN_ATTACHMENT_MONTHLY
					: 0.0;
		case VPC_ENDPOINT:
			// gateway endpoints are free
			return available(attributes) && "Interface".equalsIgnoreCase(string(attributes, "endpointType"))
					? AwsPricing.INTERFACE_ENDPOINT_MONTHLY
					: 0.0;
		case VPC_VPN_CONNECTION:
			return available(attributes) ? AwsPricing.VPN_CONNECTION_MONTHLY : 0.0;
		case VPC_DIRECT_CONNECT_INTERFACE:
			return available(attributes) ? AwsPricing.DIRECT_CONNECT_INTERFACE_MONTHLY : 0.0;
		case APIGATEWAY_REST_API:
			return restApi(attributes);
		case APIGATEWAY_V2_API:
			return v2Api(attributes);
		default:
			logger.debug("no pricing for {}", kind);
			return 0.0;
		}
	}

	double instance(String instanceType, String state) {
		if (!"running".equals(state)) {
			return 0.0;
		}
		if (!AwsPricing.isKnownInstanceType(instanceType)) {
			logger.warn("unknown instance type {}, using default price", instanceType);
		}
		return AwsPricing.getInstanceMonthly(instanceType);
	}

	double bucket(Map<String, ?> attributes) {
		double storage = number(attributes, "sizeGb") * AwsPricing.S3_STANDARD_PER_GB;
		double requests = number(attributes, "objectCount") / 1000.0 * AwsPricing.S3_REQUESTS_PER_THOUSAND;
		if (bool(attributes, "versioning")) {
			storage *= AwsPricing.S3_VERSIONING_FACTOR;
		}
		if (number(attributes, "lifecycleRules") > 0) {
			storage *= AwsPricing.S3_LIFECYCLE_FACTOR;
		}
		return Math.max(storage + requests, AwsPricing.S3_MINIMUM_MONTHLY);
	}

	double function(Map<String, ?> attributes) {
		double memory = number(attributes, "memorySize");
		if (memory <= 0) {
			memory = AwsPricing.LAMBDA_DEFAULT_MEMORY_MB;
		}
		double gbSeconds = memory / 1024.0 * AwsPricing.LAMBDA_ASSUMED_DURATION_SECONDS
				* AwsPricing.LAMBDA_ASSUMED_INVOCATIONS;
		double compute = gbSeconds * AwsPricing.LAMBDA_GB_SECOND;
		Object architectures = attributes.get("architectures");
		if (architectures instanceof Collection && ((Collection<?>) architectures).contains("arm64")) {
			compute *= AwsPricing.LAMBDA_ARM_FACTOR;
		}
		double requests = AwsPricing.LAMBDA_ASSUMED_INVOCATIONS / 1_000_000.0
				* AwsPricing.LAMBDA_PER_MILLION_REQUESTS;
		return compute + requests;
	}

	double table(Map<String, ?> attributes) {
		double capacity;
		if ("PAY_PER_REQUEST".equals(string(attributes, "billingMode"))) {
			capacity = AwsPricing.DYNAMODB_ON_DEMAND_MONTHLY;
		} else {
			capacity = (number(attributes, "readCapacityUnits") + number(attributes, "writeCapacityUnits"))
					* AwsPricing.DYNAMODB_CAPACITY_UNIT_MONTHLY;
		}
		double sizeGb = number(attributes, "sizeBytes") / (1024.0 * 1024.0 * 1024.0);
		return capacity + sizeGb * AwsPricing.DYNAMODB_STORAGE_PER_GB;
	}

	double nodegroup(Map<String, ?> attributes) {
		if (!"ACTIVE".equals(string(attributes, "status"))) {
			return 0.0;
		}
		String instanceType = Strings.isNullOrEmpty(string(attributes, "instanceType"))
				? AwsPricing.EKS_DEFAULT_NODE_TYPE
				: string(attributes, "instanceType");
		return number(attributes, "desiredSize") * AwsPricing.getInstanceMonthly(instanceType);
	}

	double distribution(Map<String, ?> attributes) {
		if (!bool(attributes, "enabled")) {
			return 0.0;
		}
		String priceClass = Strings.nullToEmpty(string(attributes, "priceClass"));
		if (priceClass.isEmpty() || priceClass.endsWith("All")) {
			return AwsPricing.CLOUDFRONT_PRICE_CLASS_ALL_MONTHLY;
		}
		if (priceClass.endsWith("200")) {
			return AwsPricing.CLOUDFRONT_PRICE_CLASS_200_MONTHLY;
		}
		return AwsPricing.CLOUDFRONT_PRICE_CLASS_100_MONTHLY;
	}

	double healthCheck(Map<String, ?> attributes) {
		String type = Strings.nullToEmpty(string(attributes, "type"));
		double cost = type.endsWith("_STR_MATCH") ? AwsPricing.ROUTE53_STRING_MATCH_HEALTH_CHECK_MONTHLY
				: AwsPricing.ROUTE53_HEALTH_CHECK_MONTHLY;
		if (bool(attributes, "measureLatency")) {
			cost += AwsPricing.ROUTE53_LATENCY_MEASUREMENT_MONTHLY;
		}
		return cost;
	}

	double restApi(Map<String, ?> attributes) {
		double cost = AwsPricing.API_ASSUMED_MILLIONS_OF_CALLS * AwsPricing.REST_API_PER_MILLION;
		Object sizes = attributes.get("cacheSizes");
		if (sizes instanceof Collection) {
			for (Object size : (Collection<?>) sizes) {
				cost += AwsPricing.getApiCacheMonthly(size == null ? null : size.toString());
			}
		}
		return cost;
	}

	double v2Api(Map<String, ?> attributes) {
		if ("WEBSOCKET".equals(string(attributes, "protocolType"))) {
			return AwsPricing.API_ASSUMED_MILLIONS_OF_CALLS * AwsPricing.WEBSOCKET_PER_MILLION_MESSAGES
					+ AwsPricing.WEBSOCKET_ASSUMED_CONNECTION_MINUTES / 1_000_000.0
							* AwsPricing.WEBSOCKET_PER_MILLION_CONNECTION_MINUTES;
		}
		return AwsPricing.API_ASSUMED_MILLIONS_OF_CALLS * AwsPricing.HTTP_API_PER_MILLION;
	}

	static boolean available(Map<String, ?> attributes) {
		return "available".equalsIgnoreCase(string(attributes, "state"));
	}

	static String string(Map<String, ?> attributes, String key) {
		Object v = attributes.get(key);
		return v == null ? null : v.toString();
	}

	static double number(Map<String, ?> attributes, String key) {
		Object v = attributes.get(key);
		double d = 0.0;
		if (v instanceof Number) {
			d = ((Number) v).doubleValue();
		} else if (v != null) {
			try {
				d = Double.parseDouble(v.toString().trim());
			} catch (NumberFormatException e) {
				logger.debug("not a number {}={}", key, v);
			}
		}
		return Double.isFinite(d) && d > 0 ? d : 0.0;
	}

	static boolean bool(Map<String, ?> attributes, String key) {
		Object v = attributes.get(key);
		if (v instanceof Boolean) {
			return (Boolean) v;
		}
		return v != null && Boolean.parseBoolean(v.toString());
	}
}
