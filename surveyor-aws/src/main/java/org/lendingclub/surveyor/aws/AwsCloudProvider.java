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

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.lendingclub.surveyor.core.CloudProvider;
import org.lendingclub.surveyor.core.JsonUtil;
import org.lendingclub.surveyor.core.ServiceClient;
import org.lendingclub.surveyor.core.SurveyorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.ClientConfiguration;
import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.client.builder.AwsSyncClientBuilder;
import com.amazonaws.retry.PredefinedRetryPolicies;
import com.amazonaws.services.apigateway.AmazonApiGatewayClient;
import com.amazonaws.services.apigatewayv2.AmazonApiGatewayV2Client;
import com.amazonaws.services.cloudfront.AmazonCloudFrontClient;
import com.amazonaws.services.directconnect.AmazonDirectConnectClient;
import com.amazonaws.services.dynamodbv2.AmazonDynamoDBClient;
import com.amazonaws.services.ec2.AmazonEC2Client;
import com.amazonaws.services.ecs.AmazonECSClient;
import com.amazonaws.services.eks.AmazonEKSClient;
import com.amazonaws.services.lambda.AWSLambdaClient;
import com.amazonaws.services.rds.AmazonRDSClient;
import com.amazonaws.services.route53.AmazonRoute53Client;
import com.amazonaws.services.s3.AmazonS3Client;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * AWS implementation of {@link CloudProvider}. SDK clients are created on
 * demand, one per service and region, and shared by every scanner thread. The
 * SDK's own retries are switched off: retry, backoff and throttling are handled
 * by the scan engine.
 */
public class AwsCloudProvider implements CloudProvider {

	public static final String NAME = "aws";

	public static final int DEFAULT_CONNECTION_TIMEOUT_MILLIS = 10_000;
	public static final int DEFAULT_SOCKET_TIMEOUT_MILLIS = 60_000;

	static Logger logger = LoggerFactory.getLogger(AwsCloudProvider.class);

	private AWSCredentialsProvider credentialsProvider;
	private ClientConfiguration clientConfiguration;
	private String regionDiscoveryRegion = "us-east-1";

	private final Map<String, AwsServiceClient> clients = Maps.newConcurrentMap();

	public AwsCloudProvider() {
	}

	public AwsCloudProvider withCredentials(AWSCredentialsProvider p) {
		this.credentialsProvider = p;
		return this;
	}

	public AwsCloudProvider withClientConfiguration(ClientConfiguration c) {
		this.clientConfiguration = c;
		return this;
	}

	/**
	 * Region used to call DescribeRegions.
	 */
	public AwsCloudProvider withRegionDiscoveryRegion(String region) {
		Preconditions.checkNotNull(region, "region cannot be null");
		this.regionDiscoveryRegion = region;
		return this;
	}

	AWSCredentialsProvider getCredentialsProvider() {
		if (credentialsProvider == null) {
			return new DefaultAWSCredentialsProviderChain();
		}
		return credentialsProvider;
	}

	ClientConfiguration getClientConfiguration() {
		if (clientConfiguration == null) {
			return new ClientConfiguration().withRetryPolicy(PredefinedRetryPolicies.NO_RETRY_POLICY)
					.withConnectionTimeout(DEFAULT_CONNECTION_TIMEOUT_MILLIS)
					.withSocketTimeout(DEFAULT_SOCKET_TIMEOUT_MILLIS);
		}
		return clientConfiguration;
	}

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public List<String> listRegions() {
		JsonNode page = getServiceClient(AwsOperations.EC2, regionDiscoveryRegion).call("DescribeRegions",
				ImmutableMap.of());
		List<String> regions = Lists.newArrayList();
		for (JsonNode region : page.path("Regions")) {
			JsonUtil.text(region, "RegionName").ifPresent(regions::add);
		}
		regions.sort(null);
		logger.info("discovered {} regions", regions.size());
		return regions;
	}

	@Override
	public ServiceClient getServiceClient(String service, String region) {
		Preconditions.checkNotNull(service, "service cannot be null");
		Preconditions.checkNotNull(region, "region cannot be null");
		String key = service.toLowerCase(Locale.ROOT) + "/" + region;
		return clients.computeIfAbsent(key, k -> newServiceClient(service.toLowerCase(Locale.ROOT), region));
	}

	protected AwsServiceClient newServiceClient(String service, String region) {
		logger.debug("creating {} client for {}", service, region);
		switch (service) {
		case AwsOperations.EC2:
			return AwsOperations.ec2(createClient(AmazonEC2Client.class, region), region);
		case AwsOperations.S3:
			return AwsOperations.s3(createClient(AmazonS3Client.class, region), region);
		case AwsOperations.RDS:
			return AwsOperations.rds(createClient(AmazonRDSClient.class, region), region);
		case AwsOperations.LAMBDA:
			return AwsOperations.lambda(createClient(AWSLambdaClient.class, region), region);
		case AwsOperations.DYNAMODB:
			return AwsOperations.dynamodb(createClient(AmazonDynamoDBClient.class, region), region);
		case AwsOperations.ELB:
			return AwsOperations.elb(createClient(
					com.amazonaws.services.elasticloadbalancing.AmazonElasticLoadBalancingClient.class, region), region);
		case AwsOperations.ELBV2:
			return AwsOperations.elbv2(createClient(
					com.amazonaws.services.elasticloadbalancingv2.AmazonElasticLoadBalancingClient.class, region),
					region);
		case AwsOperations.ECS:
			return AwsOperations.ecs(createClient(AmazonECSClient.class, region), region);
		case AwsOperations.EKS:
			return AwsOperations.eks(createClient(AmazonEKSClient.class, region), region);
		case AwsOperations.CLOUDFRONT:
			return AwsOperations.cloudfront(createClient(AmazonCloudFrontClient.class, region), region);
		case AwsOperations.ROUTE53:
			return AwsOperations.route53(createClient(AmazonRoute53Client.class, region), region);
		case AwsOperations.APIGATEWAY:
			return AwsOperations.apigateway(createClient(AmazonApiGatewayClient.class, region), region);
		case AwsOperations.APIGATEWAYV2:
			return AwsOperations.apigatewayv2(createClient(AmazonApiGatewayV2Client.class, region), region);
		case AwsOperations.DIRECT_CONNECT:
			return AwsOperations.directconnect(createClient(AmazonDirectConnectClient.class, region), region);
		default:
			throw new IllegalArgumentException("unsupported service: " + service);
		}
	}

	@SuppressWarnings("rawtypes")
	protected AwsClientBuilder configure(AwsClientBuilder b, String region) {
		b.withRegion(region);
		b.withCredentials(getCredentialsProvider());
		b.withClientConfiguration(getClientConfiguration());
		return b;
	}

	@SuppressWarnings("rawtypes")
	protected <T> T createClient(Class<T> clazz, String region) {
		try {
			String builderClass = clazz.getName() + "Builder";
			Class<?> builderClazz = Class.forName(builderClass);
			Method m = builderClazz.getMethod("standard");
			AwsSyncClientBuilder b = (AwsSyncClientBuilder) m.invoke(null);
			if (b instanceof AmazonS3ClientBuilder) {
				// buckets live in many regions, one client must reach all of them
				((AmazonS3ClientBuilder) b).enableForceGlobalBucketAccess();
			}
			configure(b, region);
			return clazz.cast(b.build());
		} catch (ClassNotFoundException | IllegalAccessException | InvocationTargetException
				| NoSuchMethodException e) {
			throw new SurveyorException(e);
		}
	}
}
