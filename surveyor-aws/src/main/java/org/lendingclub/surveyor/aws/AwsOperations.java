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

import org.lendingclub.surveyor.aws.AwsServiceClient.Page;

import com.amazonaws.services.apigateway.AmazonApiGatewayClient;
import com.amazonaws.services.apigateway.model.GetRestApisRequest;
import com.amazonaws.services.apigateway.model.GetRestApisResult;
import com.amazonaws.services.apigateway.model.GetStagesRequest;
import com.amazonaws.services.apigateway.model.GetStagesResult;
import com.amazonaws.services.apigateway.model.RestApi;
import com.amazonaws.services.apigatewayv2.AmazonApiGatewayV2Client;
import com.amazonaws.services.apigatewayv2.model.Api;
import com.amazonaws.services.apigatewayv2.model.GetApisRequest;
import com.amazonaws.services.apigatewayv2.model.GetApisResult;
import com.amazonaws.services.cloudfront.AmazonCloudFrontClient;
import com.amazonaws.services.cloudfront.model.DistributionList;
import com.amazonaws.services.cloudfront.model.ListDistributionsRequest;
import com.amazonaws.services.cloudfront.model.ListTagsForResourceRequest;
import com.amazonaws.services.cloudfront.model.Tags;
import com.amazonaws.services.directconnect.AmazonDirectConnectClient;
import com.amazonaws.services.directconnect.model.DescribeVirtualInterfacesRequest;
import com.amazonaws.services.dynamodbv2.AmazonDynamoDBClient;
import com.amazonaws.services.dynamodbv2.model.DescribeTableRequest;
import com.amazonaws.services.dynamodbv2.model.ListTablesRequest;
import com.amazonaws.services.dynamodbv2.model.ListTablesResult;
import com.amazonaws.services.ec2.AmazonEC2Client;
import com.amazonaws.services.ec2.model.DescribeAddressesRequest;
import com.amazonaws.services.ec2.model.DescribeInstancesRequest;
import com.amazonaws.services.ec2.model.DescribeInstancesResult;
import com.amazonaws.services.ec2.model.DescribeNatGatewaysRequest;
import com.amazonaws.services.ec2.model.DescribeNatGatewaysResult;
import com.amazonaws.services.ec2.model.DescribeRegionsRequest;
import com.amazonaws.services.ec2.model.DescribeSnapshotsRequest;
import com.amazonaws.services.ec2.model.DescribeSnapshotsResult;
import com.amazonaws.services.ec2.model.DescribeTransitGatewayAttachmentsRequest;
import com.amazonaws.services.ec2.model.DescribeTransitGatewayAttachmentsResult;
import com.amazonaws.services.ec2.model.DescribeTransitGatewaysRequest;
import com.amazonaws.services.ec2.model.DescribeTransitGatewaysResult;
import com.amazonaws.services.ec2.model.DescribeVolumesRequest;
import com.amazonaws.services.ec2.model.DescribeVolumesResult;
import com.amazonaws.services.ec2.model.DescribeVpcEndpointsRequest;
import com.amazonaws.services.ec2.model.DescribeVpcEndpointsResult;
import com.amazonaws.services.ec2.model.DescribeVpcsRequest;
import com.amazonaws.services.ec2.model.DescribeVpcsResult;
import com.amazonaws.services.ec2.model.DescribeVpnConnectionsRequest;
import com.amazonaws.services.ecs.AmazonECSClient;
import com.amazonaws.services.ecs.model.DescribeClustersRequest;
import com.amazonaws.services.ecs.model.DescribeClustersResult;
import com.amazonaws.services.ecs.model.DescribeServicesRequest;
import com.amazonaws.services.ecs.model.DescribeServicesResult;
import com.amazonaws.services.ecs.model.ListClustersRequest;
import com.amazonaws.services.ecs.model.ListClustersResult;
import com.amazonaws.services.ecs.model.ListServicesRequest;
import com.amazonaws.services.ecs.model.ListServicesResult;
import com.amazonaws.services.eks.AmazonEKSClient;
import com.amazonaws.services.eks.model.DescribeClusterRequest;
import com.amazonaws.services.eks.model.DescribeNodegroupRequest;
import com.amazonaws.services.eks.model.ListNodegroupsRequest;
import com.amazonaws.services.eks.model.ListNodegroupsResult;
import com.amazonaws.services.eks.model.Nodegroup;
import com.amazonaws.services.lambda.AWSLambdaClient;
import com.amazonaws.services.lambda.model.ListFunctionsRequest;
import com.amazonaws.services.lambda.model.ListFunctionsResult;
import com.amazonaws.services.rds.AmazonRDSClient;
import com.amazonaws.services.rds.model.DescribeDBClustersRequest;
import com.amazonaws.services.rds.model.DescribeDBClustersResult;
import com.amazonaws.services.rds.model.DescribeDBInstancesRequest;
import com.amazonaws.services.rds.model.DescribeDBInstancesResult;
import com.amazonaws.services.rds.model.DescribeDBSnapshotsRequest;
import com.amazonaws.services.rds.model.DescribeDBSnapshotsResult;
import com.amazonaws.services.route53.AmazonRoute53Client;
import com.amazonaws.services.route53.model.ListHealthChecksRequest;
import com.amazonaws.services.route53.model.ListHealthChecksResult;
import com.amazonaws.services.route53.model.ListHostedZonesRequest;
import com.amazonaws.services.route53.model.ListHostedZonesResult;
import com.amazonaws.services.route53.model.ResourceTagSet;
import com.amazonaws.services.s3.AmazonS3Client;
import com.amazonaws.services.s3.model.Bucket;
import com.amazonaws.services.s3.model.BucketLifecycleConfiguration;
import com.amazonaws.services.s3.model.BucketTaggingConfiguration;
import com.amazonaws.services.s3.model.BucketVersioningConfiguration;
import com.amazonaws.services.s3.model.GetPublicAccessBlockRequest;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.PublicAccessBlockConfiguration;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import com.amazonaws.services.s3.model.ServerSideEncryptionConfiguration;
import com.amazonaws.services.s3.model.TagSet;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Strings;

/**
 * Binds the operation names used by the scanners to AWS SDK calls. Operation
 * names and the item fields of each page follow the AWS API reference.
 */
public class AwsOperations {

	public static final String EC2 = "ec2";
	public static final String S3 = "s3";
	public static final String RDS = "rds";
	public static final String LAMBDA = "lambda";
	public static final String DYNAMODB = "dynamodb";
	public static final String ELB = "elasticloadbalancing";
	public static final String ELBV2 = "elasticloadbalancingv2";
	public static final String ECS = "ecs";
	public static final String EKS = "eks";
	public static final String CLOUDFRONT = "cloudfront";
	public static final String ROUTE53 = "route53";
	public static final String APIGATEWAY = "apigateway";
	public static final String APIGATEWAYV2 = "apigatewayv2";
	public static final String DIRECT_CONNECT = "directconnect";

	static JsonConverter converter = new JsonConverter();

	private AwsOperations() {
	}

	public static AwsServiceClient ec2(AmazonEC2Client ec2, String region) {
		return new AwsServiceClient(EC2, region).withOperation("DescribeRegions", params -> token -> {
			return Page.last(converter.page("Regions", ec2.describeRegions(new DescribeRegionsRequest()).getRegions()));
		}).withOperation("DescribeInstances", params -> token -> {
			DescribeInstancesResult result = ec2.describeInstances(new DescribeInstancesRequest().withNextToken(token));
			return new Page(converter.page("Reservations", result.getReservations()), result.getNextToken());
		}).withOperation("DescribeVolumes", params -> token -> {
			DescribeVolumesResult result = ec2.describeVolumes(new DescribeVolumesRequest().withNextToken(token));
			return new Page(converter.page("Volumes", result.getVolumes()), result.getNextToken());
		}).withOperation("DescribeSnapshots", params -> token -> {
			DescribeSnapshotsRequest request = new DescribeSnapshotsRequest().withNextToken(token);
			String owner = AwsServiceClient.param(params, "OwnerIds");
			if (!Strings.isNullOrEmpty(owner)) {
				request.withOwnerIds(owner);
			}
			DescribeSnapshotsResult result = ec2.describeSnapshots(request);
			return new Page(converter.page("Snapshots", result.getSnapshots()), result.getNextToken());
		}).withOperation("DescribeAddresses", params -> token -> {
			return Page.last(converter.page("Addresses", ec2.describeAddresses(new DescribeAddressesRequest()).getAddresses()));
		}).withOperation("DescribeNatGateways", params -> token -> {
			DescribeNatGatewaysResult result = ec2
					.describeNatGateways(new DescribeNatGatewaysRequest().withNextToken(token));
			return new Page(converter.page("NatGateways", result.getNatGateways()), result.getNextToken());
		}).withOperation("DescribeVpcs", params -> token -> {
			DescribeVpcsResult result = ec2.describeVpcs(new DescribeVpcsRequest().withNextToken(token));
			return new Page(converter.page("Vpcs", result.getVpcs()), result.getNextToken());
		}).withOperation("DescribeTransitGateways", params -> token -> {
			DescribeTransitGatewaysResult result = ec2
					.describeTransitGateways(new DescribeTransitGatewaysRequest().withNextToken(token));
			return new Page(converter.page("TransitGateways", result.getTransitGateways()), result.getNextToken());
		}).withOperation("DescribeTransitGatewayAttachments", params -> token -> {
			DescribeTransitGatewayAttachmentsResult result = ec2.describeTransitGatewayAttachments(
					new DescribeTransitGatewayAttachmentsRequest().withNextToken(token));
			return new Page(converter.page("TransitGatewayAttachments", result.getTransitGatewayAttachments()),
					result.getNextToken());
		}).withOperation("DescribeVpcEndpoints", params -> token -> {
			DescribeVpcEndpointsResult result = ec2
					.describeVpcEndpoints(new DescribeVpcEndpointsRequest().withNextToken(token));
			return new Page(converter.page("VpcEndpoints", result.getVpcEndpoints()), result.getNextToken());
		}).withOperation("DescribeVpnConnections", params -> token -> {
			return Page.last(converter.page("VpnConnections",
					ec2.describeVpnConnections(new DescribeVpnConnectionsRequest()).getVpnConnections()));
		});
	}

	public static AwsServiceClient s3(AmazonS3Client s3, String region) {
		return new AwsServiceClient(S3, region).withOperation("ListBuckets", params -> token -> {
			ObjectNode page = converter.createObjectNode();
			ArrayNode buckets = page.putArray("Buckets");
			for (Bucket bucket : s3.listBuckets()) {
				ObjectNode n = buckets.addObject().put("Name", bucket.getName());
				if (bucket.getCreationDate() != null) {
					n.put("CreationDate", bucket.getCreationDate().getTime());
				}
			}
			return Page.last(page);
		}).withOperation("GetBucketLocation", params -> token -> {
			String location = s3.getBucketLocation(AwsServiceClient.param(params, "Bucket"));
			ObjectNode page = converter.createObjectNode();
			// the SDK reports us-east-1 as "US", the API leaves it empty
			if (!Strings.isNullOrEmpty(location) && !"US".equals(location)) {
				page.put("LocationConstraint", location);
			}
			return Page.last(page);
		}).withOperation("ListObjectsV2", params -> token -> {
			ListObjectsV2Request request = new ListObjectsV2Request()
					.withBucketName(AwsServiceClient.param(params, "Bucket")).withContinuationToken(token);
			String maxKeys = AwsServiceClient.param(params, "MaxKeys");
			if (maxKeys != null) {
				request.withMaxKeys(Integer.parseInt(maxKeys));
			}
			ListObjectsV2Result result = s3.listObjectsV2(request);
			ObjectNode page = converter.createObjectNode().put("KeyCount", result.getKeyCount());
			ArrayNode contents = page.putArray("Contents");
			for (S3ObjectSummary summary : result.getObjectSummaries()) {
				contents.addObject().put("Key", summary.getKey()).put("Size", summary.getSize());
			}
			return new Page(page, result.isTruncated() ? result.getNextContinuationToken() : null);
		}).withOperation("GetBucketVersioning", params -> token -> {
			BucketVersioningConfiguration versioning = s3
					.getBucketVersioningConfiguration(AwsServiceClient.param(params, "Bucket"));
			ObjectNode page = converter.createObjectNode();
			if (versioning != null && versioning.getStatus() != null) {
				page.put("Status", versioning.getStatus());
			}
			return Page.last(page);
		}).withOperation("GetBucketLifecycleConfiguration", params -> token -> {
			BucketLifecycleConfiguration lifecycle = s3
					.getBucketLifecycleConfiguration(AwsServiceClient.param(params, "Bucket"));
			ObjectNode page = converter.createObjectNode();
			ArrayNode rules = page.putArray("Rules");
			if (lifecycle != null && lifecycle.getRules() != null) {
				for (BucketLifecycleConfiguration.Rule rule : lifecycle.getRules()) {
					rules.addObject().put("ID", rule.getId()).put("Status", rule.getStatus());
				}
			}
			return Page.last(page);
		}).withOperation("GetBucketTagging", params -> token -> {
			BucketTaggingConfiguration tagging = s3
					.getBucketTaggingConfiguration(AwsServiceClient.param(params, "Bucket"));
			ObjectNode page = converter.createObjectNode();
			ArrayNode tags = page.putArray("TagSet");
			if (tagging != null) {
				for (TagSet tagSet : tagging.getAllTagSets()) {
					for (Map.Entry<String, String> tag : tagSet.getAllTags().entrySet()) {
						tags.addObject().put("Key", tag.getKey()).put("Value", tag.getValue());
					}
				}
			}
			return Page.last(page);
		}).withOperation("GetBucketEncryption", params -> token -> {
			ServerSideEncryptionConfiguration sse = s3.getBucketEncryption(AwsServiceClient.param(params, "Bucket"))
					.getServerSideEncryptionConfiguration();
			return Page.last(converter.page("Rules", sse == null ? null : sse.getRules()));
		}).withOperation("GetPublicAccessBlock", params -> token -> {
			PublicAccessBlockConfiguration config = s3.getPublicAccessBlock(
					new GetPublicAccessBlockRequest().withBucketName(AwsServiceClient.param(params, "Bucket")))
					.getPublicAccessBlockConfiguration();
			ObjectNode page = converter.createObjectNode();
			if (config != null) {
				page.set("PublicAccessBlockConfiguration", converter.toJson(config));
			}
			return Page.last(page);
		});
	}

	public static AwsServiceClient rds(AmazonRDSClient rds, String region) {
		return new AwsServiceClient(RDS, region).withOperation("DescribeDBInstances", params -> token -> {
			DescribeDBInstancesResult result = rds.describeDBInstances(new DescribeDBInstancesRequest().withMarker(token));
			return new Page(converter.page("DBInstances", result.getDBInstances()), result.getMarker());
		}).withOperation("DescribeDBClusters", params -> token -> {
			DescribeDBClustersResult result = rds.describeDBClusters(new DescribeDBClustersRequest().withMarker(token));
			return new Page(converter.page("DBClusters", result.getDBClusters()), result.getMarker());
		}).withOperation("DescribeDBSnapshots", params -> token -> {
			DescribeDBSnapshotsRequest request = new DescribeDBSnapshotsRequest().withMarker(token);
			String snapshotType = AwsServiceClient.param(params, "SnapshotType");
			if (snapshotType != null) {
				request.withSnapshotType(snapshotType);
			}
			DescribeDBSnapshotsResult result = rds.describeDBSnapshots(request);
			return new Page(converter.page("DBSnapshots", result.getDBSnapshots()), result.getMarker());
		});
	}

	public static AwsServiceClient lambda(AWSLambdaClient lambda, String region) {
		return new AwsServiceClient(LAMBDA, region).withOperation("ListFunctions", params -> token -> {
			ListFunctionsResult result = lambda.listFunctions(new ListFunctionsRequest().withMarker(token));
			return new Page(converter.page("Functions", result.getFunctions()), result.getNextMarker());
		});
	}

	public static AwsServiceClient dynamodb(AmazonDynamoDBClient dynamo, String region) {
		return new AwsServiceClient(DYNAMODB, region).withOperation("ListTables", params -> token -> {
			ListTablesResult result = dynamo.listTables(new ListTablesRequest().withExclusiveStartTableName(token));
			List<String> names = result.getTableNames();
			return new Page(converter.page("TableNames", names), result.getLastEvaluatedTableName());
		}).withOperation("DescribeTable", params -> token -> {
			String name = AwsServiceClient.param(params, "TableName");
			ObjectNode page = converter.createObjectNode();
			page.set("Table", converter.toJson(dynamo.describeTable(new DescribeTableRequest(name)).getTable()));
			return Page.last(page);
		});
	}

	public static AwsServiceClient elb(com.amazonaws.services.elasticloadbalancing.AmazonElasticLoadBalancingClient elb,
			String region) {
		return new AwsServiceClient(ELB, region).withOperation("DescribeLoadBalancers", params -> token -> {
			com.amazonaws.services.elasticloadbalancing.model.DescribeLoadBalancersResult result = elb.describeLoadBalancers(
					new com.amazonaws.services.elasticloadbalancing.model.DescribeLoadBalancersRequest().withMarker(token));
			return new Page(converter.page("LoadBalancerDescriptions", result.getLoadBalancerDescriptions()),
					result.getNextMarker());
		});
	}

	public static AwsServiceClient elbv2(
			com.amazonaws.services.elasticloadbalancingv2.AmazonElasticLoadBalancingClient elb, String region) {
		return new AwsServiceClient(ELBV2, region).withOperation("DescribeLoadBalancers", params -> token -> {
			com.amazonaws.services.elasticloadbalancingv2.model.DescribeLoadBalancersResult result = elb
					.describeLoadBalancers(
							new com.amazonaws.services.elasticloadbalancingv2.model.DescribeLoadBalancersRequest()
									.withMarker(token));
			return new Page(converter.page("LoadBalancers", result.getLoadBalancers()), result.getNextMarker());
		});
	}

	public static AwsServiceClient ecs(AmazonECSClient ecs, String region) {
		return new AwsServiceClient(ECS, region).withOperation("ListClusters", params -> token -> {
			ListClustersResult result = ecs.listClusters(new ListClustersRequest().withNextToken(token));
			return new Page(converter.page("ClusterArns", result.getClusterArns()), result.getNextToken());
		}).withOperation("DescribeClusters", params -> token -> {
			DescribeClustersResult result = ecs.describeClusters(new DescribeClustersRequest()
					.withClusters(AwsServiceClient.listParam(params, "Clusters")).withInclude("STATISTICS", "TAGS"));
			return Page.last(converter.page("Clusters", result.getClusters()));
		}).withOperation("ListServices", params -> token -> {
			ListServicesResult result = ecs.listServices(
					new ListServicesRequest().withCluster(AwsServiceClient.param(params, "Cluster")).withNextToken(token));
			return new Page(converter.page("ServiceArns", result.getServiceArns()), result.getNextToken());
		}).withOperation("DescribeServices", params -> token -> {
			DescribeServicesResult result = ecs.describeServices(
					new DescribeServicesRequest().withCluster(AwsServiceClient.param(params, "Cluster"))
							.withServices(AwsServiceClient.listParam(params, "Services")).withInclude("TAGS"));
			return Page.last(converter.page("Services", result.getServices()));
		});
	}

	public static AwsServiceClient eks(AmazonEKSClient eks, String region) {
		return new AwsServiceClient(EKS, region).withOperation("ListClusters", params -> token -> {
			com.amazonaws.services.eks.model.ListClustersResult result = eks
					.listClusters(new com.amazonaws.services.eks.model.ListClustersRequest().withNextToken(token));
			return new Page(converter.page("Clusters", result.getClusters()), result.getNextToken());
		}).withOperation("DescribeCluster", params -> token -> {
			com.amazonaws.services.eks.model.Cluster cluster = eks
					.describeCluster(new DescribeClusterRequest().withName(AwsServiceClient.param(params, "Name")))
					.getCluster();
			ObjectNode page = converter.createObjectNode();
			page.set("Cluster", withTags(cluster, cluster.getTags()));
			return Page.last(page);
		}).withOperation("ListNodegroups", params -> token -> {
			ListNodegroupsResult result = eks.listNodegroups(new ListNodegroupsRequest()
					.withClusterName(AwsServiceClient.param(params, "ClusterName")).withNextToken(token));
			return new Page(converter.page("Nodegroups", result.getNodegroups()), result.getNextToken());
		}).withOperation("DescribeNodegroup", params -> token -> {
			Nodegroup nodegroup = eks.describeNodegroup(
					new DescribeNodegroupRequest().withClusterName(AwsServiceClient.param(params, "ClusterName"))
							.withNodegroupName(AwsServiceClient.param(params, "NodegroupName")))
					.getNodegroup();
			ObjectNode page = converter.createObjectNode();
			page.set("Nodegroup", withTags(nodegroup, nodegroup.getTags()));
			return Page.last(page);
		});
	}

	public static AwsServiceClient cloudfront(AmazonCloudFrontClient cloudfront, String region) {
		return new AwsServiceClient(CLOUDFRONT, region).withOperation("ListDistributions", params -> token -> {
			DistributionList list = cloudfront.listDistributions(new ListDistributionsRequest().withMarker(token))
					.getDistributionList();
			ObjectNode page = converter.createObjectNode();
			page.set("DistributionList", converter.page("Items", list == null ? null : list.getItems()));
			boolean truncated = list != null && Boolean.TRUE.equals(list.getIsTruncated());
			return new Page(page, truncated ? list.getNextMarker() : null);
		}).withOperation("ListTagsForResource", params -> token -> {
			Tags tags = cloudfront
					.listTagsForResource(new ListTagsForResourceRequest()
							.withResource(AwsServiceClient.param(params, "Resource")))
					.getTags();
			ObjectNode page = converter.createObjectNode();
			page.set("Tags", converter.page("Items", tags == null ? null : tags.getItems()));
			return Page.last(page);
		});
	}

	public static AwsServiceClient route53(AmazonRoute53Client route53, String region) {
		return new AwsServiceClient(ROUTE53, region).withOperation("ListHostedZones", params -> token -> {
			ListHostedZonesResult result = route53.listHostedZones(new ListHostedZonesRequest().withMarker(token));
			return new Page(converter.page("HostedZones", result.getHostedZones()),
					Boolean.TRUE.equals(result.getIsTruncated()) ? result.getNextMarker() : null);
		}).withOperation("ListHealthChecks", params -> token -> {
			ListHealthChecksResult result = route53.listHealthChecks(new ListHealthChecksRequest().withMarker(token));
			return new Page(converter.page("HealthChecks", result.getHealthChecks()),
					Boolean.TRUE.equals(result.getIsTruncated()) ? result.getNextMarker() : null);
		}).withOperation("ListTagsForResource", params -> token -> {
			ResourceTagSet tagSet = route53.listTagsForResource(
					new com.amazonaws.services.route53.model.ListTagsForResourceRequest()
							.withResourceType(AwsServiceClient.param(params, "ResourceType"))
							.withResourceId(AwsServiceClient.param(params, "ResourceId")))
					.getResourceTagSet();
			ObjectNode page = converter.createObjectNode();
			page.set("ResourceTagSet", converter.page("Tags", tagSet == null ? null : tagSet.getTags()));
			return Page.last(page);
		});
	}

	public static AwsServiceClient apigateway(AmazonApiGatewayClient apigateway, String region) {
		return new AwsServiceClient(APIGATEWAY, region).withOperation("GetRestApis", params -> token -> {
			GetRestApisResult result = apigateway.getRestApis(new GetRestApisRequest().withPosition(token));
			ObjectNode page = converter.createObjectNode();
			ArrayNode items = page.putArray("Items");
			if (result.getItems() != null) {
				for (RestApi api : result.getItems()) {
					items.add(withTags(api, api.getTags()));
				}
			}
			return new Page(page, result.getPosition());
		}).withOperation("GetStages", params -> token -> {
			GetStagesResult result = apigateway
					.getStages(new GetStagesRequest().withRestApiId(AwsServiceClient.param(params, "RestApiId")));
			return Page.last(converter.page("Item", result.getItem()));
		});
	}

	public static AwsServiceClient apigatewayv2(AmazonApiGatewayV2Client apigateway, String region) {
		return new AwsServiceClient(APIGATEWAYV2, region).withOperation("GetApis", params -> token -> {
			GetApisResult result = apigateway.getApis(new GetApisRequest().withNextToken(token));
			ObjectNode page = converter.createObjectNode();
			ArrayNode items = page.putArray("Items");
			if (result.getItems() != null) {
				for (Api api : result.getItems()) {
					items.add(withTags(api, api.getTags()));
				}
			}
			return new Page(page, result.getNextToken());
		}).withOperation("GetStages", params -> token -> {
			com.amazonaws.services.apigatewayv2.model.GetStagesResult result = apigateway
					.getStages(new com.amazonaws.services.apigatewayv2.model.GetStagesRequest()
							.withApiId(AwsServiceClient.param(params, "ApiId")).withNextToken(token));
			return new Page(converter.page("Items", result.getItems()), result.getNextToken());
		});
	}

	public static AwsServiceClient directconnect(AmazonDirectConnectClient directconnect, String region) {
		return new AwsServiceClient(DIRECT_CONNECT, region).withOperation("DescribeVirtualInterfaces",
				params -> token -> {
					return Page.last(converter.page("VirtualInterfaces", directconnect
							.describeVirtualInterfaces(new DescribeVirtualInterfacesRequest()).getVirtualInterfaces()));
				});
	}

	// tag maps keep their keys as written
	static JsonNode withTags(Object model, Map<String, String> tags) {
		ObjectNode n = (ObjectNode) converter.toJson(model);
		n.set("Tags", converter.toRawJson(tags));
		return n;
	}
}
