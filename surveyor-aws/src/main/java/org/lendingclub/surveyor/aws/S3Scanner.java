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
import java.util.Map;
import java.util.Optional;

import org.lendingclub.surveyor.core.ErrorClassifier;
import org.lendingclub.surveyor.core.JsonUtil;
import org.lendingclub.surveyor.core.ProviderException;
import org.lendingclub.surveyor.core.Resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableMap;

/**
 * S3 buckets. S3 is global: the bucket list is fetched once, from the global
 * region, and every bucket is reported in the <code>global</code> region with
 * its actual location in the details.
 */
public class S3Scanner extends AWSScanner {

	public static final String SERVICE_NAME = "S3";
	public static final String BUCKET = "Bucket";

	// first page only, sizes of large buckets are a lower bound
	public static final int OBJECT_SAMPLE_SIZE = 1000;

	static final String NO_ENCRYPTION = "ServerSideEncryptionConfigurationNotFoundError";
	static final String NO_PUBLIC_ACCESS_BLOCK = "NoSuchPublicAccessBlockConfiguration";

	static final double BYTES_PER_GB = 1024.0 * 1024.0 * 1024.0;

	public S3Scanner(AWSScannerBuilder builder) {
		super(builder, SERVICE_NAME);
	}

	@Override
	public boolean isGlobal() {
		return true;
	}

	@Override
	protected void doScan(RegionScan scan) {
		section(scan, "buckets", () -> {
			scan.forEachItem(AwsOperations.S3, "ListBuckets", ImmutableMap.of(), "Buckets", bucket -> {
				scan.add(scanBucket(scan, bucket));
			});
		});
	}

	Resource scanBucket(RegionScan scan, JsonNode bucket) {
		String name = bucket.path("Name").asText();
		Resource.Builder b = newResource(scan, BUCKET, name).withRegion(Resource.GLOBAL_REGION).withName(name)
				.withCreatedAt(JsonUtil.instant(bucket, "CreationDate").orElse(null)).withState("available");

		Optional<JsonNode> locationPage = detail(scan, name, "GetBucketLocation", scan.getRegion());
		if (!locationPage.isPresent()) {
			return b.withEstimatedMonthlyCost(AwsPricing.S3_MINIMUM_MONTHLY)
					.withInfo("error", "Could not fetch bucket details").build();
		}
		String location = toRegion(JsonUtil.text(locationPage.get(), "LocationConstraint").orElse(null));

		long objectCount = 0;
		long totalBytes = 0;
		Optional<JsonNode> objects = detail(scan, name, "ListObjectsV2", location);
		if (objects.isPresent()) {
			for (JsonNode object : objects.get().path("Contents")) {
				objectCount++;
				totalBytes += object.path("Size").asLong(0);
			}
		}
		double sizeGb = totalBytes / BYTES_PER_GB;

		boolean versioning = detail(scan, name, "GetBucketVersioning", location)
				.map(n -> "Enabled".equals(n.path("Status").asText())).orElse(false);
		int lifecycleRules = detail(scan, name, "GetBucketLifecycleConfiguration", location)
				.map(n -> n.path("Rules").size()).orElse(0);
		Map<String, String> tags = detail(scan, name, "GetBucketTagging", location).map(n -> tags(n, "TagSet"))
				.orElse(ImmutableMap.of());
		// null when the configuration could not be read
		Boolean encryption = null;
		String encryptionAlgorithm = null;
		Optional<JsonNode> sse = detail(scan, name, "GetBucketEncryption", location, NO_ENCRYPTION);
		if (sse.isPresent()) {
			JsonNode rules = sse.get().path("Rules");
			encryption = rules.size() > 0;
			encryptionAlgorithm = JsonUtil.text(rules.path(0).path("ApplyServerSideEncryptionByDefault"),
					"SSEAlgorithm").orElse(null);
		}
		Boolean publicAccess = detail(scan, name, "GetPublicAccessBlock", location, NO_PUBLIC_ACCESS_BLOCK)
				.map(n -> !isFullyBlocked(n.path("PublicAccessBlockConfiguration"))).orElse(null);
		if (tags.containsKey("Name")) {
			b.withName(tags.get("Name"));
		}

		return b.withEstimatedMonthlyCost(estimateCost(AwsCostEstimator.S3_BUCKET,
				attributes("sizeGb", sizeGb, "objectCount", objectCount, "versioning", versioning, "lifecycleRules",
						lifecycleRules)))
				.withInfo("location", location)
				.withInfo("objectCount", objectCount)
				.withInfo("totalSizeGb", Math.round(sizeGb * 100.0) / 100.0)
				.withInfo("size", formatSize(totalBytes))
				.withInfo("versioning", versioning)
				.withInfo("lifecycleRules", lifecycleRules)
				.withInfo("encryption", encryption)
				.withInfo("encryptionAlgorithm", encryptionAlgorithm)
				.withInfo("publicAccess", publicAccess)
				.withInfo("tags", tags.isEmpty() ? null : tags)
				.build();
	}

	/**
	 * One bucket detail call. A bucket without the configuration, or one the
	 * credentials may not read, has no detail; that does not fail the scan.
	 */
	Optional<JsonNode> detail(RegionScan scan, String bucket, String operation, String location) {
		return detail(scan, bucket, operation, location, null);
	}

	/**
	 * As {@link #detail(RegionScan, String, String, String)}, but the error
	 * <code>absentCode</code> means the bucket has no such configuration and
	 * yields an empty node.
	 */
	Optional<JsonNode> detail(RegionScan scan, String bucket, String operation, String location,
			String absentCode) {
		Map<String, Object> params = attributes("Bucket", bucket);
		if (operation.equals("ListObjectsV2")) {
			params.put("MaxKeys", OBJECT_SAMPLE_SIZE);
		}
		try {
			return Optional.of(scan.call(AwsOperations.S3, operation, params, location));
		} catch (RuntimeException e) {
			if (ErrorClassifier.isCancellation(e)) {
				throw e;
			}
			if (absentCode != null && hasErrorCode(e, absentCode)) {
				return Optional.of(MissingNode.getInstance());
			}
			logger.debug("{} on {} failed: {}", operation, bucket, e.toString());
			return Optional.empty();
		}
	}

	static boolean hasErrorCode(Throwable t, String code) {
		for (Throwable cause : Throwables.getCausalChain(t)) {
			if (cause instanceof ProviderException && code.equals(((ProviderException) cause).getErrorCode())) {
				return true;
			}
		}
		return false;
	}

	static boolean isFullyBlocked(JsonNode config) {
		for (String flag : new String[] { "BlockPublicAcls", "IgnorePublicAcls", "BlockPublicPolicy",
				"RestrictPublicBuckets" }) {
			if (!config.path(flag).asBoolean(false)) {
				return false;
			}
		}
		return true;
	}

	static String toRegion(String locationConstraint) {
		if (locationConstraint == null || locationConstraint.isEmpty() || "US".equals(locationConstraint)) {
			return "us-east-1";
		}
		if ("EU".equals(locationConstraint)) {
			return "eu-west-1";
		}
		return locationConstraint;
	}

	static String formatSize(long bytes) {
		double gb = bytes / BYTES_PER_GB;
		if (gb < 1.0) {
			return String.format(Locale.ROOT, "%.2f MB", bytes / (1024.0 * 1024.0));
		}
		return String.format(Locale.ROOT, "%.2f GB", gb);
	}
}
