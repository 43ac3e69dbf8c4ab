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

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import org.lendingclub.surveyor.core.AbstractRegionScanner;
import org.lendingclub.surveyor.core.CloudProvider;
import org.lendingclub.surveyor.core.CostEstimator;
import org.lendingclub.surveyor.core.ErrorClassifier;
import org.lendingclub.surveyor.core.JsonUtil;
import org.lendingclub.surveyor.core.Resource;
import org.lendingclub.surveyor.core.ServiceClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Stopwatch;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * Base class for the AWS service scanners. A scanner describes the resources of
 * one service in one region, in one or more sections (instances, volumes,
 * snapshots...). A section the credentials may not read is skipped; when every
 * section is denied the region fails with the access-denied error.
 */
public abstract class AWSScanner extends AbstractRegionScanner {

	protected final AWSScannerBuilder builder;

	public AWSScanner(AWSScannerBuilder builder, String serviceName) {
		super(serviceName, builder.getConfig());
		this.builder = builder;
	}

	public CloudProvider getCloudProvider() {
		return builder.getCloudProvider();
	}

	public CostEstimator getCostEstimator() {
		return builder.getCostEstimator();
	}

	public ErrorClassifier getErrorClassifier() {
		return builder.getErrorClassifier();
	}

	@Override
	public List<Resource> scanRegion(String region) {
		Stopwatch sw = Stopwatch.createStarted();
		RegionScan scan = new RegionScan(region);
		doScan(scan);
		if (scan.sections > 0 && scan.deniedSections == scan.sections) {
			throw scan.lastDenial;
		}
		logger.info("scanned {} {} resources in {} ({} ms)", scan.resources.size(), getServiceName(), region,
				sw.elapsed().toMillis());
		return scan.resources;
	}

	protected abstract void doScan(RegionScan scan);

	/**
	 * Runs one section of a region scan. Access denied on the section is logged
	 * and skipped, every other failure fails the region.
	 */
	protected void section(RegionScan scan, String name, Runnable body) {
		scan.sections++;
		try {
			body.run();
		} catch (RuntimeException e) {
			if (!ErrorClassifier.isCancellation(e) && getErrorClassifier().isAccessDenied(e)) {
				logger.info("no access to {} {} in {}: {}", getServiceName(), name, scan.getRegion(), e.getMessage());
				scan.deniedSections++;
				scan.lastDenial = e;
				return;
			}
			throw e;
		}
	}

	protected Resource.Builder newResource(RegionScan scan, String type, String id) {
		return Resource.builder().withService(getServiceName()).withRegion(scan.getRegion()).withType(type)
				.withId(id);
	}

	/**
	 * A call whose failure only loses a detail of a resource. Cancellation still
	 * propagates.
	 */
	protected Optional<JsonNode> callQuietly(RegionScan scan, String apiService, String operation,
			Map<String, ?> params) {
		try {
			return Optional.of(scan.call(apiService, operation, params));
		} catch (RuntimeException e) {
			if (ErrorClassifier.isCancellation(e)) {
				throw e;
			}
			logger.debug("{} {} in {} failed: {}", apiService, operation, scan.getRegion(), e.toString());
			return Optional.empty();
		}
	}

	protected double estimateCost(String kind, Map<String, ?> attributes) {
		return getCostEstimator().estimate(kind, attributes);
	}

	/**
	 * Mutable attribute map for cost estimation; null values are allowed.
	 */
	protected static Map<String, Object> attributes(Object... keyValues) {
		Map<String, Object> m = Maps.newHashMap();
		for (int i = 0; i + 1 < keyValues.length; i += 2) {
			m.put(keyValues[i].toString(), keyValues[i + 1]);
		}
		return m;
	}

	public static Map<String, String> tags(JsonNode n) {
		return tags(n, "Tags");
	}

	public static Map<String, String> tags(JsonNode n, String field) {
		Map<String, String> tags = Maps.newLinkedHashMap();
		for (JsonNode tag : n.path(field)) {
			JsonUtil.text(tag, "Key").ifPresent(k -> tags.put(k, tag.path("Value").asText("")));
		}
		return tags;
	}

	protected static <K, V> Map<K, V> emptyToNull(Map<K, V> m) {
		return m == null || m.isEmpty() ? null : m;
	}

	protected static <T> List<T> emptyToNull(List<T> l) {
		return l == null || l.isEmpty() ? null : l;
	}

	/**
	 * Tags given as a JSON object of key to value, as EKS and API Gateway return them.
	 */
	public static Map<String, String> tagMap(JsonNode n, String field) {
		Map<String, String> tags = Maps.newLinkedHashMap();
		Iterator<Map.Entry<String, JsonNode>> it = n.path(field).fields();
		while (it.hasNext()) {
			Map.Entry<String, JsonNode> tag = it.next();
			tags.put(tag.getKey(), tag.getValue().asText(""));
		}
		return tags;
	}

	/**
	 * Plain Java value of a field: text, number, boolean, or a list of those.
	 * Missing and null fields yield null.
	 */
	public static Object value(JsonNode n, String field) {
		return value(n.path(field));
	}

	static Object value(JsonNode v) {
		if (v.isMissingNode() || v.isNull()) {
			return null;
		}
		if (v.isBoolean()) {
			return v.booleanValue();
		}
		if (v.isIntegralNumber()) {
			return v.canConvertToInt() ? (Object) v.intValue() : (Object) v.longValue();
		}
		if (v.isNumber()) {
			return v.doubleValue();
		}
		if (v.isArray()) {
			List<Object> list = Lists.newArrayList();
			v.forEach(it -> {
				Object x = value(it);
				if (x != null) {
					list.add(x);
				}
			});
			return list;
		}
		if (v.isObject()) {
			return v.toString();
		}
		return v.asText();
	}

	/**
	 * State of a single region scan.
	 */
	public class RegionScan {
		final String region;
		final List<Resource> resources = Lists.newArrayList();
		int sections = 0;
		int deniedSections = 0;
		RuntimeException lastDenial;
		boolean firstCallPaid = true;

		RegionScan(String region) {
			this.region = region;
		}

		public String getRegion() {
			return region;
		}

		public void add(Resource r) {
			resources.add(r);
		}

		public List<Resource> getResources() {
			return Collections.unmodifiableList(resources);
		}

		public ServiceClient client(String apiService) {
			return getCloudProvider().getServiceClient(apiService, region);
		}

		// the conductor pays for the first call of the region
		void beforeCall() {
			if (firstCallPaid) {
				firstCallPaid = false;
				checkCancelled();
			} else {
				rateLimit();
			}
		}

		public JsonNode call(String apiService, String operation, Map<String, ?> params) {
			beforeCall();
			return client(apiService).call(operation, params);
		}

		public JsonNode call(String apiService, String operation, Map<String, ?> params, String regionOverride) {
			beforeCall();
			return getCloudProvider().getServiceClient(apiService, regionOverride).call(operation, params);
		}

		/**
		 * Visits every element of <code>field</code> across all pages. A field such as
		 * <code>DistributionList/Items</code> names a nested array. A token is taken
		 * before each page fetch.
		 */
		public void forEachItem(String apiService, String operation, Map<String, ?> params, String field,
				Consumer<JsonNode> action) {
			Iterator<JsonNode> pages = client(apiService).paginate(operation, params).iterator();
			beforeCall();
			while (pages.hasNext()) {
				JsonNode page = pages.next();
				JsonNode items = field.indexOf('/') >= 0 ? page.at("/" + field) : page.path(field);
				for (JsonNode item : items) {
					action.accept(item);
				}
				beforeCall();
			}
		}
	}
}
