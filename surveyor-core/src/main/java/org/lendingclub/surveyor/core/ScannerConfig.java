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
package org.lendingclub.surveyor.core;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

/**
 * Immutable scan settings. Built once at startup and handed to the orchestrator and
 * to every scanner; nothing reads configuration from global state.
 * <p>
 * Allow and deny lists follow one rule for regions and services alike: an entry in
 * the skip list is excluded even when it is also in the only list.
 */
public class ScannerConfig {

	public static final int DEFAULT_MAX_CONCURRENT_REGIONS = 10;
	public static final int DEFAULT_MAX_CONCURRENT_SERVICES = 5;
	public static final int DEFAULT_MAX_RETRIES = 3;
	public static final double DEFAULT_RETRY_DELAY = 1.0;
	public static final double DEFAULT_RETRY_BACKOFF = 2.0;
	public static final double DEFAULT_REQUESTS_PER_SECOND = 10.0;
	public static final String DEFAULT_GLOBAL_REGION = "us-east-1";
	public static final String DEFAULT_REPORT_FORMAT = "markdown";
	public static final String DEFAULT_REPORT_PATH = "aws-resources-report.md";
	public static final String DEFAULT_LOG_LEVEL = "INFO";
	public static final String LOG_FORMAT_TEXT = "text";
	public static final String LOG_FORMAT_JSON = "json";
	public static final String DEFAULT_LOG_FORMAT = LOG_FORMAT_TEXT;

	private final int maxConcurrentRegions;
	private final int maxConcurrentServices;
	private final int maxRetries;
	private final double retryDelay;
	private final double retryBackoff;
	private final double requestsPerSecond;
	private final Set<String> skipRegions;
	private final Set<String> onlyRegions;
	private final Set<String> skipServices;
	private final Set<String> onlyServices;
	private final Map<String, Double> serviceRateLimits;
	private final String globalRegion;
	private final String reportFormat;
	private final String reportPath;
	private final String logLevel;
	private final String logFormat;

	private ScannerConfig(Builder b) {
		this.maxConcurrentRegions = b.maxConcurrentRegions;
		this.maxConcurrentServices = b.maxConcurrentServices;
		this.maxRetries = b.maxRetries;
		this.retryDelay = b.retryDelay;
		this.retryBackoff = b.retryBackoff;
		this.requestsPerSecond = b.requestsPerSecond;
		this.skipRegions = ImmutableSet.copyOf(b.skipRegions);
		this.onlyRegions = ImmutableSet.copyOf(b.onlyRegions);
		this.skipServices = ImmutableSet.copyOf(b.skipServices);
		this.onlyServices = ImmutableSet.copyOf(b.onlyServices);
		this.serviceRateLimits = ImmutableMap.copyOf(b.serviceRateLimits);
		this.globalRegion = b.globalRegion;
		this.reportFormat = b.reportFormat;
		this.reportPath = b.reportPath;
		this.logLevel = b.logLevel;
		this.logFormat = b.logFormat;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static ScannerConfig defaults() {
		return builder().build();
	}

	public Builder toBuilder() {
		return new Builder(this);
	}

	public int getMaxConcurrentRegions() {
		return maxConcurrentRegions;
	}

	public int getMaxConcurrentServices() {
		return maxConcurrentServices;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	/**
	 * Initial delay between attempts, in seconds.
	 */
	public double getRetryDelay() {
		return retryDelay;
	}

	public double getRetryBackoff() {
		return retryBackoff;
	}

	public double getRequestsPerSecond() {
		return requestsPerSecond;
	}

	public Set<String> getSkipRegions() {
		return skipRegions;
	}

	public Set<String> getOnlyRegions() {
		return onlyRegions;
	}

	public Set<String> getSkipServices() {
		return skipServices;
	}

	public Set<String> getOnlyServices() {
		return onlyServices;
	}

	public Map<String, Double> getServiceRateLimits() {
		return serviceRateLimits;
	}

	public Optional<Double> getServiceRateLimit(String service) {
		return Optional.ofNullable(serviceRateLimits.get(normalizeService(service)));
	}

	public String getGlobalRegion() {
		return globalRegion;
	}

	public String getReportFormat() {
		return reportFormat;
	}

	public String getReportPath() {
		return reportPath;
	}

	public String getLogLevel() {
		return logLevel;
	}

	/**
	 * <code>text</code> or <code>json</code>, one JSON object per log event.
	 */
	public String getLogFormat() {
		return logFormat;
	}

	public boolean isRegionIncluded(String region) {
		if (region == null || skipRegions.contains(region)) {
			return false;
		}
		return onlyRegions.isEmpty() || onlyRegions.contains(region);
	}

	public boolean isServiceIncluded(String service) {
		String s = normalizeService(service);
		if (s.isEmpty() || skipServices.contains(s)) {
			return false;
		}
		return onlyServices.isEmpty() || onlyServices.contains(s);
	}

	/**
	 * Upper bound on concurrent provider calls for one run.
	 */
	public int getMaxConcurrentCalls() {
		return maxConcurrentRegions * maxConcurrentServices;
	}

	static String normalizeService(String service) {
		return Strings.nullToEmpty(service).trim().toLowerCase(Locale.ROOT);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("maxConcurrentRegions", maxConcurrentRegions)
				.add("maxConcurrentServices", maxConcurrentServices).add("maxRetries", maxRetries)
				.add("retryDelay", retryDelay).add("retryBackoff", retryBackoff)
				.add("requestsPerSecond", requestsPerSecond).add("skipRegions", skipRegions)
				.add("onlyRegions", onlyRegions).add("skipServices", skipServices).add("onlyServices", onlyServices)
				.add("serviceRateLimits", serviceRateLimits).add("globalRegion", globalRegion).toString();
	}

	public static class Builder {
		int maxConcurrentRegions = DEFAULT_MAX_CONCURRENT_REGIONS;
		int maxConcurrentServices = DEFAULT_MAX_CONCURRENT_SERVICES;
		int maxRetries = DEFAULT_MAX_RETRIES;
		double retryDelay = DEFAULT_RETRY_DELAY;
		double retryBackoff = DEFAULT_RETRY_BACKOFF;
		double requestsPerSecond = DEFAULT_REQUESTS_PER_SECOND;
		Set<String> skipRegions = ImmutableSet.of();
		Set<String> onlyRegions = ImmutableSet.of();
		Set<String> skipServices = ImmutableSet.of();
		Set<String> onlyServices = ImmutableSet.of();
		Map<String, Double> serviceRateLimits = Maps.newLinkedHashMap();
		String globalRegion = DEFAULT_GLOBAL_REGION;
		String reportFormat = DEFAULT_REPORT_FORMAT;
		String reportPath = DEFAULT_REPORT_PATH;
		String logLevel = DEFAULT_LOG_LEVEL;
		String logFormat = DEFAULT_LOG_FORMAT;

		Builder() {
		}

		Builder(ScannerConfig c) {
			this.maxConcurrentRegions = c.maxConcurrentRegions;
			this.maxConcurrentServices = c.maxConcurrentServices;
			this.maxRetries = c.maxRetries;
			this.retryDelay = c.retryDelay;
			this.retryBackoff = c.retryBackoff;
			this.requestsPerSecond = c.requestsPerSecond;
			this.skipRegions = c.skipRegions;
			this.onlyRegions = c.onlyRegions;
			this.skipServices = c.skipServices;
			this.onlyServices = c.onlyServices;
			this.serviceRateLimits = Maps.newLinkedHashMap(c.serviceRateLimits);
			this.globalRegion = c.globalRegion;
			this.reportFormat = c.reportFormat;
			this.reportPath = c.reportPath;
			this.logLevel = c.logLevel;
			this.logFormat = c.logFormat;
		}

		public Builder withMaxConcurrentRegions(int n) {
			this.maxConcurrentRegions = n;
			return this;
		}

		public Builder withMaxConcurrentServices(int n) {
			this.maxConcurrentServices = n;
			return this;
		}

		public Builder withMaxRetries(int n) {
			this.maxRetries = n;
			return this;
		}

		public Builder withRetryDelay(double seconds) {
			this.retryDelay = seconds;
			return this;
		}

		public Builder withRetryBackoff(double factor) {
			this.retryBackoff = factor;
			return this;
		}

		public Builder withRequestsPerSecond(double rate) {
			this.requestsPerSecond = rate;
			return this;
		}

		public Builder withSkipRegions(Collection<String> regions) {
			this.skipRegions = ImmutableSet.copyOf(regions);
			return this;
		}

		public Builder withOnlyRegions(Collection<String> regions) {
			this.onlyRegions = ImmutableSet.copyOf(regions);
			return this;
		}

		public Builder withSkipServices(Collection<String> services) {
			this.skipServices = normalize(services);
			return this;
		}

		public Builder withOnlyServices(Collection<String> services) {
			this.onlyServices = normalize(services);
			return this;
		}

		public Builder withServiceRateLimit(String service, double rate) {
			this.serviceRateLimits.put(normalizeService(service), rate);
			return this;
		}

		public Builder withGlobalRegion(String region) {
			this.globalRegion = region;
			return this;
		}

		public Builder withReportFormat(String format) {
			this.reportFormat = format;
			return this;
		}

		public Builder withReportPath(String path) {
			this.reportPath = path;
			return this;
		}

		public Builder withLogLevel(String level) {
			this.logLevel = level;
			return this;
		}

		public Builder withLogFormat(String format) {
			this.logFormat = Strings.nullToEmpty(format).trim().toLowerCase(Locale.ROOT);
			return this;
		}

		private static Set<String> normalize(Collection<String> services) {
			ImmutableSet.Builder<String> b = ImmutableSet.builder();
			for (String s : services) {
				if (!Strings.isNullOrEmpty(s)) {
					b.add(normalizeService(s));
				}
			}
			return b.build();
		}

		public ScannerConfig build() {
			Preconditions.checkArgument(maxConcurrentRegions > 0, "max_concurrent_regions must be > 0");
			Preconditions.checkArgument(maxConcurrentServices > 0, "max_concurrent_services must be > 0");
			Preconditions.checkArgument(maxRetries >= 1, "max_retries must be >= 1");
			Preconditions.checkArgument(retryDelay > 0, "retry_delay must be > 0");
			Preconditions.checkArgument(retryBackoff >= 1.0, "retry_backoff must be >= 1.0");
			Preconditions.checkArgument(requestsPerSecond > 0, "requests_per_second must be > 0");
			serviceRateLimits.forEach((service, rate) -> {
				Preconditions.checkArgument(rate != null && rate > 0, "rate limit for %s must be > 0", service);
			});
			Preconditions.checkArgument(!Strings.isNullOrEmpty(globalRegion), "global_region cannot be empty");
			Preconditions.checkArgument(LOG_FORMAT_TEXT.equals(logFormat) || LOG_FORMAT_JSON.equals(logFormat),
					"log_format must be text or json: %s", logFormat);
			return new ScannerConfig(this);
		}
	}
}
