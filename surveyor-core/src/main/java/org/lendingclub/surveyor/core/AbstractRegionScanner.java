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

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

public abstract class AbstractRegionScanner implements RegionScanner {

	protected final Logger logger = LoggerFactory.getLogger(getClass());

	private final String serviceName;
	private final ScannerConfig config;
	private final TokenBucket rateLimiter;

	public AbstractRegionScanner(String serviceName, ScannerConfig config) {
		this(serviceName, config, null);
	}

	protected AbstractRegionScanner(String serviceName, ScannerConfig config, TokenBucket rateLimiter) {
		Preconditions.checkNotNull(serviceName, "serviceName cannot be null");
		Preconditions.checkNotNull(config, "config cannot be null");
		this.serviceName = serviceName;
		this.config = config;
		if (rateLimiter == null) {
			// explicit per-service setting, then the scanner's own default, then the global rate
			double rate = config.getServiceRateLimit(serviceName)
					.orElse(getDefaultRateLimitPerSecond().orElse(config.getRequestsPerSecond()));
			logger.info("{} rate limit {} calls/second", serviceName, rate);
			this.rateLimiter = new TokenBucket(rate);
		} else {
			this.rateLimiter = rateLimiter;
		}
	}

	@Override
	public String getServiceName() {
		return serviceName;
	}

	@Override
	public TokenBucket getRateLimiter() {
		return rateLimiter;
	}

	public ScannerConfig getConfig() {
		return config;
	}

	/**
	 * Takes one token for a provider call beyond the first one of a region scan.
	 */
	public void rateLimit() {
		checkCancelled();
		rateLimiter.acquire(1);
	}

	protected void checkCancelled() {
		if (Thread.currentThread().isInterrupted()) {
			throw new ScanCancelledException(serviceName + " scan cancelled");
		}
	}

	public Optional<Double> getDefaultRateLimitPerSecond() {
		return Optional.empty();
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("service", serviceName).add("rateLimiter", rateLimiter)
				.toString();
	}
}
