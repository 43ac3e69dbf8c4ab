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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Scans one service across many regions in parallel.
 * <p>
 * Each region runs on its own worker, bounded by <code>max_concurrent_regions</code>.
 * A worker takes a token from the scanner's shared bucket, calls the scanner under
 * the retry policy and hands back a {@link RegionScanResult}. A failed region is
 * logged and contributes nothing; it never affects the other regions. Results are
 * gathered by the calling thread in completion order.
 */
public class ServiceScanConductor {

	Logger logger = LoggerFactory.getLogger(getClass());

	private final RegionScanner scanner;
	private final ScannerConfig config;
	private RetryPolicy retryPolicy;
	private ScanListener listener = ScanListener.NONE;

	public ServiceScanConductor(RegionScanner scanner, ScannerConfig config) {
		this.scanner = Preconditions.checkNotNull(scanner, "scanner cannot be null");
		this.config = Preconditions.checkNotNull(config, "config cannot be null");
		this.retryPolicy = RetryPolicy.fromConfig(config);
	}

	public ServiceScanConductor withRetryPolicy(RetryPolicy retryPolicy) {
		this.retryPolicy = Preconditions.checkNotNull(retryPolicy);
		return this;
	}

	public ServiceScanConductor withListener(ScanListener listener) {
		this.listener = listener == null ? ScanListener.NONE : listener;
		return this;
	}

	public String getServiceName() {
		return scanner.getServiceName();
	}

	public RegionScanner getScanner() {
		return scanner;
	}

	public List<Resource> scanAllRegions(Collection<String> regions) {
		return scan(regions).getResources();
	}

	/**
	 * Regions to scan after applying the allow and deny lists. A global service is
	 * scanned once, in the global region, and only if that region is itself
	 * selected.
	 */
	public List<String> selectRegions(Collection<String> regions) {
		List<String> selected = regions.stream().distinct().filter(config::isRegionIncluded)
				.collect(Collectors.toList());
		if (scanner.isGlobal()) {
			if (!selected.contains(config.getGlobalRegion())) {
				logger.info("{} is global and {} is not selected; skipping", scanner.getServiceName(),
						config.getGlobalRegion());
				return ImmutableList.of();
			}
			return ImmutableList.of(config.getGlobalRegion());
		}
		return selected;
	}

	public ServiceScanResult scan(Collection<String> regions) {
		String service = scanner.getServiceName();
		List<String> targets = selectRegions(regions);
		if (targets.isEmpty()) {
			logger.info("no regions to scan for {}", service);
			return new ServiceScanResult(service, ImmutableList.of());
		}
		logger.info("scanning {} across {} regions", service, targets.size());
		listener.serviceStarted(service, targets.size());

		Stopwatch sw = Stopwatch.createStarted();
		int nThreads = Math.min(config.getMaxConcurrentRegions(), targets.size());
		ThreadFactory threadFactory = new ThreadFactoryBuilder().setDaemon(true)
				.setNameFormat(ScannerConfig.normalizeService(service) + "-region-%d").build();
		ThreadPoolExecutor pool = new ThreadPoolExecutor(nThreads, nThreads, 0L, TimeUnit.MILLISECONDS,
				new LinkedBlockingQueue<Runnable>(), threadFactory);
		CompletionService<RegionScanResult> completionService = new ExecutorCompletionService<>(pool);
		Map<Future<RegionScanResult>, String> submitted = Maps.newHashMap();
		List<RegionScanResult> results = new ArrayList<>(targets.size());
		try {
			for (String region : targets) {
				submitted.put(completionService.submit(() -> scanRegion(region)), region);
			}
			for (int i = 0; i < targets.size(); i++) {
				Future<RegionScanResult> future = completionService.take();
				RegionScanResult result = collect(future, submitted.get(future));
				results.add(result);
				listener.regionCompleted(service, result);
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ScanCancelledException(service + " scan interrupted", e);
		} finally {
			pool.shutdownNow();
		}
		ServiceScanResult serviceResult = new ServiceScanResult(service, results);
		logger.info("completed scanning {}: {} resources from {} regions ({} failed) in {} ms", service,
				serviceResult.getResourceCount(), results.size(), serviceResult.getFailedRegions().size(),
				sw.elapsed(TimeUnit.MILLISECONDS));
		return serviceResult;
	}

	RegionScanResult scanRegion(String region) {
		Stopwatch sw = Stopwatch.createStarted();
		String description = scanner.getServiceName() + " in " + region;
		try {
			List<Resource> resources = retryPolicy.call(description, () -> {
				scanner.getRateLimiter().acquire(1);
				return scanner.scanRegion(region);
			});
			return RegionScanResult.success(region, resources, sw.elapsed());
		} catch (RuntimeException e) {
			if (ErrorClassifier.isCancellation(e)) {
				throw e;
			}
			ErrorKind kind = retryPolicy.getErrorClassifier().classify(e);
			return RegionScanResult.failure(region, e, kind, sw.elapsed());
		}
	}

	private RegionScanResult collect(Future<RegionScanResult> future, String region) throws InterruptedException {
		String service = scanner.getServiceName();
		RegionScanResult result;
		try {
			result = future.get();
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (ErrorClassifier.isCancellation(cause)) {
				throw new ScanCancelledException(service + " scan cancelled in " + region, cause);
			}
			// scanRegion() only lets Errors escape
			result = RegionScanResult.failure(region, cause, ErrorKind.FATAL, Duration.ZERO);
		}
		if (result.isSuccess()) {
			if (result.getResources().isEmpty()) {
				logger.debug("no {} resources found in {}", service, region);
			} else {
				logger.info("found {} {} resources in {} ({} ms)", result.getResources().size(), service, region,
						result.getDuration().toMillis());
			}
			return result;
		}
		Throwable error = result.getError().get();
		ErrorKind kind = result.getErrorKind().get();
		switch (kind) {
		case ACCESS_DENIED:
			logger.info("no access to {} in {}: {}", service, region, error.toString());
			break;
		case RATE_LIMITED:
		case TRANSIENT:
			logger.warn("giving up on {} in {} after {} attempts ({}): {}", service, region,
					retryPolicy.getMaxAttempts(), kind, error.toString());
			break;
		case FATAL:
			logger.error("failed to scan {} in {}", service, region, error);
			break;
		default:
			throw new IllegalStateException("unhandled error kind: " + kind);
		}
		return result;
	}
}
