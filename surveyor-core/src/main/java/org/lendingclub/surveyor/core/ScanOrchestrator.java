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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;

/**
 * Scans every registered service across every region.
 * <p>
 * Services run in parallel, at most <code>max_concurrent_services</code> at a time,
 * and each service fans out over its regions with up to
 * <code>max_concurrent_regions</code> workers, so a run may have the product of the
 * two in flight against the provider. A service whose scan blows up contributes no
 * resources and does not stop the others. The only failure that aborts a run is
 * being unable to list regions.
 *
 * <pre>
 * ScanOrchestrator orchestrator = ScanOrchestrator.builder().withConfig(config)
 * 		.withCloudProvider(provider).withRegistry(registry).build();
 * List&lt;Resource&gt; all = orchestrator.scanAll();
 * </pre>
 */
public class ScanOrchestrator {

	static Logger logger = LoggerFactory.getLogger(ScanOrchestrator.class);

	private final ScannerConfig config;
	private final ServiceRegistry registry;
	private final ScanListener listener;
	private final RetryPolicy retryPolicy;
	private final Supplier<List<String>> regionSupplier;
	private final AtomicReference<ScanDiagnostics> lastDiagnostics = new AtomicReference<>(new ScanDiagnostics());

	private ScanOrchestrator(Builder b) {
		this.config = b.config;
		this.registry = b.registry;
		this.listener = b.listener;
		this.retryPolicy = b.retryPolicy != null ? b.retryPolicy : RetryPolicy.fromConfig(b.config);
		if (b.regions != null) {
			List<String> regions = ImmutableList.copyOf(b.regions);
			this.regionSupplier = () -> regions;
		} else {
			CloudProvider provider = b.provider;
			this.regionSupplier = Suppliers.memoize(() -> listRegions(provider));
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	public ScannerConfig getConfig() {
		return config;
	}

	public ServiceRegistry getRegistry() {
		return registry;
	}

	/**
	 * Regions to scan, before the allow and deny lists are applied.
	 *
	 * @throws SurveyorException if the provider cannot list regions
	 */
	public List<String> getRegions() {
		return regionSupplier.get();
	}

	private List<String> listRegions(CloudProvider provider) {
		try {
			List<String> regions = retryPolicy.call("list " + provider.getName() + " regions",
					provider::listRegions);
			logger.info("found {} regions", regions.size());
			return ImmutableList.copyOf(regions);
		} catch (ScanCancelledException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new SurveyorException("unable to list regions", e);
		}
	}

	/**
	 * Registered scanners for the requested names that survive the service allow
	 * and deny lists, in registration order.
	 */
	public List<RegionScanner> selectServices(Collection<String> names) {
		List<RegionScanner> selected = new ArrayList<>();
		for (String name : names) {
			if (!registry.get(name).isPresent()) {
				logger.warn("no scanner registered for service {}", name);
			}
		}
		for (RegionScanner scanner : registry.getScanners()) {
			String service = scanner.getServiceName();
			boolean requested = names.stream().anyMatch(
					n -> ScannerConfig.normalizeService(n).equals(ScannerConfig.normalizeService(service)));
			if (requested && config.isServiceIncluded(service)) {
				selected.add(scanner);
			} else if (requested) {
				logger.info("skipping service {}", service);
			}
		}
		return selected;
	}

	public List<Resource> scanAll() {
		return scanServices(registry.getServiceNames());
	}

	/**
	 * Scans the named services and returns everything they found once all of them
	 * have completed.
	 *
	 * @throws ScanCancelledException if the calling thread is interrupted or the scan
	 *             is closed before every service completes
	 */
	public List<Resource> scanServices(Collection<String> names) {
		List<Resource> resources = new ArrayList<>();
		try (ResourceStream stream = streamServices(names)) {
			stream.forEachRemaining(resources::add);
			if (stream.isCancelled()) {
				throw new ScanCancelledException("scan closed before all services completed");
			}
		}
		return resources;
	}

	public ResourceStream stream() {
		return streamServices(registry.getServiceNames());
	}

	/**
	 * Lazily scans the named services, yielding each service's resources as soon as
	 * that service completes. The returned stream must be closed.
	 */
	public ResourceStream streamServices(Collection<String> names) {
		List<RegionScanner> scanners = selectServices(names);
		List<String> regions = getRegions();
		ScanDiagnostics diagnostics = new ScanDiagnostics();
		lastDiagnostics.set(diagnostics);
		logger.info("scanning {} services across {} regions ({} services x {} regions in parallel = {} concurrent calls)",
				scanners.size(), regions.size(), config.getMaxConcurrentServices(), config.getMaxConcurrentRegions(),
				config.getMaxConcurrentCalls());
		return new ResourceStream(scanners, regions, this::newConductor, config.getMaxConcurrentServices(), listener,
				diagnostics);
	}

	ServiceScanConductor newConductor(RegionScanner scanner) {
		return new ServiceScanConductor(scanner, config).withRetryPolicy(retryPolicy).withListener(listener);
	}

	/**
	 * Diagnostics of the most recent run.
	 */
	public ScanDiagnostics getDiagnostics() {
		return lastDiagnostics.get();
	}

	public static class Builder {
		ScannerConfig config;
		ServiceRegistry registry;
		ScanListener listener = ScanListener.NONE;
		RetryPolicy retryPolicy;
		Collection<String> regions;
		CloudProvider provider;

		Builder() {
		}

		public Builder withConfig(ScannerConfig config) {
			this.config = config;
			return this;
		}

		public Builder withRegistry(ServiceRegistry registry) {
			this.registry = registry;
			return this;
		}

		public Builder withListener(ScanListener listener) {
			this.listener = listener == null ? ScanListener.NONE : listener;
			return this;
		}

		public Builder withRetryPolicy(RetryPolicy retryPolicy) {
			this.retryPolicy = retryPolicy;
			return this;
		}

		public Builder withRegions(Collection<String> regions) {
			this.regions = regions;
			return this;
		}

		/**
		 * Regions come from the provider unless set explicitly.
		 */
		public Builder withCloudProvider(CloudProvider provider) {
			this.provider = provider;
			return this;
		}

		public ScanOrchestrator build() {
			Preconditions.checkNotNull(config, "config cannot be null");
			Preconditions.checkNotNull(registry, "registry cannot be null");
			Preconditions.checkState(regions != null || provider != null, "regions or a cloud provider is required");
			return new ScanOrchestrator(this);
		}
	}
}
