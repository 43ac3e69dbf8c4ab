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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * What happened to each service during a run. Separates regions that had nothing
 * from regions that failed, services whose conductor failed outright, and services
 * that were cancelled before they finished.
 */
public class ScanDiagnostics {

	public static class ServiceDiagnostics {
		private final String service;
		private final int resourceCount;
		private final Map<String, ErrorKind> failedRegions;
		private final Map<String, String> failureMessages;
		private final List<String> emptyRegions;
		private final Throwable serviceError;
		private final boolean cancelled;
		private final Duration duration;

		ServiceDiagnostics(ServiceScanResult result, Duration duration) {
			this.service = result.getService();
			this.resourceCount = result.getResourceCount();
			ImmutableMap.Builder<String, ErrorKind> kinds = ImmutableMap.builder();
			ImmutableMap.Builder<String, String> messages = ImmutableMap.builder();
			result.getFailedRegions().forEach(r -> {
				kinds.put(r.getRegion(), r.getErrorKind().get());
				messages.put(r.getRegion(), String.valueOf(r.getError().get().getMessage()));
			});
			this.failedRegions = kinds.build();
			this.failureMessages = messages.build();
			this.emptyRegions = ImmutableList.copyOf(result.getEmptyRegions());
			this.serviceError = null;
			this.cancelled = false;
			this.duration = duration;
		}

		ServiceDiagnostics(String service, Throwable error, boolean cancelled, Duration duration) {
			this.service = service;
			this.resourceCount = 0;
			this.failedRegions = ImmutableMap.of();
			this.failureMessages = ImmutableMap.of();
			this.emptyRegions = ImmutableList.of();
			this.serviceError = error;
			this.cancelled = cancelled;
			this.duration = duration;
		}

		public String getService() {
			return service;
		}

		public int getResourceCount() {
			return resourceCount;
		}

		public Map<String, ErrorKind> getFailedRegions() {
			return failedRegions;
		}

		public Optional<String> getFailureMessage(String region) {
			return Optional.ofNullable(failureMessages.get(region));
		}

		public List<String> getEmptyRegions() {
			return emptyRegions;
		}

		public Optional<Throwable> getServiceError() {
			return Optional.ofNullable(serviceError);
		}

		public boolean hasErrors() {
			return serviceError != null || !failedRegions.isEmpty();
		}

		/**
		 * True if the run was cancelled before this service finished. Its resource
		 * count is then zero and says nothing about the account.
		 */
		public boolean isCancelled() {
			return cancelled;
		}

		public Duration getDuration() {
			return duration;
		}

		@Override
		public String toString() {
			return MoreObjects.toStringHelper(this).omitNullValues().add("service", service)
					.add("resources", resourceCount).add("failedRegions", failedRegions)
					.add("serviceError", serviceError).add("cancelled", cancelled).toString();
		}
	}

	private final Map<String, ServiceDiagnostics> services = Maps.newConcurrentMap();

	void recordService(ServiceScanResult result, Duration duration) {
		services.put(result.getService(), new ServiceDiagnostics(result, duration));
	}

	void recordServiceFailure(String service, Throwable error, Duration duration) {
		services.put(service, new ServiceDiagnostics(service, error, false, duration));
	}

	/**
	 * Marks a service as cancelled unless it already has a recorded outcome.
	 */
	void recordServiceCancelled(String service, Duration duration) {
		services.putIfAbsent(service, new ServiceDiagnostics(service, null, true, duration));
	}

	public Optional<ServiceDiagnostics> getService(String service) {
		return Optional.ofNullable(services.get(service));
	}

	public List<ServiceDiagnostics> getServices() {
		return services.values().stream().sorted((a, b) -> a.getService().compareTo(b.getService()))
				.collect(Collectors.toList());
	}

	public List<ServiceDiagnostics> getServicesWithErrors() {
		return getServices().stream().filter(ServiceDiagnostics::hasErrors).collect(Collectors.toList());
	}

	public boolean hasErrors() {
		return services.values().stream().anyMatch(ServiceDiagnostics::hasErrors);
	}

	public List<ServiceDiagnostics> getCancelledServices() {
		return getServices().stream().filter(ServiceDiagnostics::isCancelled).collect(Collectors.toList());
	}

	public boolean isCancelled() {
		return services.values().stream().anyMatch(ServiceDiagnostics::isCancelled);
	}

	public int getTotalResourceCount() {
		return services.values().stream().mapToInt(ServiceDiagnostics::getResourceCount).sum();
	}
}
