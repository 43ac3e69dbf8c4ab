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
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * Scanners by service name, in registration order. Lookups ignore case.
 */
public class ServiceRegistry {

	private final Map<String, RegionScanner> scanners = Maps.newLinkedHashMap();

	public synchronized ServiceRegistry register(RegionScanner scanner) {
		Preconditions.checkNotNull(scanner, "scanner cannot be null");
		String key = ScannerConfig.normalizeService(scanner.getServiceName());
		Preconditions.checkArgument(!key.isEmpty(), "scanner has no service name: %s", scanner);
		Preconditions.checkArgument(!scanners.containsKey(key), "service already registered: %s",
				scanner.getServiceName());
		scanners.put(key, scanner);
		return this;
	}

	public synchronized Optional<RegionScanner> get(String service) {
		return Optional.ofNullable(scanners.get(ScannerConfig.normalizeService(service)));
	}

	public synchronized List<String> getServiceNames() {
		ImmutableList.Builder<String> b = ImmutableList.builder();
		scanners.values().forEach(s -> b.add(s.getServiceName()));
		return b.build();
	}

	public synchronized Collection<RegionScanner> getScanners() {
		return ImmutableList.copyOf(scanners.values());
	}

	public synchronized int size() {
		return scanners.size();
	}
}
