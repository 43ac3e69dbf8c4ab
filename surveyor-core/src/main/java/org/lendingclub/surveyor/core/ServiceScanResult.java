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

import java.util.List;
import java.util.stream.Collectors;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * All region outcomes of one service, in the order the regions completed.
 */
public final class ServiceScanResult {

	private final String service;
	private final List<RegionScanResult> regionResults;

	public ServiceScanResult(String service, List<RegionScanResult> regionResults) {
		this.service = service;
		this.regionResults = ImmutableList.copyOf(regionResults);
	}

	public String getService() {
		return service;
	}

	public List<RegionScanResult> getRegionResults() {
		return regionResults;
	}

	public List<Resource> getResources() {
		ImmutableList.Builder<Resource> b = ImmutableList.builder();
		regionResults.forEach(r -> b.addAll(r.getResources()));
		return b.build();
	}

	public int getResourceCount() {
		return regionResults.stream().mapToInt(r -> r.getResources().size()).sum();
	}

	public List<RegionScanResult> getFailedRegions() {
		return regionResults.stream().filter(r -> !r.isSuccess()).collect(Collectors.toList());
	}

	/**
	 * Regions that were scanned successfully and had nothing in them.
	 */
	public List<String> getEmptyRegions() {
		return regionResults.stream().filter(r -> r.isSuccess() && r.getResources().isEmpty())
				.map(RegionScanResult::getRegion).collect(Collectors.toList());
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("service", service).add("regions", regionResults.size())
				.add("resources", getResourceCount()).add("failedRegions", getFailedRegions().size()).toString();
	}
}
