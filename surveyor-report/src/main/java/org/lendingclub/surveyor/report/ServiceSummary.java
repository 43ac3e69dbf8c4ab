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
package org.lendingclub.surveyor.report;

import java.util.Map;

import org.lendingclub.surveyor.core.Resource;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;

/**
 * Resource count and estimated monthly cost of one service.
 */
public class ServiceSummary {

	private final String service;
	private int resourceCount;
	private double totalCost;
	private final Map<String, Integer> resourcesByRegion = Maps.newTreeMap();

	public ServiceSummary(String service) {
		this.service = service;
	}

	void add(Resource r) {
		resourceCount++;
		totalCost += r.getEstimatedMonthlyCostOrZero();
		resourcesByRegion.merge(r.getRegion(), 1, Integer::sum);
	}

	public String getService() {
		return service;
	}

	public int getResourceCount() {
		return resourceCount;
	}

	public double getTotalEstimatedMonthlyCost() {
		return totalCost;
	}

	public Map<String, Integer> getResourcesByRegion() {
		return ImmutableSortedMap.copyOf(resourcesByRegion);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("service", service).add("count", resourceCount)
				.add("cost", totalCost).toString();
	}
}
