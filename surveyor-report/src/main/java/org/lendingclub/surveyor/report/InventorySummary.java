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

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

import org.lendingclub.surveyor.core.Resource;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * Running totals over a resource inventory. Resources are added one at a time,
 * so a summary can be built while a report streams; only the most expensive
 * <code>topN</code> resources are retained.
 */
public class InventorySummary {

	public static final int DEFAULT_TOP_N = 10;

	static final Comparator<Resource> BY_COST = Comparator
			.comparingDouble(Resource::getEstimatedMonthlyCostOrZero);

	private final int topN;
	private final Map<String, ServiceSummary> services = Maps.newTreeMap();
	private final PriorityQueue<Resource> mostExpensive;
	private int totalResources;
	private double totalCost;

	public InventorySummary() {
		this(DEFAULT_TOP_N);
	}

	public InventorySummary(int topN) {
		Preconditions.checkArgument(topN >= 0, "topN must be >= 0: %s", topN);
		this.topN = topN;
		this.mostExpensive = new PriorityQueue<>(Math.max(1, topN + 1), BY_COST);
	}

	public static InventorySummary of(Iterable<Resource> resources) {
		InventorySummary summary = new InventorySummary();
		resources.forEach(summary::add);
		return summary;
	}

	public InventorySummary add(Resource r) {
		Preconditions.checkNotNull(r, "resource cannot be null");
		totalResources++;
		totalCost += r.getEstimatedMonthlyCostOrZero();
		services.computeIfAbsent(r.getService(), ServiceSummary::new).add(r);
		if (topN > 0 && r.getEstimatedMonthlyCostOrZero() > 0) {
			mostExpensive.add(r);
			if (mostExpensive.size() > topN) {
				mostExpensive.poll();
			}
		}
		return this;
	}

	public int getTotalResources() {
		return totalResources;
	}

	public double getTotalEstimatedMonthlyCost() {
		return totalCost;
	}

	/**
	 * Per-service summaries, ordered by service name.
	 */
	public List<ServiceSummary> getServices() {
		return ImmutableList.copyOf(services.values());
	}

	public Optional<ServiceSummary> getService(String service) {
		return Optional.ofNullable(services.get(service));
	}

	/**
	 * Resources with a positive cost, most expensive first.
	 */
	public List<Resource> getMostExpensive() {
		List<Resource> list = Lists.newArrayList(mostExpensive);
		list.sort(BY_COST.reversed());
		return list;
	}

	public boolean isEmpty() {
		return totalResources == 0;
	}
}
