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

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.Optional;
import java.util.OptionalDouble;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

/**
 * One discovered cloud object, normalized across services. Instances are immutable,
 * including the lists and maps held in the additional info.
 */
public final class Resource {

	public static final String GLOBAL_REGION = "global";

	private final String id;
	private final String type;
	private final String service;
	private final String region;
	private final String name;
	private final Instant createdAt;
	private final String state;
	private final Double estimatedMonthlyCost;
	private final Map<String, Object> additionalInfo;

	private Resource(Builder b) {
		this.id = b.id;
		this.type = b.type;
		this.service = b.service;
		this.region = b.region;
		this.name = Strings.emptyToNull(b.name);
		this.createdAt = b.createdAt;
		this.state = Strings.emptyToNull(b.state);
		this.estimatedMonthlyCost = b.estimatedMonthlyCost;
		ImmutableMap.Builder<String, Object> info = ImmutableMap.builder();
		b.additionalInfo.forEach((k, v) -> info.put(k, immutableValue(v)));
		this.additionalInfo = info.build();
	}

	// nested collections are copied so that later changes to the caller's lists and maps are not visible
	static Object immutableValue(Object v) {
		if (v instanceof Map) {
			ImmutableMap.Builder<Object, Object> m = ImmutableMap.builder();
			((Map<?, ?>) v).forEach((k, x) -> {
				if (k != null && x != null) {
					m.put(k, immutableValue(x));
				}
			});
			return m.build();
		}
		if (v instanceof Set) {
			ImmutableSet.Builder<Object> set = ImmutableSet.builder();
			((Set<?>) v).stream().filter(x -> x != null).forEach(x -> set.add(immutableValue(x)));
			return set.build();
		}
		if (v instanceof Collection) {
			ImmutableList.Builder<Object> list = ImmutableList.builder();
			((Collection<?>) v).stream().filter(x -> x != null).forEach(x -> list.add(immutableValue(x)));
			return list.build();
		}
		return v;
	}

	public static Builder builder() {
		return new Builder();
	}

	public String getId() {
		return id;
	}

	public String getType() {
		return type;
	}

	public String getService() {
		return service;
	}

	public String getRegion() {
		return region;
	}

	public Optional<String> getName() {
		return Optional.ofNullable(name);
	}

	/**
	 * The name when there is one, otherwise the id.
	 */
	public String getDisplayName() {
		return name != null ? name : id;
	}

	public Optional<Instant> getCreatedAt() {
		return Optional.ofNullable(createdAt);
	}

	public Optional<String> getState() {
		return Optional.ofNullable(state);
	}

	public OptionalDouble getEstimatedMonthlyCost() {
		return estimatedMonthlyCost == null ? OptionalDouble.empty() : OptionalDouble.of(estimatedMonthlyCost);
	}

	public double getEstimatedMonthlyCostOrZero() {
		return estimatedMonthlyCost == null ? 0.0 : estimatedMonthlyCost;
	}

	public Map<String, Object> getAdditionalInfo() {
		return additionalInfo;
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).omitNullValues().add("service", service).add("type", type)
				.add("id", id).add("region", region).add("name", name).add("state", state)
				.add("estimatedMonthlyCost", estimatedMonthlyCost).toString();
	}

	public static class Builder {
		private String id;
		private String type;
		private String service;
		private String region;
		private String name;
		private Instant createdAt;
		private String state;
		private Double estimatedMonthlyCost;
		private final Map<String, Object> additionalInfo = Maps.newLinkedHashMap();

		Builder() {
		}

		public Builder withId(String id) {
			this.id = id;
			return this;
		}

		public Builder withType(String type) {
			this.type = type;
			return this;
		}

		public Builder withService(String service) {
			this.service = service;
			return this;
		}

		public Builder withRegion(String region) {
			this.region = region;
			return this;
		}

		public Builder withName(String name) {
			this.name = name;
			return this;
		}

		public Builder withCreatedAt(Instant createdAt) {
			this.createdAt = createdAt;
			return this;
		}

		public Builder withState(String state) {
			this.state = state;
			return this;
		}

		public Builder withEstimatedMonthlyCost(double cost) {
			Preconditions.checkArgument(cost >= 0, "estimated monthly cost must be >= 0: %s", cost);
			this.estimatedMonthlyCost = cost;
			return this;
		}

		/**
		 * Adds a detail entry. Null values are dropped.
		 */
		public Builder withInfo(String key, Object value) {
			if (key != null && value != null) {
				additionalInfo.put(key, value);
			}
			return this;
		}

		public Builder withInfo(Map<String, ?> info) {
			if (info != null) {
				info.forEach(this::withInfo);
			}
			return this;
		}

		public Resource build() {
			Preconditions.checkArgument(!Strings.isNullOrEmpty(id), "id is required");
			Preconditions.checkArgument(!Strings.isNullOrEmpty(type), "type is required");
			Preconditions.checkArgument(!Strings.isNullOrEmpty(service), "service is required");
			Preconditions.checkArgument(!Strings.isNullOrEmpty(region), "region is required");
			return new Resource(this);
		}
	}
}
