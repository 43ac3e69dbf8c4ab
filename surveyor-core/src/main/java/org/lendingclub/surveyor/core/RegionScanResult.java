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
import java.util.Optional;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Outcome of scanning one region of one service: either a resource list or an
 * error, never both.
 */
public final class RegionScanResult {

	private final String region;
	private final List<Resource> resources;
	private final Throwable error;
	private final ErrorKind errorKind;
	private final Duration duration;

	private RegionScanResult(String region, List<Resource> resources, Throwable error, ErrorKind errorKind,
			Duration duration) {
		this.region = Preconditions.checkNotNull(region, "region cannot be null");
		this.resources = resources;
		this.error = error;
		this.errorKind = errorKind;
		this.duration = Preconditions.checkNotNull(duration, "duration cannot be null");
	}

	public static RegionScanResult success(String region, List<Resource> resources, Duration duration) {
		return new RegionScanResult(region, ImmutableList.copyOf(resources), null, null, duration);
	}

	public static RegionScanResult failure(String region, Throwable error, ErrorKind kind, Duration duration) {
		Preconditions.checkNotNull(error, "error cannot be null");
		Preconditions.checkNotNull(kind, "kind cannot be null");
		return new RegionScanResult(region, ImmutableList.of(), error, kind, duration);
	}

	public String getRegion() {
		return region;
	}

	public List<Resource> getResources() {
		return resources;
	}

	public Optional<Throwable> getError() {
		return Optional.ofNullable(error);
	}

	public Optional<ErrorKind> getErrorKind() {
		return Optional.ofNullable(errorKind);
	}

	public boolean isSuccess() {
		return error == null;
	}

	public Duration getDuration() {
		return duration;
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).omitNullValues().add("region", region)
				.add("resources", resources.size()).add("errorKind", errorKind)
				.add("durationMillis", duration.toMillis()).toString();
	}
}
