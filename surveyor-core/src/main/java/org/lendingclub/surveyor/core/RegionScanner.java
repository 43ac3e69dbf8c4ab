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

/**
 * Enumerates one service's resources in a single region.
 * <p>
 * An empty region is an empty list, not an error. Implementations only read from
 * the provider.
 */
public interface RegionScanner {

	String getServiceName();

	List<Resource> scanRegion(String region);

	/**
	 * The bucket shared by every region worker of this scanner.
	 */
	TokenBucket getRateLimiter();

	/**
	 * Global services are scanned once, in the configured global region.
	 */
	default boolean isGlobal() {
		return false;
	}
}
