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

/**
 * Observes scan progress. Callbacks come from scan threads and must not block.
 */
public interface ScanListener {

	ScanListener NONE = new ScanListener() {
	};

	default void serviceStarted(String service, int regionCount) {
	}

	default void regionCompleted(String service, RegionScanResult result) {
	}

	/**
	 * Called exactly once per service, including services whose scan failed.
	 */
	default void serviceCompleted(String service, int completed, int total, int resourceCount) {
	}

	default void serviceFailed(String service, Throwable error) {
	}
}
