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
package org.lendingclub.surveyor.cli;

import java.util.concurrent.atomic.AtomicInteger;

import org.lendingclub.surveyor.core.RegionScanResult;
import org.lendingclub.surveyor.core.ScanListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs a line as each service finishes.
 */
public class ProgressListener implements ScanListener {

	Logger logger = LoggerFactory.getLogger(getClass());

	private final AtomicInteger failedRegions = new AtomicInteger();

	@Override
	public void serviceStarted(String service, int regionCount) {
		logger.debug("scanning {} in {} regions", service, regionCount);
	}

	@Override
	public void regionCompleted(String service, RegionScanResult result) {
		if (!result.isSuccess()) {
			failedRegions.incrementAndGet();
		}
	}

	@Override
	public void serviceCompleted(String service, int completed, int total, int resourceCount) {
		logger.info("{}", format(service, completed, total, resourceCount));
	}

	@Override
	public void serviceFailed(String service, Throwable error) {
		logger.warn("{} failed: {}", service, error.toString());
	}

	public int getFailedRegionCount() {
		return failedRegions.get();
	}

	static String format(String service, int completed, int total, int resourceCount) {
		return "[" + completed + "/" + total + "] " + service + ": " + resourceCount + " resources";
	}
}
