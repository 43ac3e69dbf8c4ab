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
 * Closed classification of scan failures.
 */
public enum ErrorKind {

	/** permission problem, terminal for the region */
	ACCESS_DENIED(false),

	/** provider throttling, retried with backoff */
	RATE_LIMITED(true),

	/** network or availability problem, retried with backoff */
	TRANSIENT(true),

	/** anything else, terminal for the region */
	FATAL(false);

	private final boolean retryableByDefault;

	ErrorKind(boolean retryableByDefault) {
		this.retryableByDefault = retryableByDefault;
	}

	public boolean isRetryableByDefault() {
		return retryableByDefault;
	}
}
