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

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.TimeoutException;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * Maps failures to an {@link ErrorKind}. Provider failures are classified by their
 * error code. I/O failures and timeouts anywhere in the causal chain are transient.
 * Everything else is fatal.
 */
public class ErrorClassifier {

	public static final Set<String> ACCESS_DENIED_CODES = ImmutableSet.of("AccessDenied", "AccessDeniedException",
			"UnauthorizedOperation", "AuthFailure", "OptInRequired", "UnrecognizedClientException");

	public static final Set<String> THROTTLING_CODES = ImmutableSet.of("Throttling", "ThrottlingException",
			"RequestLimitExceeded", "TooManyRequestsException", "ProvisionedThroughputExceededException",
			"RequestThrottled", "SlowDown", "LimitExceededException");

	public static final Set<String> TRANSIENT_CODES = ImmutableSet.of("RequestTimeout", "RequestTimeoutException",
			"ServiceUnavailable", "InternalError", "InternalFailure", "ConnectionError");

	private final Set<String> accessDeniedCodes = Sets.newConcurrentHashSet(ACCESS_DENIED_CODES);
	private final Set<String> throttlingCodes = Sets.newConcurrentHashSet(THROTTLING_CODES);
	private final Set<String> transientCodes = Sets.newConcurrentHashSet(TRANSIENT_CODES);

	public ErrorClassifier withAccessDeniedCode(String code) {
		accessDeniedCodes.add(Preconditions.checkNotNull(code));
		return this;
	}

	public ErrorClassifier withThrottlingCode(String code) {
		throttlingCodes.add(Preconditions.checkNotNull(code));
		return this;
	}

	public ErrorClassifier withTransientCode(String code) {
		transientCodes.add(Preconditions.checkNotNull(code));
		return this;
	}

	public ErrorKind classify(Throwable t) {
		Preconditions.checkNotNull(t, "throwable cannot be null");
		for (Throwable cause : Throwables.getCausalChain(t)) {
			if (cause instanceof ProviderException) {
				String code = ((ProviderException) cause).getErrorCode();
				if (accessDeniedCodes.contains(code)) {
					return ErrorKind.ACCESS_DENIED;
				}
				if (throttlingCodes.contains(code)) {
					return ErrorKind.RATE_LIMITED;
				}
				if (transientCodes.contains(code)) {
					return ErrorKind.TRANSIENT;
				}
			}
			if (cause instanceof IOException || cause instanceof TimeoutException) {
				return ErrorKind.TRANSIENT;
			}
		}
		return ErrorKind.FATAL;
	}

	public boolean isAccessDenied(Throwable t) {
		return classify(t) == ErrorKind.ACCESS_DENIED;
	}

	/**
	 * Cancellation is not an error and must never be swallowed or retried.
	 */
	public static boolean isCancellation(Throwable t) {
		for (Throwable cause : Throwables.getCausalChain(t)) {
			if (cause instanceof ScanCancelledException || cause instanceof InterruptedException) {
				return true;
			}
		}
		return false;
	}
}
