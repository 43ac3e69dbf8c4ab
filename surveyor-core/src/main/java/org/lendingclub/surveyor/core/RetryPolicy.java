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

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;

/**
 * Exponential backoff around a fallible call.
 * <p>
 * Failures whose {@link ErrorKind} is retryable are retried after
 * <code>initialDelay</code>, then <code>initialDelay * backoffFactor</code>, and so on,
 * up to <code>maxAttempts</code> invocations in total. Any other failure, and the
 * last retryable one, is rethrown unchanged.
 */
public class RetryPolicy {

	private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

	private int maxAttempts = ScannerConfig.DEFAULT_MAX_RETRIES;
	private long initialDelayMillis = TimeUnit.SECONDS.toMillis(1);
	private double backoffFactor = ScannerConfig.DEFAULT_RETRY_BACKOFF;
	private Set<ErrorKind> retryableKinds = EnumSet.of(ErrorKind.RATE_LIMITED, ErrorKind.TRANSIENT);
	private ErrorClassifier classifier = new ErrorClassifier();

	public RetryPolicy() {
	}

	public static RetryPolicy fromConfig(ScannerConfig config) {
		return new RetryPolicy().withMaxAttempts(config.getMaxRetries())
				.withInitialDelay((long) (config.getRetryDelay() * 1000), TimeUnit.MILLISECONDS)
				.withBackoffFactor(config.getRetryBackoff());
	}

	/**
	 * Runs <code>action</code> under <code>policy</code>.
	 */
	public static <T> T withRetry(Supplier<T> action, RetryPolicy policy) {
		return policy.call("operation", action);
	}

	public RetryPolicy withMaxAttempts(int maxAttempts) {
		Preconditions.checkArgument(maxAttempts >= 1, "maxAttempts must be >= 1");
		this.maxAttempts = maxAttempts;
		return this;
	}

	public RetryPolicy withInitialDelay(long t, TimeUnit unit) {
		Preconditions.checkArgument(t >= 0, "initial delay must be >= 0");
		this.initialDelayMillis = unit.toMillis(t);
		return this;
	}

	public RetryPolicy withBackoffFactor(double backoffFactor) {
		Preconditions.checkArgument(backoffFactor >= 1.0, "backoffFactor must be >= 1.0");
		this.backoffFactor = backoffFactor;
		return this;
	}

	public RetryPolicy withRetryableKinds(Set<ErrorKind> kinds) {
		this.retryableKinds = kinds.isEmpty() ? EnumSet.noneOf(ErrorKind.class) : EnumSet.copyOf(kinds);
		return this;
	}

	public RetryPolicy withErrorClassifier(ErrorClassifier classifier) {
		this.classifier = Preconditions.checkNotNull(classifier);
		return this;
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	public long getInitialDelayMillis() {
		return initialDelayMillis;
	}

	public double getBackoffFactor() {
		return backoffFactor;
	}

	public Set<ErrorKind> getRetryableKinds() {
		return Sets.immutableEnumSet(retryableKinds);
	}

	public ErrorClassifier getErrorClassifier() {
		return classifier;
	}

	public boolean isRetryable(Throwable t) {
		if (ErrorClassifier.isCancellation(t)) {
			return false;
		}
		return retryableKinds.contains(classifier.classify(t));
	}

	public <T> T call(String description, Supplier<T> action) {
		double delay = initialDelayMillis;
		int attempt = 1;
		while (true) {
			try {
				return action.get();
			} catch (RuntimeException e) {
				if (attempt >= maxAttempts || !isRetryable(e)) {
					throw e;
				}
				long t = (long) delay;
				logger.warn("{} failed on attempt {} of {} ({}), retrying in {} ms", description, attempt, maxAttempts,
						e.toString(), t);
				try {
					sleep(t);
				} catch (InterruptedException ie) {
					Thread.currentThread().interrupt();
					throw new ScanCancelledException("interrupted while waiting to retry " + description, ie);
				}
				delay = delay * backoffFactor;
				attempt++;
			}
		}
	}

	public void run(String description, Runnable action) {
		call(description, () -> {
			action.run();
			return null;
		});
	}

	protected void sleep(long millis) throws InterruptedException {
		Thread.sleep(millis);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("maxAttempts", maxAttempts)
				.add("initialDelayMillis", initialDelayMillis).add("backoffFactor", backoffFactor)
				.add("retryableKinds", retryableKinds).toString();
	}
}
