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
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.assertj.core.api.Assertions;
import org.junit.Test;

public class RetryPolicyTest {

	static class RecordingRetryPolicy extends RetryPolicy {
		List<Long> sleeps = new ArrayList<>();

		@Override
		protected void sleep(long millis) {
			sleeps.add(millis);
		}

		long totalSleep() {
			return sleeps.stream().mapToLong(Long::longValue).sum();
		}
	}

	@Test
	public void testSuccessOnFirstAttempt() {
		RecordingRetryPolicy policy = new RecordingRetryPolicy();
		AtomicInteger calls = new AtomicInteger();
		String result = policy.call("test", () -> {
			calls.incrementAndGet();
			return "ok";
		});
		Assertions.assertThat(result).isEqualTo("ok");
		Assertions.assertThat(calls.get()).isEqualTo(1);
		Assertions.assertThat(policy.sleeps).isEmpty();
	}

	@Test
	public void testRetryableErrorExhaustsAttempts() {
		RecordingRetryPolicy policy = new RecordingRetryPolicy();
		policy.withMaxAttempts(3).withInitialDelay(100, TimeUnit.MILLISECONDS).withBackoffFactor(2.0);
		AtomicInteger calls = new AtomicInteger();
		ProviderException throttled = new ProviderException("Throttling", "Rate exceeded");

		Assertions.assertThatThrownBy(() -> policy.call("test", () -> {
			calls.incrementAndGet();
			throw throttled;
		})).isSameAs(throttled);

		Assertions.assertThat(calls.get()).isEqualTo(3);
		Assertions.assertThat(policy.sleeps).containsExactly(100L, 200L);
		Assertions.assertThat(policy.totalSleep()).isGreaterThanOrEqualTo(100 + 100 * 2);
	}

	@Test
	public void testNonRetryableErrorPropagatesImmediately() {
		RecordingRetryPolicy policy = new RecordingRetryPolicy();
		AtomicInteger calls = new AtomicInteger();
		ProviderException denied = new ProviderException("AccessDenied", "not allowed");

		Assertions.assertThatThrownBy(() -> policy.call("test", () -> {
			calls.incrementAndGet();
			throw denied;
		})).isSameAs(denied);

		Assertions.assertThat(calls.get()).isEqualTo(1);
		Assertions.assertThat(policy.sleeps).isEmpty();
	}

	@Test
	public void testFatalErrorPropagatesImmediately() {
		RecordingRetryPolicy policy = new RecordingRetryPolicy();
		AtomicInteger calls = new AtomicInteger();
		Assertions.assertThatThrownBy(() -> policy.call("test", () -> {
			calls.incrementAndGet();
			throw new IllegalStateException("bug");
		})).isInstanceOf(IllegalStateException.class);
		Assertions.assertThat(calls.get()).isEqualTo(1);
	}

	@Test
	public void testRecoversAfterTransientError() {
		RecordingRetryPolicy policy = new RecordingRetryPolicy();
		policy.withInitialDelay(1, TimeUnit.SECONDS);
		AtomicInteger calls = new AtomicInteger();
		Integer result = policy.call("test", () -> {
			if (calls.incrementAndGet() < 2) {
				throw new UncheckedIOException(new IOException("connection reset"));
			}
			return 42;
		});
		Assertions.assertThat(result).isEqualTo(42);
		Assertions.assertThat(calls.get()).isEqualTo(2);
		Assertions.assertThat(policy.sleeps).containsExactly(1000L);
	}

	@Test
	public void testCustomRetryableKinds() {
		RecordingRetryPolicy policy = new RecordingRetryPolicy();
		policy.withRetryableKinds(EnumSet.of(ErrorKind.TRANSIENT)).withMaxAttempts(5);
		AtomicInteger calls = new AtomicInteger();
		Assertions.assertThatThrownBy(() -> policy.call("test", () -> {
			calls.incrementAndGet();
			throw new ProviderException("Throttling", "slow down");
		})).isInstanceOf(ProviderException.class);
		Assertions.assertThat(calls.get()).isEqualTo(1);
	}

	@Test
	public void testCancellationIsNeverRetried() {
		RecordingRetryPolicy policy = new RecordingRetryPolicy();
		AtomicInteger calls = new AtomicInteger();
		Assertions.assertThatThrownBy(() -> policy.call("test", () -> {
			calls.incrementAndGet();
			throw new ScanCancelledException("stop");
		})).isInstanceOf(ScanCancelledException.class);
		Assertions.assertThat(calls.get()).isEqualTo(1);
	}

	@Test
	public void testWithRetryCombinator() {
		RecordingRetryPolicy policy = new RecordingRetryPolicy();
		policy.withMaxAttempts(2);
		AtomicInteger calls = new AtomicInteger();
		String result = RetryPolicy.withRetry(() -> {
			if (calls.incrementAndGet() == 1) {
				throw new ProviderException("RequestLimitExceeded", "busy");
			}
			return "done";
		}, policy);
		Assertions.assertThat(result).isEqualTo("done");
		Assertions.assertThat(calls.get()).isEqualTo(2);
	}

	@Test
	public void testFromConfig() {
		ScannerConfig config = ScannerConfig.builder().withMaxRetries(5).withRetryDelay(0.25).withRetryBackoff(3.0)
				.build();
		RetryPolicy policy = RetryPolicy.fromConfig(config);
		Assertions.assertThat(policy.getMaxAttempts()).isEqualTo(5);
		Assertions.assertThat(policy.getInitialDelayMillis()).isEqualTo(250);
		Assertions.assertThat(policy.getBackoffFactor()).isEqualTo(3.0);
		Assertions.assertThat(policy.getRetryableKinds()).containsExactlyInAnyOrder(ErrorKind.RATE_LIMITED,
				ErrorKind.TRANSIENT);
	}

	@Test
	public void testInvalidSettingsRejected() {
		Assertions.assertThatThrownBy(() -> new RetryPolicy().withMaxAttempts(0))
				.isInstanceOf(IllegalArgumentException.class);
		Assertions.assertThatThrownBy(() -> new RetryPolicy().withBackoffFactor(0.5))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
