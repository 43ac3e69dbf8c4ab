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
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

import org.assertj.core.api.Assertions;
import org.junit.Test;

public class ErrorClassifierTest {

	ErrorClassifier classifier = new ErrorClassifier();

	@Test
	public void testAccessDeniedCodes() {
		for (String code : new String[] { "AccessDenied", "AccessDeniedException", "UnauthorizedOperation" }) {
			Assertions.assertThat(classifier.classify(new ProviderException(code, "no"))).isEqualTo(
					ErrorKind.ACCESS_DENIED);
		}
	}

	@Test
	public void testThrottlingCodes() {
		for (String code : new String[] { "Throttling", "RequestLimitExceeded", "TooManyRequestsException" }) {
			Assertions.assertThat(classifier.classify(new ProviderException(code, "slow down")))
					.isEqualTo(ErrorKind.RATE_LIMITED);
		}
	}

	@Test
	public void testTransient() {
		Assertions.assertThat(classifier.classify(new ProviderException("ServiceUnavailable", "try later")))
				.isEqualTo(ErrorKind.TRANSIENT);
		Assertions.assertThat(classifier.classify(new UncheckedIOException(new SocketTimeoutException("read"))))
				.isEqualTo(ErrorKind.TRANSIENT);
		Assertions.assertThat(classifier.classify(new SurveyorException(new TimeoutException())))
				.isEqualTo(ErrorKind.TRANSIENT);
		Assertions.assertThat(
				classifier.classify(new ProviderException("", "wrapped", new IOException("connection refused"))))
				.isEqualTo(ErrorKind.TRANSIENT);
	}

	@Test
	public void testUnknownIsFatal() {
		Assertions.assertThat(classifier.classify(new ProviderException("ValidationError", "bad request")))
				.isEqualTo(ErrorKind.FATAL);
		Assertions.assertThat(classifier.classify(new NullPointerException())).isEqualTo(ErrorKind.FATAL);
	}

	@Test
	public void testWrappedProviderError() {
		RuntimeException e = new RuntimeException(new ProviderException("Throttling", "wrapped"));
		Assertions.assertThat(classifier.classify(e)).isEqualTo(ErrorKind.RATE_LIMITED);
	}

	@Test
	public void testCustomCodes() {
		ErrorClassifier c = new ErrorClassifier().withThrottlingCode("BandwidthLimitExceeded")
				.withAccessDeniedCode("Forbidden").withTransientCode("Busy");
		Assertions.assertThat(c.classify(new ProviderException("BandwidthLimitExceeded", "x")))
				.isEqualTo(ErrorKind.RATE_LIMITED);
		Assertions.assertThat(c.classify(new ProviderException("Forbidden", "x"))).isEqualTo(ErrorKind.ACCESS_DENIED);
		Assertions.assertThat(c.classify(new ProviderException("Busy", "x"))).isEqualTo(ErrorKind.TRANSIENT);
		Assertions.assertThat(classifier.classify(new ProviderException("Forbidden", "x"))).isEqualTo(ErrorKind.FATAL);
	}

	@Test
	public void testCancellation() {
		Assertions.assertThat(ErrorClassifier.isCancellation(new ScanCancelledException("x"))).isTrue();
		Assertions.assertThat(ErrorClassifier.isCancellation(new RuntimeException(new InterruptedException())))
				.isTrue();
		Assertions.assertThat(ErrorClassifier.isCancellation(new ProviderException("Throttling", "x"))).isFalse();
	}
}
