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

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;

/**
 * Token bucket shared by all region workers of one scanner.
 * <p>
 * Tokens accrue at <code>rate</code> per second up to <code>burst</code>. A caller
 * that finds too few tokens reserves the deficit: the bucket is emptied and its
 * refill clock is moved forward by the time the deficit takes to accrue, so the
 * caller's wait is never credited back to the next caller. The bookkeeping happens
 * under the bucket's monitor, the sleep outside of it.
 */
public class TokenBucket {

	public interface Sleeper {
		void sleep(long nanos) throws InterruptedException;
	}

	static final Sleeper SYSTEM_SLEEPER = nanos -> TimeUnit.NANOSECONDS.sleep(nanos);

	static final long LOG_PAUSE_THRESHOLD_MILLIS = 50;

	Logger logger = LoggerFactory.getLogger(getClass());

	private final double rate;
	private final double burst;
	private final Ticker ticker;
	private final Sleeper sleeper;

	private double tokens;
	private long lastRefill;

	public TokenBucket(double rate) {
		this(rate, Math.ceil(rate));
	}

	public TokenBucket(double rate, double burst) {
		this(rate, burst, Ticker.systemTicker(), SYSTEM_SLEEPER);
	}

	public TokenBucket(double rate, double burst, Ticker ticker, Sleeper sleeper) {
		Preconditions.checkArgument(rate > 0 && !Double.isInfinite(rate), "rate must be > 0: %s", rate);
		Preconditions.checkArgument(burst > 0 && !Double.isInfinite(burst), "burst must be > 0: %s", burst);
		this.rate = rate;
		this.burst = burst;
		this.ticker = Preconditions.checkNotNull(ticker, "ticker cannot be null");
		this.sleeper = Preconditions.checkNotNull(sleeper, "sleeper cannot be null");
		this.tokens = burst;
		this.lastRefill = ticker.read();
	}

	public double getRate() {
		return rate;
	}

	public double getBurst() {
		return burst;
	}

	public double acquire() {
		return acquire(1);
	}

	/**
	 * Blocks until <code>permits</code> tokens have been debited.
	 *
	 * @return seconds spent waiting
	 * @throws ScanCancelledException if interrupted while waiting
	 */
	public double acquire(int permits) {
		Preconditions.checkArgument(permits >= 0, "permits must be >= 0: %s", permits);
		long waitNanos = reserve(permits);
		if (waitNanos <= 0) {
			return 0;
		}
		try {
			sleeper.sleep(waitNanos);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ScanCancelledException("interrupted while rate limited", e);
		}
		long ms = TimeUnit.NANOSECONDS.toMillis(waitNanos);
		if (ms > LOG_PAUSE_THRESHOLD_MILLIS) {
			logger.info("rate limiting paused execution for {} ms", ms);
		}
		return waitNanos / (double) TimeUnit.SECONDS.toNanos(1);
	}

	/**
	 * Tokens available right now, after refill.
	 */
	public synchronized double getAvailableTokens() {
		refill(ticker.read());
		return tokens;
	}

	synchronized long reserve(int permits) {
		long now = ticker.read();
		refill(now);
		if (tokens >= permits) {
			tokens -= permits;
			return 0;
		}
		double deficit = permits - tokens;
		long deficitNanos = (long) Math.ceil(deficit / rate * TimeUnit.SECONDS.toNanos(1));
		long start = Math.max(now, lastRefill);
		tokens = 0;
		lastRefill = start + deficitNanos;
		return lastRefill - now;
	}

	private void refill(long now) {
		long elapsed = now - lastRefill;
		if (elapsed > 0) {
			double accrued = elapsed * rate / TimeUnit.SECONDS.toNanos(1);
			tokens = Math.min(burst, tokens + accrued);
			lastRefill = now;
		}
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("rate", rate).add("burst", burst).toString();
	}
}
