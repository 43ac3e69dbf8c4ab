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
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Ticker;

/**
 * Manually advanced clock. Used as both ticker and sleeper so that waits complete
 * instantly while still moving time forward.
 */
public class FakeTicker extends Ticker implements TokenBucket.Sleeper {

	private final AtomicLong nanos = new AtomicLong(TimeUnit.HOURS.toNanos(1));
	private final AtomicLong slept = new AtomicLong();

	public FakeTicker advance(long time, TimeUnit unit) {
		nanos.addAndGet(unit.toNanos(time));
		return this;
	}

	@Override
	public long read() {
		return nanos.get();
	}

	@Override
	public void sleep(long sleepNanos) {
		slept.addAndGet(sleepNanos);
		nanos.addAndGet(sleepNanos);
	}

	public long getSleptNanos() {
		return slept.get();
	}
}
