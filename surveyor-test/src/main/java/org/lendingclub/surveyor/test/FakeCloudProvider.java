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
package org.lendingclub.surveyor.test;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.lendingclub.surveyor.core.CloudProvider;
import org.lendingclub.surveyor.core.JsonUtil;
import org.lendingclub.surveyor.core.ServiceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Joiner;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * In-memory {@link CloudProvider}. Responses are canned JSON pages keyed by service,
 * region and operation; a region of <code>*</code> matches any region. Failures can
 * be injected per operation, and every page fetch is counted.
 */
public class FakeCloudProvider implements CloudProvider {

	public static final String ANY_REGION = "*";

	static Logger logger = LoggerFactory.getLogger(FakeCloudProvider.class);

	private List<String> regions = Lists.newArrayList("us-east-1", "us-west-2");
	private RuntimeException regionError;
	private final Map<String, Function<Map<String, ?>, List<JsonNode>>> handlers = new ConcurrentHashMap<>();
	private final Map<String, FailureSpec> failures = new ConcurrentHashMap<>();
	private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
	private final AtomicInteger regionCalls = new AtomicInteger();

	static class FailureSpec {
		final RuntimeException error;
		final AtomicInteger remaining;

		FailureSpec(RuntimeException error, int times) {
			this.error = error;
			this.remaining = new AtomicInteger(times);
		}
	}

	@Override
	public String getName() {
		return "fake";
	}

	public FakeCloudProvider withRegions(String... regions) {
		this.regions = Lists.newArrayList(regions);
		return this;
	}

	public FakeCloudProvider withRegionError(RuntimeException e) {
		this.regionError = e;
		return this;
	}

	public FakeCloudProvider withPages(String service, String region, String operation, JsonNode... pages) {
		List<JsonNode> list = ImmutableList.copyOf(pages);
		handlers.put(key(service, region, operation), params -> list);
		return this;
	}

	public FakeCloudProvider withPages(String service, String region, String operation, String... json) {
		List<JsonNode> list = Lists.newArrayList();
		for (String s : json) {
			list.add(parse(s));
		}
		return withPages(service, region, operation, list.toArray(new JsonNode[0]));
	}

	/**
	 * Answers an operation from its parameters, e.g. a per-bucket S3 call.
	 */
	public FakeCloudProvider withHandler(String service, String region, String operation,
			Function<Map<String, ?>, JsonNode> handler) {
		handlers.put(key(service, region, operation), params -> ImmutableList.of(handler.apply(params)));
		return this;
	}

	/**
	 * Every call to the operation fails with <code>e</code>.
	 */
	public FakeCloudProvider withError(String service, String region, String operation, RuntimeException e) {
		return withError(service, region, operation, e, Integer.MAX_VALUE);
	}

	/**
	 * The next <code>times</code> calls to the operation fail with <code>e</code>.
	 */
	public FakeCloudProvider withError(String service, String region, String operation, RuntimeException e,
			int times) {
		failures.put(key(service, region, operation), new FailureSpec(e, times));
		return this;
	}

	public int getCallCount(String service, String region, String operation) {
		AtomicInteger n = calls.get(key(service, region, operation));
		return n == null ? 0 : n.get();
	}

	public int getTotalCallCount() {
		return calls.values().stream().mapToInt(AtomicInteger::get).sum();
	}

	public int getRegionCallCount() {
		return regionCalls.get();
	}

	@Override
	public List<String> listRegions() {
		regionCalls.incrementAndGet();
		if (regionError != null) {
			throw regionError;
		}
		return ImmutableList.copyOf(regions);
	}

	@Override
	public ServiceClient getServiceClient(String service, String region) {
		return (operation, params) -> () -> pages(service, region, operation, params);
	}

	Iterator<JsonNode> pages(String service, String region, String operation, Map<String, ?> params) {
		String callKey = key(service, region, operation);
		return new AbstractIterator<JsonNode>() {
			Iterator<JsonNode> delegate;

			@Override
			protected JsonNode computeNext() {
				if (delegate == null) {
					delegate = resolve(service, region, operation, params).iterator();
				} else if (!delegate.hasNext()) {
					return endOfData();
				}
				if (!delegate.hasNext()) {
					return endOfData();
				}
				calls.computeIfAbsent(callKey, k -> new AtomicInteger()).incrementAndGet();
				FailureSpec failure = failureFor(service, region, operation);
				if (failure != null && failure.remaining.getAndDecrement() > 0) {
					throw failure.error;
				}
				return delegate.next();
			}
		};
	}

	private FailureSpec failureFor(String service, String region, String operation) {
		FailureSpec f = failures.get(key(service, region, operation));
		return f != null ? f : failures.get(key(service, ANY_REGION, operation));
	}

	private List<JsonNode> resolve(String service, String region, String operation, Map<String, ?> params) {
		Function<Map<String, ?>, List<JsonNode>> handler = handlers.get(key(service, region, operation));
		if (handler == null) {
			handler = handlers.get(key(service, ANY_REGION, operation));
		}
		if (handler == null) {
			logger.debug("no canned response for {} {} {}", service, region, operation);
			return ImmutableList.of(JsonUtil.createObjectNode());
		}
		return handler.apply(params);
	}

	static String key(String service, String region, String operation) {
		return Joiner.on('/').join(service.toLowerCase(Locale.ROOT), region, operation);
	}

	public static JsonNode parse(String json) {
		try {
			return JsonUtil.getObjectMapper().readTree(json.replace('\'', '"'));
		} catch (IOException e) {
			throw new IllegalArgumentException("invalid json: " + json, e);
		}
	}
}
