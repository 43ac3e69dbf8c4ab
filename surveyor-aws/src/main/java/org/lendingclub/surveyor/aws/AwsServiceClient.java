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
package org.lendingclub.surveyor.aws;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.lendingclub.surveyor.core.ErrorClassifier;
import org.lendingclub.surveyor.core.ProviderException;
import org.lendingclub.surveyor.core.ServiceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.SdkClientException;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * {@link ServiceClient} over one AWS SDK client in one region. Each operation
 * is bound to an SDK call that returns one page plus the token of the next
 * page. SDK failures surface as {@link ProviderException} carrying the AWS
 * error code.
 */
public class AwsServiceClient implements ServiceClient {

	public static final String CONNECTION_ERROR = "ConnectionError";
	public static final String CLIENT_ERROR = "ClientError";

	static Logger logger = LoggerFactory.getLogger(AwsServiceClient.class);

	private final String service;
	private final String region;
	private final Map<String, Operation> operations = Maps.newConcurrentMap();

	public static class Page {
		final JsonNode body;
		final String nextToken;

		public Page(JsonNode body, String nextToken) {
			this.body = body;
			this.nextToken = nextToken;
		}

		public static Page last(JsonNode body) {
			return new Page(body, null);
		}
	}

	@FunctionalInterface
	public interface PageFetcher {
		Page fetch(String token);
	}

	@FunctionalInterface
	public interface Operation {
		PageFetcher bind(Map<String, ?> params);
	}

	public AwsServiceClient(String service, String region) {
		Preconditions.checkNotNull(service, "service cannot be null");
		Preconditions.checkNotNull(region, "region cannot be null");
		this.service = service;
		this.region = region;
	}

	public AwsServiceClient withOperation(String name, Operation operation) {
		operations.put(name, operation);
		return this;
	}

	public String getService() {
		return service;
	}

	public String getRegion() {
		return region;
	}

	public Set<String> getOperationNames() {
		return ImmutableSet.copyOf(operations.keySet());
	}

	@Override
	public Iterable<JsonNode> paginate(String operation, Map<String, ?> params) {
		Operation op = operations.get(operation);
		Preconditions.checkArgument(op != null, "%s does not support %s", service, operation);
		PageFetcher fetcher = op.bind(params == null ? Collections.<String, Object>emptyMap() : params);
		return () -> new PageIterator(operation, fetcher);
	}

	protected boolean tokenHasNext(String token) {
		return (!Strings.isNullOrEmpty(token)) && (!token.equals("null"));
	}

	class PageIterator extends AbstractIterator<JsonNode> {
		final String operation;
		final PageFetcher fetcher;
		String token = null;
		boolean done = false;

		PageIterator(String operation, PageFetcher fetcher) {
			this.operation = operation;
			this.fetcher = fetcher;
		}

		@Override
		protected JsonNode computeNext() {
			if (done) {
				return endOfData();
			}
			Page page = fetch(operation, fetcher, token);
			token = page.nextToken;
			done = !tokenHasNext(token);
			return page.body;
		}
	}

	Page fetch(String operation, PageFetcher fetcher, String token) {
		logger.debug("{} {} {} token={}", service, region, operation, token);
		try {
			return fetcher.fetch(token);
		} catch (AmazonServiceException e) {
			String code = e.getErrorCode();
			String message = String.format("%s:%s in %s failed: %s", service, operation, region, e.getErrorMessage());
			if (isUnlistedServerError(e)) {
				message = message + " (" + code + ", HTTP " + e.getStatusCode() + ")";
				code = CONNECTION_ERROR;
			}
			throw new ProviderException(code, message, e);
		} catch (SdkClientException e) {
			String code = e.isRetryable() ? CONNECTION_ERROR : CLIENT_ERROR;
			throw new ProviderException(code,
					String.format("%s:%s in %s failed: %s", service, operation, region, e.getMessage()), e);
		}
	}

	/**
	 * A failure on the AWS side (5xx, or an error the SDK attributes to the service)
	 * whose code is not otherwise known is retried like a connection error.
	 */
	static boolean isUnlistedServerError(AmazonServiceException e) {
		String code = e.getErrorCode();
		if (ErrorClassifier.ACCESS_DENIED_CODES.contains(code) || ErrorClassifier.THROTTLING_CODES.contains(code)
				|| ErrorClassifier.TRANSIENT_CODES.contains(code)) {
			return false;
		}
		return e.getErrorType() == AmazonServiceException.ErrorType.Service || e.getStatusCode() >= 500;
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("service", service).add("region", region).toString();
	}

	static String param(Map<String, ?> params, String name) {
		Object v = params.get(name);
		return v == null ? null : v.toString();
	}

	static List<String> listParam(Map<String, ?> params, String name) {
		Object v = params.get(name);
		if (v == null) {
			return ImmutableList.of();
		}
		if (v instanceof Collection) {
			List<String> list = Lists.newArrayList();
			((Collection<?>) v).forEach(it -> list.add(String.valueOf(it)));
			return list;
		}
		return ImmutableList.of(v.toString());
	}
}
