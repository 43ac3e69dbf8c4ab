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

import java.util.Iterator;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Read-only access to one service in one region. Responses are JSON trees whose
 * field names follow the provider's API documentation.
 * <p>
 * Failures are reported as {@link ProviderException}.
 */
public interface ServiceClient {

	/**
	 * Lazily fetches the pages of a list/describe operation. The next page is
	 * requested only when the iterator advances past the current one.
	 */
	Iterable<JsonNode> paginate(String operation, Map<String, ?> params);

	/**
	 * Single request, or the first page of a paginated one.
	 */
	default JsonNode call(String operation, Map<String, ?> params) {
		Iterator<JsonNode> pages = paginate(operation, params).iterator();
		return pages.hasNext() ? pages.next() : MissingNode.getInstance();
	}
}
