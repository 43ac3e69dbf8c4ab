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

import java.util.Iterator;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Converts AWS SDK model objects into JSON trees whose field names match the AWS
 * API documentation (<code>InstanceId</code>, <code>State.Name</code>,
 * <code>DBInstanceIdentifier</code>), so that scanners read the same shape no
 * matter which client produced it.
 */
public class JsonConverter {

	static ObjectMapper mapper = JsonMapper.builder().enable(MapperFeature.USE_STD_BEAN_NAMING)
			.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS).serializationInclusion(JsonInclude.Include.NON_NULL)
			.build();

	public JsonConverter() {
	}

	public JsonNode toJson(Object x) {
		JsonNode n = x instanceof JsonNode ? (JsonNode) x : mapper.valueToTree(x);
		return capitalize(n);
	}

	/**
	 * A page holding <code>items</code> under <code>field</code>.
	 */
	public ObjectNode page(String field, Object items) {
		ObjectNode page = mapper.createObjectNode();
		page.set(field, items == null ? mapper.createArrayNode() : toJson(items));
		return page;
	}

	/**
	 * JSON of <code>x</code> with its field names left as they are, for maps whose
	 * keys are data, such as tag maps.
	 */
	public JsonNode toRawJson(Object x) {
		return x == null ? mapper.createObjectNode() : mapper.valueToTree(x);
	}

	public ObjectNode createObjectNode() {
		return mapper.createObjectNode();
	}

	private String getKey(String key) {
		if (!key.isEmpty() && Character.isLowerCase(key.charAt(0))) {
			return Character.toUpperCase(key.charAt(0)) + key.substring(1);
		}
		return key;
	}

	private JsonNode capitalize(JsonNode n) {
		if (n.isObject()) {
			ObjectNode r = mapper.createObjectNode();
			Iterator<Map.Entry<String, JsonNode>> fields = n.fields();
			while (fields.hasNext()) {
				Map.Entry<String, JsonNode> it = fields.next();
				r.set(getKey(it.getKey()), capitalize(it.getValue()));
			}
			return r;
		}
		if (n.isArray()) {
			ArrayNode r = mapper.createArrayNode();
			n.forEach(it -> r.add(capitalize(it)));
			return r;
		}
		return n;
	}
}
