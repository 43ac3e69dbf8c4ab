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

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Strings;

public class JsonUtil {

	static final ObjectMapper mapper = new ObjectMapper();
	static Logger logger = LoggerFactory.getLogger(JsonUtil.class);

	public static ObjectMapper getObjectMapper() {
		return mapper;
	}

	public static ObjectNode createObjectNode() {
		return getObjectMapper().createObjectNode();
	}

	public static ArrayNode createArrayNode() {
		return getObjectMapper().createArrayNode();
	}

	public static String prettyFormat(Object n) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(n);
		} catch (JsonProcessingException e) {
			throw new SurveyorException(e);
		}
	}

	/**
	 * Text value of a field, or empty when it is missing, null or blank.
	 */
	public static Optional<String> text(JsonNode n, String field) {
		JsonNode v = n.path(field);
		if (v.isMissingNode() || v.isNull() || v.isContainerNode()) {
			return Optional.empty();
		}
		return Optional.ofNullable(Strings.emptyToNull(v.asText()));
	}

	/**
	 * Timestamps arrive either as epoch millis or as ISO-8601 text.
	 */
	public static Optional<Instant> instant(JsonNode n, String field) {
		JsonNode v = n.path(field);
		if (v.isNumber()) {
			return Optional.of(Instant.ofEpochMilli(v.longValue()));
		}
		if (v.isTextual() && !v.asText().isEmpty()) {
			try {
				return Optional.of(Instant.parse(v.asText()));
			} catch (DateTimeParseException e) {
				logger.debug("unparseable timestamp {}={}", field, v.asText());
			}
		}
		return Optional.empty();
	}

	public static void logDebug(Logger log, String message, Object n) {
		try {
			if (log != null && log.isDebugEnabled()) {
				log.debug("{} - \n{}", message, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(n));
			}
		} catch (JsonProcessingException e) {
			logger.warn("problem logging: {}", e.toString());
		}
	}
}
