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

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

/**
 * Reads {@link ScannerConfig} from a JSON or YAML file and then applies
 * <code>SURVEYOR_*</code> environment variables on top.
 * <p>
 * A missing file yields the defaults. A file that exists but cannot be parsed, or
 * holds invalid values, is an error.
 */
public class ScannerConfigLoader {

	public static final String CONFIG_ENV = "SURVEYOR_CONFIG";
	public static final String DEFAULT_CONFIG_FILE = "surveyor-config.json";

	static final String ENV_PREFIX = "SURVEYOR_";

	static final List<String> KNOWN_KEYS = ImmutableList.of("max_concurrent_regions", "max_concurrent_services",
			"max_retries", "retry_delay", "retry_backoff", "requests_per_second", "skip_regions", "only_regions",
			"skip_services", "only_services", "service_rate_limits", "global_region", "report_format", "report_path",
			"log_level", "log_format");

	private static final Splitter LIST_SPLITTER = Splitter.on(',').omitEmptyStrings().trimResults();

	Logger logger = LoggerFactory.getLogger(getClass());

	private Map<String, String> environment = System.getenv();

	public ScannerConfigLoader withEnvironment(Map<String, String> environment) {
		this.environment = environment;
		return this;
	}

	/**
	 * Loads from <code>$SURVEYOR_CONFIG</code>, or from <code>surveyor-config.json</code>
	 * in the working directory.
	 */
	public ScannerConfig load() {
		String path = Strings.isNullOrEmpty(environment.get(CONFIG_ENV)) ? DEFAULT_CONFIG_FILE
				: environment.get(CONFIG_ENV);
		return load(new File(path));
	}

	public ScannerConfig load(File file) {
		return loadBuilder(file).build();
	}

	public ScannerConfig.Builder loadBuilder(File file) {
		ScannerConfig.Builder builder = ScannerConfig.builder();
		if (file.isFile()) {
			logger.info("loading configuration from {}", file.getAbsolutePath());
			apply(builder, readTree(file));
		} else {
			logger.info("{} not found; using default configuration", file.getPath());
		}
		applyEnvironment(builder);
		return builder;
	}

	JsonNode readTree(File file) {
		String name = file.getName().toLowerCase(Locale.ROOT);
		ObjectMapper mapper = name.endsWith(".yml") || name.endsWith(".yaml") ? new ObjectMapper(new YAMLFactory())
				: JsonUtil.getObjectMapper();
		try {
			JsonNode n = mapper.readTree(file);
			if (n == null || !n.isObject()) {
				throw new SurveyorException("configuration must be an object: " + file);
			}
			return n;
		} catch (IOException e) {
			throw new SurveyorException("unable to read configuration from " + file, e);
		}
	}

	public ScannerConfig.Builder apply(ScannerConfig.Builder b, JsonNode n) {
		n.fieldNames().forEachRemaining(key -> {
			if (!KNOWN_KEYS.contains(key)) {
				logger.warn("ignoring unknown configuration key: {}", key);
			}
		});
		if (n.has("max_concurrent_regions")) {
			b.withMaxConcurrentRegions(intValue(n, "max_concurrent_regions"));
		}
		if (n.has("max_concurrent_services")) {
			b.withMaxConcurrentServices(intValue(n, "max_concurrent_services"));
		}
		if (n.has("max_retries")) {
			b.withMaxRetries(intValue(n, "max_retries"));
		}
		if (n.has("retry_delay")) {
			b.withRetryDelay(doubleValue(n, "retry_delay"));
		}
		if (n.has("retry_backoff")) {
			b.withRetryBackoff(doubleValue(n, "retry_backoff"));
		}
		if (n.has("requests_per_second")) {
			b.withRequestsPerSecond(doubleValue(n, "requests_per_second"));
		}
		if (n.has("skip_regions")) {
			b.withSkipRegions(stringList(n, "skip_regions"));
		}
		if (n.has("only_regions")) {
			b.withOnlyRegions(stringList(n, "only_regions"));
		}
		if (n.has("skip_services")) {
			b.withSkipServices(stringList(n, "skip_services"));
		}
		if (n.has("only_services")) {
			b.withOnlyServices(stringList(n, "only_services"));
		}
		if (n.has("service_rate_limits")) {
			JsonNode limits = n.path("service_rate_limits");
			if (!limits.isObject()) {
				throw new SurveyorException("service_rate_limits must be an object");
			}
			limits.fields().forEachRemaining(it -> b.withServiceRateLimit(it.getKey(),
					doubleValue(limits, it.getKey())));
		}
		if (n.hasNonNull("global_region")) {
			b.withGlobalRegion(n.path("global_region").asText());
		}
		if (n.hasNonNull("report_format")) {
			b.withReportFormat(n.path("report_format").asText());
		}
		if (n.hasNonNull("report_path")) {
			b.withReportPath(n.path("report_path").asText());
		}
		if (n.hasNonNull("log_level")) {
			b.withLogLevel(n.path("log_level").asText());
		}
		if (n.hasNonNull("log_format")) {
			b.withLogFormat(n.path("log_format").asText());
		}
		return b;
	}

	public ScannerConfig.Builder applyEnvironment(ScannerConfig.Builder b) {
		String v = env("MAX_CONCURRENT_REGIONS");
		if (v != null) {
			b.withMaxConcurrentRegions(parseInt("MAX_CONCURRENT_REGIONS", v));
		}
		v = env("MAX_CONCURRENT_SERVICES");
		if (v != null) {
			b.withMaxConcurrentServices(parseInt("MAX_CONCURRENT_SERVICES", v));
		}
		v = env("REQUESTS_PER_SECOND");
		if (v != null) {
			try {
				b.withRequestsPerSecond(Double.parseDouble(v.trim()));
			} catch (NumberFormatException e) {
				throw new SurveyorException(ENV_PREFIX + "REQUESTS_PER_SECOND is not a number: " + v, e);
			}
		}
		v = env("SKIP_REGIONS");
		if (v != null) {
			b.withSkipRegions(LIST_SPLITTER.splitToList(v));
		}
		v = env("ONLY_REGIONS");
		if (v != null) {
			b.withOnlyRegions(LIST_SPLITTER.splitToList(v));
		}
		v = env("SKIP_SERVICES");
		if (v != null) {
			b.withSkipServices(LIST_SPLITTER.splitToList(v));
		}
		v = env("ONLY_SERVICES");
		if (v != null) {
			b.withOnlyServices(LIST_SPLITTER.splitToList(v));
		}
		v = env("LOG_LEVEL");
		if (v != null) {
			b.withLogLevel(v.trim());
		}
		v = env("LOG_FORMAT");
		if (v != null) {
			b.withLogFormat(v);
		}
		return b;
	}

	private String env(String name) {
		return Strings.emptyToNull(environment.get(ENV_PREFIX + name));
	}

	private static int parseInt(String name, String v) {
		try {
			return Integer.parseInt(v.trim());
		} catch (NumberFormatException e) {
			throw new SurveyorException(ENV_PREFIX + name + " is not an integer: " + v, e);
		}
	}

	private static int intValue(JsonNode n, String key) {
		JsonNode v = n.path(key);
		if (!v.canConvertToInt() || !v.isIntegralNumber()) {
			throw new SurveyorException(key + " must be an integer: " + v);
		}
		return v.intValue();
	}

	private static double doubleValue(JsonNode n, String key) {
		JsonNode v = n.path(key);
		if (!v.isNumber()) {
			throw new SurveyorException(key + " must be a number: " + v);
		}
		return v.doubleValue();
	}

	private static List<String> stringList(JsonNode n, String key) {
		JsonNode v = n.path(key);
		if (v.isTextual()) {
			return LIST_SPLITTER.splitToList(v.asText());
		}
		if (!v.isArray()) {
			throw new SurveyorException(key + " must be a list: " + v);
		}
		List<String> list = Lists.newArrayList();
		v.forEach(it -> list.add(it.asText()));
		return ImmutableList.copyOf(ImmutableSet.copyOf(list));
	}
}
