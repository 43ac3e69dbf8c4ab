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
package org.lendingclub.surveyor.cli;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.lendingclub.surveyor.core.ScannerConfig;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Command line flags. List flags take one or more values, either as separate
 * arguments or comma separated. Flags that are given override the loaded
 * configuration.
 */
public class CommandLineOptions {

	public static final String USAGE = "usage: surveyor [--regions r ...] [--skip-regions r ...] [--services s ...]\n"
			+ "                [--skip-services s ...] [--output path] [--format markdown|json|csv]\n"
			+ "                [--log-level DEBUG|INFO|WARNING|ERROR] [--log-format text|json]\n"
			+ "                [--config path] [--no-progress] [--streaming] [-role arn]";

	static final List<String> LOG_LEVELS = ImmutableList.of("DEBUG", "INFO", "WARNING", "WARN", "ERROR");
	static final List<String> LOG_FORMATS = ImmutableList.of(ScannerConfig.LOG_FORMAT_TEXT,
			ScannerConfig.LOG_FORMAT_JSON);

	private static final Splitter LIST_SPLITTER = Splitter.on(',').omitEmptyStrings().trimResults();

	List<String> regions;
	List<String> skipRegions;
	List<String> services;
	List<String> skipServices;
	String output;
	String format;
	String logLevel;
	String logFormat;
	String config;
	String role;
	boolean noProgress;
	boolean streaming;
	boolean help;

	CommandLineOptions() {
	}

	/**
	 * @throws IllegalArgumentException for an unknown flag or a missing value
	 */
	public static CommandLineOptions parse(String... args) {
		CommandLineOptions options = new CommandLineOptions();
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			String inline = null;
			int eq = arg.indexOf('=');
			if (arg.startsWith("--") && eq > 0) {
				inline = arg.substring(eq + 1);
				arg = arg.substring(0, eq);
			}
			switch (arg) {
			case "--regions":
				options.regions = listValue(arg, inline, args, i);
				break;
			case "--skip-regions":
				options.skipRegions = listValue(arg, inline, args, i);
				break;
			case "--services":
				options.services = listValue(arg, inline, args, i);
				break;
			case "--skip-services":
				options.skipServices = listValue(arg, inline, args, i);
				break;
			case "--output":
				options.output = value(arg, inline, args, i);
				break;
			case "--format":
				options.format = value(arg, inline, args, i);
				break;
			case "--log-level":
				options.logLevel = value(arg, inline, args, i).toUpperCase(Locale.ROOT);
				if (!LOG_LEVELS.contains(options.logLevel)) {
					throw new IllegalArgumentException("invalid log level: " + options.logLevel);
				}
				break;
			case "--log-format":
				options.logFormat = value(arg, inline, args, i).toLowerCase(Locale.ROOT);
				if (!LOG_FORMATS.contains(options.logFormat)) {
					throw new IllegalArgumentException("invalid log format: " + options.logFormat);
				}
				break;
			case "--config":
				options.config = value(arg, inline, args, i);
				break;
			case "-role":
			case "--role":
				options.role = value(arg, inline, args, i);
				break;
			case "--no-progress":
				options.noProgress = true;
				break;
			case "--streaming":
				options.streaming = true;
				break;
			case "-h":
			case "--help":
				options.help = true;
				break;
			default:
				throw new IllegalArgumentException("unrecognized argument: " + args[i]);
			}
			if (inline == null) {
				i += consumed(arg, args, i);
			}
		}
		return options;
	}

	private static boolean isFlag(String arg) {
		return arg.startsWith("-") && arg.length() > 1;
	}

	private static boolean takesList(String flag) {
		return flag.equals("--regions") || flag.equals("--skip-regions") || flag.equals("--services")
				|| flag.equals("--skip-services");
	}

	private static boolean takesValue(String flag) {
		return flag.equals("--output") || flag.equals("--format") || flag.equals("--log-level")
				|| flag.equals("--log-format") || flag.equals("--config") || flag.equals("-role") || flag.equals("--role");
	}

	private static int consumed(String flag, String[] args, int i) {
		if (takesValue(flag)) {
			return 1;
		}
		int n = 0;
		if (takesList(flag)) {
			while (i + n + 1 < args.length && !isFlag(args[i + n + 1])) {
				n++;
			}
		}
		return n;
	}

	private static String value(String flag, String inline, String[] args, int i) {
		String v = inline;
		if (v == null) {
			if (i + 1 >= args.length || isFlag(args[i + 1])) {
				throw new IllegalArgumentException(flag + " requires a value");
			}
			v = args[i + 1];
		}
		if (Strings.isNullOrEmpty(v.trim())) {
			throw new IllegalArgumentException(flag + " requires a value");
		}
		return v.trim();
	}

	private static List<String> listValue(String flag, String inline, String[] args, int i) {
		List<String> values = Lists.newArrayList();
		if (inline != null) {
			values.addAll(LIST_SPLITTER.splitToList(inline));
		} else {
			for (int j = i + 1; j < args.length && !isFlag(args[j]); j++) {
				values.addAll(LIST_SPLITTER.splitToList(args[j]));
			}
		}
		if (values.isEmpty()) {
			throw new IllegalArgumentException(flag + " requires at least one value");
		}
		return ImmutableList.copyOf(values);
	}

	public ScannerConfig.Builder applyTo(ScannerConfig.Builder b) {
		if (regions != null) {
			b.withOnlyRegions(regions);
		}
		if (skipRegions != null) {
			b.withSkipRegions(skipRegions);
		}
		if (services != null) {
			b.withOnlyServices(services);
		}
		if (skipServices != null) {
			b.withSkipServices(skipServices);
		}
		if (output != null) {
			b.withReportPath(output);
		}
		if (format != null) {
			b.withReportFormat(format);
		}
		if (logLevel != null) {
			b.withLogLevel(logLevel);
		}
		if (logFormat != null) {
			b.withLogFormat(logFormat);
		}
		return b;
	}

	public Optional<List<String>> getRegions() {
		return Optional.ofNullable(regions);
	}

	public Optional<List<String>> getSkipRegions() {
		return Optional.ofNullable(skipRegions);
	}

	public Optional<List<String>> getServices() {
		return Optional.ofNullable(services);
	}

	public Optional<List<String>> getSkipServices() {
		return Optional.ofNullable(skipServices);
	}

	public Optional<String> getOutput() {
		return Optional.ofNullable(output);
	}

	public Optional<String> getFormat() {
		return Optional.ofNullable(format);
	}

	public Optional<String> getLogLevel() {
		return Optional.ofNullable(logLevel);
	}

	public Optional<String> getLogFormat() {
		return Optional.ofNullable(logFormat);
	}

	public Optional<String> getConfig() {
		return Optional.ofNullable(config);
	}

	public Optional<String> getRole() {
		return Optional.ofNullable(role);
	}

	public boolean isNoProgress() {
		return noProgress;
	}

	public boolean isStreaming() {
		return streaming;
	}

	public boolean isHelp() {
		return help;
	}
}
