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
package org.lendingclub.surveyor.report;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import com.google.common.base.Strings;

public enum ReportFormat {

	MARKDOWN("md"), JSON("json"), CSV("csv");

	private final String extension;

	ReportFormat(String extension) {
		this.extension = extension;
	}

	public String getExtension() {
		return extension;
	}

	public ReportWriter newWriter() {
		switch (this) {
		case MARKDOWN:
			return new MarkdownReportWriter();
		case JSON:
			return new JsonReportWriter();
		case CSV:
			return new CsvReportWriter();
		default:
			throw new IllegalStateException("unsupported format: " + this);
		}
	}

	/**
	 * Case-insensitive lookup; <code>md</code> is accepted for markdown.
	 */
	public static ReportFormat parse(String s) {
		String name = Strings.nullToEmpty(s).trim().toUpperCase(Locale.ROOT);
		if (name.equals("MD")) {
			return MARKDOWN;
		}
		for (ReportFormat f : values()) {
			if (f.name().equals(name)) {
				return f;
			}
		}
		throw new IllegalArgumentException("unknown report format '" + s + "', expected one of "
				+ Arrays.stream(values()).map(f -> f.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", ")));
	}
}
