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

import org.assertj.core.api.Assertions;
import org.junit.Test;
import org.lendingclub.surveyor.core.ScannerConfig;

import com.google.common.collect.ImmutableList;

public class CommandLineOptionsTest {

	@Test
	public void testDefaults() {
		CommandLineOptions options = CommandLineOptions.parse();
		Assertions.assertThat(options.getRegions()).isEmpty();
		Assertions.assertThat(options.getOutput()).isEmpty();
		Assertions.assertThat(options.isStreaming()).isFalse();
		Assertions.assertThat(options.isNoProgress()).isFalse();

		ScannerConfig config = options.applyTo(ScannerConfig.builder()).build();
		Assertions.assertThat(config.getOnlyRegions()).isEmpty();
		Assertions.assertThat(config.getReportFormat()).isEqualTo(ScannerConfig.DEFAULT_REPORT_FORMAT);
	}

	@Test
	public void testListFlagsTakeSeveralValues() {
		CommandLineOptions options = CommandLineOptions.parse("--regions", "us-east-1", "us-west-2", "--skip-services",
				"EC2,S3", "--streaming");
		Assertions.assertThat(options.getRegions().get()).containsExactly("us-east-1", "us-west-2");
		Assertions.assertThat(options.getSkipServices().get()).containsExactly("EC2", "S3");
		Assertions.assertThat(options.isStreaming()).isTrue();
	}

	@Test
	public void testInlineValues() {
		CommandLineOptions options = CommandLineOptions.parse("--services=Lambda,DynamoDB", "--format=json",
				"--output=out.json");
		Assertions.assertThat(options.getServices().get()).containsExactly("Lambda", "DynamoDB");
		Assertions.assertThat(options.getFormat()).contains("json");
		Assertions.assertThat(options.getOutput()).contains("out.json");
	}

	@Test
	public void testFlagsOverrideConfig() {
		ScannerConfig.Builder loaded = ScannerConfig.builder().withReportFormat("csv").withLogLevel("DEBUG")
				.withSkipRegions(ImmutableList.of("ap-south-1"));
		ScannerConfig config = CommandLineOptions
				.parse("--format", "json", "--log-level", "warning", "--skip-regions", "eu-west-1", "--no-progress")
				.applyTo(loaded).build();
		Assertions.assertThat(config.getReportFormat()).isEqualTo("json");
		Assertions.assertThat(config.getLogLevel()).isEqualTo("WARNING");
		Assertions.assertThat(config.getSkipRegions()).containsExactly("eu-west-1");
	}

	@Test
	public void testRole() {
		Assertions.assertThat(CommandLineOptions.parse("-role", "arn:aws:iam::123456789012:role/audit").getRole())
				.contains("arn:aws:iam::123456789012:role/audit");
	}

	@Test
	public void testUnknownFlag() {
		Assertions.assertThatThrownBy(() -> CommandLineOptions.parse("--bogus"))
				.isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--bogus");
	}

	@Test
	public void testMissingValue() {
		Assertions.assertThatThrownBy(() -> CommandLineOptions.parse("--output"))
				.isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--output");
		Assertions.assertThatThrownBy(() -> CommandLineOptions.parse("--regions", "--streaming"))
				.isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--regions");
	}

	@Test
	public void testLogFormat() {
		CommandLineOptions options = CommandLineOptions.parse("--log-format", "JSON", "--no-progress");
		Assertions.assertThat(options.getLogFormat()).contains("json");
		Assertions.assertThat(options.applyTo(ScannerConfig.builder()).build().getLogFormat()).isEqualTo("json");
		Assertions.assertThat(CommandLineOptions.parse().applyTo(ScannerConfig.builder()).build().getLogFormat())
				.isEqualTo(ScannerConfig.DEFAULT_LOG_FORMAT);
		Assertions.assertThatThrownBy(() -> CommandLineOptions.parse("--log-format", "yaml"))
				.isInstanceOf(IllegalArgumentException.class).hasMessageContaining("yaml");
	}

	@Test
	public void testInvalidLogLevel() {
		Assertions.assertThatThrownBy(() -> CommandLineOptions.parse("--log-level", "LOUD"))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
