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

import java.io.IOException;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Iterator;
import java.util.List;

import org.assertj.core.api.Assertions;
import org.junit.Test;
import org.lendingclub.surveyor.core.AbstractRegionScanner;
import org.lendingclub.surveyor.core.ProviderException;
import org.lendingclub.surveyor.core.Resource;
import org.lendingclub.surveyor.core.ResourceStream;
import org.lendingclub.surveyor.core.ScanCancelledException;
import org.lendingclub.surveyor.core.ScanOrchestrator;
import org.lendingclub.surveyor.core.ScannerConfig;
import org.lendingclub.surveyor.core.ServiceRegistry;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

public class MarkdownReportWriterTest {

	Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

	static class CannedScanner extends AbstractRegionScanner {

		CannedScanner(String service, ScannerConfig config) {
			super(service, config);
		}

		@Override
		public List<Resource> scanRegion(String region) {
			if (region.equals("eu-west-1")) {
				throw new ProviderException("AccessDenied", "denied in " + region);
			}
			return ImmutableList.of(Inventories.resource(getServiceName(), region, getServiceName() + "-" + region, 10));
		}
	}

	String write(List<Resource> resources, MarkdownReportWriter writer) throws IOException {
		StringWriter out = new StringWriter();
		writer.withClock(clock).write(resources, out);
		return out.toString();
	}

	@Test
	public void testTwoServicesTwoRegions() throws IOException {
		String report = write(Inventories.twoByTwo(), new MarkdownReportWriter());

		Assertions.assertThat(report).startsWith(MarkdownReportWriter.TITLE)
				.contains("**Generated:** 2024-05-01 12:00:00")
				.contains("**Total Resources Found:** 4")
				.contains("**Total Estimated Monthly Cost:** $60.00")
				.contains("- [EC2](#ec2)\n- [RDS](#rds)")
				.contains("| EC2 | 2 | $30.00 |")
				.contains("| RDS | 2 | $30.00 |")
				.contains("## EC2\n\n### us-east-1\n\n| Type | Name/ID | State | Monthly Cost | Details |")
				.contains("| Thing | i-2 | active | $20.00 | - |")
				.contains("### Top 4 Most Expensive Resources")
				.doesNotContain("## Scan Errors");
		Assertions.assertThat(report.indexOf("## EC2")).isLessThan(report.indexOf("## RDS\n"));
		Assertions.assertThat(report.indexOf("| EC2 | Thing | i-2 | us-west-2 | $20.00 |"))
				.isLessThan(report.indexOf("| EC2 | Thing | i-1 | us-east-1 | $10.00 |"));
	}

	@Test
	public void testResourceRow() throws IOException {
		String report = write(ImmutableList.of(Inventories.instance()), new MarkdownReportWriter());
		Assertions.assertThat(report).contains(
				"| Instance | web\\|1 | running | $1,234.50 | instanceType: m5.large, cpuCount: 2, vpcId: vpc-1 |");
	}

	@Test
	public void testEmptyInventory() throws IOException {
		String report = write(ImmutableList.of(), new MarkdownReportWriter());
		Assertions.assertThat(report).contains("**Total Resources Found:** 0").contains("No resources found.")
				.doesNotContain("## Summary by Service");
	}

	@Test
	public void testTopN() throws IOException {
		List<Resource> resources = Lists.newArrayList();
		for (int i = 1; i <= 15; i++) {
			resources.add(Inventories.resource("EC2", "us-east-1", "i-" + i, i));
		}
		String report = write(resources, new MarkdownReportWriter());
		Assertions.assertThat(report).contains("### Top 10 Most Expensive Resources")
				.contains("| EC2 | Thing | i-6 | us-east-1 | $6.00 |")
				.doesNotContain("| EC2 | Thing | i-5 | us-east-1 | $5.00 |");
	}

	@Test
	public void testScanErrors() throws IOException {
		ScannerConfig config = ScannerConfig.builder().withRetryDelay(0.001).withRequestsPerSecond(1000).build();
		ServiceRegistry registry = new ServiceRegistry().register(new CannedScanner("EC2", config))
				.register(new CannedScanner("RDS", config));
		ScanOrchestrator orchestrator = ScanOrchestrator.builder().withConfig(config).withRegistry(registry)
				.withRegions(ImmutableList.of("us-east-1", "eu-west-1")).build();
		List<Resource> resources = orchestrator.scanAll();
		Assertions.assertThat(resources).hasSize(2);

		String report = write(resources, new MarkdownReportWriter().withDiagnostics(orchestrator.getDiagnostics()));
		Assertions.assertThat(report).contains("## Scan Errors")
				.contains("| EC2 | eu-west-1 | ACCESS_DENIED | AccessDenied: denied in eu-west-1 |")
				.contains("| RDS | eu-west-1 | ACCESS_DENIED | AccessDenied: denied in eu-west-1 |");
	}

	@Test
	public void testCancelledServicesListed() throws IOException {
		ScannerConfig config = ScannerConfig.builder().withRetryDelay(0.001).withRequestsPerSecond(1000)
				.withMaxConcurrentServices(1).build();
		AbstractRegionScanner stuck = new AbstractRegionScanner("Lambda", config) {
			@Override
			public List<Resource> scanRegion(String region) {
				try {
					Thread.sleep(10_000);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new ScanCancelledException("interrupted", e);
				}
				return ImmutableList.of();
			}
		};
		ServiceRegistry registry = new ServiceRegistry().register(new CannedScanner("EC2", config)).register(stuck);
		ScanOrchestrator orchestrator = ScanOrchestrator.builder().withConfig(config).withRegistry(registry)
				.withRegions(ImmutableList.of("us-east-1")).build();
		List<Resource> resources = Lists.newArrayList();
		try (ResourceStream stream = orchestrator.stream()) {
			resources.add(stream.next());
		}
		Assertions.assertThat(orchestrator.getDiagnostics().hasErrors()).isFalse();

		String report = write(resources, new MarkdownReportWriter().withDiagnostics(orchestrator.getDiagnostics()));
		Assertions.assertThat(report).contains("## Scan Errors")
				.contains("| Lambda | * | CANCELLED | scan cancelled before completion |")
				.doesNotContain("| EC2 | * |");
	}

	@Test
	public void testStreaming() throws IOException {
		StringWriter out = new StringWriter();
		InventorySummary summary = new MarkdownReportWriter().withClock(clock)
				.writeStreaming(Inventories.twoByTwo().iterator(), out);
		String report = out.toString();

		Assertions.assertThat(summary.getTotalResources()).isEqualTo(4);
		Assertions.assertThat(summary.getTotalEstimatedMonthlyCost()).isEqualTo(60.0);
		Assertions.assertThat(report).contains("## EC2\n\n### us-east-1\n\n").contains("### us-west-2")
				.contains("| Thing | db-2 | active | $20.00 | - |")
				.contains("**Total Resources Found:** 4")
				.contains("**Total Estimated Monthly Cost:** $60.00");
		// rows come before the totals in a single pass
		Assertions.assertThat(report.indexOf("| Thing | i-1 |")).isLessThan(report.indexOf("## Totals"));
		Assertions.assertThat(report.indexOf("## Totals")).isLessThan(report.indexOf("## Summary by Service"));
	}

	@Test
	public void testStreamingConsumesIteratorOnce() throws IOException {
		List<Resource> seen = Lists.newArrayList();
		Iterator<Resource> it = Inventories.twoByTwo().iterator();
		Iterator<Resource> once = new Iterator<Resource>() {
			@Override
			public boolean hasNext() {
				return it.hasNext();
			}

			@Override
			public Resource next() {
				Resource r = it.next();
				seen.add(r);
				return r;
			}
		};
		new MarkdownReportWriter().writeStreaming(once, new StringWriter());
		Assertions.assertThat(seen).hasSize(4);
	}
}
