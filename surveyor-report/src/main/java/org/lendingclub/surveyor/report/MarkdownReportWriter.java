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
import java.io.Writer;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.lendingclub.surveyor.core.ErrorKind;
import org.lendingclub.surveyor.core.Resource;
import org.lendingclub.surveyor.core.ScanDiagnostics;
import org.lendingclub.surveyor.core.ScanDiagnostics.ServiceDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * Markdown inventory report: summary by service, one table per service and
 * region, the most expensive resources, and the scan errors when diagnostics
 * are supplied.
 */
public class MarkdownReportWriter implements ReportWriter {

	public static final String TITLE = "# AWS Resources Report";
	public static final int MAX_DETAILS = 3;

	static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");
	static final String RESOURCE_HEADER = "| Type | Name/ID | State | Monthly Cost | Details |\n"
			+ "|------|---------|-------|--------------|---------|\n";

	Logger logger = LoggerFactory.getLogger(getClass());

	private Clock clock = Clock.systemDefaultZone();
	private ScanDiagnostics diagnostics;
	private int topN = InventorySummary.DEFAULT_TOP_N;

	public MarkdownReportWriter withClock(Clock clock) {
		this.clock = Preconditions.checkNotNull(clock);
		return this;
	}

	public MarkdownReportWriter withDiagnostics(ScanDiagnostics diagnostics) {
		this.diagnostics = diagnostics;
		return this;
	}

	public MarkdownReportWriter withTopN(int topN) {
		Preconditions.checkArgument(topN >= 0, "topN must be >= 0: %s", topN);
		this.topN = topN;
		return this;
	}

	@Override
	public void write(Collection<Resource> resources, Writer out) throws IOException {
		InventorySummary summary = new InventorySummary(topN);
		resources.forEach(summary::add);

		writeHeader(out, summary);
		if (summary.isEmpty()) {
			out.write("No resources found.\n\n");
		} else {
			out.write("## Table of Contents\n\n");
			for (ServiceSummary s : summary.getServices()) {
				out.write("- [" + s.getService() + "](#" + ReportFormatting.anchor(s.getService()) + ")\n");
			}
			out.write("\n");
			writeServiceSummary(out, summary);

			Map<String, Map<String, List<Resource>>> byServiceAndRegion = Maps.newTreeMap();
			for (Resource r : resources) {
				byServiceAndRegion.computeIfAbsent(r.getService(), k -> Maps.newTreeMap())
						.computeIfAbsent(r.getRegion(), k -> Lists.newArrayList()).add(r);
			}
			for (Map.Entry<String, Map<String, List<Resource>>> service : byServiceAndRegion.entrySet()) {
				out.write("## " + service.getKey() + "\n\n");
				for (Map.Entry<String, List<Resource>> region : service.getValue().entrySet()) {
					out.write("### " + region.getKey() + "\n\n");
					out.write(RESOURCE_HEADER);
					for (Resource r : region.getValue()) {
						writeResourceRow(out, r);
					}
					out.write("\n");
				}
			}
			writeMostExpensive(out, summary);
		}
		writeScanErrors(out);
		out.flush();
	}

	@Override
	public InventorySummary writeStreaming(Iterator<Resource> resources, Writer out) throws IOException {
		InventorySummary summary = new InventorySummary(topN);
		out.write(TITLE + "\n\n");
		out.write("**Generated:** " + ZonedDateTime.now(clock).format(TIMESTAMP) + "\n\n");

		String service = null;
		String region = null;
		while (resources.hasNext()) {
			Resource r = resources.next();
			summary.add(r);
			if (!Objects.equals(service, r.getService())) {
				service = r.getService();
				region = null;
				out.write("## " + service + "\n\n");
			}
			if (!Objects.equals(region, r.getRegion())) {
				if (region != null) {
					out.write("\n");
				}
				region = r.getRegion();
				out.write("### " + region + "\n\n");
				out.write(RESOURCE_HEADER);
			}
			writeResourceRow(out, r);
			if (summary.getTotalResources() % 1000 == 0) {
				out.flush();
			}
		}
		if (service != null) {
			out.write("\n");
		}

		out.write("## Totals\n\n");
		out.write("**Total Resources Found:** " + summary.getTotalResources() + "\n");
		out.write("**Total Estimated Monthly Cost:** " + ReportFormatting.money(summary.getTotalEstimatedMonthlyCost())
				+ "\n\n");
		if (summary.isEmpty()) {
			out.write("No resources found.\n\n");
		} else {
			writeServiceSummary(out, summary);
			writeMostExpensive(out, summary);
		}
		writeScanErrors(out);
		out.flush();
		logger.info("wrote streaming report with {} resources", summary.getTotalResources());
		return summary;
	}

	void writeHeader(Writer out, InventorySummary summary) throws IOException {
		out.write(TITLE + "\n\n");
		out.write("**Generated:** " + ZonedDateTime.now(clock).format(TIMESTAMP) + "\n");
		out.write("**Total Resources Found:** " + summary.getTotalResources() + "\n");
		out.write("**Total Estimated Monthly Cost:** " + ReportFormatting.money(summary.getTotalEstimatedMonthlyCost())
				+ "\n\n");
	}

	void writeServiceSummary(Writer out, InventorySummary summary) throws IOException {
		out.write("## Summary by Service\n\n");
		out.write("| Service | Resource Count | Estimated Monthly Cost |\n");
		out.write("|---------|----------------|------------------------|\n");
		for (ServiceSummary s : summary.getServices()) {
			out.write("| " + s.getService() + " | " + s.getResourceCount() + " | "
					+ ReportFormatting.money(s.getTotalEstimatedMonthlyCost()) + " |\n");
		}
		out.write("\n");
	}

	void writeResourceRow(Writer out, Resource r) throws IOException {
		List<String> details = ReportFormatting.details(r, MAX_DETAILS);
		out.write("| " + ReportFormatting.cell(r.getType()) + " | " + ReportFormatting.cell(r.getDisplayName()) + " | "
				+ ReportFormatting.cell(r.getState().orElse("active")) + " | "
				+ ReportFormatting.money(r.getEstimatedMonthlyCostOrZero()) + " | "
				+ (details.isEmpty() ? "-" : ReportFormatting.cell(Joiner.on(", ").join(details))) + " |\n");
	}

	void writeMostExpensive(Writer out, InventorySummary summary) throws IOException {
		List<Resource> top = summary.getMostExpensive();
		if (top.isEmpty()) {
			return;
		}
		out.write("## Cost Breakdown\n\n");
		out.write("### Top " + top.size() + " Most Expensive Resources\n\n");
		out.write("| Service | Type | Name/ID | Region | Monthly Cost |\n");
		out.write("|---------|------|---------|--------|--------------|\n");
		for (Resource r : top) {
			out.write("| " + r.getService() + " | " + ReportFormatting.cell(r.getType()) + " | "
					+ ReportFormatting.cell(r.getDisplayName()) + " | " + r.getRegion() + " | "
					+ ReportFormatting.money(r.getEstimatedMonthlyCostOrZero()) + " |\n");
		}
		out.write("\n");
	}

	void writeScanErrors(Writer out) throws IOException {
		if (diagnostics == null || !(diagnostics.hasErrors() || diagnostics.isCancelled())) {
			return;
		}
		out.write("## Scan Errors\n\n");
		out.write("| Service | Region | Error | Message |\n");
		out.write("|---------|--------|-------|---------|\n");
		for (ServiceDiagnostics service : diagnostics.getServicesWithErrors()) {
			if (service.getServiceError().isPresent()) {
				out.write("| " + service.getService() + " | * | " + ErrorKind.FATAL + " | "
						+ ReportFormatting.cell(String.valueOf(service.getServiceError().get().getMessage())) + " |\n");
			}
			for (Map.Entry<String, ErrorKind> it : new TreeMap<>(service.getFailedRegions()).entrySet()) {
				out.write("| " + service.getService() + " | " + it.getKey() + " | " + it.getValue() + " | "
						+ ReportFormatting.cell(service.getFailureMessage(it.getKey()).orElse("")) + " |\n");
			}
		}
		for (ServiceDiagnostics service : diagnostics.getCancelledServices()) {
			out.write("| " + service.getService() + " | * | CANCELLED | scan cancelled before completion |\n");
		}
		out.write("\n");
	}
}
