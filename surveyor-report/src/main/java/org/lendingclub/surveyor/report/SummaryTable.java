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

import java.io.PrintStream;

import com.google.common.base.Strings;

/**
 * Plain text Service / Count / Monthly Cost table for the console.
 */
public class SummaryTable {

	public static final String TOTAL = "TOTAL";

	public String render(InventorySummary summary) {
		int serviceWidth = "Service".length();
		int costWidth = Math.max("Monthly Cost".length(),
				ReportFormatting.money(summary.getTotalEstimatedMonthlyCost()).length());
		for (ServiceSummary s : summary.getServices()) {
			serviceWidth = Math.max(serviceWidth, s.getService().length());
			costWidth = Math.max(costWidth, ReportFormatting.money(s.getTotalEstimatedMonthlyCost()).length());
		}
		int countWidth = Math.max("Count".length(), Integer.toString(summary.getTotalResources()).length());

		StringBuilder sb = new StringBuilder();
		row(sb, "Service", "Count", "Monthly Cost", serviceWidth, countWidth, costWidth);
		rule(sb, serviceWidth, countWidth, costWidth);
		for (ServiceSummary s : summary.getServices()) {
			row(sb, s.getService(), Integer.toString(s.getResourceCount()),
					ReportFormatting.money(s.getTotalEstimatedMonthlyCost()), serviceWidth, countWidth, costWidth);
		}
		rule(sb, serviceWidth, countWidth, costWidth);
		row(sb, TOTAL, Integer.toString(summary.getTotalResources()),
				ReportFormatting.money(summary.getTotalEstimatedMonthlyCost()), serviceWidth, countWidth, costWidth);
		return sb.toString();
	}

	public void print(InventorySummary summary, PrintStream out) {
		if (summary.isEmpty()) {
			out.println("No resources found.");
			return;
		}
		out.print(render(summary));
		out.flush();
	}

	private void row(StringBuilder sb, String service, String count, String cost, int serviceWidth, int countWidth,
			int costWidth) {
		sb.append(Strings.padEnd(service, serviceWidth, ' ')).append("  ")
				.append(Strings.padStart(count, countWidth, ' ')).append("  ")
				.append(Strings.padStart(cost, costWidth, ' ')).append('\n');
	}

	private void rule(StringBuilder sb, int serviceWidth, int countWidth, int costWidth) {
		sb.append(Strings.repeat("-", serviceWidth)).append("  ").append(Strings.repeat("-", countWidth))
				.append("  ").append(Strings.repeat("-", costWidth)).append('\n');
	}
}
