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
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.lendingclub.surveyor.core.Resource;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

/**
 * One CSV row per resource. Scalar details are joined into a single column.
 */
public class CsvReportWriter implements ReportWriter {

	public static final String[] HEADERS = { "Service", "Type", "ID", "Name", "Region", "State", "Created",
			"Monthly Cost", "Details" };

	@Override
	public void write(Collection<Resource> resources, Writer out) throws IOException {
		writeStreaming(resources.iterator(), out);
	}

	@Override
	public InventorySummary writeStreaming(Iterator<Resource> resources, Writer out) throws IOException {
		InventorySummary summary = new InventorySummary();
		// not closed, the caller owns the writer
		CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT.withHeader(HEADERS));
		while (resources.hasNext()) {
			Resource r = resources.next();
			summary.add(r);
			printer.printRecord(r.getService(), r.getType(), r.getId(), r.getName().orElse(""), r.getRegion(),
					r.getState().orElse(""), r.getCreatedAt().map(Object::toString).orElse(""),
					String.format(Locale.ROOT, "%.2f", r.getEstimatedMonthlyCostOrZero()), details(r));
		}
		printer.flush();
		return summary;
	}

	static String details(Resource r) {
		List<String> details = Lists.newArrayList();
		for (Map.Entry<String, Object> it : r.getAdditionalInfo().entrySet()) {
			if (ReportFormatting.isShown(it.getKey(), it.getValue())) {
				details.add(it.getKey() + "=" + it.getValue());
			}
		}
		return Joiner.on("; ").join(details);
	}
}
