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
import java.util.Map;

import org.lendingclub.surveyor.core.JsonUtil;
import org.lendingclub.surveyor.core.Resource;

import com.fasterxml.jackson.core.JsonGenerator;

/**
 * JSON inventory: <code>{"resources":[...],"summary":{...}}</code>. Resources are
 * written with a streaming generator, so the summary follows the last one.
 */
public class JsonReportWriter implements ReportWriter {

	private boolean pretty = true;

	public JsonReportWriter withPrettyPrint(boolean pretty) {
		this.pretty = pretty;
		return this;
	}

	@Override
	public void write(Collection<Resource> resources, Writer out) throws IOException {
		writeStreaming(resources.iterator(), out);
	}

	@Override
	public InventorySummary writeStreaming(Iterator<Resource> resources, Writer out) throws IOException {
		InventorySummary summary = new InventorySummary();
		JsonGenerator gen = JsonUtil.getObjectMapper().getFactory().createGenerator(out);
		gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
		if (pretty) {
			gen.useDefaultPrettyPrinter();
		}
		try {
			gen.writeStartObject();
			gen.writeArrayFieldStart("resources");
			while (resources.hasNext()) {
				Resource r = resources.next();
				summary.add(r);
				writeResource(gen, r);
			}
			gen.writeEndArray();
			gen.writeFieldName("summary");
			writeSummary(gen, summary);
			gen.writeEndObject();
		} finally {
			gen.close();
		}
		out.write("\n");
		out.flush();
		return summary;
	}

	void writeResource(JsonGenerator gen, Resource r) throws IOException {
		gen.writeStartObject();
		gen.writeStringField("id", r.getId());
		gen.writeStringField("type", r.getType());
		gen.writeStringField("service", r.getService());
		gen.writeStringField("region", r.getRegion());
		if (r.getName().isPresent()) {
			gen.writeStringField("name", r.getName().get());
		}
		if (r.getState().isPresent()) {
			gen.writeStringField("state", r.getState().get());
		}
		if (r.getCreatedAt().isPresent()) {
			gen.writeStringField("createdAt", r.getCreatedAt().get().toString());
		}
		if (r.getEstimatedMonthlyCost().isPresent()) {
			gen.writeNumberField("estimatedMonthlyCost", r.getEstimatedMonthlyCost().getAsDouble());
		}
		gen.writeObjectField("additionalInfo", r.getAdditionalInfo());
		gen.writeEndObject();
	}

	void writeSummary(JsonGenerator gen, InventorySummary summary) throws IOException {
		gen.writeStartObject();
		gen.writeNumberField("totalResources", summary.getTotalResources());
		gen.writeNumberField("totalEstimatedMonthlyCost", summary.getTotalEstimatedMonthlyCost());
		gen.writeArrayFieldStart("services");
		for (ServiceSummary s : summary.getServices()) {
			gen.writeStartObject();
			gen.writeStringField("service", s.getService());
			gen.writeNumberField("resourceCount", s.getResourceCount());
			gen.writeNumberField("estimatedMonthlyCost", s.getTotalEstimatedMonthlyCost());
			gen.writeObjectFieldStart("resourcesByRegion");
			for (Map.Entry<String, Integer> it : s.getResourcesByRegion().entrySet()) {
				gen.writeNumberField(it.getKey(), it.getValue());
			}
			gen.writeEndObject();
			gen.writeEndObject();
		}
		gen.writeEndArray();
		gen.writeEndObject();
	}
}
