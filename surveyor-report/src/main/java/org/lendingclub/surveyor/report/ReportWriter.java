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

import org.lendingclub.surveyor.core.Resource;

/**
 * Renders a resource inventory.
 */
public interface ReportWriter {

	/**
	 * Writes a report over a complete inventory. The writer is flushed, not
	 * closed.
	 */
	void write(Collection<Resource> resources, Writer out) throws IOException;

	/**
	 * Writes a report in a single pass over <code>resources</code>, emitting each
	 * resource as it arrives. Totals come last.
	 *
	 * @return the summary accumulated while writing
	 */
	InventorySummary writeStreaming(Iterator<Resource> resources, Writer out) throws IOException;
}
