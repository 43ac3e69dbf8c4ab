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

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.lendingclub.surveyor.core.Resource;

import com.google.common.collect.Lists;

final class ReportFormatting {

	private ReportFormatting() {
	}

	static String money(double cost) {
		return String.format(Locale.US, "$%,.2f", cost);
	}

	/**
	 * The first <code>max</code> scalar details of a resource as
	 * <code>key: value</code>. Empty, false and zero values are left out.
	 */
	static List<String> details(Resource r, int max) {
		List<String> details = Lists.newArrayList();
		for (Map.Entry<String, Object> it : r.getAdditionalInfo().entrySet()) {
			if (details.size() >= max) {
				break;
			}
			if (isShown(it.getKey(), it.getValue())) {
				details.add(it.getKey() + ": " + it.getValue());
			}
		}
		return details;
	}

	static boolean isShown(String key, Object v) {
		if (v == null || key.equals("tags") || v instanceof Collection || v instanceof Map) {
			return false;
		}
		if (v instanceof Boolean) {
			return (Boolean) v;
		}
		if (v instanceof Number) {
			return ((Number) v).doubleValue() != 0;
		}
		return !v.toString().isEmpty();
	}

	static String cell(String s) {
		return s == null ? "" : s.replace("|", "\\|").replace('\n', ' ');
	}

	static String anchor(String heading) {
		return heading.toLowerCase(Locale.ROOT).trim().replaceAll("[^a-z0-9 _-]", "").replace(' ', '-');
	}
}
