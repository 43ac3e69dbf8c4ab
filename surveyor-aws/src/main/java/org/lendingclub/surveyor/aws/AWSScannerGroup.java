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
package org.lendingclub.surveyor.aws;

import java.util.List;

import org.lendingclub.surveyor.core.ServiceRegistry;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * An ordered set of scanner types that are built together, sharing one
 * {@link AWSScannerBuilder}, and registered with a {@link ServiceRegistry}.
 */
public class AWSScannerGroup {

	List<Class<? extends AWSScanner>> scannerList = Lists.newCopyOnWriteArrayList();

	protected final AWSScannerBuilder builder;

	public AWSScannerGroup(AWSScannerBuilder builder) {
		Preconditions.checkNotNull(builder, "builder cannot be null");
		this.builder = builder;
	}

	public List<Class<? extends AWSScanner>> getScannerTypes() {
		return ImmutableList.copyOf(scannerList);
	}

	public AWSScannerGroup addScannerType(Class<? extends AWSScanner> type) {
		scannerList.add(type);
		return this;
	}

	public AWSScannerGroup removeScannerType(Class<? extends AWSScanner> type) {
		scannerList.remove(type);
		return this;
	}

	public List<AWSScanner> getScanners() {
		List<AWSScanner> result = Lists.newArrayList();
		for (Class<? extends AWSScanner> scannerClass : scannerList) {
			result.add(builder.build(scannerClass));
		}
		return result;
	}

	public ServiceRegistry buildRegistry() {
		return registerWith(new ServiceRegistry());
	}

	public ServiceRegistry registerWith(ServiceRegistry registry) {
		getScanners().forEach(registry::register);
		return registry;
	}
}
