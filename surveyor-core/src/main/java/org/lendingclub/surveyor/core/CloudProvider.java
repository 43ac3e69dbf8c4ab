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
package org.lendingclub.surveyor.core;

import java.util.List;

/**
 * The narrow slice of a cloud provider that scanning needs.
 */
public interface CloudProvider {

	String getName();

	/**
	 * All regions enabled for the account, in a stable order.
	 */
	List<String> listRegions();

	ServiceClient getServiceClient(String service, String region);
}
