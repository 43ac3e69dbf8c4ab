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

import java.util.Map;

/**
 * Estimates the monthly cost (USD) of a resource from its raw attributes.
 * Implementations are pure: the same kind and attributes always give the same
 * result, the result is never negative, and unknown kinds cost nothing.
 */
@FunctionalInterface
public interface CostEstimator {

	CostEstimator ZERO = (kind, attributes) -> 0.0;

	double estimate(String kind, Map<String, ?> attributes);
}
