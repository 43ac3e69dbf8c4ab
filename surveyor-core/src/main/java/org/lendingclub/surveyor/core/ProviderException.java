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

import com.google.common.base.Strings;

/**
 * Failure reported by a cloud provider API. The error code is the machine-readable
 * value the provider returned (e.g. <code>AccessDenied</code>, <code>Throttling</code>)
 * and is what {@link ErrorClassifier} looks at.
 */
public class ProviderException extends SurveyorException {

	private static final long serialVersionUID = 1L;

	private final String errorCode;

	public ProviderException(String errorCode, String message) {
		this(errorCode, message, null);
	}

	public ProviderException(String errorCode, String message, Throwable cause) {
		super(Strings.isNullOrEmpty(errorCode) ? message : errorCode + ": " + message, cause);
		this.errorCode = Strings.nullToEmpty(errorCode);
	}

	public String getErrorCode() {
		return errorCode;
	}
}
