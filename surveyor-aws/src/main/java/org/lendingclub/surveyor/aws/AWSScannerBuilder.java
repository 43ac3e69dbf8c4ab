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

import java.lang.reflect.InvocationTargetException;

import org.lendingclub.surveyor.core.CloudProvider;
import org.lendingclub.surveyor.core.CostEstimator;
import org.lendingclub.surveyor.core.ErrorClassifier;
import org.lendingclub.surveyor.core.ScannerConfig;
import org.lendingclub.surveyor.core.SurveyorException;

import com.google.common.base.Preconditions;

public class AWSScannerBuilder {

	CloudProvider cloudProvider;
	ScannerConfig config;
	CostEstimator costEstimator;
	ErrorClassifier errorClassifier;

	public AWSScannerBuilder() {
	}

	public AWSScannerBuilder withCloudProvider(CloudProvider p) {
		Preconditions.checkState(this.cloudProvider == null, "cloud provider already set");
		this.cloudProvider = p;
		return this;
	}

	public AWSScannerBuilder withConfig(ScannerConfig config) {
		this.config = config;
		return this;
	}

	public AWSScannerBuilder withCostEstimator(CostEstimator costEstimator) {
		this.costEstimator = costEstimator;
		return this;
	}

	public AWSScannerBuilder withErrorClassifier(ErrorClassifier errorClassifier) {
		this.errorClassifier = errorClassifier;
		return this;
	}

	public CloudProvider getCloudProvider() {
		if (cloudProvider == null) {
			cloudProvider = new AwsCloudProvider();
		}
		return cloudProvider;
	}

	public ScannerConfig getConfig() {
		if (config == null) {
			config = ScannerConfig.defaults();
		}
		return config;
	}

	public CostEstimator getCostEstimator() {
		if (costEstimator == null) {
			costEstimator = new AwsCostEstimator();
		}
		return costEstimator;
	}

	public ErrorClassifier getErrorClassifier() {
		if (errorClassifier == null) {
			errorClassifier = new ErrorClassifier();
		}
		return errorClassifier;
	}

	public <T extends AWSScanner> T build(Class<T> clazz) {
		try {
			return clazz.getConstructor(AWSScannerBuilder.class).newInstance(this);
		} catch (IllegalAccessException | InstantiationException | NoSuchMethodException e) {
			throw new IllegalStateException(e);
		} catch (InvocationTargetException e) {
			throw new SurveyorException("could not create " + clazz.getSimpleName(), e.getCause());
		}
	}
}
