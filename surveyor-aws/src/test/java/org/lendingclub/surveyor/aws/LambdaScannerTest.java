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

import java.time.Instant;
import java.util.List;

import org.assertj.core.api.Assertions;
import org.junit.Test;
import org.lendingclub.surveyor.core.Resource;
import org.lendingclub.surveyor.test.SurveyorScannerTest;

public class LambdaScannerTest extends SurveyorScannerTest {

	@Test
	public void testFunctions() {
		provider.withPages("lambda", "us-east-1", "ListFunctions",
				"{'Functions':[{'FunctionName':'resize','FunctionArn':'arn:aws:lambda:us-east-1:1:function:resize',"
						+ "'Runtime':'java11','MemorySize':1024,'Timeout':30,'Handler':'Resize::handle',"
						+ "'LastModified':'2019-03-01T12:00:00.000+0000','Architectures':['arm64']}]}",
				"{'Functions':[{'FunctionName':'tiny','FunctionArn':'arn:aws:lambda:us-east-1:1:function:tiny',"
						+ "'State':'Active'}]}");

		LambdaScanner scanner = new AWSScannerBuilder().withCloudProvider(provider).withConfig(config)
				.build(LambdaScanner.class);
		List<Resource> resources = scanner.scanRegion("us-east-1");
		Assertions.assertThat(resources).hasSize(2);

		Resource resize = find(resources, "arn:aws:lambda:us-east-1:1:function:resize");
		Assertions.assertThat(resize.getType()).isEqualTo(LambdaScanner.FUNCTION);
		Assertions.assertThat(resize.getName()).contains("resize");
		Assertions.assertThat(resize.getState()).contains("unknown");
		Assertions.assertThat(resize.getCreatedAt()).contains(Instant.parse("2019-03-01T12:00:00Z"));
		Assertions.assertThat(resize.getAdditionalInfo()).containsEntry("runtime", "java11")
				.containsEntry("memorySize", 1024).containsEntry("timeout", 30);
		// 1024 MB, 100k x 100ms invocations, arm discount
		assertCost(resize, 10000 * 0.0000166667 * 0.8 + 0.02);

		Resource tiny = find(resources, "arn:aws:lambda:us-east-1:1:function:tiny");
		Assertions.assertThat(tiny.getState()).contains("Active");
		Assertions.assertThat(tiny.getAdditionalInfo()).containsEntry("memorySize", 128)
				.doesNotContainKey("architectures");
	}

	@Test
	public void testLastModified() {
		Assertions.assertThat(LambdaScanner.parseLastModified("2019-03-01T12:00:00.000+0000"))
				.isEqualTo(Instant.parse("2019-03-01T12:00:00Z"));
		Assertions.assertThat(LambdaScanner.parseLastModified("2019-03-01T12:00:00+01:00"))
				.isEqualTo(Instant.parse("2019-03-01T11:00:00Z"));
		Assertions.assertThat(LambdaScanner.parseLastModified("last tuesday")).isNull();
		Assertions.assertThat(LambdaScanner.parseLastModified(null)).isNull();
	}
}
