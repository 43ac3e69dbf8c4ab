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

/**
 * Every AWS service the surveyor knows how to scan.
 */
public class AllServicesScannerGroup extends AWSScannerGroup {

	public AllServicesScannerGroup(AWSScannerBuilder builder) {
		super(builder);
		addScannerType(EC2Scanner.class);
		addScannerType(S3Scanner.class);
		addScannerType(RDSScanner.class);
		addScannerType(LambdaScanner.class);
		addScannerType(DynamoDBScanner.class);
		addScannerType(ELBScanner.class);
		addScannerType(ECSScanner.class);
		addScannerType(EKSScanner.class);
		addScannerType(CloudFrontScanner.class);
		addScannerType(Route53Scanner.class);
		addScannerType(VPCScanner.class);
		addScannerType(APIGatewayScanner.class);
	}
}
