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

import org.assertj.core.api.Assertions;
import org.junit.Test;
import org.lendingclub.surveyor.core.ProviderException;
import org.lendingclub.surveyor.core.Resource;
import org.lendingclub.surveyor.test.FakeCloudProvider;
import org.lendingclub.surveyor.test.SurveyorScannerTest;

public class VPCScannerTest extends SurveyorScannerTest {

	VPCScanner scanner() {
		return new AWSScannerBuilder().withCloudProvider(provider).withConfig(config).build(VPCScanner.class);
	}

	void network() {
		provider.withPages("ec2", "us-east-1", "DescribeVpcs",
				"{'Vpcs':[{'VpcId':'vpc-default','IsDefault':true,'State':'available'},"
						+ "{'VpcId':'vpc-app','IsDefault':false,'State':'available','CidrBlock':'10.1.0.0/16',"
						+ "'Tags':[{'Key':'Name','Value':'app'}]}]}");
		provider.withPages("ec2", "us-east-1", "DescribeTransitGateways",
				"{'TransitGateways':[{'TransitGatewayId':'tgw-1','State':'available','Options':{'AmazonSideAsn':64512}},"
						+ "{'TransitGatewayId':'tgw-old','State':'deleted'}]}");
		provider.withPages("ec2", "us-east-1", "DescribeTransitGatewayAttachments",
				"{'TransitGatewayAttachments':[{'TransitGatewayAttachmentId':'tgw-attach-1','ResourceType':'vpc',"
						+ "'State':'available','TransitGatewayId':'tgw-1','ResourceId':'vpc-app'},"
						+ "{'TransitGatewayAttachmentId':'tgw-attach-2','ResourceType':'vpn','State':'available'}]}");
		provider.withPages("ec2", "us-east-1", "DescribeVpcEndpoints",
				"{'VpcEndpoints':[{'VpcEndpointId':'vpce-1','VpcEndpointType':'Interface','State':'available',"
						+ "'ServiceName':'com.amazonaws.us-east-1.sqs'},"
						+ "{'VpcEndpointId':'vpce-2','VpcEndpointType':'Gateway','State':'available',"
						+ "'ServiceName':'com.amazonaws.us-east-1.s3'},"
						+ "{'VpcEndpointId':'vpce-3','VpcEndpointType':'Interface','State':'deleting'}]}");
		provider.withPages("ec2", "us-east-1", "DescribeVpnConnections",
				"{'VpnConnections':[{'VpnConnectionId':'vpn-1','State':'available','Type':'ipsec.1',"
						+ "'VgwTelemetry':[{'Status':'UP'},{'Status':'DOWN'}]}]}");
		provider.withPages("directconnect", "us-east-1", "DescribeVirtualInterfaces",
				"{'VirtualInterfaces':[{'VirtualInterfaceId':'dxvif-1','VirtualInterfaceName':'corp',"
						+ "'VirtualInterfaceType':'private','VirtualInterfaceState':'available','Vlan':101}]}");
	}

	@Test
	public void testNetwork() {
		network();
		List<Resource> resources = scanner().scanRegion("us-east-1");
		Assertions.assertThat(resources).extracting(Resource::getId).containsExactlyInAnyOrder("vpc-app", "tgw-1",
				"tgw-attach-1", "tgw-attach-2", "vpce-1", "vpce-2", "vpn-1", "dxvif-1");

		Resource vpc = find(resources, "vpc-app");
		Assertions.assertThat(vpc.getType()).isEqualTo(VPCScanner.VPC);
		Assertions.assertThat(vpc.getName()).contains("app");
		Assertions.assertThat(vpc.getAdditionalInfo()).containsEntry("cidrBlock", "10.1.0.0/16");
		assertCost(vpc, 0.0);

		Resource tgw = find(resources, "tgw-1");
		Assertions.assertThat(tgw.getType()).isEqualTo(VPCScanner.TRANSIT_GATEWAY);
		Assertions.assertThat(tgw.getAdditionalInfo()).containsEntry("amazonSideAsn", 64512);
		assertCost(tgw, 36.5);

		Assertions.assertThat(find(resources, "tgw-attach-1").getType()).isEqualTo("Transit Gateway vpc Attachment");
		assertCost(find(resources, "tgw-attach-1"), 0.0);
		assertCost(find(resources, "tgw-attach-2"), 36.5);

		Resource sqs = find(resources, "vpce-1");
		Assertions.assertThat(sqs.getType()).isEqualTo("Interface VPC Endpoint");
		Assertions.assertThat(sqs.getName()).contains("com.amazonaws.us-east-1.sqs");
		assertCost(sqs, 7.3);
		Assertions.assertThat(find(resources, "vpce-2").getType()).isEqualTo("Gateway VPC Endpoint");
		assertCost(find(resources, "vpce-2"), 0.0);

		Resource vpn = find(resources, "vpn-1");
		Assertions.assertThat(vpn.getType()).isEqualTo(VPCScanner.VPN_CONNECTION);
		Assertions.assertThat(vpn.getAdditionalInfo()).containsEntry("tunnels", 2);
		assertCost(vpn, 36.5);

		Resource vif = find(resources, "dxvif-1");
		Assertions.assertThat(vif.getType()).isEqualTo(VPCScanner.DIRECT_CONNECT_INTERFACE);
		Assertions.assertThat(vif.getName()).contains("corp");
		Assertions.assertThat(vif.getAdditionalInfo()).containsEntry("vlan", 101);
		assertCost(vif, 30.0);
	}

	@Test
	public void testDirectConnectDenied() {
		network();
		provider.withError("directconnect", FakeCloudProvider.ANY_REGION, "DescribeVirtualInterfaces",
				new ProviderException("AccessDeniedException", "User is not authorized"));
		List<Resource> resources = scanner().scanRegion("us-east-1");
		Assertions.assertThat(resources).hasSize(7).noneMatch(r -> r.getId().equals("dxvif-1"));
	}

	@Test
	public void testGoneStates() {
		Assertions.assertThat(VPCScanner.isGone("deleted")).isTrue();
		Assertions.assertThat(VPCScanner.isGone("Deleting")).isTrue();
		Assertions.assertThat(VPCScanner.isGone("available")).isFalse();
		Assertions.assertThat(VPCScanner.isGone(null)).isFalse();
	}
}
