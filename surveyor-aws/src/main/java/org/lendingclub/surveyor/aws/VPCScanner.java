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

import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.lendingclub.surveyor.core.JsonUtil;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * VPC networking: custom VPCs, transit gateways and their attachments, VPC
 * endpoints, site-to-site VPN connections and Direct Connect virtual interfaces.
 * Default VPCs and deleted items are skipped.
 */
public class VPCScanner extends AWSScanner {

	public static final String SERVICE_NAME = "VPC";

	public static final String VPC = "VPC";
	public static final String TRANSIT_GATEWAY = "Transit Gateway";
	public static final String VPN_CONNECTION = "VPN Connection";
	public static final String DIRECT_CONNECT_INTERFACE = "Direct Connect Virtual Interface";

	static final Set<String> GONE_STATES = ImmutableSet.of("deleted", "deleting");

	public VPCScanner(AWSScannerBuilder builder) {
		super(builder, SERVICE_NAME);
	}

	@Override
	protected void doScan(RegionScan scan) {
		section(scan, "vpcs", () -> scanVpcs(scan));
		section(scan, "transit gateways", () -> scanTransitGateways(scan));
		section(scan, "transit gateway attachments", () -> scanAttachments(scan));
		section(scan, "vpc endpoints", () -> scanEndpoints(scan));
		section(scan, "vpn connections", () -> scanVpnConnections(scan));
		section(scan, "direct connect", () -> scanVirtualInterfaces(scan));
	}

	static boolean isGone(String state) {
		return state != null && GONE_STATES.contains(state.toLowerCase(Locale.ROOT));
	}

	void scanVpcs(RegionScan scan) {
		scan.forEachItem(AwsOperations.EC2, "DescribeVpcs", ImmutableMap.of(), "Vpcs", vpc -> {
			if (vpc.path("IsDefault").asBoolean(false)) {
				return;
			}
			String id = vpc.path("VpcId").asText();
			Map<String, String> tags = tags(vpc);
			scan.add(newResource(scan, VPC, id).withName(tags.get("Name"))
					.withState(JsonUtil.text(vpc, "State").orElse(null))
					.withEstimatedMonthlyCost(0)
					.withInfo("cidrBlock", value(vpc, "CidrBlock"))
					.withInfo("instanceTenancy", value(vpc, "InstanceTenancy"))
					.withInfo("dhcpOptionsId", value(vpc, "DhcpOptionsId"))
					.withInfo("tags", emptyToNull(tags))
					.build());
		});
	}

	void scanTransitGateways(RegionScan scan) {
		scan.forEachItem(AwsOperations.EC2, "DescribeTransitGateways", ImmutableMap.of(), "TransitGateways", tgw -> {
			String state = JsonUtil.text(tgw, "State").orElse(null);
			if (isGone(state)) {
				return;
			}
			Map<String, String> tags = tags(tgw);
			scan.add(newResource(scan, TRANSIT_GATEWAY, tgw.path("TransitGatewayId").asText())
					.withName(tags.get("Name"))
					.withCreatedAt(JsonUtil.instant(tgw, "CreationTime").orElse(null))
					.withState(state)
					.withEstimatedMonthlyCost(
							estimateCost(AwsCostEstimator.VPC_TRANSIT_GATEWAY, attributes("state", state)))
					.withInfo("description", JsonUtil.text(tgw, "Description").orElse(null))
					.withInfo("amazonSideAsn", value(tgw.path("Options"), "AmazonSideAsn"))
					.withInfo("ownerId", value(tgw, "OwnerId"))
					.withInfo("tags", emptyToNull(tags))
					.build());
		});
	}

	void scanAttachments(RegionScan scan) {
		scan.forEachItem(AwsOperations.EC2, "DescribeTransitGatewayAttachments", ImmutableMap.of(),
				"TransitGatewayAttachments", att -> {
					String state = JsonUtil.text(att, "State").orElse(null);
					if (isGone(state)) {
						return;
					}
					String resourceType = JsonUtil.text(att, "ResourceType").orElse("unknown");
					Map<String, String> tags = tags(att);
					scan.add(newResource(scan, "Transit Gateway " + resourceType + " Attachment",
							att.path("TransitGatewayAttachmentId").asText())
							.withName(tags.get("Name"))
							.withCreatedAt(JsonUtil.instant(att, "CreationTime").orElse(null))
							.withState(state)
							.withEstimatedMonthlyCost(estimateCost(AwsCostEstimator.VPC_TRANSIT_GATEWAY_ATTACHMENT,
									attributes("resourceType", resourceType, "state", state)))
							.withInfo("transitGatewayId", value(att, "TransitGatewayId"))
							.withInfo("resourceType", resourceType)
							.withInfo("resourceId", value(att, "ResourceId"))
							.withInfo("resourceOwnerId", value(att, "ResourceOwnerId"))
							.withInfo("tags", emptyToNull(tags))
							.build());
				});
	}

	void scanEndpoints(RegionScan scan) {
		scan.forEachItem(AwsOperations.EC2, "DescribeVpcEndpoints", ImmutableMap.of(), "VpcEndpoints", ep -> {
			String state = JsonUtil.text(ep, "State").orElse(null);
			if (isGone(state)) {
				return;
			}
			String endpointType = JsonUtil.text(ep, "VpcEndpointType").orElse("Gateway");
			Map<String, String> tags = tags(ep);
			scan.add(newResource(scan, endpointType + " VPC Endpoint", ep.path("VpcEndpointId").asText())
					.withName(tags.getOrDefault("Name", JsonUtil.text(ep, "ServiceName").orElse(null)))
					.withCreatedAt(JsonUtil.instant(ep, "CreationTimestamp").orElse(null))
					.withState(state)
					.withEstimatedMonthlyCost(estimateCost(AwsCostEstimator.VPC_ENDPOINT,
							attributes("endpointType", endpointType, "state", state)))
					.withInfo("serviceName", value(ep, "ServiceName"))
					.withInfo("vpcId", value(ep, "VpcId"))
					.withInfo("subnetIds", value(ep, "SubnetIds"))
					.withInfo("privateDnsEnabled", value(ep, "PrivateDnsEnabled"))
					.withInfo("tags", emptyToNull(tags))
					.build());
		});
	}

	void scanVpnConnections(RegionScan scan) {
		scan.forEachItem(AwsOperations.EC2, "DescribeVpnConnections", ImmutableMap.of(), "VpnConnections", vpn -> {
			String state = JsonUtil.text(vpn, "State").orElse(null);
			if (isGone(state)) {
				return;
			}
			Map<String, String> tags = tags(vpn);
			scan.add(newResource(scan, VPN_CONNECTION, vpn.path("VpnConnectionId").asText())
					.withName(tags.get("Name"))
					.withState(state)
					.withEstimatedMonthlyCost(
							estimateCost(AwsCostEstimator.VPC_VPN_CONNECTION, attributes("state", state)))
					.withInfo("type", value(vpn, "Type"))
					.withInfo("customerGatewayId", value(vpn, "CustomerGatewayId"))
					.withInfo("vpnGatewayId", value(vpn, "VpnGatewayId"))
					.withInfo("transitGatewayId", value(vpn, "TransitGatewayId"))
					.withInfo("tunnels", vpn.path("VgwTelemetry").size())
					.withInfo("tags", emptyToNull(tags))
					.build());
		});
	}

	void scanVirtualInterfaces(RegionScan scan) {
		JsonNode page = scan.call(AwsOperations.DIRECT_CONNECT, "DescribeVirtualInterfaces", ImmutableMap.of());
		for (JsonNode vif : page.path("VirtualInterfaces")) {
			String state = JsonUtil.text(vif, "VirtualInterfaceState").orElse(null);
			if (isGone(state)) {
				continue;
			}
			Map<String, String> tags = tags(vif);
			String id = vif.path("VirtualInterfaceId").asText();
			scan.add(newResource(scan, DIRECT_CONNECT_INTERFACE, id)
					.withName(tags.getOrDefault("Name", JsonUtil.text(vif, "VirtualInterfaceName").orElse(null)))
					.withState(state)
					.withEstimatedMonthlyCost(
							estimateCost(AwsCostEstimator.VPC_DIRECT_CONNECT_INTERFACE, attributes("state", state)))
					.withInfo("virtualInterfaceType", value(vif, "VirtualInterfaceType"))
					.withInfo("connectionId", value(vif, "ConnectionId"))
					.withInfo("vlan", value(vif, "Vlan"))
					.withInfo("location", value(vif, "Location"))
					.withInfo("bandwidth", value(vif, "Bandwidth"))
					.withInfo("tags", emptyToNull(tags))
					.build());
		}
	}
}
