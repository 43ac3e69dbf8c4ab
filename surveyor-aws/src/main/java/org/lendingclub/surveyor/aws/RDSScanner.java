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

import org.lendingclub.surveyor.core.JsonUtil;

import com.google.common.collect.ImmutableMap;

public class RDSScanner extends AWSScanner {

	public static final String SERVICE_NAME = "RDS";

	public static final String DB_INSTANCE = "DB Instance";
	public static final String DB_CLUSTER = "DB Cluster";
	public static final String DB_SNAPSHOT = "DB Snapshot";

	public RDSScanner(AWSScannerBuilder builder) {
		super(builder, SERVICE_NAME);
	}

	@Override
	protected void doScan(RegionScan scan) {
		section(scan, "instances", () -> scanInstances(scan));
		section(scan, "clusters", () -> scanClusters(scan));
		section(scan, "snapshots", () -> scanSnapshots(scan));
	}

	void scanInstances(RegionScan scan) {
		scan.forEachItem(AwsOperations.RDS, "DescribeDBInstances", ImmutableMap.of(), "DBInstances", db -> {
			String id = db.path("DBInstanceIdentifier").asText();
			String status = db.path("DBInstanceStatus").asText();
			String instanceClass = db.path("DBInstanceClass").asText();
			int storage = db.path("AllocatedStorage").asInt(0);
			scan.add(newResource(scan, DB_INSTANCE, id).withName(id)
					.withCreatedAt(JsonUtil.instant(db, "InstanceCreateTime").orElse(null))
					.withState(status)
					.withEstimatedMonthlyCost(estimateCost(AwsCostEstimator.RDS_INSTANCE,
							attributes("instanceClass", instanceClass, "allocatedStorage", storage, "status", status)))
					.withInfo("engine", value(db, "Engine"))
					.withInfo("engineVersion", value(db, "EngineVersion"))
					.withInfo("instanceClass", instanceClass)
					.withInfo("allocatedStorage", storage + " GB")
					.withInfo("multiAZ", db.path("MultiAZ").asBoolean(false))
					.withInfo("endpoint", value(db.path("Endpoint"), "Address"))
					.build());
		});
	}

	void scanClusters(RegionScan scan) {
		scan.forEachItem(AwsOperations.RDS, "DescribeDBClusters", ImmutableMap.of(), "DBClusters", cluster -> {
			String id = cluster.path("DBClusterIdentifier").asText();
			String status = cluster.path("Status").asText();
			int members = cluster.path("DBClusterMembers").size();
			scan.add(newResource(scan, DB_CLUSTER, id).withName(id)
					.withCreatedAt(JsonUtil.instant(cluster, "ClusterCreateTime").orElse(null))
					.withState(status)
					.withEstimatedMonthlyCost(estimateCost(AwsCostEstimator.RDS_CLUSTER,
							attributes("memberCount", members, "status", status)))
					.withInfo("engine", value(cluster, "Engine"))
					.withInfo("engineVersion", value(cluster, "EngineVersion"))
					.withInfo("memberCount", members)
					.withInfo("allocatedStorage", value(cluster, "AllocatedStorage"))
					.withInfo("endpoint", value(cluster, "Endpoint"))
					.build());
		});
	}

	void scanSnapshots(RegionScan scan) {
		scan.forEachItem(AwsOperations.RDS, "DescribeDBSnapshots", ImmutableMap.of("SnapshotType", "manual"),
				"DBSnapshots", snapshot -> {
					String id = snapshot.path("DBSnapshotIdentifier").asText();
					int storage = snapshot.path("AllocatedStorage").asInt(0);
					scan.add(newResource(scan, DB_SNAPSHOT, id).withName(id)
							.withCreatedAt(JsonUtil.instant(snapshot, "SnapshotCreateTime").orElse(null))
							.withState(JsonUtil.text(snapshot, "Status").orElse(null))
							.withEstimatedMonthlyCost(estimateCost(AwsCostEstimator.RDS_SNAPSHOT,
									attributes("allocatedStorage", storage)))
							.withInfo("engine", value(snapshot, "Engine"))
							.withInfo("allocatedStorage", storage + " GB")
							.withInfo("encrypted", value(snapshot, "Encrypted"))
							.withInfo("sourceDBInstance", value(snapshot, "DBInstanceIdentifier"))
							.build());
				});
	}
}
