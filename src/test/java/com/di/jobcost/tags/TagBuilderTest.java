package com.di.jobcost.tags;

import com.di.jobcost.usage.BatchWorkerUsage;
import com.di.jobcost.usage.ClusterUsage;
import com.di.jobcost.usage.JobEnvironment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TagBuilder Tests")
class TagBuilderTest {

    private final TagBuilder tagBuilder = new TagBuilder();

    // ============================================================================
    // Batch workers
    // ============================================================================

    @Test
    @DisplayName("Batch worker tags in fixed order")
    void batchWorkerTags() {
        BatchWorkerUsage usage = BatchWorkerUsage.builder().region("us-east-1").workerType("G.1X").workerCount(2).build();

        TagSet tags = tagBuilder.buildTags("acme", JobEnvironment.GLUE, usage, true);

        assertEquals(List.of("customer:acme", "job_type:glue", "status:success", "region:us-east-1",
                "glue_worker_type:G.1X"), tags.asList());
    }

    @Test
    @DisplayName("Failed run is tagged status:failed")
    void failedStatus() {
        BatchWorkerUsage usage = BatchWorkerUsage.builder().region("us-west-1").workerType("G.2X").workerCount(1).build();

        TagSet tags = tagBuilder.buildTags("acme", JobEnvironment.GLUE, usage, false);

        assertEquals("failed", tags.asMap().get("status"));
    }

    // ============================================================================
    // Clusters
    // ============================================================================

    @Test
    @DisplayName("Cluster tags list instance types sorted and the release label")
    void clusterTags() {
        ClusterUsage usage = ClusterUsage.builder()
                .region("us-east-1")
                .instanceCount("r5.large", 2)
                .instanceCount("m5.xlarge", 3)
                .releaseLabel("emr-6.10.0")
                .build();

        TagSet tags = tagBuilder.buildTags("acme", JobEnvironment.EMR, usage, true);

        assertEquals(List.of("customer:acme", "job_type:emr", "status:success", "region:us-east-1",
                "emr_instance_types:m5.xlarge,r5.large", "emr_release_label:emr-6.10.0"), tags.asList());
    }

    @Test
    @DisplayName("Empty cluster omits instance types; missing label omits the release tag")
    void clusterOmissions() {
        ClusterUsage usage = ClusterUsage.builder().region("us-east-1").build();

        TagSet tags = tagBuilder.buildTags("acme", JobEnvironment.EMR, usage, true);

        assertEquals(4, tags.size());
        assertFalse(tags.asMap().containsKey("emr_instance_types"));
        assertFalse(tags.asMap().containsKey("emr_release_label"));
    }

    @Test
    @DisplayName("Blank release label is omitted")
    void blankReleaseLabel() {
        ClusterUsage usage = ClusterUsage.builder().region("us-east-1").instanceCount("m5.xlarge", 1).releaseLabel("  ").build();

        assertFalse(tagBuilder.buildTags("acme", JobEnvironment.EMR, usage, true).asMap().containsKey("emr_release_label"));
    }

    @Test
    @DisplayName("Instance types with a zero count are left out of the instance types tag")
    void zeroCountTypesOmitted() {
        ClusterUsage usage = ClusterUsage.builder()
                .region("us-east-1")
                .instanceCount("m5.xlarge", 2)
                .instanceCount("r5.large", 0)
                .build();

        assertEquals("m5.xlarge", tagBuilder.buildTags("acme", JobEnvironment.EMR, usage, true)
                .asMap().get("emr_instance_types"));
    }

    @Test
    @DisplayName("Cluster with only zero counts has no instance types tag")
    void allZeroCounts() {
        ClusterUsage usage = ClusterUsage.builder().region("us-east-1").instanceCount("m5.xlarge", 0).build();

        assertFalse(tagBuilder.buildTags("acme", JobEnvironment.EMR, usage, true)
                .asMap().containsKey("emr_instance_types"));
    }

    // ============================================================================
    // Defaults and determinism
    // ============================================================================

    @Test
    @DisplayName("Missing region is tagged unknown")
    void unknownRegion() {
        BatchWorkerUsage usage = BatchWorkerUsage.builder().workerType("G.1X").workerCount(1).build();

        assertEquals("unknown", tagBuilder.buildTags("acme", JobEnvironment.GLUE, usage, true).asMap().get("region"));
    }

    @Test
    @DisplayName("Same inputs produce equal tag sets")
    void deterministic() {
        ClusterUsage a = ClusterUsage.builder().region("us-east-1")
                .instanceCount("m5.xlarge", 1).instanceCount("m5.2xlarge", 1).build();
        ClusterUsage b = ClusterUsage.builder().region("us-east-1")
                .instanceCount("m5.2xlarge", 1).instanceCount("m5.xlarge", 1).build();

        assertEquals(tagBuilder.buildTags("acme", JobEnvironment.EMR, a, true),
                tagBuilder.buildTags("acme", JobEnvironment.EMR, b, true));
    }
}
