package com.chatui.topology.graph;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResourceGraphBuilderTest {

    private ResourceGraphBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new ResourceGraphBuilder(GraphCodec.defaultMapper());
    }

    private static List<String> ids(ResourceGraph graph) {
        return graph.getResources().stream().map(ResourceNode::logicalId).toList();
    }

    @Test
    void dependenciesComeFirst() {
        builder.add("Service", ResourceKind.SERVICE_DEPLOYMENT, Map.of(), "Cluster", "LoadBalancer");
        builder.add("Cluster", ResourceKind.CLUSTER, Map.of(), "Vpc");
        builder.add("LoadBalancer", ResourceKind.LOAD_BALANCER, Map.of(), "Vpc");
        builder.add("Vpc", ResourceKind.NETWORK, Map.of());

        assertEquals(List.of("Vpc", "Cluster", "LoadBalancer", "Service"), ids(builder.build()));
    }

    @Test
    void independentDeclarationsKeepTheirOrder() {
        builder.add("B", ResourceKind.STORAGE_BUCKET, Map.of(), "A");
        builder.add("A", ResourceKind.NETWORK, Map.of());
        builder.add("C", ResourceKind.DASHBOARD, Map.of());

        assertEquals(List.of("A", "B", "C"), ids(builder.build()));
    }

    @Test
    void undeclaredDependencyIsAnError() {
        builder.add("Cluster", ResourceKind.CLUSTER, Map.of(), "Vpc");
        var e = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(e.getMessage().contains("Vpc"));
    }

    @Test
    void cyclesAreRejected() {
        builder.add("A", ResourceKind.NETWORK, Map.of(), "B");
        builder.add("B", ResourceKind.CLUSTER, Map.of(), "A");
        builder.add("C", ResourceKind.DASHBOARD, Map.of());
        var e = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(e.getMessage().contains("[A, B]"));
    }

    @Test
    void logicalIdsAreUnique() {
        builder.add("Vpc", ResourceKind.NETWORK, Map.of());
        assertThrows(IllegalStateException.class, () -> builder.add("Vpc", ResourceKind.NETWORK, Map.of()));
    }

    record Listener(String protocol, int port, List<String> certificates) {
    }

    @Test
    void recordPropertiesBecomePlainValues() {
        builder.add("LoadBalancer", ResourceKind.LOAD_BALANCER, new Listener("HTTPS", 443, List.of("AlbCert")));
        var node = builder.build().node("LoadBalancer").orElseThrow();

        assertEquals("HTTPS", node.property("protocol"));
        assertEquals(443, node.property("port"));
        assertEquals(List.of("AlbCert"), node.property("certificates"));
    }

    @Test
    void dependenciesAreSortedAndDistinct() {
        builder.add("Vpc", ResourceKind.NETWORK, Map.of());
        builder.add("Bucket", ResourceKind.STORAGE_BUCKET, Map.of());
        builder.add("Service", ResourceKind.SERVICE_DEPLOYMENT, Map.of(), "Vpc", "Bucket", "Vpc");

        assertEquals(List.of("Bucket", "Vpc"), builder.build().node("Service").orElseThrow().dependsOn());
    }
}
