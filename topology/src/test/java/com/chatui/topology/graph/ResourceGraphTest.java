package com.chatui.topology.graph;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResourceGraphTest {

    private ResourceGraph graph;

    @BeforeEach
    void setUp() {
        graph = new ResourceGraphBuilder(GraphCodec.defaultMapper())
            .add("Vpc", ResourceKind.NETWORK, Map.of("maxAzs", 2))
            .add("Secret-API_KEY", ResourceKind.SECRET_REF, Map.of("secretName", "app/api-key", "field", "API_KEY"))
            .add("Cluster", ResourceKind.CLUSTER, Map.of(), "Vpc")
            .add("Service", ResourceKind.SERVICE_DEPLOYMENT, Map.of(), "Cluster", "Secret-API_KEY")
            .output("ClusterName", "Cluster", "ClusterName", "ECS Cluster Name")
            .build();
    }

    @Test
    void pathFollowsTheLongestChain() {
        assertEquals(List.of("Vpc", "Cluster", "Service"), graph.pathTo("Service"));
        assertEquals(List.of("Secret-API_KEY"), graph.pathTo("Secret-API_KEY"));
        assertThrows(IllegalArgumentException.class, () -> graph.pathTo("Missing"));
    }

    @Test
    void queries() {
        assertEquals(4, graph.size());
        assertTrue(graph.contains("Cluster"));
        assertTrue(graph.node("Missing").isEmpty());
        assertEquals(List.of("Cluster"), graph.dependentsOf("Vpc"));
        assertEquals(1, graph.nodesOfKind(ResourceKind.SECRET_REF).size());
        assertEquals("app/api-key", graph.node("Secret-API_KEY").orElseThrow().stringProperty("secretName"));
        assertEquals("Cluster.ClusterName", graph.getOutputs().get("ClusterName").key());
    }

    @Test
    @SuppressWarnings("unchecked")
    void nestedPropertiesCannotBeChanged() {
        var service = new ResourceGraphBuilder(GraphCodec.defaultMapper())
            .add("Service", ResourceKind.SERVICE_DEPLOYMENT, Map.of(
                "environment", Map.of("KNOWLEDGE_BUCKET", "bucket"),
                "rules", List.of(Map.of("name", "BlockNonUS"))))
            .build()
            .node("Service")
            .orElseThrow();
        var hash = service.hashCode();

        var environment = (Map<String, Object>) service.property("environment");
        assertThrows(UnsupportedOperationException.class, () -> environment.put("INJECTED", "yes"));
        var rules = (List<Object>) service.property("rules");
        assertThrows(UnsupportedOperationException.class, () -> rules.add("extra"));
        var rule = (Map<String, Object>) rules.get(0);
        assertThrows(UnsupportedOperationException.class, () -> rule.put("name", "AllowAll"));

        assertEquals(Map.of("KNOWLEDGE_BUCKET", "bucket"), environment);
        assertEquals(hash, service.hashCode());
    }

    @Test
    void nodeDoesNotShareTheCallersCollections() {
        var environment = new HashMap<String, Object>();
        environment.put("A", "1");
        var node = new ResourceNode("Service", ResourceKind.SERVICE_DEPLOYMENT,
            Map.of("environment", environment), List.of());

        environment.put("B", "2");
        assertEquals(Map.of("A", "1"), node.property("environment"));
    }

    @Test
    void dependencyDeclaredLaterIsRejected() {
        var cluster = new ResourceNode("Cluster", ResourceKind.CLUSTER, Map.of(), List.of("Vpc"));
        var vpc = new ResourceNode("Vpc", ResourceKind.NETWORK, Map.of(), List.of());
        assertThrows(IllegalArgumentException.class, () -> new ResourceGraph(List.of(cluster, vpc), Map.of()));
    }

    @Test
    void outputMustReferToADeclaredResource() {
        var vpc = new ResourceNode("Vpc", ResourceKind.NETWORK, Map.of(), List.of());
        var output = new OutputRef("LoadBalancer", "DnsName", "ALB DNS");
        assertThrows(IllegalArgumentException.class,
            () -> new ResourceGraph(List.of(vpc), Map.of("LoadBalancerDNS", output)));
    }

    @Test
    void lookupOnlyKinds() {
        assertTrue(ResourceKind.SECRET_REF.isLookupOnly());
        assertTrue(ResourceKind.DNS_ZONE.isLookupOnly());
        assertFalse(ResourceKind.LOAD_BALANCER.isLookupOnly());
    }
}
