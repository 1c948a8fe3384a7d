package com.chatui.topology.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.chatui.topology.exception.DependencyError;
import com.chatui.topology.exception.DependencyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GraphApplierTest {

    private ResourceGraph graph;
    private final List<String> applied = new ArrayList<>();

    @BeforeEach
    void setUp() {
        graph = new ResourceGraphBuilder(GraphCodec.defaultMapper())
            .add("Vpc", ResourceKind.NETWORK, Map.of())
            .add("HostedZone", ResourceKind.DNS_ZONE, Map.of("domainName", "example.com"))
            .add("AlbCert", ResourceKind.CERTIFICATE, Map.of(), "HostedZone")
            .add("LoadBalancer", ResourceKind.LOAD_BALANCER, Map.of(), "Vpc", "AlbCert")
            .add("AliasRecord", ResourceKind.DNS_RECORD, Map.of(), "HostedZone", "LoadBalancer")
            .build();
        applied.clear();
    }

    @Test
    void appliesEverythingInOrder() {
        var report = new GraphApplier().apply(graph, node -> applied.add(node.logicalId()));

        assertTrue(report.isSuccessful());
        assertEquals(List.of("Vpc", "HostedZone", "AlbCert", "LoadBalancer", "AliasRecord"), applied);
        assertEquals(5, report.withStatus(ResourceOutcome.Status.APPLIED).size());
    }

    @Test
    void stopsAtTheFirstFailure() {
        var report = new GraphApplier().apply(graph, node -> {
            if (node.logicalId().equals("AlbCert")) {
                throw new DependencyException(DependencyError.HOSTED_ZONE_NOT_FOUND, "AlbCert", "example.com");
            }
            applied.add(node.logicalId());
        });

        assertFalse(report.isSuccessful());
        assertEquals(List.of("Vpc", "HostedZone"), applied);
        assertEquals(List.of("AlbCert"),
            report.withStatus(ResourceOutcome.Status.FAILED).stream().map(ResourceOutcome::logicalId).toList());
        assertEquals(List.of("LoadBalancer", "AliasRecord"),
            report.withStatus(ResourceOutcome.Status.SKIPPED).stream().map(ResourceOutcome::logicalId).toList());
    }

    @Test
    void failureIsLocatedInTheGraph() {
        var report = new GraphApplier().apply(graph, node -> {
            if (node.kind() == ResourceKind.DNS_RECORD) {
                throw new DependencyException(DependencyError.LOOKUP_FAILED, node.logicalId(), "app.example.com");
            }
        });

        var failure = report.firstFailure().orElseThrow();
        assertEquals(List.of("HostedZone", "AlbCert", "LoadBalancer", "AliasRecord"), failure.getResourcePath());
        assertEquals(DependencyError.LOOKUP_FAILED, failure.getError());
        assertTrue(failure.getMessage().startsWith("HostedZone > AlbCert > LoadBalancer > AliasRecord: "));
        assertTrue(failure.getMessage().endsWith("(app.example.com)"));
    }
}
