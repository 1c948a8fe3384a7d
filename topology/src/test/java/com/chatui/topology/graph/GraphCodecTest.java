package com.chatui.topology.graph;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.chatui.topology.assembly.TopologyAssembler;
import com.chatui.topology.config.TopologyConfig;
import com.chatui.topology.exception.ConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class GraphCodecTest {

    private final GraphCodec codec = new GraphCodec();

    private ResourceGraph assembled() throws ConfigurationException {
        var config = TopologyConfig.builder()
            .containerImage("lobehub/lobe-chat:latest")
            .domainName("example.com")
            .subdomain("chat")
            .region("us-west-2")
            .notifyEmail("ops@example.com")
            .secretRef("OPENAI_API_KEY", "multimodalai/openai-api-key", "OPENAI_API_KEY")
            .build();
        return new TopologyAssembler(codec.mapper()).assemble(config).graph();
    }

    @Test
    void assembledGraphSurvivesItsDocument() throws Exception {
        var graph = assembled();
        var document = codec.write(graph);

        assertEquals(graph, codec.read(document));
        assertEquals(document, codec.write(codec.read(document)));
    }

    @Test
    void writesToDisk(@TempDir Path dir) throws Exception {
        var graph = assembled();
        var file = dir.resolve("cdk.out").resolve("chat-ui-topology.json");

        codec.write(graph, file);
        assertEquals(graph, codec.read(file));
    }

    @Test
    void documentNeverCarriesSecretValues() throws Exception {
        var document = codec.write(assembled());
        assertTrue(document.contains("multimodalai/openai-api-key"));
        assertFalse(document.contains("secretValue"));
    }

    @Test
    void readRejectsOutOfOrderDocuments() {
        var json = "{\"resources\":["
            + "{\"logicalId\":\"Cluster\",\"kind\":\"CLUSTER\",\"properties\":{},\"dependsOn\":[\"Vpc\"]},"
            + "{\"logicalId\":\"Vpc\",\"kind\":\"NETWORK\",\"properties\":{},\"dependsOn\":[]}"
            + "],\"outputs\":{}}";
        assertThrows(JsonProcessingException.class, () -> codec.read(json));
    }

    @Test
    void readsAHandWrittenDocument() throws IOException {
        var json = "{\"resources\":[{\"logicalId\":\"HostedZone\",\"kind\":\"DNS_ZONE\","
            + "\"properties\":{\"domainName\":\"example.com\"}}]}";
        var graph = codec.read(json);

        assertEquals(List.of(), graph.node("HostedZone").orElseThrow().dependsOn());
        assertEquals(Map.of(), graph.getOutputs());
    }
}
