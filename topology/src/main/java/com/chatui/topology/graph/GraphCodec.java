package com.chatui.topology.graph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

// JSON form of a resource graph, written next to the cloud assembly
public class GraphCodec {
    private final ObjectMapper mapper;

    public GraphCodec() {
        this(defaultMapper());
    }

    public GraphCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public String write(ResourceGraph graph) throws JsonProcessingException {
        return mapper.writeValueAsString(graph);
    }

    public ResourceGraph read(String json) throws JsonProcessingException {
        return mapper.readValue(json, ResourceGraph.class);
    }

    public void write(ResourceGraph graph, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        Files.writeString(file, write(graph));
    }

    public ResourceGraph read(Path file) throws IOException {
        return read(Files.readString(file));
    }
}
