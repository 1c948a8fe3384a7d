package com.chatui.topology.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable set of declarations in dependency order, plus the named outputs
 * surfaced after apply.
 * <p>
 * Every dependency of a node appears before it. Construction rejects graphs
 * that break this, so a parsed document is as trustworthy as a built one.
 */
public final class ResourceGraph {
    private final List<ResourceNode> resources;
    private final Map<String, OutputRef> outputs;
    private final Map<String, ResourceNode> index = new HashMap<>();
    private final Map<String, Integer> depth = new HashMap<>();

    @JsonCreator
    public ResourceGraph(
        @JsonProperty("resources") List<ResourceNode> resources,
        @JsonProperty("outputs") Map<String, OutputRef> outputs) {
            this.resources = List.copyOf(resources);
            this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs == null ? Map.of() : outputs));

            for (var node : this.resources) {
                var level = 0;
                for (var dependency : node.dependsOn()) {
                    if (!depth.containsKey(dependency)) {
                        throw new IllegalArgumentException(
                            node.logicalId() + " depends on " + dependency + " which is not declared before it");
                    }
                    level = Math.max(level, depth.get(dependency) + 1);
                }
                if (index.put(node.logicalId(), node) != null) {
                    throw new IllegalArgumentException("Duplicate logical id " + node.logicalId());
                }
                depth.put(node.logicalId(), level);
            }
            this.outputs.forEach((name, ref) -> {
                if (!index.containsKey(ref.resourceId())) {
                    throw new IllegalArgumentException("Output " + name + " refers to unknown " + ref.resourceId());
                }
            });
    }

    @JsonProperty("resources")
    public List<ResourceNode> getResources() {
        return resources;
    }

    @JsonProperty("outputs")
    public Map<String, OutputRef> getOutputs() {
        return outputs;
    }

    public Optional<ResourceNode> node(String logicalId) {
        return Optional.ofNullable(index.get(logicalId));
    }

    public boolean contains(String logicalId) {
        return index.containsKey(logicalId);
    }

    public List<ResourceNode> nodesOfKind(ResourceKind kind) {
        return resources.stream().filter(node -> node.kind() == kind).toList();
    }

    public List<String> dependentsOf(String logicalId) {
        return resources.stream()
            .filter(node -> node.dependsOn().contains(logicalId))
            .map(ResourceNode::logicalId)
            .toList();
    }

    /**
     * Longest dependency chain from a root down to {@code logicalId},
     * used to locate a failing declaration.
     */
    public List<String> pathTo(String logicalId) {
        var current = index.get(logicalId);
        if (current == null) {
            throw new IllegalArgumentException("Unknown logical id " + logicalId);
        }
        var path = new ArrayList<String>();
        while (current != null) {
            path.add(0, current.logicalId());
            ResourceNode deepest = null;
            for (var dependency : current.dependsOn()) {
                if (deepest == null || depth.get(dependency) > depth.get(deepest.logicalId())) {
                    deepest = index.get(dependency);
                }
            }
            current = deepest;
        }
        return path;
    }

    public int size() {
        return resources.size();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ResourceGraph)) {
            return false;
        }
        var graph = (ResourceGraph) other;
        return resources.equals(graph.resources) && outputs.equals(graph.outputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resources, outputs);
    }

    @Override
    public String toString() {
        return "ResourceGraph[" + resources.size() + " resources, outputs=" + outputs.keySet() + "]";
    }
}
