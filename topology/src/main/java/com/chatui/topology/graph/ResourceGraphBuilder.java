package com.chatui.topology.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Collects declarations and orders them topologically.
 * <p>
 * Properties may be records or maps; they are converted to plain JSON values
 * so that a graph read back from its document equals the one built here.
 * Ties in the ordering keep declaration order.
 */
public class ResourceGraphBuilder {
    private static final TypeReference<Map<String, Object>> PROPERTIES = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final Map<String, ResourceNode> nodes = new LinkedHashMap<>();
    private final Map<String, OutputRef> outputs = new LinkedHashMap<>();

    public ResourceGraphBuilder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ResourceGraphBuilder add(String logicalId, ResourceKind kind, Object properties, String... dependsOn) {
        return add(logicalId, kind, properties, Arrays.asList(dependsOn));
    }

    public ResourceGraphBuilder add(String logicalId, ResourceKind kind, Object properties, Collection<String> dependsOn) {
        if (nodes.containsKey(logicalId)) {
            throw new IllegalStateException("Duplicate logical id " + logicalId);
        }
        Map<String, Object> plain = properties == null ? Map.of() : mapper.convertValue(properties, PROPERTIES);
        nodes.put(logicalId, new ResourceNode(logicalId, kind, plain, List.copyOf(dependsOn)));
        return this;
    }

    public ResourceGraphBuilder output(String name, String resourceId, String attribute, String description) {
        outputs.put(name, new OutputRef(resourceId, attribute, description));
        return this;
    }

    public boolean contains(String logicalId) {
        return nodes.containsKey(logicalId);
    }

    public ResourceGraph build() {
        var position = new HashMap<String, Integer>();
        var pending = new HashMap<String, Integer>();
        var dependents = new HashMap<String, List<String>>();
        for (var node : nodes.values()) {
            position.put(node.logicalId(), position.size());
            pending.put(node.logicalId(), node.dependsOn().size());
            for (var dependency : node.dependsOn()) {
                if (!nodes.containsKey(dependency)) {
                    throw new IllegalStateException(node.logicalId() + " depends on undeclared " + dependency);
                }
                dependents.computeIfAbsent(dependency, key -> new ArrayList<>()).add(node.logicalId());
            }
        }

        var ready = new PriorityQueue<String>(Comparator.comparing(position::get));
        pending.forEach((id, count) -> {
            if (count == 0) {
                ready.add(id);
            }
        });
        var ordered = new ArrayList<ResourceNode>();
        while (!ready.isEmpty()) {
            var id = ready.poll();
            ordered.add(nodes.get(id));
            for (var dependent : dependents.getOrDefault(id, List.of())) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (ordered.size() != nodes.size()) {
            var cyclic = new ArrayList<>(nodes.keySet());
            ordered.forEach(node -> cyclic.remove(node.logicalId()));
            throw new IllegalStateException("Dependency cycle between " + cyclic);
        }
        return new ResourceGraph(ordered, outputs);
    }
}
