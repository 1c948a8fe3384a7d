package com.chatui.topology.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * One declaration in the graph.
 *
 * @param properties plain JSON values (strings, numbers, booleans, lists, maps)
 * @param dependsOn  logical ids that must be applied first, sorted
 */
public record ResourceNode(
    String logicalId,
    ResourceKind kind,
    Map<String, Object> properties,
    List<String> dependsOn
) {

    public ResourceNode {
        Objects.requireNonNull(logicalId, "logicalId");
        Objects.requireNonNull(kind, "kind");
        properties = properties == null ? Map.of() : frozenMap(properties);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(new TreeSet<>(dependsOn));
    }

    private static Map<String, Object> frozenMap(Map<?, ?> map) {
        var copy = new LinkedHashMap<String, Object>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), frozen(value)));
        return Collections.unmodifiableMap(copy);
    }

    // Nested JSON containers are frozen too, so a node never changes after construction
    private static Object frozen(Object value) {
        if (value instanceof Map) {
            return frozenMap((Map<?, ?>) value);
        }
        if (value instanceof List) {
            var copy = new ArrayList<Object>();
            for (var element : (List<?>) value) {
                copy.add(frozen(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public Object property(String name) {
        return properties.get(name);
    }

    public String stringProperty(String name) {
        var value = properties.get(name);
        return value == null ? null : value.toString();
    }
}
