package com.chatui.topology.graph;

/**
 * A stack output: an attribute of a declared resource, resolved after apply.
 */
public record OutputRef(String resourceId, String attribute, String description) {

    public String key() {
        return resourceId + "." + attribute;
    }
}
