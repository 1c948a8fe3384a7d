package com.chatui.topology.graph;

import com.chatui.topology.exception.DependencyException;

/**
 * Applies one declaration. Called in dependency order.
 */
@FunctionalInterface
public interface ResourceProvisioner {

    void provision(ResourceNode node) throws DependencyException;
}
