package com.chatui.topology.graph;

import java.util.ArrayList;

import com.chatui.topology.exception.DependencyException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Walks a graph in dependency order and hands each declaration to a
 * {@link ResourceProvisioner}. The walk stops at the first failure; the
 * remaining declarations are reported as skipped.
 */
public class GraphApplier {
    private static final Logger LOG = LogManager.getLogger(GraphApplier.class);

    public ApplyReport apply(ResourceGraph graph, ResourceProvisioner provisioner) {
        var outcomes = new ArrayList<ResourceOutcome>();
        DependencyException failure = null;
        for (var node : graph.getResources()) {
            var id = node.logicalId();
            if (failure != null) {
                outcomes.add(new ResourceOutcome(id, ResourceOutcome.Status.SKIPPED, null));
                continue;
            }
            try {
                provisioner.provision(node);
                outcomes.add(new ResourceOutcome(id, ResourceOutcome.Status.APPLIED, null));
                LOG.debug("apply - {} - {} applied", node.kind(), id);
            } catch (DependencyException e) {
                failure = e.withPath(graph.pathTo(id));
                outcomes.add(new ResourceOutcome(id, ResourceOutcome.Status.FAILED, failure.getMessage()));
                LOG.error("apply - {} - {}", node.kind(), failure.getMessage());
            }
        }
        LOG.info("apply - {} of {} declarations applied",
            outcomes.stream().filter(o -> o.status() == ResourceOutcome.Status.APPLIED).count(),
            outcomes.size());
        return new ApplyReport(outcomes, failure);
    }
}
