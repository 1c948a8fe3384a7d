package com.chatui.topology.graph;

import java.util.List;
import java.util.Optional;

import com.chatui.topology.exception.DependencyException;

public record ApplyReport(List<ResourceOutcome> outcomes, DependencyException failure) {

    public ApplyReport {
        outcomes = List.copyOf(outcomes);
    }

    public boolean isSuccessful() {
        return failure == null;
    }

    public Optional<DependencyException> firstFailure() {
        return Optional.ofNullable(failure);
    }

    public List<ResourceOutcome> withStatus(ResourceOutcome.Status status) {
        return outcomes.stream().filter(outcome -> outcome.status() == status).toList();
    }
}
