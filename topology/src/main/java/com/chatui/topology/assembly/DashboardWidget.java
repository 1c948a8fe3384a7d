package com.chatui.topology.assembly;

import java.util.List;

// A graph widget: metrics on the left and right axes
public record DashboardWidget(String title, List<DashboardMetric> left, List<DashboardMetric> right) {

    public DashboardWidget {
        left = List.copyOf(left);
        right = List.copyOf(right);
    }

    static DashboardWidget of(String title, DashboardMetric... left) {
        return new DashboardWidget(title, List.of(left), List.of());
    }
}
