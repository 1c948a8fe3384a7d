package com.chatui.topology.firewall;

public record NotStatement(MatchStatement statement) implements MatchStatement {

    @Override
    public boolean matches(InboundRequest request) {
        return !statement.matches(request);
    }
}
