package com.chatui.topology.firewall;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = GeoMatchStatement.class, name = "geoMatch"),
    @JsonSubTypes.Type(value = NotStatement.class, name = "not")
})
public interface MatchStatement {

    boolean matches(InboundRequest request);
}
