package com.chatui.topology.firewall;

import java.util.List;

/**
 * Matches requests whose source country is in {@code countryCodes}.
 * <p>
 * Wrapped in a {@link NotStatement} with a BLOCK action this turns away every
 * client outside the list. There is no exemption for monitoring probes, VPN
 * users or partners abroad; operators have to widen the list or drop the rule.
 */
public record GeoMatchStatement(List<String> countryCodes) implements MatchStatement {

    public GeoMatchStatement {
        countryCodes = List.copyOf(countryCodes);
    }

    @Override
    public boolean matches(InboundRequest request) {
        return request.countryCode() != null && countryCodes.contains(request.countryCode());
    }
}
