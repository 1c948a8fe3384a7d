package com.chatui.topology.firewall;

/**
 * The parts of an incoming request the web ACL looks at.
 *
 * @param countryCode ISO 3166 alpha-2 code resolved from the source address
 */
public record InboundRequest(String sourceIp, String countryCode, String method, String uri) {
}
