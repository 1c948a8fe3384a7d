package com.chatui.topology.assembly;

/**
 * A security group rule between two declared resources.
 *
 * @param securityGroupOf resource whose security group carries the rule
 * @param peer            resource on the other side
 */
public record SecurityRule(
    Direction direction,
    String securityGroupOf,
    String peer,
    String protocol,
    int fromPort,
    int toPort,
    String description
) {

    public enum Direction {
        INGRESS,
        EGRESS
    }

    // The same opening, seen from the peer's security group
    public SecurityRule mirror(String description) {
        var opposite = direction == Direction.INGRESS ? Direction.EGRESS : Direction.INGRESS;
        return new SecurityRule(opposite, peer, securityGroupOf, protocol, fromPort, toPort, description);
    }

    public boolean isMirrorOf(SecurityRule other) {
        return direction != other.direction
            && securityGroupOf.equals(other.peer)
            && peer.equals(other.securityGroupOf)
            && protocol.equals(other.protocol)
            && fromPort == other.fromPort
            && toPort == other.toPort;
    }
}
