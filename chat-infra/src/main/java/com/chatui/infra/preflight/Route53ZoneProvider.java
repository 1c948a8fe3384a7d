package com.chatui.infra.preflight;

import java.util.Optional;

import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.route53.Route53Client;
import software.amazon.awssdk.services.route53.model.ListHostedZonesByNameRequest;

/**
 * Finds the public hosted zone for a domain, the same zone the stack's
 * {@code HostedZone.fromLookup} resolves at synth time.
 */
public class Route53ZoneProvider implements DnsZoneProvider {
    private final Route53Client route53Client;

    public Route53ZoneProvider() {
        this(Route53Client.builder()
            .credentialsProvider(DefaultCredentialsProvider.create())
            .region(Region.AWS_GLOBAL) // Route 53 is a global service
            .build());
    }

    public Route53ZoneProvider(Route53Client route53Client) {
        this.route53Client = route53Client;
    }

    @Override
    public Optional<String> lookupZone(String domainName) {
        var dnsName = domainName.endsWith(".") ? domainName : domainName + ".";
        var response = route53Client.listHostedZonesByName(ListHostedZonesByNameRequest.builder()
            .dnsName(dnsName)
            .maxItems("10")
            .build());
        // Zones come back in name order starting at dnsName
        return response.hostedZones().stream()
            .filter(zone -> zone.name().equalsIgnoreCase(dnsName))
            .filter(zone -> zone.config() == null || !Boolean.TRUE.equals(zone.config().privateZone()))
            .map(zone -> zone.id())
            .findFirst();
    }
}
