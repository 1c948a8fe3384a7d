package com.chatui.infra.preflight;

import com.chatui.topology.exception.DependencyError;
import com.chatui.topology.exception.DependencyException;
import com.chatui.topology.graph.ResourceNode;
import com.chatui.topology.graph.ResourceProvisioner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Resolves the lookup-only declarations of a topology against the account
 * before a deploy. Everything else is created by CloudFormation and passes.
 */
public class PreflightProvisioner implements ResourceProvisioner {
    private static final Logger LOG = LogManager.getLogger(PreflightProvisioner.class);

    private final SecretStore secretStore;
    private final DnsZoneProvider dnsZoneProvider;

    public PreflightProvisioner(SecretStore secretStore, DnsZoneProvider dnsZoneProvider) {
        this.secretStore = secretStore;
        this.dnsZoneProvider = dnsZoneProvider;
    }

    @Override
    public void provision(ResourceNode node) throws DependencyException {
        switch (node.kind()) {
            case SECRET_REF:
                checkSecret(node);
                break;
            case DNS_ZONE:
                checkHostedZone(node);
                break;
            case CONTAINER_IMAGE:
                if (!Boolean.TRUE.equals(node.property("digestPinned"))) {
                    LOG.warn("preflight - {} - {} can change between deploys", node.logicalId(), node.stringProperty("image"));
                }
                break;
            default:
                break;
        }
    }

    private void checkSecret(ResourceNode node) throws DependencyException {
        var secretName = node.stringProperty("secretName");
        try {
            var arn = secretStore.lookupSecret(secretName)
                .orElseThrow(() -> new DependencyException(DependencyError.SECRET_NOT_FOUND, node.logicalId(), secretName));
            // The JSON field inside the secret is only resolved by ECS when the task starts
            LOG.info("preflight - {} - {} field {}", node.logicalId(), arn, node.stringProperty("field"));
        } catch (SdkException e) {
            throw new DependencyException(DependencyError.LOOKUP_FAILED, node.logicalId(), secretName, e);
        }
    }

    private void checkHostedZone(ResourceNode node) throws DependencyException {
        var domainName = node.stringProperty("domainName");
        try {
            var zoneId = dnsZoneProvider.lookupZone(domainName)
                .orElseThrow(() -> new DependencyException(DependencyError.HOSTED_ZONE_NOT_FOUND, node.logicalId(), domainName));
            LOG.info("preflight - {} - {} served by {}", node.logicalId(), domainName, zoneId);
        } catch (SdkException e) {
            throw new DependencyException(DependencyError.LOOKUP_FAILED, node.logicalId(), domainName, e);
        }
    }
}
