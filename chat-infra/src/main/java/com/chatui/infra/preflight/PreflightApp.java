package com.chatui.infra.preflight;

import java.io.IOException;
import java.nio.file.Path;

import com.chatui.topology.graph.GraphApplier;
import com.chatui.topology.graph.GraphCodec;
import com.chatui.topology.graph.ResourceOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Checks that a synthesized topology's external references exist.
 * <p>
 * Usage: {@code PreflightApp <cdk.out/chat-ui-topology.json> [region]}. The
 * region falls back to {@code AWS_REGION}, then {@code CDK_DEFAULT_REGION}.
 */
public class PreflightApp {
    private static final Logger LOG = LogManager.getLogger(PreflightApp.class);

    public static void main(final String[] args) {
        if (args.length < 1) {
            LOG.error("preflight - usage: PreflightApp <topology.json> [region]");
            System.exit(2);
            return;
        }
        var region = args.length > 1 ? args[1] : System.getenv().getOrDefault("AWS_REGION", System.getenv("CDK_DEFAULT_REGION"));
        if (region == null) {
            LOG.error("preflight - no region given and none in the environment");
            System.exit(2);
            return;
        }

        var codec = new GraphCodec();
        try {
            var graph = codec.read(Path.of(args[0]));
            var provisioner = new PreflightProvisioner(new SecretsManagerSecretStore(region), new Route53ZoneProvider());
            var report = new GraphApplier().apply(graph, provisioner);
            if (!report.isSuccessful()) {
                LOG.error("preflight - failed - {}, {} declarations not checked",
                    report.failure().getMessage(), report.withStatus(ResourceOutcome.Status.SKIPPED).size());
                System.exit(1);
                return;
            }
            LOG.info("preflight - ok - {} declarations", graph.size());
        } catch (IOException e) {
            LOG.error("preflight - cannot read {}", args[0], e);
            System.exit(1);
        }
    }
}
