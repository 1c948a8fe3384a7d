package com.chatui.infra;

import java.io.IOException;
import java.nio.file.Path;

import com.chatui.topology.assembly.TopologyAssembler;
import com.chatui.topology.exception.ConfigurationException;
import com.chatui.topology.graph.GraphCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awscdk.App;
import software.amazon.awscdk.DefaultStackSynthesizer;
import software.amazon.awscdk.DefaultStackSynthesizerProps;
import software.amazon.awscdk.Environment;
import software.amazon.awscdk.StackProps;

public class ChatUiApp {
    private static final Logger LOG = LogManager.getLogger(ChatUiApp.class);

    static final String TOPOLOGY_FILE = "chat-ui-topology.json";

    public static void main(final String[] args) {
        var app = new App();

        var codec = new GraphCodec();
        ChatUiStackProps chatUiStackProps;
        try {
            var config = new TopologyConfigLoader(app.getNode()::tryGetContext, System.getenv()).load();
            var topology = new TopologyAssembler(codec.mapper()).assemble(config);
            // Preflight reads this document
            codec.write(topology.graph(), Path.of(app.getOutdir(), TOPOLOGY_FILE));
            chatUiStackProps = new ChatUiStackProps(topology);
        } catch (ConfigurationException e) {
            LOG.error("config - {} - {}", e.getError(), e.getMessage());
            System.exit(1);
            return;
        } catch (IOException e) {
            LOG.error("topology - cannot write {}", TOPOLOGY_FILE, e);
            System.exit(1);
            return;
        }

        var config = chatUiStackProps.topology().config();
        var env = Environment.builder()
            .account(config.account())
            .region(config.region())
            .build();

        var stackProps = StackProps.builder()
            .env(env)
            .stackName(config.stackName())
            .tags(config.tags());
        if (config.hasCustomBootstrap()) {
            LOG.info("bootstrap - qualifier {} - assets bucket {}", config.bootstrapQualifier(), config.fileAssetsBucketName());
            stackProps.synthesizer(new DefaultStackSynthesizer(DefaultStackSynthesizerProps.builder()
                .qualifier(config.bootstrapQualifier())
                .fileAssetsBucketName(config.fileAssetsBucketName())
                .build()));
        }

        new ChatUiStack(app, config.stackName(), stackProps.build(), chatUiStackProps);

        app.synth();
    }
}
