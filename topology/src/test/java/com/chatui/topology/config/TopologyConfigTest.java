package com.chatui.topology.config;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;

import com.chatui.topology.exception.ConfigurationError;
import com.chatui.topology.exception.ConfigurationException;
import com.chatui.topology.scaling.ScalingInterval;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TopologyConfigTest {

    private static TopologyConfig.Builder base() {
        return TopologyConfig.builder()
            .containerImage("lobehub/lobe-chat:latest")
            .domainName("example.com")
            .region("us-east-1");
    }

    private static ConfigurationException invalid(TopologyConfig.Builder builder) {
        return assertThrows(ConfigurationException.class, () -> builder.build().validate());
    }

    @Test
    void defaultsAreValid() throws ConfigurationException {
        var config = base().build();
        config.validate();

        assertEquals("ChatUiStack", config.stackName());
        assertEquals(3210, config.containerPort());
        assertEquals(1, config.minReplicas());
        assertEquals(6, config.maxReplicas());
        assertEquals(2, config.desiredReplicas());
        assertEquals(30, config.cpuTargetPercent());
        assertEquals(3, config.requestScalingSteps().size());
        assertEquals(List.of("US"), config.allowedCountries());
        assertTrue(config.enableHttps());
    }

    @Test
    void desiredReplicasFollowTheBounds() {
        assertEquals(3, base().minReplicas(3).maxReplicas(6).build().desiredReplicas());
        assertEquals(1, base().minReplicas(1).maxReplicas(1).build().desiredReplicas());
    }

    @Test
    void httpsNeedsADomain() {
        var e = invalid(TopologyConfig.builder().containerImage("image").region("us-east-1"));
        assertEquals(ConfigurationError.HTTPS_WITHOUT_DOMAIN, e.getError());
        assertEquals("domainName", e.getField());
    }

    @Test
    void plainHttpWorksWithoutADomain() throws ConfigurationException {
        var config = TopologyConfig.builder().containerImage("image").region("us-east-1").enableHttps(false).build();
        config.validate();
        assertTrue(config.fqdn().isEmpty());
        assertFalse(config.hasDnsRecord());
    }

    @Test
    void subdomainNeedsADomain() {
        var e = invalid(TopologyConfig.builder().containerImage("image").region("us-east-1")
            .enableHttps(false)
            .subdomain("app"));
        assertEquals(ConfigurationError.SUBDOMAIN_WITHOUT_DOMAIN, e.getError());
    }

    @Test
    void blankSubdomainIsRejected() {
        var e = invalid(base().subdomain(""));
        assertEquals(ConfigurationError.MISSING_VALUE, e.getError());
        assertEquals("subdomain", e.getField());

        assertEquals("subdomain", invalid(base().subdomain("  ")).getField());
    }

    @Test
    void nullEnvVarValueNamesTheField() {
        var envVars = new HashMap<String, String>();
        envVars.put("NEXT_PUBLIC_ENABLE_AUTH", null);

        var e = invalid(base().envVars(envVars));
        assertEquals(ConfigurationError.MISSING_VALUE, e.getError());
        assertEquals("envVars", e.getField());
        assertTrue(e.getMessage().contains("NEXT_PUBLIC_ENABLE_AUTH"));
    }

    @Test
    void nullSecretRefNamesTheField() {
        var e = invalid(base().secretRefs(Arrays.asList((SecretRef) null)));
        assertEquals(ConfigurationError.INVALID_SECRET_REF, e.getError());
        assertEquals("secretRefs", e.getField());
    }

    @Test
    void nullCountryNamesTheField() {
        var e = invalid(base().allowedCountries(Arrays.asList("US", null)));
        assertEquals(ConfigurationError.INVALID_COUNTRY_CODE, e.getError());
        assertEquals("allowedCountries", e.getField());
    }

    @Test
    void nullScalingStepNamesTheField() {
        var e = invalid(base().requestScalingSteps(Arrays.asList(ScalingInterval.below(50, -1), null)));
        assertEquals(ConfigurationError.INVALID_SCALING_STEPS, e.getError());
        assertEquals("requestScalingSteps", e.getField());
    }

    @Test
    void collectionsAreUnmodifiable() {
        var config = base().envVar("A", "1").allowedCountries(List.of("US")).build();
        assertThrows(UnsupportedOperationException.class, () -> config.envVars().put("B", "2"));
        assertThrows(UnsupportedOperationException.class, () -> config.allowedCountries().add("CA"));
    }

    @Test
    void invertedReplicaBoundsAreRejected() {
        var e = invalid(base().minReplicas(4).maxReplicas(2));
        assertEquals(ConfigurationError.REPLICA_BOUNDS_INVERTED, e.getError());
        assertEquals("maxReplicas", e.getField());
    }

    @Test
    void atLeastOneReplica() {
        assertEquals("minReplicas", invalid(base().minReplicas(0)).getField());
    }

    @Test
    void cpuTargetMustBeAPercentage() {
        assertEquals(ConfigurationError.OUT_OF_RANGE, invalid(base().cpuTargetPercent(0)).getError());
        assertEquals("cpuTargetPercent", invalid(base().cpuTargetPercent(101)).getField());
    }

    @Test
    void containerPortMustBeAPort() {
        assertEquals("containerPort", invalid(base().containerPort(70000)).getField());
    }

    @Test
    void containerImageIsRequired() {
        var e = invalid(TopologyConfig.builder().domainName("example.com").region("us-east-1"));
        assertEquals(ConfigurationError.MISSING_VALUE, e.getError());
        assertEquals("containerImage", e.getField());
    }

    @Test
    void secretRefsNeedEveryPart() {
        var e = invalid(base().secretRef("OPENAI_API_KEY", "multimodalai/openai-api-key", ""));
        assertEquals(ConfigurationError.INVALID_SECRET_REF, e.getError());
    }

    @Test
    void secretNamesMustNotCollideWithVariables() {
        var e = invalid(base()
            .envVar("OPENAI_API_KEY", "plain")
            .secretRef("OPENAI_API_KEY", "multimodalai/openai-api-key", "OPENAI_API_KEY"));
        assertEquals(ConfigurationError.DUPLICATE_NAME, e.getError());
        assertTrue(e.getMessage().contains("OPENAI_API_KEY"));
    }

    @Test
    void countryCodesAreUppercaseAlpha2() {
        var e = invalid(base().allowedCountries(List.of("us")));
        assertEquals(ConfigurationError.INVALID_COUNTRY_CODE, e.getError());
    }

    @Test
    void capacityBoundsAreChecked() {
        assertEquals(ConfigurationError.CAPACITY_BOUNDS_INVERTED,
            invalid(base().capacityMin(3).capacityMax(2).capacityDesired(2)).getError());
        assertEquals("capacityDesired", invalid(base().capacityDesired(9)).getField());
    }

    @Test
    void logDeliveryAccountComesFromTheRegion() {
        assertEquals("127311923021", base().build().logDeliveryAccount().orElseThrow());
        assertEquals("111122223333",
            base().elbLogDeliveryAccount("111122223333").build().logDeliveryAccount().orElseThrow());
    }

    @Test
    void unknownRegionNeedsAnExplicitLogDeliveryAccount() throws ConfigurationException {
        var e = invalid(base().region("xx-nowhere-1"));
        assertEquals(ConfigurationError.UNKNOWN_LOG_DELIVERY_REGION, e.getError());
        assertEquals("region", e.getField());

        base().region("xx-nowhere-1").elbLogDeliveryAccount("111122223333").build().validate();
        base().region("xx-nowhere-1").observability(false).build().validate();
    }

    @Test
    void fullyQualifiedName() {
        assertEquals("app.example.com", base().subdomain("app").build().fqdn().orElseThrow());
        assertEquals("example.com", base().build().fqdn().orElseThrow());
    }

    @Test
    void customBootstrapIsOptional() throws ConfigurationException {
        assertFalse(base().build().hasCustomBootstrap());

        var config = base().bootstrapQualifier("kyn").fileAssetsBucketName("kyn-bootstrap-bucket").build();
        config.validate();
        assertTrue(config.hasCustomBootstrap());
        assertTrue(base().fileAssetsBucketName("kyn-bootstrap-bucket").build().hasCustomBootstrap());
    }

    @Test
    void bootstrapQualifierIsShortAndPlain() {
        var e = invalid(base().bootstrapQualifier("far-too-long-qualifier"));
        assertEquals(ConfigurationError.INVALID_VALUE, e.getError());
        assertEquals("bootstrapQualifier", e.getField());

        assertEquals("bootstrapQualifier", invalid(base().bootstrapQualifier("a b")).getField());
        assertEquals("fileAssetsBucketName", invalid(base().fileAssetsBucketName(" ")).getField());
    }

    @Test
    void toBuilderKeepsEveryField() {
        var config = base().subdomain("app").secretRef("KEY", "path", "FIELD").tag("team", "chat")
            .bootstrapQualifier("kyn").fileAssetsBucketName("kyn-bootstrap-bucket").build();
        assertEquals(config, config.toBuilder().build());
    }

    @Test
    void messageNamesTheField() {
        var e = invalid(base().minReplicas(4).maxReplicas(2));
        assertTrue(e.getMessage().startsWith("maxReplicas: "));
    }
}
