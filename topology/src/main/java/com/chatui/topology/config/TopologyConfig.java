package com.chatui.topology.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import com.chatui.topology.exception.ConfigurationError;
import com.chatui.topology.exception.ConfigurationException;
import com.chatui.topology.scaling.ScalingInterval;

/**
 * Everything a chat UI deployment can be parameterized with.
 * <p>
 * Defaults are those of {@link Builder}. {@link #validate()} must pass before
 * the configuration is assembled into a topology.
 */
public record TopologyConfig(
    String stackName,
    String account,
    String region,
    String domainName,
    String subdomain,
    String containerImage,
    int containerPort,
    int memoryLimitMiB,
    List<SecretRef> secretRefs,
    Map<String, String> envVars,
    int minReplicas,
    int maxReplicas,
    int desiredReplicas,
    int cpuTargetPercent,
    List<ScalingInterval> requestScalingSteps,
    int scalingCooldownSeconds,
    boolean enableHttps,
    String notifyEmail,
    List<String> allowedCountries,
    boolean enableWaf,
    boolean knowledgeBucket,
    boolean observability,
    String instanceType,
    int capacityMin,
    int capacityMax,
    int capacityDesired,
    int targetCapacityPercent,
    int accessLogRetentionDays,
    String elbLogDeliveryAccount,
    String dashboardName,
    Map<String, String> tags,
    String bootstrapQualifier,
    String fileAssetsBucketName
) {
    private static final Pattern COUNTRY_CODE = Pattern.compile("[A-Z]{2}");
    // Same constraint the CDK bootstrap template puts on its qualifier
    private static final Pattern BOOTSTRAP_QUALIFIER = Pattern.compile("[A-Za-z0-9_-]{1,10}");

    // Null entries survive the copy so validate() can name the field
    public TopologyConfig {
        secretRefs = copyOf(secretRefs);
        envVars = copyOf(envVars);
        requestScalingSteps = copyOf(requestScalingSteps);
        allowedCountries = copyOf(allowedCountries);
        tags = copyOf(tags);
    }

    private static <T> List<T> copyOf(List<T> list) {
        return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
    }

    private static <K, V> Map<K, V> copyOf(Map<K, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .stackName(stackName)
            .account(account)
            .region(region)
            .domainName(domainName)
            .subdomain(subdomain)
            .containerImage(containerImage)
            .containerPort(containerPort)
            .memoryLimitMiB(memoryLimitMiB)
            .secretRefs(secretRefs)
            .envVars(envVars)
            .minReplicas(minReplicas)
            .maxReplicas(maxReplicas)
            .desiredReplicas(desiredReplicas)
            .cpuTargetPercent(cpuTargetPercent)
            .requestScalingSteps(requestScalingSteps)
            .scalingCooldownSeconds(scalingCooldownSeconds)
            .enableHttps(enableHttps)
            .notifyEmail(notifyEmail)
            .allowedCountries(allowedCountries)
            .enableWaf(enableWaf)
            .knowledgeBucket(knowledgeBucket)
            .observability(observability)
            .instanceType(instanceType)
            .capacityMin(capacityMin)
            .capacityMax(capacityMax)
            .capacityDesired(capacityDesired)
            .targetCapacityPercent(targetCapacityPercent)
            .accessLogRetentionDays(accessLogRetentionDays)
            .elbLogDeliveryAccount(elbLogDeliveryAccount)
            .dashboardName(dashboardName)
            .tags(tags)
            .bootstrapQualifier(bootstrapQualifier)
            .fileAssetsBucketName(fileAssetsBucketName);
    }

    /**
     * Whether the stack is deployed against a custom CDK bootstrap rather
     * than the default one.
     */
    public boolean hasCustomBootstrap() {
        return bootstrapQualifier != null || fileAssetsBucketName != null;
    }

    public boolean hasDnsRecord() {
        return domainName != null && subdomain != null;
    }

    public Optional<String> fqdn() {
        return hasDnsRecord() ? Optional.of(subdomain + "." + domainName) : Optional.ofNullable(domainName);
    }

    public Optional<String> logDeliveryAccount() {
        return elbLogDeliveryAccount != null
            ? Optional.of(elbLogDeliveryAccount)
            : ElbLogDelivery.accountFor(region);
    }

    // Fails on the first offending field, in declaration order
    public void validate() throws ConfigurationException {
        requireText(stackName, "stackName");
        requireText(containerImage, "containerImage");
        if (containerPort < 1 || containerPort > 65535) {
            throw new ConfigurationException(ConfigurationError.OUT_OF_RANGE, "containerPort", String.valueOf(containerPort));
        }
        if (memoryLimitMiB <= 0) {
            throw new ConfigurationException(ConfigurationError.OUT_OF_RANGE, "memoryLimitMiB", String.valueOf(memoryLimitMiB));
        }
        if (enableHttps && isBlank(domainName)) {
            throw new ConfigurationException(ConfigurationError.HTTPS_WITHOUT_DOMAIN, "domainName");
        }
        if (subdomain != null) {
            requireText(subdomain, "subdomain");
            if (isBlank(domainName)) {
                throw new ConfigurationException(ConfigurationError.SUBDOMAIN_WITHOUT_DOMAIN, "subdomain");
            }
        }
        validateEnvVars();
        validateSecrets();
        if (minReplicas < 1) {
            throw new ConfigurationException(ConfigurationError.OUT_OF_RANGE, "minReplicas", String.valueOf(minReplicas));
        }
        if (maxReplicas < minReplicas) {
            throw new ConfigurationException(
                ConfigurationError.REPLICA_BOUNDS_INVERTED, "maxReplicas", minReplicas + " > " + maxReplicas);
        }
        if (desiredReplicas < minReplicas || desiredReplicas > maxReplicas) {
            throw new ConfigurationException(ConfigurationError.OUT_OF_RANGE, "desiredReplicas", String.valueOf(desiredReplicas));
        }
        if (cpuTargetPercent <= 0 || cpuTargetPercent > 100) {
            throw new ConfigurationException(ConfigurationError.OUT_OF_RANGE, "cpuTargetPercent", String.valueOf(cpuTargetPercent));
        }
        if (requestScalingSteps.contains(null)) {
            throw new ConfigurationException(ConfigurationError.INVALID_SCALING_STEPS, "requestScalingSteps");
        }
        if (scalingCooldownSeconds < 0) {
            throw new ConfigurationException(
                ConfigurationError.OUT_OF_RANGE, "scalingCooldownSeconds", String.valueOf(scalingCooldownSeconds));
        }
        for (var country : allowedCountries) {
            if (country == null || !COUNTRY_CODE.matcher(country).matches()) {
                throw new ConfigurationException(ConfigurationError.INVALID_COUNTRY_CODE, "allowedCountries", country);
            }
        }
        requireText(instanceType, "instanceType");
        if (capacityMin < 0 || capacityMax < capacityMin) {
            throw new ConfigurationException(
                ConfigurationError.CAPACITY_BOUNDS_INVERTED, "capacityMax", capacityMin + " > " + capacityMax);
        }
        if (capacityDesired < capacityMin || capacityDesired > capacityMax) {
            throw new ConfigurationException(ConfigurationError.OUT_OF_RANGE, "capacityDesired", String.valueOf(capacityDesired));
        }
        if (targetCapacityPercent <= 0 || targetCapacityPercent > 100) {
            throw new ConfigurationException(
                ConfigurationError.OUT_OF_RANGE, "targetCapacityPercent", String.valueOf(targetCapacityPercent));
        }
        if (observability) {
            if (accessLogRetentionDays < 1) {
                throw new ConfigurationException(
                    ConfigurationError.OUT_OF_RANGE, "accessLogRetentionDays", String.valueOf(accessLogRetentionDays));
            }
            if (logDeliveryAccount().isEmpty()) {
                throw new ConfigurationException(ConfigurationError.UNKNOWN_LOG_DELIVERY_REGION, "region", region);
            }
        }
        requireText(dashboardName, "dashboardName");
        if (bootstrapQualifier != null && !BOOTSTRAP_QUALIFIER.matcher(bootstrapQualifier).matches()) {
            throw new ConfigurationException(ConfigurationError.INVALID_VALUE, "bootstrapQualifier", bootstrapQualifier);
        }
        if (fileAssetsBucketName != null) {
            requireText(fileAssetsBucketName, "fileAssetsBucketName");
        }
    }

    private void validateEnvVars() throws ConfigurationException {
        for (var entry : envVars.entrySet()) {
            if (isBlank(entry.getKey()) || entry.getValue() == null) {
                throw new ConfigurationException(ConfigurationError.MISSING_VALUE, "envVars", entry.getKey());
            }
        }
    }

    private void validateSecrets() throws ConfigurationException {
        var names = new HashSet<>(envVars.keySet());
        for (var secret : secretRefs) {
            if (secret == null || !secret.isComplete()) {
                throw new ConfigurationException(
                    ConfigurationError.INVALID_SECRET_REF, "secretRefs", secret == null ? null : secret.logicalName());
            }
            // Secrets and plain variables share the container environment
            if (!names.add(secret.logicalName())) {
                throw new ConfigurationException(ConfigurationError.DUPLICATE_NAME, "secretRefs", secret.logicalName());
            }
        }
    }

    private static void requireText(String value, String field) throws ConfigurationException {
        if (isBlank(value)) {
            throw new ConfigurationException(ConfigurationError.MISSING_VALUE, field);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static final class Builder {
        private String stackName = "ChatUiStack";
        private String account;
        private String region;
        private String domainName;
        private String subdomain;
        private String containerImage;
        private int containerPort = 3210;
        private int memoryLimitMiB = 1024;
        private final List<SecretRef> secretRefs = new ArrayList<>();
        private final Map<String, String> envVars = new LinkedHashMap<>();
        private int minReplicas = 1;
        private int maxReplicas = 6;
        private Integer desiredReplicas;
        private int cpuTargetPercent = 30;
        private List<ScalingInterval> requestScalingSteps = List.of(
            ScalingInterval.below(50, -1),
            ScalingInterval.atOrAbove(100, 1),
            ScalingInterval.atOrAbove(200, 2));
        private int scalingCooldownSeconds = 60;
        private boolean enableHttps = true;
        private String notifyEmail;
        private List<String> allowedCountries = List.of("US");
        private boolean enableWaf = true;
        private boolean knowledgeBucket = true;
        private boolean observability = true;
        private String instanceType = "t3.small";
        private int capacityMin = 1;
        private int capacityMax = 4;
        private int capacityDesired = 2;
        private int targetCapacityPercent = 80;
        private int accessLogRetentionDays = 30;
        private String elbLogDeliveryAccount;
        private String dashboardName = "ChatUiEcsDashboard";
        private final Map<String, String> tags = new LinkedHashMap<>();
        private String bootstrapQualifier;
        private String fileAssetsBucketName;

        private Builder() {
        }

        public Builder stackName(String stackName) {
            this.stackName = stackName;
            return this;
        }

        public Builder account(String account) {
            this.account = account;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder domainName(String domainName) {
            this.domainName = domainName;
            return this;
        }

        public Builder subdomain(String subdomain) {
            this.subdomain = subdomain;
            return this;
        }

        public Builder containerImage(String containerImage) {
            this.containerImage = containerImage;
            return this;
        }

        public Builder containerPort(int containerPort) {
            this.containerPort = containerPort;
            return this;
        }

        public Builder memoryLimitMiB(int memoryLimitMiB) {
            this.memoryLimitMiB = memoryLimitMiB;
            return this;
        }

        public Builder secretRef(String logicalName, String secretPath, String field) {
            this.secretRefs.add(new SecretRef(logicalName, secretPath, field));
            return this;
        }

        public Builder secretRefs(List<SecretRef> secretRefs) {
            this.secretRefs.clear();
            this.secretRefs.addAll(secretRefs);
            return this;
        }

        public Builder envVar(String name, String value) {
            this.envVars.put(name, value);
            return this;
        }

        public Builder envVars(Map<String, String> envVars) {
            this.envVars.clear();
            this.envVars.putAll(envVars);
            return this;
        }

        public Builder minReplicas(int minReplicas) {
            this.minReplicas = minReplicas;
            return this;
        }

        public Builder maxReplicas(int maxReplicas) {
            this.maxReplicas = maxReplicas;
            return this;
        }

        public Builder desiredReplicas(int desiredReplicas) {
            this.desiredReplicas = desiredReplicas;
            return this;
        }

        public Builder cpuTargetPercent(int cpuTargetPercent) {
            this.cpuTargetPercent = cpuTargetPercent;
            return this;
        }

        public Builder requestScalingSteps(List<ScalingInterval> requestScalingSteps) {
            this.requestScalingSteps = new ArrayList<>(requestScalingSteps);
            return this;
        }

        public Builder scalingCooldownSeconds(int scalingCooldownSeconds) {
            this.scalingCooldownSeconds = scalingCooldownSeconds;
            return this;
        }

        public Builder enableHttps(boolean enableHttps) {
            this.enableHttps = enableHttps;
            return this;
        }

        public Builder notifyEmail(String notifyEmail) {
            this.notifyEmail = notifyEmail;
            return this;
        }

        public Builder allowedCountries(List<String> allowedCountries) {
            this.allowedCountries = new ArrayList<>(allowedCountries);
            return this;
        }

        public Builder enableWaf(boolean enableWaf) {
            this.enableWaf = enableWaf;
            return this;
        }

        public Builder knowledgeBucket(boolean knowledgeBucket) {
            this.knowledgeBucket = knowledgeBucket;
            return this;
        }

        public Builder observability(boolean observability) {
            this.observability = observability;
            return this;
        }

        public Builder instanceType(String instanceType) {
            this.instanceType = instanceType;
            return this;
        }

        public Builder capacityMin(int capacityMin) {
            this.capacityMin = capacityMin;
            return this;
        }

        public Builder capacityMax(int capacityMax) {
            this.capacityMax = capacityMax;
            return this;
        }

        public Builder capacityDesired(int capacityDesired) {
            this.capacityDesired = capacityDesired;
            return this;
        }

        public Builder targetCapacityPercent(int targetCapacityPercent) {
            this.targetCapacityPercent = targetCapacityPercent;
            return this;
        }

        public Builder accessLogRetentionDays(int accessLogRetentionDays) {
            this.accessLogRetentionDays = accessLogRetentionDays;
            return this;
        }

        public Builder elbLogDeliveryAccount(String elbLogDeliveryAccount) {
            this.elbLogDeliveryAccount = elbLogDeliveryAccount;
            return this;
        }

        public Builder dashboardName(String dashboardName) {
            this.dashboardName = dashboardName;
            return this;
        }

        public Builder tag(String key, String value) {
            this.tags.put(key, value);
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags.clear();
            this.tags.putAll(tags);
            return this;
        }

        public Builder bootstrapQualifier(String bootstrapQualifier) {
            this.bootstrapQualifier = bootstrapQualifier;
            return this;
        }

        public Builder fileAssetsBucketName(String fileAssetsBucketName) {
            this.fileAssetsBucketName = fileAssetsBucketName;
            return this;
        }

        public TopologyConfig build() {
            // Two tasks unless the bounds say otherwise
            var desired = desiredReplicas != null
                ? desiredReplicas
                : Math.max(minReplicas, Math.min(2, maxReplicas));
            return new TopologyConfig(
                stackName,
                account,
                region,
                domainName,
                subdomain,
                containerImage,
                containerPort,
                memoryLimitMiB,
                secretRefs,
                envVars,
                minReplicas,
                maxReplicas,
                desired,
                cpuTargetPercent,
                requestScalingSteps,
                scalingCooldownSeconds,
                enableHttps,
                notifyEmail,
                allowedCountries,
                enableWaf,
                knowledgeBucket,
                observability,
                instanceType,
                capacityMin,
                capacityMax,
                capacityDesired,
                targetCapacityPercent,
                accessLogRetentionDays,
                elbLogDeliveryAccount,
                dashboardName,
                tags,
                bootstrapQualifier,
                fileAssetsBucketName);
        }
    }
}
