package com.chatui.infra;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.chatui.topology.config.SecretRef;
import com.chatui.topology.config.TopologyConfig;
import com.chatui.topology.exception.ConfigurationError;
import com.chatui.topology.exception.ConfigurationException;
import com.chatui.topology.scaling.ScalingInterval;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds a {@link TopologyConfig} from CDK context.
 * <p>
 * Values from {@code cdk.json} arrive as JSON types, values passed with
 * {@code -c key=value} arrive as strings; both are accepted. String forms:
 * <ul>
 *   <li>{@code secretRefs}: {@code NAME=secret/path:FIELD;...}</li>
 *   <li>{@code requestScalingSteps}: {@code <50:-1,>=100:+1,100..200:+2}, or {@code none}</li>
 *   <li>{@code envVars}, {@code tags}: {@code KEY=value,...}</li>
 *   <li>{@code allowedCountries}: {@code US,CA}</li>
 * </ul>
 * Account, region and the notification email fall back to the environment.
 */
public class TopologyConfigLoader {
    private static final Logger LOG = LogManager.getLogger(TopologyConfigLoader.class);

    static final String ENV_ACCOUNT = "CDK_DEFAULT_ACCOUNT";
    static final String ENV_REGION = "CDK_DEFAULT_REGION";
    static final String ENV_NOTIFY_EMAIL = "CHATUI_NOTIFY_EMAIL";

    private final Function<String, Object> context;
    private final Map<String, String> environment;
    private final ObjectMapper mapper = new ObjectMapper();

    public TopologyConfigLoader(Function<String, Object> context, Map<String, String> environment) {
        this.context = context;
        this.environment = environment;
    }

    public TopologyConfig load() throws ConfigurationException {
        var builder = TopologyConfig.builder();

        var stackName = string("stackName");
        if (stackName != null) {
            builder.stackName(stackName);
        }
        builder.account(stringOrEnv("account", ENV_ACCOUNT));
        builder.region(stringOrEnv("region", ENV_REGION));
        builder.domainName(string("domainName"));
        builder.subdomain(string("subdomain"));
        builder.containerImage(string("containerImage"));
        builder.notifyEmail(stringOrEnv("notifyEmail", ENV_NOTIFY_EMAIL));
        builder.elbLogDeliveryAccount(string("elbLogDeliveryAccount"));
        builder.bootstrapQualifier(string("bootstrapQualifier"));
        builder.fileAssetsBucketName(string("fileAssetsBucketName"));

        var instanceType = string("instanceType");
        if (instanceType != null) {
            builder.instanceType(instanceType);
        }
        var dashboardName = string("dashboardName");
        if (dashboardName != null) {
            builder.dashboardName(dashboardName);
        }

        Integer value;
        if ((value = integer("containerPort")) != null) {
            builder.containerPort(value);
        }
        if ((value = integer("memoryLimitMiB")) != null) {
            builder.memoryLimitMiB(value);
        }
        if ((value = integer("minReplicas")) != null) {
            builder.minReplicas(value);
        }
        if ((value = integer("maxReplicas")) != null) {
            builder.maxReplicas(value);
        }
        if ((value = integer("desiredReplicas")) != null) {
            builder.desiredReplicas(value);
        }
        if ((value = integer("cpuTargetPercent")) != null) {
            builder.cpuTargetPercent(value);
        }
        if ((value = integer("scalingCooldownSeconds")) != null) {
            builder.scalingCooldownSeconds(value);
        }
        if ((value = integer("capacityMin")) != null) {
            builder.capacityMin(value);
        }
        if ((value = integer("capacityMax")) != null) {
            builder.capacityMax(value);
        }
        if ((value = integer("capacityDesired")) != null) {
            builder.capacityDesired(value);
        }
        if ((value = integer("targetCapacityPercent")) != null) {
            builder.targetCapacityPercent(value);
        }
        if ((value = integer("accessLogRetentionDays")) != null) {
            builder.accessLogRetentionDays(value);
        }

        Boolean flag;
        if ((flag = bool("enableHttps")) != null) {
            builder.enableHttps(flag);
        }
        if ((flag = bool("enableWaf")) != null) {
            builder.enableWaf(flag);
        }
        if ((flag = bool("knowledgeBucket")) != null) {
            builder.knowledgeBucket(flag);
        }
        if ((flag = bool("observability")) != null) {
            builder.observability(flag);
        }

        if (context.apply("secretRefs") != null) {
            builder.secretRefs(secretRefs());
        }
        if (context.apply("requestScalingSteps") != null) {
            builder.requestScalingSteps(scalingSteps());
        }
        if (context.apply("allowedCountries") != null) {
            builder.allowedCountries(countries());
        }
        if (context.apply("envVars") != null) {
            builder.envVars(pairs("envVars"));
        }
        if (context.apply("tags") != null) {
            builder.tags(pairs("tags"));
        }

        var config = builder.build();
        LOG.info("config - {} - account {} region {} image {}",
            config.stackName(), config.account(), config.region(), config.containerImage());
        return config;
    }

    private String string(String key) {
        var raw = context.apply(key);
        if (raw == null) {
            return null;
        }
        var text = raw.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private String stringOrEnv(String key, String variable) {
        var text = string(key);
        if (text != null) {
            return text;
        }
        var fallback = environment.get(variable);
        return fallback == null || fallback.isBlank() ? null : fallback.trim();
    }

    private Integer integer(String key) throws ConfigurationException {
        var raw = context.apply(key);
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number) {
            var number = ((Number) raw).doubleValue();
            if (number != Math.rint(number) || number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
                throw new ConfigurationException(ConfigurationError.INVALID_VALUE, key, raw.toString());
            }
            return (int) number;
        }
        try {
            return Integer.valueOf(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(ConfigurationError.INVALID_VALUE, key, raw.toString());
        }
    }

    private Boolean bool(String key) throws ConfigurationException {
        var raw = context.apply(key);
        if (raw == null) {
            return null;
        }
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        var text = raw.toString().trim().toLowerCase();
        if (text.equals("true")) {
            return true;
        }
        if (text.equals("false")) {
            return false;
        }
        throw new ConfigurationException(ConfigurationError.INVALID_VALUE, key, raw.toString());
    }

    private List<SecretRef> secretRefs() throws ConfigurationException {
        var raw = context.apply("secretRefs");
        if (raw instanceof List) {
            return convert("secretRefs", raw, new TypeReference<List<SecretRef>>() {});
        }
        var refs = new ArrayList<SecretRef>();
        for (var entry : split(raw.toString(), ";")) {
            // NAME=secret/path:FIELD
            var eq = entry.indexOf('=');
            var colon = entry.lastIndexOf(':');
            if (eq <= 0 || colon <= eq + 1 || colon == entry.length() - 1) {
                throw new ConfigurationException(ConfigurationError.INVALID_SECRET_REF, "secretRefs", entry);
            }
            refs.add(new SecretRef(
                entry.substring(0, eq).trim(),
                entry.substring(eq + 1, colon).trim(),
                entry.substring(colon + 1).trim()));
        }
        return refs;
    }

    private List<ScalingInterval> scalingSteps() throws ConfigurationException {
        var raw = context.apply("requestScalingSteps");
        if (raw instanceof List) {
            return convert("requestScalingSteps", raw, new TypeReference<List<ScalingInterval>>() {});
        }
        var text = raw.toString().trim();
        if (text.equalsIgnoreCase("none")) {
            return List.of();
        }
        var steps = new ArrayList<ScalingInterval>();
        for (var entry : split(text, ",")) {
            var colon = entry.lastIndexOf(':');
            if (colon <= 0) {
                throw new ConfigurationException(ConfigurationError.INVALID_SCALING_STEPS, "requestScalingSteps", entry);
            }
            var range = entry.substring(0, colon).trim();
            try {
                var change = Integer.parseInt(entry.substring(colon + 1).trim().replace("+", ""));
                if (range.startsWith(">=")) {
                    steps.add(ScalingInterval.atOrAbove(Double.parseDouble(range.substring(2)), change));
                } else if (range.startsWith("<")) {
                    steps.add(ScalingInterval.below(Double.parseDouble(range.substring(1)), change));
                } else if (range.contains("..")) {
                    var dots = range.indexOf("..");
                    steps.add(ScalingInterval.between(
                        Double.parseDouble(range.substring(0, dots)),
                        Double.parseDouble(range.substring(dots + 2)),
                        change));
                } else {
                    throw new ConfigurationException(
                        ConfigurationError.INVALID_SCALING_STEPS, "requestScalingSteps", entry);
                }
            } catch (NumberFormatException e) {
                throw new ConfigurationException(ConfigurationError.INVALID_SCALING_STEPS, "requestScalingSteps", entry);
            }
        }
        return steps;
    }

    private List<String> countries() throws ConfigurationException {
        var raw = context.apply("allowedCountries");
        if (raw instanceof List) {
            return convert("allowedCountries", raw, new TypeReference<List<String>>() {});
        }
        return split(raw.toString(), ",");
    }

    private Map<String, String> pairs(String key) throws ConfigurationException {
        var raw = context.apply(key);
        if (raw instanceof Map) {
            return convert(key, raw, new TypeReference<LinkedHashMap<String, String>>() {});
        }
        var pairs = new LinkedHashMap<String, String>();
        for (var entry : split(raw.toString(), ",")) {
            var eq = entry.indexOf('=');
            if (eq <= 0) {
                throw new ConfigurationException(ConfigurationError.INVALID_VALUE, key, entry);
            }
            pairs.put(entry.substring(0, eq).trim(), entry.substring(eq + 1).trim());
        }
        return pairs;
    }

    private <T> T convert(String key, Object raw, TypeReference<T> type) throws ConfigurationException {
        try {
            return mapper.convertValue(raw, type);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(ConfigurationError.INVALID_VALUE, key, e.getMessage());
        }
    }

    private static List<String> split(String text, String separator) {
        var parts = new ArrayList<String>();
        for (var part : text.split(separator)) {
            if (!part.isBlank()) {
                parts.add(part.trim());
            }
        }
        return parts;
    }
}
