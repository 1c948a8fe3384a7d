package com.chatui.topology.health;

import java.util.ArrayList;
import java.util.List;

import com.chatui.topology.exception.ConfigurationError;
import com.chatui.topology.exception.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Target group success codes in ELB syntax: {@code 200}, {@code 200-399} or
 * a comma separated mix of both. Ranges are inclusive.
 */
public final class HealthyHttpCodes {
    private final String expression;
    private final List<int[]> ranges;

    private HealthyHttpCodes(String expression, List<int[]> ranges) {
        this.expression = expression;
        this.ranges = ranges;
    }

    public static HealthyHttpCodes parse(String expression) throws ConfigurationException {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException(ConfigurationError.INVALID_HTTP_CODES, "healthyHttpCodes");
        }
        var ranges = new ArrayList<int[]>();
        for (var part : expression.split(",")) {
            var bounds = part.trim().split("-", -1);
            if (bounds.length > 2) {
                throw invalid(expression);
            }
            var low = code(bounds[0], expression);
            var high = bounds.length == 2 ? code(bounds[1], expression) : low;
            if (low > high) {
                throw invalid(expression);
            }
            ranges.add(new int[] { low, high });
        }
        return new HealthyHttpCodes(expression.replace(" ", ""), List.copyOf(ranges));
    }

    public boolean matches(int statusCode) {
        return ranges.stream().anyMatch(range -> statusCode >= range[0] && statusCode <= range[1]);
    }

    @JsonValue
    public String expression() {
        return expression;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof HealthyHttpCodes && ((HealthyHttpCodes) other).expression.equals(expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }

    private static int code(String text, String expression) throws ConfigurationException {
        try {
            var code = Integer.parseInt(text.trim());
            if (code < 200 || code > 499) {
                throw invalid(expression);
            }
            return code;
        } catch (NumberFormatException e) {
            throw new ConfigurationException(ConfigurationError.INVALID_HTTP_CODES, "healthyHttpCodes", expression);
        }
    }

    private static ConfigurationException invalid(String expression) {
        return new ConfigurationException(ConfigurationError.INVALID_HTTP_CODES, "healthyHttpCodes", expression);
    }
}
