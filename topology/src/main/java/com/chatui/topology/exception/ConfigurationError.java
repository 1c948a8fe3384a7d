package com.chatui.topology.exception;

public enum ConfigurationError {
    MISSING_VALUE("Required value is missing"),
    INVALID_VALUE("Value cannot be parsed"),
    OUT_OF_RANGE("Value is out of range"),
    REPLICA_BOUNDS_INVERTED("maxReplicas must be greater than or equal to minReplicas"),
    CAPACITY_BOUNDS_INVERTED("Capacity bounds are inverted"),
    HTTPS_WITHOUT_DOMAIN("HTTPS requires a domain name"),
    SUBDOMAIN_WITHOUT_DOMAIN("A subdomain requires a domain name"),
    INVALID_SECRET_REF("Secret reference needs a name, a path and a field"),
    DUPLICATE_NAME("Name is declared more than once"),
    INVALID_COUNTRY_CODE("Country codes must be ISO 3166 alpha-2"),
    INVALID_SCALING_STEPS("Scaling steps overlap or are unbounded on both sides"),
    INVALID_HEALTH_CHECK("Health check timeout must be shorter than its interval"),
    INVALID_HTTP_CODES("Healthy HTTP codes must be codes or ranges between 200 and 499"),
    DUPLICATE_FIREWALL_PRIORITY("Firewall rule priorities must be unique"),
    INVALID_FIREWALL_RULE("Firewall rule needs either an action or an override action"),
    INVALID_ALARM("datapointsToAlarm must be between 1 and evaluationPeriods"),
    UNKNOWN_LOG_DELIVERY_REGION("No ELB log delivery account is known for the region");

    private final String message;

    ConfigurationError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
