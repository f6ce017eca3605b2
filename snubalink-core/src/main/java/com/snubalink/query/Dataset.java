package com.snubalink.query;

import java.util.Locale;
import java.util.Map;

/**
 * Target dataset of a query. Discriminates the backend entity, the public column alias table and
 * the strategy used to infer the owning organization.
 */
public enum Dataset {
    EVENTS("events", OrganizationStrategy.PROJECTS),
    TRANSACTIONS("transactions", OrganizationStrategy.PROJECTS),
    DISCOVER("discover", OrganizationStrategy.PROJECTS),
    SESSIONS("sessions", OrganizationStrategy.PROJECTS_WITH_ORGANIZATION),
    OUTCOMES("outcomes", OrganizationStrategy.ORGANIZATIONS),
    OUTCOMES_RAW("outcomes_raw", OrganizationStrategy.ORGANIZATIONS);

    private final String value;
    private final OrganizationStrategy organizationStrategy;

    Dataset(String value, OrganizationStrategy organizationStrategy) {
        this.value = value;
        this.organizationStrategy = organizationStrategy;
    }

    /** Name used on the wire, both as the legacy {@code dataset} field and in {@code /{dataset}/snql}. */
    public String value() {
        return value;
    }

    /** Entity matched by a structured query. Every dataset currently reads its namesake entity. */
    public String entity() {
        return value;
    }

    public OrganizationStrategy organizationStrategy() {
        return organizationStrategy;
    }

    public Map<String, String> aliases() {
        return DatasetColumns.aliases(this);
    }

    public boolean supportsMeasurements() {
        return aliases().containsKey(DatasetColumns.MEASUREMENTS_KEY);
    }

    public boolean supportsSpanOpBreakdowns() {
        return aliases().containsKey(DatasetColumns.SPAN_OP_BREAKDOWNS_KEY);
    }

    public static Dataset fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Dataset value is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Dataset dataset : values()) {
            if (dataset.value.equals(normalized)) {
                return dataset;
            }
        }
        throw new IllegalArgumentException("Unsupported dataset: " + value);
    }

    /** How a query against the dataset is tied to exactly one organization. */
    public enum OrganizationStrategy {
        /** Inferred through the queried projects. */
        PROJECTS,
        /** Inferred through the queried projects, and the organization id is sent as well. */
        PROJECTS_WITH_ORGANIZATION,
        /** Given as {@code org_id}, or inferred from {@code project_id} or {@code key_id}. */
        ORGANIZATIONS
    }
}
