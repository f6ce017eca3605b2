package com.snubalink.service.core.params;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The organization a query runs for, and the projects it was inferred from (empty for
 * organization-based datasets).
 */
public record OrganizationScope(long organizationId, List<Long> projectIds, boolean sendOrganization) {

    public OrganizationScope {
        projectIds = projectIds == null ? List.of() : List.copyOf(projectIds);
    }

    /** {@code project} and {@code organization} fields of the legacy query body. */
    public Map<String, Object> bodyFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (!projectIds.isEmpty()) {
            fields.put("project", projectIds);
        }
        if (sendOrganization) {
            fields.put("organization", organizationId);
        }
        return fields;
    }
}
