package com.snubalink.service.core.lookup;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the relational entities a query refers to by id. Supplied by the application;
 * missing or deleted entities are reported as empty results, never as exceptions.
 */
public interface EntityLookupService {

    Optional<ProjectRef> project(long id);

    Optional<OrganizationRef> organization(long id);

    /** Environment id to name. Unknown ids are absent from the map. */
    Map<Long, String> environmentNames(Collection<Long> ids);

    /** Release id to version string. Unknown ids are absent from the map. */
    Map<Long, String> releaseVersions(Collection<Long> ids);

    Optional<GroupRef> group(long id);

    Map<Long, GroupReleaseRef> groupReleases(Collection<Long> ids);

    Optional<ProjectKeyRef> projectKey(long id);

    /** Projects a set of releases was deployed to. */
    List<Long> releaseProjectIds(Collection<Long> releaseIds);

    record ProjectRef(long id, long organizationId) {}

    /** {@code retentionDays} is null when the organization keeps data forever. */
    record OrganizationRef(long id, Integer retentionDays) {}

    record GroupRef(long id, long projectId, Instant firstSeen) {}

    record GroupReleaseRef(long id, long groupId, long releaseId) {}

    record ProjectKeyRef(long id, long projectId) {}
}
