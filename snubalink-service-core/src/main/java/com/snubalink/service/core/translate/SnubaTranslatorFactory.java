package com.snubalink.service.core.translate;

import com.snubalink.query.SnubaQueryParams;
import com.snubalink.service.core.lookup.EntityLookupService;
import com.snubalink.service.core.lookup.EntityLookupService.GroupReleaseRef;
import com.snubalink.service.core.lookup.LookupIds;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the translators for one query from its filter keys. Environment and release filters are
 * given as ids but stored by name, so they are looked up once here.
 */
@Slf4j
@RequiredArgsConstructor
public class SnubaTranslatorFactory {

    public static final String ENVIRONMENT = "environment";
    public static final String RELEASE = "tags[sentry:release]";
    /** Result column carrying the group id in group-release queries. */
    public static final String ISSUE = "issue";

    private final EntityLookupService lookup;

    public SnubaTranslators build(SnubaQueryParams params) {
        Map<String, List<Object>> filterKeys = params.getFilterKeys();
        SnubaTranslators translators = SnubaTranslators.identity();

        List<Long> environmentIds = LookupIds.distinct(filterKeys.get(ENVIRONMENT));
        if (!environmentIds.isEmpty()) {
            Map<Long, Object> names = new HashMap<>();
            lookup.environmentNames(environmentIds)
                    .forEach((id, name) -> names.put(id, name == null || name.isEmpty() ? null : name));
            translators = byId(translators, ENVIRONMENT, names);
        }

        List<Long> releaseIds = LookupIds.distinct(filterKeys.get(RELEASE));
        if (!releaseIds.isEmpty()) {
            translators = params.isGroupRelease()
                    ? groupRelease(translators, releaseIds)
                    : byId(translators, RELEASE, new HashMap<>(lookup.releaseVersions(releaseIds)));
        }
        return translators;
    }

    private static SnubaTranslators byId(SnubaTranslators translators, String column, Map<Long, Object> forwardMap) {
        Map<Object, Long> reverseMap = new HashMap<>();
        forwardMap.forEach((id, value) -> reverseMap.put(value, id));
        return translators
                .withForward(filters -> {
                    filters.computeIfPresent(column, (key, ids) -> mapIds(column, ids, forwardMap));
                    return filters;
                })
                .withReverse(row -> {
                    if (row.containsKey(column)) {
                        Object value = row.get(column);
                        Long id = reverseMap.get(value);
                        row.put(column, id != null ? id : value);
                    }
                    return row;
                });
    }

    /**
     * Group-release filters hold group-release ids. They are sent as release versions, and a row is
     * mapped back through its group id and version. When two group-release ids share a group and
     * version, the one looked up last wins.
     */
    private SnubaTranslators groupRelease(SnubaTranslators translators, List<Long> groupReleaseIds) {
        Map<Long, GroupReleaseRef> groupReleases = lookup.groupReleases(groupReleaseIds);
        List<Long> releaseIds = new ArrayList<>();
        groupReleases.values().forEach(ref -> releaseIds.add(ref.releaseId()));
        Map<Long, String> versions = releaseIds.isEmpty() ? Map.of() : lookup.releaseVersions(releaseIds);

        Map<Long, Object> forwardMap = new HashMap<>();
        Map<GroupVersion, Long> reverseMap = new HashMap<>();
        for (Long id : groupReleaseIds) {
            GroupReleaseRef ref = groupReleases.get(id);
            if (ref == null) {
                continue;
            }
            String version = versions.get(ref.releaseId());
            forwardMap.put(id, version);
            reverseMap.put(new GroupVersion(ref.groupId(), version), id);
        }
        return translators
                .withForward(filters -> {
                    filters.computeIfPresent(RELEASE, (key, ids) -> mapIds(RELEASE, ids, forwardMap));
                    return filters;
                })
                .withReverse(row -> {
                    if (row.containsKey(RELEASE)) {
                        Object value = row.get(RELEASE);
                        GroupVersion key = new GroupVersion(
                                LookupIds.toLong(row.get(ISSUE)), value == null ? null : value.toString());
                        Long id = reverseMap.get(key);
                        row.put(RELEASE, id != null ? id : value);
                    }
                    return row;
                });
    }

    /** Falsy ids (null, zero) are dropped, as are ids the lookup did not know. */
    private static List<Object> mapIds(String column, List<Object> ids, Map<Long, Object> forwardMap) {
        List<Object> mapped = new ArrayList<>(ids.size());
        for (Object raw : ids) {
            Long id = LookupIds.toLong(raw);
            if (id == null || id == 0L) {
                continue;
            }
            if (!forwardMap.containsKey(id)) {
                log.warn("No {} found for id {}, dropping it from the filter", column, id);
                continue;
            }
            mapped.add(forwardMap.get(id));
        }
        return mapped;
    }

    record GroupVersion(Long groupId, String version) {}
}
