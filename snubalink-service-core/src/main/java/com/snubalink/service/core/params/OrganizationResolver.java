package com.snubalink.service.core.params;

import com.snubalink.query.Dataset;
import com.snubalink.query.SnubaQueryParams;
import com.snubalink.query.condition.Comparison;
import com.snubalink.query.condition.Condition;
import com.snubalink.query.condition.Expression;
import com.snubalink.query.condition.Membership;
import com.snubalink.query.condition.Operator;
import com.snubalink.query.exception.UnqualifiedQueryException;
import com.snubalink.service.core.lookup.EntityLookupService;
import com.snubalink.service.core.lookup.EntityLookupService.GroupRef;
import com.snubalink.service.core.lookup.EntityLookupService.ProjectKeyRef;
import com.snubalink.service.core.lookup.EntityLookupService.ProjectRef;
import com.snubalink.service.core.lookup.LookupIds;
import com.snubalink.service.core.translate.SnubaTranslatorFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Ties a query to exactly one organization, following the strategy of its dataset. */
@Slf4j
@RequiredArgsConstructor
public class OrganizationResolver {

    public static final String PROJECT_ID = "project_id";
    public static final String GROUP_ID = "group_id";
    public static final String ORG_ID = "org_id";
    public static final String KEY_ID = "key_id";

    private final EntityLookupService lookup;

    public OrganizationScope resolve(SnubaQueryParams params) {
        Dataset dataset = params.getDataset();
        switch (dataset.organizationStrategy()) {
            case PROJECTS:
                return forProjects(params, false);
            case PROJECTS_WITH_ORGANIZATION:
                return forProjects(params, true);
            case ORGANIZATIONS:
                return forOrganizations(params);
            default:
                throw new UnqualifiedQueryException(
                        "No strategy found for getting an organization for the given dataset.");
        }
    }

    private OrganizationScope forProjects(SnubaQueryParams params, boolean sendOrganization) {
        Map<String, List<Object>> filterKeys = params.getFilterKeys();
        List<Long> projectIds = LookupIds.distinct(filterKeys.get(PROJECT_ID));
        if (projectIds.isEmpty()) {
            projectIds = relatedProjectIds(params);
        }
        if (projectIds.isEmpty()) {
            projectIds = projectIdsFromConditions(params.getConditions());
        }
        if (projectIds.isEmpty()) {
            throw new UnqualifiedQueryException(
                    "No project_id filter, or none could be inferred from other filters.");
        }
        for (Long projectId : projectIds) {
            Optional<ProjectRef> project = lookup.project(projectId);
            if (project.isPresent()) {
                return new OrganizationScope(project.get().organizationId(), projectIds, sendOrganization);
            }
            log.debug("Project {} no longer exists, trying the next candidate", projectId);
        }
        throw new UnqualifiedQueryException("All project_ids from the filter no longer exist");
    }

    private OrganizationScope forOrganizations(SnubaQueryParams params) {
        Map<String, List<Object>> filterKeys = params.getFilterKeys();
        List<Long> orgIds = LookupIds.distinct(filterKeys.get(ORG_ID));
        if (!orgIds.isEmpty()) {
            return new OrganizationScope(orgIds.get(0), List.of(), true);
        }
        for (Long projectId : LookupIds.distinct(filterKeys.get(PROJECT_ID))) {
            Optional<ProjectRef> project = lookup.project(projectId);
            if (project.isPresent()) {
                return new OrganizationScope(project.get().organizationId(), List.of(), true);
            }
        }
        List<Long> keyIds = LookupIds.distinct(filterKeys.get(KEY_ID));
        if (!keyIds.isEmpty()) {
            Optional<ProjectRef> project =
                    lookup.projectKey(keyIds.get(0)).map(ProjectKeyRef::projectId).flatMap(lookup::project);
            if (project.isPresent()) {
                return new OrganizationScope(project.get().organizationId(), List.of(), true);
            }
        }
        throw new UnqualifiedQueryException("No organization_id filter, or none could be inferred from other filters.");
    }

    /** Projects of the first filter key that points at project-owned entities. */
    private List<Long> relatedProjectIds(SnubaQueryParams params) {
        for (Map.Entry<String, List<Object>> entry : params.getFilterKeys().entrySet()) {
            List<Long> ids = LookupIds.distinct(entry.getValue());
            if (ids.isEmpty()) {
                continue;
            }
            if (GROUP_ID.equals(entry.getKey())) {
                List<Long> projectIds = new ArrayList<>();
                for (Long groupId : ids) {
                    lookup.group(groupId).map(GroupRef::projectId).ifPresent(projectIds::add);
                }
                return LookupIds.distinct(projectIds);
            }
            // group-release filters carry group-release ids, not release ids
            if (SnubaTranslatorFactory.RELEASE.equals(entry.getKey()) && !params.isGroupRelease()) {
                return LookupIds.distinct(lookup.releaseProjectIds(ids));
            }
        }
        return List.of();
    }

    private static List<Long> projectIdsFromConditions(List<Condition> conditions) {
        for (Condition condition : conditions) {
            if (condition instanceof Comparison c
                    && isProjectColumn(c.lhs())
                    && c.operator() == Operator.EQ
                    && c.value() != null) {
                return LookupIds.distinct(List.of(c.value()));
            }
            if (condition instanceof Membership m && isProjectColumn(m.lhs()) && !m.negated()) {
                return LookupIds.distinct(m.values());
            }
        }
        return List.of();
    }

    private static boolean isProjectColumn(Expression expression) {
        return expression instanceof Expression.Column column && PROJECT_ID.equals(column.name());
    }
}
