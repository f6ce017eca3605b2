package com.snubalink.service.core.health;

import com.snubalink.query.Dataset;
import com.snubalink.query.SnubaQueryParams;
import com.snubalink.query.condition.Condition;
import com.snubalink.service.core.cache.TimeQuantizer;
import com.snubalink.service.core.query.SnubaQueryService;
import com.snubalink.service.core.response.SnubaResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Crash-free rates and per-release session overviews computed from the sessions dataset. */
@Slf4j
@RequiredArgsConstructor
public class ReleaseHealth {

    static final String REFERRER = "sessions.release-health-overview";
    static final List<String> OVERVIEW_COLUMNS = List.of(
            "release",
            "project_id",
            "duration_quantiles",
            "sessions",
            "sessions_errored",
            "sessions_crashed",
            "sessions_abnormal",
            "users",
            "users_crashed");

    private final SnubaQueryService queries;
    private final TimeQuantizer quantizer;
    private final Clock clock;

    /** Percentage of sessions (or users) that did not crash, or null when there were none. */
    public static Double crashFreeRate(long total, long crashed) {
        if (total == 0) {
            return null;
        }
        return 100 - (double) crashed / total * 100;
    }

    /**
     * Health of each release over the trailing {@code window}. Pairs without any sessions are absent
     * from the result.
     */
    public Map<ProjectRelease, Overview> overview(Set<ProjectRelease> releases, Duration window) {
        if (releases.isEmpty()) {
            return Map.of();
        }
        Set<Long> projectIds = new LinkedHashSet<>();
        Set<String> versions = new LinkedHashSet<>();
        releases.forEach(r -> {
            projectIds.add(r.projectId());
            versions.add(r.release());
        });

        // quantized so that repeated overviews of the same projects share a cache entry
        Instant end = quantizer.quantize(clock.instant(), Objects.hash(projectIds.toArray()));
        SnubaQueryParams.Builder params = SnubaQueryParams.builder(Dataset.SESSIONS)
                .start(end.minus(window))
                .end(end)
                .groupby("release", "project_id")
                .filter("project_id", projectIds)
                .condition(Condition.in("release", new ArrayList<>(versions)))
                .referrer(REFERRER);
        OVERVIEW_COLUMNS.forEach(params::selectColumn);
        SnubaResult result = queries.rawQuery(params.build(), true);

        Map<ProjectRelease, Overview> out = new LinkedHashMap<>();
        for (Map<String, Object> row : result.data()) {
            Number projectId = (Number) row.get("project_id");
            ProjectRelease key = new ProjectRelease(projectId.longValue(), String.valueOf(row.get("release")));
            if (!releases.contains(key)) {
                continue;
            }
            out.put(key, Overview.fromRow(row));
        }
        log.debug("Release health overview releases={} withData={}", releases.size(), out.size());
        return out;
    }

    public record ProjectRelease(long projectId, String release) {}

    /** Durations are in seconds. */
    public record Overview(
            Double durationP50,
            Double durationP90,
            Double crashFreeUsers,
            Double crashFreeSessions,
            long totalUsers,
            long totalSessions,
            long sessionsCrashed,
            long sessionsErrored,
            boolean hasHealthData) {

        static Overview fromRow(Map<String, Object> row) {
            long sessions = count(row, "sessions");
            long crashed = count(row, "sessions_crashed");
            long users = count(row, "users");
            List<?> quantiles = row.get("duration_quantiles") instanceof List<?> list ? list : List.of();
            // errored sessions are counted again as crashed or abnormal
            long errored = Math.max(0, count(row, "sessions_errored") - crashed - count(row, "sessions_abnormal"));
            return new Overview(
                    seconds(quantiles, 0),
                    seconds(quantiles, 1),
                    crashFreeRate(users, count(row, "users_crashed")),
                    crashFreeRate(sessions, crashed),
                    users,
                    sessions,
                    crashed,
                    errored,
                    true);
        }

        private static long count(Map<String, Object> row, String column) {
            return row.get(column) instanceof Number n ? n.longValue() : 0L;
        }

        private static Double seconds(List<?> quantiles, int index) {
            if (index >= quantiles.size() || !(quantiles.get(index) instanceof Number n)) {
                return null;
            }
            double millis = n.doubleValue();
            return Double.isNaN(millis) ? null : millis / 1000.0;
        }
    }
}
