package com.snubalink.service.core.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.snubalink.query.Dataset;
import com.snubalink.query.SnubaQueryParams;
import com.snubalink.service.core.cache.TimeQuantizer;
import com.snubalink.service.core.health.ReleaseHealth.Overview;
import com.snubalink.service.core.health.ReleaseHealth.ProjectRelease;
import com.snubalink.service.core.query.SnubaQueryService;
import com.snubalink.service.core.response.SnubaResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class ReleaseHealthTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:34:56Z");

    @Mock
    private SnubaQueryService queries;

    private ReleaseHealth health;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        health = new ReleaseHealth(
                queries, new TimeQuantizer(Duration.ofMinutes(10)), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void crashFreeRateIsAPercentage() {
        assertEquals(96.0, ReleaseHealth.crashFreeRate(100, 4), 1e-9);
        assertEquals(100.0, ReleaseHealth.crashFreeRate(7, 0), 1e-9);
        assertEquals(66.666, ReleaseHealth.crashFreeRate(3, 1), 1e-3);
        assertNull(ReleaseHealth.crashFreeRate(0, 0));
    }

    @Test
    void overviewSummarizesRequestedReleases() {
        when(queries.rawQuery(any(), eq(true)))
                .thenReturn(new SnubaResult(
                        List.of(
                                row("1.0", 1, List.of(1500, 9000), 100, 10, 4, 1, 20, 1),
                                row("1.0", 2, List.of(100, 200), 50, 0, 0, 0, 5, 0)),
                        List.of(),
                        null));
        ProjectRelease requested = new ProjectRelease(1, "1.0");
        ProjectRelease silent = new ProjectRelease(1, "2.0");

        Map<ProjectRelease, Overview> overview = health.overview(Set.of(requested, silent), Duration.ofDays(1));

        assertEquals(Set.of(requested), overview.keySet());
        Overview o = overview.get(requested);
        assertEquals(1.5, o.durationP50(), 1e-9);
        assertEquals(9.0, o.durationP90(), 1e-9);
        assertEquals(96.0, o.crashFreeSessions(), 1e-9);
        assertEquals(95.0, o.crashFreeUsers(), 1e-9);
        assertEquals(100, o.totalSessions());
        assertEquals(20, o.totalUsers());
        assertEquals(4, o.sessionsCrashed());
        assertEquals(5, o.sessionsErrored());
        assertTrue(o.hasHealthData());
    }

    @Test
    void overviewQueriesSessionsOverTheWindow() {
        when(queries.rawQuery(any(), eq(true))).thenReturn(SnubaResult.empty());

        health.overview(Set.of(new ProjectRelease(1, "1.0")), Duration.ofDays(1));

        ArgumentCaptor<SnubaQueryParams> captor = ArgumentCaptor.forClass(SnubaQueryParams.class);
        verify(queries).rawQuery(captor.capture(), eq(true));
        SnubaQueryParams params = captor.getValue();
        assertEquals(Dataset.SESSIONS, params.getDataset());
        assertEquals(Duration.ofDays(1), Duration.between(params.getStart(), params.getEnd()));
        assertTrue(!params.getEnd().isAfter(NOW.plus(Duration.ofMinutes(10))));
        assertEquals(List.of("release", "project_id"), params.getGroupby());
        assertEquals(List.of(1L), params.getFilterKeys().get("project_id"));
        assertEquals(ReleaseHealth.REFERRER, params.getReferrer());
    }

    @Test
    void noReleasesSkipTheQuery() {
        assertTrue(health.overview(Set.of(), Duration.ofDays(1)).isEmpty());
        verifyNoInteractions(queries);
    }

    @Test
    void overviewWithoutQuantilesHasNoDurations() {
        Map<String, Object> row = row("1.0", 1, List.of(), 0, 0, 0, 0, 0, 0);

        Overview o = Overview.fromRow(row);

        assertNull(o.durationP50());
        assertNull(o.crashFreeSessions());
        assertEquals(0, o.sessionsErrored());
    }

    private static Map<String, Object> row(
            String release,
            long projectId,
            List<Integer> quantiles,
            long sessions,
            long errored,
            long crashed,
            long abnormal,
            long users,
            long usersCrashed) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("release", release);
        row.put("project_id", projectId);
        row.put("duration_quantiles", quantiles);
        row.put("sessions", sessions);
        row.put("sessions_errored", errored);
        row.put("sessions_crashed", crashed);
        row.put("sessions_abnormal", abnormal);
        row.put("users", users);
        row.put("users_crashed", usersCrashed);
        return row;
    }
}
