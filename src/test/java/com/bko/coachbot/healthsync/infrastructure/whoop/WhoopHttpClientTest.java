package com.bko.coachbot.healthsync.infrastructure.whoop;

import com.bko.coachbot.healthsync.MetricType;
import com.bko.coachbot.healthsync.app.TokenRejectedException;
import com.bko.coachbot.healthsync.app.WearablePage;
import com.bko.coachbot.healthsync.app.WearableRecord;
import com.bko.coachbot.healthsync.app.WearableStream;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.Deadline;
import com.bko.coachbot.shared.ErrorKind;
import com.bko.coachbot.shared.HttpResult;
import com.bko.coachbot.shared.TestSettings;
import com.bko.coachbot.vault.AccessToken;
import org.apache.hc.client5.http.fluent.Request;
import org.apache.hc.client5.http.fluent.Response;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.MockedStatic;
import org.mockito.Mockito;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WhoopHttpClientTest {
    private static final AccessToken TOKEN = new AccessToken("access-1", Instant.parse("2025-01-10T09:00:00Z"));
    private static final Instant SINCE = Instant.parse("2025-01-03T08:00:00Z");

    @Test
    void parsesSleepPageAndRequestsFromTheCursor() throws Exception {
        String body = "{\"records\":["
                + "{\"id\":93845,\"start\":\"2025-01-09T22:41:00Z\",\"score_state\":\"SCORED\","
                + "\"score\":{\"sleep_performance_percentage\":98,\"sleep_efficiency_percentage\":91.7,"
                + "\"stage_summary\":{\"total_in_bed_time_milli\":30272735,\"total_rem_sleep_time_milli\":5409090,"
                + "\"total_slow_wave_sleep_time_milli\":6630370}}},"
                + "{\"id\":93846,\"start\":\"2025-01-10T13:00:00Z\",\"score_state\":\"PENDING_SCORE\"}"
                + "],\"next_token\":\"MTIzOjEyMzEyMw\"}";
        Request request = requestReturning(new HttpResult(200, body, null));

        try (MockedStatic<Request> mocked = Mockito.mockStatic(Request.class)) {
            mocked.when(() -> Request.get(any(URI.class))).thenReturn(request);

            WearablePage page = client().fetchPage(WearableStream.SLEEP, TOKEN, SINCE, null, deadline());

            assertEquals(2, page.records().size());
            assertTrue(page.hasMore());
            assertEquals("MTIzOjEyMzEyMw", page.nextToken());

            WearableRecord scored = page.records().get(0);
            assertEquals("sleep-93845", scored.id());
            assertEquals(Instant.parse("2025-01-09T22:41:00Z"), scored.recordedAt());
            assertTrue(scored.scored());
            assertEquals(98.0, scored.metrics().get(MetricType.SLEEP_PERFORMANCE));
            assertEquals(30272735.0, scored.metrics().get(MetricType.SLEEP_IN_BED));

            WearableRecord pending = page.records().get(1);
            assertFalse(pending.scored());
            assertTrue(pending.metrics().isEmpty());

            ArgumentCaptor<URI> uri = ArgumentCaptor.forClass(URI.class);
            mocked.verify(() -> Request.get(uri.capture()));
            assertTrue(uri.getValue().toString().startsWith("https://api.prod.whoop.com/developer/v1/activity/sleep?"));
            assertTrue(uri.getValue().getQuery().contains("start=2025-01-03T08:00:00Z"));
            assertFalse(uri.getValue().getQuery().contains("nextToken"));
            verify(request).addHeader("Authorization", "Bearer access-1");
        }
    }

    @Test
    void recoveryUsesCycleIdAndPassesContinuationToken() throws Exception {
        String body = "{\"records\":[{\"cycle_id\":93845,\"sleep_id\":10235,\"created_at\":\"2025-01-10T07:25:44Z\","
                + "\"score_state\":\"SCORED\",\"score\":{\"recovery_score\":44,\"resting_heart_rate\":64,"
                + "\"hrv_rmssd_milli\":31.81}}],\"next_token\":null}";
        Request request = requestReturning(new HttpResult(200, body, null));

        try (MockedStatic<Request> mocked = Mockito.mockStatic(Request.class)) {
            mocked.when(() -> Request.get(any(URI.class))).thenReturn(request);

            WearablePage page = client().fetchPage(WearableStream.RECOVERY, TOKEN, SINCE, "page-2", deadline());

            assertFalse(page.hasMore());
            assertNull(page.nextToken());
            WearableRecord record = page.records().get(0);
            assertEquals("recovery-93845", record.id());
            assertEquals(31.81, record.metrics().get(MetricType.HRV_RMSSD));

            ArgumentCaptor<URI> uri = ArgumentCaptor.forClass(URI.class);
            mocked.verify(() -> Request.get(uri.capture()));
            assertTrue(uri.getValue().getQuery().contains("nextToken=page-2"));
        }
    }

    @Test
    void skipsRecordsWithoutTimestamp() throws Exception {
        String body = "{\"records\":[{\"id\":1,\"score_state\":\"SCORED\",\"score\":{\"strain\":8.2}},"
                + "{\"id\":2,\"start\":\"2025-01-09T17:00:00Z\",\"score_state\":\"SCORED\",\"score\":{\"strain\":12.5}}]}";

        Request request = requestReturning(new HttpResult(200, body, null));
        try (MockedStatic<Request> mocked = Mockito.mockStatic(Request.class)) {
            mocked.when(() -> Request.get(any(URI.class))).thenReturn(request);

            WearablePage page = client().fetchPage(WearableStream.WORKOUT, TOKEN, SINCE, null, deadline());

            assertEquals(1, page.records().size());
            assertEquals("workout-2", page.records().get(0).id());
            assertEquals(12.5, page.records().get(0).metrics().get(MetricType.WORKOUT_STRAIN));
        }
    }

    @Test
    void unauthorizedRaisesTokenRejected() throws Exception {
        Request request = requestReturning(new HttpResult(401, "", null));
        try (MockedStatic<Request> mocked = Mockito.mockStatic(Request.class)) {
            mocked.when(() -> Request.get(any(URI.class))).thenReturn(request);

            TokenRejectedException thrown = assertThrows(TokenRejectedException.class,
                    () -> client().fetchPage(WearableStream.SLEEP, TOKEN, SINCE, null, deadline()));

            assertEquals(401, thrown.getStatusCode());
        }
    }

    @Test
    void classifiesThrottlingAndServerErrors() throws Exception {
        Request throttledRequest = requestReturning(new HttpResult(429, "", "12"));
        Request failingRequest = requestReturning(new HttpResult(500, "", null));
        try (MockedStatic<Request> mocked = Mockito.mockStatic(Request.class)) {
            mocked.when(() -> Request.get(any(URI.class))).thenReturn(throttledRequest, failingRequest);

            CoachException throttled = assertThrows(CoachException.class,
                    () -> client().fetchPage(WearableStream.SLEEP, TOKEN, SINCE, null, deadline()));
            CoachException failed = assertThrows(CoachException.class,
                    () -> client().fetchPage(WearableStream.SLEEP, TOKEN, SINCE, null, deadline()));

            assertEquals(ErrorKind.RATE_LIMITED, throttled.getKind());
            assertEquals(Duration.ofSeconds(12), throttled.getRetryAfter());
            assertEquals(ErrorKind.UPSTREAM_UNAVAILABLE, failed.getKind());
            assertTrue(failed.isRetryable());
        }
    }

    private WhoopHttpClient client() {
        return new WhoopHttpClient(TestSettings.configured());
    }

    private Request requestReturning(HttpResult result) throws Exception {
        Request request = mock(Request.class, RETURNS_SELF);
        Response response = mock(Response.class);
        when(request.execute()).thenReturn(response);
        when(response.handleResponse(any())).thenReturn(result);
        return request;
    }

    private Deadline deadline() {
        return Deadline.after(Duration.ofSeconds(30), Clock.systemUTC());
    }
}
