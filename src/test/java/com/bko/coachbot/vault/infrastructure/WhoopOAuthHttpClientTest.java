package com.bko.coachbot.vault.infrastructure;

import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.Deadline;
import com.bko.coachbot.shared.ErrorKind;
import com.bko.coachbot.shared.HttpResult;
import com.bko.coachbot.shared.TestSettings;
import com.bko.coachbot.vault.app.TokenGrant;
import org.apache.hc.client5.http.fluent.Request;
import org.apache.hc.client5.http.fluent.Response;
import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;
import org.mockito.Mockito;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WhoopOAuthHttpClientTest {

    @Test
    void refreshParsesRotatedGrant() throws Exception {
        HttpResult result = new HttpResult(200,
                "{\"access_token\":\"access-2\",\"refresh_token\":\"refresh-2\",\"expires_in\":1800,\"scope\":\"offline\"}",
                null);

        Request request = requestReturning(result);
        try (MockedStatic<Request> mocked = Mockito.mockStatic(Request.class)) {
            mocked.when(() -> Request.post(WhoopOAuthHttpClient.TOKEN_URL)).thenReturn(request);

            TokenGrant grant = new WhoopOAuthHttpClient(TestSettings.configured()).refresh("refresh-1", deadline());

            assertEquals("access-2", grant.accessToken());
            assertEquals("refresh-2", grant.refreshToken());
            assertEquals(1800, grant.expiresInSeconds());
            assertEquals("offline", grant.scope());
        }
    }

    @Test
    void invalidGrantNeedsReauthorization() throws Exception {
        HttpResult result = new HttpResult(400, "{\"error\":\"invalid_grant\"}", null);

        Request request = requestReturning(result);
        try (MockedStatic<Request> mocked = Mockito.mockStatic(Request.class)) {
            mocked.when(() -> Request.post(anyString())).thenReturn(request);

            CoachException thrown = assertThrows(CoachException.class,
                    () -> new WhoopOAuthHttpClient(TestSettings.configured()).refresh("revoked", deadline()));

            assertEquals(ErrorKind.AUTH_EXPIRED, thrown.getKind());
            assertFalse(thrown.isRetryable());
            assertTrue(thrown.getMessage().contains("invalid_grant"));
        }
    }

    @Test
    void serverErrorIsRetryable() throws Exception {
        HttpResult result = new HttpResult(503, "unavailable", null);

        Request request = requestReturning(result);
        try (MockedStatic<Request> mocked = Mockito.mockStatic(Request.class)) {
            mocked.when(() -> Request.post(anyString())).thenReturn(request);

            CoachException thrown = assertThrows(CoachException.class,
                    () -> new WhoopOAuthHttpClient(TestSettings.configured()).exchangeCode("code", "https://x/cb", deadline()));

            assertEquals(ErrorKind.UPSTREAM_UNAVAILABLE, thrown.getKind());
        }
    }

    @Test
    void rateLimitCarriesRetryAfter() throws Exception {
        HttpResult result = new HttpResult(429, "", "7");

        Request request = requestReturning(result);
        try (MockedStatic<Request> mocked = Mockito.mockStatic(Request.class)) {
            mocked.when(() -> Request.post(anyString())).thenReturn(request);

            CoachException thrown = assertThrows(CoachException.class,
                    () -> new WhoopOAuthHttpClient(TestSettings.configured()).refresh("refresh-1", deadline()));

            assertEquals(ErrorKind.RATE_LIMITED, thrown.getKind());
            assertEquals(Duration.ofSeconds(7), thrown.getRetryAfter());
        }
    }

    @Test
    void missingAccessTokenIsUpstreamFailure() throws Exception {
        HttpResult result = new HttpResult(200, "{\"token_type\":\"bearer\"}", null);

        Request request = requestReturning(result);
        try (MockedStatic<Request> mocked = Mockito.mockStatic(Request.class)) {
            mocked.when(() -> Request.post(anyString())).thenReturn(request);

            CoachException thrown = assertThrows(CoachException.class,
                    () -> new WhoopOAuthHttpClient(TestSettings.configured()).refresh("refresh-1", deadline()));

            assertEquals(ErrorKind.UPSTREAM_UNAVAILABLE, thrown.getKind());
        }
    }

    @Test
    void authorizationUrlCarriesStateAndScopes() {
        URI url = new WhoopOAuthHttpClient(TestSettings.configured())
                .authorizationUrl("state-1", TestSettings.SERVICE_URL + "/whoop/callback");

        String query = url.getQuery();
        assertTrue(url.toString().startsWith(WhoopOAuthHttpClient.AUTH_URL));
        assertTrue(query.contains("state=state-1"));
        assertTrue(query.contains("client_id=whoop-id"));
        assertTrue(query.contains("offline"));
        assertTrue(query.contains("redirect_uri=" + TestSettings.SERVICE_URL + "/whoop/callback"));
    }

    @Test
    void unconfiguredClientFailsWithoutCallingWhoop() {
        try (MockedStatic<Request> mocked = Mockito.mockStatic(Request.class)) {
            CoachException thrown = assertThrows(CoachException.class,
                    () -> new WhoopOAuthHttpClient(TestSettings.unconfigured()).refresh("refresh-1", deadline()));

            assertEquals(ErrorKind.AUTH_EXPIRED, thrown.getKind());
            mocked.verifyNoInteractions();
        }
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
