package com.bko.coachbot.vault.app;

import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.Deadline;
import com.bko.coachbot.shared.ErrorKind;
import com.bko.coachbot.shared.MutableClock;
import com.bko.coachbot.shared.TestSettings;
import com.bko.coachbot.vault.AccessToken;
import com.bko.coachbot.vault.AuthorizationLink;
import com.bko.coachbot.vault.infrastructure.InMemoryOAuthStateStore;
import com.bko.coachbot.vault.infrastructure.InMemoryTokenStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TokenVaultServiceTest {
    private static final String USER = "1001";

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-10T07:00:00Z"));
    private InMemoryTokenStore tokenStore;
    private InMemoryOAuthStateStore stateStore;
    private OAuthTokenClient oauthClient;
    private TokenVaultService vault;

    @BeforeEach
    void setUp() {
        tokenStore = new InMemoryTokenStore();
        stateStore = new InMemoryOAuthStateStore();
        oauthClient = mock(OAuthTokenClient.class);
        vault = new TokenVaultService(tokenStore, stateStore, oauthClient, TestSettings.configured(), clock);
    }

    @Test
    void returnsStoredTokenWhileOutsideTheSafetyMargin() {
        tokenStore.save(new TokenRecord(USER, "access-1", "refresh-1", clock.instant().plusSeconds(600), "offline", 1));

        AccessToken token = vault.getValidToken(USER, deadline());

        assertEquals("access-1", token.value());
        verify(oauthClient, never()).refresh(anyString(), any());
    }

    @Test
    void refreshesTokenThatExpiresWithinTheMargin() {
        tokenStore.save(new TokenRecord(USER, "access-1", "refresh-1", clock.instant().plusSeconds(30), "offline", 1));
        when(oauthClient.refresh(eq("refresh-1"), any())).thenReturn(new TokenGrant("access-2", "refresh-2", 3600, null));

        AccessToken token = vault.getValidToken(USER, deadline());

        assertEquals("access-2", token.value());
        TokenRecord stored = tokenStore.find(USER).orElseThrow();
        assertEquals("refresh-2", stored.refreshToken());
        assertEquals(2, stored.version());
        assertEquals("offline", stored.scope());
        assertEquals(clock.instant().plusSeconds(3600), stored.expiresAt());
    }

    @Test
    void concurrentCallersShareOneRefresh() throws Exception {
        tokenStore.save(new TokenRecord(USER, "expired", "refresh-1", clock.instant().minusSeconds(5), "offline", 1));
        CountDownLatch refreshing = new CountDownLatch(1);
        when(oauthClient.refresh(eq("refresh-1"), any())).thenAnswer(invocation -> {
            refreshing.countDown();
            Thread.sleep(200);
            return new TokenGrant("fresh", "refresh-2", 3600, "offline");
        });

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AccessToken>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                Callable<AccessToken> call = () -> {
                    start.await();
                    return vault.getValidToken(USER, deadline());
                };
                results.add(pool.submit(call));
            }
            start.countDown();
            for (Future<AccessToken> result : results) {
                assertEquals("fresh", result.get(5, TimeUnit.SECONDS).value());
            }
        } finally {
            pool.shutdownNow();
        }

        assertTrue(refreshing.await(1, TimeUnit.SECONDS));
        verify(oauthClient, times(1)).refresh(anyString(), any());
        assertEquals(2, tokenStore.find(USER).orElseThrow().version());
    }

    @Test
    void invalidGrantIsTerminalAndKeepsTheStoredRecord() {
        tokenStore.save(new TokenRecord(USER, "expired", "revoked", clock.instant().minusSeconds(5), "offline", 3));
        when(oauthClient.refresh(eq("revoked"), any()))
                .thenThrow(new CoachException(ErrorKind.AUTH_EXPIRED, "Whoop auth error: HTTP 400 invalid_grant"));

        CoachException thrown = assertThrows(CoachException.class, () -> vault.getValidToken(USER, deadline()));

        assertEquals(ErrorKind.AUTH_EXPIRED, thrown.getKind());
        assertFalse(thrown.isRetryable());
        verify(oauthClient, times(1)).refresh(anyString(), any());
        assertEquals(3, tokenStore.find(USER).orElseThrow().version());
    }

    @Test
    void invalidGrantAfterRotationElsewhereUsesTheStoredToken() {
        tokenStore.save(new TokenRecord(USER, "expired", "refresh-1", clock.instant().minusSeconds(5), "offline", 1));
        when(oauthClient.refresh(eq("refresh-1"), any())).thenAnswer(invocation -> {
            // another instance refreshed first and rotated the refresh token
            tokenStore.save(new TokenRecord(USER, "other-instance", "refresh-2", clock.instant().plusSeconds(3600), "offline", 2));
            throw new CoachException(ErrorKind.AUTH_EXPIRED, "invalid_grant");
        });

        AccessToken token = vault.getValidToken(USER, deadline());

        assertEquals("other-instance", token.value());
    }

    @Test
    void upstreamFailureDuringRefreshStaysRetryable() {
        tokenStore.save(new TokenRecord(USER, "expired", "refresh-1", clock.instant().minusSeconds(5), "offline", 1));
        when(oauthClient.refresh(eq("refresh-1"), any()))
                .thenThrow(new CoachException(ErrorKind.UPSTREAM_UNAVAILABLE, "HTTP 502"));

        CoachException thrown = assertThrows(CoachException.class, () -> vault.getValidToken(USER, deadline()));

        assertTrue(thrown.isRetryable());
    }

    @Test
    void unlinkedUserNeedsAuthorization() {
        CoachException thrown = assertThrows(CoachException.class, () -> vault.getValidToken("nobody", deadline()));

        assertEquals(ErrorKind.AUTH_EXPIRED, thrown.getKind());
    }

    @Test
    void rejectedTokenIsRefreshedOnceAndReusedByLaterRejections() {
        tokenStore.save(new TokenRecord(USER, "access-1", "refresh-1", clock.instant().plusSeconds(3000), "offline", 1));
        when(oauthClient.refresh(eq("refresh-1"), any())).thenReturn(new TokenGrant("access-2", "refresh-2", 3600, null));
        AccessToken rejected = new AccessToken("access-1", clock.instant().plusSeconds(3000));

        assertEquals("access-2", vault.refreshAfterRejection(USER, rejected, deadline()).value());
        assertEquals("access-2", vault.refreshAfterRejection(USER, rejected, deadline()).value());

        verify(oauthClient, times(1)).refresh(anyString(), any());
    }

    @Test
    void authorizationCodeFlowStoresTokensForTheStateOwner() {
        when(oauthClient.authorizationUrl(anyString(), eq(TestSettings.SERVICE_URL + "/whoop/callback")))
                .thenReturn(URI.create("https://api.prod.whoop.com/oauth/oauth2/auth?state=x"));
        when(oauthClient.exchangeCode(eq("code-1"), eq(TestSettings.SERVICE_URL + "/whoop/callback"), any()))
                .thenReturn(new TokenGrant("access-1", "refresh-1", 3600, "offline read:sleep"));

        AuthorizationLink link = vault.beginAuthorization(USER);
        String owner = vault.completeAuthorization(link.state(), "code-1", deadline());

        assertEquals(USER, owner);
        assertTrue(vault.isLinked(USER));
        assertEquals(1, tokenStore.find(USER).orElseThrow().version());

        CoachException replayed = assertThrows(CoachException.class,
                () -> vault.completeAuthorization(link.state(), "code-1", deadline()));
        assertEquals(ErrorKind.VALIDATION_FAILED, replayed.getKind());
    }

    @Test
    void staleStateIsRejected() {
        stateStore.save("old-state", USER, clock.instant());
        clock.advance(Duration.ofMinutes(16));

        CoachException thrown = assertThrows(CoachException.class,
                () -> vault.completeAuthorization("old-state", "code", deadline()));

        assertEquals(ErrorKind.VALIDATION_FAILED, thrown.getKind());
        verify(oauthClient, never()).exchangeCode(anyString(), anyString(), any());
    }

    @Test
    void revokeRemovesTheTokens() {
        tokenStore.save(new TokenRecord(USER, "access-1", "refresh-1", clock.instant().plusSeconds(600), "offline", 1));

        vault.revoke(USER);

        assertFalse(vault.isLinked(USER));
    }

    private Deadline deadline() {
        return Deadline.after(Duration.ofSeconds(30), clock);
    }
}
