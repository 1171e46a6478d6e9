package com.bko.coachbot.vault.app;

import com.bko.coachbot.shared.AppSettings;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.Deadline;
import com.bko.coachbot.shared.ErrorKind;
import com.bko.coachbot.vault.AccessToken;
import com.bko.coachbot.vault.AuthorizationLink;
import com.bko.coachbot.vault.TokenVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

@Service
public class TokenVaultService implements TokenVault {
    private static final Logger logger = LoggerFactory.getLogger(TokenVaultService.class);
    static final Duration STATE_TTL = Duration.ofMinutes(15);

    private final TokenStore tokenStore;
    private final OAuthStateStore stateStore;
    private final OAuthTokenClient oauthClient;
    private final AppSettings settings;
    private final Clock clock;
    private final ConcurrentMap<String, CompletableFuture<TokenRecord>> inFlight = new ConcurrentHashMap<>();

    public TokenVaultService(TokenStore tokenStore,
                             OAuthStateStore stateStore,
                             OAuthTokenClient oauthClient,
                             AppSettings settings,
                             Clock clock) {
        this.tokenStore = tokenStore;
        this.stateStore = stateStore;
        this.oauthClient = oauthClient;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public AccessToken getValidToken(String userId, Deadline deadline) {
        TokenRecord current = load(userId);
        if (current.isValidAt(clock.instant(), margin())) {
            return toAccessToken(current);
        }
        return toAccessToken(refreshOnce(userId, record -> !record.isValidAt(clock.instant(), margin()), deadline));
    }

    @Override
    public AccessToken refreshAfterRejection(String userId, AccessToken rejected, Deadline deadline) {
        logger.info("Wearable API rejected the access token of user {}, refreshing", userId);
        return toAccessToken(refreshOnce(userId, record -> rejected.value().equals(record.accessToken()), deadline));
    }

    @Override
    public boolean isLinked(String userId) {
        return tokenStore.find(userId).isPresent();
    }

    @Override
    public AuthorizationLink beginAuthorization(String userId) {
        String state = UUID.randomUUID().toString();
        stateStore.save(state, userId, clock.instant());
        return new AuthorizationLink(state, oauthClient.authorizationUrl(state, redirectUri()));
    }

    @Override
    public String completeAuthorization(String state, String code, Deadline deadline) {
        OAuthStateStore.PendingAuthorization pending = stateStore.consume(state)
                .orElseThrow(() -> new CoachException(ErrorKind.VALIDATION_FAILED,
                        "Invalid or expired state. Cannot link Whoop account."));
        Instant now = clock.instant();
        if (pending.createdAt().plus(STATE_TTL).isBefore(now)) {
            throw new CoachException(ErrorKind.VALIDATION_FAILED, "Invalid or expired state. Cannot link Whoop account.");
        }

        TokenGrant grant = oauthClient.exchangeCode(code, redirectUri(), deadline);
        Optional<TokenRecord> existing = tokenStore.find(pending.userId());
        TokenRecord record = existing
                .map(previous -> new TokenRecord(pending.userId(), grant.accessToken(), grant.refreshToken(),
                        now.plusSeconds(grant.expiresInSeconds()), grant.scope(), previous.version() + 1))
                .orElseGet(() -> TokenRecord.linked(pending.userId(), grant, now));
        tokenStore.save(record);
        logger.info("Linked Whoop account for user {} (scope {})", pending.userId(), grant.scope());
        return pending.userId();
    }

    @Override
    public void revoke(String userId) {
        tokenStore.delete(userId);
        logger.info("Removed Whoop tokens of user {}", userId);
    }

    private TokenRecord refreshOnce(String userId, Predicate<TokenRecord> needsRefresh, Deadline deadline) {
        CompletableFuture<TokenRecord> mine = new CompletableFuture<>();
        CompletableFuture<TokenRecord> running = inFlight.putIfAbsent(userId, mine);
        if (running != null) {
            logger.debug("Joining in-flight token refresh of user {}", userId);
            return join(running, deadline);
        }
        try {
            // re-read: a refresh may have completed between the caller's read and taking ownership
            TokenRecord latest = load(userId);
            TokenRecord result = needsRefresh.test(latest) ? exchange(latest, deadline) : latest;
            mine.complete(result);
            return result;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(userId, mine);
        }
    }

    private TokenRecord exchange(TokenRecord latest, Deadline deadline) {
        String userId = latest.userId();
        TokenGrant grant;
        try {
            grant = oauthClient.refresh(latest.refreshToken(), deadline);
        } catch (CoachException e) {
            if (e.getKind() == ErrorKind.AUTH_EXPIRED) {
                Optional<TokenRecord> current = tokenStore.find(userId);
                if (current.isPresent() && current.get().version() != latest.version()) {
                    logger.info("Refresh grant of user {} was already rotated by another instance, using version {}",
                            userId, current.get().version());
                    return current.get();
                }
                logger.warn("Refresh grant of user {} rejected; re-authorization required", userId);
            }
            throw e;
        }

        TokenRecord refreshed = latest.refreshedWith(grant, clock.instant());
        if (!tokenStore.replace(userId, latest.version(), refreshed)) {
            TokenRecord winner = load(userId);
            logger.info("Token of user {} replaced concurrently, keeping stored version {}", userId, winner.version());
            return winner;
        }
        logger.info("Refreshed Whoop token of user {} (version {}, expires {})",
                userId, refreshed.version(), refreshed.expiresAt());
        return refreshed;
    }

    private TokenRecord join(CompletableFuture<TokenRecord> running, Deadline deadline) {
        try {
            return running.get(deadline.remaining().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new CoachException(ErrorKind.DEADLINE_EXCEEDED, "Timed out waiting for token refresh", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CoachException(ErrorKind.DEADLINE_EXCEEDED, "Interrupted waiting for token refresh", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CoachException) {
                throw (CoachException) e.getCause();
            }
            throw new CoachException(ErrorKind.UPSTREAM_UNAVAILABLE, "Token refresh failed", e.getCause());
        }
    }

    private TokenRecord load(String userId) {
        return tokenStore.find(userId)
                .orElseThrow(() -> new CoachException(ErrorKind.AUTH_EXPIRED,
                        "User " + userId + " has not linked a Whoop account"));
    }

    private AccessToken toAccessToken(TokenRecord record) {
        return new AccessToken(record.accessToken(), record.expiresAt());
    }

    private Duration margin() {
        return settings.service().tokenRefreshMargin();
    }

    private String redirectUri() {
        if (!settings.service().hasPublicUrl()) {
            throw new IllegalStateException("URL is not configured; cannot build the Whoop redirect URI");
        }
        return settings.service().baseUrl() + TokenVault.CALLBACK_PATH;
    }
}
