package com.bko.coachbot.vault.app;

import com.bko.coachbot.shared.Deadline;

import java.net.URI;

public interface OAuthTokenClient {
    TokenGrant refresh(String refreshToken, Deadline deadline);

    TokenGrant exchangeCode(String code, String redirectUri, Deadline deadline);

    URI authorizationUrl(String state, String redirectUri);
}
