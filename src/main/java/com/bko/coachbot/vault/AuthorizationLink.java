package com.bko.coachbot.vault;

import java.net.URI;

public record AuthorizationLink(String state, URI url) {
}
