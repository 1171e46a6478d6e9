package com.bko.coachbot.trigger.web;

import com.bko.coachbot.content.MessageTemplates;
import com.bko.coachbot.dispatch.Dispatcher;
import com.bko.coachbot.shared.CoachException;
import com.bko.coachbot.shared.ErrorKind;
import com.bko.coachbot.shared.MutableClock;
import com.bko.coachbot.shared.TestSettings;
import com.bko.coachbot.vault.TokenVault;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class WhoopCallbackControllerTest {
    private final TokenVault tokenVault = mock(TokenVault.class);
    private final Dispatcher dispatcher = mock(Dispatcher.class);
    private final WhoopCallbackController controller = new WhoopCallbackController(tokenVault, dispatcher,
            TestSettings.configured(), new MutableClock(Instant.parse("2025-01-10T07:00:00Z")));

    @Test
    void linksAccountAndNotifiesUser() {
        when(tokenVault.completeAuthorization(eq("s-1"), eq("code-1"), any())).thenReturn("1001");

        ResponseEntity<?> response = controller.callback("code-1", "s-1");

        assertEquals(HttpStatus.OK, response.getStatusCode());
        verify(dispatcher).dispatch(eq("oauth:s-1"), eq("1001"), eq(MessageTemplates.LINKED), any());
    }

    @Test
    void missingParametersAreBadRequest() {
        ResponseEntity<?> response = controller.callback(null, "s-1");

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        verifyNoInteractions(tokenVault, dispatcher);
    }

    @Test
    void unknownStateIsBadRequest() {
        when(tokenVault.completeAuthorization(eq("stale"), eq("code-1"), any()))
                .thenThrow(new CoachException(ErrorKind.VALIDATION_FAILED, "Invalid or expired state"));

        ResponseEntity<?> response = controller.callback("code-1", "stale");

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void notificationFailureStillLinks() {
        when(tokenVault.completeAuthorization(eq("s-1"), eq("code-1"), any())).thenReturn("1001");
        when(dispatcher.dispatch(any(), any(), any(), any()))
                .thenThrow(new CoachException(ErrorKind.DELIVERY_REJECTED, "bot was blocked by the user"));

        assertEquals(HttpStatus.OK, controller.callback("code-1", "s-1").getStatusCode());
    }

    @Test
    void upstreamFailurePropagates() {
        when(tokenVault.completeAuthorization(any(), any(), any()))
                .thenThrow(new CoachException(ErrorKind.UPSTREAM_UNAVAILABLE, "Whoop HTTP 503"));

        assertThrows(CoachException.class, () -> controller.callback("code-1", "s-1"));
    }
}
