package com.bko.coachbot.shared;

import org.apache.hc.client5.http.fluent.Request;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Executes fluent HTTP requests with timeouts bounded by the request deadline and maps transport failures
 * to {@link ErrorKind#UPSTREAM_UNAVAILABLE}. Status codes are left to the caller to classify.
 */
public final class HttpCalls {

    private HttpCalls() {
    }

    public static HttpResult execute(String operation, Request request, Deadline deadline, Duration timeoutCap) {
        Duration timeout = deadline.bound(timeoutCap);
        Timeout bounded = Timeout.ofMilliseconds(Math.max(1, timeout.toMillis()));
        try {
            return request
                    .connectTimeout(bounded)
                    .responseTimeout(bounded)
                    .execute()
                    .handleResponse(response -> {
                        String body = response.getEntity() == null
                                ? ""
                                : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
                        Header retryAfter = response.getFirstHeader("Retry-After");
                        return new HttpResult(response.getCode(), body, retryAfter == null ? null : retryAfter.getValue());
                    });
        } catch (IOException e) {
            if (deadline.isExpired()) {
                throw new CoachException(ErrorKind.DEADLINE_EXCEEDED, operation + " ran out of request budget", e);
            }
            throw new CoachException(ErrorKind.UPSTREAM_UNAVAILABLE, operation + " failed: " + e.getMessage(), e);
        }
    }
}
