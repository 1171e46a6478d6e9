package com.bko.coachbot.shared;

import com.google.api.core.ApiFuture;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.FirestoreException;
import io.grpc.Status;

import java.time.Instant;
import java.util.concurrent.ExecutionException;

/**
 * Blocking helpers for the Firestore adapters. Store failures are retryable from the caller's point of view.
 */
public final class FirestoreCalls {

    private FirestoreCalls() {
    }

    public static <T> T await(ApiFuture<T> future, String operation) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CoachException(ErrorKind.UPSTREAM_UNAVAILABLE, operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CoachException) {
                throw (CoachException) cause;
            }
            throw new CoachException(ErrorKind.UPSTREAM_UNAVAILABLE, operation + " failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Whether a failed {@code create()} hit an existing document, in either form the client reports it.
     */
    public static boolean isAlreadyExists(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ApiException
                    && ((ApiException) t).getStatusCode().getCode() == StatusCode.Code.ALREADY_EXISTS) {
                return true;
            }
            if (t instanceof FirestoreException && ((FirestoreException) t).getStatus() != null
                    && ((FirestoreException) t).getStatus().getCode() == Status.Code.ALREADY_EXISTS) {
                return true;
            }
        }
        return false;
    }

    public static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
    }

    public static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    }
}
