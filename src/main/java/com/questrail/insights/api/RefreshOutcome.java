package com.questrail.insights.api;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * RefreshOutcome
 * -----------------------------------------------------------------------------
 * Result of one refresh cycle (full or site-scoped).
 *
 * <p>Only the top of the cycle decides the outcome. Failures contained at a
 * single key (one device's statistics, one resource kind's bulk fetch) are
 * reported to the observability sink and do not change a {@link Status#SUCCESS}
 * outcome.</p>
 */
public record RefreshOutcome(Status status, Instant completedAt, String detail, Throwable cause)
{
    public enum Status
    {
        /** Site listing succeeded; the snapshot reflects this cycle. */
        SUCCESS,
        /** Credentials were rejected. Re-authentication is required before retrying. */
        AUTHENTICATION_FAILURE,
        /** The API could not be reached. The previous snapshot is preserved. */
        CONNECTIVITY_FAILURE,
        /** Anything else. Retryable; logged with full detail. */
        UNEXPECTED_FAILURE,
        /** Nothing was attempted (e.g. a site-scoped refresh for an unknown site). */
        SKIPPED
    }

    public RefreshOutcome {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(completedAt, "completedAt");
        detail = detail == null ? "" : detail;
    }

    public static RefreshOutcome success(Instant at) {
        return new RefreshOutcome(Status.SUCCESS, at, "", null);
    }

    public static RefreshOutcome skipped(Instant at, String detail) {
        return new RefreshOutcome(Status.SKIPPED, at, detail, null);
    }

    public static RefreshOutcome failure(Status status, Instant at, String detail, Throwable cause) {
        if (status == Status.SUCCESS || status == Status.SKIPPED) {
            throw new IllegalArgumentException("not a failure status: " + status);
        }
        return new RefreshOutcome(status, at, detail, cause);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /** Whether a later cycle may succeed without operator action. */
    public boolean isRetryable() {
        return status == Status.CONNECTIVITY_FAILURE || status == Status.UNEXPECTED_FAILURE;
    }

    public Optional<Throwable> failureCause() {
        return Optional.ofNullable(cause);
    }
}
