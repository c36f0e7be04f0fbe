package com.questrail.insights.observability;

import com.questrail.insights.model.ProtectModelKind;

import java.time.Instant;
import java.util.Objects;

/**
 * A fetch failed and was contained at the granularity named by {@link #scope()}.
 *
 * <p>Identifier fields that do not apply to the scope are {@code null}.</p>
 */
public record FetchFailureEvent(
    Instant timestamp,
    Scope scope,
    String siteId,
    String deviceId,
    ProtectModelKind resourceKind,
    String message,
    Throwable cause
) {
    public enum Scope {
        /** Devices or clients of one site; the site keeps its previous contents. */
        SITE,
        /** Supplementary device info; the device keeps its listing fields. */
        DEVICE_INFO,
        /** Device statistics; an empty statistics record was stored. */
        DEVICE_STATS,
        /** Bulk listing of one video/sensor kind. */
        PROTECT_BULK,
        /** Detail fetch following a bare-identifier listing. */
        PROTECT_DETAIL,
        /** Push connection start. */
        PUSH_CONNECTION
    }

    public FetchFailureEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(scope, "scope");
        message = message == null ? "" : message;
    }

    public static FetchFailureEvent site(Instant at, String siteId, Throwable cause) {
        return new FetchFailureEvent(at, Scope.SITE, siteId, null, null, describe(cause), cause);
    }

    public static FetchFailureEvent device(Instant at, Scope scope, String siteId, String deviceId, Throwable cause) {
        return new FetchFailureEvent(at, scope, siteId, deviceId, null, describe(cause), cause);
    }

    public static FetchFailureEvent protect(Instant at, Scope scope, ProtectModelKind kind, String message, Throwable cause) {
        return new FetchFailureEvent(at, scope, null, null, kind, message != null ? message : describe(cause), cause);
    }

    /**
     * Human-readable location of the failure, e.g. {@code site=a device=b}.
     */
    public String location() {
        StringBuilder sb = new StringBuilder();
        if (siteId != null) {
            sb.append("site=").append(siteId);
        }
        if (deviceId != null) {
            sb.append(sb.length() > 0 ? " " : "").append("device=").append(deviceId);
        }
        if (resourceKind != null) {
            sb.append(sb.length() > 0 ? " " : "").append("kind=").append(resourceKind.pluralKey());
        }
        return sb.toString();
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
