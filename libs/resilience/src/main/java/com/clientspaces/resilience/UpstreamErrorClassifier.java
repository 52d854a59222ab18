package com.clientspaces.resilience;

import java.io.UncheckedIOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Classification table for collaboration API failures.
 *
 * <ul>
 *   <li>408, 429, 500, 502, 503, 504 and 505-599 → {@link ErrorKind#TRANSIENT}
 *   <li>401 with an expired/invalid token sub-code → {@link ErrorKind#TRANSIENT}
 *   <li>connection reset, DNS failure, timeouts → {@link ErrorKind#TRANSIENT}
 *   <li>no status but a throttling/unavailability/token upstream code → {@link ErrorKind#TRANSIENT}
 *   <li>any other 4xx → {@link ErrorKind#PERMANENT}
 *   <li>everything else (501, 1xx-3xx, unrecognised exceptions) → {@link ErrorKind#UNKNOWN}
 * </ul>
 *
 * Sub-codes are compared case-insensitively with separators removed, so
 * {@code "InvalidAuthenticationToken"} and {@code "invalid_authentication_token"} are the same.
 */
public final class UpstreamErrorClassifier implements ErrorClassifier {

    private static final Set<String> TRANSIENT_UPSTREAM_CODES = Set.of(
            "servicenotavailable",
            "serviceunavailable",
            "timeout",
            "requesttimeout",
            "activitylimitreached",
            "throttledrequest",
            "generalexception",
            "tokenunavailable",
            "unauthenticated",
            "invalidauthenticationtoken",
            "authenticationcanceled");

    @Override
    public ErrorKind classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause == null) {
            return ErrorKind.UNKNOWN;
        }
        if (cause instanceof ExternalApiException api) {
            return classifyApiError(api);
        }
        if (isTransportFailure(cause)) {
            return ErrorKind.TRANSIENT;
        }
        return ErrorKind.UNKNOWN;
    }

    private ErrorKind classifyApiError(ExternalApiException api) {
        int status = api.statusCode();
        if (status == ExternalApiException.NO_STATUS) {
            return isTransientUpstreamCode(api.subCode()) ? ErrorKind.TRANSIENT : ErrorKind.UNKNOWN;
        }
        if (status == 401) {
            return isTokenRefreshable(api.subCode()) ? ErrorKind.TRANSIENT : ErrorKind.PERMANENT;
        }
        if (status == 408 || status == 429) {
            return ErrorKind.TRANSIENT;
        }
        if (status >= 500 && status <= 599) {
            // 501 Not Implemented will not change on retry, and is not a client error either
            return status == 501 ? ErrorKind.UNKNOWN : ErrorKind.TRANSIENT;
        }
        if (status >= 400 && status <= 499) {
            return ErrorKind.PERMANENT;
        }
        return ErrorKind.UNKNOWN;
    }

    private static boolean isTokenRefreshable(String subCode) {
        String code = normalize(subCode);
        return code.contains("token") && (code.contains("expired") || code.contains("invalid"));
    }

    private static boolean isTransientUpstreamCode(String subCode) {
        String code = normalize(subCode);
        return !code.isEmpty() && TRANSIENT_UPSTREAM_CODES.stream().anyMatch(code::contains);
    }

    private static boolean isTransportFailure(Throwable cause) {
        return cause instanceof SocketException
                || cause instanceof SocketTimeoutException
                || cause instanceof UnknownHostException
                || cause instanceof HttpTimeoutException
                || cause instanceof TimeoutException;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException
                        || current instanceof ExecutionException
                        || current instanceof UncheckedIOException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String normalize(String subCode) {
        if (subCode == null) {
            return "";
        }
        return subCode.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
